package org.javai.cellsim.datamodel.model;

import java.util.Objects;
import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * A request to track the population of a species over the run.
 * Use the factory methods; they keep the targets consistent with the scope.
 */
public record CountRequest(
		Species species,
		CountScope scope,
		@Nullable MeshObject object,
		@Nullable Region region
) {

	public CountRequest {
		Objects.requireNonNull(species, "species must not be null");
		Objects.requireNonNull(scope, "scope must not be null");
		switch (scope) {
			case WORLD -> {
				if (object != null || region != null) {
					throw new IllegalArgumentException("world counts take no target");
				}
			}
			case OBJECT -> {
				if (object == null || region != null) {
					throw new IllegalArgumentException("object counts need exactly an object target");
				}
			}
			case REGION -> {
				if (region == null) {
					throw new IllegalArgumentException("region counts need a region target");
				}
				if (object != region.owner()) {
					throw new IllegalArgumentException("region count object must own the region");
				}
			}
		}
	}

	public static CountRequest world(Species species) {
		return new CountRequest(species, CountScope.WORLD, null, null);
	}

	public static CountRequest object(Species species, MeshObject object) {
		return new CountRequest(species, CountScope.OBJECT, object, null);
	}

	public static CountRequest region(Species species, Region region) {
		return new CountRequest(species, CountScope.REGION, region.owner(), region);
	}

	public Optional<MeshObject> targetObject() {
		return Optional.ofNullable(object);
	}

	public Optional<Region> targetRegion() {
		return Optional.ofNullable(region);
	}
}

package org.javai.cellsim.datamodel.model;

import java.util.Objects;
import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * Molecules placed into a mesh object, or one of its regions, at simulation start.
 *
 * @param name release site name
 * @param object the target object
 * @param region the target region, or {@code null} to release into the whole object
 * @param species the released species
 * @param quantity number of molecules, positive
 * @param oriented whether the orientation of the released molecules is applied
 */
public record ReleaseSite(
		String name,
		MeshObject object,
		@Nullable Region region,
		Species species,
		int quantity,
		boolean oriented
) {

	public ReleaseSite {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(object, "object must not be null");
		Objects.requireNonNull(species, "species must not be null");
		if (region != null && region.owner() != object) {
			throw new IllegalArgumentException("region " + region.qualifiedName() + " is not part of " + object.name());
		}
		if (quantity <= 0) {
			throw new IllegalArgumentException("quantity must be positive: " + quantity);
		}
	}

	public Optional<Region> targetRegion() {
		return Optional.ofNullable(region);
	}
}

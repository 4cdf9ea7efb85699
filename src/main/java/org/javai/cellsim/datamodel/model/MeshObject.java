package org.javai.cellsim.datamodel.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A polygonal surface bounding a simulation compartment, with its named regions.
 * <p>
 * Instances are assembled through {@link #builder(String)} and are immutable afterwards. The
 * object owns its regions; each {@link Region} points back at this object without owning it.
 */
public final class MeshObject {

	private final String name;
	private final List<Vertex> vertices;
	private final List<Face> faces;
	private final List<Region> regions;

	private MeshObject(Builder builder) {
		this.name = builder.name;
		this.vertices = List.copyOf(builder.vertices);
		this.faces = List.copyOf(builder.faces);
		List<Region> built = new ArrayList<>(builder.regions.size());
		for (RegionSpec spec : builder.regions) {
			built.add(new Region(this, spec.name(), spec.faceIndices()));
		}
		this.regions = List.copyOf(built);
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String name() {
		return name;
	}

	public List<Vertex> vertices() {
		return vertices;
	}

	public List<Face> faces() {
		return faces;
	}

	/**
	 * Regions in declaration order. Names are recorded as given, so duplicates are possible.
	 */
	public List<Region> regions() {
		return regions;
	}

	/**
	 * Find a region by name. Every region is examined before giving up; when several regions share
	 * the name, the first one in declaration order is returned.
	 */
	public Optional<Region> findRegion(String regionName) {
		for (Region region : regions) {
			if (region.name().equals(regionName)) {
				return Optional.of(region);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return "MeshObject[" + name + ", vertices=" + vertices.size() + ", faces=" + faces.size()
				+ ", regions=" + regions.stream().map(Region::name).toList() + "]";
	}

	private record RegionSpec(String name, List<Integer> faceIndices) {
	}

	public static final class Builder {

		private final String name;
		private final List<Vertex> vertices = new ArrayList<>();
		private final List<Face> faces = new ArrayList<>();
		private final List<RegionSpec> regions = new ArrayList<>();

		private Builder(String name) {
			this.name = Objects.requireNonNull(name, "name must not be null");
		}

		public Builder vertex(double x, double y, double z) {
			vertices.add(new Vertex(x, y, z));
			return this;
		}

		public Builder face(Face face) {
			faces.add(Objects.requireNonNull(face, "face must not be null"));
			return this;
		}

		public Builder region(String regionName, List<Integer> faceIndices) {
			Objects.requireNonNull(regionName, "regionName must not be null");
			regions.add(new RegionSpec(regionName, faceIndices != null ? List.copyOf(faceIndices) : List.of()));
			return this;
		}

		public MeshObject build() {
			return new MeshObject(this);
		}
	}
}

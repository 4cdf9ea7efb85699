package org.javai.cellsim.datamodel.model;

import java.util.List;

/**
 * A named subset of a mesh object's faces.
 * <p>
 * Region names are unique only within their owner, so regions compare by identity. The owner
 * reference is a back-pointer; regions are created by and live exactly as long as their
 * {@link MeshObject}.
 */
public final class Region {

	private final MeshObject owner;
	private final String name;
	private final List<Integer> faceIndices;

	Region(MeshObject owner, String name, List<Integer> faceIndices) {
		this.owner = owner;
		this.name = name;
		this.faceIndices = faceIndices;
	}

	public MeshObject owner() {
		return owner;
	}

	public String name() {
		return name;
	}

	public List<Integer> faceIndices() {
		return faceIndices;
	}

	/**
	 * The {@code Object[Region]} form used by release-site object expressions.
	 */
	public String qualifiedName() {
		return owner.name() + "[" + name + "]";
	}

	@Override
	public String toString() {
		return "Region[" + qualifiedName() + ", faces=" + faceIndices.size() + "]";
	}
}

package org.javai.cellsim.datamodel;

/**
 * The independent namespaces a data model refers into by name.
 */
public enum ReferenceKind {
	SPECIES("species"),
	MESH_OBJECT("mesh object"),
	REGION("region"),
	SURFACE_CLASS("surface class");

	private final String label;

	ReferenceKind(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}

package org.javai.cellsim.datamodel;

/**
 * Thrown when a species, mesh object, region or surface class name does not resolve in its
 * namespace at the point of lookup.
 */
public class UnresolvedReferenceException extends DataModelException {

	private final ReferenceKind kind;
	private final String name;

	public UnresolvedReferenceException(String path, ReferenceKind kind, String name) {
		super(path, "unknown " + kind.label() + " '" + name + "'");
		this.kind = kind;
		this.name = name;
	}

	public UnresolvedReferenceException(String path, ReferenceKind kind, String name, String scope) {
		super(path, "unknown " + kind.label() + " '" + name + "' in " + scope);
		this.kind = kind;
		this.name = name;
	}

	public ReferenceKind kind() {
		return kind;
	}

	public String name() {
		return name;
	}
}

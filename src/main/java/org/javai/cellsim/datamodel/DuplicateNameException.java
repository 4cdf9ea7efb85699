package org.javai.cellsim.datamodel;

/**
 * Thrown when a second definition reuses a name already registered in the same namespace.
 */
public class DuplicateNameException extends DataModelException {

	private final ReferenceKind kind;
	private final String name;

	public DuplicateNameException(String path, ReferenceKind kind, String name) {
		super(path, "duplicate " + kind.label() + " definition '" + name + "'");
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

package org.javai.cellsim.datamodel;

/**
 * Thrown when a field is missing, has the wrong shape, or a scalar fails to convert to its
 * expected numeric type.
 */
public class MalformedFieldException extends DataModelException {

	private final String field;

	public MalformedFieldException(String path, String field, String message) {
		super(path, "field '" + field + "' " + message);
		this.field = field;
	}

	public MalformedFieldException(String path, String field, String message, Throwable cause) {
		super(path, "field '" + field + "' " + message, cause);
		this.field = field;
	}

	public String field() {
		return field;
	}
}

package org.javai.cellsim.datamodel;

/**
 * Thrown when the data model document itself cannot be read or decoded.
 */
public class DocumentReadException extends DataModelException {

	public DocumentReadException(String message) {
		super("", message);
	}

	public DocumentReadException(String message, Throwable cause) {
		super("", message, cause);
	}
}

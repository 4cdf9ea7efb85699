package org.javai.cellsim.datamodel;

/**
 * Thrown when an embedded token, such as an orientation-annotated molecule or a bracketed object
 * expression, is malformed.
 */
public class DataModelParseException extends DataModelException {

	private final String text;

	public DataModelParseException(String path, String text, String message) {
		super(path, message + ": '" + text + "'");
		this.text = text;
	}

	public String text() {
		return text;
	}
}

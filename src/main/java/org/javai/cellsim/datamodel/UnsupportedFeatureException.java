package org.javai.cellsim.datamodel;

/**
 * Thrown when the document uses an option the binder recognizes but does not implement, such as
 * a collective molecule selector in a surface class property.
 */
public class UnsupportedFeatureException extends DataModelException {

	private final String feature;

	public UnsupportedFeatureException(String path, String feature, String message) {
		super(path, message);
		this.feature = feature;
	}

	public String feature() {
		return feature;
	}
}

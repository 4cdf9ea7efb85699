package org.javai.cellsim.datamodel;

import java.util.Locale;

/**
 * Serialization formats a data model document can arrive in.
 */
public enum DocumentFormat {
	JSON,
	YAML;

	/**
	 * Infer the format from a file name extension.
	 *
	 * @throws DocumentReadException if the extension is not recognized
	 */
	public static DocumentFormat fromFileName(String fileName) {
		String lower = fileName.toLowerCase(Locale.ROOT);
		if (lower.endsWith(".json")) {
			return JSON;
		}
		if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
			return YAML;
		}
		throw new DocumentReadException("Cannot infer document format from file name: " + fileName);
	}
}

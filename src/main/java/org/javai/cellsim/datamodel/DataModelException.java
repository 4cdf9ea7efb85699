package org.javai.cellsim.datamodel;

import org.springframework.lang.Nullable;

/**
 * Base class for every failure raised while binding a data model.
 * <p>
 * Each instance records the document path at which the fault was detected, for example
 * {@code mcell.release_sites.release_site_list[2]}, so the caller can localize it without
 * dumping the source document. The first error aborts the whole import.
 */
public class DataModelException extends RuntimeException {

	private final String path;

	public DataModelException(String path, String message) {
		super(format(path, message));
		this.path = path;
	}

	public DataModelException(String path, String message, Throwable cause) {
		super(format(path, message), cause);
		this.path = path;
	}

	/**
	 * The document path the error was raised at; empty when the error concerns the whole document.
	 */
	public String path() {
		return path;
	}

	private static String format(@Nullable String path, String message) {
		return path == null || path.isEmpty() ? message : path + ": " + message;
	}
}

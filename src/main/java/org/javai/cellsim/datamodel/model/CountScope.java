package org.javai.cellsim.datamodel.model;

import java.util.Optional;

/**
 * Where a count request tallies molecules.
 */
public enum CountScope {
	WORLD("World"),
	OBJECT("Object"),
	REGION("Region");

	private final String tag;

	CountScope(String tag) {
		this.tag = tag;
	}

	/**
	 * The {@code count_location} value in the data model.
	 */
	public String tag() {
		return tag;
	}

	public static Optional<CountScope> fromTag(String tag) {
		for (CountScope scope : values()) {
			if (scope.tag.equals(tag)) {
				return Optional.of(scope);
			}
		}
		return Optional.empty();
	}
}

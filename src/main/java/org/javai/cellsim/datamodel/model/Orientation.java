package org.javai.cellsim.datamodel.model;

import java.util.Optional;

/**
 * Which side of a surface a molecule reference faces.
 * {@link #MIX} is the default and means either side.
 */
public enum Orientation {
	UP('\''),
	DOWN(','),
	MIX(';');

	private final char symbol;

	Orientation(char symbol) {
		this.symbol = symbol;
	}

	/**
	 * The suffix character that denotes this orientation in a molecule token.
	 */
	public char symbol() {
		return symbol;
	}

	/**
	 * Map a suffix character to its orientation, or empty when the character is not a suffix.
	 */
	public static Optional<Orientation> fromSuffix(char c) {
		for (Orientation orientation : values()) {
			if (orientation.symbol == c) {
				return Optional.of(orientation);
			}
		}
		return Optional.empty();
	}
}

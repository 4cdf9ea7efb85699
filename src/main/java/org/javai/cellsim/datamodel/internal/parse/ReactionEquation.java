package org.javai.cellsim.datamodel.internal.parse;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits one side of a reaction, written as molecule tokens joined by {@code " + "}.
 */
public final class ReactionEquation {

	public static final String SEPARATOR = " + ";

	private static final Pattern SEPARATOR_PATTERN = Pattern.compile(Pattern.quote(SEPARATOR));

	private ReactionEquation() {
	}

	/**
	 * Split a side into its tokens. Empty tokens, e.g. from a trailing separator, are kept so the
	 * token parser can report them.
	 */
	public static List<String> tokens(String side) {
		return List.of(SEPARATOR_PATTERN.split(side, -1));
	}
}

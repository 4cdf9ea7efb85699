package org.javai.cellsim.datamodel;

/**
 * What to do with a reaction's {@code bkwd_rate} field. Reactions are always built as irreversible;
 * no reverse rule is ever synthesized.
 */
public enum BackwardRatePolicy {
	/**
	 * Build the forward reaction and log a warning that the backward rate was dropped.
	 */
	IGNORE_WITH_WARNING,
	/**
	 * Fail the import with an {@link UnsupportedFeatureException}.
	 */
	REJECT
}

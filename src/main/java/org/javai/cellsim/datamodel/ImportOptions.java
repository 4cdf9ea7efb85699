package org.javai.cellsim.datamodel;

import java.util.Objects;

/**
 * Options for a data model import.
 *
 * @param layout where the sections live in the document
 * @param backwardRatePolicy how reactions carrying a backward rate are treated
 */
public record ImportOptions(
		DataModelLayout layout,
		BackwardRatePolicy backwardRatePolicy
) {
	public ImportOptions {
		Objects.requireNonNull(layout, "layout must not be null");
		Objects.requireNonNull(backwardRatePolicy, "backwardRatePolicy must not be null");
	}

	public static ImportOptions defaults() {
		return new ImportOptions(DataModelLayout.CELLBLENDER, BackwardRatePolicy.IGNORE_WITH_WARNING);
	}

	public static ImportOptions flat() {
		return defaults().withLayout(DataModelLayout.FLAT);
	}

	public ImportOptions withLayout(DataModelLayout layout) {
		return new ImportOptions(layout, backwardRatePolicy);
	}

	public ImportOptions withBackwardRatePolicy(BackwardRatePolicy policy) {
		return new ImportOptions(layout, policy);
	}
}

package org.javai.cellsim.datamodel.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * The species exported for visualization, in document order and without duplicates.
 */
public record VizSelection(List<Species> species) {

	public VizSelection {
		species = species != null ? List.copyOf(new LinkedHashSet<>(species)) : List.of();
	}

	public static VizSelection none() {
		return new VizSelection(List.of());
	}

	public boolean isEmpty() {
		return species.isEmpty();
	}

	public boolean contains(Species candidate) {
		return species.contains(candidate);
	}
}

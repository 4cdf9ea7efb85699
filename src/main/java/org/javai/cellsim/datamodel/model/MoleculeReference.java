package org.javai.cellsim.datamodel.model;

import java.util.Objects;

/**
 * A species mentioned in a reaction or release, together with its orientation.
 */
public record MoleculeReference(Species species, Orientation orientation) {

	public MoleculeReference {
		Objects.requireNonNull(species, "species must not be null");
		orientation = orientation != null ? orientation : Orientation.MIX;
	}

	@Override
	public String toString() {
		return orientation == Orientation.MIX
				? species.name()
				: species.name() + orientation.symbol();
	}
}

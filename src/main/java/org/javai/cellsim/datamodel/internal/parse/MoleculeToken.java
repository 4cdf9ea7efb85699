package org.javai.cellsim.datamodel.internal.parse;

import org.javai.cellsim.datamodel.model.Orientation;

/**
 * A molecule mention split into its species name and orientation, before the name is resolved.
 */
public record MoleculeToken(String speciesName, Orientation orientation) {
}

package org.javai.cellsim.datamodel.model;

import java.util.Objects;

/**
 * A molecular species.
 *
 * @param name unique species name
 * @param diffusionConstant diffusion constant, finite and non-negative
 * @param surface {@code true} for membrane-bound (2D) species, {@code false} for volume (3D) species
 */
public record Species(String name, double diffusionConstant, boolean surface) {

	public Species {
		Objects.requireNonNull(name, "name must not be null");
		if (!Double.isFinite(diffusionConstant) || diffusionConstant < 0) {
			throw new IllegalArgumentException("diffusionConstant must be finite and non-negative: " + diffusionConstant);
		}
	}
}

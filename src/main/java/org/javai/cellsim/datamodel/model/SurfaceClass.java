package org.javai.cellsim.datamodel.model;

import java.util.Objects;

/**
 * A named surface behavior bound to one species.
 *
 * @param name unique surface class name
 * @param type lower-cased behavior tag such as {@code reflective}, {@code absorptive} or {@code transparent}
 * @param species the species the behavior applies to
 */
public record SurfaceClass(String name, String type, Species species) {

	public SurfaceClass {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(species, "species must not be null");
	}
}

package org.javai.cellsim.datamodel.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.lang.Nullable;

/**
 * An irreversible reaction rule.
 *
 * @param name optional reaction name from the document
 * @param reactants ordered reactants, never empty
 * @param products ordered products, never empty
 * @param forwardRate forward rate constant, finite and non-negative
 */
public record Reaction(
		@Nullable String name,
		List<MoleculeReference> reactants,
		List<MoleculeReference> products,
		double forwardRate
) {

	public Reaction {
		Objects.requireNonNull(reactants, "reactants must not be null");
		Objects.requireNonNull(products, "products must not be null");
		if (reactants.isEmpty() || products.isEmpty()) {
			throw new IllegalArgumentException("reactions need at least one reactant and one product");
		}
		if (!Double.isFinite(forwardRate) || forwardRate < 0) {
			throw new IllegalArgumentException("forwardRate must be finite and non-negative: " + forwardRate);
		}
		reactants = List.copyOf(reactants);
		products = List.copyOf(products);
	}

	/**
	 * Render the rule the way the data model writes it, e.g. {@code A' + B, -> C}.
	 */
	public String equation() {
		return join(reactants) + " -> " + join(products);
	}

	private static String join(List<MoleculeReference> refs) {
		return refs.stream().map(MoleculeReference::toString).collect(Collectors.joining(" + "));
	}
}

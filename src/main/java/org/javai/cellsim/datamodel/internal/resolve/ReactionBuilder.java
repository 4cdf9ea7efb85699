package org.javai.cellsim.datamodel.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import org.javai.cellsim.datamodel.BackwardRatePolicy;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.UnsupportedFeatureException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.internal.parse.MoleculeTokenParser;
import org.javai.cellsim.datamodel.internal.parse.ReactionEquation;
import org.javai.cellsim.datamodel.model.MoleculeReference;
import org.javai.cellsim.datamodel.model.Reaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds reaction rules from their reactant and product strings.
 * <p>
 * Only forward rates are modelled. A {@code bkwd_rate} is never turned into a reverse rule; the
 * {@link BackwardRatePolicy} decides whether it is dropped with a warning or rejected.
 */
public class ReactionBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ReactionBuilder.class);

	public List<Reaction> build(DataModelNode document, BuildContext context) {
		MoleculeTokenParser tokenParser = new MoleculeTokenParser(context.species());
		List<Reaction> reactions = new ArrayList<>();
		for (DataModelNode entry : document.listAt(context.layout().reactions())) {
			String name = entry.optionalString("rxn_name").filter(s -> !s.isBlank()).orElse(null);
			double forwardRate = entry.requireDouble("fwd_rate");
			if (forwardRate < 0) {
				throw new MalformedFieldException(entry.path(), "fwd_rate", "must not be negative: " + forwardRate);
			}
			checkBackwardRate(entry, context.options().backwardRatePolicy());

			List<MoleculeReference> reactants = side(entry, "reactants", tokenParser);
			List<MoleculeReference> products = side(entry, "products", tokenParser);

			Reaction reaction = new Reaction(name, reactants, products, forwardRate);
			reactions.add(reaction);
			context.plan().add(new ConstructionCommand.ConstructReaction(reaction));
			logger.debug("Reaction {} at rate {}", reaction.equation(), forwardRate);
		}
		return reactions;
	}

	private List<MoleculeReference> side(DataModelNode entry, String field, MoleculeTokenParser tokenParser) {
		String text = entry.requireString(field);
		if (text.isBlank()) {
			throw new MalformedFieldException(entry.path(), field, "must name at least one molecule");
		}
		String path = entry.pathOf(field);
		List<MoleculeReference> refs = new ArrayList<>();
		for (String token : ReactionEquation.tokens(text)) {
			refs.add(tokenParser.parse(token, path));
		}
		return refs;
	}

	private void checkBackwardRate(DataModelNode entry, BackwardRatePolicy policy) {
		String backward = entry.optionalString("bkwd_rate").map(String::trim).orElse("");
		if (backward.isEmpty()) {
			return;
		}
		if (policy == BackwardRatePolicy.REJECT) {
			throw new UnsupportedFeatureException(entry.path(), "bkwd_rate",
					"reversible reactions are not supported (bkwd_rate " + backward + ")");
		}
		logger.warn("{}: ignoring bkwd_rate {}; reactions are built as irreversible", entry.path(), backward);
	}
}

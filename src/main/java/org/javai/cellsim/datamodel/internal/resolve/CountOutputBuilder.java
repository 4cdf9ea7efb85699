package org.javai.cellsim.datamodel.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.UnsupportedFeatureException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.CountRequest;
import org.javai.cellsim.datamodel.model.CountScope;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds molecule count requests at world, object or region scope.
 */
public class CountOutputBuilder {

	private static final Logger logger = LoggerFactory.getLogger(CountOutputBuilder.class);

	static final String REACTION_COUNT = "Reaction";

	public List<CountRequest> build(DataModelNode document, BuildContext context) {
		List<CountRequest> requests = new ArrayList<>();
		for (DataModelNode entry : document.listAt(context.layout().reactionOutput())) {
			String countedKind = entry.optionalString("rxn_or_mol").orElse("Molecule");
			if (REACTION_COUNT.equals(countedKind)) {
				throw new UnsupportedFeatureException(entry.path(), "rxn_or_mol",
						"reaction counts are not supported; only molecule counts can be requested");
			}

			Species species = context.species().require(entry.requireString("molecule_name"), entry.pathOf("molecule_name"));
			String location = entry.requireString("count_location");
			CountScope scope = CountScope.fromTag(location)
					.orElseThrow(() -> new MalformedFieldException(entry.path(), "count_location",
							"must be World, Object or Region but was '" + location + "'"));

			CountRequest request = switch (scope) {
				case WORLD -> CountRequest.world(species);
				case OBJECT -> CountRequest.object(species, requireObject(entry, context));
				case REGION -> CountRequest.region(species, context.requireRegion(
						requireObject(entry, context), entry.requireString("region_name"), entry.pathOf("region_name")));
			};
			requests.add(request);
			context.plan().add(new ConstructionCommand.AddCount(request));
			logger.debug("Count of '{}' at {} scope", species.name(), scope.tag());
		}
		return requests;
	}

	private MeshObject requireObject(DataModelNode entry, BuildContext context) {
		return context.meshObjects().require(entry.requireString("object_name"), entry.pathOf("object_name"));
	}
}

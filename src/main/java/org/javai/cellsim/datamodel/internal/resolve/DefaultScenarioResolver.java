package org.javai.cellsim.datamodel.internal.resolve;

import java.util.List;
import java.util.Optional;
import org.javai.cellsim.datamodel.ImportOptions;
import org.javai.cellsim.datamodel.ImportedScenario;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.CountRequest;
import org.javai.cellsim.datamodel.model.Initialization;
import org.javai.cellsim.datamodel.model.Reaction;
import org.javai.cellsim.datamodel.model.ReleaseSite;
import org.javai.cellsim.datamodel.model.SurfaceRegionAssignment;
import org.javai.cellsim.datamodel.model.VizSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default resolver that runs the builders in dependency order.
 * <p>
 * The order is fixed: species, reactions, geometry, surface classes, surface region assignments,
 * release sites, counts, visualization, initialization. Each builder only reads registries filled
 * by the builders before it, so the first unresolved reference reported is deterministic.
 */
public class DefaultScenarioResolver implements ScenarioResolver {

	private static final Logger logger = LoggerFactory.getLogger(DefaultScenarioResolver.class);

	private final SpeciesRegistryBuilder speciesBuilder = new SpeciesRegistryBuilder();
	private final ReactionBuilder reactionBuilder = new ReactionBuilder();
	private final GeometryBuilder geometryBuilder = new GeometryBuilder();
	private final SurfaceClassBuilder surfaceClassBuilder = new SurfaceClassBuilder();
	private final SurfaceRegionModifier surfaceRegionModifier = new SurfaceRegionModifier();
	private final ReleaseSiteBuilder releaseSiteBuilder = new ReleaseSiteBuilder();
	private final CountOutputBuilder countOutputBuilder = new CountOutputBuilder();
	private final VisualizationSelector visualizationSelector = new VisualizationSelector();
	private final InitializationBuilder initializationBuilder = new InitializationBuilder();

	@Override
	public ImportedScenario resolve(DataModelNode document, ImportOptions options) {
		BuildContext context = new BuildContext(options);

		speciesBuilder.build(document, context);
		List<Reaction> reactions = reactionBuilder.build(document, context);
		geometryBuilder.build(document, context);
		surfaceClassBuilder.build(document, context);
		List<SurfaceRegionAssignment> assignments = surfaceRegionModifier.build(document, context);
		List<ReleaseSite> releaseSites = releaseSiteBuilder.build(document, context);
		List<CountRequest> counts = countOutputBuilder.build(document, context);
		VizSelection visualization = visualizationSelector.build(document, context);
		Optional<Initialization> initialization = initializationBuilder.build(document, context);

		logger.info("Resolved data model: {} species, {} reactions, {} objects, {} surface classes, "
						+ "{} surface assignments, {} release sites, {} counts",
				context.species().size(), reactions.size(), context.meshObjects().size(),
				context.surfaceClasses().size(), assignments.size(), releaseSites.size(), counts.size());

		return new ImportedScenario(
				context.species().asMap(),
				reactions,
				context.meshObjects().asMap(),
				context.surfaceClasses().asMap(),
				assignments,
				releaseSites,
				counts,
				visualization,
				initialization,
				context.plan());
	}
}

package org.javai.cellsim.datamodel.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.model.VizSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the species exported for visualization: those flagged with {@code export_viz}, or every
 * species when {@code viz_output.export_all} is set. Exactly one visualization request is issued.
 */
public class VisualizationSelector {

	private static final Logger logger = LoggerFactory.getLogger(VisualizationSelector.class);

	public VizSelection build(DataModelNode document, BuildContext context) {
		boolean exportAll = document.descend(context.layout().vizOutput())
				.map(viz -> viz.optionalBoolean("export_all", false))
				.orElse(false);

		List<Species> selected = new ArrayList<>();
		for (DataModelNode entry : document.listAt(context.layout().species())) {
			if (exportAll || entry.optionalBoolean("export_viz", false)) {
				selected.add(context.species().require(entry.requireString("mol_name"), entry.pathOf("mol_name")));
			}
		}

		VizSelection selection = new VizSelection(selected);
		context.plan().add(new ConstructionCommand.AddVisualization(selection));
		logger.debug("Visualizing {} species (export_all={})", selection.species().size(), exportAll);
		return selection;
	}
}

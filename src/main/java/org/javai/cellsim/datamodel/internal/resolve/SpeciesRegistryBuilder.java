package org.javai.cellsim.datamodel.internal.resolve;

import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.bind.NameRegistry;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the species namespace from the molecule list.
 */
public class SpeciesRegistryBuilder {

	private static final Logger logger = LoggerFactory.getLogger(SpeciesRegistryBuilder.class);

	static final String SURFACE_TYPE = "2D";

	public NameRegistry<Species> build(DataModelNode document, BuildContext context) {
		NameRegistry<Species> registry = context.species();
		for (DataModelNode entry : document.listAt(context.layout().species())) {
			String name = entry.requireString("mol_name");
			double diffusionConstant = entry.requireDouble("diffusion_constant");
			if (diffusionConstant < 0) {
				throw new MalformedFieldException(entry.path(), "diffusion_constant",
						"must not be negative: " + diffusionConstant);
			}
			boolean surface = SURFACE_TYPE.equals(entry.optionalString("mol_type").orElse(""));

			Species species = new Species(name, diffusionConstant, surface);
			registry.register(name, species, entry.path());
			context.plan().add(new ConstructionCommand.ConstructSpecies(species));
			logger.debug("Species '{}' (D={}, {})", name, diffusionConstant, surface ? "surface" : "volume");
		}
		return registry;
	}
}

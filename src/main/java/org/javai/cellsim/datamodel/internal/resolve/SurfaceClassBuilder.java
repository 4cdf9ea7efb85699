package org.javai.cellsim.datamodel.internal.resolve;

import java.util.Locale;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.UnsupportedFeatureException;
import org.javai.cellsim.datamodel.internal.bind.NameRegistry;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.MoleculeSelector;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.model.SurfaceClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds surface classes from their property lists.
 * <p>
 * Only properties bound to a single molecule are supported. The collective selectors are
 * recognized and rejected with {@link UnsupportedFeatureException}. When a class lists several
 * properties, the last one defines the class.
 */
public class SurfaceClassBuilder {

	private static final Logger logger = LoggerFactory.getLogger(SurfaceClassBuilder.class);

	public NameRegistry<SurfaceClass> build(DataModelNode document, BuildContext context) {
		NameRegistry<SurfaceClass> registry = context.surfaceClasses();
		String propertiesKey = context.layout().surfaceClassPropertiesKey();
		for (DataModelNode entry : document.listAt(context.layout().surfaceClasses())) {
			String name = entry.requireString("name");
			SurfaceClass surfaceClass = null;
			for (DataModelNode property : entry.children(propertiesKey)) {
				Species species = resolveSpecies(property, context.species());
				String type = property.requireString("surf_class_type").toLowerCase(Locale.ROOT);
				if (surfaceClass != null) {
					logger.debug("Surface class '{}': property at {} replaces the previous one", name, property.path());
				}
				surfaceClass = new SurfaceClass(name, type, species);
			}
			if (surfaceClass == null) {
				logger.debug("Surface class '{}' has no properties; not registered", name);
				continue;
			}
			registry.register(name, surfaceClass, entry.path());
			logger.debug("Surface class '{}' ({}) for species '{}'", name, surfaceClass.type(), surfaceClass.species().name());
		}
		return registry;
	}

	private Species resolveSpecies(DataModelNode property, NameRegistry<Species> species) {
		MoleculeSelector selector = selector(property);
		if (!(selector instanceof MoleculeSelector.SingleMolecule single)) {
			throw new UnsupportedFeatureException(property.path(), selector.tag(),
					"affected_mols " + selector.tag() + " is not supported; only "
							+ MoleculeSelector.SingleMolecule.TAG + " properties can be bound");
		}
		return species.require(single.moleculeName(), property.pathOf("molecule"));
	}

	static MoleculeSelector selector(DataModelNode property) {
		String tag = property.requireString("affected_mols");
		if (MoleculeSelector.SingleMolecule.TAG.equals(tag)) {
			return new MoleculeSelector.SingleMolecule(property.requireString("molecule"));
		}
		return MoleculeSelector.collective(tag)
				.orElseThrow(() -> new MalformedFieldException(property.path(), "affected_mols",
						"has unknown selector '" + tag + "'"));
	}
}

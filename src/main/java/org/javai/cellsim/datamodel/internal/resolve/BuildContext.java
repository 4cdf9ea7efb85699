package org.javai.cellsim.datamodel.internal.resolve;

import org.javai.cellsim.datamodel.DataModelLayout;
import org.javai.cellsim.datamodel.ImportOptions;
import org.javai.cellsim.datamodel.ReferenceKind;
import org.javai.cellsim.datamodel.UnresolvedReferenceException;
import org.javai.cellsim.datamodel.engine.ConstructionPlan;
import org.javai.cellsim.datamodel.internal.bind.NameRegistry;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Region;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.model.SurfaceClass;

/**
 * State shared by the builders of one import run: the options, the registries populated so far,
 * and the construction plan being recorded.
 * <p>
 * A context lives exactly as long as one import; nothing in it is global.
 */
public final class BuildContext {

	private final ImportOptions options;
	private final NameRegistry<Species> species = new NameRegistry<>(ReferenceKind.SPECIES);
	private final NameRegistry<MeshObject> meshObjects = new NameRegistry<>(ReferenceKind.MESH_OBJECT);
	private final NameRegistry<SurfaceClass> surfaceClasses = new NameRegistry<>(ReferenceKind.SURFACE_CLASS);
	private final ConstructionPlan plan = new ConstructionPlan();

	public BuildContext(ImportOptions options) {
		this.options = options;
	}

	public ImportOptions options() {
		return options;
	}

	public DataModelLayout layout() {
		return options.layout();
	}

	public NameRegistry<Species> species() {
		return species;
	}

	public NameRegistry<MeshObject> meshObjects() {
		return meshObjects;
	}

	public NameRegistry<SurfaceClass> surfaceClasses() {
		return surfaceClasses;
	}

	public ConstructionPlan plan() {
		return plan;
	}

	/**
	 * Resolve a region of an object by name, examining every region before failing.
	 *
	 * @throws UnresolvedReferenceException if no region of the object has the name
	 */
	public Region requireRegion(MeshObject object, String regionName, String path) {
		return object.findRegion(regionName)
				.orElseThrow(() -> new UnresolvedReferenceException(
						path, ReferenceKind.REGION, regionName, "object '" + object.name() + "'"));
	}
}

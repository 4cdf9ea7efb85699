package org.javai.cellsim.datamodel.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Region;
import org.javai.cellsim.datamodel.model.SurfaceClass;
import org.javai.cellsim.datamodel.model.SurfaceRegionAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns surface classes to regions of mesh objects.
 */
public class SurfaceRegionModifier {

	private static final Logger logger = LoggerFactory.getLogger(SurfaceRegionModifier.class);

	public List<SurfaceRegionAssignment> build(DataModelNode document, BuildContext context) {
		List<SurfaceRegionAssignment> assignments = new ArrayList<>();
		for (DataModelNode entry : document.listAt(context.layout().modifySurfaceRegions())) {
			MeshObject object = context.meshObjects()
					.require(entry.requireString("object_name"), entry.pathOf("object_name"));
			SurfaceClass surfaceClass = context.surfaceClasses()
					.require(entry.requireString("surf_class_name"), entry.pathOf("surf_class_name"));
			Region region = context.requireRegion(object, entry.requireString("region_name"), entry.pathOf("region_name"));

			SurfaceRegionAssignment assignment = new SurfaceRegionAssignment(object, region, surfaceClass);
			assignments.add(assignment);
			context.plan().add(new ConstructionCommand.AssignSurfaceClass(assignment));
			logger.debug("Surface class '{}' assigned to {}", surfaceClass.name(), region.qualifiedName());
		}
		return assignments;
	}
}

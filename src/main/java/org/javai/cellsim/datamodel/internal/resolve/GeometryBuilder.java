package org.javai.cellsim.datamodel.internal.resolve;

import java.util.List;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.bind.NameRegistry;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.Face;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds mesh objects and their regions.
 * <p>
 * Face indices are not checked against the vertex list, and duplicate region names within one
 * object are kept as given; region lookups then resolve to the first of them.
 */
public class GeometryBuilder {

	private static final Logger logger = LoggerFactory.getLogger(GeometryBuilder.class);

	public NameRegistry<MeshObject> build(DataModelNode document, BuildContext context) {
		NameRegistry<MeshObject> registry = context.meshObjects();
		String regionsKey = context.layout().regionsKey();
		for (DataModelNode entry : document.listAt(context.layout().objects())) {
			String name = entry.requireString("name");
			MeshObject.Builder builder = MeshObject.builder(name);

			List<List<Double>> vertices = entry.requireDoubleTuples("vertex_list");
			for (int i = 0; i < vertices.size(); i++) {
				List<Double> v = vertices.get(i);
				if (v.size() != 3) {
					throw new MalformedFieldException(entry.path(), "vertex_list[" + i + "]",
							"must have 3 coordinates but had " + v.size());
				}
				builder.vertex(v.get(0), v.get(1), v.get(2));
			}
			for (List<Integer> connection : entry.requireIntTuples("element_connections")) {
				builder.face(new Face(connection));
			}
			for (DataModelNode regionEntry : entry.children(regionsKey)) {
				builder.region(regionEntry.requireString("name"), regionEntry.requireIntList("include_elements"));
			}

			MeshObject object = builder.build();
			registry.register(name, object, entry.path());
			context.plan().add(new ConstructionCommand.ConstructMeshObject(object));
			for (Region region : object.regions()) {
				context.plan().add(new ConstructionCommand.ConstructRegion(region));
			}
			logger.debug("Mesh object {}", object);
		}
		return registry;
	}
}

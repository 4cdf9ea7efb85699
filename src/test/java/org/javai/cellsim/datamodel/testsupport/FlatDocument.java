package org.javai.cellsim.datamodel.testsupport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;

/**
 * Fluent builder for documents in the flat layout, with string-encoded scalars as the data model
 * writes them.
 */
public final class FlatDocument {

	private final List<Map<String, Object>> species = new ArrayList<>();
	private final List<Map<String, Object>> reactions = new ArrayList<>();
	private final List<Map<String, Object>> objects = new ArrayList<>();
	private final List<Map<String, Object>> surfaceClasses = new ArrayList<>();
	private final List<Map<String, Object>> modifications = new ArrayList<>();
	private final List<Map<String, Object>> releaseSites = new ArrayList<>();
	private final List<Map<String, Object>> counts = new ArrayList<>();
	private Map<String, Object> vizOutput;
	private Map<String, Object> initialization;

	public static FlatDocument create() {
		return new FlatDocument();
	}

	public FlatDocument species(String name, String diffusionConstant, String type) {
		return species(name, diffusionConstant, type, false);
	}

	public FlatDocument species(String name, String diffusionConstant, String type, boolean exportViz) {
		species.add(entry("mol_name", name, "diffusion_constant", diffusionConstant, "mol_type", type,
				"export_viz", exportViz));
		return this;
	}

	public FlatDocument reaction(String reactants, String products, String fwdRate) {
		reactions.add(entry("reactants", reactants, "products", products, "fwd_rate", fwdRate));
		return this;
	}

	public FlatDocument reaction(Map<String, Object> raw) {
		reactions.add(raw);
		return this;
	}

	/**
	 * A unit cube of 8 vertices and 12 triangular faces with the given regions.
	 */
	@SafeVarargs
	public final FlatDocument cube(String name, Map<String, Object>... regions) {
		objects.add(entry(
				"name", name,
				"vertex_list", List.of(
						List.of(0, 0, 0), List.of(1, 0, 0), List.of(1, 1, 0), List.of(0, 1, 0),
						List.of(0, 0, 1), List.of(1, 0, 1), List.of(1, 1, 1), List.of(0, 1, 1)),
				"element_connections", List.of(
						List.of(0, 1, 2), List.of(0, 2, 3), List.of(4, 5, 6), List.of(4, 6, 7),
						List.of(0, 1, 5), List.of(0, 5, 4), List.of(2, 3, 7), List.of(2, 7, 6),
						List.of(1, 2, 6), List.of(1, 6, 5), List.of(0, 3, 7), List.of(0, 7, 4)),
				"regions", Arrays.asList(regions)));
		return this;
	}

	public FlatDocument object(Map<String, Object> raw) {
		objects.add(raw);
		return this;
	}

	public static Map<String, Object> region(String name, Integer... faces) {
		return entry("name", name, "include_elements", List.of(faces));
	}

	@SafeVarargs
	public final FlatDocument surfaceClass(String name, Map<String, Object>... properties) {
		surfaceClasses.add(entry("name", name, "properties", Arrays.asList(properties)));
		return this;
	}

	public static Map<String, Object> property(String affectedMols, String molecule, String type) {
		return entry("affected_mols", affectedMols, "molecule", molecule, "surf_class_type", type);
	}

	public FlatDocument modify(String objectName, String regionName, String surfaceClassName) {
		modifications.add(entry("object_name", objectName, "region_name", regionName, "surf_class_name", surfaceClassName));
		return this;
	}

	public FlatDocument release(String name, String objectExpr, String molecule, String quantity, Object orient) {
		releaseSites.add(entry("name", name, "object_expr", objectExpr, "molecule", molecule, "quantity", quantity,
				"orient", orient));
		return this;
	}

	public FlatDocument count(String molecule, String location) {
		return count(molecule, location, null, null);
	}

	public FlatDocument count(String molecule, String location, String objectName, String regionName) {
		counts.add(entry("molecule_name", molecule, "count_location", location, "object_name", objectName,
				"region_name", regionName));
		return this;
	}

	public FlatDocument count(Map<String, Object> raw) {
		counts.add(raw);
		return this;
	}

	public FlatDocument exportAll(boolean exportAll) {
		vizOutput = entry("export_all", exportAll);
		return this;
	}

	public FlatDocument initialization(String iterations, String timeStep) {
		initialization = entry("iterations", iterations, "time_step", timeStep);
		return this;
	}

	public Map<String, Object> toMap() {
		Map<String, Object> document = new LinkedHashMap<>();
		document.put("species", species);
		document.put("reactions", reactions);
		document.put("objects", objects);
		document.put("surface_classes", surfaceClasses);
		document.put("modify_surface_regions", modifications);
		document.put("release_sites", releaseSites);
		document.put("reaction_data_output", counts);
		if (vizOutput != null) {
			document.put("viz_output", vizOutput);
		}
		if (initialization != null) {
			document.put("initialization", initialization);
		}
		return document;
	}

	public DataModelNode toNode() {
		return DataModelNode.root(toMap());
	}

	/**
	 * A mapping from alternating keys and values; null values are left out.
	 */
	public static Map<String, Object> entry(Object... keysAndValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			if (keysAndValues[i + 1] != null) {
				map.put((String) keysAndValues[i], keysAndValues[i + 1]);
			}
		}
		return map;
	}
}

package org.javai.cellsim.datamodel;

/**
 * Where each section of a data model lives in the decoded document tree.
 * <p>
 * Entry-level field names ({@code mol_name}, {@code fwd_rate}, {@code object_expr}, ...) are the
 * same in every layout; only the section locations and the two nested list keys differ.
 */
public enum DataModelLayout {

	/**
	 * Top-level sections named after their content, e.g. {@code species} and {@code reactions}.
	 */
	FLAT(
			"species",
			"reactions",
			"objects",
			"regions",
			"surface_classes",
			"properties",
			"modify_surface_regions",
			"release_sites",
			"reaction_data_output",
			"viz_output",
			"initialization"),

	/**
	 * The CellBlender export layout, rooted at {@code mcell}.
	 */
	CELLBLENDER(
			"mcell.define_molecules.molecule_list",
			"mcell.define_reactions.reaction_list",
			"mcell.geometrical_objects.object_list",
			"define_surface_regions",
			"mcell.define_surface_classes.surface_class_list",
			"surface_class_prop_list",
			"mcell.modify_surface_regions.modify_surface_regions_list",
			"mcell.release_sites.release_site_list",
			"mcell.reaction_data_output.reaction_output_list",
			"mcell.viz_output",
			"mcell.initialization");

	private final String species;
	private final String reactions;
	private final String objects;
	private final String regionsKey;
	private final String surfaceClasses;
	private final String surfaceClassPropertiesKey;
	private final String modifySurfaceRegions;
	private final String releaseSites;
	private final String reactionOutput;
	private final String vizOutput;
	private final String initialization;

	DataModelLayout(String species, String reactions, String objects, String regionsKey,
			String surfaceClasses, String surfaceClassPropertiesKey, String modifySurfaceRegions,
			String releaseSites, String reactionOutput, String vizOutput, String initialization) {
		this.species = species;
		this.reactions = reactions;
		this.objects = objects;
		this.regionsKey = regionsKey;
		this.surfaceClasses = surfaceClasses;
		this.surfaceClassPropertiesKey = surfaceClassPropertiesKey;
		this.modifySurfaceRegions = modifySurfaceRegions;
		this.releaseSites = releaseSites;
		this.reactionOutput = reactionOutput;
		this.vizOutput = vizOutput;
		this.initialization = initialization;
	}

	public String species() {
		return species;
	}

	public String reactions() {
		return reactions;
	}

	public String objects() {
		return objects;
	}

	/**
	 * Key of the region list inside each object entry.
	 */
	public String regionsKey() {
		return regionsKey;
	}

	public String surfaceClasses() {
		return surfaceClasses;
	}

	/**
	 * Key of the property list inside each surface class entry.
	 */
	public String surfaceClassPropertiesKey() {
		return surfaceClassPropertiesKey;
	}

	public String modifySurfaceRegions() {
		return modifySurfaceRegions;
	}

	public String releaseSites() {
		return releaseSites;
	}

	public String reactionOutput() {
		return reactionOutput;
	}

	public String vizOutput() {
		return vizOutput;
	}

	public String initialization() {
		return initialization;
	}
}

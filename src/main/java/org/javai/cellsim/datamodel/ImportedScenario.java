package org.javai.cellsim.datamodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.cellsim.datamodel.engine.ConstructionPlan;
import org.javai.cellsim.datamodel.engine.SimulationEngine;
import org.javai.cellsim.datamodel.model.CountRequest;
import org.javai.cellsim.datamodel.model.Initialization;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Reaction;
import org.javai.cellsim.datamodel.model.ReleaseSite;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.model.SurfaceClass;
import org.javai.cellsim.datamodel.model.SurfaceRegionAssignment;
import org.javai.cellsim.datamodel.model.VizSelection;

/**
 * The fully resolved result of one import.
 * <p>
 * Registries keep document order. The {@link #plan()} holds the engine calls in the order they
 * must be issued; use {@link #applyTo(SimulationEngine)} to hand the scenario to an engine.
 *
 * @param species species by name
 * @param reactions reaction rules in document order
 * @param meshObjects mesh objects by name
 * @param surfaceClasses surface classes by name
 * @param surfaceRegionAssignments surface classes applied to regions
 * @param releaseSites release sites in document order
 * @param countRequests count requests in document order
 * @param visualization species selected for visualization
 * @param initialization run parameters, empty when the document has no initialization section
 * @param plan the recorded engine calls, sealed against further additions
 */
public record ImportedScenario(
		Map<String, Species> species,
		List<Reaction> reactions,
		Map<String, MeshObject> meshObjects,
		Map<String, SurfaceClass> surfaceClasses,
		List<SurfaceRegionAssignment> surfaceRegionAssignments,
		List<ReleaseSite> releaseSites,
		List<CountRequest> countRequests,
		VizSelection visualization,
		Optional<Initialization> initialization,
		ConstructionPlan plan
) {

	public ImportedScenario {
		species = orderedCopy(species);
		reactions = List.copyOf(reactions);
		meshObjects = orderedCopy(meshObjects);
		surfaceClasses = orderedCopy(surfaceClasses);
		surfaceRegionAssignments = List.copyOf(surfaceRegionAssignments);
		releaseSites = List.copyOf(releaseSites);
		countRequests = List.copyOf(countRequests);
		plan = plan.sealedCopy();
	}

	/**
	 * Issue every recorded construction call against the engine.
	 */
	public void applyTo(SimulationEngine engine) {
		plan.applyTo(engine);
	}

	private static <T> Map<String, T> orderedCopy(Map<String, T> source) {
		return Collections.unmodifiableMap(new LinkedHashMap<>(source));
	}
}

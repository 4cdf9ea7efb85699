package org.javai.cellsim.datamodel.engine;

import org.javai.cellsim.datamodel.model.CountRequest;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Reaction;
import org.javai.cellsim.datamodel.model.Region;
import org.javai.cellsim.datamodel.model.ReleaseSite;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.model.SurfaceRegionAssignment;
import org.javai.cellsim.datamodel.model.VizSelection;

/**
 * Construction API of the simulation engine that consumes a resolved scenario.
 * <p>
 * The protocol is write-only: the importer never reads state back from the engine. Calls arrive
 * in dependency order, so a species is always constructed before any reaction that uses it, and a
 * mesh object before its regions.
 */
public interface SimulationEngine {

	void constructSpecies(Species species);

	void constructReaction(Reaction reaction);

	void constructMeshObject(MeshObject object);

	void constructRegion(Region region);

	void assignSurfaceClass(SurfaceRegionAssignment assignment);

	/**
	 * Release molecules into an object, or into one of its regions when the site names one.
	 */
	void releaseInto(ReleaseSite site);

	void addCount(CountRequest request);

	void addVisualization(VizSelection selection);

	void setIterations(int iterations);

	void setTimeStep(double timeStep);
}

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
 * One recorded call against the {@link SimulationEngine}. Sealed to ensure all command types are
 * known.
 */
public sealed interface ConstructionCommand {

	/**
	 * Issue this command against the engine.
	 */
	void applyTo(SimulationEngine engine);

	record ConstructSpecies(Species species) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.constructSpecies(species);
		}
	}

	record ConstructReaction(Reaction reaction) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.constructReaction(reaction);
		}
	}

	record ConstructMeshObject(MeshObject object) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.constructMeshObject(object);
		}
	}

	record ConstructRegion(Region region) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.constructRegion(region);
		}
	}

	record AssignSurfaceClass(SurfaceRegionAssignment assignment) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.assignSurfaceClass(assignment);
		}
	}

	record ReleaseMolecules(ReleaseSite site) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.releaseInto(site);
		}
	}

	record AddCount(CountRequest request) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.addCount(request);
		}
	}

	record AddVisualization(VizSelection selection) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.addVisualization(selection);
		}
	}

	record SetIterations(int iterations) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.setIterations(iterations);
		}
	}

	record SetTimeStep(double timeStep) implements ConstructionCommand {
		@Override
		public void applyTo(SimulationEngine engine) {
			engine.setTimeStep(timeStep);
		}
	}
}

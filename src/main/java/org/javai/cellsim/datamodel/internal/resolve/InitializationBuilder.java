package org.javai.cellsim.datamodel.internal.resolve;

import java.util.Optional;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.model.Initialization;

/**
 * Reads the iteration count and time step.
 */
public class InitializationBuilder {

	public Optional<Initialization> build(DataModelNode document, BuildContext context) {
		Optional<DataModelNode> section = document.descend(context.layout().initialization());
		if (section.isEmpty()) {
			return Optional.empty();
		}
		DataModelNode node = section.get();
		int iterations = node.requireInt("iterations");
		if (iterations <= 0) {
			throw new MalformedFieldException(node.path(), "iterations", "must be positive: " + iterations);
		}
		double timeStep = node.requireDouble("time_step");
		if (timeStep <= 0) {
			throw new MalformedFieldException(node.path(), "time_step", "must be positive: " + timeStep);
		}

		context.plan().add(new ConstructionCommand.SetIterations(iterations));
		context.plan().add(new ConstructionCommand.SetTimeStep(timeStep));
		return Optional.of(new Initialization(iterations, timeStep));
	}
}

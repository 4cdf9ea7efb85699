package org.javai.cellsim.datamodel.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered engine calls recorded during an import.
 * <p>
 * Builders append to the plan while they run; nothing touches the engine until the import has
 * finished without error and the caller invokes {@link #applyTo(SimulationEngine)}. A failed
 * import therefore never leaves a partially constructed scenario behind.
 * <p>
 * A plan handed out with an import result is sealed: it replays as usual but rejects new commands.
 */
public final class ConstructionPlan {

	private static final Logger logger = LoggerFactory.getLogger(ConstructionPlan.class);

	private final List<ConstructionCommand> commands;
	private final boolean sealed;

	public ConstructionPlan() {
		this.commands = new ArrayList<>();
		this.sealed = false;
	}

	private ConstructionPlan(List<ConstructionCommand> commands) {
		this.commands = List.copyOf(commands);
		this.sealed = true;
	}

	/**
	 * Append a command.
	 *
	 * @throws IllegalStateException if the plan is sealed
	 */
	public void add(ConstructionCommand command) {
		Objects.requireNonNull(command, "command must not be null");
		if (sealed) {
			throw new IllegalStateException("construction plan is sealed; no commands can be added");
		}
		commands.add(command);
	}

	/**
	 * A read-only copy of this plan. Later additions to this plan do not show in the copy.
	 */
	public ConstructionPlan sealedCopy() {
		return sealed ? this : new ConstructionPlan(commands);
	}

	public boolean isSealed() {
		return sealed;
	}

	/**
	 * The recorded commands in issue order.
	 */
	public List<ConstructionCommand> commands() {
		return List.copyOf(commands);
	}

	/**
	 * The recorded commands of one type, in issue order.
	 */
	public <T extends ConstructionCommand> List<T> commands(Class<T> type) {
		return commands.stream()
				.filter(type::isInstance)
				.map(type::cast)
				.toList();
	}

	public int size() {
		return commands.size();
	}

	public boolean isEmpty() {
		return commands.isEmpty();
	}

	/**
	 * Replay every command against the engine in order. When the engine is a
	 * {@link TransactionalEngine} the replay runs inside one transaction that is rolled back if any
	 * command fails; the failure is rethrown.
	 */
	public void applyTo(SimulationEngine engine) {
		Objects.requireNonNull(engine, "engine must not be null");
		if (engine instanceof TransactionalEngine transactional) {
			transactional.begin();
			try {
				replay(engine);
			}
			catch (RuntimeException e) {
				logger.warn("Construction failed after partial replay; rolling back", e);
				transactional.rollback();
				throw e;
			}
			transactional.commit();
		}
		else {
			replay(engine);
		}
	}

	private void replay(SimulationEngine engine) {
		logger.debug("Applying {} construction commands", commands.size());
		for (ConstructionCommand command : commands) {
			command.applyTo(engine);
		}
	}
}

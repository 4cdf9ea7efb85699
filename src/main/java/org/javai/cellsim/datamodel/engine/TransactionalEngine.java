package org.javai.cellsim.datamodel.engine;

/**
 * An engine that can stage construction calls and make them visible atomically.
 * {@link ConstructionPlan#applyTo(SimulationEngine)} wraps the whole plan in one transaction
 * when the target implements this interface.
 */
public interface TransactionalEngine extends SimulationEngine {

	void begin();

	void commit();

	/**
	 * Discard everything staged since {@link #begin()}.
	 */
	void rollback();
}

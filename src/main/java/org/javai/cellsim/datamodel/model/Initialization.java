package org.javai.cellsim.datamodel.model;

/**
 * Scalar run parameters.
 *
 * @param iterations number of iterations, positive
 * @param timeStep time step in seconds, positive and finite
 */
public record Initialization(int iterations, double timeStep) {

	public Initialization {
		if (iterations <= 0) {
			throw new IllegalArgumentException("iterations must be positive: " + iterations);
		}
		if (!Double.isFinite(timeStep) || timeStep <= 0) {
			throw new IllegalArgumentException("timeStep must be positive and finite: " + timeStep);
		}
	}
}

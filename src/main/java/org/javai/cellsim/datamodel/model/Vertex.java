package org.javai.cellsim.datamodel.model;

/**
 * A mesh vertex in 3-D space.
 */
public record Vertex(double x, double y, double z) {
}

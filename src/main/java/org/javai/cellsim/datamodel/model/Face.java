package org.javai.cellsim.datamodel.model;

import java.util.List;

/**
 * A mesh face given as indices into the owning object's vertex list.
 * Bounds are not checked here.
 */
public record Face(List<Integer> vertexIndices) {

	public Face {
		vertexIndices = vertexIndices != null ? List.copyOf(vertexIndices) : List.of();
	}

	public static Face of(Integer... indices) {
		return new Face(List.of(indices));
	}
}

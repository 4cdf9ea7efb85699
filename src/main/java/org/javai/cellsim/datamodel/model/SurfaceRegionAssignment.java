package org.javai.cellsim.datamodel.model;

/**
 * A surface class applied to one region of a mesh object.
 */
public record SurfaceRegionAssignment(MeshObject object, Region region, SurfaceClass surfaceClass) {
}

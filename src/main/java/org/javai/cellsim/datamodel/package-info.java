/**
 * Public API of the reaction-diffusion data model importer.
 * <p>
 * {@link org.javai.cellsim.datamodel.DataModelImporter} reads a data model, resolves every
 * species, mesh object, region and surface class reference, and returns an
 * {@link org.javai.cellsim.datamodel.ImportedScenario} whose construction plan can be applied to
 * a {@link org.javai.cellsim.datamodel.engine.SimulationEngine}.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel;

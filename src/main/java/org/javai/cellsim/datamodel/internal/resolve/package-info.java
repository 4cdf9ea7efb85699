/**
 * Scenario resolution internals.
 * <p>
 * One builder per data model section, each consuming its section plus the registries built
 * before it and recording engine calls into the shared construction plan. Applications work with
 * {@link org.javai.cellsim.datamodel.ImportedScenario} instead of these types.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.internal.resolve;

/**
 * Name-keyed registries through which cross-references are bound.
 * Internal types; the resolved graph is exposed through {@code ImportedScenario}.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.internal.bind;

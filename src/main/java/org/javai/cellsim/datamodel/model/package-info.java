/**
 * The resolved scenario graph: immutable species, reaction, geometry, surface, release, output
 * and run-parameter types produced by the importer.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.model;

/**
 * The boundary to the simulation engine: its construction API and the recorded, replayable
 * sequence of calls an import produces.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.engine;

package org.javai.cellsim.datamodel.internal.resolve;

import org.javai.cellsim.datamodel.ImportOptions;
import org.javai.cellsim.datamodel.ImportedScenario;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;

/**
 * Binds a decoded data model into a resolved scenario.
 * <p>
 * Resolution is a single forward pass over the document. Any failure aborts it with a
 * {@link org.javai.cellsim.datamodel.DataModelException}; no partial scenario is returned.
 */
public interface ScenarioResolver {

	/**
	 * @param document the decoded document root
	 * @param options layout and policy options
	 * @return the resolved scenario together with its recorded construction plan
	 */
	ImportedScenario resolve(DataModelNode document, ImportOptions options);
}

package org.javai.cellsim.datamodel.internal.parse;

import org.javai.cellsim.datamodel.DataModelParseException;

/**
 * Parses release-site object expressions: either {@code Object} or {@code Object[Region]}.
 */
public final class ObjectExpressionParser {

	private ObjectExpressionParser() {
	}

	/**
	 * @param expression the expression text
	 * @param path document path used in error reports
	 * @throws DataModelParseException on empty names, unmatched or nested brackets, or text after {@code ]}
	 */
	public static ObjectExpression parse(String expression, String path) {
		if (expression.isBlank()) {
			throw new DataModelParseException(path, expression, "Empty object expression");
		}
		int open = expression.indexOf('[');
		if (open < 0) {
			if (expression.indexOf(']') >= 0) {
				throw new DataModelParseException(path, expression, "Unmatched ']' in object expression");
			}
			return new ObjectExpression(expression, null);
		}
		if (open == 0) {
			throw new DataModelParseException(path, expression, "Missing object name before '['");
		}
		int close = expression.indexOf(']', open);
		if (close < 0) {
			throw new DataModelParseException(path, expression, "Unmatched '[' in object expression");
		}
		if (close != expression.length() - 1) {
			throw new DataModelParseException(path, expression, "Unexpected text after ']' in object expression");
		}
		String region = expression.substring(open + 1, close);
		if (region.isEmpty()) {
			throw new DataModelParseException(path, expression, "Empty region name in object expression");
		}
		if (region.indexOf('[') >= 0 || expression.substring(0, open).indexOf(']') >= 0) {
			throw new DataModelParseException(path, expression, "Nested brackets in object expression");
		}
		return new ObjectExpression(expression.substring(0, open), region);
	}
}

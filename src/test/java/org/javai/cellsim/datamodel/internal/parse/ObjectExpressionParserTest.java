package org.javai.cellsim.datamodel.internal.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.cellsim.datamodel.DataModelParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ObjectExpressionParserTest {

	@ParameterizedTest
	@CsvSource({
			"Cell[Top], Cell, Top",
			"Cube[r_1], Cube, r_1",
			"A[B], A, B"
	})
	void shouldParseRegionExpression(String expression, String object, String region) {
		ObjectExpression parsed = ObjectExpressionParser.parse(expression, "release_sites[0].object_expr");

		assertThat(parsed.objectName()).isEqualTo(object);
		assertThat(parsed.region()).contains(region);
		assertThat(parsed).hasToString(expression);
	}

	@Test
	void shouldParseBareObject() {
		ObjectExpression parsed = ObjectExpressionParser.parse("Cell", "release_sites[0].object_expr");

		assertThat(parsed.objectName()).isEqualTo("Cell");
		assertThat(parsed.region()).isEmpty();
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "  ", "Cell[Top", "Cell]", "[Top]", "Cell[]", "Cell[Top]x", "Cell[A[B]", "Cell[A]]" })
	void shouldRejectMalformed(String expression) {
		assertThatThrownBy(() -> ObjectExpressionParser.parse(expression, "release_sites[4].object_expr"))
				.isInstanceOf(DataModelParseException.class)
				.hasMessageStartingWith("release_sites[4].object_expr: ");
	}
}

package it.cavallium.searchcore.index;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TestNumericTerms {

	@ParameterizedTest
	@ValueSource(doubles = {0, -0.5, 1, 1e300, -1e300, Double.MIN_VALUE, 42.125})
	public void testDecode(double value) {
		var term = NumericTerms.encode(value);
		Assertions.assertTrue(NumericTerms.isNumeric(term));
		Assertions.assertEquals(value, NumericTerms.decode(term));
	}

	@Test
	public void testOrder() {
		double[] values = {-1e10, -3, -0.5, 0, 0.25, 7, 1e10};
		for (int i = 1; i < values.length; i++) {
			var previous = NumericTerms.encode(values[i - 1]);
			var current = NumericTerms.encode(values[i]);
			Assertions.assertTrue(previous.compareTo(current) < 0, values[i - 1] + " should sort before " + values[i]);
		}
	}

	@Test
	public void testNotNumeric() {
		Assertions.assertFalse(NumericTerms.isNumeric("hello"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> NumericTerms.decode("hello"));
	}

	@Test
	public void testInternalIdsOrder() {
		Assertions.assertTrue(InternalIds.encode(255).compareTo(InternalIds.encode(256)) < 0);
		Assertions.assertEquals(256, InternalIds.decode(InternalIds.encode(256)));
	}
}

package works.bosk.jer.codec.interpreter;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.jer.codec.interpreter.NativeValues.sameValue;

class NativeValuesTest {

	@Test
	void integralNumbersCompareByValue() {
		assertTrue(sameValue(5, 5L));
		assertTrue(sameValue((short) 5, BigInteger.valueOf(5)));
		assertFalse(sameValue(5, 6L));
	}

	@Test
	void realNumbers() {
		assertTrue(sameValue(1.5, 1.5f));
		assertTrue(sameValue(Double.NaN, Double.NaN));
		assertFalse(sameValue(0.0, -0.0));
		assertTrue(sameValue(2, 2.0));
	}

	@Test
	void byteArraysCompareByContent() {
		assertTrue(sameValue(new byte[]{ 1, 2 }, new byte[]{ 1, 2 }));
		assertFalse(sameValue(new byte[]{ 1, 2 }, new byte[]{ 2, 1 }));
	}

	@Test
	void nested() {
		assertTrue(sameValue(
			Map.of("a", List.of(1, 2), "b", new byte[]{ 9 }),
			Map.of("a", List.of(1L, 2L), "b", new byte[]{ 9 })));
		assertFalse(sameValue(Map.of("a", 1), Map.of("b", 1)));
		assertFalse(sameValue(List.of(1), List.of(1, 2)));
	}

	@Test
	void nulls() {
		assertTrue(sameValue(null, null));
		assertFalse(sameValue(null, 0));
		assertFalse(sameValue("x", null));
	}
}

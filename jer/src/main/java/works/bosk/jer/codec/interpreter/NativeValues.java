package works.bosk.jer.codec.interpreter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Value equality over the native value model, used to decide whether
 * a member equals its DEFAULT.
 * <p>
 * Integral numbers compare by value regardless of their boxed type;
 * {@code byte[]} compares by content, including inside maps and lists.
 */
final class NativeValues {
	private NativeValues() { }

	static boolean sameValue(Object a, Object b) {
		if (a == b) {
			return true;
		} else if (a == null || b == null) {
			return false;
		} else if (a instanceof Number x && b instanceof Number y) {
			return sameNumber(x, y);
		} else if (a instanceof byte[] x && b instanceof byte[] y) {
			return Arrays.equals(x, y);
		} else if (a instanceof CharSequence x && b instanceof CharSequence y) {
			return x.toString().equals(y.toString());
		} else if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
			return sameMap(x, y);
		} else if (a instanceof List<?> x && b instanceof List<?> y) {
			return sameList(x, y);
		} else {
			return a.equals(b);
		}
	}

	private static boolean sameNumber(Number x, Number y) {
		if (isIntegral(x) && isIntegral(y)) {
			return toBigInteger(x).equals(toBigInteger(y));
		} else {
			return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
		}
	}

	private static boolean sameMap(Map<?, ?> x, Map<?, ?> y) {
		if (x.size() != y.size()) {
			return false;
		}
		for (Map.Entry<?, ?> entry : x.entrySet()) {
			if (!y.containsKey(entry.getKey()) || !sameValue(entry.getValue(), y.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	private static boolean sameList(List<?> x, List<?> y) {
		if (x.size() != y.size()) {
			return false;
		}
		Iterator<?> xi = x.iterator();
		Iterator<?> yi = y.iterator();
		while (xi.hasNext()) {
			if (!sameValue(xi.next(), yi.next())) {
				return false;
			}
		}
		return true;
	}

	static boolean isIntegral(Number n) {
		return n instanceof Long
			|| n instanceof Integer
			|| n instanceof Short
			|| n instanceof Byte
			|| n instanceof BigInteger;
	}

	private static BigInteger toBigInteger(Number n) {
		return (n instanceof BigInteger b) ? b : BigInteger.valueOf(n.longValue());
	}
}

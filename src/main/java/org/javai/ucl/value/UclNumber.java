package org.javai.ucl.value;

import java.math.BigDecimal;

/**
 * A signed number. There is no separate integer representation: whether a
 * number is integral only matters when it is rendered as text or converted.
 */
public record UclNumber(double value) implements UclValue {

	// Beyond this magnitude doubles no longer represent every integer.
	private static final double MAX_EXACT_INTEGRAL = 9.007199254740992E15;

	public UclNumber {
		// -0.0 and 0.0 must compare equal
		if (value == 0) {
			value = 0.0;
		}
	}

	public static UclNumber of(double value) {
		return new UclNumber(value);
	}

	@Override
	public Kind kind() {
		return Kind.NUMBER;
	}

	@Override
	public Object toJava() {
		return value;
	}

	public boolean isIntegral() {
		return !Double.isInfinite(value) && value == Math.rint(value);
	}

	public long longValue() {
		return (long) value;
	}

	/**
	 * Returns the canonical decimal text of this number. Integral values render
	 * without a fractional part ({@code 5}, not {@code 5.0}) and no value renders
	 * in exponent notation.
	 */
	public String toCanonicalString() {
		return canonical(value);
	}

	public static String canonical(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		}
		if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGRAL) {
			return Long.toString((long) value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	@Override
	public String toString() {
		return canonical(value);
	}
}

package com.github.micycle1.atsegment;

import java.math.BigDecimal;

final class MathUtil {

	private MathUtil() {
	}

	/**
	 * Drops every decimal after the first {@code digits}, rounding toward zero:
	 * truncate(0.123456, 4) == 0.1234, truncate(-0.98765, 2) == -0.98.
	 */
	public static double truncate(double value, int digits) {
		if (!Double.isFinite(value)) {
			return value;
		}
		double scale = Math.pow(10, digits);
		double scaled = value * scale;
		if (Math.abs(scaled) >= Long.MAX_VALUE) {
			return value;
		}
		return ((long) scaled) / scale;
	}

	/** Plain decimal notation without exponent or trailing zeros. */
	public static String plain(double value) {
		if (!Double.isFinite(value)) {
			return Double.toString(value);
		}
		if (value == 0.0) {
			return "0";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}
}

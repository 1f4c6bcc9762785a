package com.github.micycle1.atsegment.calculus;

import java.util.Arrays;
import java.util.Objects;

/**
 * A discrete k-form: one scalar per cell of the matching dimension. The values
 * array is owned by the form and may be mutated in place through
 * {@link #set(int, double)}.
 */
public final class Form {

	private final FormSpace space;
	private final double[] values;

	public Form(FormSpace space, double[] values) {
		this.space = Objects.requireNonNull(space, "space must not be null");
		this.values = Objects.requireNonNull(values, "values must not be null");
	}

	public static Form zeros(FormSpace space, int size) {
		return new Form(space, new double[size]);
	}

	public static Form constant(FormSpace space, int size, double value) {
		double[] values = new double[size];
		Arrays.fill(values, value);
		return new Form(space, values);
	}

	public FormSpace getSpace() {
		return space;
	}

	public int size() {
		return values.length;
	}

	public double get(int index) {
		return values[index];
	}

	public void set(int index, double value) {
		values[index] = value;
	}

	/** Backing array; writes are visible through this form. */
	public double[] values() {
		return values;
	}

	public Form copy() {
		return new Form(space, values.clone());
	}

	public Form scale(double factor) {
		double[] out = new double[values.length];
		for (int i = 0; i < out.length; i++) {
			out[i] = factor * values[i];
		}
		return new Form(space, out);
	}

	/** Elementwise square, used to build the diagonal weight operators. */
	public double[] squared() {
		double[] out = new double[values.length];
		for (int i = 0; i < out.length; i++) {
			out[i] = values[i] * values[i];
		}
		return out;
	}

	public double dot(Form other) {
		checkCompatible(other);
		double s = 0.0;
		for (int i = 0; i < values.length; i++) {
			s += values[i] * other.values[i];
		}
		return s;
	}

	/** max_i |this_i - other_i| */
	public double supNormDistance(Form other) {
		checkCompatible(other);
		double max = 0.0;
		for (int i = 0; i < values.length; i++) {
			max = Math.max(max, Math.abs(values[i] - other.values[i]));
		}
		return max;
	}

	public double min() {
		double m = Double.POSITIVE_INFINITY;
		for (double v : values) {
			m = Math.min(m, v);
		}
		return m;
	}

	public double max() {
		double m = Double.NEGATIVE_INFINITY;
		for (double v : values) {
			m = Math.max(m, v);
		}
		return m;
	}

	private void checkCompatible(Form other) {
		if (!space.equals(other.space) || values.length != other.values.length) {
			throw new IllegalArgumentException("Incompatible forms: " + this + " vs " + other);
		}
	}

	@Override
	public String toString() {
		return space + "[" + values.length + "]";
	}
}

package com.github.micycle1.atsegment.calculus;

import java.util.Objects;

/**
 * A (degree, duality) pair naming the space a {@link Form} belongs to, e.g.
 * primal 0-forms (one value per pixel) or primal 1-forms (one value per pixel
 * adjacency).
 */
public final class FormSpace {

	private final int degree;
	private final Duality duality;

	public FormSpace(int degree, Duality duality) {
		if (degree < 0 || degree > 2) {
			throw new IllegalArgumentException("Form degree must be 0, 1 or 2, got " + degree);
		}
		this.degree = degree;
		this.duality = Objects.requireNonNull(duality, "duality must not be null");
	}

	public static FormSpace primal(int degree) {
		return new FormSpace(degree, Duality.PRIMAL);
	}

	public static FormSpace dual(int degree) {
		return new FormSpace(degree, Duality.DUAL);
	}

	public int getDegree() {
		return degree;
	}

	public Duality getDuality() {
		return duality;
	}

	/**
	 * Dimension of the primal cells carrying this space's values in a 2D complex:
	 * the degree itself for primal forms, {@code 2 - degree} for dual forms.
	 */
	public int cellDimension() {
		return duality == Duality.PRIMAL ? degree : 2 - degree;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FormSpace)) {
			return false;
		}
		FormSpace other = (FormSpace) o;
		return degree == other.degree && duality == other.duality;
	}

	@Override
	public int hashCode() {
		return 31 * degree + duality.hashCode();
	}

	@Override
	public String toString() {
		return (duality == Duality.PRIMAL ? "Primal" : "Dual") + "Form" + degree;
	}
}

package com.github.micycle1.atsegment;

/**
 * The Ambrosio-Tortorelli energy terms of one state (u, v) for given lambda
 * and epsilon.
 */
public final class Energies {

	private final double fidelity;
	private final double diffusion;
	private final double edgeSmoothness;
	private final double edgePenalty;
	private final double perimeter;
	private final double total;

	public Energies(double fidelity, double diffusion, double edgeSmoothness, double edgePenalty, double perimeter,
			double total) {
		this.fidelity = fidelity;
		this.diffusion = diffusion;
		this.edgeSmoothness = edgeSmoothness;
		this.edgePenalty = edgePenalty;
		this.perimeter = perimeter;
		this.total = total;
	}

	/** sum a (u - g)^2 */
	public double getFidelity() {
		return fidelity;
	}

	/** sum v^2 |grad u|^2 */
	public double getDiffusion() {
		return diffusion;
	}

	/** l e |grad v|^2 */
	public double getEdgeSmoothness() {
		return edgeSmoothness;
	}

	/** sum l (1 - v)^2 / 4e */
	public double getEdgePenalty() {
		return edgePenalty;
	}

	/** h (edge smoothness + edge penalty): lambda times the perimeter estimate. */
	public double getPerimeter() {
		return perimeter;
	}

	/** h^2 fidelity + h (diffusion + edge smoothness + edge penalty). */
	public double getTotal() {
		return total;
	}

	@Override
	public String toString() {
		return "Energies{fidelity=" + fidelity + ", diffusion=" + diffusion + ", edgeSmoothness=" + edgeSmoothness
				+ ", edgePenalty=" + edgePenalty + ", perimeter=" + perimeter + ", total=" + total + "}";
	}
}

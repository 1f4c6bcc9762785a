package com.github.micycle1.atsegment;

import java.io.IOException;
import java.util.Objects;

import com.github.micycle1.atsegment.calculus.Form;

/**
 * Computes the AT energy terms of a converged state and formats them as rows of
 * the tab-separated report. Purely diagnostic: nothing here feeds back into the
 * solver.
 */
public final class EnergyReporter {

	public static final String HEADER = "#  l \t a \t e \ta(u-g)^2 \tv^2|grad u|^2 \t  le|grad v|^2 \t  l(1-v)^2/4e \t l.per \tAT tot";

	private final OperatorAssembler assembler;
	private final double alpha;
	private final double h;

	public EnergyReporter(OperatorAssembler assembler, double alpha, double h) {
		this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
		this.alpha = alpha;
		this.h = h;
	}

	public Energies compute(Form u, Form v, Form g, double lambda, double eps) {
		double fidelity = 0.0;
		for (int i = 0; i < u.size(); i++) {
			double d = u.get(i) - g.get(i);
			fidelity += alpha * d * d;
		}

		double diffusion = u.dot(assembler.diffusionOperator(v).apply(u));

		double edgeSmoothness = lambda * eps * v.dot(assembler.getOperators().edgeLaplacian.apply(v));

		double edgePenalty = 0.0;
		double c = lambda / (4.0 * eps);
		for (int i = 0; i < v.size(); i++) {
			double d = 1.0 - v.get(i);
			edgePenalty += c * d * d;
		}

		double perimeter = h * edgeSmoothness + h * edgePenalty;
		double total = h * h * fidelity + h * diffusion + h * edgeSmoothness + h * edgePenalty;
		return new Energies(fidelity, diffusion, edgeSmoothness, edgePenalty, perimeter, total);
	}

	/**
	 * One report row: lambda (8 decimals), alpha, epsilon (4 decimals) and the six
	 * energies (5 decimals), truncated toward zero and tab separated.
	 */
	public static String formatRow(double lambda, double alpha, double eps, Energies e) {
		StringBuilder sb = new StringBuilder();
		sb.append(MathUtil.plain(MathUtil.truncate(lambda, 8))).append('\t');
		sb.append(MathUtil.plain(alpha)).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(eps, 4))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getFidelity(), 5))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getDiffusion(), 5))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getEdgeSmoothness(), 5))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getEdgePenalty(), 5))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getPerimeter(), 5))).append('\t');
		sb.append(MathUtil.plain(MathUtil.truncate(e.getTotal(), 5)));
		return sb.toString();
	}

	public static void appendHeader(Appendable out) throws IOException {
		out.append(HEADER).append('\n');
	}

	public static void appendRow(Appendable out, LambdaStep step, double alpha) throws IOException {
		out.append(formatRow(step.getLambda(), alpha, step.getEpsilon(), step.getEnergies())).append('\n');
	}
}

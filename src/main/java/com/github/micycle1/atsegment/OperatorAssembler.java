package com.github.micycle1.atsegment;

import java.util.Objects;

import com.github.micycle1.atsegment.calculus.Form;
import com.github.micycle1.atsegment.calculus.FormSpace;
import com.github.micycle1.atsegment.calculus.Operator;

/**
 * Assembles the two SPD systems of the alternating minimization from the base
 * operators of an {@link OperatorBundle}:
 *
 * <pre>
 * u-system: (h * D0^T diag(v^2) D0 + a h^2 Id0) u = h^2 a g
 * v-system: h (e l B'B + (l/4e) Id1 + diag(w^2)) v = (h/e) (l/4) 1,   w = D0 u
 * </pre>
 *
 * where {@code B'B} is {@link OperatorBundle#edgeLaplacian}. Both matrices are
 * SPD whenever a, h, e, l &gt; 0.
 */
public final class OperatorAssembler {

	private final OperatorBundle ops;

	public OperatorAssembler(OperatorBundle ops) {
		this.ops = Objects.requireNonNull(ops, "ops must not be null");
	}

	public OperatorBundle getOperators() {
		return ops;
	}

	/**
	 * {@code -dual_h2 dual_D1 primal_h1 diag(v^2) primal_D0}, the edge-weighted
	 * Laplacian whose quadratic form is the diffusion energy.
	 */
	public Operator diffusionOperator(Form v) {
		Operator mv2 = ops.getCalculus().diagonal(FormSpace.primal(1), v.squared());
		return ops.codifferential1.compose(mv2).compose(ops.primalD0).times(-1.0);
	}

	/** Matrix of the u-system for the current edge field. */
	public Operator uOperator(Form v, double alpha, double h) {
		return diffusionOperator(v).times(h).plus(alpha * h * h, ops.identity0);
	}

	/** Right-hand side of the u-system. */
	public Form uRightHandSide(Form g, double alpha, double h) {
		return g.scale(h * h * alpha);
	}

	/** {@code l B'B}; depends on lambda only, so built once per lambda value. */
	public Operator edgeOperator(double lambda) {
		return ops.edgeLaplacian.times(lambda);
	}

	/**
	 * {@code h (e l B'B + (l/4e) Id1)}, the part of the v-system that does not
	 * depend on u. Built once per (lambda, epsilon).
	 *
	 * @param lambdaEdge {@link #edgeOperator(double)} for the current lambda
	 */
	public Operator edgeSystem(Operator lambdaEdge, double lambda, double eps, double h) {
		return lambdaEdge.times(eps).plus(lambda / (4.0 * eps), ops.identity1).times(h);
	}

	/**
	 * Matrix of the v-system.
	 *
	 * @param edgeSystem {@link #edgeSystem(Operator, double, double, double)} for
	 *                   the current lambda and epsilon
	 * @param w          discrete gradient of the current u
	 */
	public Operator vOperator(Operator edgeSystem, Form w, double h) {
		double[] w2 = w.squared();
		for (int i = 0; i < w2.length; i++) {
			w2[i] *= h;
		}
		return edgeSystem.plus(ops.getCalculus().diagonal(FormSpace.primal(1), w2));
	}

	/** Right-hand side of the v-system: the constant 1-form (h/e)(l/4). */
	public Form vRightHandSide(double lambda, double eps, double h) {
		return ops.getCalculus().constant(FormSpace.primal(1), h * (1.0 / eps) * lambda / 4.0);
	}

	/** Discrete gradient {@code w = primal_D0 u}. */
	public Form gradient(Form u) {
		return ops.primalD0.apply(u);
	}
}

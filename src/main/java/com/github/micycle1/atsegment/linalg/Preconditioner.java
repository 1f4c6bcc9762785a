package com.github.micycle1.atsegment.linalg;

/**
 * <p>
 * Light-weight preconditioner for CSR sparse matrices used with
 * {@link ConjugateGradientSolver}. Implementations compute
 * <code>z = M^{-1} r</code> for a symmetric positive definite M approximating
 * A.
 * </p>
 */
public interface Preconditioner {
	void apply(double[] r, double[] z);
}

package com.github.micycle1.atsegment.linalg;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Capability to solve {@code A x = b} for a sparse symmetric positive definite
 * matrix A. Implementations factorize (or iterate) from scratch on every call
 * and never throw for numerical trouble: a singular, indefinite or otherwise
 * unsolvable system is reported as {@link SolveResult#failed(String)}.
 */
public interface SpdSolver {

	/**
	 * @param a square SPD matrix; left untouched
	 * @param b right-hand side of length {@code a.numRows}; left untouched
	 * @throws IllegalArgumentException if the dimensions do not match
	 */
	SolveResult factorizeAndSolve(DMatrixSparseCSC a, double[] b);

	/** Short name used in logs and on the command line. */
	String getName();

	static void checkDimensions(DMatrixSparseCSC a, double[] b) {
		if (a.numRows != a.numCols) {
			throw new IllegalArgumentException("Matrix must be square, got " + a.numRows + "x" + a.numCols);
		}
		if (b.length != a.numRows) {
			throw new IllegalArgumentException("RHS length " + b.length + " does not match matrix size " + a.numRows);
		}
	}
}

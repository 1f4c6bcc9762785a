package com.github.micycle1.atsegment.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;

/**
 * Direct sparse Cholesky (LL^T) solve using EJML. The factorization fails, and
 * the result is reported as failed, when the matrix is not positive definite.
 */
public final class CholeskySolver implements SpdSolver {

	private final FillReducing fillReducing;

	public CholeskySolver() {
		this(FillReducing.NONE);
	}

	public CholeskySolver(FillReducing fillReducing) {
		this.fillReducing = fillReducing;
	}

	@Override
	public SolveResult factorizeAndSolve(DMatrixSparseCSC a, double[] b) {
		SpdSolver.checkDimensions(a, b);
		LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver = LinearSolverFactory_DSCC.cholesky(fillReducing);
		DMatrixSparseCSC lhs = solver.modifiesA() ? a.copy() : a;
		if (!solver.setA(lhs)) {
			return SolveResult.failed("Cholesky factorization failed (matrix not SPD?)");
		}
		DMatrixRMaj rhs = new DMatrixRMaj(b.length, 1, true, b.clone());
		DMatrixRMaj x = new DMatrixRMaj(a.numCols, 1);
		solver.solve(rhs, x);
		return SolveResult.solved(x.data, "OK");
	}

	@Override
	public String getName() {
		return "cholesky";
	}
}

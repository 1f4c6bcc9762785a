package com.github.micycle1.atsegment.linalg;

import org.ejml.data.DMatrixSparseCSC;
import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.R064Store;
import org.ojalgo.matrix.store.SparseStore;

/**
 * Sparse LU solve with ojAlgo. Does not exploit symmetry, but is more forgiving
 * than Cholesky on nearly indefinite systems.
 */
public final class SparseLUSolver implements SpdSolver {

	@Override
	public SolveResult factorizeAndSolve(DMatrixSparseCSC a, double[] b) {
		SpdSolver.checkDimensions(a, b);
		final int n = a.numRows;

		final SparseStore<Double> store = SparseStore.R064.make(n, n);
		for (int col = 0; col < a.numCols; col++) {
			for (int p = a.col_idx[col]; p < a.col_idx[col + 1]; p++) {
				store.add(a.nz_rows[p], col, a.nz_values[p]);
			}
		}
		final R064Store rhs = R064Store.FACTORY.make(n, 1);
		for (int i = 0; i < n; i++) {
			rhs.set(i, 0, b[i]);
		}

		final LU<Double> lu = LU.R064.make();
		if (!lu.decompose(store) || !lu.isSolvable()) {
			return SolveResult.failed("LU decomposition failed (singular/ill-conditioned system)");
		}
		final MatrixStore<Double> x = lu.getSolution(rhs);
		double[] out = new double[n];
		for (int i = 0; i < n; i++) {
			out[i] = x.doubleValue(i, 0);
		}
		return SolveResult.solved(out, "OK");
	}

	@Override
	public String getName() {
		return "lu";
	}
}

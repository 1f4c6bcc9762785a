package com.github.micycle1.atsegment.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Compressed sparse row view of a square matrix, the layout the iterative
 * solver and its preconditioners sweep over.
 */
public final class SparseCSR {

	public final int n;
	public final int nnz;
	public final int[] rowPtr; // length n+1
	public final int[] colIdx; // length nnz
	public final double[] val; // length nnz

	public SparseCSR(int n, int nnz, int[] rowPtr, int[] colIdx, double[] val) {
		this.n = n;
		this.nnz = nnz;
		this.rowPtr = rowPtr;
		this.colIdx = colIdx;
		this.val = val;
	}

	/** The CSC arrays of A^T are the CSR arrays of A. */
	public static SparseCSR fromCSC(DMatrixSparseCSC a) {
		DMatrixSparseCSC t = CommonOps_DSCC.transpose(a, null, null);
		if (!t.indicesSorted) {
			t.sortIndices(null);
		}
		int nnz = t.nz_length;
		return new SparseCSR(a.numRows, nnz, Arrays.copyOf(t.col_idx, a.numRows + 1), Arrays.copyOf(t.nz_rows, nnz),
				Arrays.copyOf(t.nz_values, nnz));
	}

	/** Diagonal entries; 0 where the diagonal is not stored. */
	public double[] diagonal() {
		double[] d = new double[n];
		for (int i = 0; i < n; i++) {
			for (int p = rowPtr[i]; p < rowPtr[i + 1]; p++) {
				if (colIdx[p] == i) {
					d[i] = val[p];
					break;
				}
			}
		}
		return d;
	}

	/** y = A x */
	public void matVec(double[] x, double[] y) {
		for (int i = 0; i < n; i++) {
			double sum = 0.0;
			int start = rowPtr[i], end = rowPtr[i + 1];
			for (int p = start; p < end; p++) {
				sum += val[p] * x[colIdx[p]];
			}
			y[i] = sum;
		}
	}

	@Override
	public String toString() {
		return "SparseCSR{n=" + n + ", nnz=" + nnz + "}";
	}
}

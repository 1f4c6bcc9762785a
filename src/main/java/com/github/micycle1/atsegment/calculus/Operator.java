package com.github.micycle1.atsegment.calculus;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Sparse linear operator between two form spaces, backed by an EJML
 * {@link DMatrixSparseCSC}. Instances are immutable: every algebraic operation
 * returns a new operator and the wrapped matrix must not be modified by
 * callers.
 */
public final class Operator {

	private final FormSpace source;
	private final FormSpace target;
	private final DMatrixSparseCSC matrix;

	public Operator(FormSpace source, FormSpace target, DMatrixSparseCSC matrix) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.target = Objects.requireNonNull(target, "target must not be null");
		this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
		if (!matrix.indicesSorted) {
			matrix.sortIndices(null);
		}
	}

	/** Diagonal operator on {@code space} with the given entries. */
	public static Operator diagonal(FormSpace space, double[] diag) {
		return new Operator(space, space, CommonOps_DSCC.diag(diag));
	}

	public FormSpace getSource() {
		return source;
	}

	public FormSpace getTarget() {
		return target;
	}

	public int rows() {
		return matrix.numRows;
	}

	public int cols() {
		return matrix.numCols;
	}

	public DMatrixSparseCSC matrix() {
		return matrix;
	}

	public double get(int row, int col) {
		return matrix.get(row, col);
	}

	/**
	 * Composition {@code this * right}: applies {@code right} first, then this
	 * operator.
	 */
	public Operator compose(Operator right) {
		if (!right.target.equals(source) || right.rows() != cols()) {
			throw new IllegalArgumentException("Cannot compose " + this + " with " + right);
		}
		DMatrixSparseCSC out = CommonOps_DSCC.mult(matrix, right.matrix, null);
		return new Operator(right.source, target, out);
	}

	public Operator plus(Operator other) {
		return plus(1.0, other);
	}

	/** {@code this + beta * other} */
	public Operator plus(double beta, Operator other) {
		if (!other.source.equals(source) || !other.target.equals(target) || other.rows() != rows()
				|| other.cols() != cols()) {
			throw new IllegalArgumentException("Cannot add " + other + " to " + this);
		}
		DMatrixSparseCSC out = CommonOps_DSCC.add(1.0, matrix, beta, other.matrix, null, null, null);
		return new Operator(source, target, out);
	}

	public Operator times(double factor) {
		DMatrixSparseCSC out = new DMatrixSparseCSC(matrix.numRows, matrix.numCols, matrix.nz_length);
		CommonOps_DSCC.scale(factor, matrix, out);
		return new Operator(source, target, out);
	}

	public Operator transpose() {
		DMatrixSparseCSC out = CommonOps_DSCC.transpose(matrix, null, null);
		return new Operator(target, source, out);
	}

	public Form apply(Form form) {
		if (!form.getSpace().equals(source) || form.size() != cols()) {
			throw new IllegalArgumentException("Cannot apply " + this + " to " + form);
		}
		DMatrixRMaj x = DMatrixRMaj.wrap(form.size(), 1, form.values());
		DMatrixRMaj y = new DMatrixRMaj(rows(), 1);
		CommonOps_DSCC.mult(matrix, x, y);
		return new Form(target, y.data);
	}

	/** True when |A(i,j) - A(j,i)| <= tol for every stored entry. */
	public boolean isSymmetric(double tol) {
		if (rows() != cols()) {
			return false;
		}
		for (int col = 0; col < matrix.numCols; col++) {
			for (int p = matrix.col_idx[col]; p < matrix.col_idx[col + 1]; p++) {
				int row = matrix.nz_rows[p];
				if (Math.abs(matrix.nz_values[p] - matrix.get(col, row)) > tol) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "Operator{" + source + " -> " + target + ", " + rows() + "x" + cols() + ", nnz=" + matrix.nz_length + "}";
	}
}

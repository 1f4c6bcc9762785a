package com.github.micycle1.atsegment.calculus;

import java.util.Objects;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Discrete exterior calculus over a 2D {@link CellComplex}: form containers
 * plus derivative, Hodge star and identity operators.
 * <p>
 * A primal k-form stores one value per primal k-cell; a dual k-form one value
 * per primal (2-k)-cell. All cells have unit primal and dual size, so the Hodge
 * stars are signed identities. Signs are chosen so that
 * <ul>
 * <li>{@code hodge(2-k, d.opposite()) * hodge(k, d) = (-1)^(k(2-k)) Id},</li>
 * <li>the codifferential {@code hodge * derivative * hodge} is the negative
 * adjoint of the primal derivative, i.e.
 * {@code -hodge(2,DUAL) * derivative(1,DUAL) * hodge(1,PRIMAL) = D0^T} and
 * {@code -hodge(1,DUAL) * derivative(0,DUAL) * hodge(2,PRIMAL) = D1^T}.</li>
 * </ul>
 * Operators are assembled on first request and cached; they never depend on
 * the fields being solved for.
 */
public final class GridCalculus {

	private final CellComplex complex;

	private Operator primalD0;
	private Operator primalD1;

	public GridCalculus(CellComplex complex) {
		this.complex = Objects.requireNonNull(complex, "complex must not be null");
		if (complex.getDimension() != 2) {
			throw new IllegalArgumentException("Only 2D complexes are supported");
		}
	}

	public CellComplex getComplex() {
		return complex;
	}

	/** Number of values held by a form of the given space. */
	public int formSize(FormSpace space) {
		return complex.getCellCount(space.cellDimension());
	}

	public Form zeros(FormSpace space) {
		return Form.zeros(space, formSize(space));
	}

	public Form constant(FormSpace space, double value) {
		return Form.constant(space, formSize(space), value);
	}

	/**
	 * Exterior derivative {@code d: k-forms -> (k+1)-forms} on the primal or dual
	 * complex. Only k = 0 and k = 1 exist in 2D.
	 */
	public Operator derivative(int k, Duality duality) {
		if (k < 0 || k > 1) {
			throw new IllegalArgumentException("No derivative of degree " + k + " in 2D");
		}
		if (duality == Duality.PRIMAL) {
			return k == 0 ? primalD0() : primalD1();
		}
		// dual d_k is the signed transpose of primal d_(1-k)
		if (k == 0) {
			Operator t = primalD1().transpose();
			return new Operator(FormSpace.dual(0), FormSpace.dual(1), t.matrix());
		}
		Operator t = primalD0().transpose().times(-1.0);
		return new Operator(FormSpace.dual(1), FormSpace.dual(2), t.matrix());
	}

	/**
	 * Hodge star from k-forms of the given duality to (2-k)-forms of the opposite
	 * duality.
	 */
	public Operator hodge(int k, Duality duality) {
		FormSpace source = new FormSpace(k, duality);
		FormSpace target = new FormSpace(2 - k, duality.opposite());
		double sign = (duality == Duality.DUAL && k == 1) ? -1.0 : 1.0;
		int n = formSize(source);
		DMatrixSparseCSC m = CommonOps_DSCC.identity(n);
		if (sign != 1.0) {
			CommonOps_DSCC.scale(sign, m, m);
		}
		return new Operator(source, target, m);
	}

	/** Identity (unit mass) operator on k-forms. */
	public Operator identity(int k, Duality duality) {
		FormSpace space = new FormSpace(k, duality);
		return new Operator(space, space, CommonOps_DSCC.identity(formSize(space)));
	}

	/** Diagonal operator on the given space, e.g. diag(v^2) on primal 1-forms. */
	public Operator diagonal(FormSpace space, double[] diag) {
		if (diag.length != formSize(space)) {
			throw new IllegalArgumentException("Diagonal of length " + diag.length + " for " + space + " of size " + formSize(space));
		}
		return Operator.diagonal(space, diag);
	}

	private Operator primalD0() {
		if (primalD0 == null) {
			primalD0 = incidence(1, FormSpace.primal(0), FormSpace.primal(1));
		}
		return primalD0;
	}

	private Operator primalD1() {
		if (primalD1 == null) {
			primalD1 = incidence(2, FormSpace.primal(1), FormSpace.primal(2));
		}
		return primalD1;
	}

	// rows: cells of dimension dim, columns: their boundary (dim-1)-cells
	private Operator incidence(int dim, FormSpace source, FormSpace target) {
		int rows = complex.getCellCount(dim);
		int cols = complex.getCellCount(dim - 1);
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(rows, cols, rows * 2 * dim);
		for (int c = 0; c < rows; c++) {
			int[] faces = complex.getBoundary(dim, c);
			int[] signs = complex.getBoundaryOrientation(dim, c);
			for (int j = 0; j < faces.length; j++) {
				tr.addItem(c, faces[j], signs[j]);
			}
		}
		DMatrixSparseCSC m = DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
		return new Operator(source, target, m);
	}
}

package com.github.micycle1.atsegment.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Iterative solver implementing the preconditioned Conjugate Gradient method
 * for symmetric positive definite systems A x = b, with A stored in compressed
 * sparse row (CSR) format. Each call starts from x = 0 and stops when the
 * relative residual ||b - A x|| / ||b|| drops below the tolerance.
 * <p>
 * Supports Jacobi and SSOR preconditioning through the {@code Preconditioner}
 * interface.
 */
public final class ConjugateGradientSolver implements SpdSolver {

	public enum PreconditionerType {
		NONE, JACOBI, SSOR
	}

	public static final class Result {
		boolean converged;
		int iters;
		double relResidual;
		String breakdown; // null if OK

		public boolean isConverged() {
			return converged;
		}

		public int getIterations() {
			return iters;
		}

		public double getRelativeResidual() {
			return relResidual;
		}

		@Override
		public String toString() {
			return (converged ? "converged" : "not converged") + " after " + iters + " iterations, relative residual "
					+ relResidual + (breakdown != null ? " (" + breakdown + ")" : "");
		}
	}

	private final double tol;
	private final int maxIters;
	private final PreconditionerType preconditionerType;

	public ConjugateGradientSolver() {
		this(1e-10, 10_000, PreconditionerType.JACOBI);
	}

	public ConjugateGradientSolver(double tol, int maxIters, PreconditionerType preconditionerType) {
		if (tol <= 0.0 || maxIters <= 0) {
			throw new IllegalArgumentException("tol and maxIters must be positive");
		}
		this.tol = tol;
		this.maxIters = maxIters;
		this.preconditionerType = preconditionerType;
	}

	@Override
	public SolveResult factorizeAndSolve(DMatrixSparseCSC a, double[] b) {
		SpdSolver.checkDimensions(a, b);
		SparseCSR csr = SparseCSR.fromCSC(a);
		Preconditioner precond;
		switch (preconditionerType) {
			case JACOBI:
				precond = Jacobi.fromCSR(csr);
				break;
			case SSOR:
				precond = new SSOR(csr, 1.25);
				break;
			default:
				precond = null;
		}
		double[] x = new double[b.length];
		Result res = solve(csr, b, x, tol, maxIters, precond);
		if (!res.converged) {
			return SolveResult.failed("CG " + res);
		}
		return SolveResult.solved(x, "CG " + res);
	}

	@Override
	public String getName() {
		return "cg";
	}

	public static Result solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {

		final int n = A.n;
		Result res = new Result();

		double[] r = new double[n];
		double[] z = new double[n];
		double[] p = new double[n];
		double[] Ap = new double[n];

		// r = b - A*x
		A.matVec(x, Ap);
		for (int i = 0; i < n; i++) {
			r[i] = b[i] - Ap[i];
		}

		double bnorm = norm2(b);
		if (bnorm == 0.0) {
			Arrays.fill(x, 0.0);
			res.converged = true;
			res.iters = 0;
			res.relResidual = 0.0;
			return res;
		}

		double rnorm = norm2(r);
		if (rnorm / bnorm <= tol) {
			res.converged = true;
			res.iters = 0;
			res.relResidual = rnorm / bnorm;
			return res;
		}

		applyPreconditioner(precond, r, z);
		System.arraycopy(z, 0, p, 0, n);
		double rz = dot(r, z);

		for (int k = 1; k <= maxIters; k++) {

			A.matVec(p, Ap);
			double pAp = dot(p, Ap);
			if (!finite(pAp) || pAp <= 0.0) {
				// A (or M) is not positive definite along p
				res.breakdown = "curvature breakdown (p'Ap=" + pAp + ")";
				res.iters = k;
				break;
			}
			double alpha = rz / pAp;

			for (int i = 0; i < n; i++) {
				x[i] += alpha * p[i];
				r[i] -= alpha * Ap[i];
			}

			rnorm = norm2(r);
			if (rnorm / bnorm <= tol) {
				res.converged = true;
				res.iters = k;
				res.relResidual = rnorm / bnorm;
				return res;
			}

			applyPreconditioner(precond, r, z);
			double rzNew = dot(r, z);
			if (!finite(rzNew) || Math.abs(rz) < 1e-300) {
				res.breakdown = "rho breakdown";
				res.iters = k;
				break;
			}
			double beta = rzNew / rz;
			for (int i = 0; i < n; i++) {
				p[i] = z[i] + beta * p[i];
			}
			rz = rzNew;
			res.iters = k;
		}

		res.converged = false;
		res.relResidual = norm2(r) / Math.max(bnorm, 1e-300);
		return res;
	}

	private static void applyPreconditioner(Preconditioner precond, double[] r, double[] z) {
		if (precond != null) {
			precond.apply(r, z);
		} else {
			System.arraycopy(r, 0, z, 0, r.length);
		}
	}

	static double dot(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	static double norm2(double[] a) {
		double s = 0.0;
		for (double v : a) {
			s += v * v;
		}
		return Math.sqrt(s);
	}

	static boolean finite(double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}
}

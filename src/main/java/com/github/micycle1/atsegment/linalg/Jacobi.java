package com.github.micycle1.atsegment.linalg;

public final class Jacobi implements Preconditioner {
	private final int n;
	private final double[] Minv; // Minv[i] = 1 / A[i,i]

	private Jacobi(int n, double[] Minv) {
		this.n = n;
		this.Minv = Minv;
	}

	// Build from CSR by scanning the diagonal
	public static Jacobi fromCSR(SparseCSR a) {
		return fromDiagonal(a.diagonal());
	}

	// Build from an explicit diagonal vector
	public static Jacobi fromDiagonal(double[] diag) {
		int n = diag.length;
		double[] Minv = new double[n];
		final double eps = 1e-14;
		for (int i = 0; i < n; i++) {
			double d = diag[i];
			Minv[i] = Math.abs(d) < eps ? 1.0 : 1.0 / d; // fallback on missing diagonal
		}
		return new Jacobi(n, Minv);
	}

	@Override
	public void apply(double[] r, double[] z) {
		for (int i = 0; i < n; i++) {
			z[i] = Minv[i] * r[i];
		}
	}
}

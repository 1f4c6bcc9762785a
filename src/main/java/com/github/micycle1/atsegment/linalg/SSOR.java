package com.github.micycle1.atsegment.linalg;

/**
 * Symmetric successive over-relaxation. For a symmetric A the resulting M is
 * symmetric, so it is a valid conjugate gradient preconditioner.
 */
public class SSOR implements Preconditioner {
	final int n;
	final int[] rp, ci;
	final double[] a;
	final double[] Dinv;
	final double omega; // in (0, 2), e.g. 1.25

	public SSOR(SparseCSR m, double omega) {
		if (omega <= 0.0 || omega >= 2.0) {
			throw new IllegalArgumentException("SSOR relaxation must lie in (0,2), got " + omega);
		}
		this.n = m.n;
		this.rp = m.rowPtr;
		this.ci = m.colIdx;
		this.a = m.val;
		this.omega = omega;
		this.Dinv = new double[n];
		double[] d = m.diagonal();
		for (int i = 0; i < n; i++) {
			double di = d[i];
			if (Math.abs(di) < 1e-14) {
				di = (di >= 0 ? 1e-14 : -1e-14);
			}
			Dinv[i] = 1.0 / di;
		}
	}

	// z = M^{-1} r with M = w/(2-w) (D/w + L) D^{-1} (D/w + U)
	@Override
	public void apply(double[] r, double[] z) {
		double[] y = z; // reuse output buffer
		// Forward: (D/w + L) y = r
		for (int i = 0; i < n; i++) {
			double sum = r[i];
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j < i) {
					sum -= a[p] * y[j];
				}
			}
			y[i] = sum * (omega * Dinv[i]);
		}
		// y = D y
		for (int i = 0; i < n; i++) {
			y[i] /= Dinv[i];
		}
		// Backward: (D/w + U) z = y
		for (int i = n - 1; i >= 0; i--) {
			double sum = y[i];
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j > i) {
					sum -= a[p] * z[j];
				}
			}
			z[i] = sum * (omega * Dinv[i]);
		}
		double scale = 2.0 - omega;
		for (int i = 0; i < n; i++) {
			z[i] *= scale / omega;
		}
	}
}

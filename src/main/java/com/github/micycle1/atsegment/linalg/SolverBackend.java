package com.github.micycle1.atsegment.linalg;

import java.util.Locale;

/**
 * The available {@link SpdSolver} implementations, selectable by name.
 */
public enum SolverBackend {

	/** EJML sparse Cholesky. */
	CHOLESKY {
		@Override
		public SpdSolver create() {
			return new CholeskySolver();
		}
	},
	/** ojAlgo sparse LU. */
	LU {
		@Override
		public SpdSolver create() {
			return new SparseLUSolver();
		}
	},
	/** Jacobi preconditioned conjugate gradient. */
	CG {
		@Override
		public SpdSolver create() {
			return new ConjugateGradientSolver();
		}
	};

	public abstract SpdSolver create();

	/**
	 * @throws IllegalArgumentException for an unknown name
	 */
	public static SolverBackend fromName(String name) {
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown solver '" + name + "', expected one of cholesky, lu, cg", e);
		}
	}
}

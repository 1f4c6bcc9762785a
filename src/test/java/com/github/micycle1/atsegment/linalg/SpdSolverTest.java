package com.github.micycle1.atsegment.linalg;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class SpdSolverTest {

	// 1D Laplacian + shift: tridiagonal, SPD
	private static DMatrixSparseCSC shiftedLaplacian(int n, double shift) {
		DMatrixSparseTriplet t = new DMatrixSparseTriplet(n, n, 3 * n);
		for (int i = 0; i < n; i++) {
			t.addItem(i, i, 2.0 + shift);
			if (i > 0) {
				t.addItem(i, i - 1, -1.0);
			}
			if (i < n - 1) {
				t.addItem(i, i + 1, -1.0);
			}
		}
		return DConvertMatrixStruct.convert(t, (DMatrixSparseCSC) null);
	}

	private static double[] multiply(DMatrixSparseCSC a, double[] x) {
		double[] y = new double[a.numRows];
		for (int col = 0; col < a.numCols; col++) {
			for (int p = a.col_idx[col]; p < a.col_idx[col + 1]; p++) {
				y[a.nz_rows[p]] += a.nz_values[p] * x[col];
			}
		}
		return y;
	}

	@ParameterizedTest
	@EnumSource(SolverBackend.class)
	public void solvesShiftedLaplacian(SolverBackend backend) {
		int n = 40;
		DMatrixSparseCSC a = shiftedLaplacian(n, 0.1);
		Random rnd = new Random(3);
		double[] expected = new double[n];
		for (int i = 0; i < n; i++) {
			expected[i] = rnd.nextDouble() - 0.5;
		}
		double[] b = multiply(a, expected);
		double[] bCopy = b.clone();

		SpdSolver solver = backend.create();
		SolveResult r = solver.factorizeAndSolve(a, b);
		assertTrue(r.isSolved(), backend + ": " + r);
		assertArrayEquals(expected, r.getSolution(), 1e-7);
		assertArrayEquals(bCopy, b, 0.0, "rhs must not be modified");
		assertEquals(2.0 + 0.1, a.get(0, 0), 0.0, "matrix must not be modified");
	}

	@Test
	public void testCholeskyReportsIndefiniteMatrix() {
		DMatrixSparseCSC a = shiftedLaplacian(5, -5.0); // negative diagonal
		SolveResult r = new CholeskySolver().factorizeAndSolve(a, new double[5]);
		assertFalse(r.isSolved());
		assertNotNull(r.getStatus());
		assertThrows(LinearSolveFailedException.class, r::getSolution);
	}

	@Test
	public void testConjugateGradientReportsIndefiniteMatrix() {
		DMatrixSparseCSC a = shiftedLaplacian(5, -5.0);
		double[] b = { 1, 1, 1, 1, 1 };
		SolveResult r = new ConjugateGradientSolver(1e-10, 100, ConjugateGradientSolver.PreconditionerType.NONE)
				.factorizeAndSolve(a, b);
		assertFalse(r.isSolved(), r.toString());
	}

	@Test
	public void testSsorPreconditionedConjugateGradient() {
		DMatrixSparseCSC a = shiftedLaplacian(60, 0.01);
		double[] b = new double[60];
		b[0] = 1.0;
		b[59] = -2.0;
		SolveResult r = new ConjugateGradientSolver(1e-12, 500, ConjugateGradientSolver.PreconditionerType.SSOR)
				.factorizeAndSolve(a, b);
		assertTrue(r.isSolved(), r.toString());
		assertArrayEquals(b, multiply(a, r.getSolution()), 1e-9);
	}

	@Test
	public void testZeroRightHandSide() {
		SolveResult r = new ConjugateGradientSolver().factorizeAndSolve(shiftedLaplacian(4, 1.0), new double[4]);
		assertTrue(r.isSolved());
		assertArrayEquals(new double[4], r.getSolution(), 0.0);
	}

	@Test
	public void testDimensionMismatch() {
		DMatrixSparseCSC a = shiftedLaplacian(4, 1.0);
		for (SolverBackend backend : SolverBackend.values()) {
			assertThrows(IllegalArgumentException.class, () -> backend.create().factorizeAndSolve(a, new double[3]));
		}
	}

	@Test
	public void testNonFiniteSolutionIsFailure() {
		SolveResult r = SolveResult.solved(new double[] { 1.0, Double.NaN }, "OK");
		assertFalse(r.isSolved());
	}

	@Test
	public void testBackendNames() {
		assertEquals(SolverBackend.CG, SolverBackend.fromName(" cg "));
		assertEquals(SolverBackend.CHOLESKY, SolverBackend.fromName("Cholesky"));
		assertEquals("lu", SolverBackend.LU.create().getName());
		assertThrows(IllegalArgumentException.class, () -> SolverBackend.fromName("qr"));
	}
}

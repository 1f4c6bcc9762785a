package com.github.micycle1.atsegment.calculus;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class GridCalculusTest {

	private static final double TOL = 1e-12;

	private GridComplex complex;
	private GridCalculus calculus;

	@BeforeEach
	public void setUp() {
		complex = new GridComplex(5, 4);
		calculus = new GridCalculus(complex);
	}

	@Test
	public void testOperatorDimensions() {
		int nv = complex.getCellCount(0), ne = complex.getCellCount(1), nf = complex.getCellCount(2);
		Operator d0 = calculus.derivative(0, Duality.PRIMAL);
		assertEquals(ne, d0.rows());
		assertEquals(nv, d0.cols());
		Operator d1 = calculus.derivative(1, Duality.PRIMAL);
		assertEquals(nf, d1.rows());
		assertEquals(ne, d1.cols());
		Operator dd0 = calculus.derivative(0, Duality.DUAL);
		assertEquals(ne, dd0.rows());
		assertEquals(nf, dd0.cols());
		Operator dd1 = calculus.derivative(1, Duality.DUAL);
		assertEquals(nv, dd1.rows());
		assertEquals(ne, dd1.cols());
		assertEquals(FormSpace.dual(2), dd1.getTarget());
		assertEquals(FormSpace.primal(0), calculus.hodge(2, Duality.DUAL).getTarget());
		assertThrows(IllegalArgumentException.class, () -> calculus.derivative(2, Duality.PRIMAL));
	}

	@Test
	public void testGradientOfRampIsConstantAlongX() {
		Form u = calculus.zeros(FormSpace.primal(0));
		for (int y = 0; y < complex.getHeight(); y++) {
			for (int x = 0; x < complex.getWidth(); x++) {
				u.set(complex.vertexIndex(x, y), 0.25 * x);
			}
		}
		Form w = calculus.derivative(0, Duality.PRIMAL).apply(u);
		for (int e = 0; e < w.size(); e++) {
			assertEquals(complex.isHorizontalEdge(e) ? 0.25 : 0.0, w.get(e), TOL);
		}
	}

	@ParameterizedTest
	@EnumSource(Duality.class)
	public void derivativeSquaredIsZero(Duality duality) {
		Operator dd = calculus.derivative(1, duality).compose(calculus.derivative(0, duality));
		Random rnd = new Random(7);
		Form f = calculus.zeros(calculus.derivative(0, duality).getSource());
		for (int i = 0; i < f.size(); i++) {
			f.set(i, rnd.nextGaussian());
		}
		Form out = dd.apply(f);
		for (int i = 0; i < out.size(); i++) {
			assertEquals(0.0, out.get(i), TOL);
		}
	}

	@Test
	public void testHodgeStarSquared() {
		for (int k = 0; k <= 2; k++) {
			Operator starStar = calculus.hodge(2 - k, Duality.DUAL).compose(calculus.hodge(k, Duality.PRIMAL));
			double expected = (k * (2 - k)) % 2 == 0 ? 1.0 : -1.0;
			for (int i = 0; i < starStar.rows(); i++) {
				assertEquals(expected, starStar.get(i, i), TOL, "k=" + k);
			}
		}
	}

	@Test
	public void testCodifferentialIsNegativeAdjoint() {
		Operator d0 = calculus.derivative(0, Duality.PRIMAL);
		Operator codiff = calculus.hodge(2, Duality.DUAL).compose(calculus.derivative(1, Duality.DUAL))
				.compose(calculus.hodge(1, Duality.PRIMAL));
		Operator d0t = d0.transpose();
		for (int r = 0; r < d0t.rows(); r++) {
			for (int c = 0; c < d0t.cols(); c++) {
				assertEquals(d0t.get(r, c), -codiff.get(r, c), TOL);
			}
		}
	}

	@Test
	public void testComposeRejectsMismatchedSpaces() {
		Operator d0 = calculus.derivative(0, Duality.PRIMAL);
		assertThrows(IllegalArgumentException.class, () -> d0.compose(d0));
		assertThrows(IllegalArgumentException.class, () -> d0.apply(calculus.zeros(FormSpace.primal(1))));
		assertThrows(IllegalArgumentException.class, () -> calculus.identity(0, Duality.PRIMAL).plus(calculus.identity(1, Duality.PRIMAL)));
	}

	@Test
	public void testIdentityAndDiagonal() {
		Form f = calculus.constant(FormSpace.primal(1), 3.0);
		Form out = calculus.identity(1, Duality.PRIMAL).apply(f);
		assertArrayEquals(f.values(), out.values(), TOL);

		double[] d = new double[f.size()];
		for (int i = 0; i < d.length; i++) {
			d[i] = i;
		}
		Form scaled = calculus.diagonal(FormSpace.primal(1), d).apply(f);
		for (int i = 0; i < d.length; i++) {
			assertEquals(3.0 * i, scaled.get(i), TOL);
		}
		assertThrows(IllegalArgumentException.class, () -> calculus.diagonal(FormSpace.primal(0), d));
	}
}

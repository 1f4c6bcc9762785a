package com.github.micycle1.atsegment;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.atsegment.calculus.Duality;
import com.github.micycle1.atsegment.calculus.Form;
import com.github.micycle1.atsegment.calculus.FormSpace;
import com.github.micycle1.atsegment.calculus.GridCalculus;
import com.github.micycle1.atsegment.calculus.GridComplex;
import com.github.micycle1.atsegment.calculus.Operator;
import com.github.micycle1.atsegment.linalg.CholeskySolver;

public class OperatorAssemblerTest {

	private static final double TOL = 1e-12;

	private GridComplex complex;
	private GridCalculus calculus;
	private OperatorAssembler assembler;
	private final Random rnd = new Random(11);

	@BeforeEach
	public void setUp() {
		complex = new GridComplex(5, 4);
		calculus = new GridCalculus(complex);
		assembler = new OperatorAssembler(OperatorBundle.build(calculus));
	}

	private Form random(FormSpace space) {
		Form f = calculus.zeros(space);
		for (int i = 0; i < f.size(); i++) {
			f.set(i, rnd.nextDouble());
		}
		return f;
	}

	@Test
	public void testEdgeLaplacianIsHodgeLaplacian() {
		Operator d0 = calculus.derivative(0, Duality.PRIMAL);
		Operator d1 = calculus.derivative(1, Duality.PRIMAL);
		Operator expected = d0.compose(d0.transpose()).plus(d1.transpose().compose(d1));
		Operator actual = assembler.getOperators().edgeLaplacian;
		for (int r = 0; r < expected.rows(); r++) {
			for (int c = 0; c < expected.cols(); c++) {
				assertEquals(expected.get(r, c), actual.get(r, c), TOL);
			}
		}
	}

	@Test
	public void testUOperatorIsSymmetricPositiveDefinite() {
		Form v = random(FormSpace.primal(1));
		Operator a = assembler.uOperator(v, 0.7, 0.5);
		assertTrue(a.isSymmetric(TOL));
		for (int trial = 0; trial < 5; trial++) {
			Form x = random(FormSpace.primal(0));
			assertTrue(x.dot(a.apply(x)) > 0.0);
		}
		assertTrue(new CholeskySolver().factorizeAndSolve(a.matrix(), new double[a.rows()]).isSolved());
	}

	@Test
	public void testVOperatorIsSymmetricPositiveDefinite() {
		Form w = random(FormSpace.primal(1));
		Operator b = assembler.vOperator(assembler.edgeSystem(assembler.edgeOperator(0.05), 0.05, 0.5, 1.0), w, 1.0);
		assertTrue(b.isSymmetric(TOL));
		assertTrue(new CholeskySolver().factorizeAndSolve(b.matrix(), new double[b.rows()]).isSolved());
	}

	@Test
	public void testUOperatorWithUnitEdgesOnConstantField() {
		// D0 of a constant vanishes, only the fidelity mass remains
		Form v = calculus.constant(FormSpace.primal(1), 1.0);
		Form c = calculus.constant(FormSpace.primal(0), 0.4);
		Form out = assembler.uOperator(v, 2.0, 0.5).apply(c);
		for (int i = 0; i < out.size(); i++) {
			assertEquals(2.0 * 0.25 * 0.4, out.get(i), TOL);
		}
	}

	@Test
	public void testVSystemWithoutGradientReducesToEdgeTerms() {
		double lambda = 0.1, eps = 0.5, h = 2.0;
		Form u = calculus.constant(FormSpace.primal(0), 0.3);
		Form w = assembler.gradient(u);
		for (int i = 0; i < w.size(); i++) {
			assertEquals(0.0, w.get(i), 0.0);
		}
		Operator lambdaEdge = assembler.edgeOperator(lambda);
		Operator b = assembler.vOperator(assembler.edgeSystem(lambdaEdge, lambda, eps, h), w, h);
		Operator expected = lambdaEdge.times(eps * h).plus(h * lambda / (4 * eps), calculus.identity(1, Duality.PRIMAL));
		for (int r = 0; r < b.rows(); r++) {
			for (int c = 0; c < b.cols(); c++) {
				assertEquals(expected.get(r, c), b.get(r, c), TOL);
			}
		}
		Form rhs = assembler.vRightHandSide(lambda, eps, h);
		for (int i = 0; i < rhs.size(); i++) {
			assertEquals((h / eps) * (lambda / 4), rhs.get(i), TOL);
		}
	}

	@Test
	public void testEdgeSystemIsReusedAcrossGradients() {
		double lambda = 0.2, eps = 0.25, h = 0.5;
		Operator edgeSystem = assembler.edgeSystem(assembler.edgeOperator(lambda), lambda, eps, h);
		double[] before = edgeSystem.matrix().nz_values.clone();

		for (int trial = 0; trial < 3; trial++) {
			Form w = random(FormSpace.primal(1));
			Operator b = assembler.vOperator(edgeSystem, w, h);
			for (int r = 0; r < b.rows(); r++) {
				for (int c = 0; c < b.cols(); c++) {
					double diag = r == c ? h * w.get(r) * w.get(r) : 0.0;
					assertEquals(edgeSystem.get(r, c) + diag, b.get(r, c), TOL);
				}
			}
		}
		assertArrayEquals(before, edgeSystem.matrix().nz_values);
	}

	@Test
	public void testDiffusionQuadraticFormMatchesWeightedGradient() {
		Form u = random(FormSpace.primal(0));
		Form v = random(FormSpace.primal(1));
		Form w = assembler.gradient(u);
		double expected = 0.0;
		for (int e = 0; e < w.size(); e++) {
			expected += v.get(e) * v.get(e) * w.get(e) * w.get(e);
		}
		assertEquals(expected, u.dot(assembler.diffusionOperator(v).apply(u)), 1e-10);
	}
}

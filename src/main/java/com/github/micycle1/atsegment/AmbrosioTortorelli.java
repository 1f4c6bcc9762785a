package com.github.micycle1.atsegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.atsegment.AnnealingOutcome.Status;
import com.github.micycle1.atsegment.calculus.Form;
import com.github.micycle1.atsegment.calculus.FormSpace;
import com.github.micycle1.atsegment.calculus.GridCalculus;
import com.github.micycle1.atsegment.calculus.GridComplex;
import com.github.micycle1.atsegment.calculus.Operator;
import com.github.micycle1.atsegment.image.GrayImage;
import com.github.micycle1.atsegment.image.ImageFieldMapper;
import com.github.micycle1.atsegment.linalg.LinearSolveFailedException;
import com.github.micycle1.atsegment.linalg.SolveResult;
import com.github.micycle1.atsegment.linalg.SolverBackend;
import com.github.micycle1.atsegment.linalg.SpdSolver;

/**
 * <p>
 * Alternating minimization of the Ambrosio-Tortorelli functional
 * </p>
 *
 * <pre>
 *  /
 *  | a.(u-g)^2 + v^2 |grad u|^2 + le.|grad v|^2 + (l/4e).(1-v)^2
 *  /
 * </pre>
 * <p>
 * over a gray image g, producing a piecewise-smooth reconstruction u (one value
 * per pixel) and an edge indicator v (one value per pixel adjacency, 0 on edges
 * and 1 in smooth regions).
 * </p>
 *
 * <p>
 * Three nested loops:
 * </p>
 * <ol>
 * <li>lambda runs from {@code lambda1} down to {@code lambda2}, divided by
 * {@code lambdaRatio} each time;</li>
 * <li>for each lambda, epsilon is annealed from {@code epsilon} by successive
 * halving (at most {@value #MAX_ANNEALING_STEPS} values, stopping once
 * {@code eps/2 < h^2});</li>
 * <li>for each (lambda, epsilon), u and v are solved for alternately until v
 * moves by less than {@value #CONVERGENCE_TOLERANCE} in sup-norm or
 * {@code maxIterations} is reached.</li>
 * </ol>
 * <p>
 * u and v carry over from one configuration to the next. After each lambda the
 * energies are evaluated and a {@link LambdaStep} snapshot is handed to the
 * listener.
 * </p>
 *
 * <p>
 * A failed linear solve abandons the current (lambda, epsilon) configuration:
 * the failed result is dropped, the outcome is recorded as
 * {@link Status#FAILED} and annealing moves on. With {@link Params#failFast}
 * a {@link LinearSolveFailedException} is thrown instead.
 * </p>
 *
 * <p>
 * The class is not thread-safe; one instance runs one image.
 * </p>
 */
public class AmbrosioTortorelli {

	private static final Logger log = LoggerFactory.getLogger(AmbrosioTortorelli.class);

	/** Sup-norm change of v below which coordinate descent stops. */
	public static final double CONVERGENCE_TOLERANCE = 1e-4;
	/** Maximum number of epsilon values per lambda. */
	public static final int MAX_ANNEALING_STEPS = 5;
	private static final double EPSILON_DIVISOR = 2.0;

	/**
	 * User-tunable parameters. Defaults match the command line defaults.
	 */
	public static final class Params {
		/** Fidelity weight a. */
		public double alpha = 1.0;
		/** Initial (largest) edge width e. */
		public double epsilon = 1.0;
		/** First lambda of the schedule. */
		public double lambda1 = 0.3125;
		/** Last lambda of the schedule (inclusive bound). */
		public double lambda2 = 0.00005;
		/** lambda is divided by this after each value. */
		public double lambdaRatio = Math.sqrt(2.0);
		/** Grid step h. */
		public double gridStep = 1.0;
		/** Maximum u/v iterations per (lambda, epsilon). */
		public int maxIterations = 10;
		public SolverBackend solver = SolverBackend.CHOLESKY;
		/** Clamp v into [0,1] after each solve; off in the reference computation. */
		public boolean clampEdgeField = false;
		/** Throw on the first failed solve instead of abandoning the configuration. */
		public boolean failFast = false;

		/** Runs the schedule for a single lambda value. */
		public Params singleLambda(double lambda) {
			lambda1 = lambda;
			lambda2 = lambda;
			return this;
		}

		/**
		 * Applies the lenient corrections (lambda2 capped at lambda1, a ratio not
		 * above 1 replaced by sqrt(2)) and rejects values no schedule can run with.
		 *
		 * @return this
		 * @throws IllegalArgumentException on non-positive or non-finite parameters
		 */
		public Params sanitize() {
			requirePositive(alpha, "alpha");
			requirePositive(epsilon, "epsilon");
			requirePositive(gridStep, "gridStep");
			requirePositive(lambda1, "lambda1");
			requirePositive(lambda2, "lambda2");
			if (maxIterations < 0) {
				throw new IllegalArgumentException("maxIterations must be >= 0, got " + maxIterations);
			}
			Objects.requireNonNull(solver, "solver must not be null");
			if (lambda2 > lambda1) {
				lambda2 = lambda1;
			}
			if (!(lambdaRatio > 1.0) || !Double.isFinite(lambdaRatio)) {
				lambdaRatio = Math.sqrt(2.0);
			}
			return this;
		}

		private static void requirePositive(double value, String name) {
			if (!(value > 0.0) || !Double.isFinite(value)) {
				throw new IllegalArgumentException(name + " must be positive and finite, got " + value);
			}
		}

		@Override
		public String toString() {
			return "Params{alpha=" + alpha + ", epsilon=" + epsilon + ", lambda1=" + lambda1 + ", lambda2=" + lambda2
					+ ", lambdaRatio=" + lambdaRatio + ", gridStep=" + gridStep + ", maxIterations=" + maxIterations
					+ ", solver=" + solver + ", clampEdgeField=" + clampEdgeField + ", failFast=" + failFast + "}";
		}
	}

	private final Params params;
	private final GridComplex complex;
	private final OperatorAssembler assembler;
	private final EnergyReporter energyReporter;
	private final SpdSolver solver;

	// fixed input
	private final Form g;

	// working state, overwritten in place across all loops
	private final Form u;
	private final Form v;

	public AmbrosioTortorelli(GrayImage image, Params params) {
		this(new GridComplex(image.getWidth(), image.getHeight()), image, params);
	}

	private AmbrosioTortorelli(GridComplex complex, GrayImage image, Params params) {
		this(complex, new ImageFieldMapper(complex).toNormalizedForm(image), params, params.solver.create());
	}

	/**
	 * @param complex pixel grid
	 * @param g       normalized input intensities, a primal 0-form on the grid
	 * @param params  parameters; sanitized in place
	 * @param solver  SPD solve capability used for both systems
	 */
	public AmbrosioTortorelli(GridComplex complex, Form g, Params params, SpdSolver solver) {
		this.complex = Objects.requireNonNull(complex, "complex must not be null");
		this.params = Objects.requireNonNull(params, "params must not be null").sanitize();
		this.solver = Objects.requireNonNull(solver, "solver must not be null");
		Objects.requireNonNull(g, "g must not be null");
		if (complex.getCellCount(1) == 0) {
			throw new IllegalArgumentException("Image needs at least two pixels: " + complex);
		}
		if (!g.getSpace().equals(FormSpace.primal(0)) || g.size() != complex.getCellCount(0)) {
			throw new IllegalArgumentException("g must be a primal 0-form on " + complex + ", got " + g);
		}
		this.g = g.copy();

		log.info("Creating calculus: {}", complex);
		GridCalculus calculus = new GridCalculus(complex);
		log.info("Building AT functionals");
		OperatorBundle ops = OperatorBundle.build(calculus);
		this.assembler = new OperatorAssembler(ops);
		this.energyReporter = new EnergyReporter(assembler, params.alpha, params.gridStep);

		this.u = this.g.scale(params.alpha);
		this.v = calculus.constant(FormSpace.primal(1), 1.0);
	}

	public Params getParams() {
		return params;
	}

	public GridComplex getComplex() {
		return complex;
	}

	public Form getInput() {
		return g;
	}

	/** Current reconstruction (live view). */
	public Form getU() {
		return u;
	}

	/** Current edge indicator (live view). */
	public Form getV() {
		return v;
	}

	/**
	 * lambda1, lambda1/r, lambda1/r^2, ... while the value stays {@code >=
	 * lambda2}.
	 */
	public static List<Double> lambdaSchedule(double lambda1, double lambda2, double ratio) {
		List<Double> schedule = new ArrayList<>();
		double l = lambda1;
		while (l >= lambda2) {
			schedule.add(l);
			l /= ratio;
		}
		return schedule;
	}

	/**
	 * Epsilon values one lambda value anneals through: start at {@code eps0},
	 * halve, and stop after the first value whose half is below {@code h^2}, with
	 * at most {@value #MAX_ANNEALING_STEPS} values.
	 */
	public static List<Double> epsilonSchedule(double eps0, double h) {
		List<Double> schedule = new ArrayList<>();
		double eps = EPSILON_DIVISOR * eps0;
		for (int k = 0; k < MAX_ANNEALING_STEPS; k++) {
			eps /= EPSILON_DIVISOR;
			schedule.add(eps);
			if (eps / EPSILON_DIVISOR < h * h) {
				break;
			}
		}
		return schedule;
	}

	public List<LambdaStep> run() {
		return run(step -> {
		});
	}

	/**
	 * Runs the whole lambda schedule.
	 *
	 * @param listener called once per lambda value, in schedule order
	 * @return the same steps, in order
	 * @throws LinearSolveFailedException only when {@link Params#failFast} is set
	 */
	public List<LambdaStep> run(LambdaStepListener listener) {
		Objects.requireNonNull(listener, "listener must not be null");
		log.info("Running with {}", params);
		List<LambdaStep> steps = new ArrayList<>();
		final double h = params.gridStep;
		final List<Double> epsilons = epsilonSchedule(params.epsilon, h);
		int index = 0;
		for (double lambda : lambdaSchedule(params.lambda1, params.lambda2, params.lambdaRatio)) {
			log.info("************ lambda = {} **************", lambda);
			Operator lambdaEdge = assembler.edgeOperator(lambda);

			List<AnnealingOutcome> outcomes = new ArrayList<>();
			for (int k = 0; k < epsilons.size(); k++) {
				double eps = epsilons.get(k);
				Operator edgeSystem = assembler.edgeSystem(lambdaEdge, lambda, eps, h);
				outcomes.add(coordinateDescent(lambda, eps, edgeSystem, k));
			}

			double lastEps = epsilons.get(epsilons.size() - 1);
			Energies energies = energyReporter.compute(u, v, g, lambda, lastEps);
			log.info("Energies for lambda = {}: {}", lambda, energies);
			LambdaStep step = new LambdaStep(index++, lambda, lastEps, u.copy(), v.copy(), energies, outcomes);
			steps.add(step);
			listener.onLambdaStep(step);
		}
		return steps;
	}

	/**
	 * Alternating u/v solves for a fixed (lambda, epsilon), updating u and v in
	 * place.
	 */
	AnnealingOutcome coordinateDescent(double lambda, double eps, Operator edgeSystem, int annealingStep) {
		final double alpha = params.alpha;
		final double h = params.gridStep;
		final int n = params.maxIterations;
		final Form uRhs = assembler.uRightHandSide(g, alpha, h);
		final Form vRhs = assembler.vRightHandSide(lambda, eps, h);

		double variation = Double.NaN;
		for (int i = 0; i < n; i++) {
			log.debug("------ Iteration {}:{}/{} (eps = {}) ------", annealingStep, i, n, eps);

			Operator av2a = assembler.uOperator(v, alpha, h);
			SolveResult ru = solver.factorizeAndSolve(av2a.matrix(), uRhs.values());
			log.debug("Solving Av2A u = ag: {}", ru);
			if (!ru.isSolved()) {
				return failed(lambda, eps, i, variation, "u-system: " + ru.getStatus());
			}
			System.arraycopy(ru.getSolution(), 0, u.values(), 0, u.size());

			Form w = assembler.gradient(u);
			Operator bb = assembler.vOperator(edgeSystem, w, h);
			SolveResult rv = solver.factorizeAndSolve(bb.matrix(), vRhs.values());
			log.debug("Solving (BB+Mw2) v = l_4e: {}", rv);
			if (!rv.isSolved()) {
				return failed(lambda, eps, i, variation, "v-system: " + rv.getStatus());
			}
			double[] next = rv.getSolution();
			if (params.clampEdgeField) {
				for (int j = 0; j < next.length; j++) {
					next[j] = Math.max(0.0, Math.min(1.0, next[j]));
				}
			}
			double[] current = v.values();
			variation = 0.0;
			for (int j = 0; j < next.length; j++) {
				variation = Math.max(variation, Math.abs(next[j] - current[j]));
			}
			System.arraycopy(next, 0, current, 0, next.length);
			log.info("Variation |v^k+1 - v^k|_oo = {}", variation);

			if (variation < CONVERGENCE_TOLERANCE) {
				return new AnnealingOutcome(lambda, eps, i + 1, variation, Status.CONVERGED, null);
			}
		}
		return new AnnealingOutcome(lambda, eps, n, variation, Status.MAX_ITERATIONS, null);
	}

	private AnnealingOutcome failed(double lambda, double eps, int iterations, double variation, String reason) {
		if (params.failFast) {
			throw new LinearSolveFailedException(
					"Linear solve failed for lambda=" + lambda + ", eps=" + eps + " (" + solver.getName() + "): " + reason);
		}
		log.warn("Abandoning lambda={} eps={} after {} iterations: {}", lambda, eps, iterations, reason);
		return new AnnealingOutcome(lambda, eps, iterations, variation, Status.FAILED, reason);
	}
}

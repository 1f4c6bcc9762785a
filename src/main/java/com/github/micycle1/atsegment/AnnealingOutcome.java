package com.github.micycle1.atsegment;

/**
 * How the coordinate descent for one (lambda, epsilon) pair ended.
 */
public final class AnnealingOutcome {

	public enum Status {
		/** sup-norm change of v dropped below the tolerance */
		CONVERGED,
		/** iteration cap reached without convergence */
		MAX_ITERATIONS,
		/** a linear solve failed; the configuration was abandoned */
		FAILED
	}

	private final double lambda;
	private final double epsilon;
	private final int iterations;
	private final double lastVariation;
	private final Status status;
	private final String failureReason;

	AnnealingOutcome(double lambda, double epsilon, int iterations, double lastVariation, Status status,
			String failureReason) {
		this.lambda = lambda;
		this.epsilon = epsilon;
		this.iterations = iterations;
		this.lastVariation = lastVariation;
		this.status = status;
		this.failureReason = failureReason;
	}

	public double getLambda() {
		return lambda;
	}

	public double getEpsilon() {
		return epsilon;
	}

	/** Completed u/v iterations. */
	public int getIterations() {
		return iterations;
	}

	/** |v^(k+1) - v^k|_oo of the last completed iteration; NaN if none completed. */
	public double getLastVariation() {
		return lastVariation;
	}

	public Status getStatus() {
		return status;
	}

	/** Null unless {@link Status#FAILED}. */
	public String getFailureReason() {
		return failureReason;
	}

	@Override
	public String toString() {
		return "AnnealingOutcome{lambda=" + lambda + ", eps=" + epsilon + ", " + status + " after " + iterations
				+ " iterations, variation=" + lastVariation + (failureReason != null ? ", reason=" + failureReason : "")
				+ "}";
	}
}

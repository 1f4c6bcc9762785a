package com.github.micycle1.atsegment.linalg;

import java.util.Objects;

/**
 * Outcome of one {@link SpdSolver} call: either a solution vector with a status
 * description, or a failure reason.
 */
public final class SolveResult {

	private final double[] solution; // null when failed
	private final String status;

	private SolveResult(double[] solution, String status) {
		this.solution = solution;
		this.status = status;
	}

	public static SolveResult solved(double[] solution, String status) {
		Objects.requireNonNull(solution, "solution must not be null");
		for (double v : solution) {
			if (!Double.isFinite(v)) {
				return failed("non-finite value in solution (" + status + ")");
			}
		}
		return new SolveResult(solution, status);
	}

	public static SolveResult failed(String reason) {
		return new SolveResult(null, Objects.requireNonNull(reason, "reason must not be null"));
	}

	public boolean isSolved() {
		return solution != null;
	}

	/**
	 * @throws LinearSolveFailedException if the solve failed
	 */
	public double[] getSolution() {
		if (solution == null) {
			throw new LinearSolveFailedException(status);
		}
		return solution;
	}

	/** Solver status when solved, failure reason otherwise. */
	public String getStatus() {
		return status;
	}

	@Override
	public String toString() {
		return (isSolved() ? "Solved(" : "Failed(") + status + ")";
	}
}

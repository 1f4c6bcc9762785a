package com.github.micycle1.atsegment.linalg;

/**
 * Thrown when a linear system that should be SPD could not be solved.
 */
public class LinearSolveFailedException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public LinearSolveFailedException(String message) {
		super(message);
	}

	public LinearSolveFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}

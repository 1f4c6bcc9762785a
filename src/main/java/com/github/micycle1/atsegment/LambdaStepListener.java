package com.github.micycle1.atsegment;

/**
 * Receives the result of every lambda value as soon as it is available.
 */
@FunctionalInterface
public interface LambdaStepListener {

	void onLambdaStep(LambdaStep step);
}

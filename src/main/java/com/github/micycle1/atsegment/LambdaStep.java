package com.github.micycle1.atsegment;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.atsegment.calculus.Form;

/**
 * State reached once all epsilon steps for one lambda value have run. The forms
 * are snapshots and do not change when the solver moves on.
 */
public final class LambdaStep {

	private final int index;
	private final double lambda;
	private final double epsilon;
	private final Form u;
	private final Form v;
	private final Energies energies;
	private final List<AnnealingOutcome> outcomes;

	LambdaStep(int index, double lambda, double epsilon, Form u, Form v, Energies energies,
			List<AnnealingOutcome> outcomes) {
		this.index = index;
		this.lambda = lambda;
		this.epsilon = epsilon;
		this.u = u;
		this.v = v;
		this.energies = energies;
		this.outcomes = Collections.unmodifiableList(outcomes);
	}

	/** Position in the lambda schedule, starting at 0. */
	public int getIndex() {
		return index;
	}

	public double getLambda() {
		return lambda;
	}

	/** Last epsilon used for this lambda. */
	public double getEpsilon() {
		return epsilon;
	}

	public Form getU() {
		return u;
	}

	public Form getV() {
		return v;
	}

	public Energies getEnergies() {
		return energies;
	}

	/** One entry per epsilon step, in annealing order. */
	public List<AnnealingOutcome> getOutcomes() {
		return outcomes;
	}

	public boolean hasFailures() {
		for (AnnealingOutcome o : outcomes) {
			if (o.getStatus() == AnnealingOutcome.Status.FAILED) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return "LambdaStep{#" + index + ", lambda=" + lambda + ", eps=" + epsilon + ", " + energies + "}";
	}
}

package com.github.micycle1.atsegment;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.atsegment.calculus.Duality;
import com.github.micycle1.atsegment.calculus.GridCalculus;
import com.github.micycle1.atsegment.calculus.Operator;

/**
 * Immutable set of the base operators of one run: derivatives, Hodge stars,
 * identities and the two compositions every later system is assembled from.
 * Built once per image and shared read-only by the solver loops.
 */
public final class OperatorBundle {

	private static final Logger log = LoggerFactory.getLogger(OperatorBundle.class);

	private final GridCalculus calculus;

	public final Operator primalD0;
	public final Operator primalD1;
	public final Operator dualD0;
	public final Operator dualD1;
	public final Operator primalH1;
	public final Operator primalH2;
	public final Operator dualH1;
	public final Operator dualH2;
	public final Operator identity0;
	public final Operator identity1;

	/** {@code dual_h2 * dual_D1 * primal_h1}: primal 1-forms to primal 0-forms. */
	public final Operator codifferential1;
	/**
	 * {@code -(primal_D0 * dual_h2 * dual_D1 * primal_h1 + dual_h1 * dual_D0 *
	 * primal_h2 * primal_D1)}: the lambda-free curl-curl plus grad-div operator on
	 * primal 1-forms.
	 */
	public final Operator edgeLaplacian;

	private OperatorBundle(GridCalculus calculus) {
		this.calculus = calculus;
		log.debug("primal_D0");
		primalD0 = calculus.derivative(0, Duality.PRIMAL);
		log.debug("primal_D1");
		primalD1 = calculus.derivative(1, Duality.PRIMAL);
		log.debug("dual_D0");
		dualD0 = calculus.derivative(0, Duality.DUAL);
		log.debug("dual_D1");
		dualD1 = calculus.derivative(1, Duality.DUAL);
		log.debug("primal_h1, primal_h2, dual_h1, dual_h2");
		primalH1 = calculus.hodge(1, Duality.PRIMAL);
		primalH2 = calculus.hodge(2, Duality.PRIMAL);
		dualH1 = calculus.hodge(1, Duality.DUAL);
		dualH2 = calculus.hodge(2, Duality.DUAL);
		identity0 = calculus.identity(0, Duality.PRIMAL);
		identity1 = calculus.identity(1, Duality.PRIMAL);

		codifferential1 = dualH2.compose(dualD1).compose(primalH1);
		Operator gradDiv = primalD0.compose(codifferential1);
		Operator curlCurl = dualH1.compose(dualD0).compose(primalH2).compose(primalD1);
		edgeLaplacian = gradDiv.plus(curlCurl).times(-1.0);
	}

	public static OperatorBundle build(GridCalculus calculus) {
		return new OperatorBundle(Objects.requireNonNull(calculus, "calculus must not be null"));
	}

	public GridCalculus getCalculus() {
		return calculus;
	}
}

package com.github.micycle1.atsegment.calculus;

/**
 * Which of the two interleaved complexes a form or operator lives on. A dual
 * k-cell is attached to a primal (n-k)-cell.
 */
public enum Duality {
	PRIMAL, DUAL;

	public Duality opposite() {
		return this == PRIMAL ? DUAL : PRIMAL;
	}
}

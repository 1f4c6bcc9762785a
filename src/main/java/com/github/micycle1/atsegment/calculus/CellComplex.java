package com.github.micycle1.atsegment.calculus;

/**
 * CellComplex: the minimal combinatorial interface a 2D cell complex has to
 * provide so that {@link GridCalculus} can build derivative and Hodge operators
 * over it.
 * <p>
 * Conventions:
 * <ul>
 * <li>Cells of dimension 0, 1 and 2 are indexed 0..getCellCount(dim)-1. The
 * index of a cell never changes for the lifetime of the complex.</li>
 * <li>getBoundary(dim, i) lists the (dim-1)-cells on the boundary of cell i and
 * getBoundaryOrientation(dim, i) the matching incidence signs (+1/-1). A 1-cell
 * runs from its -1 endpoint to its +1 endpoint; a 2-cell lists its edges
 * counter-clockwise.</li>
 * <li>Every cell has Khalimsky (doubled) coordinates: both even for a 0-cell,
 * exactly one odd for a 1-cell, both odd for a 2-cell.</li>
 * </ul>
 */
public interface CellComplex {

	/** Topological dimension of the complex (2 for images). */
	default int getDimension() {
		return 2;
	}

	/** Number of cells of the given dimension. */
	int getCellCount(int dim);

	/** (dim-1)-cells on the boundary of the given cell; empty for 0-cells. */
	int[] getBoundary(int dim, int index);

	/** Incidence signs matching {@link #getBoundary(int, int)}. */
	int[] getBoundaryOrientation(int dim, int index);

	/** Khalimsky coordinates {kx, ky} of the given cell. */
	int[] getKhalimskyCoordinates(int dim, int index);
}

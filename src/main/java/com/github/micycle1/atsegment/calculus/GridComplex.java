package com.github.micycle1.atsegment.calculus;

/**
 * Cell complex over a rectangular pixel lattice of {@code width x height}
 * pixels. Pixels are the primal 0-cells, pixel adjacencies the primal 1-cells
 * and the unit squares between four pixels the primal 2-cells.
 * <p>
 * Index layout (all row-major, y = row):
 * <ul>
 * <li>vertex (x,y): {@code y*width + x}</li>
 * <li>horizontal edge (x,y)-(x+1,y): {@code y*(width-1) + x}</li>
 * <li>vertical edge (x,y)-(x,y+1): {@code H + y*width + x}, where H is the
 * horizontal edge count</li>
 * <li>face with lower-left vertex (x,y): {@code y*(width-1) + x}</li>
 * </ul>
 * Edges are oriented along +x and +y.
 */
public final class GridComplex implements CellComplex {

	private final int width;
	private final int height;
	private final int horizontalEdges;
	private final int verticalEdges;

	public GridComplex(int width, int height) {
		if (width < 1 || height < 1) {
			throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
		}
		this.width = width;
		this.height = height;
		this.horizontalEdges = (width - 1) * height;
		this.verticalEdges = width * (height - 1);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/** Width of the doubled (Khalimsky) lattice hosting every cell. */
	public int getKhalimskyWidth() {
		return 2 * width - 1;
	}

	public int getKhalimskyHeight() {
		return 2 * height - 1;
	}

	@Override
	public int getCellCount(int dim) {
		switch (dim) {
			case 0:
				return width * height;
			case 1:
				return horizontalEdges + verticalEdges;
			case 2:
				return (width - 1) * (height - 1);
			default:
				throw new IllegalArgumentException("No cells of dimension " + dim);
		}
	}

	public int vertexIndex(int x, int y) {
		return y * width + x;
	}

	public int horizontalEdgeIndex(int x, int y) {
		return y * (width - 1) + x;
	}

	public int verticalEdgeIndex(int x, int y) {
		return horizontalEdges + y * width + x;
	}

	public int faceIndex(int x, int y) {
		return y * (width - 1) + x;
	}

	public boolean isHorizontalEdge(int edge) {
		return edge < horizontalEdges;
	}

	@Override
	public int[] getBoundary(int dim, int index) {
		checkIndex(dim, index);
		switch (dim) {
			case 0:
				return new int[0];
			case 1:
				if (isHorizontalEdge(index)) {
					int x = index % (width - 1);
					int y = index / (width - 1);
					return new int[] { vertexIndex(x, y), vertexIndex(x + 1, y) };
				} else {
					int e = index - horizontalEdges;
					int x = e % width;
					int y = e / width;
					return new int[] { vertexIndex(x, y), vertexIndex(x, y + 1) };
				}
			default:
				int x = index % (width - 1);
				int y = index / (width - 1);
				// bottom, right, top, left
				return new int[] { horizontalEdgeIndex(x, y), verticalEdgeIndex(x + 1, y), horizontalEdgeIndex(x, y + 1),
						verticalEdgeIndex(x, y) };
		}
	}

	@Override
	public int[] getBoundaryOrientation(int dim, int index) {
		checkIndex(dim, index);
		switch (dim) {
			case 0:
				return new int[0];
			case 1:
				return new int[] { -1, 1 };
			default:
				return new int[] { 1, 1, -1, -1 };
		}
	}

	@Override
	public int[] getKhalimskyCoordinates(int dim, int index) {
		checkIndex(dim, index);
		switch (dim) {
			case 0:
				return new int[] { 2 * (index % width), 2 * (index / width) };
			case 1:
				if (isHorizontalEdge(index)) {
					return new int[] { 2 * (index % (width - 1)) + 1, 2 * (index / (width - 1)) };
				}
				int e = index - horizontalEdges;
				return new int[] { 2 * (e % width), 2 * (e / width) + 1 };
			default:
				return new int[] { 2 * (index % (width - 1)) + 1, 2 * (index / (width - 1)) + 1 };
		}
	}

	private void checkIndex(int dim, int index) {
		int count = getCellCount(dim);
		if (index < 0 || index >= count) {
			throw new IndexOutOfBoundsException("Cell " + index + " of dimension " + dim + " out of range [0," + count + ")");
		}
	}

	@Override
	public String toString() {
		return "GridComplex{" + width + "x" + height + ", cells=[" + getCellCount(0) + ", " + getCellCount(1) + ", "
				+ getCellCount(2) + "]}";
	}
}

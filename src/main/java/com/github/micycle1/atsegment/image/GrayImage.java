package com.github.micycle1.atsegment.image;

import java.util.Arrays;

/**
 * 8-bit gray raster, row-major with (0,0) at the first stored row.
 */
public final class GrayImage {

	private final int width;
	private final int height;
	private final int[] pixels;

	public GrayImage(int width, int height) {
		if (width < 1 || height < 1) {
			throw new IllegalArgumentException("Image must be at least 1x1, got " + width + "x" + height);
		}
		this.width = width;
		this.height = height;
		this.pixels = new int[width * height];
	}

	public GrayImage(int width, int height, int[] pixels) {
		this(width, height);
		if (pixels.length != width * height) {
			throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length);
		}
		for (int i = 0; i < pixels.length; i++) {
			this.pixels[i] = checkValue(pixels[i]);
		}
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int get(int x, int y) {
		return pixels[index(x, y)];
	}

	public void set(int x, int y, int value) {
		pixels[index(x, y)] = checkValue(value);
	}

	public void fill(int value) {
		Arrays.fill(pixels, checkValue(value));
	}

	/** Copy of the raster, row-major. */
	public int[] toArray() {
		return pixels.clone();
	}

	private int index(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height) {
			throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + width + "x" + height);
		}
		return y * width + x;
	}

	private static int checkValue(int value) {
		if (value < 0 || value > 255) {
			throw new IllegalArgumentException("Gray value out of [0,255]: " + value);
		}
		return value;
	}

	@Override
	public String toString() {
		return "GrayImage{" + width + "x" + height + "}";
	}
}

package com.github.micycle1.atsegment.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.atsegment.calculus.Form;
import com.github.micycle1.atsegment.calculus.FormSpace;
import com.github.micycle1.atsegment.calculus.GridComplex;

/**
 * Converts between gray rasters and forms on a {@link GridComplex}.
 * <p>
 * Values are scaled linearly, {@code round(value * 255)} clamped to [0,255];
 * there is no normalization against the range of the form.
 */
public final class ImageFieldMapper {

	private static final Logger log = LoggerFactory.getLogger(ImageFieldMapper.class);

	private final GridComplex complex;

	public ImageFieldMapper(GridComplex complex) {
		this.complex = complex;
	}

	/** Primal 0-form g = pixel / 255. */
	public Form toNormalizedForm(GrayImage image) {
		if (image.getWidth() != complex.getWidth() || image.getHeight() != complex.getHeight()) {
			throw new IllegalArgumentException(image + " does not match " + complex);
		}
		int n = complex.getCellCount(0);
		double[] g = new double[n];
		for (int i = 0; i < n; i++) {
			int[] k = complex.getKhalimskyCoordinates(0, i);
			g[i] = image.get(k[0] / 2, k[1] / 2) / 255.0;
		}
		return new Form(FormSpace.primal(0), g);
	}

	/** Pixel raster of a primal 0-form, one pixel per vertex. */
	public GrayImage form0ToImage(Form u) {
		checkSpace(u, 0);
		log.info("min_u={} max_u={}", u.min(), u.max());
		GrayImage image = new GrayImage(complex.getWidth(), complex.getHeight());
		for (int i = 0; i < u.size(); i++) {
			int[] k = complex.getKhalimskyCoordinates(0, i);
			image.set(k[0] / 2, k[1] / 2, toGray(u.get(i)));
		}
		return image;
	}

	/**
	 * Raster over the doubled lattice: each edge value lands at the Khalimsky
	 * coordinates of its 1-cell, every other pixel stays 255.
	 */
	public GrayImage form1ToImage(Form v) {
		checkSpace(v, 1);
		log.info("min_v={} max_v={}", v.min(), v.max());
		GrayImage image = new GrayImage(complex.getKhalimskyWidth(), complex.getKhalimskyHeight());
		image.fill(255);
		for (int i = 0; i < v.size(); i++) {
			int[] k = complex.getKhalimskyCoordinates(1, i);
			image.set(k[0], k[1], toGray(v.get(i)));
		}
		return image;
	}

	public static int toGray(double value) {
		if (Double.isNaN(value)) {
			return 0;
		}
		long g = Math.round(value * 255.0);
		return (int) Math.max(0, Math.min(255, g));
	}

	private void checkSpace(Form form, int degree) {
		if (!form.getSpace().equals(FormSpace.primal(degree)) || form.size() != complex.getCellCount(degree)) {
			throw new IllegalArgumentException("Expected a primal " + degree + "-form on " + complex + ", got " + form);
		}
	}
}

package com.github.micycle1.atsegment.image;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

/**
 * Reads and writes gray rasters. PGM (binary P5 and ASCII P2) is handled
 * natively, with maxval above 255 rescaled to 8 bits; any other format
 * {@link ImageIO} can decode is converted to luminance. Output is always binary
 * PGM.
 */
public final class PgmIO {

	private PgmIO() {
	}

	public static GrayImage read(Path path) throws IOException {
		try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
			in.mark(2);
			int c0 = in.read();
			int c1 = in.read();
			in.reset();
			if (c0 == 'P' && (c1 == '5' || c1 == '2')) {
				return readPgm(in);
			}
		}
		BufferedImage img = ImageIO.read(path.toFile());
		if (img == null) {
			throw new IOException("Unsupported image format: " + path);
		}
		return fromBufferedImage(img);
	}

	public static GrayImage readPgm(InputStream in) throws IOException {
		String magic = token(in);
		boolean binary;
		if ("P5".equals(magic)) {
			binary = true;
		} else if ("P2".equals(magic)) {
			binary = false;
		} else {
			throw new IOException("Not a PGM stream (magic '" + magic + "')");
		}
		int width = parseInt(token(in), "width");
		int height = parseInt(token(in), "height");
		int maxval = parseInt(token(in), "maxval");
		if (width < 1 || height < 1 || maxval < 1 || maxval > 65535) {
			throw new IOException("Invalid PGM header: " + width + "x" + height + " maxval " + maxval);
		}
		// a single whitespace byte separates the header from binary data; token() consumed it

		int[] pixels = new int[width * height];
		for (int i = 0; i < pixels.length; i++) {
			int raw;
			if (binary) {
				raw = readByte(in);
				if (maxval > 255) {
					raw = (raw << 8) | readByte(in);
				}
			} else {
				raw = parseInt(token(in), "sample");
			}
			if (raw > maxval) {
				throw new IOException("Sample " + raw + " exceeds maxval " + maxval);
			}
			pixels[i] = maxval == 255 ? raw : (int) Math.round(raw * 255.0 / maxval);
		}
		return new GrayImage(width, height, pixels);
	}

	public static void write(GrayImage image, Path path) throws IOException {
		try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
			write(image, out);
		}
	}

	/** Binary PGM (P5, maxval 255). */
	public static void write(GrayImage image, OutputStream out) throws IOException {
		String header = "P5\n" + image.getWidth() + " " + image.getHeight() + "\n255\n";
		out.write(header.getBytes(StandardCharsets.US_ASCII));
		int[] px = image.toArray();
		byte[] data = new byte[px.length];
		for (int i = 0; i < px.length; i++) {
			data[i] = (byte) px[i];
		}
		out.write(data);
		out.flush();
	}

	static GrayImage fromBufferedImage(BufferedImage img) {
		GrayImage out = new GrayImage(img.getWidth(), img.getHeight());
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++) {
				int rgb = img.getRGB(x, y);
				int r = (rgb >> 16) & 0xff;
				int g = (rgb >> 8) & 0xff;
				int b = rgb & 0xff;
				out.set(x, y, (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b));
			}
		}
		return out;
	}

	// next whitespace-delimited header token, skipping '#' comments
	private static String token(InputStream in) throws IOException {
		StringBuilder sb = new StringBuilder();
		int c;
		while ((c = in.read()) != -1) {
			if (c == '#' && sb.length() == 0) {
				do {
					c = in.read();
				} while (c != -1 && c != '\n' && c != '\r');
				continue;
			}
			if (Character.isWhitespace(c)) {
				if (sb.length() > 0) {
					break;
				}
				continue;
			}
			sb.append((char) c);
		}
		if (sb.length() == 0) {
			throw new EOFException("Unexpected end of PGM stream");
		}
		return sb.toString();
	}

	private static int readByte(InputStream in) throws IOException {
		int b = in.read();
		if (b == -1) {
			throw new EOFException("Unexpected end of PGM pixel data");
		}
		return b;
	}

	private static int parseInt(String s, String what) throws IOException {
		try {
			return Integer.parseInt(s);
		} catch (NumberFormatException e) {
			throw new IOException("Invalid PGM " + what + ": '" + s + "'", e);
		}
	}
}

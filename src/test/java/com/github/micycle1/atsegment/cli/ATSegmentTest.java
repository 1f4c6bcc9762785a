package com.github.micycle1.atsegment.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.atsegment.EnergyReporter;
import com.github.micycle1.atsegment.image.GrayImage;
import com.github.micycle1.atsegment.image.PgmIO;

public class ATSegmentTest {

	@TempDir
	Path dir;

	private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
	private final PrintStream err = new PrintStream(errBytes, true);

	private Path writeInput() throws IOException {
		GrayImage img = new GrayImage(5, 4);
		for (int y = 0; y < 4; y++) {
			for (int x = 0; x < 5; x++) {
				img.set(x, y, x < 2 ? 20 : 230);
			}
		}
		Path p = dir.resolve("in.pgm");
		PgmIO.write(img, p);
		return p;
	}

	@Test
	public void testEndToEnd() throws IOException {
		Path input = writeInput();
		String base = dir.resolve("out").toString();
		int code = ATSegment.run(new String[] { "-i", input.toString(), "-o", base, "-1", "0.1", "-2", "0.05", "-r", "2" },
				err);
		assertEquals(ATSegment.EXIT_OK, code, errBytes.toString(StandardCharsets.UTF_8));

		List<String> lines = Files.readAllLines(OutputWriter.reportPath(base), StandardCharsets.UTF_8);
		assertEquals(3, lines.size());
		assertEquals(EnergyReporter.HEADER, lines.get(0));
		assertTrue(lines.get(1).startsWith("0.1\t1\t1\t"), lines.get(1));
		assertTrue(lines.get(2).startsWith("0.05\t1\t1\t"), lines.get(2));
		assertEquals(9, lines.get(1).split("\t").length);

		for (double lambda : new double[] { 0.1, 0.05 }) {
			GrayImage u = PgmIO.read(OutputWriter.uImagePath(base, lambda));
			assertEquals(5, u.getWidth());
			assertEquals(4, u.getHeight());
			GrayImage v = PgmIO.read(OutputWriter.vImagePath(base, lambda));
			assertEquals(9, v.getWidth());
			assertEquals(7, v.getHeight());
			assertEquals(255, v.get(1, 1));
		}
		assertTrue(OutputWriter.uImagePath(base, 0.05).toString().endsWith("out-l0.0500000-u.pgm"));
	}

	@Test
	public void testMissingInputPrintsUsage() {
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[0], err));
		assertTrue(errBytes.toString(StandardCharsets.UTF_8).startsWith("Usage: "));
	}

	@Test
	public void testHelp() {
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-h", "-i", "x.pgm" }, err));
	}

	@Test
	public void testBadArgument() {
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-i", "x.pgm", "-a", "one" }, err));
		assertTrue(errBytes.toString(StandardCharsets.UTF_8).startsWith("Error checking program options"));
	}

	@Test
	public void testNonPositiveParameter() throws IOException {
		Path input = writeInput();
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-i", input.toString(), "-a", "-1" }, err));
	}

	@Test
	public void testInvalidParameterIsReportedBeforeReadingInput() {
		Path missing = dir.resolve("missing.pgm");
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-i", missing.toString(), "-a", "-1" }, err));
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-i", missing.toString(), "-2", "0" }, err));
		assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("alpha must be positive"));
	}

	@Test
	public void testSinglePixelImage() throws IOException {
		Path input = dir.resolve("dot.pgm");
		PgmIO.write(new GrayImage(1, 1), input);
		assertEquals(ATSegment.EXIT_USAGE, ATSegment.run(new String[] { "-i", input.toString() }, err));
	}

	@Test
	public void testUnreadableInput() {
		Path missing = dir.resolve("missing.pgm");
		assertEquals(ATSegment.EXIT_IO, ATSegment.run(new String[] { "-i", missing.toString() }, err));
	}

	@Test
	public void testUnwritableOutput() throws IOException {
		Path input = writeInput();
		String base = dir.resolve("no-such-dir").resolve("out").toString();
		assertEquals(ATSegment.EXIT_IO,
				ATSegment.run(new String[] { "-i", input.toString(), "-o", base, "-l", "0.1" }, err));
	}
}

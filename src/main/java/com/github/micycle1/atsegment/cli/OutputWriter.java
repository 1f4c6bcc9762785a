package com.github.micycle1.atsegment.cli;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.atsegment.EnergyReporter;
import com.github.micycle1.atsegment.LambdaStep;
import com.github.micycle1.atsegment.LambdaStepListener;
import com.github.micycle1.atsegment.image.ImageFieldMapper;
import com.github.micycle1.atsegment.image.PgmIO;

/**
 * Writes the per-lambda outputs of a run: one row of {@code <base>.txt} and the
 * rasters {@code <base>-l<lambda>-u.pgm} and {@code <base>-l<lambda>-v.pgm}.
 */
public final class OutputWriter implements LambdaStepListener, Closeable {

	private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

	private final String basename;
	private final double alpha;
	private final ImageFieldMapper mapper;
	private final Writer report;

	/**
	 * Creates {@code <basename>.txt} and writes the header line.
	 */
	public OutputWriter(String basename, double alpha, ImageFieldMapper mapper) throws IOException {
		this.basename = basename;
		this.alpha = alpha;
		this.mapper = mapper;
		this.report = Files.newBufferedWriter(reportPath(basename), StandardCharsets.UTF_8);
		EnergyReporter.appendHeader(report);
	}

	public static Path reportPath(String basename) {
		return Paths.get(basename + ".txt");
	}

	public static Path uImagePath(String basename, double lambda) {
		return Paths.get(String.format(Locale.ROOT, "%s-l%.7f-u.pgm", basename, lambda));
	}

	public static Path vImagePath(String basename, double lambda) {
		return Paths.get(String.format(Locale.ROOT, "%s-l%.7f-v.pgm", basename, lambda));
	}

	/**
	 * @throws UncheckedIOException if a file cannot be written
	 */
	@Override
	public void onLambdaStep(LambdaStep step) {
		try {
			EnergyReporter.appendRow(report, step, alpha);
			report.flush();
			Path uPath = uImagePath(basename, step.getLambda());
			PgmIO.write(mapper.form0ToImage(step.getU()), uPath);
			Path vPath = vImagePath(basename, step.getLambda());
			PgmIO.write(mapper.form1ToImage(step.getV()), vPath);
			log.info("Wrote {} and {}", uPath, vPath);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot write outputs for lambda=" + step.getLambda(), e);
		}
	}

	@Override
	public void close() throws IOException {
		report.close();
	}
}

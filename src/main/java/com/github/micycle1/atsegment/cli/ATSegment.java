package com.github.micycle1.atsegment.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.atsegment.AmbrosioTortorelli;
import com.github.micycle1.atsegment.AmbrosioTortorelli.Params;
import com.github.micycle1.atsegment.LambdaStep;
import com.github.micycle1.atsegment.image.GrayImage;
import com.github.micycle1.atsegment.image.ImageFieldMapper;
import com.github.micycle1.atsegment.image.PgmIO;

/**
 * Command line entry point: reads a gray image, runs the Ambrosio-Tortorelli
 * schedule and writes the report and rasters for every lambda value.
 * <p>
 * Exit codes: 0 on success, 1 on argument errors or {@code --help}, 2 when an
 * input or output file cannot be read or written.
 */
public final class ATSegment {

	private static final Logger log = LoggerFactory.getLogger(ATSegment.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_IO = 2;

	private ATSegment() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.err));
	}

	public static int run(String[] args, PrintStream err) {
		CliOptions opts;
		Params params;
		try {
			opts = CliOptions.parse(args);
			params = opts.toParams().sanitize();
		} catch (CliOptions.ParseException | IllegalArgumentException e) {
			err.println("Error checking program options: " + e.getMessage());
			err.print(CliOptions.usage("atsegment"));
			return EXIT_USAGE;
		}
		if (opts.isHelp() || !opts.hasInput()) {
			err.print(CliOptions.usage("atsegment"));
			return EXIT_USAGE;
		}

		GrayImage image;
		try {
			log.info("Reading image {}", opts.getInput());
			image = PgmIO.read(Paths.get(opts.getInput()));
		} catch (IOException e) {
			log.error("Cannot read input image {}", opts.getInput(), e);
			return EXIT_IO;
		}

		AmbrosioTortorelli at;
		try {
			at = new AmbrosioTortorelli(image, params);
		} catch (IllegalArgumentException e) {
			// a single-pixel image has no edges to segment
			err.println("Cannot segment " + opts.getInput() + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		ImageFieldMapper mapper = new ImageFieldMapper(at.getComplex());
		try (OutputWriter out = new OutputWriter(opts.getOutput(), params.alpha, mapper)) {
			for (LambdaStep step : at.run(out)) {
				if (step.hasFailures()) {
					log.warn("lambda = {} had failed linear solves: {}", step.getLambda(), step.getOutcomes());
				}
			}
		} catch (IOException | UncheckedIOException e) {
			log.error("Cannot write outputs with basename {}", opts.getOutput(), e);
			return EXIT_IO;
		}
		return EXIT_OK;
	}
}

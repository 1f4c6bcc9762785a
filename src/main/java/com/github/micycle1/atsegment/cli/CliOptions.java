package com.github.micycle1.atsegment.cli;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.github.micycle1.atsegment.AmbrosioTortorelli.Params;
import com.github.micycle1.atsegment.linalg.SolverBackend;

/**
 * Command line options of {@link ATSegment}. Short options take their value as
 * the next argument ({@code -a 0.5}); long options accept either
 * {@code --alpha 0.5} or {@code --alpha=0.5}.
 */
public final class CliOptions {

	/** Thrown for unknown options, missing or unparsable values. */
	public static final class ParseException extends Exception {
		private static final long serialVersionUID = 1L;

		public ParseException(String message) {
			super(message);
		}
	}

	private enum Option {
		HELP('h', "help", false, "display this message"),
		INPUT('i', "input", true, "the input image filename."),
		OUTPUT('o', "output", true, "the output image basename. (default: AT)"),
		LAMBDA('l', "lambda", true, "the parameter lambda (sets lambda-1 = lambda-2)."),
		LAMBDA_1('1', "lambda-1", true, "the initial parameter lambda (l1). (default: 0.3125)"),
		LAMBDA_2('2', "lambda-2", true, "the final parameter lambda (l2). (default: 0.00005)"),
		LAMBDA_RATIO('r', "lambda-ratio", true, "the division ratio for lambda from l1 to l2. (default: sqrt(2))"),
		ALPHA('a', "alpha", true, "the parameter alpha. (default: 1.0)"),
		EPSILON('e', "epsilon", true, "the parameter epsilon. (default: 1.0)"),
		GRIDSTEP('g', "gridstep", true, "the parameter h, i.e. the gridstep. (default: 1.0)"),
		NBITER('n', "nbiter", true, "the maximum number of iterations. (default: 10)"),
		SOLVER('s', "solver", true, "the SPD solver: cholesky, lu or cg. (default: cholesky)"),
		CLAMP('\0', "clamp", false, "clamp the edge field v into [0,1] after each solve.");

		final char shortName;
		final String longName;
		final boolean hasValue;
		final String description;

		Option(char shortName, String longName, boolean hasValue, String description) {
			this.shortName = shortName;
			this.longName = longName;
			this.hasValue = hasValue;
			this.description = description;
		}
	}

	private final Map<Option, String> values = new LinkedHashMap<>();

	private CliOptions() {
	}

	public static CliOptions parse(String... args) throws ParseException {
		CliOptions opts = new CliOptions();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			Option option;
			String value = null;
			if (arg.startsWith("--") && arg.length() > 2) {
				String name = arg.substring(2);
				int eq = name.indexOf('=');
				if (eq >= 0) {
					value = name.substring(eq + 1);
					name = name.substring(0, eq);
				}
				option = byLongName(name);
				if (!option.hasValue && value != null) {
					throw new ParseException("option '--" + name + "' does not take any arguments");
				}
			} else if (arg.startsWith("-") && arg.length() == 2) {
				option = byShortName(arg.charAt(1));
			} else {
				throw new ParseException("unexpected argument '" + arg + "'");
			}
			if (option.hasValue && value == null) {
				if (i + 1 >= args.length) {
					throw new ParseException("the required argument for option '--" + option.longName + "' is missing");
				}
				value = args[++i];
			}
			opts.values.put(option, value == null ? "" : value);
		}
		opts.validate();
		return opts;
	}

	private static Option byLongName(String name) throws ParseException {
		for (Option o : Option.values()) {
			if (o.longName.equals(name)) {
				return o;
			}
		}
		throw new ParseException("unrecognised option '--" + name + "'");
	}

	private static Option byShortName(char c) throws ParseException {
		for (Option o : Option.values()) {
			if (o.shortName == c) {
				return o;
			}
		}
		throw new ParseException("unrecognised option '-" + c + "'");
	}

	// parse every numeric value up front so errors surface before any work
	private void validate() throws ParseException {
		for (Map.Entry<Option, String> e : values.entrySet()) {
			switch (e.getKey()) {
				case LAMBDA:
				case LAMBDA_1:
				case LAMBDA_2:
				case LAMBDA_RATIO:
				case ALPHA:
				case EPSILON:
				case GRIDSTEP:
					parseDouble(e.getKey());
					break;
				case NBITER:
					parseInt(e.getKey());
					break;
				case SOLVER:
					try {
						SolverBackend.fromName(e.getValue());
					} catch (IllegalArgumentException ex) {
						throw new ParseException(ex.getMessage());
					}
					break;
				default:
					break;
			}
		}
	}

	public boolean isHelp() {
		return values.containsKey(Option.HELP);
	}

	public boolean hasInput() {
		return values.containsKey(Option.INPUT);
	}

	public String getInput() {
		return values.get(Option.INPUT);
	}

	public String getOutput() {
		return values.getOrDefault(Option.OUTPUT, "AT");
	}

	/**
	 * Parameters for the solver, as given. {@link Params#sanitize()} applies the
	 * lenient corrections and range checks.
	 */
	public Params toParams() throws ParseException {
		Params p = new Params();
		p.lambda1 = doubleOr(Option.LAMBDA_1, p.lambda1);
		p.lambda2 = doubleOr(Option.LAMBDA_2, p.lambda2);
		p.lambdaRatio = doubleOr(Option.LAMBDA_RATIO, p.lambdaRatio);
		if (values.containsKey(Option.LAMBDA)) {
			p.singleLambda(parseDouble(Option.LAMBDA));
		}
		p.alpha = doubleOr(Option.ALPHA, p.alpha);
		p.epsilon = doubleOr(Option.EPSILON, p.epsilon);
		p.gridStep = doubleOr(Option.GRIDSTEP, p.gridStep);
		if (values.containsKey(Option.NBITER)) {
			p.maxIterations = parseInt(Option.NBITER);
		}
		if (values.containsKey(Option.SOLVER)) {
			p.solver = SolverBackend.fromName(values.get(Option.SOLVER));
		}
		p.clampEdgeField = values.containsKey(Option.CLAMP);
		return p;
	}

	private double doubleOr(Option o, double fallback) throws ParseException {
		return values.containsKey(o) ? parseDouble(o) : fallback;
	}

	private double parseDouble(Option o) throws ParseException {
		String s = values.get(o);
		try {
			return Double.parseDouble(s);
		} catch (NumberFormatException e) {
			throw new ParseException("the argument ('" + s + "') for option '--" + o.longName + "' is invalid");
		}
	}

	private int parseInt(Option o) throws ParseException {
		String s = values.get(o);
		try {
			return Integer.parseInt(s);
		} catch (NumberFormatException e) {
			throw new ParseException("the argument ('" + s + "') for option '--" + o.longName + "' is invalid");
		}
	}

	public static String usage(String program) {
		StringBuilder sb = new StringBuilder();
		sb.append("Usage: ").append(program).append(" -i toto.pgm\n");
		sb.append("Computes the Ambrosio-Tortorelli reconstruction/segmentation of an input image.\n\n");
		sb.append(" / \n");
		sb.append(" | a.(u-g)^2 + v^2 |grad u|^2 + le.|grad v|^2 + (l/4e).(1-v)^2 \n");
		sb.append(" / \n\n");
		sb.append("Allowed options are: \n");
		for (Option o : Option.values()) {
			String flags = o.shortName != '\0' ? "-" + o.shortName + " [ --" + o.longName + " ]" : "--" + o.longName;
			if (o.hasValue) {
				flags += " arg";
			}
			sb.append(String.format(Locale.ROOT, "  %-28s %s%n", flags, o.description));
		}
		return sb.toString();
	}
}

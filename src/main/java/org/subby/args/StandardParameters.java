package org.subby.args;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.subby.args.ArgValue.CustomValue;
import org.subby.args.ArgValue.StringValue;
import org.subby.args.ArgValue.TupleValue;
import org.subby.log.CommandLog;
import org.subby.log.Verbosity;
import org.subby.range.FileRange;
import org.subby.range.FileRangeParser;

/** Parameter groups shared by the program's commands */
public class StandardParameters {
	/** Name of the argument the {@link #printFlags() print flags} write the program's verbosity to */
	public static final String VERBOSITY = "verbosity";
	/** Name of the input file argument */
	public static final String INPUT = "input";
	/** Name of the switch that enables range parsing for inputs */
	public static final String USE_RANGES = "use-ranges";
	/** Name of the output file argument */
	public static final String OUTPUT = "output";
	/** Name of the switch to overwrite the input file */
	public static final String OVERWRITE = "overwrite";

	/** File name extension of subtitle files */
	public static final String SUBTITLE_EXTENSION = ".srt";

	/** Parses {@link FileRange file ranges} */
	public static final ValueType FILE_RANGE = ValueTypes.of("file range", FileRange.class, FileRangeParser::parse);

	private StandardParameters() {}

	/**
	 * @return A group of switches controlling the program's verbosity, with a post-processor that writes the {@link Verbosity} to the
	 *         {@link #VERBOSITY} argument and applies it to the command's log
	 */
	public static GroupSpec printFlags() {
		return GroupSpec.build()//
			.with("-verbose", p -> p.shorthand("-V").enable().help("Print more information"))//
			.with("-debug", p -> p.enable().help("Print debugging information"))//
			.with("-quiet", p -> p.shorthand("-q").enable().help("Print nothing"))//
			.withPostProcessor(new VerbosityProcessor())//
			.build();
	}

	/**
	 * @return A group for a single subtitle file input, with a post-processor that decodes the input into a {@link FileRange} and a
	 *         validator that requires a subtitle file
	 */
	public static GroupSpec singleInput() {
		return GroupSpec.build()//
			.with(INPUT, p -> p.help("The input file"))//
			.with("-" + USE_RANGES, p -> p.shorthand("-R").enable().help("Enable parsing for ranges of lines or timestamps"))//
			.withPostProcessor(new InputRangeProcessor())//
			.withValidator(new SubtitleInputValidator())//
			.build();
	}

	/**
	 * @return A group for any number of subtitle file inputs, with a post-processor that decodes each input into a {@link FileRange} and a
	 *         validator that requires each to be a subtitle file
	 */
	public static GroupSpec multipleInput() {
		return GroupSpec.build()//
			.with(INPUT, p -> p.multiple().help("Input files for the command"))//
			.with("-" + USE_RANGES, p -> p.shorthand("-R").enable().help("Enable parsing for ranges of lines or timestamps"))//
			.withPostProcessor(new InputRangeProcessor())//
			.withValidator(new SubtitleInputValidator())//
			.build();
	}

	/** @return A mutually exclusive group choosing between an output file and overwriting the input, one of which is required */
	public static GroupSpec output() {
		return GroupSpec.build()//
			.with("-" + OUTPUT, p -> p.shorthand("-o").displayName("output_file").help("The output file"))//
			.with("-" + OVERWRITE, p -> p.shorthand("-O").enable().help("Overwrite input file"))//
			.mutuallyExclusive()//
			.withValidator(new OutputValidator())//
			.build();
	}

	/**
	 * @param args The resolved arguments
	 * @return The input file ranges, after {@link #singleInput()} or {@link #multipleInput()} post-processing
	 */
	public static List<FileRange> getInputs(ArgMap args) {
		return args.getAll(INPUT, FileRange.class);
	}

	/** Derives the {@link Verbosity} from the print flags. Quiet wins over debug, which wins over verbose. */
	static class VerbosityProcessor implements PostProcessor {
		@Override
		public void process(ArgMap args, CommandLog log) {
			Verbosity verbosity;
			if (isSet(args, "quiet"))
				verbosity = Verbosity.QUIET;
			else if (isSet(args, "debug"))
				verbosity = Verbosity.DEBUG;
			else if (isSet(args, "verbose"))
				verbosity = Verbosity.VERBOSE;
			else
				verbosity = Verbosity.INFO;
			args.put(VERBOSITY, ArgValue.custom(verbosity));
			log.setVerbosity(verbosity);
		}

		private static boolean isSet(ArgMap args, String name) {
			return args.has(name) && args.getBoolean(name);
		}

		@Override
		public String toString() {
			return "verbosity";
		}
	}

	/**
	 * Replaces each raw input string with a {@link FileRange}. Ranges are only parsed if {@link #USE_RANGES} is set. An input that fails to
	 * parse is left as a string for {@link SubtitleInputValidator} to report.
	 */
	static class InputRangeProcessor implements PostProcessor {
		@Override
		public void process(ArgMap args, CommandLog log) {
			ArgValue input = args.get(INPUT);
			if (input == null)
				return;
			boolean useRanges = args.has(USE_RANGES) && args.getBoolean(USE_RANGES);
			if (input instanceof TupleValue) {
				List<ArgValue> decoded = new ArrayList<>(((TupleValue) input).size());
				for (ArgValue element : ((TupleValue) input).getValues())
					decoded.add(decode(element, useRanges, log));
				args.put(INPUT, ArgValue.tuple(decoded));
			} else
				args.put(INPUT, decode(input, useRanges, log));
		}

		private static ArgValue decode(ArgValue input, boolean useRanges, CommandLog log) {
			if (!(input instanceof StringValue))
				return input;
			String text = ((StringValue) input).getValue();
			if (!useRanges)
				return ArgValue.custom(FileRange.whole(text));
			try {
				return ArgValue.custom(FileRangeParser.parse(text));
			} catch (ParseException e) {
				log.debug("Could not decode range from " + text + ": " + e.getMessage());
				return input;
			}
		}

		@Override
		public String toString() {
			return "input ranges";
		}
	}

	/** Requires every input to be a decoded subtitle {@link FileRange} */
	static class SubtitleInputValidator implements Validator {
		@Override
		public boolean validate(ArgMap args, CommandLog log) {
			ArgValue input = args.get(INPUT);
			if (input == null)
				return true;
			List<ArgValue> inputs = input instanceof TupleValue ? ((TupleValue) input).getValues() : Collections.singletonList(input);
			for (ArgValue element : inputs) {
				if (!validate(element, log))
					return false;
			}
			return true;
		}

		private static boolean validate(ArgValue input, CommandLog log) {
			if (!(input instanceof CustomValue) || !(((CustomValue) input).getValue() instanceof FileRange)) {
				String text = String.valueOf(input.unwrap());
				try {
					FileRangeParser.parse(text);
					log.error("'" + text + "' could not be decoded as a file range");
				} catch (ParseException e) {
					log.error(e.getMessage());
				}
				return false;
			}
			String fileName = ((FileRange) ((CustomValue) input).getValue()).getFileName();
			if (!fileName.endsWith(SUBTITLE_EXTENSION)) {
				log.error("'" + fileName + "' is not an srt file");
				if (fileName.indexOf(FileRangeParser.RANGE_SEPARATOR) >= 0)
					log.warn("If you specified a range, use -R to enable range parsing");
				return false;
			}
			return true;
		}

		@Override
		public String toString() {
			return "subtitle input";
		}
	}

	/** Requires either an output file or the overwrite switch */
	static class OutputValidator implements Validator {
		@Override
		public boolean validate(ArgMap args, CommandLog log) {
			if (args.has(OUTPUT) || (args.has(OVERWRITE) && args.getBoolean(OVERWRITE)))
				return true;
			log.error("Specify an output file with -o or overwrite the input file with -O");
			return false;
		}

		@Override
		public String toString() {
			return "output";
		}
	}
}

package org.subby.args;

import java.io.IOException;
import java.io.PrintStream;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.apache.log4j.Logger;
import org.subby.log.CommandLog;
import org.subby.log.Verbosity;

/**
 * A declarative command-line parser for a program with subcommands. The program's root command carries the parameters common to every
 * subcommand; each subcommand's parameters become available once its name appears on the command line.
 *
 * <p>
 * Parsing proceeds in stages:
 * <ol>
 * <li>The tokens are {@link CommandLineParser classified} and their raw values collected.</li>
 * <li>The raw values are {@link ArgumentResolver resolved} to typed values and merged with the declared defaults.</li>
 * <li>The {@link PipelineRunner pipeline} of post-processors and validators runs for the root command and then the subcommand.</li>
 * </ol>
 * </p>
 */
public class CommandLine {
	private static final Logger log = Logger.getLogger(CommandLine.class);

	/** Exit status for a successful run */
	public static final int EXIT_SUCCESS = 0;
	/** Exit status when a validator or the command handler failed */
	public static final int EXIT_FAILURE = 1;
	/** Exit status when the command line could not be parsed */
	public static final int EXIT_USAGE = 2;

	private final CommandSpec theRoot;
	private final Map<String, CommandSpec> theSubcommands;
	private final CommandLog theLog;
	private final Verbosity theInitialVerbosity;
	private final PrintStream theHelpOutput;

	CommandLine(Builder builder) {
		theRoot = builder.buildRoot();
		theSubcommands = Collections.unmodifiableMap(new LinkedHashMap<>(builder.theSubcommands));
		theLog = builder.theLog != null ? builder.theLog : new CommandLog(builder.theProgramName);
		theInitialVerbosity = theLog.getVerbosity();
		theHelpOutput = builder.theHelpOutput;
		// Root and subcommand parameter names must not collide
		for (CommandSpec subcommand : theSubcommands.values())
			new ArgumentPool().register(theRoot).register(subcommand);
	}

	/**
	 * @param programName The name of the program, as printed in help
	 * @return A builder for a command line
	 */
	public static Builder build(String programName) {
		return new Builder(programName);
	}

	/** @return The root command, named after the program */
	public CommandSpec getRoot() {
		return theRoot;
	}

	/** @return The subcommands of this command line, by name */
	public Map<String, CommandSpec> getSubcommands() {
		return theSubcommands;
	}

	/** @return The logging context given to validators, post-processors and handlers */
	public CommandLog getLog() {
		return theLog;
	}

	/**
	 * @param args The command-line tokens, not including the program name
	 * @return The result of the parse
	 * @throws CommandLineException If the command line is structurally invalid
	 */
	public ParseResult parse(String... args) throws CommandLineException {
		return parse(Arrays.asList(args));
	}

	/**
	 * @param args The command-line tokens, not including the program name
	 * @return The result of the parse
	 * @throws CommandLineException If the command line is structurally invalid
	 */
	public ParseResult parse(List<String> args) throws CommandLineException {
		// A previous parse's verbosity must not silence this one's errors
		theLog.setVerbosity(theInitialVerbosity);
		List<String> tokens = new ArrayList<>(args);
		for (String token : tokens) {
			if (CommandLineParser.HELP_ALIASES.contains(token))
				return printHelp(tokens);
		}

		ArgumentPool pool = new ArgumentPool().register(theRoot);
		CommandLineParser parser = new CommandLineParser(pool, theSubcommands).parse(tokens);
		ArgMap arguments = new ArgumentResolver(pool).resolve(parser.getIntermediates(), parser.getSubcommand());
		if (log.isDebugEnabled())
			log.debug("Resolved " + arguments);

		if (!new PipelineRunner(theLog).run(theRoot, parser.getSubcommand(), arguments))
			return ParseResult.validationFailed(parser.getSubcommand());
		return ParseResult.success(arguments, parser.getSubcommand());
	}

	/**
	 * Parses the command line and runs the handler of the matched subcommand, or of the root command if no subcommand was matched
	 *
	 * @param args The command-line tokens, not including the program name
	 * @return The exit status for the program: {@link #EXIT_SUCCESS}, {@link #EXIT_FAILURE} or {@link #EXIT_USAGE}
	 */
	public int run(String... args) {
		ParseResult result;
		try {
			result = parse(args);
		} catch (CommandLineException e) {
			theLog.error(e.getMessage());
			return EXIT_USAGE;
		}
		switch (result.getStatus()) {
		case HELP:
			return EXIT_SUCCESS;
		case VALIDATION_FAILED:
			return EXIT_FAILURE;
		case SUCCESS:
			break;
		}
		CommandSpec command = result.getSubcommand() != null ? result.getSubcommand() : theRoot;
		if (command.getHandler() == null) {
			theHelpOutput.print(HelpFormatter.printGeneralHelp(theRoot, theSubcommands.values()));
			return EXIT_SUCCESS;
		}
		try {
			command.getHandler().run(result.getArguments(), theLog);
		} catch (IOException | ParseException e) {
			theLog.error(command.getName() + " failed: " + e.getMessage());
			log.debug(command.getName() + " failed", e);
			return EXIT_FAILURE;
		}
		return EXIT_SUCCESS;
	}

	/** @return General help for the program */
	public String printHelp() {
		return HelpFormatter.printGeneralHelp(theRoot, theSubcommands.values());
	}

	/**
	 * @param subcommand The name of the subcommand
	 * @return Help for the subcommand
	 * @throws IllegalArgumentException If no such subcommand exists
	 */
	public String printHelp(String subcommand) throws IllegalArgumentException {
		CommandSpec command = theSubcommands.get(subcommand);
		if (command == null)
			throw new IllegalArgumentException("No such subcommand: \"" + subcommand + "\"");
		return HelpFormatter.printCommandHelp(theRoot, command);
	}

	private ParseResult printHelp(List<String> tokens) {
		CommandSpec subcommand = null;
		for (String token : tokens) {
			subcommand = theSubcommands.get(token);
			if (subcommand != null)
				break;
		}
		String help = subcommand == null ? printHelp() : HelpFormatter.printCommandHelp(theRoot, subcommand);
		theHelpOutput.print(help);
		return ParseResult.help(subcommand, help);
	}

	@Override
	public String toString() {
		return theRoot.getName() + theSubcommands.keySet();
	}

	/** Builds a {@link CommandLine} */
	public static class Builder {
		private final String theProgramName;
		private final List<Consumer<CommandSpec.Builder>> theRootConfiguration;
		private String theDescription;
		private final Map<String, CommandSpec> theSubcommands;
		private boolean isPrintFlags;
		private CommandLog theLog;
		private PrintStream theHelpOutput;

		Builder(String programName) {
			theProgramName = Objects.requireNonNull(programName, "Program name must not be null");
			theRootConfiguration = new ArrayList<>();
			theDescription = "";
			theSubcommands = new LinkedHashMap<>();
			theHelpOutput = System.out;
			isPrintFlags = true;
		}

		/**
		 * @param description The description of the program, printed in help
		 * @return This builder
		 */
		public Builder withDescription(String description) {
			theDescription = description == null ? "" : description;
			return this;
		}

		/**
		 * Leaves the {@link StandardParameters#printFlags() verbosity flags} off the root command
		 *
		 * @return This builder
		 */
		public Builder withoutPrintFlags() {
			isPrintFlags = false;
			return this;
		}

		/**
		 * @param configure Configures the root command with parameters, validators, post-processors or a handler for when no subcommand
		 *        is given
		 * @return This builder
		 */
		public Builder withRoot(Consumer<CommandSpec.Builder> configure) {
			theRootConfiguration.add(Objects.requireNonNull(configure, "Configuration must not be null"));
			return this;
		}

		/**
		 * @param subcommand The subcommand to add
		 * @return This builder
		 */
		public Builder withSubcommand(CommandSpec subcommand) {
			if (theSubcommands.containsKey(subcommand.getName()))
				throw new IllegalArgumentException("A subcommand named \"" + subcommand.getName() + "\" already exists");
			theSubcommands.put(subcommand.getName(), subcommand);
			return this;
		}

		/**
		 * @param subcommands The subcommands to add
		 * @return This builder
		 */
		public Builder withSubcommands(Collection<CommandSpec> subcommands) {
			for (CommandSpec subcommand : subcommands)
				withSubcommand(subcommand);
			return this;
		}

		/**
		 * @param commandLog The logging context for validators, post-processors and handlers. By default, a new log for the program.
		 * @return This builder
		 */
		public Builder withLog(CommandLog commandLog) {
			theLog = commandLog;
			return this;
		}

		/**
		 * @param helpOutput The stream to print help to. {@link System#out} by default.
		 * @return This builder
		 */
		public Builder withHelpOutput(PrintStream helpOutput) {
			theHelpOutput = Objects.requireNonNull(helpOutput, "Help output must not be null");
			return this;
		}

		/** @return The new command line */
		public CommandLine build() {
			return new CommandLine(this);
		}

		CommandSpec buildRoot() {
			CommandSpec.Builder root = CommandSpec.build(theProgramName).withHelp(theDescription);
			// The verbosity must be in effect before any other root post-processor or validator reports
			if (isPrintFlags)
				root.withGroup(StandardParameters.printFlags());
			for (Consumer<CommandSpec.Builder> configure : theRootConfiguration)
				configure.accept(root);
			return root.build();
		}
	}
}

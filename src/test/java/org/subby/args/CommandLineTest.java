package org.subby.args;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.subby.args.CommandLineException.ErrorType;
import org.subby.log.LogCapture;
import org.subby.log.Verbosity;

/** Tests parsing, validation, help and dispatch through {@link CommandLine} */
public class CommandLineTest {
	private ByteArrayOutputStream theHelp;
	private List<String> theCalls;
	private CommandLine theCommandLine;

	/** Builds a program with "delay" and "dummy" subcommands */
	@Before
	public void setup() {
		theHelp = new ByteArrayOutputStream();
		theCalls = new ArrayList<>();
		theCommandLine = CommandLine.build("subby")//
			.withDescription("Edit subtitle files")//
			.withHelpOutput(new PrintStream(theHelp, true))//
			.withSubcommand(delay())//
			.withSubcommand(CommandSpec.build("dummy").withHelp("Does nothing").build())//
			.build();
	}

	private CommandSpec delay() {
		return CommandSpec.build("delay")//
			.withHelp("Delay subtitles")//
			.withParameter("-unit", p -> p.shorthand("-u").choices("ms", "s", "minute", "hour").defaultValue("ms")
				.help("The unit of the delay"))//
			.withParameter("-exclusive", p -> p.enable().help("Only delay the given range"))//
			.withParameter("delay", p -> p.valueType(ValueTypes.INTEGER).displayName("amount").help("The amount to delay by"))//
			.withHandler((args, log) -> theCalls.add("delay " + args.getLong("delay") + args.getString("unit")))//
			.build();
	}

	private String help() {
		try {
			return theHelp.toString("UTF-8");
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
	}

	private void expectError(ErrorType type, String... args) {
		try {
			theCommandLine.parse(args);
			Assert.assertTrue("Expected " + type + " for " + Arrays.toString(args), false);
		} catch (CommandLineException e) {
			Assert.assertEquals(e.getMessage(), type, e.getType());
		}
	}

	/** A flag-value pair, a positional and an enable switch */
	@Test
	public void testDelay() {
		ParseResult result = theCommandLine.parse("delay", "-unit:s", "120", "-exclusive");
		Assert.assertTrue(result.isSuccess());
		ArgMap args = result.getArguments();
		Assert.assertEquals("s", args.getString("unit"));
		Assert.assertEquals(120, args.getLong("delay"));
		Assert.assertTrue(args.getBoolean("exclusive"));
		Assert.assertEquals("delay", args.getSubcommand());
		Assert.assertEquals("delay", result.getSubcommand().getName());
		Assert.assertEquals(Verbosity.INFO, args.get(StandardParameters.VERBOSITY, Verbosity.class));
	}

	/** Defaults are merged in for everything not given */
	@Test
	public void testDefaults() {
		ArgMap args = theCommandLine.parse("delay", "5").getArguments();
		Assert.assertEquals(ArgValue.of("ms"), args.get("unit"));
		Assert.assertFalse(args.getBoolean("exclusive"));
		Assert.assertFalse(args.getBoolean("verbose"));
		Assert.assertFalse(args.getBoolean("quiet"));
		Assert.assertEquals(5, args.getInt("delay"));
	}

	/** Negative numbers are values, not flags */
	@Test
	public void testNegativeNumber() {
		ArgMap args = theCommandLine.parse("delay", "-100", "-u", "minute").getArguments();
		Assert.assertEquals(-100, args.getLong("delay"));
		Assert.assertEquals("minute", args.getString("unit"));
	}

	@Test
	public void testShorthandPair() {
		ArgMap args = theCommandLine.parse("delay", "-u=hour", "3").getArguments();
		Assert.assertEquals("hour", args.getString("unit"));
	}

	@Test
	public void testInvalidValue() {
		expectError(ErrorType.INVALID_VALUE, "delay", "two");
	}

	/** Once a subcommand is matched, another subcommand's name is just a value */
	@Test
	public void testSecondSubcommand() {
		expectError(ErrorType.TOO_MANY_POSITIONALS, "delay", "100", "dummy");
	}

	@Test
	public void testTooManyPositionals() {
		expectError(ErrorType.TOO_MANY_POSITIONALS, "dummy", "extra");
		expectError(ErrorType.TOO_MANY_POSITIONALS, "extra");
	}

	@Test
	public void testInvalidChoice() {
		try {
			theCommandLine.parse("delay", "-unit", "pico", "1");
			Assert.assertTrue("Expected an invalid choice", false);
		} catch (CommandLineException e) {
			Assert.assertEquals(ErrorType.INVALID_CHOICE, e.getType());
			Assert.assertEquals("Error: pico is not valid for unit; choose from ms, s, minute, hour", e.getMessage());
		}
	}

	@Test
	public void testMissingPositional() {
		expectError(ErrorType.MISSING_POSITIONAL, "delay", "-u", "s");
	}

	@Test
	public void testUnknownFlag() {
		expectError(ErrorType.UNKNOWN_FLAG, "delay", "10", "-bogus");
		// Subcommand flags are not known before the subcommand
		expectError(ErrorType.UNKNOWN_FLAG, "-unit", "s", "delay", "10");
	}

	@Test
	public void testPositionalAsFlag() {
		expectError(ErrorType.POSITIONAL_USED_AS_FLAG, "delay", "-delay", "10");
	}

	@Test
	public void testRepeatedValue() {
		expectError(ErrorType.INVALID_VALUE, "delay", "10", "-u", "s", "-u", "ms");
	}

	@Test
	public void testFlagWithoutValue() {
		expectError(ErrorType.INVALID_VALUE, "delay", "10", "-u");
	}

	/** Mutually exclusive flags conflict in either order */
	@Test
	public void testConflictingFlags() {
		theCommandLine = CommandLine.build("prog").withoutPrintFlags()//
			.withRoot(root -> root.withGroup(g -> g//
				.with("-a", p -> p.enable())//
				.with("-b", p -> p.enable())//
				.mutuallyExclusive()))//
			.build();
		expectError(ErrorType.CONFLICTING_FLAGS, "-a", "-b");
		expectError(ErrorType.CONFLICTING_FLAGS, "-b", "-a");
		Assert.assertTrue(theCommandLine.parse("-b").getArguments().getBoolean("b"));
		Assert.assertNull(theCommandLine.parse("-b").getArguments().getSubcommand());
	}

	/** Root post-processors and validators run before the subcommand's, and the first failed validator stops the pipeline */
	@Test
	public void testPipeline() {
		List<String> order = new ArrayList<>();
		boolean[] rootValid = new boolean[] { true };
		theCommandLine = CommandLine.build("prog")//
			.withHelpOutput(new PrintStream(theHelp, true))//
			.withRoot(root -> root//
				.withValidator((args, log) -> {
					order.add("root validator: " + log.getVerbosity());
					return rootValid[0];
				})//
				.withPostProcessor((args, log) -> order.add("root post-processor")))//
			.withSubcommand(CommandSpec.build("sub")//
				.withPostProcessor((args, log) -> {
					order.add("sub post-processor");
					args.put("derived", ArgValue.of(args.getBoolean("quiet")));
				})//
				.withValidator((args, log) -> {
					order.add("sub validator");
					return false;
				})//
				.withValidator((args, log) -> {
					order.add("unreachable");
					return true;
				})//
				.build())//
			.build();

		ParseResult result = theCommandLine.parse("sub", "-q");
		Assert.assertEquals(ParseResult.Status.VALIDATION_FAILED, result.getStatus());
		Assert.assertNull(result.getArguments());
		Assert.assertEquals(Arrays.asList("root post-processor", "root validator: QUIET", "sub post-processor", "sub validator"), order);

		order.clear();
		rootValid[0] = false;
		Assert.assertEquals(CommandLine.EXIT_FAILURE, theCommandLine.run("sub"));
		Assert.assertEquals(Arrays.asList("root post-processor", "root validator: INFO"), order);
	}

	@Test
	public void testVerbosityPrecedence() {
		Assert.assertEquals(Verbosity.VERBOSE, theCommandLine.parse("-V").getArguments().get("verbosity", Verbosity.class));
		Assert.assertEquals(Verbosity.DEBUG, theCommandLine.parse("-V", "-debug").getArguments().get("verbosity", Verbosity.class));
		Assert.assertEquals(Verbosity.QUIET, theCommandLine.parse("-debug", "-q").getArguments().get("verbosity", Verbosity.class));
		Assert.assertEquals(Verbosity.QUIET, theCommandLine.getLog().getVerbosity());
		theCommandLine.parse();
		Assert.assertEquals(Verbosity.INFO, theCommandLine.getLog().getVerbosity());
	}

	/** Each parse starts from the log's configured verbosity, so a quiet parse does not silence the errors of the next */
	@Test
	public void testVerbosityReset() {
		LogCapture capture = new LogCapture("reset");
		theCommandLine = CommandLine.build("subby")//
			.withLog(capture.getLog())//
			.withSubcommand(delay())//
			.build();
		Assert.assertTrue(theCommandLine.parse("-q").isSuccess());
		Assert.assertEquals(Verbosity.QUIET, capture.getLog().getVerbosity());
		Assert.assertEquals(CommandLine.EXIT_USAGE, theCommandLine.run("extra"));
		Assert.assertEquals("ERROR Too many positional arguments provided\n", capture.getText());
		Assert.assertEquals(Verbosity.INFO, capture.getLog().getVerbosity());
	}

	@Test
	public void testGeneralHelp() {
		ParseResult result = theCommandLine.parse("-h");
		Assert.assertEquals(ParseResult.Status.HELP, result.getStatus());
		Assert.assertNull(result.getSubcommand());
		Assert.assertEquals(result.getHelp(), help());
		Assert.assertTrue(help(), help().startsWith("subby command options...\nEdit subtitle files\n\nSubcommands:\n"));
		Assert.assertTrue(help(), help().contains("\tdelay\tDelay subtitles\n"));
		Assert.assertTrue(help(), help().contains("\tdummy\tDoes nothing\n"));
	}

	/** Help for a subcommand, even when the rest of the command line is invalid */
	@Test
	public void testSubcommandHelp() {
		ParseResult result = theCommandLine.parse("-bogus", "delay", "--help");
		Assert.assertEquals(ParseResult.Status.HELP, result.getStatus());
		Assert.assertEquals("delay", result.getSubcommand().getName());
		Assert.assertTrue(help(), help().startsWith("subby delay amount {-V | -debug | -q} {-u} {-exclusive}\nDelay subtitles\n"));
		Assert.assertEquals(theCommandLine.printHelp("delay"), help());
	}

	@Test
	public void testRun() {
		Assert.assertEquals(CommandLine.EXIT_SUCCESS, theCommandLine.run("delay", "-u", "s", "30"));
		Assert.assertEquals(Arrays.asList("delay 30s"), theCalls);
		Assert.assertEquals(CommandLine.EXIT_USAGE, theCommandLine.run("delay", "-u", "s"));
		Assert.assertEquals(CommandLine.EXIT_SUCCESS, theCommandLine.run("delay", "-help"));
		Assert.assertEquals(1, theCalls.size());

		// No handler for the root: print help
		theHelp.reset();
		Assert.assertEquals(CommandLine.EXIT_SUCCESS, theCommandLine.run());
		Assert.assertTrue(help(), help().startsWith("subby command options..."));
	}

	@Test
	public void testHandlerFailure() {
		theCommandLine = CommandLine.build("prog").withoutPrintFlags()//
			.withRoot(root -> root.withHandler((args, log) -> {
				throw new IOException("disk full");
			}))//
			.build();
		Assert.assertEquals(CommandLine.EXIT_FAILURE, theCommandLine.run());
	}

	/** Schema collisions between the root and a subcommand are caught when the command line is built */
	@Test
	public void testCollision() {
		try {
			CommandLine.build("prog")//
				.withSubcommand(CommandSpec.build("sub").withParameter("-quiet", p -> p.enable()).build())//
				.build();
			Assert.assertTrue("Expected a collision", false);
		} catch (IllegalArgumentException e) {
			Assert.assertFalse(e instanceof CommandLineException);
		}
	}
}

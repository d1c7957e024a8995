package org.subby.args;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/** Tests the help text produced by {@link HelpFormatter} */
public class HelpFormatterTest {
	private static final CommandSpec ROOT = CommandSpec.build("subby").withHelp("Edit subtitle files").build();
	private static final CommandSpec DELAY = CommandSpec.build("delay")//
		.withHelp("Delay subtitles")//
		.withParameter("-unit", p -> p.shorthand("-u").defaultValue("ms").help("The unit"))//
		.withParameter("delay", p -> p.displayName("amount").help("The amount"))//
		.withGroup(StandardParameters.output())//
		.build();
	private static final CommandSpec MERGE = CommandSpec.build("merge")//
		.withHelp("Merge subtitles")//
		.withGroup(StandardParameters.multipleInput())//
		.build();

	@Test
	public void testGeneralHelp() {
		Assert.assertEquals("subby command options...\n"//
			+ "Edit subtitle files\n"//
			+ "\n"//
			+ "Subcommands:\n"//
			+ "\tdelay\tDelay subtitles\n"//
			+ "\tmerge\tMerge subtitles\n", //
			HelpFormatter.printGeneralHelp(ROOT, Arrays.asList(DELAY, MERGE)));
	}

	@Test
	public void testCommandHelp() {
		Assert.assertEquals("subby delay amount {-u} [-o | -O]\n"//
			+ "Delay subtitles\n"//
			+ "\n"//
			+ "Parameters:\n"//
			+ "\tamount\tThe amount\n"//
			+ "\n"//
			+ "Flags:\n"//
			+ "\t-unit, -u\tThe unit\n"//
			+ "\t\t(ms)\n"//
			+ "\toutput_file, -o\tThe output file\n"//
			+ "\t-overwrite, -O\tOverwrite input file\n", //
			HelpFormatter.printCommandHelp(ROOT, DELAY));
	}

	/** Multi-valued positionals are marked in the usage line */
	@Test
	public void testMultipleUsage() {
		String help = HelpFormatter.printCommandHelp(ROOT, MERGE);
		Assert.assertTrue(help, help.startsWith("subby merge input... {-R}\nMerge subtitles\n"));
		Assert.assertTrue(help, help.contains("\tinput\tInput files for the command\n"));
	}
}

package org.subby.args;

import org.apache.log4j.Logger;
import org.subby.log.CommandLog;

/**
 * Runs the post-processors and then the validators of the root command, then those of the matched subcommand, stopping at the first
 * validator that fails. Root post-processors therefore run before any subcommand validator, so values they derive (such as the verbosity
 * of the {@link CommandLog}) are in effect when the subcommand's validators report.
 */
public class PipelineRunner {
	private static final Logger log = Logger.getLogger(PipelineRunner.class);

	private final CommandLog theLog;

	/** @param commandLog The logging context to give to each post-processor and validator */
	public PipelineRunner(CommandLog commandLog) {
		theLog = commandLog;
	}

	/** @return The logging context given to each post-processor and validator */
	public CommandLog getLog() {
		return theLog;
	}

	/**
	 * @param root The root command
	 * @param subcommand The matched subcommand, or null if none was matched
	 * @param args The resolved arguments, which the post-processors may modify
	 * @return Whether all validators passed
	 */
	public boolean run(CommandSpec root, CommandSpec subcommand, ArgMap args) {
		if (!runCommand(root, args))
			return false;
		return subcommand == null || runCommand(subcommand, args);
	}

	boolean runCommand(CommandSpec command, ArgMap args) {
		if (log.isDebugEnabled())
			log.debug("Post-processing for " + command.getName());
		for (PostProcessor postProcessor : command.getPostProcessors())
			postProcessor.process(args, theLog);
		if (log.isDebugEnabled())
			log.debug("Validating for " + command.getName());
		for (Validator validator : command.getValidators()) {
			if (!validator.validate(args, theLog)) {
				log.debug("Validation failed for " + command.getName() + " at " + validator);
				return false;
			}
		}
		return true;
	}
}

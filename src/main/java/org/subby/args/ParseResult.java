package org.subby.args;

/** The outcome of {@link CommandLine#parse(String...) parsing} a command line that was structurally valid */
public class ParseResult {
	/** The kinds of outcomes */
	public enum Status {
		/** The arguments were parsed and validated */
		SUCCESS,
		/** A validator rejected the arguments after reporting why */
		VALIDATION_FAILED,
		/** Help was requested and printed instead of parsing */
		HELP;
	}

	private final Status theStatus;
	private final ArgMap theArguments;
	private final CommandSpec theSubcommand;
	private final String theHelp;

	private ParseResult(Status status, ArgMap arguments, CommandSpec subcommand, String help) {
		theStatus = status;
		theArguments = arguments;
		theSubcommand = subcommand;
		theHelp = help;
	}

	static ParseResult success(ArgMap arguments, CommandSpec subcommand) {
		return new ParseResult(Status.SUCCESS, arguments, subcommand, null);
	}

	static ParseResult validationFailed(CommandSpec subcommand) {
		return new ParseResult(Status.VALIDATION_FAILED, null, subcommand, null);
	}

	static ParseResult help(CommandSpec subcommand, String help) {
		return new ParseResult(Status.HELP, null, subcommand, help);
	}

	/** @return The kind of this outcome */
	public Status getStatus() {
		return theStatus;
	}

	/** @return Whether the arguments were parsed and validated */
	public boolean isSuccess() {
		return theStatus == Status.SUCCESS;
	}

	/** @return The validated arguments, or null if parsing did not succeed */
	public ArgMap getArguments() {
		return theArguments;
	}

	/** @return The matched subcommand, or null if none was matched */
	public CommandSpec getSubcommand() {
		return theSubcommand;
	}

	/** @return The help text that was printed, or null if help was not requested */
	public String getHelp() {
		return theHelp;
	}

	@Override
	public String toString() {
		switch (theStatus) {
		case SUCCESS:
			return theArguments.toString();
		default:
			return theStatus.toString();
		}
	}
}

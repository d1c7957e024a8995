package org.subby.args;

/** Thrown when a command line cannot be parsed against the declared parameters */
public class CommandLineException extends IllegalArgumentException {
	/** The kinds of structural errors in a command line */
	public enum ErrorType {
		/** A flag token resolves to no declared flag */
		UNKNOWN_FLAG,
		/** A positional parameter's name was used as a flag */
		POSITIONAL_USED_AS_FLAG,
		/** More positional values were given than positional parameters are declared */
		TOO_MANY_POSITIONALS,
		/** A positional parameter with no default was not given a value */
		MISSING_POSITIONAL,
		/** Two or more members of a mutually exclusive group were given */
		CONFLICTING_FLAGS,
		/** A value is not among its parameter's choices */
		INVALID_CHOICE,
		/** A value could not be converted to its parameter's type, or the parameter was given the wrong number of values */
		INVALID_VALUE;
	}

	private final ErrorType theType;

	/**
	 * @param type The type of the error
	 * @param message The message for the user
	 */
	public CommandLineException(ErrorType type, String message) {
		super(message);
		theType = type;
	}

	/**
	 * @param type The type of the error
	 * @param message The message for the user
	 * @param cause The cause of the error
	 */
	public CommandLineException(ErrorType type, String message, Throwable cause) {
		super(message, cause);
		theType = type;
	}

	/** @return The type of this error */
	public ErrorType getType() {
		return theType;
	}
}

package org.subby.log;

import java.util.Objects;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * The logging context for a command-line program. Validators, post-processors and command handlers are given an instance of this class
 * to report feedback to the user; the messages are filtered by the context's {@link #getVerbosity() verbosity} and written to a log4j
 * logger named {@value #LOGGER_PREFIX}&lt;program name&gt;.
 */
public class CommandLog {
	/** The prefix of the names of the log4j loggers that command logs write to */
	public static final String LOGGER_PREFIX = "console.";

	private final String theProgramName;
	private final Logger theLogger;
	private Verbosity theVerbosity;

	/** @param programName The name of the program, used to name the logger */
	public CommandLog(String programName) {
		this(programName, Logger.getLogger(LOGGER_PREFIX + programName));
	}

	/**
	 * @param programName The name of the program
	 * @param logger The logger to write messages to
	 */
	public CommandLog(String programName, Logger logger) {
		theProgramName = Objects.requireNonNull(programName, "Program name must not be null");
		theLogger = Objects.requireNonNull(logger, "Logger must not be null");
		theVerbosity = Verbosity.INFO;
	}

	/** @return The name of the program this log reports for */
	public String getProgramName() {
		return theProgramName;
	}

	/** @return The logger messages are written to */
	public Logger getLogger() {
		return theLogger;
	}

	/** @return The threshold for messages */
	public Verbosity getVerbosity() {
		return theVerbosity;
	}

	/**
	 * @param verbosity The threshold for messages
	 * @return This log
	 */
	public CommandLog setVerbosity(Verbosity verbosity) {
		theVerbosity = Objects.requireNonNull(verbosity, "Verbosity must not be null");
		return this;
	}

	/**
	 * @param level The message level
	 * @return Whether a message of the given level would be printed
	 */
	public boolean isEnabled(Verbosity level) {
		return theVerbosity.permits(level);
	}

	public void debug(String message) {
		log(Verbosity.DEBUG, message, null);
	}

	public void verbose(String message) {
		log(Verbosity.VERBOSE, message, null);
	}

	public void info(String message) {
		log(Verbosity.INFO, message, null);
	}

	public void warn(String message) {
		log(Verbosity.WARN, message, null);
	}

	public void error(String message) {
		log(Verbosity.ERROR, message, null);
	}

	public void error(String message, Throwable cause) {
		log(Verbosity.ERROR, message, cause);
	}

	private void log(Verbosity level, String message, Throwable cause) {
		if (!isEnabled(level))
			return;
		// The verbosity is the only filter, so everything that passes is logged at INFO or above
		Level logLevel;
		switch (level) {
		case ERROR:
			logLevel = Level.ERROR;
			break;
		case WARN:
			logLevel = Level.WARN;
			break;
		default:
			logLevel = Level.INFO;
			break;
		}
		theLogger.log(logLevel, message, cause);
	}

	@Override
	public String toString() {
		return theProgramName + "(" + theVerbosity + ")";
	}
}

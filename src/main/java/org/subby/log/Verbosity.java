package org.subby.log;

/**
 * Levels of user-facing feedback. As a threshold, a level lets through messages of its own level and all later levels. {@link #QUIET}
 * lets nothing through.
 */
public enum Verbosity {
	/** Diagnostic detail */
	DEBUG,
	/** Extra feedback */
	VERBOSE,
	/** Normal feedback */
	INFO,
	/** Warnings */
	WARN,
	/** Errors */
	ERROR,
	/** No output at all */
	QUIET;

	/**
	 * @param messageLevel The level of a message
	 * @return Whether a message of the given level is printed when this is the threshold
	 */
	public boolean permits(Verbosity messageLevel) {
		return this != QUIET && messageLevel.compareTo(this) >= 0;
	}
}

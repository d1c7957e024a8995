package org.subby.args;

import org.subby.log.CommandLog;

/**
 * Checks a resolved argument set after post-processing. A validator that fails is responsible for reporting why to the user.
 *
 * @see CommandSpec#getValidators()
 */
@FunctionalInterface
public interface Validator {
	/**
	 * @param args The resolved arguments
	 * @param log The logging context to report problems to
	 * @return Whether the arguments are valid. False stops the program.
	 */
	boolean validate(ArgMap args, CommandLog log);
}

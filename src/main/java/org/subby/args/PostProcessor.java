package org.subby.args;

import org.subby.log.CommandLog;

/**
 * Derives or rewrites values in a resolved argument set before validation, e.g. decoding a file range from a raw string. Post-processors
 * must not throw: a failure of anything they call must be left for a {@link Validator} to report.
 *
 * @see CommandSpec#getPostProcessors()
 */
@FunctionalInterface
public interface PostProcessor {
	/**
	 * @param args The resolved arguments, to modify in place
	 * @param log The logging context
	 */
	void process(ArgMap args, CommandLog log);
}

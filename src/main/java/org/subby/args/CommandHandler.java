package org.subby.args;

import java.io.IOException;
import java.text.ParseException;

import org.subby.log.CommandLog;

/** Performs the work of a command once its arguments have been parsed and validated */
@FunctionalInterface
public interface CommandHandler {
	/**
	 * @param args The validated arguments
	 * @param log The logging context to report to
	 * @throws IOException If the command fails to read or write a file
	 * @throws ParseException If the command fails to decode its input
	 */
	void run(ArgMap args, CommandLog log) throws IOException, ParseException;
}

package org.subby.args;

import java.text.ParseException;

/**
 * Decodes the text of a command-line value into a typed value
 *
 * @param <T> The type of the decoded value
 */
@FunctionalInterface
public interface ValueDecoder<T> {
	/**
	 * @param text The text representing the value as specified on the command line
	 * @return The decoded value. Must not be null; an empty but valid value must be represented by the decoded type itself.
	 * @throws ParseException If the value cannot be decoded
	 */
	T decode(String text) throws ParseException;
}

package org.subby.args;

import java.text.ParseException;

import org.subby.args.ArgValue.StringValue;

/**
 * The declared type of a parameter's values. Converts raw command-line text into an {@link ArgValue}.
 *
 * @see ValueTypes
 */
public interface ValueType {
	/** @return A name for this type, used in help and error messages */
	String getName();

	/**
	 * @param text The raw text to convert
	 * @return The converted value
	 * @throws ParseException If the text cannot be converted to this type
	 */
	ArgValue parse(String text) throws ParseException;

	/**
	 * @param value The value to test
	 * @return Whether the given value is already of this type
	 */
	boolean accepts(ArgValue value);

	/** @return Whether this type leaves raw text unchanged */
	default boolean isString() {
		return false;
	}

	/**
	 * Converts a value to this type. A value already of this type is returned as is, so coercing a value twice yields the same result as
	 * coercing it once.
	 *
	 * @param value The value to coerce
	 * @return The value, converted to this type
	 * @throws ParseException If the value cannot be converted to this type
	 */
	default ArgValue coerce(ArgValue value) throws ParseException {
		if (accepts(value))
			return value;
		else if (value instanceof StringValue)
			return parse(((StringValue) value).getValue());
		throw new ParseException("A " + value.getTypeName() + " cannot be used as a " + getName() + ": " + value, 0);
	}
}

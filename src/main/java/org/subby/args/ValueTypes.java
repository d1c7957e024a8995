package org.subby.args;

import java.text.ParseException;
import java.util.Objects;

import org.subby.args.ArgValue.BoolValue;
import org.subby.args.ArgValue.CustomValue;
import org.subby.args.ArgValue.IntValue;
import org.subby.args.ArgValue.StringValue;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

/** Standard {@link ValueType}s */
public class ValueTypes {
	/** Leaves text unchanged */
	public static final ValueType STRING = new ValueType() {
		@Override
		public String getName() {
			return "string";
		}

		@Override
		public ArgValue parse(String text) {
			return ArgValue.of(text);
		}

		@Override
		public boolean accepts(ArgValue value) {
			return value instanceof StringValue;
		}

		@Override
		public boolean isString() {
			return true;
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** Parses decimal integers, including negative ones */
	public static final ValueType INTEGER = new ValueType() {
		@Override
		public String getName() {
			return "integer";
		}

		@Override
		public ArgValue parse(String text) throws ParseException {
			Long value = Longs.tryParse(text.trim());
			if (value == null)
				throw new ParseException("'" + text + "' is not an integer", 0);
			return ArgValue.of(value.longValue());
		}

		@Override
		public boolean accepts(ArgValue value) {
			return value instanceof IntValue;
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** Parses "true" or "false", ignoring case */
	public static final ValueType BOOLEAN = new ValueType() {
		@Override
		public String getName() {
			return "boolean";
		}

		@Override
		public ArgValue parse(String text) throws ParseException {
			if ("true".equalsIgnoreCase(text))
				return ArgValue.of(true);
			else if ("false".equalsIgnoreCase(text))
				return ArgValue.of(false);
			throw new ParseException("'" + text + "' is not a boolean", 0);
		}

		@Override
		public boolean accepts(ArgValue value) {
			return value instanceof BoolValue;
		}

		@Override
		public String toString() {
			return getName();
		}
	};

	/** Parses floating-point numbers into {@link Double} custom values */
	public static final ValueType NUMBER = of("number", Double.class, text -> {
		Double value = Doubles.tryParse(text.trim());
		if (value == null)
			throw new ParseException("'" + text + "' is not a number", 0);
		return value;
	});

	private ValueTypes() {}

	/**
	 * @param <T> The type of the decoded values
	 * @param name The name of the type
	 * @param type The class of the decoded values
	 * @param decoder The decoder for the type
	 * @return A value type that produces {@link CustomValue custom values} using the given decoder
	 */
	public static <T> ValueType of(String name, Class<T> type, ValueDecoder<? extends T> decoder) {
		return new CustomValueType<>(name, type, decoder);
	}

	static class CustomValueType<T> implements ValueType {
		private final String theName;
		private final Class<T> theType;
		private final ValueDecoder<? extends T> theDecoder;

		CustomValueType(String name, Class<T> type, ValueDecoder<? extends T> decoder) {
			theName = Objects.requireNonNull(name, "Name must not be null");
			theType = Objects.requireNonNull(type, "Type must not be null");
			theDecoder = Objects.requireNonNull(decoder, "Decoder must not be null");
		}

		@Override
		public String getName() {
			return theName;
		}

		@Override
		public ArgValue parse(String text) throws ParseException {
			T value;
			try {
				value = theDecoder.decode(text);
			} catch (IllegalArgumentException e) {
				ParseException pe = new ParseException(e.getMessage(), 0);
				pe.initCause(e);
				throw pe;
			}
			if (value == null)
				throw new ParseException("No " + theName + " decoded from '" + text + "'", 0);
			return ArgValue.custom(value);
		}

		@Override
		public boolean accepts(ArgValue value) {
			return value instanceof CustomValue && theType.isInstance(((CustomValue) value).getValue());
		}

		@Override
		public String toString() {
			return theName;
		}
	}
}

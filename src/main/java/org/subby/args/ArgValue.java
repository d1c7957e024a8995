package org.subby.args;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;

/**
 * A single resolved argument value. This is a closed set of variants: a string, a boolean, an integer, a value produced by a custom
 * {@link ValueType}, a tuple of other values, or {@link #NONE}.
 */
public abstract class ArgValue {
	/** Represents the absence of a value, e.g. when no subcommand was matched */
	public static final ArgValue NONE = new ArgValue() {
		@Override
		public Object unwrap() {
			return null;
		}

		@Override
		public String getTypeName() {
			return "none";
		}

		@Override
		public String toString() {
			return "none";
		}
	};

	ArgValue() {}

	/** @return The plain java value of this argument: a String, Boolean, Long, custom object, List of these, or null for {@link #NONE} */
	public abstract Object unwrap();

	/** @return A short name of this value's variant, for error messages */
	public abstract String getTypeName();

	/** @return Whether this value is {@link #NONE} */
	public boolean isNone() {
		return this == NONE;
	}

	/**
	 * @param value The string value
	 * @return A string argument value
	 */
	public static StringValue of(String value) {
		return new StringValue(value);
	}

	/**
	 * @param value The boolean value
	 * @return A boolean argument value
	 */
	public static BoolValue of(boolean value) {
		return value ? BoolValue.TRUE : BoolValue.FALSE;
	}

	/**
	 * @param value The integer value
	 * @return An integer argument value
	 */
	public static IntValue of(long value) {
		return new IntValue(value);
	}

	/**
	 * @param value The value produced by a custom decoder
	 * @return A custom argument value
	 */
	public static CustomValue custom(Object value) {
		return new CustomValue(value);
	}

	/**
	 * @param values The values of the tuple
	 * @return A tuple argument value
	 */
	public static TupleValue tuple(List<? extends ArgValue> values) {
		return new TupleValue(values);
	}

	/**
	 * @param values The string values of the tuple
	 * @return A tuple of string values
	 */
	public static TupleValue strings(List<String> values) {
		List<ArgValue> elements = new ArrayList<>(values.size());
		for (String value : values)
			elements.add(of(value));
		return new TupleValue(elements);
	}

	/** A string value */
	public static final class StringValue extends ArgValue {
		private final String theValue;

		StringValue(String value) {
			theValue = Objects.requireNonNull(value, "String value must not be null");
		}

		/** @return The string */
		public String getValue() {
			return theValue;
		}

		@Override
		public Object unwrap() {
			return theValue;
		}

		@Override
		public String getTypeName() {
			return "string";
		}

		@Override
		public int hashCode() {
			return theValue.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof StringValue && theValue.equals(((StringValue) obj).theValue);
		}

		@Override
		public String toString() {
			return theValue;
		}
	}

	/** A boolean value */
	public static final class BoolValue extends ArgValue {
		static final BoolValue TRUE = new BoolValue(true);
		static final BoolValue FALSE = new BoolValue(false);

		private final boolean theValue;

		private BoolValue(boolean value) {
			theValue = value;
		}

		/** @return The boolean */
		public boolean getValue() {
			return theValue;
		}

		@Override
		public Object unwrap() {
			return theValue;
		}

		@Override
		public String getTypeName() {
			return "boolean";
		}

		@Override
		public int hashCode() {
			return Boolean.hashCode(theValue);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof BoolValue && theValue == ((BoolValue) obj).theValue;
		}

		@Override
		public String toString() {
			return String.valueOf(theValue);
		}
	}

	/** An integer value */
	public static final class IntValue extends ArgValue {
		private final long theValue;

		IntValue(long value) {
			theValue = value;
		}

		/** @return The integer */
		public long getValue() {
			return theValue;
		}

		@Override
		public Object unwrap() {
			return theValue;
		}

		@Override
		public String getTypeName() {
			return "integer";
		}

		@Override
		public int hashCode() {
			return Long.hashCode(theValue);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof IntValue && theValue == ((IntValue) obj).theValue;
		}

		@Override
		public String toString() {
			return String.valueOf(theValue);
		}
	}

	/** A value produced by a custom decoder, e.g. a file range */
	public static final class CustomValue extends ArgValue {
		private final Object theValue;

		CustomValue(Object value) {
			theValue = Objects.requireNonNull(value, "Custom value must not be null");
		}

		/** @return The decoded object */
		public Object getValue() {
			return theValue;
		}

		@Override
		public Object unwrap() {
			return theValue;
		}

		@Override
		public String getTypeName() {
			return theValue.getClass().getSimpleName();
		}

		@Override
		public int hashCode() {
			return theValue.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof CustomValue && theValue.equals(((CustomValue) obj).theValue);
		}

		@Override
		public String toString() {
			return theValue.toString();
		}
	}

	/** An ordered tuple of values, produced by {@link ParameterKind#MULTIPLE multi-valued} parameters */
	public static final class TupleValue extends ArgValue {
		private final List<ArgValue> theValues;

		TupleValue(List<? extends ArgValue> values) {
			theValues = Collections.unmodifiableList(new ArrayList<>(values));
		}

		/** @return The elements of this tuple */
		public List<ArgValue> getValues() {
			return theValues;
		}

		/** @return The number of elements in this tuple */
		public int size() {
			return theValues.size();
		}

		@Override
		public Object unwrap() {
			List<Object> unwrapped = new ArrayList<>(theValues.size());
			for (ArgValue value : theValues)
				unwrapped.add(value.unwrap());
			return Collections.unmodifiableList(unwrapped);
		}

		@Override
		public String getTypeName() {
			return "tuple";
		}

		@Override
		public int hashCode() {
			return theValues.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof TupleValue && theValues.equals(((TupleValue) obj).theValues);
		}

		@Override
		public String toString() {
			return Joiner.on(';').join(theValues);
		}
	}
}

package org.subby.args;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.subby.args.ArgValue.TupleValue;

import com.google.common.collect.ImmutableSet;

/**
 * An immutable description of a single command-line parameter. A parameter whose name begins with the {@link #FLAG_MARKER flag marker} is
 * a flag, identified on the command line by its name (or its shorthand). Any other parameter is a positional, identified by its position.
 */
public class ParameterSpec implements ParameterElement {
	/** The character that marks a flag name */
	public static final char FLAG_MARKER = '-';

	private final String theName;
	private final String theCanonicalName;
	private final String theShorthand;
	private final String theHelp;
	private final String theDisplayName;
	private final ParameterKind theKind;
	private final Set<String> theChoices;
	private final ValueType theValueType;
	private final ArgValue theDefault;

	ParameterSpec(Builder builder, ArgValue defaultValue) {
		theName = builder.theName;
		theCanonicalName = canonicalName(builder.theName);
		theShorthand = builder.theShorthand;
		theHelp = builder.theHelp;
		theDisplayName = builder.theDisplayName;
		theKind = builder.theKind;
		theChoices = builder.theChoices;
		theValueType = builder.theValueType;
		theDefault = defaultValue;
	}

	/**
	 * @param name The name for the parameter. Flags begin with {@link #FLAG_MARKER}, e.g. "-unit"; positionals do not, e.g. "delay".
	 * @return A builder for the parameter
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/**
	 * @param token The flag or parameter name, possibly with leading flag markers
	 * @return The name with all leading flag markers removed
	 */
	public static String canonicalName(String token) {
		int start = 0;
		while (start < token.length() && token.charAt(start) == FLAG_MARKER)
			start++;
		return token.substring(start);
	}

	/** @return The name of this parameter as declared, including any flag marker */
	public String getName() {
		return theName;
	}

	/** @return The name of this parameter without flag markers. This is the key of this parameter's value in the {@link ArgMap}. */
	public String getCanonicalName() {
		return theCanonicalName;
	}

	/** @return The short alias for this flag as declared (e.g. "-u"), or null if it has none */
	public String getShorthand() {
		return theShorthand;
	}

	/** @return A description of this parameter */
	public String getHelp() {
		return theHelp;
	}

	/** @return The name to display for this parameter in help, or null to use its {@link #getName() name} */
	public String getDisplayName() {
		return theDisplayName;
	}

	/** @return The behavior of this parameter */
	public ParameterKind getKind() {
		return theKind;
	}

	/** @return The values this parameter is restricted to, or null if it is unrestricted */
	public Set<String> getChoices() {
		return theChoices;
	}

	/** @return The type of this parameter's values */
	public ValueType getValueType() {
		return theValueType;
	}

	/** @return The declared default for this parameter, already converted to its {@link #getValueType() value type}, or null */
	public ArgValue getDefault() {
		return theDefault;
	}

	/** @return Whether this parameter is a positional, i.e. its name does not begin with the flag marker */
	public boolean isPositional() {
		return !isFlag(theName);
	}

	static boolean isFlag(String name) {
		return !name.isEmpty() && name.charAt(0) == FLAG_MARKER;
	}

	@Override
	public String toString() {
		return theName + " (" + theKind.name().toLowerCase() + (theKind.isSwitch() ? "" : " " + theValueType.getName()) + ")";
	}

	/** Builds a {@link ParameterSpec} */
	public static class Builder {
		private final String theName;
		private String theShorthand;
		private String theHelp;
		private String theDisplayName;
		private ParameterKind theKind;
		private Set<String> theChoices;
		private ValueType theValueType;
		private ArgValue theDefault;

		Builder(String name) {
			if (name == null)
				throw new NullPointerException("Name must not be null");
			else if (canonicalName(name).isEmpty())
				throw new IllegalArgumentException("Parameter name must not be empty: \"" + name + "\"");
			theName = name;
			theHelp = "";
			theKind = ParameterKind.VALUE;
			theValueType = ValueTypes.STRING;
		}

		/**
		 * @param shorthand The short alias for the flag, including the flag marker, e.g. "-u"
		 * @return This builder
		 */
		public Builder shorthand(String shorthand) {
			if (!isFlag(shorthand) || canonicalName(shorthand).isEmpty())
				throw new IllegalArgumentException("Shorthand must begin with '" + FLAG_MARKER + "': \"" + shorthand + "\"");
			theShorthand = shorthand;
			return this;
		}

		/**
		 * @param help A description of the parameter
		 * @return This builder
		 */
		public Builder help(String help) {
			theHelp = help == null ? "" : help;
			return this;
		}

		/**
		 * @param displayName The name to display for the parameter in help
		 * @return This builder
		 */
		public Builder displayName(String displayName) {
			theDisplayName = displayName;
			return this;
		}

		/**
		 * @param kind The behavior of the parameter
		 * @return This builder
		 */
		public Builder kind(ParameterKind kind) {
			theKind = Objects.requireNonNull(kind, "Kind must not be null");
			return this;
		}

		/** @return This builder, configured as an {@link ParameterKind#ENABLE enable} switch */
		public Builder enable() {
			return kind(ParameterKind.ENABLE);
		}

		/** @return This builder, configured as a {@link ParameterKind#DISABLE disable} switch */
		public Builder disable() {
			return kind(ParameterKind.DISABLE);
		}

		/** @return This builder, configured as {@link ParameterKind#OPTIONAL optional} */
		public Builder optional() {
			return kind(ParameterKind.OPTIONAL);
		}

		/** @return This builder, configured as {@link ParameterKind#MULTIPLE multi-valued} */
		public Builder multiple() {
			return kind(ParameterKind.MULTIPLE);
		}

		/**
		 * @param choices The only values the parameter may be given
		 * @return This builder
		 */
		public Builder choices(String... choices) {
			return choices(Arrays.asList(choices));
		}

		/**
		 * @param choices The only values the parameter may be given
		 * @return This builder
		 */
		public Builder choices(Iterable<String> choices) {
			theChoices = ImmutableSet.copyOf(choices);
			return this;
		}

		/**
		 * @param valueType The type of the parameter's values
		 * @return This builder
		 */
		public Builder valueType(ValueType valueType) {
			theValueType = Objects.requireNonNull(valueType, "Value type must not be null");
			return this;
		}

		/**
		 * @param defaultValue The default for the parameter. Text is converted with the parameter's value type when it is built.
		 * @return This builder
		 */
		public Builder defaultValue(String defaultValue) {
			theDefault = defaultValue == null ? null : ArgValue.of(defaultValue);
			return this;
		}

		/**
		 * @param defaultValue The default for the parameter
		 * @return This builder
		 */
		public Builder defaultValue(long defaultValue) {
			theDefault = ArgValue.of(defaultValue);
			return this;
		}

		/**
		 * @param defaultValue The default for the parameter. Must be of (or convertible to) the parameter's value type.
		 * @return This builder
		 */
		public Builder defaultValue(ArgValue defaultValue) {
			theDefault = defaultValue;
			return this;
		}

		/**
		 * @return The new parameter
		 * @throws IllegalArgumentException If the configuration is invalid for the parameter
		 */
		public ParameterSpec build() throws IllegalArgumentException {
			if (!isFlag(theName)) {
				if (theKind.isSwitch())
					throw new IllegalArgumentException("Positional parameter " + theName + " cannot be a " + theKind + " switch");
				else if (theShorthand != null)
					throw new IllegalArgumentException("Positional parameter " + theName + " cannot have a shorthand");
			}
			ArgValue defaultValue = null;
			if (theDefault != null && !theKind.isSwitch()) {
				try {
					defaultValue = coerceDefault();
				} catch (ParseException e) {
					throw new IllegalArgumentException("Bad default for " + theName + ": " + e.getMessage(), e);
				}
				if (theChoices != null) {
					List<ArgValue> elements = defaultValue instanceof TupleValue ? ((TupleValue) defaultValue).getValues()
						: Collections.singletonList(defaultValue);
					for (ArgValue element : elements) {
						if (!theChoices.contains(element.toString()))
							throw new IllegalArgumentException(
								"Default " + element + " for " + theName + " is not among its choices " + theChoices);
					}
				}
			}
			return new ParameterSpec(this, defaultValue);
		}

		private ArgValue coerceDefault() throws ParseException {
			if (theKind != ParameterKind.MULTIPLE)
				return theValueType.coerce(theDefault);
			List<ArgValue> elements = new ArrayList<>();
			if (theDefault instanceof TupleValue) {
				for (ArgValue element : ((TupleValue) theDefault).getValues())
					elements.add(theValueType.coerce(element));
			} else
				elements.add(theValueType.coerce(theDefault));
			return ArgValue.tuple(elements);
		}
	}
}

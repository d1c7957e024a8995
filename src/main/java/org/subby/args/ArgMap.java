package org.subby.args;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.subby.args.ArgValue.BoolValue;
import org.subby.args.ArgValue.IntValue;
import org.subby.args.ArgValue.StringValue;
import org.subby.args.ArgValue.TupleValue;

import com.google.common.primitives.Primitives;

/**
 * A resolved set of arguments, keyed by the {@link ParameterSpec#getCanonicalName() canonical name} of each parameter. The typed getters
 * fail with an exception when the argument is absent or of a different type; they never substitute a default.
 */
public class ArgMap implements Iterable<Map.Entry<String, ArgValue>> {
	/** The key under which the name of the matched subcommand (or {@link ArgValue#NONE}) is stored */
	public static final String SUBCOMMAND_KEY = "subcmd";

	private final Map<String, ArgValue> theValues;

	/** Creates an empty argument map */
	public ArgMap() {
		theValues = new LinkedHashMap<>();
	}

	/**
	 * @param name The name of the argument
	 * @return Whether a value is present for the argument
	 */
	public boolean has(String name) {
		return theValues.containsKey(name);
	}

	/**
	 * @param name The name of the argument
	 * @return The value of the argument, or null if it is not present
	 */
	public ArgValue get(String name) {
		return theValues.get(name);
	}

	/**
	 * @param name The name of the argument
	 * @return The value of the argument
	 * @throws IllegalArgumentException If no value is present for the argument
	 */
	public ArgValue require(String name) throws IllegalArgumentException {
		ArgValue value = theValues.get(name);
		if (value == null)
			throw new IllegalArgumentException("No such argument: \"" + name + "\"");
		return value;
	}

	/**
	 * @param name The name of the argument
	 * @param value The value for the argument
	 * @return This map
	 */
	public ArgMap put(String name, ArgValue value) {
		theValues.put(Objects.requireNonNull(name, "Name must not be null"), Objects.requireNonNull(value, "Value must not be null"));
		return this;
	}

	/**
	 * @param other The arguments to add to this map, overriding any present in this map
	 * @return This map
	 */
	public ArgMap putAll(ArgMap other) {
		theValues.putAll(other.theValues);
		return this;
	}

	/**
	 * @param name The name of the argument to remove
	 * @return The removed value, or null if it was not present
	 */
	public ArgValue remove(String name) {
		return theValues.remove(name);
	}

	/** @return The names of all arguments in this map */
	public Set<String> names() {
		return Collections.unmodifiableSet(theValues.keySet());
	}

	/** @return The number of arguments in this map */
	public int size() {
		return theValues.size();
	}

	/**
	 * @param name The name of the argument
	 * @return The string value of the argument
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument is not a string
	 */
	public String getString(String name) throws IllegalArgumentException, ClassCastException {
		return cast(name, StringValue.class, "string").getValue();
	}

	/**
	 * @param name The name of the argument
	 * @return The boolean value of the argument
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument is not a boolean
	 */
	public boolean getBoolean(String name) throws IllegalArgumentException, ClassCastException {
		return cast(name, BoolValue.class, "boolean").getValue();
	}

	/**
	 * @param name The name of the argument
	 * @return The integer value of the argument
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument is not an integer
	 */
	public long getLong(String name) throws IllegalArgumentException, ClassCastException {
		return cast(name, IntValue.class, "integer").getValue();
	}

	/**
	 * @param name The name of the argument
	 * @return The integer value of the argument
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument is not an integer
	 * @throws ArithmeticException If the value does not fit in an int
	 */
	public int getInt(String name) throws IllegalArgumentException, ClassCastException {
		return Math.toIntExact(getLong(name));
	}

	/**
	 * @param name The name of the argument
	 * @return The elements of the tuple value of the argument
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument is not a tuple
	 */
	public List<ArgValue> getTuple(String name) throws IllegalArgumentException, ClassCastException {
		return cast(name, TupleValue.class, "tuple").getValues();
	}

	/**
	 * @param <T> The compile-time type of the value
	 * @param name The name of the argument
	 * @param type The run-time type of the value
	 * @return The value of the argument, {@link ArgValue#unwrap() unwrapped}
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If the argument's value is not of the given type
	 */
	public <T> T get(String name, Class<T> type) throws IllegalArgumentException, ClassCastException {
		ArgValue value = require(name);
		Object unwrapped = value.unwrap();
		Class<T> wrapped = Primitives.wrap(type);
		if (!wrapped.isInstance(unwrapped))
			throw new ClassCastException("Argument " + name + " (" + value.getTypeName() + ") cannot be used as a " + type.getName());
		return wrapped.cast(unwrapped);
	}

	/**
	 * @param <T> The compile-time type of the values
	 * @param name The name of the argument
	 * @param type The run-time type of the values
	 * @return The elements of the argument's tuple value, {@link ArgValue#unwrap() unwrapped}. If the argument is not a tuple, a list of
	 *         its single value.
	 * @throws IllegalArgumentException If the argument is not present
	 * @throws ClassCastException If any of the argument's values is not of the given type
	 */
	public <T> List<T> getAll(String name, Class<T> type) throws IllegalArgumentException, ClassCastException {
		ArgValue value = require(name);
		Class<T> wrapped = Primitives.wrap(type);
		List<ArgValue> elements = value instanceof TupleValue ? ((TupleValue) value).getValues() : Collections.singletonList(value);
		List<T> result = new ArrayList<>(elements.size());
		for (ArgValue element : elements) {
			Object unwrapped = element.unwrap();
			if (!wrapped.isInstance(unwrapped))
				throw new ClassCastException(
					"Argument " + name + " element (" + element.getTypeName() + ") cannot be used as a " + type.getName());
			result.add(wrapped.cast(unwrapped));
		}
		return Collections.unmodifiableList(result);
	}

	/** @return The name of the matched subcommand, or null if none was matched */
	public String getSubcommand() {
		ArgValue value = theValues.get(SUBCOMMAND_KEY);
		if (value == null || value.isNone())
			return null;
		return value.toString();
	}

	/** @return An unmodifiable view of this map */
	public Map<String, ArgValue> asMap() {
		return Collections.unmodifiableMap(theValues);
	}

	private <V extends ArgValue> V cast(String name, Class<V> variant, String typeName) {
		ArgValue value = require(name);
		if (!variant.isInstance(value))
			throw new ClassCastException("Argument " + name + " (" + value.getTypeName() + ") cannot be used as a " + typeName);
		return variant.cast(value);
	}

	@Override
	public Iterator<Map.Entry<String, ArgValue>> iterator() {
		return asMap().entrySet().iterator();
	}

	@Override
	public int hashCode() {
		return theValues.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ArgMap && theValues.equals(((ArgMap) obj).theValues);
	}

	@Override
	public String toString() {
		return theValues.toString();
	}
}

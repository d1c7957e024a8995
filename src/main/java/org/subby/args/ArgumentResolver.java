package org.subby.args;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.subby.args.CommandLineException.ErrorType;

import com.google.common.base.Joiner;

/**
 * Turns the raw values collected by a {@link CommandLineParser} into a typed {@link ArgMap}: checks mutual exclusion, defaults missing
 * positionals, converts each value to its parameter's type and merges in the declared defaults.
 */
public class ArgumentResolver {
	private final ArgumentPool thePool;

	/** @param pool The pool holding every parameter registered during the parse */
	public ArgumentResolver(ArgumentPool pool) {
		thePool = pool;
	}

	/**
	 * @param intermediates The raw values for each parameter given on the command line, by canonical name
	 * @param subcommand The matched subcommand, or null if none was matched
	 * @return The resolved arguments
	 * @throws CommandLineException If the values cannot be resolved
	 */
	public ArgMap resolve(Map<String, List<String>> intermediates, CommandSpec subcommand) throws CommandLineException {
		checkExclusion(intermediates);

		ArgMap resolved = new ArgMap();
		defaultPositionals(resolved);
		for (Map.Entry<String, List<String>> entry : intermediates.entrySet()) {
			ParameterSpec parameter = thePool.get(entry.getKey());
			ArgValue value = coerce(parameter, entry.getValue());
			if (value != null)
				resolved.put(parameter.getCanonicalName(), value);
		}

		ArgMap args = thePool.defaults().putAll(resolved);
		args.put(ArgMap.SUBCOMMAND_KEY, subcommand == null ? ArgValue.NONE : ArgValue.of(subcommand.getName()));
		return args;
	}

	void checkExclusion(Map<String, List<String>> intermediates) throws CommandLineException {
		for (Set<String> group : thePool.mutuallyExclusiveGroups()) {
			List<String> conflicts = new ArrayList<>(2);
			for (String name : intermediates.keySet()) {
				if (group.contains(name))
					conflicts.add(thePool.get(name).getName());
			}
			if (conflicts.size() > 1)
				throw new CommandLineException(ErrorType.CONFLICTING_FLAGS,
					"The following flags conflict: " + Joiner.on(", ").join(conflicts));
		}
	}

	void defaultPositionals(ArgMap resolved) throws CommandLineException {
		while (thePool.hasNextPositional()) {
			ParameterSpec positional = thePool.nextPositional();
			if (positional.getDefault() != null)
				resolved.put(positional.getCanonicalName(), positional.getDefault());
			else if (positional.getKind() != ParameterKind.OPTIONAL)
				throw new CommandLineException(ErrorType.MISSING_POSITIONAL,
					"No value provided for positional argument: " + positional.getName());
		}
	}

	/**
	 * @param parameter The parameter to convert values for
	 * @param values The raw values given for the parameter
	 * @return The converted value, or null if the parameter resolves to no value
	 * @throws CommandLineException If the values are not valid for the parameter
	 */
	ArgValue coerce(ParameterSpec parameter, List<String> values) throws CommandLineException {
		switch (parameter.getKind()) {
		case ENABLE:
			return ArgValue.of(true);
		case DISABLE:
			return ArgValue.of(false);
		case OPTIONAL:
			if (values.isEmpty())
				return parameter.getDefault();
			break;
		default:
			break;
		}
		if (parameter.getKind() != ParameterKind.MULTIPLE && values.size() != 1)
			throw new CommandLineException(ErrorType.INVALID_VALUE,
				parameter.getName() + " expects a single value but was given " + values.size() + ": " + values);

		if (parameter.getChoices() != null) {
			for (String value : values) {
				if (!parameter.getChoices().contains(value))
					throw new CommandLineException(ErrorType.INVALID_CHOICE, "Error: " + value + " is not valid for "
						+ parameter.getCanonicalName() + "; choose from " + Joiner.on(", ").join(parameter.getChoices()));
			}
		}

		ValueType type = parameter.getValueType();
		if (type.isString()) {
			if (parameter.getKind() == ParameterKind.MULTIPLE)
				return ArgValue.strings(values);
			return ArgValue.of(values.get(0));
		}
		List<ArgValue> converted = new ArrayList<>(values.size());
		for (String value : values) {
			try {
				converted.add(type.parse(value));
			} catch (ParseException e) {
				throw new CommandLineException(ErrorType.INVALID_VALUE,
					"Invalid value for " + parameter.getCanonicalName() + ": " + e.getMessage(), e);
			}
		}
		if (parameter.getKind() == ParameterKind.MULTIPLE)
			return ArgValue.tuple(converted);
		return converted.get(0);
	}
}

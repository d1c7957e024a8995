package org.subby.args;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.subby.args.CommandLineException.ErrorType;

/**
 * Indexes the parameters of one or more {@link CommandSpec commands} for a single parse. The root command is registered first; a
 * subcommand's parameters are registered when its name is encountered on the command line.
 */
public class ArgumentPool {
	private static final Logger log = Logger.getLogger(ArgumentPool.class);

	private final Deque<String> thePositionalQueue;
	private final Set<String> thePositionalNames;
	private final Map<String, ParameterSpec> theByName;
	private final Map<String, String> theShorthandToLong;
	private final List<GroupSpec> theGroups;

	/** Creates an empty pool */
	public ArgumentPool() {
		thePositionalQueue = new ArrayDeque<>();
		thePositionalNames = new HashSet<>();
		theByName = new LinkedHashMap<>();
		theShorthandToLong = new LinkedHashMap<>();
		theGroups = new ArrayList<>();
	}

	/**
	 * Registers all parameters and groups of a command
	 *
	 * @param command The command to register
	 * @return This pool
	 * @throws IllegalArgumentException If any of the command's parameter names collide with ones already registered
	 */
	public ArgumentPool register(CommandSpec command) throws IllegalArgumentException {
		for (ParameterElement element : command.getParameters()) {
			if (element instanceof GroupSpec)
				register((GroupSpec) element);
			else
				register((ParameterSpec) element);
		}
		if (log.isDebugEnabled())
			log.debug("Registered command " + command.getName() + ": " + theByName.keySet());
		return this;
	}

	/**
	 * Registers each member of a group and records the group's membership
	 *
	 * @param group The group to register
	 * @return This pool
	 * @throws IllegalArgumentException If any of the group's parameter names collide with ones already registered
	 */
	public ArgumentPool register(GroupSpec group) throws IllegalArgumentException {
		for (ParameterSpec parameter : group.getParameters())
			register(parameter);
		theGroups.add(group);
		return this;
	}

	/**
	 * Registers a single parameter. A positional is appended to the positional queue; a flag is indexed by its name and its shorthand.
	 *
	 * @param parameter The parameter to register
	 * @return This pool
	 * @throws IllegalArgumentException If the parameter's name or shorthand collides with one already registered
	 */
	public ArgumentPool register(ParameterSpec parameter) throws IllegalArgumentException {
		String name = parameter.getCanonicalName();
		if (name.equals(ArgMap.SUBCOMMAND_KEY))
			throw new IllegalArgumentException("\"" + name + "\" is reserved for the subcommand name");
		else if (theByName.containsKey(name) || theShorthandToLong.containsKey(name))
			throw new IllegalArgumentException("A parameter named \"" + name + "\" is already registered");
		if (parameter.isPositional()) {
			thePositionalQueue.add(name);
			thePositionalNames.add(name);
		} else if (parameter.getShorthand() != null) {
			String shorthand = ParameterSpec.canonicalName(parameter.getShorthand());
			if (theByName.containsKey(shorthand) || theShorthandToLong.containsKey(shorthand))
				throw new IllegalArgumentException("Shorthand \"" + parameter.getShorthand() + "\" for " + parameter.getName()
					+ " collides with a registered parameter");
			theShorthandToLong.put(shorthand, name);
		}
		theByName.put(name, parameter);
		return this;
	}

	/** @return All parameters registered in this pool, in registration order */
	public Collection<ParameterSpec> getParameters() {
		return Collections.unmodifiableCollection(theByName.values());
	}

	/**
	 * @param canonicalName The canonical name of the parameter
	 * @return The registered parameter with the given name, or null if there is none
	 */
	public ParameterSpec get(String canonicalName) {
		return theByName.get(canonicalName);
	}

	/** @return Whether any positionals remain to be consumed */
	public boolean hasNextPositional() {
		return !thePositionalQueue.isEmpty();
	}

	/**
	 * Consumes the next positional parameter
	 *
	 * @return The next positional parameter
	 * @throws CommandLineException {@link ErrorType#TOO_MANY_POSITIONALS} if no positionals remain
	 */
	public ParameterSpec nextPositional() throws CommandLineException {
		String name = thePositionalQueue.poll();
		if (name == null)
			throw new CommandLineException(ErrorType.TOO_MANY_POSITIONALS, "Too many positional arguments provided");
		return theByName.get(name);
	}

	/** @return The positionals that have not yet been consumed, in order */
	public List<ParameterSpec> remainingPositionals() {
		List<ParameterSpec> remaining = new ArrayList<>(thePositionalQueue.size());
		for (String name : thePositionalQueue)
			remaining.add(theByName.get(name));
		return remaining;
	}

	/**
	 * Resolves a flag token to its parameter
	 *
	 * @param token The flag token, with or without flag markers, e.g. "-unit", "--unit", "-u" or "unit"
	 * @return The flag parameter
	 * @throws CommandLineException {@link ErrorType#POSITIONAL_USED_AS_FLAG} if the token names a positional, or
	 *         {@link ErrorType#UNKNOWN_FLAG} if it names no registered parameter
	 */
	public ParameterSpec resolve(String token) throws CommandLineException {
		String name = ParameterSpec.canonicalName(token);
		String longName = theShorthandToLong.get(name);
		if (longName != null)
			name = longName;
		if (thePositionalNames.contains(name))
			throw new CommandLineException(ErrorType.POSITIONAL_USED_AS_FLAG,
				name + " is a positional argument and cannot be used as a flag");
		ParameterSpec parameter = theByName.get(name);
		if (parameter == null)
			throw new CommandLineException(ErrorType.UNKNOWN_FLAG, "Unknown flag " + token);
		return parameter;
	}

	/**
	 * @return The default value of every registered parameter that has one. Enable switches default to false and disable switches to
	 *         true.
	 */
	public ArgMap defaults() {
		ArgMap defaults = new ArgMap();
		for (ParameterSpec parameter : theByName.values()) {
			switch (parameter.getKind()) {
			case ENABLE:
				defaults.put(parameter.getCanonicalName(), ArgValue.of(false));
				break;
			case DISABLE:
				defaults.put(parameter.getCanonicalName(), ArgValue.of(true));
				break;
			default:
				if (parameter.getDefault() != null)
					defaults.put(parameter.getCanonicalName(), parameter.getDefault());
				break;
			}
		}
		return defaults;
	}

	/** @return The canonical names of the members of each mutually exclusive group */
	public List<Set<String>> mutuallyExclusiveGroups() {
		List<Set<String>> groups = new ArrayList<>();
		for (GroupSpec group : theGroups) {
			if (!group.isMutuallyExclusive())
				continue;
			Set<String> members = new LinkedHashSet<>();
			for (ParameterSpec parameter : group.getParameters())
				members.add(parameter.getCanonicalName());
			groups.add(Collections.unmodifiableSet(members));
		}
		return groups;
	}
}

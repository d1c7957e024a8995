package org.subby.args;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.subby.args.CommandLineException.ErrorType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Doubles;

/**
 * Walks a list of command-line tokens, classifying each one and collecting the raw values given for each parameter. The values are left as
 * text; converting them is the job of {@link ArgumentResolver}.
 *
 * <p>
 * An instance carries the state of a single parse and must not be reused.
 * </p>
 */
public class CommandLineParser {
	private static final Logger log = Logger.getLogger(CommandLineParser.class);

	/** The tokens that request help */
	public static final ImmutableSet<String> HELP_ALIASES = ImmutableSet.of("-h", "-help", "--help");
	/** The token representing standard input or output, which is a value and not a flag */
	public static final String STANDARD_STREAM = "-";
	/** The separators between a flag and its value in a single token */
	public static final String PAIR_SEPARATORS = ":=";
	/** The separator between values of a multi-valued flag in a single flag-value pair token */
	public static final char MULTI_VALUE_SEPARATOR = ';';
	private static final ImmutableSet<String> NON_FINITE = ImmutableSet.of("NaN", "Infinity");

	/** The classes of command-line tokens */
	public enum TokenType {
		/** A value for the open flag or the next positional */
		VALUE,
		/** A request for help */
		HELP,
		/** The name of a subcommand */
		SUBCOMMAND,
		/** A flag and its value(s) in one token, e.g. "-unit:s" or "-unit=s" */
		FLAG_VALUE_PAIR,
		/** A flag name */
		FLAG;
	}

	private final ArgumentPool thePool;
	private final Map<String, CommandSpec> theSubcommands;
	private final Map<String, List<String>> theIntermediates;
	private ParameterSpec theCurrentParameter;
	private List<String> theCurrentValues;
	private CommandSpec theSubcommand;

	/**
	 * @param pool The pool with the root command registered
	 * @param subcommands The subcommands that may be matched, by name
	 */
	public CommandLineParser(ArgumentPool pool, Map<String, CommandSpec> subcommands) {
		thePool = pool;
		theSubcommands = subcommands;
		theIntermediates = new LinkedHashMap<>();
	}

	/**
	 * @param token The token to test
	 * @return Whether the token is a numeric literal, e.g. "120", "-100" or "1.5"
	 */
	public static boolean isNumber(String token) {
		if (token.isEmpty())
			return false;
		char last = token.charAt(token.length() - 1);
		// Java literal suffixes ("5d", "1f") do not make a number on the command line
		if (!(last >= '0' && last <= '9') && last != '.' && !NON_FINITE.contains(stripSign(token)))
			return false;
		return Doubles.tryParse(token) != null;
	}

	private static String stripSign(String token) {
		return token.charAt(0) == '-' || token.charAt(0) == '+' ? token.substring(1) : token;
	}

	/**
	 * @param token The token to classify
	 * @return The class of the token in the current state of this parse
	 */
	public TokenType classify(String token) {
		if (isNumber(token))
			return TokenType.VALUE;
		else if (HELP_ALIASES.contains(token))
			return TokenType.HELP;
		else if (theSubcommand == null && theSubcommands.containsKey(token))
			return TokenType.SUBCOMMAND;
		else if (!ParameterSpec.isFlag(token) || token.equals(STANDARD_STREAM))
			return TokenType.VALUE;
		else if (separatorIndex(token) >= 0)
			return TokenType.FLAG_VALUE_PAIR;
		else
			return TokenType.FLAG;
	}

	/**
	 * Parses all tokens, then closes any parameter still collecting values
	 *
	 * @param tokens The tokens to parse
	 * @return This parser
	 * @throws CommandLineException If the tokens are structurally invalid
	 */
	public CommandLineParser parse(String... tokens) throws CommandLineException {
		return parse(Arrays.asList(tokens));
	}

	/**
	 * Parses all tokens, then closes any parameter still collecting values
	 *
	 * @param tokens The tokens to parse
	 * @return This parser
	 * @throws CommandLineException If the tokens are structurally invalid
	 */
	public CommandLineParser parse(List<String> tokens) throws CommandLineException {
		for (String token : tokens)
			accept(token);
		finish();
		return this;
	}

	/**
	 * @param token The next token on the command line
	 * @throws CommandLineException If the token cannot be accepted in the current state
	 */
	public void accept(String token) throws CommandLineException {
		TokenType type = classify(token);
		if (log.isDebugEnabled())
			log.debug(type + ": " + token);
		switch (type) {
		case VALUE:
			addValue(token);
			break;
		case HELP:
			// Help is handled before parsing begins
			break;
		case SUBCOMMAND:
			closeCurrent();
			theSubcommand = theSubcommands.get(token);
			thePool.register(theSubcommand);
			break;
		case FLAG_VALUE_PAIR:
			closeCurrent();
			addPair(token);
			break;
		case FLAG:
			closeCurrent();
			ParameterSpec flag = thePool.resolve(token);
			if (flag.getKind().isSwitch())
				store(flag, Collections.emptyList());
			else {
				theCurrentParameter = flag;
				theCurrentValues = new ArrayList<>(3);
			}
			break;
		}
	}

	/**
	 * Closes any parameter still collecting values
	 *
	 * @throws CommandLineException If the open parameter did not receive the values it requires
	 */
	public void finish() throws CommandLineException {
		closeCurrent();
	}

	/** @return The subcommand matched on the command line, or null if none was matched */
	public CommandSpec getSubcommand() {
		return theSubcommand;
	}

	/** @return The raw values collected for each parameter given on the command line, by canonical name, in the order first given */
	public Map<String, List<String>> getIntermediates() {
		return Collections.unmodifiableMap(theIntermediates);
	}

	private void addValue(String token) {
		if (theCurrentParameter == null) {
			theCurrentParameter = thePool.nextPositional();
			theCurrentValues = new ArrayList<>(3);
		}
		theCurrentValues.add(token);
		if (theCurrentValues.size() >= theCurrentParameter.getKind().getMaxValues()) {
			store(theCurrentParameter, theCurrentValues);
			theCurrentParameter = null;
			theCurrentValues = null;
		}
	}

	private void addPair(String token) {
		int sepIdx = separatorIndex(token);
		String flagName = token.substring(0, sepIdx);
		String value = token.substring(sepIdx + 1);
		ParameterSpec flag = thePool.resolve(flagName);
		if (value.isEmpty())
			throw new CommandLineException(ErrorType.INVALID_VALUE, "Value cannot be blank in pair: " + token);
		if (flag.getKind() == ParameterKind.MULTIPLE) {
			List<String> values = new ArrayList<>();
			int start = 0;
			for (int i = 0; i < value.length(); i++) {
				if (value.charAt(i) == MULTI_VALUE_SEPARATOR) {
					values.add(value.substring(start, i));
					start = i + 1;
				}
			}
			values.add(value.substring(start));
			store(flag, values);
		} else
			store(flag, ImmutableList.of(value));
	}

	private void closeCurrent() {
		if (theCurrentParameter == null)
			return;
		ParameterSpec parameter = theCurrentParameter;
		List<String> values = theCurrentValues;
		theCurrentParameter = null;
		theCurrentValues = null;
		if (values.isEmpty()) {
			switch (parameter.getKind()) {
			case MULTIPLE:
				throw new CommandLineException(ErrorType.INVALID_VALUE, parameter.getName() + " requires at least one value");
			case VALUE:
				throw new CommandLineException(ErrorType.INVALID_VALUE, parameter.getName() + " requires a value");
			default:
				break;
			}
		}
		store(parameter, values);
	}

	private void store(ParameterSpec parameter, List<String> values) {
		theIntermediates.computeIfAbsent(parameter.getCanonicalName(), __ -> new ArrayList<>(values.size())).addAll(values);
	}

	private static int separatorIndex(String token) {
		for (int i = 0; i < token.length(); i++) {
			if (PAIR_SEPARATORS.indexOf(token.charAt(i)) >= 0)
				return i;
		}
		return -1;
	}
}

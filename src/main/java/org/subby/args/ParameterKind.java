package org.subby.args;

/** The declared behavior of a parameter */
public enum ParameterKind {
	/** Takes exactly one value */
	VALUE,
	/** A switch that resolves to true when specified and false otherwise */
	ENABLE,
	/** A switch that resolves to false when specified and true otherwise */
	DISABLE,
	/** Takes at most one value, resolving to the declared default when specified without one */
	OPTIONAL,
	/** Takes one or more values, absorbing values until the next flag or subcommand */
	MULTIPLE;

	/** @return Whether this kind is a boolean switch that takes no value */
	public boolean isSwitch() {
		return this == ENABLE || this == DISABLE;
	}

	/** @return The maximum number of values a parameter of this kind can collect */
	public int getMaxValues() {
		switch (this) {
		case ENABLE:
		case DISABLE:
			return 0;
		case MULTIPLE:
			return Integer.MAX_VALUE;
		default:
			return 1;
		}
	}
}

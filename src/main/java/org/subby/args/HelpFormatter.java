package org.subby.args;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Joiner;

/** Renders usage and help text from command schemas */
public class HelpFormatter {
	private HelpFormatter() {}

	/**
	 * @param root The root command, whose name is the program name and whose help is the program description
	 * @param subcommands The program's subcommands
	 * @return A help message listing the subcommands
	 */
	public static String printGeneralHelp(CommandSpec root, Collection<CommandSpec> subcommands) {
		StringBuilder str = new StringBuilder();
		str.append(root.getName()).append(" command options...\n");
		str.append(root.getHelp()).append("\n\nSubcommands:\n");
		for (CommandSpec subcommand : subcommands)
			str.append('\t').append(subcommand.getName()).append('\t').append(subcommand.getHelp()).append('\n');
		return str.toString();
	}

	/**
	 * @param root The root command
	 * @param subcommand The subcommand to print help for
	 * @return A help message with usage and a description of every parameter available to the subcommand
	 */
	public static String printCommandHelp(CommandSpec root, CommandSpec subcommand) {
		ArgumentPool pool = new ArgumentPool().register(root).register(subcommand);

		List<String> usage = new ArrayList<>();
		usage.add(root.getName());
		usage.add(subcommand.getName());
		for (ParameterSpec positional : pool.remainingPositionals())
			usage.add(displayName(positional) + (positional.getKind() == ParameterKind.MULTIPLE ? "..." : ""));
		addFlagUsage(usage, root);
		addFlagUsage(usage, subcommand);

		StringBuilder str = new StringBuilder();
		Joiner.on(' ').appendTo(str, usage).append('\n');
		str.append(subcommand.getHelp()).append("\n\n");
		str.append("Parameters:\n");
		for (ParameterSpec positional : pool.remainingPositionals())
			printParameter(str, positional);
		str.append("\nFlags:\n");
		for (ParameterSpec parameter : pool.getParameters()) {
			if (!parameter.isPositional())
				printParameter(str, parameter);
		}
		return str.toString();
	}

	private static void addFlagUsage(List<String> usage, CommandSpec command) {
		for (ParameterElement element : command.getParameters()) {
			List<String> flags = new ArrayList<>();
			boolean exclusive;
			if (element instanceof GroupSpec) {
				exclusive = ((GroupSpec) element).isMutuallyExclusive();
				for (ParameterSpec member : ((GroupSpec) element).getParameters()) {
					if (!member.isPositional())
						flags.add(member.getShorthand() != null ? member.getShorthand() : member.getName());
				}
			} else {
				ParameterSpec parameter = (ParameterSpec) element;
				exclusive = false;
				if (!parameter.isPositional())
					flags.add(parameter.getShorthand() != null ? parameter.getShorthand() : parameter.getName());
			}
			if (!flags.isEmpty())
				usage.add((exclusive ? "[" : "{") + Joiner.on(" | ").join(flags) + (exclusive ? "]" : "}"));
		}
	}

	private static void printParameter(StringBuilder str, ParameterSpec parameter) {
		str.append('\t').append(displayName(parameter));
		if (parameter.getShorthand() != null)
			str.append(", ").append(parameter.getShorthand());
		str.append('\t').append(parameter.getHelp());
		if (!parameter.getKind().isSwitch() && parameter.getDefault() != null)
			str.append("\n\t\t(").append(parameter.getDefault()).append(')');
		str.append('\n');
	}

	private static String displayName(ParameterSpec parameter) {
		return parameter.getDisplayName() != null ? parameter.getDisplayName() : parameter.getName();
	}
}

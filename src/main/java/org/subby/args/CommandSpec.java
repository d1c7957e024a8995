package org.subby.args;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;

/**
 * An immutable description of a command: the program's root command or one of its subcommands. A command aggregates its parameters with
 * the validators and post-processors that run on the parsed arguments when the command is matched.
 */
public class CommandSpec {
	private final String theName;
	private final String theHelp;
	private final CommandHandler theHandler;
	private final List<ParameterElement> theParameters;
	private final List<Validator> theValidators;
	private final List<PostProcessor> thePostProcessors;

	CommandSpec(Builder builder) {
		theName = builder.theName;
		theHelp = builder.theHelp;
		theHandler = builder.theHandler;
		theParameters = ImmutableList.copyOf(builder.theParameters);
		theValidators = ImmutableList.copyOf(builder.theValidators);
		thePostProcessors = ImmutableList.copyOf(builder.thePostProcessors);
	}

	/**
	 * @param name The name of the command, as typed on the command line for a subcommand
	 * @return A builder for the command
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** @return The name of this command */
	public String getName() {
		return theName;
	}

	/** @return A description of this command */
	public String getHelp() {
		return theHelp;
	}

	/** @return The handler that performs this command, or null if it has none */
	public CommandHandler getHandler() {
		return theHandler;
	}

	/** @return This command's parameters and parameter groups, in declaration order */
	public List<ParameterElement> getParameters() {
		return theParameters;
	}

	/** @return This command's validators, including those contributed by its groups, in registration order */
	public List<Validator> getValidators() {
		return theValidators;
	}

	/** @return This command's post-processors, including those contributed by its groups, in registration order */
	public List<PostProcessor> getPostProcessors() {
		return thePostProcessors;
	}

	@Override
	public String toString() {
		return theName;
	}

	/** Builds a {@link CommandSpec} */
	public static class Builder {
		private final String theName;
		private String theHelp;
		private CommandHandler theHandler;
		private final List<ParameterElement> theParameters;
		private final List<Validator> theValidators;
		private final List<PostProcessor> thePostProcessors;

		Builder(String name) {
			if (name == null)
				throw new NullPointerException("Name must not be null");
			else if (name.isEmpty() || ParameterSpec.isFlag(name))
				throw new IllegalArgumentException("Illegal command name: \"" + name + "\"");
			theName = name;
			theHelp = "";
			theParameters = new ArrayList<>();
			theValidators = new ArrayList<>(3);
			thePostProcessors = new ArrayList<>(3);
		}

		/**
		 * @param help A description of the command
		 * @return This builder
		 */
		public Builder withHelp(String help) {
			theHelp = help == null ? "" : help;
			return this;
		}

		/**
		 * @param handler The handler to perform the command
		 * @return This builder
		 */
		public Builder withHandler(CommandHandler handler) {
			theHandler = handler;
			return this;
		}

		/**
		 * @param parameter The parameter to add
		 * @return This builder
		 */
		public Builder withParameter(ParameterSpec parameter) {
			theParameters.add(Objects.requireNonNull(parameter, "Parameter must not be null"));
			return this;
		}

		/**
		 * @param name The name of the parameter to add
		 * @param configure Configures the parameter (optional)
		 * @return This builder
		 */
		public Builder withParameter(String name, Consumer<ParameterSpec.Builder> configure) {
			ParameterSpec.Builder param = ParameterSpec.build(name);
			if (configure != null)
				configure.accept(param);
			return withParameter(param.build());
		}

		/**
		 * Adds a group of parameters, along with the group's validators and post-processors
		 *
		 * @param group The group to add
		 * @return This builder
		 */
		public Builder withGroup(GroupSpec group) {
			theParameters.add(Objects.requireNonNull(group, "Group must not be null"));
			theValidators.addAll(group.getValidators());
			thePostProcessors.addAll(group.getPostProcessors());
			return this;
		}

		/**
		 * @param configure Configures the group to add
		 * @return This builder
		 */
		public Builder withGroup(Consumer<GroupSpec.Builder> configure) {
			GroupSpec.Builder group = GroupSpec.build();
			configure.accept(group);
			return withGroup(group.build());
		}

		/**
		 * @param validator The validator to add
		 * @return This builder
		 */
		public Builder withValidator(Validator validator) {
			theValidators.add(Objects.requireNonNull(validator, "Validator must not be null"));
			return this;
		}

		/**
		 * @param postProcessor The post-processor to add
		 * @return This builder
		 */
		public Builder withPostProcessor(PostProcessor postProcessor) {
			thePostProcessors.add(Objects.requireNonNull(postProcessor, "Post-processor must not be null"));
			return this;
		}

		/** @return The new command */
		public CommandSpec build() {
			return new CommandSpec(this);
		}
	}
}

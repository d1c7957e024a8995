package org.subby.args;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;

/**
 * An ordered group of parameters. If the group is {@link #isMutuallyExclusive() mutually exclusive}, at most one of its members may be
 * specified on a command line. A group may also carry validators and post-processors, which are added to any command the group is added
 * to.
 */
public class GroupSpec implements ParameterElement {
	private final List<ParameterSpec> theParameters;
	private final boolean isMutuallyExclusive;
	private final List<Validator> theValidators;
	private final List<PostProcessor> thePostProcessors;

	GroupSpec(Builder builder) {
		theParameters = ImmutableList.copyOf(builder.theParameters);
		isMutuallyExclusive = builder.isMutuallyExclusive;
		theValidators = ImmutableList.copyOf(builder.theValidators);
		thePostProcessors = ImmutableList.copyOf(builder.thePostProcessors);
	}

	/** @return A builder for a parameter group */
	public static Builder build() {
		return new Builder();
	}

	/**
	 * @param mutuallyExclusive Whether at most one of the parameters may be specified
	 * @param parameters The parameters for the group
	 * @return The new group
	 */
	public static GroupSpec of(boolean mutuallyExclusive, ParameterSpec... parameters) {
		Builder builder = build();
		for (ParameterSpec parameter : parameters)
			builder.with(parameter);
		if (mutuallyExclusive)
			builder.mutuallyExclusive();
		return builder.build();
	}

	/** @return The members of this group */
	public List<ParameterSpec> getParameters() {
		return theParameters;
	}

	/** @return Whether at most one member of this group may be specified */
	public boolean isMutuallyExclusive() {
		return isMutuallyExclusive;
	}

	/** @return Validators contributed by this group */
	public List<Validator> getValidators() {
		return theValidators;
	}

	/** @return Post-processors contributed by this group */
	public List<PostProcessor> getPostProcessors() {
		return thePostProcessors;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(isMutuallyExclusive ? "[" : "{");
		for (int i = 0; i < theParameters.size(); i++) {
			if (i > 0)
				str.append(" | ");
			str.append(theParameters.get(i).getName());
		}
		return str.append(isMutuallyExclusive ? ']' : '}').toString();
	}

	/** Builds a {@link GroupSpec} */
	public static class Builder {
		private final List<ParameterSpec> theParameters;
		private boolean isMutuallyExclusive;
		private final List<Validator> theValidators;
		private final List<PostProcessor> thePostProcessors;

		Builder() {
			theParameters = new ArrayList<>();
			theValidators = new ArrayList<>(2);
			thePostProcessors = new ArrayList<>(2);
		}

		/**
		 * @param parameter The parameter to add to the group
		 * @return This builder
		 */
		public Builder with(ParameterSpec parameter) {
			theParameters.add(Objects.requireNonNull(parameter, "Parameter must not be null"));
			return this;
		}

		/**
		 * @param name The name of the parameter to add
		 * @param configure Configures the parameter (optional)
		 * @return This builder
		 */
		public Builder with(String name, Consumer<ParameterSpec.Builder> configure) {
			ParameterSpec.Builder param = ParameterSpec.build(name);
			if (configure != null)
				configure.accept(param);
			return with(param.build());
		}

		/** @return This builder, marked so that at most one of its parameters may be specified */
		public Builder mutuallyExclusive() {
			isMutuallyExclusive = true;
			return this;
		}

		/**
		 * @param validator A validator for any command this group is added to
		 * @return This builder
		 */
		public Builder withValidator(Validator validator) {
			theValidators.add(Objects.requireNonNull(validator, "Validator must not be null"));
			return this;
		}

		/**
		 * @param postProcessor A post-processor for any command this group is added to
		 * @return This builder
		 */
		public Builder withPostProcessor(PostProcessor postProcessor) {
			thePostProcessors.add(Objects.requireNonNull(postProcessor, "Post-processor must not be null"));
			return this;
		}

		/** @return The new group */
		public GroupSpec build() {
			if (theParameters.isEmpty())
				throw new IllegalArgumentException("A group must have at least one parameter");
			return new GroupSpec(this);
		}
	}
}

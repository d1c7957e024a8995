package org.subby.args;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;
import org.subby.args.CommandLineException.ErrorType;

/** Tests conversion, defaulting and exclusion in {@link ArgumentResolver} */
public class ArgumentResolverTest {
	private static final CommandSpec COMMAND = CommandSpec.build("prog")//
		.withParameter("source", null)//
		.withParameter("count", p -> p.valueType(ValueTypes.INTEGER).defaultValue(1))//
		.withParameter("-sizes", p -> p.multiple().valueType(ValueTypes.INTEGER))//
		.withParameter("-tags", p -> p.multiple().choices("a", "b", "c"))//
		.withParameter("-level", p -> p.optional().valueType(ValueTypes.INTEGER).defaultValue(3))//
		.withParameter("-mode", p -> p.optional())//
		.withParameter("-colors", p -> p.disable())//
		.withGroup(g -> g.with("-left", p -> p.enable()).with("-right", p -> p.enable()).mutuallyExclusive())//
		.build();

	private static ArgMap resolve(Object... nameValues) {
		Map<String, List<String>> intermediates = new LinkedHashMap<>();
		for (int i = 0; i < nameValues.length; i += 2) {
			@SuppressWarnings("unchecked")
			List<String> values = (List<String>) nameValues[i + 1];
			intermediates.put((String) nameValues[i], values);
		}
		ArgumentPool pool = new ArgumentPool().register(COMMAND);
		// Consume the positionals that have values, as the parser would
		for (int i = 0; i < nameValues.length; i += 2) {
			if (pool.get((String) nameValues[i]).isPositional())
				pool.nextPositional();
		}
		return new ArgumentResolver(pool).resolve(intermediates, null);
	}

	@Test
	public void testConversion() {
		ArgMap args = resolve("source", Arrays.asList("in.srt"), "count", Arrays.asList("4"), //
			"sizes", Arrays.asList("1", "-2", "3"), "tags", Arrays.asList("c", "a"), "colors", Collections.emptyList());
		Assert.assertEquals("in.srt", args.getString("source"));
		Assert.assertEquals(4, args.getLong("count"));
		Assert.assertEquals(Arrays.asList(1L, -2L, 3L), args.getAll("sizes", long.class));
		Assert.assertEquals(Arrays.asList("c", "a"), args.getAll("tags", String.class));
		Assert.assertFalse(args.getBoolean("colors"));
		Assert.assertFalse(args.getBoolean("left"));
		Assert.assertTrue(args.get(ArgMap.SUBCOMMAND_KEY).isNone());
	}

	/** Missing positionals take their defaults, and declared defaults fill in for flags not given */
	@Test
	public void testDefaults() {
		ArgMap args = resolve("source", Arrays.asList("in.srt"));
		Assert.assertEquals(ArgValue.of(1), args.get("count"));
		Assert.assertEquals(ArgValue.of(3), args.get("level"));
		Assert.assertTrue(args.getBoolean("colors"));
		Assert.assertFalse(args.has("sizes"));
		Assert.assertFalse(args.has("mode"));

		try {
			resolve();
			Assert.assertTrue("Expected a missing positional", false);
		} catch (CommandLineException e) {
			Assert.assertEquals(ErrorType.MISSING_POSITIONAL, e.getType());
			Assert.assertEquals("No value provided for positional argument: source", e.getMessage());
		}
	}

	/** An optional flag given without a value takes its default, or is left out */
	@Test
	public void testOptional() {
		ArgMap args = resolve("source", Arrays.asList("x"), "level", Collections.emptyList(), "mode", Collections.emptyList());
		Assert.assertEquals(3, args.getInt("level"));
		Assert.assertFalse(args.has("mode"));
		args = resolve("source", Arrays.asList("x"), "level", Arrays.asList("9"), "mode", Arrays.asList("fast"));
		Assert.assertEquals(9, args.getInt("level"));
		Assert.assertEquals("fast", args.getString("mode"));
	}

	@Test
	public void testErrors() {
		expectError(ErrorType.INVALID_VALUE, "source", Arrays.asList("x"), "sizes", Arrays.asList("1", "two"));
		expectError(ErrorType.INVALID_VALUE, "source", Arrays.asList("x"), "count", Arrays.asList("1", "2"));
		expectError(ErrorType.INVALID_CHOICE, "source", Arrays.asList("x"), "tags", Arrays.asList("a", "d"));
		expectError(ErrorType.CONFLICTING_FLAGS, "source", Arrays.asList("x"), "right", Collections.emptyList(), "left",
			Collections.emptyList());
	}

	/** Exclusion is checked before anything else, naming the flags as declared */
	@Test
	public void testConflictMessage() {
		try {
			resolve("left", Collections.emptyList(), "right", Collections.emptyList());
			Assert.assertTrue("Expected a conflict", false);
		} catch (CommandLineException e) {
			Assert.assertEquals(ErrorType.CONFLICTING_FLAGS, e.getType());
			Assert.assertEquals("The following flags conflict: -left, -right", e.getMessage());
		}
	}

	private static void expectError(ErrorType type, Object... nameValues) {
		try {
			resolve(nameValues);
			Assert.assertTrue("Expected " + type, false);
		} catch (CommandLineException e) {
			Assert.assertEquals(e.getMessage(), type, e.getType());
		}
	}
}

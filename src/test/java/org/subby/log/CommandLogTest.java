package org.subby.log;

import org.junit.Assert;
import org.junit.Test;

/** Tests verbosity filtering in {@link CommandLog} */
public class CommandLogTest {
	private static void logAll(CommandLog log) {
		log.debug("d");
		log.verbose("v");
		log.info("i");
		log.warn("w");
		log.error("e");
	}

	@Test
	public void testThresholds() {
		LogCapture capture = new LogCapture("thresholds");
		CommandLog log = capture.getLog();
		Assert.assertEquals(Verbosity.INFO, log.getVerbosity());
		logAll(log);
		Assert.assertEquals("INFO i\nWARN w\nERROR e\n", capture.getText());

		capture.clear();
		logAll(log.setVerbosity(Verbosity.DEBUG));
		Assert.assertEquals("INFO d\nINFO v\nINFO i\nWARN w\nERROR e\n", capture.getText());

		capture.clear();
		logAll(log.setVerbosity(Verbosity.VERBOSE));
		Assert.assertEquals("INFO v\nINFO i\nWARN w\nERROR e\n", capture.getText());

		capture.clear();
		logAll(log.setVerbosity(Verbosity.QUIET));
		log.error("failed", new IllegalStateException("cause"));
		Assert.assertEquals("", capture.getText());
	}

	@Test
	public void testPermits() {
		Assert.assertTrue(Verbosity.INFO.permits(Verbosity.ERROR));
		Assert.assertFalse(Verbosity.INFO.permits(Verbosity.VERBOSE));
		Assert.assertTrue(Verbosity.DEBUG.permits(Verbosity.DEBUG));
		Assert.assertFalse(Verbosity.QUIET.permits(Verbosity.ERROR));
		Assert.assertFalse(Verbosity.QUIET.permits(Verbosity.QUIET));
	}

	@Test
	public void testLoggerName() {
		CommandLog log = new CommandLog("subby");
		Assert.assertEquals("console.subby", log.getLogger().getName());
		Assert.assertEquals("subby", log.getProgramName());
		try {
			log.setVerbosity(null);
			Assert.assertTrue("Null verbosity should be rejected", false);
		} catch (NullPointerException e) {
			// Expected
		}
	}
}

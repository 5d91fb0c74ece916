package org.metricshub.rash.util;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.metricshub.rash.intermediate.IrLowering;
import org.slf4j.Logger;

public class RashLoggerTest {

	@Test
	public void testLoggerIsNamedAfterThePhase() {
		Logger logger = RashLogger.getLogger(IrLowering.class);
		assertEquals(IrLowering.class.getName(), logger.getName());
		assertEquals("WARN", System.getProperty("slf4j.internal.verbosity"));
	}
}

/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.apermap.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.scijava.log.StderrLogService;

import sc.fiji.apermap.ApertureUtils;
import sc.fiji.apermap.event.TraceEvent;

/**
 * Tests for {@link Logger}.
 */
public class LoggerTest {

	private Logger logger;
	private List<TraceEvent> events;

	@Before
	public void setUp() {
		logger = new Logger(new StderrLogService(), "LoggerTest");
		logger.setDebug(false);
		events = new ArrayList<>();
		logger.addListener(events::add);
	}

	@Test
	public void testEventsFollowLevels() {
		logger.info("started");
		logger.debug("hidden");
		logger.warn("count mismatch");
		assertEquals(2, events.size());
		assertEquals(TraceEvent.INFO, events.get(0).getLevel());
		assertEquals("LoggerTest", events.get(0).getSource());
		assertEquals("started", events.get(0).getMessage());
		assertTrue(events.get(1).isWarning());

		logger.setDebug(true);
		logger.debug("shown");
		assertEquals(3, events.size());
		assertEquals(TraceEvent.DEBUG, events.get(2).getLevel());
	}

	@Test
	public void testChildSharesListeners() {
		final Logger child = logger.child(LoggerTest.class);
		child.info("from child");
		assertEquals(1, events.size());
		assertEquals("LoggerTest", events.get(0).getSource());
		assertFalse(events.get(0).isWarning());
	}

	@Test
	public void testFailingListenerDoesNotInterrupt() {
		final Logger failing = new Logger(new StderrLogService(), "Failing");
		final List<TraceEvent> received = new ArrayList<>();
		failing.addListener(event -> {
			throw new IllegalStateException("listener failure");
		});
		failing.addListener(received::add);
		failing.info("message");
		assertEquals(1, received.size());
	}

	@Test
	public void testDefaultLogService() {
		final StderrLogService service = new StderrLogService();
		ApertureUtils.setLogService(service);
		try {
			assertSame(service, ApertureUtils.getLogService());
			new Logger(LoggerTest.class).info("via installed service");
		}
		finally {
			ApertureUtils.setLogService(null);
		}
		assertNotSame(service, ApertureUtils.getLogService());
	}

	@Test
	public void testFormatDouble() {
		assertEquals("3.14", ApertureUtils.formatDouble(3.14159, 2));
		assertEquals("NaN", ApertureUtils.formatDouble(Double.NaN, 2));
		assertEquals("1.23E-3", ApertureUtils.formatDouble(0.001234, 2));
		assertEquals("2.5E5", ApertureUtils.formatDouble(250000, 1));
	}

}

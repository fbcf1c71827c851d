/*
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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.scijava.log.LogService;

import sc.fiji.apermap.ApertureUtils;
import sc.fiji.apermap.event.TraceEvent;
import sc.fiji.apermap.event.TraceEventListener;

/**
 * The Logger class provides functionality for logging messages with different
 * levels such as info, debug, and warn.
 * <p>
 * Messages are written to a SciJava {@link LogService} and, in addition,
 * forwarded as {@link TraceEvent}s to any registered
 * {@link TraceEventListener}. Loggers created with {@link #child(Class)} share
 * the listeners of their parent, so that a single subscription covers every
 * stage of a pipeline run.
 * </p>
 */
public class Logger {

	private final LogService logService;
	private final String callerIdentifier;
	private final List<TraceEventListener> listeners;
	private boolean debug;

	public Logger(final Class<?> clazz) {
		this(ApertureUtils.getLogService(), clazz.getSimpleName());
	}

	/**
	 * Constructs a new Logger with the specified log service and caller identifier.
	 *
	 * @param logService       the service messages are written to
	 * @param callerIdentifier the identifier for the calling class/component
	 */
	public Logger(final LogService logService, final String callerIdentifier) {
		this(logService, callerIdentifier, new CopyOnWriteArrayList<>());
	}

	private Logger(final LogService logService, final String callerIdentifier,
			final List<TraceEventListener> listeners) {
		if (logService == null) throw new IllegalArgumentException("LogService cannot be null");
		this.logService = logService;
		this.callerIdentifier = callerIdentifier;
		this.listeners = listeners;
		setDebug(ApertureUtils.isDebugMode() || logService.isDebug());
	}

	/**
	 * Creates a Logger for another component that writes to the same log service
	 * and notifies the same listeners as this one.
	 *
	 * @param clazz the class of the component
	 * @return the new Logger
	 */
	public Logger child(final Class<?> clazz) {
		final Logger child = new Logger(logService, clazz.getSimpleName(), listeners);
		child.setDebug(debug);
		return child;
	}

	/**
	 * Logs an informational message.
	 *
	 * @param msg the message to log
	 */
	public void info(final Object msg) {
		logService.info(callerIdentifier + ": " + msg);
		notifyListeners(TraceEvent.INFO, msg);
	}

	/**
	 * Logs a debug message (only if debug mode is enabled).
	 *
	 * @param msg the debug message to log
	 */
	public void debug(final Object msg) {
		if (!debug) return;
		logService.info(callerIdentifier + ": " + msg);
		notifyListeners(TraceEvent.DEBUG, msg);
	}

	/**
	 * Logs a warning message.
	 *
	 * @param string the warning message to log
	 */
	public void warn(final String string) {
		logService.warn(callerIdentifier + ": " + string);
		notifyListeners(TraceEvent.WARN, string);
	}

	public void addListener(final TraceEventListener listener) {
		if (listener != null) listeners.add(listener);
	}

	public void removeListener(final TraceEventListener listener) {
		listeners.remove(listener);
	}

	private void notifyListeners(final int level, final Object msg) {
		if (listeners.isEmpty()) return;
		final TraceEvent event = new TraceEvent(level, callerIdentifier, String.valueOf(msg));
		for (final TraceEventListener listener : listeners) {
			try {
				listener.traceEvent(event);
			} catch (final RuntimeException ex) {
				logService.warn(callerIdentifier + ": Listener " + listener + " failed", ex);
			}
		}
	}

	/**
	 * Checks if debug mode is enabled.
	 *
	 * @return true if debug mode is enabled, false otherwise
	 */
	public boolean isDebug() {
		return debug;
	}

	/**
	 * Sets the debug mode state.
	 *
	 * @param debug true to enable debug mode, false to disable
	 */
	public void setDebug(final boolean debug) {
		this.debug = debug;
	}

}

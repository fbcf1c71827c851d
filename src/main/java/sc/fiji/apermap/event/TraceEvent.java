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

package sc.fiji.apermap.event;

/**
 * A single diagnostic message emitted while an aperture map is being made.
 * Events are informational: listeners may display or record them, but the
 * pipeline never waits on, or reacts to, their delivery.
 *
 * @see TraceEventListener
 */
public class TraceEvent {

	/** Level of messages only relevant when debugging */
	public final static int DEBUG = 0;
	/** Level of regular progress messages */
	public final static int INFO = 1;
	/** Level of non-fatal problems, e.g., a fiber-count mismatch */
	public final static int WARN = 2;

	protected final int level;
	protected final String source;
	protected final String message;

	/**
	 * Constructs a new event.
	 *
	 * @param level   the event level (e.g., {@link #INFO}, {@link #WARN})
	 * @param source  the pipeline stage that emitted the message
	 * @param message the message text
	 */
	public TraceEvent(final int level, final String source, final String message) {
		this.level = level;
		this.source = source;
		this.message = message;
	}

	/**
	 * Gets the level of this event.
	 *
	 * @return the event level
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * Gets the name of the stage that emitted this event.
	 *
	 * @return the source identifier (typically a simple class name)
	 */
	public String getSource() {
		return source;
	}

	public String getMessage() {
		return message;
	}

	public boolean isWarning() {
		return level == WARN;
	}

	@Override
	public String toString() {
		final String lvl = switch (level) {
			case DEBUG -> "DEBUG";
			case WARN -> "WARN";
			default -> "INFO";
		};
		return "[" + lvl + "] " + source + ": " + message;
	}

}

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

package sc.fiji.apermap;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

/**
 * Static utilities shared by the aperture map classes: the log service used
 * by default, debug mode, and formatting helpers.
 */
public class ApertureUtils {

	/** System property that turns on debug mode at startup */
	public static final String DEBUG_PROPERTY = "apermap.debug";

	private static LogService logService;
	private static boolean debugMode = Boolean.getBoolean(DEBUG_PROPERTY);

	private ApertureUtils() {}

	/**
	 * Returns the log service used by loggers that were not given one
	 * explicitly. Unless {@link #setLogService(LogService)} was called, this is
	 * a {@link StderrLogService}.
	 *
	 * @return the default log service
	 */
	public static synchronized LogService getLogService() {
		if (logService == null) logService = new StderrLogService();
		return logService;
	}

	/**
	 * Replaces the default log service, e.g., with the one of an application
	 * context.
	 *
	 * @param service the new service, or null to restore the default
	 */
	public static synchronized void setLogService(final LogService service) {
		logService = service;
	}

	/**
	 * Assesses if debug mode is enabled
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debugMode;
	}

	/**
	 * Enables/disables debug mode. Only affects loggers created afterwards.
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		debugMode = b;
	}

	/**
	 * Formats a value with a fixed number of decimals, switching to scientific
	 * notation for magnitudes below 0.01 or from 1E5 on (pixel positions and
	 * spacings read best in plain notation).
	 *
	 * @param value  the value
	 * @param digits the number of decimals
	 * @return the formatted value, or "NaN"
	 */
	public static String formatDouble(final double value, final int digits) {
		if (Double.isNaN(value)) return "NaN";
		final double magnitude = Math.abs(value);
		final boolean scientific = (magnitude > 0 && magnitude < 0.01) || magnitude >= 1E5;
		final String pattern = "0." + "0".repeat(Math.max(1, digits)) + (scientific ? "E0" : "");
		return new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US)).format(value);
	}

	/**
	 * @param fromStart a start time, from {@link System#currentTimeMillis()}
	 * @return the time elapsed since then, e.g., "250 msec" or "2 min, 05 sec"
	 */
	public static String getElapsedTime(final long fromStart) {
		final long millis = System.currentTimeMillis() - fromStart;
		if (millis < 1000) return millis + " msec";
		final long seconds = TimeUnit.MILLISECONDS.toSeconds(millis);
		if (seconds < 90) return seconds + " sec";
		return String.format("%d min, %02d sec", seconds / 60, seconds % 60);
	}

}

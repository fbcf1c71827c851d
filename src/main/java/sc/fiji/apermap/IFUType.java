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

import java.util.Locale;

/**
 * The Integral Field Unit configurations (fiber bundles) of the IFU-M
 * spectrograph. Each configuration has a fixed Nx &times; Ny spaxel grid whose
 * fibers are split evenly between the two spectrograph sides.
 */
public enum IFUType {

	/** Large spaxels. Bundles are not distinguishable on the detector */
	LSB(18, 20, 17.3, false),
	/** Standard resolution */
	STD(23, 24, 10.0, true),
	/** High resolution */
	HR(27, 32, 5.0, true),
	/** Plain M2FS fiber setup */
	M2FS(16, 16, 5.0, true),
	UNKNOWN(0, 0, 0., false);

	private final int nx;
	private final int ny;
	private final double widthY;
	private final boolean grouped;

	IFUType(final int nx, final int ny, final double widthY, final boolean grouped) {
		this.nx = nx;
		this.ny = ny;
		this.widthY = widthY;
		this.grouped = grouped;
	}

	public int getNx() {
		return nx;
	}

	public int getNy() {
		return ny;
	}

	/** @return the on-sky width of the unit along its y axis (arcsec) */
	public double getWidthY() {
		return widthY;
	}

	/** @return the total number of fibers of this unit (both sides) */
	public int getTotalFibers() {
		return nx * ny;
	}

	/** @return the number of fibers imaged on each spectrograph side */
	public int getExpectedFibers() {
		return nx * ny / 2;
	}

	/**
	 * @return true if fibers are arranged in bundles separated by wider gaps on
	 *         the detector, false if they are evenly spaced
	 */
	public boolean isGrouped() {
		return grouped;
	}

	/**
	 * Infers the configuration from a number of fibers found on one side.
	 *
	 * @param nFibers   the number of fibers found
	 * @param tolerance the maximum (exclusive) difference to the expected count
	 * @return the first configuration whose expected count is within tolerance,
	 *         or {@link #UNKNOWN}
	 */
	public static IFUType guess(final int nFibers, final int tolerance) {
		for (final IFUType type : values()) {
			if (type == UNKNOWN) continue;
			if (Math.abs(nFibers - type.getExpectedFibers()) < tolerance) return type;
		}
		return UNKNOWN;
	}

	/**
	 * Parses a configuration label (case-insensitive).
	 *
	 * @param label e.g., "HR"
	 * @return the matching configuration, or {@link #UNKNOWN}
	 */
	public static IFUType fromLabel(final String label) {
		if (label == null) return UNKNOWN;
		try {
			return valueOf(label.trim().toUpperCase(Locale.ROOT));
		} catch (final IllegalArgumentException ignored) {
			return UNKNOWN;
		}
	}

}

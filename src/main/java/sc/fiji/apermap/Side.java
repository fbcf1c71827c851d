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

/**
 * The two spectrograph sides ("shoes"), processed independently.
 */
public enum Side {

	BLUE("b"), RED("r");

	private final String prefix;

	Side(final String prefix) {
		this.prefix = prefix;
	}

	/** @return the single-letter prefix of frame and template file names */
	public String getPrefix() {
		return prefix;
	}

	public static Side fromPrefix(final String prefix) {
		for (final Side side : values()) {
			if (side.prefix.equalsIgnoreCase(prefix)) return side;
		}
		throw new IllegalArgumentException("Unknown spectrograph side: " + prefix);
	}

}

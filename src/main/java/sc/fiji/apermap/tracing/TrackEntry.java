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

package sc.fiji.apermap.tracing;

/**
 * One cell of a {@link FiberTrack}: either the detected position of the fiber
 * in a profile, or a gap.
 */
public final class TrackEntry {

	private static final TrackEntry GAP = new TrackEntry(Double.NaN, false);

	private final double position;
	private final boolean detected;

	private TrackEntry(final double position, final boolean detected) {
		this.position = position;
		this.detected = detected;
	}

	public static TrackEntry detected(final double position) {
		if (!Double.isFinite(position)) throw new IllegalArgumentException("Invalid position: " + position);
		return new TrackEntry(position, true);
	}

	public static TrackEntry gap() {
		return GAP;
	}

	public boolean isDetected() {
		return detected;
	}

	public boolean isGap() {
		return !detected;
	}

	/**
	 * @return the detected row position
	 * @throws IllegalStateException if this entry is a gap
	 */
	public double getPosition() {
		if (!detected) throw new IllegalStateException("Gap entries have no position");
		return position;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof TrackEntry)) return false;
		final TrackEntry other = (TrackEntry) o;
		return detected == other.detected && (!detected || Double.compare(position, other.position) == 0);
	}

	@Override
	public int hashCode() {
		return detected ? Double.hashCode(position) : 0;
	}

	@Override
	public String toString() {
		return detected ? String.valueOf(position) : "-";
	}

}

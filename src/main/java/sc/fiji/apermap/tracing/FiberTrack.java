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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The positions of one fiber across the sequence of column profiles.
 */
public class FiberTrack {

	private final List<TrackEntry> entries;
	private final boolean synthetic;

	public FiberTrack() {
		this(false);
	}

	private FiberTrack(final boolean synthetic) {
		entries = new ArrayList<>();
		this.synthetic = synthetic;
	}

	/**
	 * Creates a track made of gaps only, standing for a fiber that was not
	 * detected and is to be interpolated.
	 *
	 * @param nProfiles the track length
	 * @return the synthetic track
	 */
	public static FiberTrack synthetic(final int nProfiles) {
		final FiberTrack track = new FiberTrack(true);
		track.appendGaps(nProfiles);
		return track;
	}

	public void add(final TrackEntry entry) {
		entries.add(entry);
	}

	public void appendGaps(final int count) {
		for (int i = 0; i < count; i++)
			entries.add(TrackEntry.gap());
	}

	public void set(final int profile, final TrackEntry entry) {
		entries.set(profile, entry);
	}

	public TrackEntry get(final int profile) {
		return entries.get(profile);
	}

	public int size() {
		return entries.size();
	}

	public boolean isSynthetic() {
		return synthetic;
	}

	public boolean isDetected(final int profile) {
		return entries.get(profile).isDetected();
	}

	/**
	 * @return the last detected position, or NaN if there is none
	 */
	public double lastDetectedPosition() {
		for (int i = entries.size() - 1; i >= 0; i--) {
			if (entries.get(i).isDetected()) return entries.get(i).getPosition();
		}
		return Double.NaN;
	}

	public int countDetected() {
		int count = 0;
		for (final TrackEntry entry : entries) {
			if (entry.isDetected()) count++;
		}
		return count;
	}

	public double gapFraction() {
		return (entries.isEmpty()) ? 1 : 1 - (double) countDetected() / entries.size();
	}

	public List<TrackEntry> getEntries() {
		return Collections.unmodifiableList(entries);
	}

	@Override
	public String toString() {
		return (synthetic ? "Synthetic" : "") + "FiberTrack" + entries;
	}

}

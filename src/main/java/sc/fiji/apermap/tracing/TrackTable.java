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
import java.util.Comparator;
import java.util.List;

/**
 * A rectangular table of {@link FiberTrack}s: every track holds exactly one
 * entry per column profile.
 */
public class TrackTable {

	private final int nProfiles;
	private final List<FiberTrack> tracks;

	public TrackTable(final int nProfiles) {
		this(nProfiles, new ArrayList<>());
	}

	public TrackTable(final int nProfiles, final List<FiberTrack> tracks) {
		this.nProfiles = nProfiles;
		this.tracks = new ArrayList<>(tracks.size());
		for (final FiberTrack track : tracks)
			add(track);
	}

	/**
	 * @throws IllegalArgumentException if the track does not have one entry per
	 *                                  profile
	 */
	public void add(final FiberTrack track) {
		tracks.add(checked(track));
	}

	public void insert(final int index, final FiberTrack track) {
		tracks.add(index, checked(track));
	}

	private FiberTrack checked(final FiberTrack track) {
		if (track.size() != nProfiles) throw new IllegalArgumentException(
				"Track has " + track.size() + " entries but table has " + nProfiles + " profiles");
		return track;
	}

	public FiberTrack get(final int index) {
		return tracks.get(index);
	}

	public List<FiberTrack> getTracks() {
		return Collections.unmodifiableList(tracks);
	}

	public int size() {
		return tracks.size();
	}

	public int getNProfiles() {
		return nProfiles;
	}

	public boolean isEmpty() {
		return tracks.isEmpty();
	}

	/** @return the number of tracks detected in the given profile */
	public int countDetected(final int profile) {
		int count = 0;
		for (final FiberTrack track : tracks) {
			if (track.isDetected(profile)) count++;
		}
		return count;
	}

	/**
	 * Sorts tracks by their position in a profile in which all are detected.
	 */
	public void sortByPosition(final int profile) {
		tracks.sort(Comparator.comparingDouble(t -> t.get(profile).getPosition()));
	}

	@Override
	public String toString() {
		return "TrackTable[" + tracks.size() + " tracks x " + nProfiles + " profiles]";
	}

}

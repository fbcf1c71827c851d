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
import java.util.Comparator;
import java.util.List;

import sc.fiji.apermap.util.Logger;

/**
 * Stitches the peak lists of consecutive profiles into fiber tracks.
 * <p>
 * Tracks, ordered by their last detected position, are merged with the
 * ascending peaks of the next profile: a track and a peak closer than the match
 * tolerance are joined; otherwise whichever is smaller falls behind. A track
 * that falls behind receives a gap, a peak that falls behind starts a new
 * track, padded with gaps for the profiles before it. No track is dropped here.
 * </p>
 */
public class PeakAligner {

	private final double matchTolerance;
	private final Logger logger;

	public PeakAligner(final double matchTolerance) {
		this(matchTolerance, new Logger(PeakAligner.class));
	}

	public PeakAligner(final double matchTolerance, final Logger logger) {
		if (matchTolerance <= 0) throw new IllegalArgumentException("Match tolerance must be positive");
		this.matchTolerance = matchTolerance;
		this.logger = logger;
	}

	/**
	 * @param peakLists one ascending array of peak positions per profile
	 * @return the tracks, one entry per profile each
	 */
	public TrackTable align(final List<double[]> peakLists) {
		final List<FiberTrack> tracks = new ArrayList<>();
		final List<FiberTrack> active = new ArrayList<>();
		for (int p = 0; p < peakLists.size(); p++) {
			final double[] peaks = peakLists.get(p);
			active.sort(Comparator.comparingDouble(FiberTrack::lastDetectedPosition));
			final List<FiberTrack> started = new ArrayList<>();
			int i = 0;
			int j = 0;
			while (i < active.size() && j < peaks.length) {
				final FiberTrack track = active.get(i);
				final double last = track.lastDetectedPosition();
				if (Math.abs(last - peaks[j]) < matchTolerance) {
					track.add(TrackEntry.detected(peaks[j]));
					i++;
					j++;
				} else if (last < peaks[j]) {
					track.add(TrackEntry.gap());
					i++;
				} else {
					started.add(startTrack(p, peaks[j]));
					j++;
				}
			}
			for (; i < active.size(); i++)
				active.get(i).add(TrackEntry.gap());
			for (; j < peaks.length; j++)
				started.add(startTrack(p, peaks[j]));
			if (p > 0 && !started.isEmpty())
				logger.debug("Profile " + p + ": " + started.size() + " new track(s)");
			active.addAll(started);
			tracks.addAll(started);
		}
		final TrackTable table = new TrackTable(peakLists.size(), tracks);
		logger.debug("Aligned " + table);
		return table;
	}

	private static FiberTrack startTrack(final int profile, final double position) {
		final FiberTrack track = new FiberTrack();
		track.appendGaps(profile);
		track.add(TrackEntry.detected(position));
		return track;
	}

}

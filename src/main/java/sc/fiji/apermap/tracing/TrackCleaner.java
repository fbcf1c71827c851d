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
import java.util.List;

import sc.fiji.apermap.SignalNotFoundException;
import sc.fiji.apermap.util.Logger;

/**
 * Removes unreliable tracks and chooses the reference profile.
 * <p>
 * Tracks missing from more than the allowed fraction of profiles are dropped.
 * The reference profile is the one in which most of the remaining tracks are
 * detected (ties go to the median of the tied profiles, upper median for an
 * even count). Tracks not detected in the reference profile are dropped too,
 * and the survivors are sorted by their reference position.
 * </p>
 */
public class TrackCleaner {

	private final double maxGapFraction;
	private final Logger logger;

	/**
	 * The cleaned tracks with their reference profile.
	 *
	 * @param tracks           the surviving tracks, sorted by reference position
	 * @param referenceProfile the index of the reference profile
	 */
	public record Result(TrackTable tracks, int referenceProfile) {

		/** @return the position of every track in the reference profile */
		public double[] referencePositions() {
			final double[] positions = new double[tracks.size()];
			for (int i = 0; i < positions.length; i++)
				positions[i] = tracks.get(i).get(referenceProfile).getPosition();
			return positions;
		}
	}

	public TrackCleaner(final double maxGapFraction) {
		this(maxGapFraction, new Logger(TrackCleaner.class));
	}

	public TrackCleaner(final double maxGapFraction, final Logger logger) {
		this.maxGapFraction = maxGapFraction;
		this.logger = logger;
	}

	/**
	 * @param table the aligned tracks
	 * @return the cleaned tracks
	 * @throws SignalNotFoundException if no track survives
	 */
	public Result clean(final TrackTable table) throws SignalNotFoundException {
		final List<FiberTrack> complete = new ArrayList<>();
		for (final FiberTrack track : table.getTracks()) {
			if (track.gapFraction() <= maxGapFraction) complete.add(track);
		}
		logger.debug((table.size() - complete.size()) + " of " + table.size() + " tracks exceed gap fraction "
				+ maxGapFraction);
		if (complete.isEmpty())
			throw new SignalNotFoundException("No track is detected in enough profiles (" + table.size() + " tracks)");

		final TrackTable filtered = new TrackTable(table.getNProfiles(), complete);
		final int reference = referenceProfile(filtered);
		final List<FiberTrack> kept = new ArrayList<>();
		for (final FiberTrack track : complete) {
			if (track.isDetected(reference)) kept.add(track);
		}
		final TrackTable cleaned = new TrackTable(table.getNProfiles(), kept);
		cleaned.sortByPosition(reference);
		logger.info(cleaned.size() + " tracks kept; reference profile " + reference);
		return new Result(cleaned, reference);
	}

	static int referenceProfile(final TrackTable table) {
		int max = -1;
		final List<Integer> tied = new ArrayList<>();
		for (int p = 0; p < table.getNProfiles(); p++) {
			final int count = table.countDetected(p);
			if (count > max) {
				max = count;
				tied.clear();
			}
			if (count == max) tied.add(p);
		}
		return tied.get(tied.size() / 2);
	}

}

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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import sc.fiji.apermap.SignalNotFoundException;

/**
 * Tests for {@link TrackCleaner}.
 */
public class TrackCleanerTest {

	/** NaN marks a gap */
	private static FiberTrack track(final double... positions) {
		final FiberTrack track = new FiberTrack();
		for (final double p : positions)
			track.add(Double.isNaN(p) ? TrackEntry.gap() : TrackEntry.detected(p));
		return track;
	}

	private static final double G = Double.NaN;

	@Test
	public void testCleaning() {
		final TrackTable table = new TrackTable(5);
		table.add(track(50, 50, 50, 50, 50));
		table.add(track(30, 30, 30, 30, G)); // 20% gaps: kept
		table.add(track(70, 70, G, G, G)); // 60% gaps: dropped
		table.add(track(G, 10, 10, 10, 10));
		final TrackCleaner.Result result = new TrackCleaner(0.2).clean(table);
		// profiles 1-3 tie with 3 detections
		assertEquals(2, result.referenceProfile());
		assertEquals(3, result.tracks().size());
		assertArrayEquals(new double[] { 10, 30, 50 }, result.referencePositions(), 0);
	}

	@Test
	public void testEvenTieUsesUpperMedian() {
		final TrackTable table = new TrackTable(4);
		table.add(track(1, 1, 1, 1));
		table.add(track(5, 5, 5, 5));
		assertEquals(2, TrackCleaner.referenceProfile(table));
	}

	@Test
	public void testTracksMissingAtReferenceAreDropped() {
		final TrackTable table = new TrackTable(4);
		table.add(track(1, 1, 1, 1));
		table.add(track(G, G, 9, 9));
		table.add(track(5, 5, G, 5));
		table.add(track(G, 3, 3, G));
		table.add(track(7, G, 7, G));
		final TrackCleaner.Result result = new TrackCleaner(0.5).clean(table);
		assertEquals(2, result.referenceProfile());
		assertArrayEquals(new double[] { 1, 3, 7, 9 }, result.referencePositions(), 0);
	}

	@Test(expected = SignalNotFoundException.class)
	public void testNoCompleteTrack() {
		final TrackTable table = new TrackTable(4);
		table.add(track(1, G, G, 1));
		new TrackCleaner(0.2).clean(table);
	}

}

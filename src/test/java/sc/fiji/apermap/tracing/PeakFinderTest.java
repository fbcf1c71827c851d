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

import java.util.List;

import org.junit.Test;

import sc.fiji.apermap.SyntheticFrames;

/**
 * Tests for {@link PeakFinder}.
 */
public class PeakFinderTest {

	private static int[] indices(final List<PeakFinder.Peak> peaks) {
		return peaks.stream().mapToInt(PeakFinder.Peak::getIndex).toArray();
	}

	@Test
	public void testPlateausResolveToMiddle() {
		assertArrayEquals(new int[] { 3 }, PeakFinder.localMaxima(new double[] { 0, 1, 3, 3, 3, 1, 0 }));
		assertArrayEquals(new int[] { 1 }, PeakFinder.localMaxima(new double[] { 0, 2, 2, 0 }));
		// rising edge into the last sample is not a maximum
		assertArrayEquals(new int[0], PeakFinder.localMaxima(new double[] { 0, 1, 2, 3 }));
	}

	@Test
	public void testDistanceKeepsHigherPeaks() {
		final double[] x = { 0, 5, 0, 9, 0, 4, 0, 0, 7, 0 };
		assertArrayEquals(new int[] { 1, 3, 5, 8 }, indices(new PeakFinder().find(x)));
		assertArrayEquals(new int[] { 3, 8 }, indices(new PeakFinder().distance(3).find(x)));
	}

	@Test
	public void testProminence() {
		final double[] x = { 0, 10, 4, 6, 0 };
		final List<PeakFinder.Peak> all = new PeakFinder().find(x);
		assertEquals(10, all.get(0).getProminence(), 0);
		assertEquals(2, all.get(1).getProminence(), 0);
		assertArrayEquals(new int[] { 1 }, indices(new PeakFinder().minProminence(3).find(x)));
	}

	@Test
	public void testSubPixelCenterAndWidth() {
		final double[] profile = SyntheticFrames.profile(100, new double[] { 50.3 }, 2, 500);
		final List<PeakFinder.Peak> peaks = new PeakFinder().find(profile);
		assertEquals(1, peaks.size());
		assertEquals(50, peaks.get(0).getIndex());
		assertEquals(50.3, peaks.get(0).getCenter(), 0.15);
		assertEquals(2.3548 * 2, peaks.get(0).getWidth(), 0.2);
		assertEquals(0, new PeakFinder().minWidth(6).find(profile).size());
	}

}

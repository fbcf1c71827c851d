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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import sc.fiji.apermap.CurvatureModel;
import sc.fiji.apermap.FitException;

/**
 * Tests for {@link TraceFitter}.
 */
public class TraceFitterTest {

	private static final double[] BASES = { 10, 20, 40, 50 };

	/* fibers drift by 0.5 px per profile; profiles are 100 columns apart */
	private static TrackTable tracks(final int nProfiles) {
		final TrackTable table = new TrackTable(nProfiles);
		for (final double base : BASES) {
			final FiberTrack track = new FiberTrack();
			for (int p = 0; p < nProfiles; p++)
				track.add(TrackEntry.detected(base + 0.5 * p));
			table.add(track);
		}
		return table;
	}

	private static List<ColumnProfile> profiles(final int nProfiles) {
		final List<ColumnProfile> profiles = new ArrayList<>();
		for (int p = 0; p < nProfiles; p++)
			profiles.add(new ColumnProfile(p, new int[] { 100 * p }, new double[80]));
		return profiles;
	}

	private static FiberLayout layoutWithMissing30() {
		return new FiberLayout(Arrays.asList( //
				new FiberLayout.Slot(10, 10, 0), //
				new FiberLayout.Slot(20, 20, 1), //
				new FiberLayout.Slot(30, 30, -1), //
				new FiberLayout.Slot(40, 40, 2), //
				new FiberLayout.Slot(50, 50, 3)));
	}

	@Test
	public void testSynthesizeMissingFiber() {
		final TrackTable complete = new TraceFitter(4, 4).synthesize(tracks(6), layoutWithMissing30());
		assertEquals(5, complete.size());
		final FiberTrack synthetic = complete.get(2);
		assertTrue(synthetic.isSynthetic());
		for (int p = 0; p < 6; p++)
			assertEquals(30 + 0.5 * p, synthetic.get(p).getPosition(), 1e-6);
		assertFalse(complete.get(3).isSynthetic());
		assertEquals(40, complete.get(3).get(0).getPosition(), 0);
	}

	@Test
	public void testFitTraces() {
		final List<TraceCoefficients> traces = new TraceFitter(4, 4).fit(tracks(6), layoutWithMissing30(), profiles(6),
				CurvatureModel.flat(600));
		assertEquals(5, traces.size());
		assertEquals(3, traces.get(2).getLabel());
		assertTrue(traces.get(2).isSynthetic());
		assertEquals(4, traces.get(0).getDegree());
		// row = base + 0.005 * column
		assertEquals(31, traces.get(2).rowAt(200), 1e-6);
		assertEquals(51.25, traces.get(4).rowAt(250), 1e-6);
		assertEquals(30, traces.get(2).getReferencePosition(), 0);
	}

	@Test
	public void testCurvatureShiftsColumns() {
		// offset(row) = 10 everywhere: traces move 10 columns right
		final List<TraceCoefficients> traces = new TraceFitter(4, 2).fit(tracks(6), layoutWithMissing30(),
				profiles(6), new CurvatureModel(0, 0, 10, 0, 600));
		assertEquals(10, traces.get(0).rowAt(10), 1e-6);
	}

	@Test(expected = FitException.class)
	public void testTooFewProfilesForDegree() {
		new TraceFitter(4, 4).fit(tracks(3), layoutWithMissing30(), profiles(3), CurvatureModel.flat(300));
	}

}

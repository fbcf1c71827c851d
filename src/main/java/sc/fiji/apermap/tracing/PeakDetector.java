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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import sc.fiji.apermap.ApertureUtils;
import sc.fiji.apermap.SignalNotFoundException;
import sc.fiji.apermap.TraceParameters;
import sc.fiji.apermap.util.Logger;

/**
 * Detects candidate fiber centers in column profiles.
 * <p>
 * Detection runs in two passes: an unconstrained pre-analysis that measures the
 * typical fiber spacing ({@link #calibrate(List)}), and a refined pass that
 * only keeps peaks satisfying the {@link PeakThresholds} derived from it
 * ({@link #detect(List, PeakThresholds)}).
 * </p>
 */
public class PeakDetector {

	private final TraceParameters params;
	private final Logger logger;

	public PeakDetector(final TraceParameters params) {
		this(params, new Logger(PeakDetector.class));
	}

	public PeakDetector(final TraceParameters params, final Logger logger) {
		this.params = params;
		this.logger = logger;
	}

	/**
	 * Measures the median spacing between adjacent maxima of every profile and
	 * derives the refined-pass thresholds from it.
	 *
	 * @param profiles the column profiles
	 * @return the thresholds
	 * @throws SignalNotFoundException if no profile has two maxima, or if the
	 *                                 spacing is too small to define an aperture
	 */
	public PeakThresholds calibrate(final List<ColumnProfile> profiles) throws SignalNotFoundException {
		final PeakFinder finder = new PeakFinder();
		final List<Double> spacings = new ArrayList<>();
		for (final ColumnProfile profile : profiles) {
			final List<PeakFinder.Peak> peaks = finder.find(profile.getValues());
			for (int i = 1; i < peaks.size(); i++)
				spacings.add((double) (peaks.get(i).getIndex() - peaks.get(i - 1).getIndex()));
		}
		if (spacings.isEmpty()) throw new SignalNotFoundException("No peaks found in any of " + profiles.size()
				+ " profiles. Is the frame illuminated?");
		final double median = new Median().evaluate(spacings.stream().mapToDouble(Double::doubleValue).toArray());
		final PeakThresholds thresholds = PeakThresholds.fromSpacing(median, params);
		if (thresholds.getApertureHalfWidth() < 1) throw new SignalNotFoundException(
				"Median peak spacing of " + median + " px is too small to resolve fibers");
		logger.info("Median peak spacing: " + ApertureUtils.formatDouble(median, 2) + " px; " + thresholds);
		return thresholds;
	}

	/**
	 * Runs the refined pass.
	 *
	 * @param profiles   the column profiles
	 * @param thresholds the acceptance criteria
	 * @return one ascending array of sub-pixel peak centers (rows) per profile
	 * @throws SignalNotFoundException if a majority of profiles has no peak
	 */
	public List<double[]> detect(final List<ColumnProfile> profiles, final PeakThresholds thresholds)
			throws SignalNotFoundException {
		final PeakFinder finder = thresholds.toFinder();
		final List<double[]> peakLists = new ArrayList<>(profiles.size());
		int empty = 0;
		for (final ColumnProfile profile : profiles) {
			final List<PeakFinder.Peak> peaks = finder.find(profile.getValues());
			final double[] centers = new double[peaks.size()];
			for (int i = 0; i < centers.length; i++)
				centers[i] = peaks.get(i).getCenter();
			// centers of width-filtered peaks may swap order on asymmetric shoulders
			Arrays.sort(centers);
			if (centers.length == 0) empty++;
			peakLists.add(centers);
		}
		if (empty * 2 > profiles.size()) throw new SignalNotFoundException(
				empty + " of " + profiles.size() + " profiles have no peak passing " + thresholds);
		if (empty > 0) logger.debug(empty + " profile(s) without accepted peaks");
		return peakLists;
	}

	/**
	 * Convenience method running both passes.
	 *
	 * @see #calibrate(List)
	 * @see #detect(List, PeakThresholds)
	 */
	public List<double[]> detect(final List<ColumnProfile> profiles) throws SignalNotFoundException {
		return detect(profiles, calibrate(profiles));
	}

}

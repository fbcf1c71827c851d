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
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import sc.fiji.apermap.FitException;
import sc.fiji.apermap.IFUType;
import sc.fiji.apermap.TraceParameters;
import sc.fiji.apermap.util.Logger;
import sc.fiji.apermap.util.PolynomialFitter;

/**
 * Compares the fibers detected in the reference profile with the template of
 * the IFU and works out which fibers were never detected.
 * <p>
 * Two strategies are used, depending on the fiber layout:
 * </p>
 * <ul>
 * <li><b>Grouped</b> layouts (fibers arranged in bundles) are registered on
 * their bundle gaps: gaps of the template are paired with gaps of the detected
 * fibers, a polynomial mapping template onto detector is fitted through the
 * pairs and refined on the matched fibers. Predicted fibers with no detection
 * within {@code matchWidthFactor * apertureHalfWidth} are missing.</li>
 * <li><b>Ungrouped</b> layouts are walked in order: a spacing larger than
 * {@code gapFactor} times the largest template spacing receives a marker one
 * median spacing after the fiber preceding it, until the expected count is
 * reached.</li>
 * </ul>
 * The resolver never fails: the layout may hold fewer or more fibers than
 * expected, in which case the caller reports the mismatch.
 */
public class MissingFiberResolver {

	private static final int MAX_REFINEMENTS = 5;
	private static final double RESIDUAL_TOLERANCE = 1e-6;

	private final TraceParameters params;
	private final Logger logger;

	/** A bundle gap: the spacing between fibers {@code index} and {@code index + 1} */
	static final class Gap {
		final int index;
		final double center;
		final double width;

		Gap(final int index, final double center, final double width) {
			this.index = index;
			this.center = center;
			this.width = width;
		}

		@Override
		public String toString() {
			return String.format("Gap[%d, %.1f, w=%.1f]", index, center, width);
		}
	}

	public MissingFiberResolver(final TraceParameters params) {
		this(params, new Logger(MissingFiberResolver.class));
	}

	public MissingFiberResolver(final TraceParameters params, final Logger logger) {
		this.params = params;
		this.logger = logger;
	}

	/**
	 * Resolves the fiber layout.
	 *
	 * @param detected          the ascending reference positions of the detected
	 *                          tracks
	 * @param template          the ascending template positions, already scaled
	 *                          to the frame binning
	 * @param ifuType           the IFU configuration
	 * @param apertureHalfWidth the aperture half width (px)
	 * @return the layout
	 */
	public FiberLayout resolve(final double[] detected, final double[] template, final IFUType ifuType,
			final int apertureHalfWidth) {
		if (detected.length == 0) throw new IllegalArgumentException("No detected fibers");
		if (template.length == 0) throw new IllegalArgumentException("Empty template");
		final FiberLayout layout;
		if (ifuType.isGrouped()) {
			layout = resolveGrouped(detected, template, params.getMatchWidthFactor() * apertureHalfWidth);
		} else {
			final int expected = (ifuType.getExpectedFibers() > 0) ? ifuType.getExpectedFibers() : template.length;
			layout = resolveUngrouped(detected, template, expected);
		}
		logger.info(layout + ": missing fibers at " + Arrays.toString(layout.getMissingIndices()));
		return layout;
	}

	FiberLayout resolveGrouped(final double[] detected, final double[] template, final double tolerance) {
		final double[] predicted = initialMapping(detected, template);
		int[] match = assign(detected, predicted, tolerance);
		for (int iteration = 0; iteration < MAX_REFINEMENTS; iteration++) {
			final double[] refined = refit(detected, template, match);
			if (refined == null) break;
			final int[] rematch = assign(detected, refined, tolerance);
			System.arraycopy(refined, 0, predicted, 0, predicted.length);
			if (Arrays.equals(rematch, match)) break;
			match = rematch;
		}

		final List<FiberLayout.Slot> slots = new ArrayList<>(template.length);
		final boolean[] assigned = new boolean[detected.length];
		final List<double[]> pairs = new ArrayList<>();
		for (int k = 0; k < template.length; k++) {
			if (match[k] < 0) {
				slots.add(new FiberLayout.Slot(predicted[k], template[k], -1));
			} else {
				assigned[match[k]] = true;
				slots.add(new FiberLayout.Slot(detected[match[k]], template[k], match[k]));
				pairs.add(new double[] { detected[match[k]], template[k] });
			}
		}
		// detections matching no template fiber are kept, with an interpolated template coordinate
		for (int m = 0; m < detected.length; m++) {
			if (assigned[m]) continue;
			logger.debug("Detection at " + detected[m] + " matches no template fiber");
			slots.add(new FiberLayout.Slot(detected[m], interpolate(pairs, detected[m]), m));
		}
		return new FiberLayout(slots);
	}

	FiberLayout resolveUngrouped(final double[] detected, final double[] template, final int expected) {
		final double threshold = params.getGapFactor() * max(diff(template));
		final double[] detectedSpacings = diff(detected);
		final double step = (detectedSpacings.length == 0) ? 0 : new Median().evaluate(detectedSpacings);

		final List<Double> positions = new ArrayList<>();
		final List<Integer> tracks = new ArrayList<>();
		for (int m = 0; m < detected.length; m++) {
			positions.add(detected[m]);
			tracks.add(m);
		}
		int i = 0;
		while (step > 0 && threshold > 0 && i < positions.size() - 1 && positions.size() < expected) {
			if (positions.get(i + 1) - positions.get(i) > threshold) {
				positions.add(i + 1, positions.get(i) + step);
				tracks.add(i + 1, -1);
			}
			i++;
		}
		final double templateStep = (template.length > 1) ? new Median().evaluate(diff(template)) : step;
		final List<FiberLayout.Slot> slots = new ArrayList<>(positions.size());
		for (int k = 0; k < positions.size(); k++) {
			final double coordinate = (k < template.length) ? template[k]
					: template[template.length - 1] + (k - template.length + 1) * templateStep;
			slots.add(new FiberLayout.Slot(positions.get(k), coordinate, tracks.get(k)));
		}
		return new FiberLayout(slots);
	}

	/**
	 * Maps every template position onto the detector through the paired bundle
	 * gaps, or through a pure shift when fewer than two pairs are available.
	 */
	private double[] initialMapping(final double[] detected, final double[] template) {
		final List<Gap> templateGaps = findGaps(template, params.getGapFactor(), params.getLocalWindow());
		final List<Gap> observedGaps = findGaps(detected, params.getGapFactor(), params.getLocalWindow());
		final List<Gap[]> pairs = pairGaps(templateGaps, observedGaps);
		logger.debug(templateGaps.size() + " template gap(s), " + observedGaps.size() + " observed gap(s), "
				+ pairs.size() + " pair(s)");

		// gaps next to a missing fiber are wider than expected and their centers are off
		final double spacing = medianSpacing(detected);
		final double ratio = (medianSpacing(template) > 0) ? spacing / medianSpacing(template) : 1;
		final List<Gap[]> clean = new ArrayList<>();
		for (final Gap[] pair : pairs) {
			if (Math.abs(pair[1].width - pair[0].width * ratio) <= spacing / 2) clean.add(pair);
		}
		final List<Gap[]> used = (clean.size() >= 2) ? clean : pairs;

		final double[] predicted = new double[template.length];
		if (used.size() >= 2) {
			final double[] x = new double[used.size()];
			final double[] y = new double[used.size()];
			for (int i = 0; i < x.length; i++) {
				x[i] = used.get(i)[0].center;
				y[i] = used.get(i)[1].center;
			}
			try {
				final double[] coeffs = PolynomialFitter.fit(x, y, Math.min(params.getTemplateDegree(), x.length - 1));
				for (int k = 0; k < template.length; k++)
					predicted[k] = PolynomialFitter.evaluate(coeffs, template[k]);
				return predicted;
			} catch (final FitException e) {
				logger.warn("Could not map template gaps onto detector (" + e.getMessage() + "). Using a shift.");
			}
		}
		final double shift = (used.size() == 1) ? used.get(0)[1].center - used.get(0)[0].center
				: bestShift(detected, template);
		for (int k = 0; k < template.length; k++)
			predicted[k] = template[k] + shift;
		return predicted;
	}

	/**
	 * Fits the template-to-detector mapping on matched fibers.
	 *
	 * @return the refined predictions, or null if too few fibers are matched
	 */
	private double[] refit(final double[] detected, final double[] template, final int[] match) {
		final List<double[]> pairs = new ArrayList<>();
		for (int k = 0; k < template.length; k++) {
			if (match[k] >= 0) pairs.add(new double[] { template[k], detected[match[k]] });
		}
		if (pairs.size() < 2) return null;
		final double[] x = pairs.stream().mapToDouble(p -> p[0]).toArray();
		final double[] y = pairs.stream().mapToDouble(p -> p[1]).toArray();
		try {
			final double[] coeffs = PolynomialFitter.fit(x, y, Math.min(params.getTemplateDegree(), x.length - 1));
			final double[] predicted = new double[template.length];
			for (int k = 0; k < template.length; k++)
				predicted[k] = PolynomialFitter.evaluate(coeffs, template[k]);
			return predicted;
		} catch (final FitException e) {
			logger.debug("Refinement skipped: " + e.getMessage());
			return null;
		}
	}

	/**
	 * Pairs template gaps with observed gaps, in order. Surplus observed gaps are
	 * dropped narrowest first; if observed gaps are fewer, the template sequence
	 * is aligned at the offset with the best linear fit (smallest shift among
	 * equally good ones).
	 */
	static List<Gap[]> pairGaps(final List<Gap> templateGaps, final List<Gap> observedGaps) {
		List<Gap> observed = observedGaps;
		if (observed.size() > templateGaps.size()) {
			final List<Gap> byWidth = new ArrayList<>(observed);
			byWidth.sort(Comparator.comparingDouble(g -> g.width));
			final List<Gap> widest = byWidth.subList(observed.size() - templateGaps.size(), observed.size());
			observed = new ArrayList<>(widest);
			observed.sort(Comparator.comparingInt(g -> g.index));
		}
		int offset = 0;
		if (observed.size() < templateGaps.size() && !observed.isEmpty()) {
			// evenly spaced gaps fit equally well at several offsets: prefer the smallest shift
			double bestResidual = Double.POSITIVE_INFINITY;
			double bestShift = Double.POSITIVE_INFINITY;
			for (int s = 0; s <= templateGaps.size() - observed.size(); s++) {
				final double residual = alignmentResidual(templateGaps, observed, s);
				double shift = 0;
				for (int k = 0; k < observed.size(); k++)
					shift += observed.get(k).center - templateGaps.get(s + k).center;
				shift = Math.abs(shift / observed.size());
				if (residual < bestResidual - RESIDUAL_TOLERANCE
						|| (residual <= bestResidual + RESIDUAL_TOLERANCE && shift < bestShift)) {
					bestResidual = Math.min(residual, bestResidual);
					bestShift = shift;
					offset = s;
				}
			}
		}
		final List<Gap[]> pairs = new ArrayList<>(observed.size());
		for (int k = 0; k < observed.size(); k++)
			pairs.add(new Gap[] { templateGaps.get(offset + k), observed.get(k) });
		return pairs;
	}

	private static double alignmentResidual(final List<Gap> templateGaps, final List<Gap> observed, final int offset) {
		if (observed.size() < 3) return 0;
		final SimpleRegression regression = new SimpleRegression();
		for (int k = 0; k < observed.size(); k++)
			regression.addData(templateGaps.get(offset + k).center, observed.get(k).center);
		return regression.getSumSquaredErrors();
	}

	/**
	 * Finds the spacings larger than {@code factor} times the median of the
	 * spacings within {@code +-window} of them.
	 *
	 * @param positions ascending positions
	 * @return the gaps, in order
	 */
	static List<Gap> findGaps(final double[] positions, final double factor, final int window) {
		final double[] spacings = diff(positions);
		final List<Gap> gaps = new ArrayList<>();
		final Median median = new Median();
		for (int k = 0; k < spacings.length; k++) {
			final int from = Math.max(0, k - window);
			final int to = Math.min(spacings.length - 1, k + window);
			final double local = median.evaluate(spacings, from, to - from + 1);
			if (spacings[k] > factor * local)
				gaps.add(new Gap(k, (positions[k] + positions[k + 1]) / 2, spacings[k]));
		}
		return gaps;
	}

	/**
	 * Assigns every detection to its nearest prediction, if close enough. When
	 * several detections share a prediction the closest one wins.
	 *
	 * @return for every prediction, the index of its detection or -1
	 */
	static int[] assign(final double[] detected, final double[] predicted, final double tolerance) {
		final int[] match = new int[predicted.length];
		Arrays.fill(match, -1);
		for (int m = 0; m < detected.length; m++) {
			int nearest = -1;
			double distance = Double.POSITIVE_INFINITY;
			for (int k = 0; k < predicted.length; k++) {
				final double d = Math.abs(predicted[k] - detected[m]);
				if (d < distance) {
					distance = d;
					nearest = k;
				}
			}
			if (nearest < 0 || distance > tolerance) continue;
			if (match[nearest] < 0 || distance < Math.abs(predicted[nearest] - detected[match[nearest]]))
				match[nearest] = m;
		}
		return match;
	}

	/**
	 * @return the shift of the template that best overlays the detections,
	 *         among those aligning the first detection with a template fiber
	 */
	static double bestShift(final double[] detected, final double[] template) {
		double bestShift = detected[0] - template[0];
		double bestScore = Double.POSITIVE_INFINITY;
		for (final double anchor : template) {
			final double shift = detected[0] - anchor;
			double score = 0;
			for (final double d : detected)
				score += nearestDistance(template, d - shift);
			if (score < bestScore) {
				bestScore = score;
				bestShift = shift;
			}
		}
		return bestShift;
	}

	private static double nearestDistance(final double[] sorted, final double value) {
		final int i = Arrays.binarySearch(sorted, value);
		if (i >= 0) return 0;
		final int insertion = -i - 1;
		double distance = Double.POSITIVE_INFINITY;
		if (insertion > 0) distance = value - sorted[insertion - 1];
		if (insertion < sorted.length) distance = Math.min(distance, sorted[insertion] - value);
		return distance;
	}

	/**
	 * Piecewise-linear interpolation of {x, y} pairs ascending in x, extrapolated
	 * from the end segments.
	 */
	private static double interpolate(final List<double[]> pairs, final double x) {
		if (pairs.isEmpty()) return x;
		if (pairs.size() == 1) return x + pairs.get(0)[1] - pairs.get(0)[0];
		int i = 1;
		while (i < pairs.size() - 1 && pairs.get(i)[0] < x)
			i++;
		final double[] p0 = pairs.get(i - 1);
		final double[] p1 = pairs.get(i);
		if (p1[0] == p0[0]) return p0[1];
		return p0[1] + (x - p0[0]) * (p1[1] - p0[1]) / (p1[0] - p0[0]);
	}

	private static double medianSpacing(final double[] positions) {
		final double[] spacings = diff(positions);
		return (spacings.length == 0) ? 0 : new Median().evaluate(spacings);
	}

	private static double[] diff(final double[] values) {
		final double[] diff = new double[Math.max(0, values.length - 1)];
		for (int i = 0; i < diff.length; i++)
			diff[i] = values[i + 1] - values[i];
		return diff;
	}

	private static double max(final double[] values) {
		double max = 0;
		for (final double v : values)
			max = Math.max(max, v);
		return max;
	}

}

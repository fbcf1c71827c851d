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

/**
 * 1D peak finding on sampled signals.
 * <p>
 * Candidates are local maxima; a flat top resolves to its middle sample (lower
 * middle for an even plateau). Candidates can then be filtered by a minimum
 * distance (larger peaks are kept first), by topographic prominence and by
 * their width at a fraction of the prominence. Widths are measured between
 * linearly interpolated crossing points, which also give the sub-pixel peak
 * center.
 * </p>
 */
public class PeakFinder {

	private double distance;
	private double minProminence;
	private double minWidth;
	private double relHeight = 0.5;

	/**
	 * A detected peak.
	 */
	public static class Peak {

		private final int index;
		private final double height;
		private final double prominence;
		private final double leftIp;
		private final double rightIp;

		Peak(final int index, final double height, final double prominence, final double leftIp,
				final double rightIp) {
			this.index = index;
			this.height = height;
			this.prominence = prominence;
			this.leftIp = leftIp;
			this.rightIp = rightIp;
		}

		/** @return the sample index of the maximum */
		public int getIndex() {
			return index;
		}

		public double getHeight() {
			return height;
		}

		public double getProminence() {
			return prominence;
		}

		/** @return the interpolated position of the left crossing */
		public double getLeftIp() {
			return leftIp;
		}

		/** @return the interpolated position of the right crossing */
		public double getRightIp() {
			return rightIp;
		}

		public double getWidth() {
			return rightIp - leftIp;
		}

		/** @return the midpoint of the two crossings */
		public double getCenter() {
			return (leftIp + rightIp) / 2;
		}

		@Override
		public String toString() {
			return String.format("Peak[%d, center=%.2f, prom=%.1f, width=%.2f]", index, getCenter(), prominence,
					getWidth());
		}
	}

	/** Minimum distance (samples) between peaks. Values below 1 disable the filter */
	public PeakFinder distance(final double distance) {
		this.distance = distance;
		return this;
	}

	public PeakFinder minProminence(final double minProminence) {
		this.minProminence = minProminence;
		return this;
	}

	public PeakFinder minWidth(final double minWidth) {
		this.minWidth = minWidth;
		return this;
	}

	/** Fraction of the prominence below the maximum at which widths are measured */
	public PeakFinder relHeight(final double relHeight) {
		this.relHeight = relHeight;
		return this;
	}

	/**
	 * Finds the peaks of a signal.
	 *
	 * @param x the signal
	 * @return the accepted peaks, ordered by index
	 */
	public List<Peak> find(final double[] x) {
		int[] peaks = localMaxima(x);
		if (distance >= 1 && peaks.length > 1) peaks = selectByDistance(x, peaks, (int) Math.ceil(distance));
		final List<Peak> result = new ArrayList<>(peaks.length);
		for (final int peak : peaks) {
			// prominence: lowest point on either side before a higher sample
			double leftMin = x[peak];
			int leftBase = peak;
			for (int i = peak; i >= 0 && x[i] <= x[peak]; i--) {
				if (x[i] < leftMin) {
					leftMin = x[i];
					leftBase = i;
				}
			}
			double rightMin = x[peak];
			int rightBase = peak;
			for (int i = peak; i < x.length && x[i] <= x[peak]; i++) {
				if (x[i] < rightMin) {
					rightMin = x[i];
					rightBase = i;
				}
			}
			final double prominence = x[peak] - Math.max(leftMin, rightMin);
			if (prominence < minProminence) continue;

			final double height = x[peak] - prominence * relHeight;
			int i = peak;
			while (leftBase < i && height < x[i])
				i--;
			double leftIp = i;
			if (x[i] < height) leftIp += (height - x[i]) / (x[i + 1] - x[i]);
			i = peak;
			while (i < rightBase && height < x[i])
				i++;
			double rightIp = i;
			if (x[i] < height) rightIp -= (height - x[i]) / (x[i - 1] - x[i]);
			if (rightIp - leftIp < minWidth) continue;
			result.add(new Peak(peak, x[peak], prominence, leftIp, rightIp));
		}
		return result;
	}

	/**
	 * @return the indices of all local maxima, flat tops resolved to their middle
	 */
	static int[] localMaxima(final double[] x) {
		final int[] maxima = new int[x.length / 2 + 1];
		int m = 0;
		final int iMax = x.length - 1;
		int i = 1;
		while (i < iMax) {
			if (x[i - 1] < x[i]) {
				int ahead = i + 1;
				while (ahead < iMax && x[ahead] == x[i])
					ahead++;
				if (x[ahead] < x[i]) {
					maxima[m++] = (i + ahead - 1) / 2;
					i = ahead;
				}
			}
			i++;
		}
		return Arrays.copyOf(maxima, m);
	}

	/**
	 * Visits peaks from the highest down (ties in index order) and removes the
	 * neighbours of every kept peak that lie closer than the given distance.
	 */
	private static int[] selectByDistance(final double[] x, final int[] peaks, final int minDistance) {
		final boolean[] keep = new boolean[peaks.length];
		Arrays.fill(keep, true);
		final Integer[] byHeight = new Integer[peaks.length];
		for (int i = 0; i < peaks.length; i++)
			byHeight[i] = i;
		// stable sort, ascending height
		Arrays.sort(byHeight, Comparator.comparingDouble(j -> x[peaks[j]]));
		for (int n = peaks.length - 1; n >= 0; n--) {
			final int j = byHeight[n];
			if (!keep[j]) continue;
			for (int k = j - 1; k >= 0 && peaks[j] - peaks[k] < minDistance; k--)
				keep[k] = false;
			for (int k = j + 1; k < peaks.length && peaks[k] - peaks[j] < minDistance; k++)
				keep[k] = false;
		}
		int count = 0;
		final int[] kept = new int[peaks.length];
		for (int j = 0; j < peaks.length; j++) {
			if (keep[j]) kept[count++] = peaks[j];
		}
		return Arrays.copyOf(kept, count);
	}

}

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

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import sc.fiji.apermap.ConfigurationException;
import sc.fiji.apermap.util.Logger;

/**
 * Splits a frame into groups of adjacent columns and collapses each group into
 * a {@link ColumnProfile} by inverse-variance weighted averaging.
 * <p>
 * With {@code trace_n = floor(width / traceStep)}, group starts are spaced
 * evenly over {@code [0, width]}; every start but the last opens a group of
 * {@code nLines} columns (clamped to the frame), so {@code trace_n - 1}
 * profiles are produced. Column indices are reported in the coordinates of
 * the interval passed in, which need not start at zero; rows are counted from
 * the first row of the interval.
 * </p>
 */
public class ColumnProfileExtractor {

	private final int traceStep;
	private final int nLines;
	private final Logger logger;

	public ColumnProfileExtractor(final int traceStep, final int nLines) {
		this(traceStep, nLines, new Logger(ColumnProfileExtractor.class));
	}

	public ColumnProfileExtractor(final int traceStep, final int nLines, final Logger logger) {
		this.traceStep = traceStep;
		this.nLines = nLines;
		this.logger = logger;
	}

	/**
	 * Extracts profiles assuming unit variance everywhere.
	 *
	 * @see #extract(RandomAccessibleInterval, RandomAccessibleInterval)
	 */
	public List<ColumnProfile> extract(final RandomAccessibleInterval<? extends RealType<?>> frame)
			throws ConfigurationException {
		return extract(frame, null);
	}

	/**
	 * Extracts the column profiles of a frame.
	 *
	 * @param frame    the (rectified) frame, dimension 0: column, 1: row
	 * @param variance the per-pixel variance over the same interval, or null
	 *                 for unit variance. Non-positive or non-finite variances
	 *                 give the pixel no weight.
	 * @return the profiles, ordered by column
	 * @throws ConfigurationException if the grouping parameters are degenerate
	 *                                for this frame
	 */
	public List<ColumnProfile> extract(final RandomAccessibleInterval<? extends RealType<?>> frame,
			final RandomAccessibleInterval<? extends RealType<?>> variance) throws ConfigurationException {
		if (frame == null) throw new IllegalArgumentException("Frame cannot be null");
		if (traceStep <= 0) throw new ConfigurationException("Trace step must be positive: " + traceStep);
		if (nLines <= 0) throw new ConfigurationException("Number of stacked columns must be positive: " + nLines);
		final long width = frame.dimension(0);
		final int nRows = (int) frame.dimension(1);
		if (traceStep > width)
			throw new ConfigurationException("Trace step (" + traceStep + ") exceeds frame width (" + width + ")");
		final int traceN = (int) (width / traceStep);
		if (traceN - 1 < 2) {
			throw new ConfigurationException("Trace step " + traceStep + " leaves " + Math.max(0, traceN - 1)
					+ " column group(s) on a " + width + " px wide frame; at least 2 are required");
		}
		final long minColumn = frame.min(0);
		final long minRow = frame.min(1);
		final RandomAccess<? extends RealType<?>> ra = frame.randomAccess();
		final RandomAccess<? extends RealType<?>> varRa = (variance == null) ? null : variance.randomAccess();

		final List<ColumnProfile> profiles = new ArrayList<>(traceN - 1);
		for (int i = 0; i < traceN - 1; i++) {
			final long start = (long) Math.floor(i * (double) width / (traceN - 1));
			final int nMembers = (int) Math.min(nLines, width - start);
			final int[] columns = new int[nMembers];
			final double[] weightedSum = new double[nRows];
			final double[] weights = new double[nRows];
			for (int m = 0; m < nMembers; m++) {
				final long column = minColumn + start + m;
				columns[m] = (int) column;
				ra.setPosition(column, 0);
				if (varRa != null) varRa.setPosition(column, 0);
				for (int r = 0; r < nRows; r++) {
					ra.setPosition(minRow + r, 1);
					final double w;
					if (varRa == null) {
						w = 1;
					} else {
						varRa.setPosition(minRow + r, 1);
						final double var = varRa.get().getRealDouble();
						w = (var > 0 && Double.isFinite(var)) ? 1 / var : 0;
					}
					if (w == 0) continue;
					weightedSum[r] += w * ra.get().getRealDouble();
					weights[r] += w;
				}
			}
			final double[] values = new double[nRows];
			for (int r = 0; r < nRows; r++)
				values[r] = (weights[r] > 0) ? weightedSum[r] / weights[r] : 0;
			profiles.add(new ColumnProfile(i, columns, values));
		}
		logger.debug(profiles.size() + " profiles of " + nLines + " column(s), step " + traceStep);
		return profiles;
	}

}

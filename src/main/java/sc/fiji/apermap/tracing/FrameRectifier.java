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

import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.apermap.CurvatureModel;

/**
 * Straightens the spectral curvature of a frame: every row is shifted along
 * the column axis by its curvature offset, so that a rectified column
 * {@code x} of row {@code y} samples the detector at absolute column
 * {@code x + offset(y)}. Samples between pixels are linearly interpolated.
 *
 * @see CurvatureModel#offset(double)
 */
public class FrameRectifier {

	private final CurvatureModel curvature;

	public FrameRectifier(final CurvatureModel curvature) {
		if (curvature == null) throw new IllegalArgumentException("Curvature model cannot be null");
		this.curvature = curvature;
	}

	/**
	 * Rectifies a frame. Samples falling outside the detector are 0.
	 *
	 * @param frame the 2D frame (dimension 0: column, dimension 1: row)
	 * @return the rectified frame, same shape as the input
	 */
	public Img<DoubleType> rectify(final RandomAccessibleInterval<? extends RealType<?>> frame) {
		return resample(frame, 0);
	}

	/**
	 * Rectifies a variance image. Samples falling outside the detector get an
	 * infinite variance, i.e., no weight when profiles are averaged.
	 *
	 * @param variance the per-pixel variance, same shape as the frame
	 * @return the rectified variance
	 */
	public Img<DoubleType> rectifyVariance(final RandomAccessibleInterval<? extends RealType<?>> variance) {
		return resample(variance, Double.POSITIVE_INFINITY);
	}

	/**
	 * Computes the columns of a rectified frame that map inside the detector
	 * and inside the valid spectral span for every row. Rectified column
	 * {@code x} samples absolute column {@code x + offset(y)}, so the span
	 * {@code [offset(y)+X1, offset(y)+X1+dX)} is {@code [X1, X1+dX)} on every
	 * rectified row. Profiles taken outside this interval would sample padding
	 * or unilluminated columns.
	 *
	 * @param nColumns the frame width
	 * @param nRows    the frame height
	 * @return the interval (dimension 0: rectified column, dimension 1: row), or
	 *         null if no column is covered on every row
	 */
	public Interval coveredInterval(final long nColumns, final long nRows) {
		double minOffset = Double.POSITIVE_INFINITY;
		double maxOffset = Double.NEGATIVE_INFINITY;
		for (long row = 0; row < nRows; row++) {
			final double offset = curvature.offset(row);
			minOffset = Math.min(minOffset, offset);
			maxOffset = Math.max(maxOffset, offset);
		}
		final long spanFirst = (long) Math.ceil(curvature.getX1());
		final long spanLast = (long) Math.ceil(curvature.getX1() + curvature.getDX()) - 1;
		final long first = Math.max(Math.max(0, (long) Math.ceil(-minOffset)), spanFirst);
		final long last = Math.min(Math.min(nColumns - 1, (long) Math.floor(nColumns - 1 - maxOffset)), spanLast);
		if (last < first) return null;
		return new FinalInterval(new long[] { first, 0 }, new long[] { last, nRows - 1 });
	}

	private Img<DoubleType> resample(final RandomAccessibleInterval<? extends RealType<?>> image,
			final double padding) {
		final RandomAccessibleInterval<? extends RealType<?>> source = Views.zeroMin(image);
		final int nColumns = (int) source.dimension(0);
		final int nRows = (int) source.dimension(1);
		final double[] rectified = new double[nColumns * nRows];
		final double[] row = new double[nColumns];
		final RandomAccess<? extends RealType<?>> ra = source.randomAccess();
		for (int y = 0; y < nRows; y++) {
			ra.setPosition(y, 1);
			for (int x = 0; x < nColumns; x++) {
				ra.setPosition(x, 0);
				row[x] = ra.get().getRealDouble();
			}
			final double offset = curvature.offset(y);
			final int base = y * nColumns;
			for (int x = 0; x < nColumns; x++) {
				final double src = x + offset;
				if (src < 0 || src > nColumns - 1) {
					rectified[base + x] = padding;
					continue;
				}
				final int i0 = (int) Math.floor(src);
				final double f = src - i0;
				rectified[base + x] = (f == 0) ? row[i0] : row[i0] * (1 - f) + row[i0 + 1] * f;
			}
		}
		return ArrayImgs.doubles(rectified, nColumns, nRows);
	}

}

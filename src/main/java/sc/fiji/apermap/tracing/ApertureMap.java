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

import java.util.Arrays;
import java.util.stream.IntStream;

import ij.ImagePlus;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.IntType;
import sc.fiji.apermap.util.ImpUtils;

/**
 * A labeled image assigning every illuminated pixel to its fiber: 0 is
 * background, {@code k > 0} is fiber {@code k}, fibers being numbered by
 * ascending row.
 */
public class ApertureMap {

	private final Img<IntType> labels;
	private final int[] data;
	private final int nFibers;
	private final int[] midpointRows;
	private long[] counts;

	ApertureMap(final int[] data, final Img<IntType> labels, final int nFibers, final int[] midpointRows) {
		this.data = data;
		this.labels = labels;
		this.nFibers = nFibers;
		this.midpointRows = midpointRows;
	}

	/** @return the label image (dimension 0: column, dimension 1: row) */
	public Img<IntType> getLabels() {
		return labels;
	}

	public long getWidth() {
		return labels.dimension(0);
	}

	public long getHeight() {
		return labels.dimension(1);
	}

	/** @return the label at the given pixel */
	public int getLabel(final int column, final int row) {
		return data[row * (int) getWidth() + column];
	}

	/** @return the number of fibers that were rasterized */
	public int getNFibers() {
		return nFibers;
	}

	/**
	 * @return for every fiber, its trace row at the horizontal center of the
	 *         frame, rounded
	 */
	public int[] getMidpointRows() {
		return midpointRows.clone();
	}

	/**
	 * @return the number of pixels of every label; index 0 holds the
	 *         background
	 */
	public synchronized long[] getPixelCounts() {
		if (counts == null) {
			counts = new long[nFibers + 1];
			for (final int label : data) {
				if (label >= 0 && label <= nFibers) counts[label]++;
			}
		}
		return counts.clone();
	}

	/** @return the pixel count of the largest aperture */
	public long getMaxApertureSize() {
		final long[] c = getPixelCounts();
		return (c.length < 2) ? 0 : Arrays.stream(c, 1, c.length).max().getAsLong();
	}

	/**
	 * @return the distinct nonzero labels present in the map, ascending
	 */
	public int[] getPresentLabels() {
		final long[] c = getPixelCounts();
		return IntStream.rangeClosed(1, nFibers).filter(l -> c[l] > 0).toArray();
	}

	/** @return true if every label 1..N is present, i.e., none was clipped away */
	public boolean isComplete() {
		return getPresentLabels().length == nFibers;
	}

	public ImagePlus toImagePlus(final String title) {
		return ImpUtils.toImagePlus(labels, title);
	}

	@Override
	public String toString() {
		return "ApertureMap[" + getWidth() + "x" + getHeight() + ", " + nFibers + " fibers]";
	}

}

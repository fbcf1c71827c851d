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

import net.imglib2.img.array.ArrayImgs;
import sc.fiji.apermap.CurvatureModel;
import sc.fiji.apermap.util.Logger;

/**
 * Rasterizes fitted traces into an {@link ApertureMap}.
 * <p>
 * At every column, fiber {@code i} labels the rows
 * {@code [center - hw, center + hw)} around its rounded trace center (later
 * fibers overwrite earlier ones where bands touch). Pixels outside the valid
 * spectral span of their row are then reset to background.
 * </p>
 */
public class ApertureMapBuilder {

	private final CurvatureModel curvature;
	private final int apertureHalfWidth;
	private final Logger logger;

	public ApertureMapBuilder(final CurvatureModel curvature, final int apertureHalfWidth) {
		this(curvature, apertureHalfWidth, new Logger(ApertureMapBuilder.class));
	}

	public ApertureMapBuilder(final CurvatureModel curvature, final int apertureHalfWidth, final Logger logger) {
		if (apertureHalfWidth < 1) throw new IllegalArgumentException("Invalid aperture half width: " + apertureHalfWidth);
		this.curvature = curvature;
		this.apertureHalfWidth = apertureHalfWidth;
		this.logger = logger;
	}

	/**
	 * Rasterizes the traces, dropping every trace left without a pixel (outside
	 * the frame or the valid span) and relabeling the others, so that the
	 * labels of the map are exactly {@code 1..N} of the returned traces.
	 *
	 * @param nColumns the frame width
	 * @param nRows    the frame height
	 * @param traces   the traces, in label order
	 * @return the map and the traces it labels
	 */
	public Rasterization buildComplete(final int nColumns, final int nRows, final List<TraceCoefficients> traces) {
		List<TraceCoefficients> kept = traces;
		ApertureMap map = build(nColumns, nRows, kept);
		// dropping a band can uncover pixels of a neighbor, so iterate until stable
		while (!map.isComplete()) {
			kept = retainLabels(kept, map.getPresentLabels());
			map = build(nColumns, nRows, kept);
		}
		if (kept.size() < traces.size())
			logger.warn((traces.size() - kept.size()) + " fiber(s) dropped: no pixel inside the frame and the valid span");
		return new Rasterization(map, kept);
	}

	/** The map built by {@link #buildComplete(int, int, List)} and its traces */
	public record Rasterization(ApertureMap map, List<TraceCoefficients> traces) {

		/** @return the labels of the synthetic (interpolated) traces */
		public int[] syntheticLabels() {
			return traces.stream().filter(TraceCoefficients::isSynthetic).mapToInt(TraceCoefficients::getLabel)
					.toArray();
		}
	}

	static List<TraceCoefficients> retainLabels(final List<TraceCoefficients> traces, final int[] labels) {
		final List<TraceCoefficients> kept = new ArrayList<>(labels.length);
		for (final int label : labels)
			kept.add(traces.get(label - 1).withLabel(kept.size() + 1));
		return kept;
	}

	/**
	 * @param nColumns the frame width
	 * @param nRows    the frame height
	 * @param traces   the traces, in label order
	 * @return the map
	 */
	public ApertureMap build(final int nColumns, final int nRows, final List<TraceCoefficients> traces) {
		final int[] data = new int[nColumns * nRows];
		for (int i = 0; i < traces.size(); i++) {
			final TraceCoefficients trace = traces.get(i);
			final int label = i + 1;
			for (int x = 0; x < nColumns; x++) {
				final long center = (long) Math.rint(trace.rowAt(x));
				final long from = Math.max(0, center - apertureHalfWidth);
				final long to = Math.min(nRows, center + apertureHalfWidth);
				for (long y = from; y < to; y++)
					data[(int) y * nColumns + x] = label;
			}
		}
		for (int y = 0; y < nRows; y++) {
			final int base = y * nColumns;
			for (int x = 0; x < nColumns; x++) {
				if (!curvature.isInSpan(y, x)) data[base + x] = 0;
			}
		}
		final int middle = nColumns / 2;
		final int[] midpointRows = new int[traces.size()];
		for (int i = 0; i < midpointRows.length; i++)
			midpointRows[i] = (int) Math.rint(traces.get(i).rowAt(middle));

		final ApertureMap map = new ApertureMap(data, ArrayImgs.ints(data, nColumns, nRows), traces.size(),
				midpointRows);
		if (!map.isComplete()) {
			logger.debug((traces.size() - map.getPresentLabels().length)
					+ " fiber(s) have no pixel in the map (outside the frame or the valid span)");
		}
		logger.debug(map + ", largest aperture: " + map.getMaxApertureSize() + " px");
		return map;
	}

}

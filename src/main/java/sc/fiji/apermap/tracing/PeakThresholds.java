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

import sc.fiji.apermap.TraceParameters;

/**
 * The peak acceptance criteria of the refined detection pass, derived from the
 * fiber spacing measured in the pre-analysis.
 */
public final class PeakThresholds {

	private final int apertureHalfWidth;
	private final double widthCut;
	private final double distanceCut;
	private final double prominenceCut;
	private final double relHeight;

	public PeakThresholds(final int apertureHalfWidth, final double widthCut, final double distanceCut,
			final double prominenceCut, final double relHeight) {
		this.apertureHalfWidth = apertureHalfWidth;
		this.widthCut = widthCut;
		this.distanceCut = distanceCut;
		this.prominenceCut = prominenceCut;
		this.relHeight = relHeight;
	}

	/**
	 * Derives thresholds from the median peak-to-peak spacing:
	 * {@code hw = rint(spacing / 2)}, {@code width >= hw - widthOffset},
	 * {@code distance >= hw * distanceFactor}.
	 *
	 * @param medianSpacing the median spacing (px) of adjacent peaks
	 * @param params        the multipliers
	 * @return the thresholds
	 */
	public static PeakThresholds fromSpacing(final double medianSpacing, final TraceParameters params) {
		final int hw = (int) Math.rint(medianSpacing / 2);
		return new PeakThresholds(hw, hw - params.getWidthOffset(), hw * params.getDistanceFactor(),
				params.getProminenceCut(), params.getRelHeight());
	}

	/** @return half the height (rows) of one fiber band in the aperture map */
	public int getApertureHalfWidth() {
		return apertureHalfWidth;
	}

	public double getWidthCut() {
		return widthCut;
	}

	public double getDistanceCut() {
		return distanceCut;
	}

	public double getProminenceCut() {
		return prominenceCut;
	}

	public double getRelHeight() {
		return relHeight;
	}

	PeakFinder toFinder() {
		return new PeakFinder().distance(distanceCut).minProminence(prominenceCut).minWidth(widthCut)
				.relHeight(relHeight);
	}

	@Override
	public String toString() {
		return "PeakThresholds[hw=" + apertureHalfWidth + ", width>=" + widthCut + ", distance>=" + distanceCut
				+ ", prominence>=" + prominenceCut + "]";
	}

}

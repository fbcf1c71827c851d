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

package sc.fiji.apermap.io;

import java.util.Arrays;

import sc.fiji.apermap.IFUType;
import sc.fiji.apermap.Side;

/**
 * The expected fiber positions (rows at the reference column) of an IFU on one
 * spectrograph side, measured at a given pixel binning.
 */
public final class FiberTemplate {

	private final IFUType ifuType;
	private final Side side;
	private final double[] positions;
	private final int binning;

	public FiberTemplate(final IFUType ifuType, final Side side, final double[] positions, final int binning) {
		if (binning < 1) throw new IllegalArgumentException("Invalid binning: " + binning);
		this.ifuType = ifuType;
		this.side = side;
		this.positions = positions.clone();
		this.binning = binning;
	}

	/**
	 * Rescales the template to a frame binning: positions are multiplied by
	 * {@code binning / frameBinning}.
	 *
	 * @param frameBinning the binning of the frame
	 * @return the scaled template (this template if binnings agree)
	 */
	public FiberTemplate scaledTo(final int frameBinning) {
		if (frameBinning < 1) throw new IllegalArgumentException("Invalid binning: " + frameBinning);
		if (frameBinning == binning) return this;
		final double factor = (double) binning / frameBinning;
		final double[] scaled = new double[positions.length];
		for (int i = 0; i < scaled.length; i++)
			scaled[i] = positions[i] * factor;
		return new FiberTemplate(ifuType, side, scaled, frameBinning);
	}

	public IFUType getIFUType() {
		return ifuType;
	}

	public Side getSide() {
		return side;
	}

	public double[] getPositions() {
		return positions.clone();
	}

	public int getBinning() {
		return binning;
	}

	public int size() {
		return positions.length;
	}

	@Override
	public String toString() {
		return "FiberTemplate[" + ifuType + "/" + side + ", " + positions.length + " fibers, binning " + binning
				+ "]";
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof FiberTemplate)) return false;
		final FiberTemplate other = (FiberTemplate) o;
		return ifuType == other.ifuType && side == other.side && binning == other.binning
				&& Arrays.equals(positions, other.positions);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * (31 * ifuType.hashCode() + side.hashCode()) + binning) + Arrays.hashCode(positions);
	}

}

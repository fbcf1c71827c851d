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

package sc.fiji.apermap;

import java.util.List;

import sc.fiji.apermap.tracing.ApertureMap;
import sc.fiji.apermap.tracing.PeakThresholds;
import sc.fiji.apermap.tracing.TraceCoefficients;

/**
 * The outcome of one {@link ApertureMapMaker} run.
 */
public class ApertureMapResult {

	private final ApertureMap map;
	private final List<TraceCoefficients> traces;
	private final int[] missingIndices;
	private final PeakThresholds thresholds;
	private final int expectedFibers;
	private final int referenceProfile;
	private final double referenceColumn;

	ApertureMapResult(final ApertureMap map, final List<TraceCoefficients> traces, final int[] missingIndices,
			final PeakThresholds thresholds, final int expectedFibers, final int referenceProfile,
			final double referenceColumn) {
		this.map = map;
		this.traces = List.copyOf(traces);
		this.missingIndices = missingIndices;
		this.thresholds = thresholds;
		this.expectedFibers = expectedFibers;
		this.referenceProfile = referenceProfile;
		this.referenceColumn = referenceColumn;
	}

	public ApertureMap getApertureMap() {
		return map;
	}

	/** @return one trace per fiber, in label order */
	public List<TraceCoefficients> getTraces() {
		return traces;
	}

	/** @return the row of every fiber in the reference profile, in label order */
	public double[] getReferencePositions() {
		return traces.stream().mapToDouble(TraceCoefficients::getReferencePosition).toArray();
	}

	/** @see ApertureMap#getMidpointRows() */
	public int[] getMidpointRows() {
		return map.getMidpointRows();
	}

	/** @return the 1-based labels of the fibers that were interpolated */
	public int[] getMissingIndices() {
		return missingIndices.clone();
	}

	public int getApertureHalfWidth() {
		return thresholds.getApertureHalfWidth();
	}

	public PeakThresholds getThresholds() {
		return thresholds;
	}

	public int getNFibers() {
		return traces.size();
	}

	public int getExpectedFibers() {
		return expectedFibers;
	}

	/** @return true if the number of fibers differs from the expected one */
	public boolean isCountMismatch() {
		return traces.size() != expectedFibers;
	}

	public int getReferenceProfile() {
		return referenceProfile;
	}

	/** @return the representative (rectified) column of the reference profile */
	public double getReferenceColumn() {
		return referenceColumn;
	}

	@Override
	public String toString() {
		return "ApertureMapResult[" + traces.size() + "/" + expectedFibers + " fibers, " + missingIndices.length
				+ " interpolated, hw=" + getApertureHalfWidth() + ", reference column "
				+ ApertureUtils.formatDouble(referenceColumn, 1) + "]";
	}

}

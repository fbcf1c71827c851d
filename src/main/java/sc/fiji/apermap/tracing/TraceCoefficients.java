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

import sc.fiji.apermap.util.PolynomialFitter;

/**
 * The fitted trace of one fiber: a power-basis polynomial giving the row of the
 * fiber center at every absolute detector column.
 */
public final class TraceCoefficients {

	private final int label;
	private final double[] coefficients;
	private final double referencePosition;
	private final boolean synthetic;

	/**
	 * @param label             the 1-based fiber label
	 * @param coefficients      {@code c[0] + c[1]*col + ... + c[d]*col^d}
	 * @param referencePosition the row of the fiber in the reference profile
	 * @param synthetic         whether the fiber was interpolated rather than
	 *                          detected
	 */
	public TraceCoefficients(final int label, final double[] coefficients, final double referencePosition,
			final boolean synthetic) {
		this.label = label;
		this.coefficients = coefficients.clone();
		this.referencePosition = referencePosition;
		this.synthetic = synthetic;
	}

	/** @return the row of the trace center at the given column */
	public double rowAt(final double column) {
		return PolynomialFitter.evaluate(coefficients, column);
	}

	/** @return a copy of this trace under another label */
	public TraceCoefficients withLabel(final int newLabel) {
		return (newLabel == label) ? this : new TraceCoefficients(newLabel, coefficients, referencePosition, synthetic);
	}

	public int getLabel() {
		return label;
	}

	public double[] getCoefficients() {
		return coefficients.clone();
	}

	public int getDegree() {
		return coefficients.length - 1;
	}

	public double getReferencePosition() {
		return referencePosition;
	}

	public boolean isSynthetic() {
		return synthetic;
	}

	@Override
	public String toString() {
		return "Trace " + label + (synthetic ? " (synthetic)" : "") + ": " + Arrays.toString(coefficients);
	}

}

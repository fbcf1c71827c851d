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

package sc.fiji.apermap.util;

import java.util.Arrays;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import sc.fiji.apermap.FitException;

/**
 * Static methods for least-squares polynomial fitting.
 * <p>
 * Abscissae are mapped onto [-1, 1] before solving (QR decomposition of the
 * Vandermonde matrix), which keeps high-degree fits over detector-sized ranges
 * well conditioned. Results are returned in the plain power basis,
 * {@code y = c[0] + c[1]*x + ... + c[d]*x^d}.
 * </p>
 */
public class PolynomialFitter {

	/* Pivots of R smaller than this are treated as zero */
	private static final double SINGULARITY_THRESHOLD = 1e-10;

	private PolynomialFitter() {
	}

	/**
	 * Fits a polynomial of the given degree.
	 *
	 * @param x      the abscissae
	 * @param y      the ordinates
	 * @param degree the polynomial degree
	 * @return the {@code degree + 1} power-basis coefficients
	 * @throws FitException if there are fewer distinct abscissae than
	 *                      coefficients, or the system is singular
	 */
	public static double[] fit(final double[] x, final double[] y, final int degree) throws FitException {
		if (x.length != y.length)
			throw new IllegalArgumentException("Mismatched lengths: " + x.length + " vs " + y.length);
		if (degree < 0) throw new IllegalArgumentException("Invalid degree: " + degree);
		final int nDistinct = countDistinct(x);
		if (nDistinct < degree + 1) {
			throw new FitException(
					"Cannot fit degree " + degree + " polynomial to " + nDistinct + " distinct point(s)");
		}

		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : x) {
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		final double shift = (max + min) / 2;
		final double scale = (max > min) ? (max - min) / 2 : 1;

		final double[][] vandermonde = new double[x.length][degree + 1];
		for (int i = 0; i < x.length; i++) {
			final double u = (x[i] - shift) / scale;
			double p = 1;
			for (int j = 0; j <= degree; j++) {
				vandermonde[i][j] = p;
				p *= u;
			}
		}
		final double[] normalized;
		try {
			final DecompositionSolver solver = new QRDecomposition(
					new Array2DRowRealMatrix(vandermonde, false), SINGULARITY_THRESHOLD).getSolver();
			if (!solver.isNonSingular()) throw new FitException("Singular least-squares system (degree " + degree + ")");
			final RealVector solution = solver.solve(new ArrayRealVector(y, false));
			normalized = solution.toArray();
		} catch (final SingularMatrixException e) {
			throw new FitException("Singular least-squares system (degree " + degree + ")", e);
		}
		for (final double c : normalized) {
			if (!Double.isFinite(c)) throw new FitException("Non-finite fit coefficient (degree " + degree + ")");
		}
		return toPowerBasis(normalized, shift, scale);
	}

	/**
	 * Evaluates power-basis coefficients at x (Horner's scheme).
	 */
	public static double evaluate(final double[] coefficients, final double x) {
		double result = 0;
		for (int j = coefficients.length - 1; j >= 0; j--)
			result = result * x + coefficients[j];
		return result;
	}

	/**
	 * Expands {@code sum a[j] * ((x - shift) / scale)^j} into the power basis of x.
	 */
	private static double[] toPowerBasis(final double[] a, final double shift, final double scale) {
		final PolynomialFunction u = new PolynomialFunction(new double[] { -shift / scale, 1 / scale });
		PolynomialFunction acc = new PolynomialFunction(new double[] { a[a.length - 1] });
		for (int j = a.length - 2; j >= 0; j--) {
			acc = acc.multiply(u).add(new PolynomialFunction(new double[] { a[j] }));
		}
		// PolynomialFunction drops trailing zero coefficients
		return Arrays.copyOf(acc.getCoefficients(), a.length);
	}

	private static int countDistinct(final double[] x) {
		final double[] sorted = x.clone();
		Arrays.sort(sorted);
		int count = 0;
		for (int i = 0; i < sorted.length; i++) {
			if (i == 0 || sorted[i] != sorted[i - 1]) count++;
		}
		return count;
	}

}

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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Parabolic model of the spectral curvature on the detector.
 * <p>
 * The expected column offset of row {@code y} is
 * {@code offset(y) = A*(y-B)^2 + C}. The valid spectral span of that row is the
 * half-open column interval {@code [offset(y)+X1, offset(y)+X1+dX)}.
 * </p>
 */
public final class CurvatureModel {

	private final double a;
	private final double b;
	private final double c;
	private final double x1;
	private final double dx;

	/**
	 * @param a  curvature (A)
	 * @param b  row of the parabola vertex (B)
	 * @param c  column offset at the vertex (C)
	 * @param x1 start of the valid span, relative to the curve (X1)
	 * @param dx width of the valid span (dX)
	 */
	public CurvatureModel(final double a, final double b, final double c, final double x1, final double dx) {
		this.a = a;
		this.b = b;
		this.c = c;
		this.x1 = x1;
		this.dx = dx;
	}

	/**
	 * A model without curvature whose span covers the given number of columns.
	 */
	public static CurvatureModel flat(final long nColumns) {
		return new CurvatureModel(0, 0, 0, 0, nColumns);
	}

	public double offset(final double row) {
		return a * (row - b) * (row - b) + c;
	}

	public double spanStart(final double row) {
		return offset(row) + x1;
	}

	public double spanEnd(final double row) {
		return spanStart(row) + dx;
	}

	public boolean isInSpan(final long row, final long column) {
		return column >= spanStart(row) && column < spanEnd(row);
	}

	/**
	 * Returns a copy of the frame in which every pixel outside the valid
	 * spectral span of its row is set to zero.
	 *
	 * @param frame the 2D frame (dimension 0: column, dimension 1: row)
	 * @return the masked copy
	 */
	public <T extends RealType<T>> Img<FloatType> maskOutsideSpan(final RandomAccessibleInterval<T> frame) {
		final RandomAccessibleInterval<T> source = Views.zeroMin(frame);
		final Img<FloatType> masked = ArrayImgs.floats(source.dimension(0), source.dimension(1));
		final Cursor<T> cursor = Views.flatIterable(source).localizingCursor();
		final Cursor<FloatType> out = Views.flatIterable(masked).cursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			out.fwd();
			if (isInSpan(cursor.getLongPosition(1), cursor.getLongPosition(0)))
				out.get().setReal(cursor.get().getRealDouble());
		}
		return masked;
	}

	public double getA() {
		return a;
	}

	public double getB() {
		return b;
	}

	public double getC() {
		return c;
	}

	public double getX1() {
		return x1;
	}

	public double getDX() {
		return dx;
	}

	@Override
	public String toString() {
		return String.format("CurvatureModel[A=%.4e, B=%.1f, C=%.1f, X1=%.1f, dX=%.1f]", a, b, c, x1, dx);
	}

}

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

import java.util.HashSet;
import java.util.Set;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Synthetic trace frames: horizontal Gaussian fiber profiles on a zero
 * background.
 */
public class SyntheticFrames {

	private SyntheticFrames() {}

	/**
	 * @param nColumns  frame width
	 * @param nRows     frame height
	 * @param rows      the center row of every fiber
	 * @param sigma     the Gaussian sigma (rows)
	 * @param amplitude the peak value of every fiber
	 * @return the frame (dimension 0: column, dimension 1: row)
	 */
	public static Img<FloatType> fibers(final int nColumns, final int nRows, final double[] rows,
			final double sigma, final double amplitude) {
		final Img<FloatType> img = ArrayImgs.floats(nColumns, nRows);
		final double[] profile = profile(nRows, rows, sigma, amplitude);
		final Cursor<FloatType> cursor = img.localizingCursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.get().setReal(profile[cursor.getIntPosition(1)]);
		}
		return img;
	}

	/**
	 * @return the sum of Gaussians, sampled at every row
	 */
	public static double[] profile(final int nRows, final double[] rows, final double sigma,
			final double amplitude) {
		final double[] profile = new double[nRows];
		for (int y = 0; y < nRows; y++) {
			for (final double row : rows) {
				final double d = y - row;
				profile[y] += amplitude * Math.exp(-d * d / (2 * sigma * sigma));
			}
		}
		return profile;
	}

	/**
	 * @return {@code count} positions starting at {@code first}, {@code step}
	 *         apart
	 */
	public static double[] evenlySpaced(final double first, final double step, final int count) {
		final double[] positions = new double[count];
		for (int i = 0; i < count; i++)
			positions[i] = first + i * step;
		return positions;
	}

	/**
	 * @return a bundled layout: {@code nBundles} bundles of {@code perBundle}
	 *         fibers, {@code step} apart within a bundle and {@code gap} apart
	 *         between bundles
	 */
	public static double[] bundled(final double first, final int nBundles, final int perBundle, final double step,
			final double gap) {
		final double[] positions = new double[nBundles * perBundle];
		final double bundleLength = (perBundle - 1) * step + gap;
		for (int b = 0; b < nBundles; b++) {
			for (int f = 0; f < perBundle; f++)
				positions[b * perBundle + f] = first + b * bundleLength + f * step;
		}
		return positions;
	}

	/**
	 * @param positions the positions
	 * @param missing   the 1-based indices to drop
	 * @return the positions without the dropped ones
	 */
	public static double[] without(final double[] positions, final int... missing) {
		final Set<Integer> drop = new HashSet<>();
		for (final int m : missing)
			drop.add(m - 1);
		final double[] kept = new double[positions.length - drop.size()];
		int k = 0;
		for (int i = 0; i < positions.length; i++) {
			if (!drop.contains(i)) kept[k++] = positions[i];
		}
		return kept;
	}

}

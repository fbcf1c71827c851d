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

import ij.ImagePlus;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Static utilities for moving frames and aperture maps between
 * {@link ImagePlus} and ImgLib2.
 */
public class ImpUtils {

	private ImpUtils() {} // prevent class instantiation

	/**
	 * Copies the current plane of an image into a float Img (dimension 0:
	 * column, dimension 1: row).
	 *
	 * @param imp the image, of any gray type
	 * @return the frame
	 * @throws IllegalArgumentException if the image is RGB
	 */
	public static Img<FloatType> toFrame(final ImagePlus imp) throws IllegalArgumentException {
		if (imp.getType() == ImagePlus.COLOR_RGB)
			throw new IllegalArgumentException("RGB images are not supported: " + imp.getTitle());
		final ImageProcessor ip = imp.getProcessor();
		final float[] pixels = (float[]) ip.convertToFloatProcessor().getPixels();
		return ArrayImgs.floats(pixels.clone(), ip.getWidth(), ip.getHeight());
	}

	/**
	 * Wraps an integer label image as an ImagePlus: 16-bit when labels fit,
	 * 32-bit otherwise.
	 *
	 * @param labels the label image (dimension 0: column, dimension 1: row)
	 * @param title  the image title
	 * @return the image
	 */
	public static <T extends IntegerType<T>> ImagePlus toImagePlus(final RandomAccessibleInterval<T> labels,
			final String title) {
		final int width = (int) labels.dimension(0);
		final int height = (int) labels.dimension(1);
		final float[] values = new float[width * height];
		long max = 0;
		final Cursor<T> cursor = Views.flatIterable(Views.zeroMin(labels)).cursor();
		int i = 0;
		while (cursor.hasNext()) {
			final long v = cursor.next().getIntegerLong();
			values[i++] = v;
			max = Math.max(max, v);
		}
		final ImageProcessor ip;
		if (max <= 65535) {
			final short[] shorts = new short[values.length];
			for (int j = 0; j < values.length; j++)
				shorts[j] = (short) values[j];
			ip = new ShortProcessor(width, height, shorts, null);
		} else {
			ip = new FloatProcessor(width, height, values);
		}
		ip.resetMinAndMax();
		return new ImagePlus(title, ip);
	}

}

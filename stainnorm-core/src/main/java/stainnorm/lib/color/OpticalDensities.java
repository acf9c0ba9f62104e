/*-
 * #%L
 * This file is part of stainnorm.
 * %%
 * Copyright (C) 2024 stainnorm developers
 * %%
 * stainnorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * stainnorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with stainnorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.lib.color;

import java.util.Objects;

import stainnorm.lib.images.ByteImage;

/**
 * Static methods to convert 8-bit transmitted light intensities to optical densities.
 * <p>
 * Optical densities use the natural logarithm, i.e. {@code -ln(val/max)}. 
 * A value of 0 is treated as 1 to avoid infinite densities; this happens during conversion, 
 * so pixel buffers are never modified.
 */
public final class OpticalDensities {

	private OpticalDensities() {
		throw new AssertionError();
	}

	/**
	 * Convert a single pixel value to an optical density as {@code -ln(val/max)}, where {@code val} is clipped to be &gt;= 1.
	 * <p>
	 * Values greater than {@code max} give negative optical densities.
	 * 
	 * @param val
	 * @param max
	 * @return
	 */
	public static double makeOD(double val, double max) {
		return -Math.log(Math.max(val, 1) / max);
	}

	/**
	 * Create an optical density lookup table with 256 entries, normalizing to the specified background value.
	 * @param maxValue background (white) value
	 * @return
	 * 
	 * @see #makeOD(double, double)
	 */
	public static double[] makeODLUT(double maxValue) {
		double[] odLUT = new double[256];
		for (int i = 0; i < odLUT.length; i++)
			odLUT[i] = makeOD(i, maxValue);
		return odLUT;
	}

	/**
	 * Compute optical densities for all pixels of a 3-channel image.
	 * 
	 * @param img the input image
	 * @param io background (white) value
	 * @return an array with shape 3 x nPixels, i.e. one row per channel
	 * @throws InvalidImageShapeException if the image does not have 3 channels
	 */
	public static double[][] computeOpticalDensities(ByteImage img, double io) throws InvalidImageShapeException {
		Objects.requireNonNull(img, "Image must not be null");
		checkRGB(img);
		double[] odLUT = makeODLUT(io);
		int n = img.getPixelCount();
		double[][] od = new double[3][n];
		for (int i = 0; i < n; i++) {
			od[0][i] = odLUT[img.getValue(i, 0)];
			od[1][i] = odLUT[img.getValue(i, 1)];
			od[2][i] = odLUT[img.getValue(i, 2)];
		}
		return od;
	}

	/**
	 * Extract the pixels with an optical density above a threshold in any channel.
	 * 
	 * @param od optical densities, with shape 3 x nPixels
	 * @param threshold
	 * @return an array with shape nForeground x 3, i.e. one row per foreground pixel
	 */
	public static double[][] extractForeground(double[][] od, double threshold) {
		Objects.requireNonNull(od, "Optical densities must not be null");
		int n = od[0].length;
		int count = 0;
		for (int i = 0; i < n; i++) {
			if (isForeground(od, i, threshold))
				count++;
		}
		double[][] foreground = new double[count][];
		int ind = 0;
		for (int i = 0; i < n; i++) {
			if (isForeground(od, i, threshold))
				foreground[ind++] = new double[]{od[0][i], od[1][i], od[2][i]};
		}
		return foreground;
	}

	private static boolean isForeground(double[][] od, int i, double threshold) {
		return od[0][i] > threshold || od[1][i] > threshold || od[2][i] > threshold;
	}

	/**
	 * Check that an image has 3 channels.
	 * @param img
	 * @throws InvalidImageShapeException if the image does not have 3 channels
	 */
	public static void checkRGB(ByteImage img) throws InvalidImageShapeException {
		if (img.getChannelCount() != 3)
			throw new InvalidImageShapeException("Stain normalization requires 3 channels, but image has " + img.getChannelCount());
	}

}

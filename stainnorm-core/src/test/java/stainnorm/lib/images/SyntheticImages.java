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

package stainnorm.lib.images;

import java.util.Arrays;

/**
 * Helpers to create small synthetic brightfield images with known stains.
 */
public class SyntheticImages {

	/**
	 * Hematoxylin, from Ruifrok &amp; Johnston's original paper.
	 */
	public static final double[] HEMATOXYLIN = {0.65, 0.70, 0.29};

	/**
	 * Eosin, from Ruifrok &amp; Johnston's original paper.
	 */
	public static final double[] EOSIN = {0.07, 0.99, 0.11};

	/**
	 * A 'hematoxylin-like' stain with a different hue.
	 */
	public static final double[] TARGET_STAIN_1 = {0.49, 0.77, 0.41};

	/**
	 * An 'eosin-like' stain with a different hue.
	 */
	public static final double[] TARGET_STAIN_2 = {0.20, 0.80, 0.56};

	/**
	 * Create an image where each pixel contains a mixture of two stains, using the Beer-Lambert law 
	 * with a background of 255.
	 * 
	 * @param width
	 * @param height
	 * @param stain1 first stain vector (normalized internally)
	 * @param stain2 second stain vector (normalized internally)
	 * @param concentrations one row per pixel, containing the concentrations of stain 1 and stain 2
	 * @return
	 */
	public static ByteImage createTwoStainImage(int width, int height, double[] stain1, double[] stain2, double[][] concentrations) {
		double[] s1 = normalize(stain1);
		double[] s2 = normalize(stain2);
		byte[] pixels = new byte[width * height * 3];
		for (int i = 0; i < width * height; i++) {
			double c1 = concentrations[i][0];
			double c2 = concentrations[i][1];
			for (int c = 0; c < 3; c++) {
				double val = Math.round(255 * Math.exp(-(c1*s1[c] + c2*s2[c])));
				pixels[i*3 + c] = (byte)Math.max(0, Math.min(255, val));
			}
		}
		return ByteImage.create(width, height, 3, pixels);
	}

	/**
	 * Create a 4x4 image with two blocks: the first 8 pixels contain only stain 1, 
	 * the last 8 only stain 2, with concentrations increasing linearly within each block.
	 * 
	 * @param stain1
	 * @param stain2
	 * @param start1 concentration of the first pixel of stain 1
	 * @param step1 concentration increment for stain 1
	 * @param start2 concentration of the first pixel of stain 2
	 * @param step2 concentration increment for stain 2
	 * @return
	 */
	public static ByteImage createTwoBlockImage(double[] stain1, double[] stain2, double start1, double step1, double start2, double step2) {
		double[][] concentrations = new double[16][2];
		for (int i = 0; i < 8; i++) {
			concentrations[i][0] = start1 + step1 * i;
			concentrations[i+8][1] = start2 + step2 * i;
		}
		return createTwoStainImage(4, 4, stain1, stain2, concentrations);
	}

	/**
	 * Create a larger image containing a mixture of two stains in varying proportions, 
	 * together with some background pixels.
	 * 
	 * @param width
	 * @param height
	 * @param stain1
	 * @param stain2
	 * @return
	 */
	public static ByteImage createMixedImage(int width, int height, double[] stain1, double[] stain2) {
		double[][] concentrations = new double[width * height][2];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int i = y * width + x;
				// Leave a strip of background along the top
				if (y == 0)
					continue;
				double c1 = 0.2 + 0.8 * x / (double)width;
				double c2 = 0.1 + 0.6 * y / (double)height;
				if ((x + y) % 3 == 0)
					c2 = 0;
				else if ((x + y) % 3 == 1)
					c1 = 0;
				concentrations[i][0] = c1;
				concentrations[i][1] = c2;
			}
		}
		return createTwoStainImage(width, height, stain1, stain2, concentrations);
	}

	/**
	 * Create an image where every sample has the same value.
	 * @param width
	 * @param height
	 * @param nChannels
	 * @param value
	 * @return
	 */
	public static ByteImage createUniformImage(int width, int height, int nChannels, int value) {
		byte[] pixels = new byte[width * height * nChannels];
		Arrays.fill(pixels, (byte)value);
		return ByteImage.create(width, height, nChannels, pixels);
	}

	/**
	 * Normalize a vector to unit length.
	 * @param v
	 * @return
	 */
	public static double[] normalize(double[] v) {
		double len = Math.sqrt(v[0]*v[0] + v[1]*v[1] + v[2]*v[2]);
		return new double[] {v[0]/len, v[1]/len, v[2]/len};
	}

}

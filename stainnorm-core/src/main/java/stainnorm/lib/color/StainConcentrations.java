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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.stats.LinearAlgebraTools;
import stainnorm.lib.common.ColorTools;
import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.images.ByteImage;

/**
 * Static methods for color deconvolution into stain concentrations, and 'reconvolution' 
 * of concentrations into an RGB image.
 */
public final class StainConcentrations {

	private static final Logger logger = LoggerFactory.getLogger(StainConcentrations.class);

	private StainConcentrations() {
		throw new AssertionError();
	}

	/**
	 * Compute stain concentrations by solving {@code stains * C = od} in the least squares sense.
	 * Concentrations are not constrained, and so may be negative.
	 * 
	 * @param od optical densities, with shape 3 x nPixels
	 * @param stains stain matrix used for deconvolution
	 * @return concentrations, with shape 3 x nPixels
	 */
	public static double[][] deconvolve(double[][] od, StainMatrix stains) {
		Objects.requireNonNull(od, "Optical densities must not be null");
		Objects.requireNonNull(stains, "Stains must not be null");
		return LinearAlgebraTools.leastSquares(stains.getMatrix(), od);
	}

	/**
	 * Compute the robust maximum (99th percentile) of each concentration channel.
	 * The value for the residual channel is always 1, because it does not represent a real stain.
	 * 
	 * @param concentrations concentrations, with shape 3 x nPixels
	 * @return an array of length 3
	 */
	public static double[] maxConcentrations(double[][] concentrations) {
		Objects.requireNonNull(concentrations, "Concentrations must not be null");
		return new double[] {
				LinearAlgebraTools.percentile(concentrations[0], MacenkoParameters.MAX_CONCENTRATION_PERCENTILE),
				LinearAlgebraTools.percentile(concentrations[1], MacenkoParameters.MAX_CONCENTRATION_PERCENTILE),
				1.0
		};
	}

	/**
	 * Rescale concentrations in-place so that their maxima match target maxima.
	 * 
	 * @param concentrations concentrations, with shape 3 x nPixels; these are modified
	 * @param maxSource maximum concentrations of the source
	 * @param maxTarget maximum concentrations of the target
	 * @throws DegenerateStainEstimationException if any source maximum is not a finite positive value
	 */
	public static void rescaleConcentrations(double[][] concentrations, double[] maxSource, double[] maxTarget) {
		for (int c = 0; c < concentrations.length; c++) {
			if (!GeneralTools.isPositiveFinite(maxSource[c]))
				throw new DegenerateStainEstimationException(
						"Cannot rescale stain " + (c+1) + " - maximum concentration is " + maxSource[c]);
			double scale = maxTarget[c] / maxSource[c];
			logger.debug("Scaling stain {} concentrations by {}", c+1, scale);
			double[] row = concentrations[c];
			for (int i = 0; i < row.length; i++)
				row[i] *= scale;
		}
	}

	/**
	 * Create an 8-bit RGB image from stain concentrations, using {@code io * exp(-stains * C)}.
	 * Values are clipped to 0-255 and rounded down.
	 * 
	 * @param concentrations concentrations, with shape 3 x (width * height)
	 * @param stains stain matrix used for reconvolution
	 * @param io background (white) value
	 * @param width output width
	 * @param height output height
	 * @return
	 */
	public static ByteImage reconvolve(double[][] concentrations, StainMatrix stains, double io, int width, int height) {
		Objects.requireNonNull(concentrations, "Concentrations must not be null");
		Objects.requireNonNull(stains, "Stains must not be null");
		int n = width * height;
		if (concentrations.length != 3 || concentrations[0].length != n)
			throw new IllegalArgumentException("Concentrations must have shape 3x" + n);

		double[][] mat = stains.getMatrix().getData();
		double[] c1 = concentrations[0];
		double[] c2 = concentrations[1];
		double[] c3 = concentrations[2];
		byte[] pixels = new byte[n * 3];
		int ind = 0;
		for (int i = 0; i < n; i++) {
			for (int c = 0; c < 3; c++) {
				double[] row = mat[c];
				double od = row[0]*c1[i] + row[1]*c2[i] + row[2]*c3[i];
				pixels[ind++] = (byte)ColorTools.do8BitRangeCheck(io * Math.exp(-od));
			}
		}
		return ByteImage.create(width, height, 3, pixels);
	}

}

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

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.algorithms.EstimateStainMatrix;
import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.images.ByteImage;
import stainnorm.lib.io.GsonTools;

/**
 * Stain characteristics of a reference image, used as the target of stain normalization.
 * <p>
 * This stores the target's stain matrix and the robust maximum concentration of each stain,  
 * so that these only need to be computed once when normalizing many images to the same target.
 * Instances are immutable.
 */
public final class MacenkoTarget {

	private static final Logger logger = LoggerFactory.getLogger(MacenkoTarget.class);

	private final StainMatrix stains;
	private final double[] maxConcentrations;

	private MacenkoTarget(StainMatrix stains, double[] maxConcentrations) {
		this.stains = stains;
		this.maxConcentrations = maxConcentrations;
	}

	/**
	 * Create a target directly from a stain matrix and maximum concentrations.
	 * 
	 * @param stains the target stain matrix
	 * @param maxConcentrations maximum concentration for each stain (length 3); the third value is always treated as 1
	 * @return
	 * @throws InvalidNormalizationParameterException if a stain value is not finite, or either stain maximum is not a positive finite number
	 */
	public static MacenkoTarget create(StainMatrix stains, double[] maxConcentrations) {
		Objects.requireNonNull(stains, "Stains must not be null");
		Objects.requireNonNull(maxConcentrations, "Max concentrations must not be null");
		if (maxConcentrations.length != 3)
			throw new IllegalArgumentException("Expected 3 max concentrations, but got " + maxConcentrations.length);
		for (int i = 1; i <= 3; i++) {
			for (double v : stains.getStain(i).getArray()) {
				if (!Double.isFinite(v))
					throw new InvalidNormalizationParameterException("Target stain vectors must be finite, but got " + stains.getStain(i));
			}
		}
		for (int i = 0; i < 2; i++) {
			if (!GeneralTools.isPositiveFinite(maxConcentrations[i]))
				throw new InvalidNormalizationParameterException("Target max concentration " + (i+1) + " must be a positive finite number, but got " + maxConcentrations[i]);
		}
		return new MacenkoTarget(stains, new double[] {maxConcentrations[0], maxConcentrations[1], 1.0});
	}

	/**
	 * Compute the target characteristics from a reference image.
	 * 
	 * @param img the reference image; this is not modified
	 * @param params
	 * @return
	 * @throws InvalidImageShapeException if the image does not have 3 channels
	 * @throws DegenerateStainEstimationException if stains or stain concentrations cannot be estimated from the image
	 */
	public static MacenkoTarget fromImage(ByteImage img, MacenkoParameters params) {
		Objects.requireNonNull(img, "Target image must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		OpticalDensities.checkRGB(img);
		double[][] od = OpticalDensities.computeOpticalDensities(img, params.getIo());
		StainMatrix stains = EstimateStainMatrix.estimateStainMatrix(od, params);
		double[] maxConcentrations = StainConcentrations.maxConcentrations(StainConcentrations.deconvolve(od, stains));
		logger.debug("Target max concentrations: {}", maxConcentrations);
		for (int i = 0; i < 2; i++) {
			if (!GeneralTools.isPositiveFinite(maxConcentrations[i]))
				throw new DegenerateStainEstimationException("Target max concentration for " + stains.getStain(i+1).getName() 
						+ " must be a positive finite number, but got " + maxConcentrations[i]);
		}
		return new MacenkoTarget(stains, maxConcentrations);
	}

	/**
	 * Read a target from its JSON representation.
	 * @param json
	 * @return
	 * @see #toJson()
	 */
	public static MacenkoTarget fromJson(String json) {
		Objects.requireNonNull(json, "JSON must not be null");
		return GsonTools.getInstance().fromJson(json, MacenkoTarget.class);
	}

	/**
	 * Get a JSON representation of this target.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance().toJson(this);
	}

	/**
	 * Get the target stain matrix.
	 * @return
	 */
	public StainMatrix getStains() {
		return stains;
	}

	/**
	 * Get the maximum concentration of each stain; the third (residual) value is 1.
	 * @return
	 */
	public double[] getMaxConcentrations() {
		return maxConcentrations.clone();
	}

	@Override
	public String toString() {
		return "MacenkoTarget [" + stains + ", max concentrations=" + Arrays.toString(maxConcentrations) + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(stains, Arrays.hashCode(maxConcentrations));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MacenkoTarget))
			return false;
		MacenkoTarget other = (MacenkoTarget)obj;
		return stains.equals(other.stains) && Arrays.equals(maxConcentrations, other.maxConcentrations);
	}

}

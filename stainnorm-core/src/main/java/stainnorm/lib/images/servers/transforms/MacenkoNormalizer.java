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

package stainnorm.lib.images.servers.transforms;

import java.awt.image.BufferedImage;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.algorithms.EstimateStainMatrix;
import stainnorm.lib.awt.common.BufferedImageTools;
import stainnorm.lib.color.DegenerateStainEstimationException;
import stainnorm.lib.color.InvalidImageShapeException;
import stainnorm.lib.color.MacenkoParameters;
import stainnorm.lib.color.MacenkoTarget;
import stainnorm.lib.color.OpticalDensities;
import stainnorm.lib.color.StainConcentrations;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.images.ByteImage;

/**
 * Normalizes the stain appearance of an image to match a target, using the method of
 * <p>
 * M. Macenko et al., 'A method for normalizing histology slides for quantitative analysis', 
 * in 2009 IEEE International Symposium on Biomedical Imaging: From Nano to Macro, 2009, pp. 1107-1110.
 * <p>
 * Stain vectors are estimated from the input image and used to deconvolve it into stain concentrations. 
 * These are optionally rescaled to match the concentration range of the target, and then 'reconvolved' 
 * using the target's stain vectors.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class MacenkoNormalizer implements BufferedImageNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(MacenkoNormalizer.class);

	private final MacenkoTarget target;
	private final MacenkoParameters params;

	private MacenkoNormalizer(MacenkoTarget target, MacenkoParameters params) {
		this.target = target;
		this.params = params;
	}

	/**
	 * Create a normalizer for a precomputed target.
	 * @param target stain characteristics to normalize towards
	 * @param params parameters used when estimating the stains of each input image
	 * @return
	 */
	public static MacenkoNormalizer create(MacenkoTarget target, MacenkoParameters params) {
		Objects.requireNonNull(target, "Target must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		return new MacenkoNormalizer(target, params);
	}

	/**
	 * Create a normalizer for a target image.
	 * The target stains are estimated once, and reused for every call to {@link #normalize(ByteImage)}.
	 * 
	 * @param targetImage reference image with the desired stain appearance
	 * @param params
	 * @return
	 * @throws InvalidImageShapeException if the target image does not have 3 channels
	 * @throws DegenerateStainEstimationException if stains cannot be estimated from the target image
	 */
	public static MacenkoNormalizer create(ByteImage targetImage, MacenkoParameters params) {
		return create(MacenkoTarget.fromImage(targetImage, params), params);
	}

	/**
	 * Normalize a patch to a target image, using default parameters.
	 * 
	 * @param patch
	 * @param targetImage
	 * @return
	 * @see #normalize(ByteImage, ByteImage, MacenkoParameters)
	 */
	public static ByteImage normalize(ByteImage patch, ByteImage targetImage) {
		return normalize(patch, targetImage, MacenkoParameters.getDefault());
	}

	/**
	 * Normalize a patch to a target image.
	 * 
	 * @param patch the image to normalize; this is not modified
	 * @param targetImage reference image with the desired stain appearance; this is not modified
	 * @param params
	 * @return a new image with the same dimensions as the patch
	 * @throws InvalidImageShapeException if either image does not have 3 channels
	 * @throws DegenerateStainEstimationException if stains cannot be estimated from either image
	 */
	public static ByteImage normalize(ByteImage patch, ByteImage targetImage, MacenkoParameters params) {
		Objects.requireNonNull(patch, "Patch must not be null");
		Objects.requireNonNull(targetImage, "Target image must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		// Check both shapes before doing any work
		OpticalDensities.checkRGB(patch);
		OpticalDensities.checkRGB(targetImage);
		return create(targetImage, params).normalize(patch);
	}

	/**
	 * Get the target used by this normalizer.
	 * @return
	 */
	public MacenkoTarget getTarget() {
		return target;
	}

	/**
	 * Get the parameters used by this normalizer.
	 * @return
	 */
	public MacenkoParameters getParameters() {
		return params;
	}

	/**
	 * Normalize a patch to the target of this normalizer.
	 * 
	 * @param patch the image to normalize; this is not modified
	 * @return a new image with the same dimensions as the patch
	 * @throws InvalidImageShapeException if the patch does not have 3 channels
	 * @throws DegenerateStainEstimationException if stains cannot be estimated from the patch
	 */
	public ByteImage normalize(ByteImage patch) {
		Objects.requireNonNull(patch, "Patch must not be null");
		OpticalDensities.checkRGB(patch);

		double[][] od = OpticalDensities.computeOpticalDensities(patch, params.getIo());
		StainMatrix stains = EstimateStainMatrix.estimateStainMatrix(od, params);
		double[][] concentrations = StainConcentrations.deconvolve(od, stains);

		if (params.doIntensityNorm()) {
			double[] maxSource = StainConcentrations.maxConcentrations(concentrations);
			StainConcentrations.rescaleConcentrations(concentrations, maxSource, target.getMaxConcentrations());
		}

		logger.trace("Normalizing {} with {}", patch, stains);
		return StainConcentrations.reconvolve(concentrations, target.getStains(), params.getIo(), patch.getWidth(), patch.getHeight());
	}

	@Override
	public BufferedImage filter(BufferedImage img, BufferedImage output) {
		if (output == null)
			output = createCompatibleDestImage(img, null);

		if (!BufferedImageTools.is8bitColorType(img.getType()) || !BufferedImageTools.is8bitColorType(output.getType()))
			throw new IllegalArgumentException("Macenko normalizer only supports 8-bit RGB inputs and outputs");

		ByteImage result = normalize(BufferedImageTools.toByteImage(img));
		return BufferedImageTools.toBufferedImage(result, output);
	}

	@Override
	public String toString() {
		return "MacenkoNormalizer [" + target + ", " + params + "]";
	}

}

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

package stainnorm.lib.analysis.algorithms;

import java.util.Objects;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import stainnorm.lib.analysis.stats.LinearAlgebraTools;
import stainnorm.lib.analysis.stats.LinearAlgebraTools.SymmetricEigen;
import stainnorm.lib.color.DegenerateStainEstimationException;
import stainnorm.lib.color.MacenkoParameters;
import stainnorm.lib.color.OpticalDensities;
import stainnorm.lib.color.StainMatrix;
import stainnorm.lib.common.GeneralTools;
import stainnorm.lib.images.ByteImage;

/**
 * Estimate a stain matrix automatically from an image, using the method described in
 * <p>
 * M. Macenko et al., 'A method for normalizing histology slides for quantitative analysis', 
 * in 2009 IEEE International Symposium on Biomedical Imaging: From Nano to Macro, 2009, pp. 1107-1110.
 * <p>
 * Foreground optical densities are projected onto the plane defined by the two largest eigenvectors 
 * of their covariance matrix. Stain vectors are found from robust extremes (percentiles) of the angles 
 * within that plane, and a third residual vector is computed from their cross product.
 */
public final class EstimateStainMatrix {

	private static final Logger logger = LoggerFactory.getLogger(EstimateStainMatrix.class);

	/**
	 * Eigenvalues at or below this are treated as zero.
	 */
	private static final double EIGENVALUE_TOLERANCE = 1e-12;

	/**
	 * Minimum ratio of the second largest eigenvalue to the largest, below which the second eigenvector is unreliable.
	 */
	private static final double EIGENVALUE_RATIO_TOLERANCE = 1e-10;

	/**
	 * Maximum relative distance of the mean optical density from a line for it to be treated as on the line.
	 */
	private static final double COLLINEAR_TOLERANCE = 1e-8;

	private EstimateStainMatrix() {
		throw new AssertionError();
	}

	/**
	 * Estimate a stain matrix from a 3-channel image.
	 * 
	 * @param img the image; this is not modified
	 * @param params
	 * @return a stain matrix with unit length columns
	 * @throws stainnorm.lib.color.InvalidImageShapeException if the image does not have 3 channels
	 * @throws DegenerateStainEstimationException if the foreground pixels are insufficient to estimate two stains
	 */
	public static StainMatrix estimateStainMatrix(ByteImage img, MacenkoParameters params) {
		Objects.requireNonNull(img, "Image must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		OpticalDensities.checkRGB(img);
		double[][] od = OpticalDensities.computeOpticalDensities(img, params.getIo());
		return estimateStainMatrix(od, params);
	}

	/**
	 * Estimate a stain matrix from optical densities.
	 * 
	 * @param od optical densities, with shape 3 x nPixels; this is not modified
	 * @param params
	 * @return a stain matrix with unit length columns
	 * @throws DegenerateStainEstimationException if the foreground pixels are insufficient to estimate two stains
	 */
	public static StainMatrix estimateStainMatrix(double[][] od, MacenkoParameters params) {
		Objects.requireNonNull(od, "Optical densities must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		if (od.length != 3)
			throw new IllegalArgumentException("Expected optical densities for 3 channels, but got " + od.length);

		double[][] foreground = OpticalDensities.extractForeground(od, params.getBeta());
		int n = foreground.length;
		logger.debug("{} of {} pixels have optical density > {}", n, od[0].length, params.getBeta());
		if (n < 2)
			throw new DegenerateStainEstimationException(
					"Not enough foreground pixels to estimate stains (found " + n + " with optical density > " + params.getBeta() + ")");

		RealMatrix cov = LinearAlgebraTools.covariance(foreground);
		logger.debug("Covariance matrix:\n {}", GeneralTools.matrixToString(cov.getData()));

		SymmetricEigen eigen = LinearAlgebraTools.eigenSymmetric(cov);
		double lambda1 = eigen.getEigenvalue(2);
		double lambda2 = eigen.getEigenvalue(1);
		if (!(lambda1 > EIGENVALUE_TOLERANCE))
			throw new DegenerateStainEstimationException(
					"Foreground optical densities do not vary (largest eigenvalue " + lambda1 + ")");

		double[] eigen1 = eigen.getEigenvector(2);
		double[] eigen2 = eigen.getEigenvector(1);
		if (!(lambda2 > lambda1 * EIGENVALUE_RATIO_TOLERANCE)) {
			// Samples vary along one direction only (e.g. two uniform colors), so the second eigenvector 
			// is arbitrary - use the plane through the origin that contains all the samples instead
			logger.debug("Second eigenvalue {} is negligible, using the foreground mean to define the second axis", lambda2);
			eigen2 = orthogonalMeanDirection(foreground, eigen1);
		}

		// Eigenvector signs are arbitrary - fix them so the first component is non-negative
		eigen1 = flipToPositiveFirst(eigen1);
		eigen2 = flipToPositiveFirst(eigen2);
		logger.debug("First eigenvector: {}", eigen1);
		logger.debug("Second eigenvector: {}", eigen2);

		double[] phi = new double[n];
		for (int i = 0; i < n; i++) {
			double[] v = foreground[i];
			phi[i] = Math.atan2(
					v[0]*eigen2[0] + v[1]*eigen2[1] + v[2]*eigen2[2],
					v[0]*eigen1[0] + v[1]*eigen1[1] + v[2]*eigen1[2]);
		}

		double minPhi = LinearAlgebraTools.percentile(phi, params.getAlpha());
		double maxPhi = LinearAlgebraTools.percentile(phi, 100 - params.getAlpha());
		logger.debug("Angle percentiles: {} (min), {} (max)", minPhi, maxPhi);

		double[] v1 = fromAngle(eigen1, eigen2, minPhi);
		double[] v2 = fromAngle(eigen1, eigen2, maxPhi);
		double[] v3 = LinearAlgebraTools.cross3(v1, v2);

		// Two stains can't be distinguished by angle alone; order by the red component
		RealMatrix he = MatrixUtils.createRealMatrix(3, 3);
		if (v1[0] > v2[0]) {
			he.setColumn(0, v1);
			he.setColumn(1, v2);
		} else {
			he.setColumn(0, v2);
			he.setColumn(1, v1);
		}
		he.setColumn(2, v3);

		he = LinearAlgebraTools.normalizeColumns(he);
		checkFinite(he);
		
		StainMatrix stains = StainMatrix.fromColumns(he);
		logger.debug("Estimated {}", stains);
		return stains;
	}

	/**
	 * Get the unit vector along the component of the mean optical density that is orthogonal to the 
	 * specified (unit) direction.
	 * @throws DegenerateStainEstimationException if all samples lie along a single line through the origin
	 */
	private static double[] orthogonalMeanDirection(double[][] foreground, double[] direction) {
		double[] mean = new double[3];
		for (double[] v : foreground) {
			for (int c = 0; c < 3; c++)
				mean[c] += v[c] / foreground.length;
		}
		double dot = mean[0]*direction[0] + mean[1]*direction[1] + mean[2]*direction[2];
		double[] residual = new double[3];
		double residualLength = 0;
		double meanLength = 0;
		for (int c = 0; c < 3; c++) {
			residual[c] = mean[c] - dot * direction[c];
			residualLength += residual[c] * residual[c];
			meanLength += mean[c] * mean[c];
		}
		residualLength = Math.sqrt(residualLength);
		meanLength = Math.sqrt(meanLength);
		if (!(residualLength > meanLength * COLLINEAR_TOLERANCE))
			throw new DegenerateStainEstimationException("Foreground optical densities lie along a single direction, so only one stain can be estimated");
		for (int c = 0; c < 3; c++)
			residual[c] /= residualLength;
		return residual;
	}

	private static double[] flipToPositiveFirst(double[] v) {
		if (v[0] < 0) {
			for (int i = 0; i < v.length; i++)
				v[i] = -v[i];
		}
		return v;
	}

	private static double[] fromAngle(double[] eigen1, double[] eigen2, double phi) {
		double cos = Math.cos(phi);
		double sin = Math.sin(phi);
		return new double[] {
				eigen1[0]*cos + eigen2[0]*sin,
				eigen1[1]*cos + eigen2[1]*sin,
				eigen1[2]*cos + eigen2[2]*sin
		};
	}

	private static void checkFinite(RealMatrix mat) {
		for (double[] row : mat.getData()) {
			for (double v : row) {
				if (!Double.isFinite(v))
					throw new DegenerateStainEstimationException("Estimated stain matrix contains non-finite values:\n" + GeneralTools.matrixToString(mat.getData()));
			}
		}
	}

}

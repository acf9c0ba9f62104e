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

package stainnorm.lib.analysis.stats;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import stainnorm.lib.color.ZeroColumnNormalizationException;

/**
 * Small set of dense linear algebra and statistics operations needed for stain estimation.
 * <p>
 * These are thin wrappers around Apache Commons Math, chosen so that conventions 
 * (eigenvalue order, percentile interpolation, covariance normalization) are explicit and fixed.
 */
public final class LinearAlgebraTools {

	private LinearAlgebraTools() {
		throw new AssertionError();
	}

	/**
	 * Result of a symmetric eigen-decomposition, with eigenvalues sorted in ascending order.
	 */
	public static final class SymmetricEigen {

		private final double[] eigenvalues;
		private final RealMatrix eigenvectors;

		private SymmetricEigen(double[] eigenvalues, RealMatrix eigenvectors) {
			this.eigenvalues = eigenvalues;
			this.eigenvectors = eigenvectors;
		}

		/**
		 * Eigenvalues, in ascending order.
		 * @return
		 */
		public double[] getEigenvalues() {
			return eigenvalues.clone();
		}

		/**
		 * Eigenvalue at the specified index, where index 0 is the smallest.
		 * @param ind
		 * @return
		 */
		public double getEigenvalue(int ind) {
			return eigenvalues[ind];
		}

		/**
		 * Eigenvector at the specified index, where index 0 corresponds to the smallest eigenvalue.
		 * @param ind
		 * @return
		 */
		public double[] getEigenvector(int ind) {
			return eigenvectors.getColumn(ind);
		}

	}

	/**
	 * Rescale each column of a matrix to have unit Euclidean length.
	 * 
	 * @param matrix input matrix; this is not modified
	 * @return a new matrix with the same shape as the input
	 * @throws ZeroColumnNormalizationException if any column has zero (or non-finite) length
	 */
	public static RealMatrix normalizeColumns(RealMatrix matrix) throws ZeroColumnNormalizationException {
		Objects.requireNonNull(matrix, "Matrix must not be null");
		RealMatrix result = matrix.copy();
		for (int c = 0; c < result.getColumnDimension(); c++) {
			double norm = result.getColumnVector(c).getNorm();
			if (!(norm > 0) || !Double.isFinite(norm))
				throw new ZeroColumnNormalizationException(c);
			result.setColumnVector(c, result.getColumnVector(c).mapDivide(norm));
		}
		return result;
	}

	/**
	 * Compute the eigen-decomposition of a real symmetric matrix.
	 * <p>
	 * The eigenvalues are explicitly sorted in ascending order, regardless of the order used 
	 * by the underlying implementation.
	 * 
	 * @param matrix a square, symmetric matrix
	 * @return
	 */
	public static SymmetricEigen eigenSymmetric(RealMatrix matrix) {
		Objects.requireNonNull(matrix, "Matrix must not be null");
		if (!matrix.isSquare())
			throw new IllegalArgumentException("Eigen-decomposition requires a square matrix, but got " 
					+ matrix.getRowDimension() + "x" + matrix.getColumnDimension());
		
		EigenDecomposition eigen = new EigenDecomposition(matrix);
		double[] values = eigen.getRealEigenvalues();
		int[] order = rank(values);
		
		int n = values.length;
		double[] sortedValues = new double[n];
		RealMatrix vectors = MatrixUtils.createRealMatrix(matrix.getRowDimension(), n);
		for (int i = 0; i < n; i++) {
			sortedValues[i] = values[order[i]];
			vectors.setColumn(i, eigen.getEigenvector(order[i]).toArray());
		}
		return new SymmetricEigen(sortedValues, vectors);
	}

	/**
	 * Solve the least squares problem {@code A X = B} for X.
	 * <p>
	 * The solution is computed using the pseudo-inverse of A, and so gives the minimum norm 
	 * solution if A is rank-deficient.
	 * 
	 * @param a matrix A, with shape m x n
	 * @param b matrix B, with shape m x k
	 * @return matrix X, with shape n x k
	 */
	public static RealMatrix leastSquares(RealMatrix a, RealMatrix b) {
		Objects.requireNonNull(a, "Matrix A must not be null");
		Objects.requireNonNull(b, "Matrix B must not be null");
		return new SingularValueDecomposition(a).getSolver().solve(b);
	}

	/**
	 * Solve the least squares problem {@code A X = B} for X, where B is provided as a 2D array 
	 * with one row per row of A.
	 * <p>
	 * This avoids creating a large {@link RealMatrix} when B has many columns (e.g. one per pixel).
	 * 
	 * @param a matrix A, with shape m x n
	 * @param b array B, with shape m x k
	 * @return array X, with shape n x k
	 * @see #leastSquares(RealMatrix, RealMatrix)
	 */
	public static double[][] leastSquares(RealMatrix a, double[][] b) {
		Objects.requireNonNull(a, "Matrix A must not be null");
		Objects.requireNonNull(b, "Array B must not be null");
		int m = a.getRowDimension();
		if (b.length != m)
			throw new IllegalArgumentException("Expected " + m + " rows in B, but got " + b.length);
		
		double[][] pinv = new SingularValueDecomposition(a).getSolver().getInverse().getData();
		int n = pinv.length;
		int k = m == 0 ? 0 : b[0].length;
		double[][] x = new double[n][k];
		for (int i = 0; i < n; i++) {
			double[] row = x[i];
			for (int j = 0; j < m; j++) {
				double p = pinv[i][j];
				double[] bRow = b[j];
				for (int col = 0; col < k; col++)
					row[col] += p * bRow[col];
			}
		}
		return x;
	}

	/**
	 * Compute a percentile using linear interpolation between the closest ranks.
	 * <p>
	 * This is the default definition used by NumPy and R (type 7).
	 * 
	 * @param values input values; this array is not modified
	 * @param q the percentile, in the range 0-100
	 * @return
	 */
	public static double percentile(double[] values, double q) {
		Objects.requireNonNull(values, "Values must not be null");
		if (values.length == 0)
			throw new IllegalArgumentException("Cannot compute percentile of an empty array");
		if (!(q >= 0 && q <= 100))
			throw new IllegalArgumentException("Percentile must be between 0 and 100, but got " + q);
		if (q == 0)
			return StatUtils.min(values);
		return new Percentile()
				.withEstimationType(Percentile.EstimationType.R_7)
				.evaluate(values, q);
	}

	/**
	 * Compute the sample covariance matrix, where each row of the input is an observation 
	 * and each column a variable.
	 * The bias-corrected estimate is used (i.e. normalized by n - 1).
	 * 
	 * @param observations
	 * @return
	 */
	public static RealMatrix covariance(double[][] observations) {
		Objects.requireNonNull(observations, "Observations must not be null");
		if (observations.length < 2)
			throw new IllegalArgumentException("At least 2 observations are required to compute a covariance matrix");
		return new Covariance(observations, true).getCovarianceMatrix();
	}

	/**
	 * Compute the cross product of two vectors.
	 * @param u
	 * @param v
	 * @return
	 */
	public static double[] cross3(double[] u, double[] v) {
		double[] s = new double[3];
		s[0] = (u[1]*v[2] - u[2]*v[1]);
		s[1] = (u[2]*v[0] - u[0]*v[2]);
		s[2] = (u[0]*v[1] - u[1]*v[0]);
		return s;
	}

	/*
	 * Adapted from ImageJ's Tools class, which has the following note:
	 *  Returns a sorted list of indices of the specified double array.
	 *  Modified from: http://stackoverflow.com/questions/951848 by N.Vischer.
	 */
	static int[] rank(double[] values) {
		int n = values.length;
		final Integer[] indexes = new Integer[n];
		final Double[] data = new Double[n];
		for (int i=0; i<n; i++) {
			indexes[i] = Integer.valueOf(i);
			data[i] = Double.valueOf(values[i]);
		}
		Arrays.sort(indexes, new Comparator<Integer>() {
			@Override
			public int compare(final Integer o1, final Integer o2) {
				return data[o1].compareTo(data[o2]);
			}
		});
		int[] indexes2 = new int[n];
		for (int i=0; i<n; i++)
			indexes2[i] = indexes[i].intValue();
		return indexes2;
	}

}

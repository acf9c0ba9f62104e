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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import stainnorm.lib.analysis.stats.LinearAlgebraTools.SymmetricEigen;
import stainnorm.lib.color.ZeroColumnNormalizationException;

@SuppressWarnings("javadoc")
public class TestLinearAlgebraTools {
	
	private static final double EPS = 1e-10;

	@Test
	public void test_normalizeColumns() {
		double[][] data = {
				{0.3, -2.0, 10.0},
				{0.4, 0.5, 1e-3},
				{0.0, 1.5, -4.0}
		};
		RealMatrix mat = MatrixUtils.createRealMatrix(data);
		RealMatrix normalized = LinearAlgebraTools.normalizeColumns(mat);
		for (int c = 0; c < 3; c++) {
			assertEquals(1.0, normalized.getColumnVector(c).getNorm(), EPS);
		}
		assertArrayEquals(new double[] {0.6, 0.8, 0.0}, normalized.getColumn(0), EPS);
		
		// Input should be unchanged
		assertArrayEquals(data[0], mat.getRow(0), 0.0);
		assertArrayEquals(data[1], mat.getRow(1), 0.0);
		assertArrayEquals(data[2], mat.getRow(2), 0.0);
	}
	
	@Test
	public void test_normalizeColumnsNonSquare() {
		RealMatrix mat = MatrixUtils.createRealMatrix(new double[][] {
			{1, 2},
			{1, 2},
			{1, 2},
			{1, 2}
		});
		RealMatrix normalized = LinearAlgebraTools.normalizeColumns(mat);
		assertEquals(4, normalized.getRowDimension());
		assertEquals(2, normalized.getColumnDimension());
		assertArrayEquals(new double[] {0.5, 0.5, 0.5, 0.5}, normalized.getColumn(1), EPS);
	}
	
	@Test
	public void test_normalizeZeroColumn() {
		RealMatrix mat = MatrixUtils.createRealMatrix(new double[][] {
			{1, 0, 3},
			{2, 0, 1},
			{3, 0, 2}
		});
		var e = assertThrows(ZeroColumnNormalizationException.class, () -> LinearAlgebraTools.normalizeColumns(mat));
		assertEquals(1, e.getColumn());
	}

	@Test
	public void test_eigenAscending() {
		RealMatrix mat = MatrixUtils.createRealDiagonalMatrix(new double[] {3, 1, 2});
		SymmetricEigen eigen = LinearAlgebraTools.eigenSymmetric(mat);
		assertArrayEquals(new double[] {1, 2, 3}, eigen.getEigenvalues(), EPS);
		assertEquals(1.0, Math.abs(eigen.getEigenvector(2)[0]), EPS);
		assertEquals(1.0, Math.abs(eigen.getEigenvector(1)[2]), EPS);
		assertEquals(1.0, Math.abs(eigen.getEigenvector(0)[1]), EPS);
	}
	
	@Test
	public void test_eigenReconstruction() {
		RealMatrix mat = MatrixUtils.createRealMatrix(new double[][] {
			{4, 1, 0.5},
			{1, 3, 0.2},
			{0.5, 0.2, 1}
		});
		SymmetricEigen eigen = LinearAlgebraTools.eigenSymmetric(mat);
		double[] values = eigen.getEigenvalues();
		for (int i = 1; i < values.length; i++)
			assertEquals(true, values[i] >= values[i-1]);
		for (int i = 0; i < values.length; i++) {
			var v = MatrixUtils.createRealVector(eigen.getEigenvector(i));
			assertArrayEquals(v.mapMultiply(values[i]).toArray(), mat.operate(v).toArray(), 1e-8);
		}
	}

	@Test
	public void test_percentile() {
		double[] values = {4, 1, 3, 2};
		assertEquals(2.5, LinearAlgebraTools.percentile(values, 50), EPS);
		assertEquals(1.75, LinearAlgebraTools.percentile(values, 25), EPS);
		assertEquals(1.0, LinearAlgebraTools.percentile(values, 0), EPS);
		assertEquals(4.0, LinearAlgebraTools.percentile(values, 100), EPS);
		assertEquals(1.03, LinearAlgebraTools.percentile(values, 1), EPS);
		assertEquals(3.97, LinearAlgebraTools.percentile(values, 99), EPS);
		// Input should not be sorted in-place
		assertArrayEquals(new double[] {4, 1, 3, 2}, values, 0.0);
	}

	@Test
	public void test_percentileInvalid() {
		assertThrows(IllegalArgumentException.class, () -> LinearAlgebraTools.percentile(new double[0], 50));
		assertThrows(IllegalArgumentException.class, () -> LinearAlgebraTools.percentile(new double[] {1, 2}, -1));
		assertThrows(IllegalArgumentException.class, () -> LinearAlgebraTools.percentile(new double[] {1, 2}, 101));
	}

	@Test
	public void test_leastSquares() {
		RealMatrix a = MatrixUtils.createRealMatrix(new double[][] {
			{0.65, 0.07, 0.27},
			{0.70, 0.99, 0.57},
			{0.29, 0.11, 0.78}
		});
		RealMatrix x = MatrixUtils.createRealMatrix(new double[][] {
			{1.0, 0.0, 0.5, -0.2},
			{0.0, 2.0, 0.5, 0.1},
			{0.3, 0.0, 0.0, 0.0}
		});
		RealMatrix b = a.multiply(x);
		
		RealMatrix solved = LinearAlgebraTools.leastSquares(a, b);
		double[][] solvedArray = LinearAlgebraTools.leastSquares(a, b.getData());
		for (int r = 0; r < 3; r++) {
			assertArrayEquals(x.getRow(r), solved.getRow(r), 1e-10);
			assertArrayEquals(x.getRow(r), solvedArray[r], 1e-10);
		}
	}

	@Test
	public void test_leastSquaresRankDeficient() {
		// Second column duplicates the first - minimum norm solution splits the weight equally
		RealMatrix a = MatrixUtils.createRealMatrix(new double[][] {
			{1, 1},
			{0, 0}
		});
		double[][] x = LinearAlgebraTools.leastSquares(a, new double[][] {{2}, {0}});
		assertEquals(1.0, x[0][0], EPS);
		assertEquals(1.0, x[1][0], EPS);
	}

	@Test
	public void test_covariance() {
		double[][] observations = {
				{1, 2, 0},
				{2, 4, 0},
				{3, 6, 0}
		};
		RealMatrix cov = LinearAlgebraTools.covariance(observations);
		assertEquals(1.0, cov.getEntry(0, 0), EPS);
		assertEquals(4.0, cov.getEntry(1, 1), EPS);
		assertEquals(2.0, cov.getEntry(0, 1), EPS);
		assertEquals(2.0, cov.getEntry(1, 0), EPS);
		assertEquals(0.0, cov.getEntry(2, 2), EPS);
		
		assertThrows(IllegalArgumentException.class, () -> LinearAlgebraTools.covariance(new double[][] {{1, 2, 3}}));
	}

	@Test
	public void test_cross3() {
		assertArrayEquals(new double[] {0, 0, 1}, LinearAlgebraTools.cross3(new double[] {1, 0, 0}, new double[] {0, 1, 0}), 0.0);
		assertArrayEquals(new double[] {0, 0, -1}, LinearAlgebraTools.cross3(new double[] {0, 1, 0}, new double[] {1, 0, 0}), 0.0);
	}

	@Test
	public void test_rank() {
		assertArrayEquals(new int[] {1, 3, 2, 0}, LinearAlgebraTools.rank(new double[] {4, 1, 3, 2}));
	}

}

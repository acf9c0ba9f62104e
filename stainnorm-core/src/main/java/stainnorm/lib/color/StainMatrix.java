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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A 3x3 stain matrix, with one stain vector per column.
 * <p>
 * Columns 0 and 1 hold the two stains, column 2 the residual component.
 * Instances are immutable.
 */
public final class StainMatrix {

	/**
	 * Default name for the first stain.
	 */
	public static final String STAIN_1 = "Stain 1";

	/**
	 * Default name for the second stain.
	 */
	public static final String STAIN_2 = "Stain 2";

	/**
	 * Default name for the residual component.
	 */
	public static final String RESIDUAL = "Residual";

	private final StainVector stain1;
	private final StainVector stain2;
	private final StainVector stain3;

	private StainMatrix(StainVector stain1, StainVector stain2, StainVector stain3) {
		this.stain1 = Objects.requireNonNull(stain1);
		this.stain2 = Objects.requireNonNull(stain2);
		this.stain3 = Objects.requireNonNull(stain3);
	}

	/**
	 * Create a stain matrix from three stain vectors.
	 * @param stain1
	 * @param stain2
	 * @param residual
	 * @return
	 */
	public static StainMatrix create(StainVector stain1, StainVector stain2, StainVector residual) {
		return new StainMatrix(stain1, stain2, residual);
	}

	/**
	 * Create a stain matrix from a 3x3 matrix, using the columns as stain vectors.
	 * The third column is treated as the residual.
	 * <p>
	 * Columns are used as provided; see {@link stainnorm.lib.analysis.stats.LinearAlgebraTools#normalizeColumns(RealMatrix)}
	 * to normalize them first.
	 * 
	 * @param matrix
	 * @return
	 */
	public static StainMatrix fromColumns(RealMatrix matrix) {
		Objects.requireNonNull(matrix, "Matrix must not be null");
		if (matrix.getRowDimension() != 3 || matrix.getColumnDimension() != 3)
			throw new IllegalArgumentException("Stain matrix must be 3x3, but got " 
					+ matrix.getRowDimension() + "x" + matrix.getColumnDimension());
		double[] c1 = matrix.getColumn(0);
		double[] c2 = matrix.getColumn(1);
		double[] c3 = matrix.getColumn(2);
		return new StainMatrix(
				StainVector.createStainVector(STAIN_1, c1[0], c1[1], c1[2]),
				StainVector.createStainVector(STAIN_2, c2[0], c2[1], c2[2]),
				StainVector.createResidualStainVector(RESIDUAL, c3[0], c3[1], c3[2]));
	}

	/**
	 * Get a specified stain vector, where n should be 1, 2 or 3.
	 * 
	 * @param n
	 * @return
	 * @throws IllegalArgumentException if n is out of range
	 */
	public StainVector getStain(int n) {
		switch (n) {
		case 1:
			return stain1;
		case 2:
			return stain2;
		case 3:
			return stain3;
		default:
			throw new IllegalArgumentException("Stain number must be 1, 2 or 3 (stains are not zero-based), but got " + n);
		}
	}

	/**
	 * Get the stain vectors as columns of a new 3x3 matrix.
	 * @return
	 */
	public RealMatrix getMatrix() {
		RealMatrix mat = MatrixUtils.createRealMatrix(3, 3);
		mat.setColumn(0, stain1.getArray());
		mat.setColumn(1, stain2.getArray());
		mat.setColumn(2, stain3.getArray());
		return mat;
	}

	/**
	 * Get the stain names and values as a map, preserving the stain order.
	 * @return
	 */
	public Map<String, List<Double>> getStainsAsMap() {
		Map<String, List<Double>> map = new LinkedHashMap<>();
		for (StainVector stain : Arrays.asList(stain1, stain2, stain3)) {
			map.put(stain.getName(), List.of(stain.getRed(), stain.getGreen(), stain.getBlue()));
		}
		return map;
	}

	@Override
	public String toString() {
		return "Stain matrix: " + stain1 + ", " + stain2 + ", " + stain3;
	}

	@Override
	public int hashCode() {
		return Objects.hash(stain1, stain2, stain3);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StainMatrix))
			return false;
		StainMatrix other = (StainMatrix)obj;
		return stain1.equals(other.stain1) && stain2.equals(other.stain2) && stain3.equals(other.stain3);
	}

}

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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestStainMatrix {

	@Test
	void Check_Stain_Matrix_From_Columns() {
		RealMatrix mat = MatrixUtils.createRealMatrix(new double[][] {
			{1.0, 0.0, 0.0},
			{0.0, 1.0, 0.0},
			{0.0, 0.0, 1.0}
		});
		StainMatrix stains = StainMatrix.fromColumns(mat);
		assertEquals(StainMatrix.STAIN_1, stains.getStain(1).getName());
		assertEquals(StainMatrix.STAIN_2, stains.getStain(2).getName());
		assertEquals(StainMatrix.RESIDUAL, stains.getStain(3).getName());
		assertArrayEquals(new double[] {0.0, 1.0, 0.0}, stains.getStain(2).getArray());
		
		RealMatrix mat2 = stains.getMatrix();
		for (int r = 0; r < 3; r++)
			assertArrayEquals(mat.getRow(r), mat2.getRow(r));
	}

	@Test
	void Check_Stain_Matrix_Invalid_Stain_Number() {
		StainMatrix stains = StainMatrix.fromColumns(MatrixUtils.createRealIdentityMatrix(3));
		assertThrows(IllegalArgumentException.class, () -> stains.getStain(0));
		assertThrows(IllegalArgumentException.class, () -> stains.getStain(4));
	}

	@Test
	void Check_Stain_Matrix_Wrong_Size() {
		assertThrows(IllegalArgumentException.class, () -> StainMatrix.fromColumns(MatrixUtils.createRealIdentityMatrix(2)));
	}

	@Test
	void Check_Stain_Matrix_As_Map() {
		StainMatrix stains = StainMatrix.fromColumns(MatrixUtils.createRealIdentityMatrix(3));
		Map<String, List<Double>> expectedStains = new LinkedHashMap<>();       // LinkedHashMap to conserve order
		expectedStains.put("Stain 1", List.of(1.0, 0.0, 0.0));
		expectedStains.put("Stain 2", List.of(0.0, 1.0, 0.0));
		expectedStains.put("Residual", List.of(0.0, 0.0, 1.0));
		
		assertEquals(expectedStains, stains.getStainsAsMap());
	}

	@Test
	void Check_Stain_Vector_Angle() {
		StainVector s1 = StainVector.createStainVector("1", 1, 0, 0);
		StainVector s2 = StainVector.createStainVector("2", 0, 2, 0);
		StainVector s3 = StainVector.createStainVector("3", 3, 0, 0);
		assertEquals(90.0, StainVector.computeAngle(s1, s2), 1e-10);
		assertEquals(0.0, StainVector.computeAngle(s1, s3), 1e-10);
	}

}

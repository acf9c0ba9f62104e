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

import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.jupiter.api.Test;

import stainnorm.lib.analysis.stats.LinearAlgebraTools;
import stainnorm.lib.images.ByteImage;

@SuppressWarnings("javadoc")
public class TestStainConcentrations {

	private static final StainMatrix stains = StainMatrix.fromColumns(
			LinearAlgebraTools.normalizeColumns(MatrixUtils.createRealMatrix(new double[][] {
				{0.65, 0.07, 0.27},
				{0.70, 0.99, 0.57},
				{0.29, 0.11, 0.78}
			})));

	@Test
	public void test_deconvolveReconvolve() {
		byte[] pixels = {
				(byte)255, (byte)255, (byte)255,
				(byte)200, (byte)120, (byte)180,
				(byte)90, (byte)60, (byte)140,
				(byte)10, (byte)240, (byte)30
		};
		ByteImage img = ByteImage.create(2, 2, 3, pixels);
		double[][] od = OpticalDensities.computeOpticalDensities(img, 255);
		double[][] concentrations = StainConcentrations.deconvolve(od, stains);
		
		assertEquals(3, concentrations.length);
		assertEquals(4, concentrations[0].length);
		// Background has zero concentration
		for (int c = 0; c < 3; c++)
			assertEquals(0.0, concentrations[c][0], 1e-12);
		
		ByteImage output = StainConcentrations.reconvolve(concentrations, stains, 255, 2, 2);
		for (int i = 0; i < pixels.length; i++)
			assertEquals(pixels[i] & 0xff, output.getPixels()[i] & 0xff, 1);
	}

	@Test
	public void test_reconvolveClips() {
		double[][] concentrations = {
				{-10, 0},
				{0, 0},
				{0, 100}
		};
		ByteImage output = StainConcentrations.reconvolve(concentrations, stains, 255, 2, 1);
		// Negative concentrations would give values > 255
		assertEquals(255, output.getValue(0, 0, 0));
		assertEquals(255, output.getValue(0, 0, 1));
		// Very high concentrations approach 0
		assertEquals(0, output.getValue(1, 0, 2));
	}

	@Test
	public void test_maxConcentrations() {
		double[][] concentrations = new double[3][101];
		for (int i = 0; i <= 100; i++) {
			concentrations[0][i] = i;
			concentrations[1][i] = i / 10.0;
			concentrations[2][i] = 1000;
		}
		double[] max = StainConcentrations.maxConcentrations(concentrations);
		assertArrayEquals(new double[] {99, 9.9, 1}, max, 1e-10);
	}

	@Test
	public void test_rescale() {
		double[][] concentrations = {
				{1, 2},
				{3, 4},
				{5, 6}
		};
		StainConcentrations.rescaleConcentrations(concentrations, new double[] {2, 1, 1}, new double[] {1, 3, 1});
		assertArrayEquals(new double[] {0.5, 1}, concentrations[0], 1e-12);
		assertArrayEquals(new double[] {9, 12}, concentrations[1], 1e-12);
		assertArrayEquals(new double[] {5, 6}, concentrations[2], 1e-12);
	}

	@Test
	public void test_rescaleInvalidMax() {
		double[][] concentrations = {
				{1, 2},
				{3, 4},
				{5, 6}
		};
		assertThrows(DegenerateStainEstimationException.class, 
				() -> StainConcentrations.rescaleConcentrations(concentrations, new double[] {1, 0, 1}, new double[] {1, 1, 1}));
		assertThrows(DegenerateStainEstimationException.class, 
				() -> StainConcentrations.rescaleConcentrations(concentrations, new double[] {-0.5, 1, 1}, new double[] {1, 1, 1}));
	}

}

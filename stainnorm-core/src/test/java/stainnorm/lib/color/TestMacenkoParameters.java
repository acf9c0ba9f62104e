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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestMacenkoParameters {

	@Test
	public void testDefaults() {
		var params = MacenkoParameters.getDefault();
		assertEquals(255.0, params.getIo());
		assertEquals(0.15, params.getBeta());
		assertEquals(1.0, params.getAlpha());
		assertTrue(params.doIntensityNorm());
		assertEquals(params, MacenkoParameters.builder().build());
	}

	@Test
	public void testBuilder() {
		var params = MacenkoParameters.builder()
				.io(240)
				.beta(0)
				.alpha(49.9)
				.intensityNorm(false)
				.build();
		assertEquals(240.0, params.getIo());
		assertEquals(0.0, params.getBeta());
		assertEquals(49.9, params.getAlpha());
		assertFalse(params.doIntensityNorm());
		assertEquals(params, params.toBuilder().build());
	}

	@Test
	public void testInvalid() {
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().alpha(0).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().alpha(50).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().alpha(-1).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().alpha(Double.NaN).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().io(0).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().io(-255).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().io(Double.POSITIVE_INFINITY).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().beta(-0.01).build());
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.builder().beta(Double.NaN).build());
	}

	@Test
	public void testFromJson() {
		var params = MacenkoParameters.fromJson("{\"io\": 240, \"alpha\": 2.5, \"somethingElse\": [1, 2]}");
		assertEquals(240.0, params.getIo());
		assertEquals(MacenkoParameters.DEFAULT_BETA, params.getBeta());
		assertEquals(2.5, params.getAlpha());
		assertTrue(params.doIntensityNorm());
		
		assertEquals(MacenkoParameters.getDefault(), MacenkoParameters.fromJson("{}"));
		
		var params2 = MacenkoParameters.builder().beta(0.3).intensityNorm(false).build();
		assertEquals(params2, MacenkoParameters.fromJson(params2.toJson()));
	}

	@Test
	public void testFromJsonInvalid() {
		assertThrows(InvalidNormalizationParameterException.class, () -> MacenkoParameters.fromJson("{\"alpha\": 60}"));
	}

}

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

import java.util.Locale;
import java.util.Locale.Category;
import java.util.Objects;

import stainnorm.lib.common.GeneralTools;

/**
 * Representation of a stain vector, defined in terms of red, green and blue optical densities.
 * <p>
 * Instances are immutable. Values are stored as provided; stain vectors created by 
 * {@link StainMatrix} have unit length.
 */
public final class StainVector {

	private final String name;
	private final double r, g, b;
	private final boolean isResidual;

	private StainVector(String name, double r, double g, double b, boolean isResidual) {
		this.name = name;
		this.r = r;
		this.g = g;
		this.b = b;
		this.isResidual = isResidual;
	}

	/**
	 * Create a stain vector.
	 * @param name the name of the stain
	 * @param r the stain vector red component
	 * @param g the stain vector green component
	 * @param b the stain vector blue component
	 * @return
	 */
	public static StainVector createStainVector(String name, double r, double g, double b) {
		return new StainVector(name, r, g, b, false);
	}

	/**
	 * Create a stain vector representing the residual (orthogonal) component.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static StainVector createResidualStainVector(String name, double r, double g, double b) {
		return new StainVector(name, r, g, b, true);
	}

	/**
	 * Returns true if this vector represents the residual (orthogonal) component, 
	 * rather than a real stain.
	 * @return
	 */
	public boolean isResidual() {
		return isResidual;
	}

	/**
	 * Returns the name of the stain vector.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Get the red component of the stain vector.
	 * @return
	 */
	public double getRed() {
		return r;
	}

	/**
	 * Get the green component of the stain vector.
	 * @return
	 */
	public double getGreen() {
		return g;
	}

	/**
	 * Get the blue component of the stain vector.
	 * @return
	 */
	public double getBlue() {
		return b;
	}

	/**
	 * Get the stain vector as a 3 element array (red, green, blue).
	 * @return
	 */
	public double[] getArray() {
		return new double[]{r, g, b};
	}

	/**
	 * Euclidean length of the vector.
	 * @return
	 */
	public double getLength() {
		return Math.sqrt(r*r + g*g + b*b);
	}

	/**
	 * Get a String representation of the stain vector array, formatting according to the specified Locale.
	 * @param locale
	 * @param nDecimalPlaces
	 * @return
	 */
	public String arrayAsString(final Locale locale, final int nDecimalPlaces) {
		return GeneralTools.arrayToString(locale, getArray(), nDecimalPlaces);
	}

	@Override
	public String toString() {
		return name + ": " + arrayAsString(Locale.getDefault(Category.FORMAT), 3);
	}

	/**
	 * Calculate the angle between two stain vectors, in degrees.
	 * @param s1
	 * @param s2
	 * @return
	 */
	public static double computeAngle(StainVector s1, StainVector s2) {
		double[] v1 = s1.getArray();
		double[] v2 = s2.getArray();
		double n1 = 0, n2 = 0, dot = 0;
		for (int i = 0; i < v1.length; i++) {
			n1 += v1[i]*v1[i];
			n2 += v2[i]*v2[i];
			dot += v1[i]*v2[i];
		}
		double cos = dot / (Math.sqrt(n1) * Math.sqrt(n2));
		// Rounding can push this slightly outside [-1, 1]
		cos = Math.max(-1, Math.min(1, cos));
		return Math.acos(cos) / Math.PI * 180;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, r, g, b, isResidual);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof StainVector))
			return false;
		StainVector other = (StainVector)obj;
		return Objects.equals(name, other.name) &&
				Double.doubleToLongBits(r) == Double.doubleToLongBits(other.r) &&
				Double.doubleToLongBits(g) == Double.doubleToLongBits(other.g) &&
				Double.doubleToLongBits(b) == Double.doubleToLongBits(other.b) &&
				isResidual == other.isResidual;
	}

}

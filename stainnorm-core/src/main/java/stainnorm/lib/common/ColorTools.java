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

package stainnorm.lib.common;

/**
 * Static methods for working with packed RGB values and 8-bit intensities.
 */
public final class ColorTools {

	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255, following {@link java.awt.Color}.
	 * 
	 * @param r red value; should be in the range 0-255
	 * @param g green value; should be in the range 0-255
	 * @param b blue value; should be in the range 0-255
	 * @return
	 */
	public static int packRGB(int r, int g, int b) {
		return (255<<24) + (r<<16) + (g<<8) + b;
	}

	/**
	 * Clip an input value to be an integer in the range 0-255 (with rounding down).
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return v < 0 ? 0 : (v > 255 ? 255 : (int)v);
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}

}

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

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Locale.Category;
import java.util.Map;

/**
 * Collection of generally-useful static methods.
 */
public final class GeneralTools {

	private static final Map<Locale, NumberFormat> formatters = new HashMap<>();

	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Returns true if the value is finite and strictly greater than zero.
	 * @param value
	 * @return
	 */
	public static boolean isPositiveFinite(double value) {
		return Double.isFinite(value) && value > 0;
	}

	/**
	 * Convert a double array to a String using a space as a delimiter.
	 * 
	 * @param locale
	 * @param array
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String arrayToString(final Locale locale, final double[] array, final int nDecimalPlaces) {
		return arrayToString(locale, array, " ", nDecimalPlaces);
	}

	/**
	 * Convert a double array to a String, using the specified delimiter and number of decimal places.
	 * 
	 * @param locale
	 * @param array
	 * @param delimiter
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String arrayToString(final Locale locale, final double[] array, final String delimiter, final int nDecimalPlaces) {
		StringBuilder sb = new StringBuilder();
		if (array.length == 0)
			return "";
		for (int i = 0; i < array.length; i++) {
			sb.append(formatNumber(locale, array[i], nDecimalPlaces));
			if (i < array.length-1)
				sb.append(delimiter);
		}
		return sb.toString();
	}

	/**
	 * Format a number with a specified maximum number of decimal places, using the default locale.
	 * 
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public static String formatNumber(final double value, final int maxDecimalPlaces) {
		return formatNumber(Locale.getDefault(Category.FORMAT), value, maxDecimalPlaces);
	}

	/**
	 * Format a number with a specified maximum number of decimal places, using the specified locale.
	 * 
	 * @param locale
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public synchronized static String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		NumberFormat nf = formatters.get(locale);
		if (nf == null) {
			nf = NumberFormat.getInstance(locale);
			nf.setGroupingUsed(false);
			formatters.put(locale, nf);
		}
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}

	/**
	 * Get a String representation of a 2D array, one row per line.
	 * Intended for logging.
	 * @param data
	 * @return
	 */
	public static String matrixToString(final double[][] data) {
		StringBuilder sb = new StringBuilder();
		for (double[] row : data) {
			for (double d : row) {
				sb.append(d).append(",\t");
			}
			sb.append("\n");
		}
		return sb.toString();
	}

}

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

/**
 * Thrown when a matrix column with zero length is passed for normalization.
 * For a stain matrix this indicates that two stain vectors were parallel.
 */
public class ZeroColumnNormalizationException extends StainNormalizationException {

	private static final long serialVersionUID = 1L;

	private final int column;

	/**
	 * Constructor.
	 * @param column index of the offending column
	 */
	public ZeroColumnNormalizationException(int column) {
		super("Cannot normalize column " + column + " - column has zero (or non-finite) length");
		this.column = column;
	}

	/**
	 * Get the index of the column that could not be normalized.
	 * @return
	 */
	public int getColumn() {
		return column;
	}

}

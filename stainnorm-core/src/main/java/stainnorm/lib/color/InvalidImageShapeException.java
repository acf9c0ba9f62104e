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
 * Thrown when an image does not have the shape required for stain normalization (i.e. 3 channels),
 * or when pixel data is inconsistent with the stated dimensions.
 */
public class InvalidImageShapeException extends StainNormalizationException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with a message.
	 * @param message
	 */
	public InvalidImageShapeException(String message) {
		super(message);
	}

}

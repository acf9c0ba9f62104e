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
 * Thrown when a stain matrix cannot be estimated from an image, usually because too few pixels
 * exceed the optical density threshold or because they do not span two independent directions.
 */
public class DegenerateStainEstimationException extends StainNormalizationException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with a message.
	 * @param message
	 */
	public DegenerateStainEstimationException(String message) {
		super(message);
	}

	/**
	 * Constructor with a message and cause.
	 * @param message
	 * @param cause
	 */
	public DegenerateStainEstimationException(String message, Throwable cause) {
		super(message, cause);
	}

}

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

package stainnorm.lib.awt.common;

import java.awt.image.BufferedImage;
import java.util.Objects;

import stainnorm.lib.images.ByteImage;

/**
 * Static methods for converting between {@link BufferedImage} and {@link ByteImage}.
 */
public final class BufferedImageTools {

	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Returns true if the BufferedImage type represents an 8-bit RGB image (with or without alpha).
	 * @param type
	 * @return
	 */
	public static boolean is8bitColorType(int type) {
		return type == BufferedImage.TYPE_INT_RGB ||
				type == BufferedImage.TYPE_INT_ARGB ||
				type == BufferedImage.TYPE_INT_ARGB_PRE ||
				type == BufferedImage.TYPE_INT_BGR ||
				type == BufferedImage.TYPE_3BYTE_BGR ||
				type == BufferedImage.TYPE_4BYTE_ABGR ||
				type == BufferedImage.TYPE_4BYTE_ABGR_PRE;
	}

	/**
	 * Extract the red, green and blue values of an 8-bit color image.
	 * Any alpha channel is discarded.
	 * 
	 * @param img
	 * @return a 3-channel image
	 * @throws IllegalArgumentException if the image is not an 8-bit color type
	 */
	public static ByteImage toByteImage(BufferedImage img) {
		Objects.requireNonNull(img, "Image must not be null");
		if (!is8bitColorType(img.getType()))
			throw new IllegalArgumentException("Only 8-bit RGB images are supported, but image has type " + img.getType());
		int w = img.getWidth();
		int h = img.getHeight();
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		return ByteImage.fromPackedRGB(w, h, rgb);
	}

	/**
	 * Write the pixels of a 3-channel {@link ByteImage} to a BufferedImage.
	 * 
	 * @param img the source pixels
	 * @param output the image to write to; if null, a new {@link BufferedImage#TYPE_INT_RGB} image is created
	 * @return the output image
	 */
	public static BufferedImage toBufferedImage(ByteImage img, BufferedImage output) {
		Objects.requireNonNull(img, "Image must not be null");
		int w = img.getWidth();
		int h = img.getHeight();
		if (output == null)
			output = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		else if (output.getWidth() != w || output.getHeight() != h)
			throw new IllegalArgumentException("Output image size " + output.getWidth() + "x" + output.getHeight() 
				+ " does not match " + w + "x" + h);
		output.setRGB(0, 0, w, h, img.toPackedRGB(), 0, w);
		return output;
	}

}

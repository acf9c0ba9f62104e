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

package stainnorm.lib.images;

import java.util.Arrays;
import java.util.Objects;

import stainnorm.lib.color.InvalidImageShapeException;
import stainnorm.lib.common.ColorTools;

/**
 * Immutable image containing unsigned 8-bit samples, stored interleaved 
 * (row-major, with channels varying fastest).
 * <p>
 * Pixel data is always copied on construction and on access, so that instances never share 
 * a buffer with the caller.
 */
public final class ByteImage {

	private final int width;
	private final int height;
	private final int nChannels;
	private final byte[] pixels;

	private ByteImage(int width, int height, int nChannels, byte[] pixels) {
		this.width = width;
		this.height = height;
		this.nChannels = nChannels;
		this.pixels = pixels;
	}

	/**
	 * Create an image from interleaved 8-bit samples.
	 * 
	 * @param width image width
	 * @param height image height
	 * @param nChannels number of channels per pixel
	 * @param pixels samples, of length {@code width * height * nChannels}; this array is copied
	 * @return
	 * @throws InvalidImageShapeException if any dimension is not positive, or the array length is inconsistent with the dimensions
	 */
	public static ByteImage create(int width, int height, int nChannels, byte[] pixels) throws InvalidImageShapeException {
		Objects.requireNonNull(pixels, "Pixels must not be null");
		checkDimensions(width, height, nChannels);
		long n = (long)width * height * nChannels;
		if (pixels.length != n)
			throw new InvalidImageShapeException("Expected " + n + " samples for " + width + "x" + height + "x" + nChannels + " image, but got " + pixels.length);
		return new ByteImage(width, height, nChannels, pixels.clone());
	}

	/**
	 * Create a 3-channel RGB image from packed (A)RGB int values, as returned by 
	 * {@link java.awt.image.BufferedImage#getRGB(int, int, int, int, int[], int, int)}.
	 * Any alpha values are discarded.
	 * 
	 * @param width
	 * @param height
	 * @param rgb packed values, of length {@code width * height}
	 * @return
	 */
	public static ByteImage fromPackedRGB(int width, int height, int[] rgb) throws InvalidImageShapeException {
		Objects.requireNonNull(rgb, "RGB array must not be null");
		checkDimensions(width, height, 3);
		if (rgb.length != width * height)
			throw new InvalidImageShapeException("Expected " + (width * height) + " packed RGB values, but got " + rgb.length);
		byte[] pixels = new byte[rgb.length * 3];
		int ind = 0;
		for (int v : rgb) {
			pixels[ind++] = (byte)ColorTools.red(v);
			pixels[ind++] = (byte)ColorTools.green(v);
			pixels[ind++] = (byte)ColorTools.blue(v);
		}
		return new ByteImage(width, height, 3, pixels);
	}

	private static void checkDimensions(int width, int height, int nChannels) {
		if (width <= 0 || height <= 0 || nChannels <= 0)
			throw new InvalidImageShapeException("Image dimensions must be > 0, but got " + width + "x" + height + "x" + nChannels);
		if ((long)width * height * nChannels > Integer.MAX_VALUE)
			throw new InvalidImageShapeException("Image " + width + "x" + height + "x" + nChannels + " is too large");
	}

	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of channels per pixel.
	 * @return
	 */
	public int getChannelCount() {
		return nChannels;
	}

	/**
	 * Total number of pixels, i.e. {@code width * height}.
	 * @return
	 */
	public int getPixelCount() {
		return width * height;
	}

	/**
	 * Get the unsigned value of a single sample.
	 * @param x
	 * @param y
	 * @param c
	 * @return the value, in the range 0-255
	 */
	public int getValue(int x, int y, int c) {
		Objects.checkIndex(x, width);
		Objects.checkIndex(y, height);
		Objects.checkIndex(c, nChannels);
		return pixels[(y * width + x) * nChannels + c] & 0xff;
	}

	/**
	 * Get the unsigned value of a sample by pixel index (i.e. {@code y * width + x}) and channel.
	 * @param pixel
	 * @param c
	 * @return the value, in the range 0-255
	 */
	public int getValue(int pixel, int c) {
		return pixels[pixel * nChannels + c] & 0xff;
	}

	/**
	 * Get a copy of the interleaved samples.
	 * @return
	 */
	public byte[] getPixels() {
		return pixels.clone();
	}

	/**
	 * Get packed RGB values, suitable for {@link java.awt.image.BufferedImage#setRGB(int, int, int, int, int[], int, int)}.
	 * @return
	 * @throws InvalidImageShapeException if the image does not have 3 channels
	 */
	public int[] toPackedRGB() throws InvalidImageShapeException {
		if (nChannels != 3)
			throw new InvalidImageShapeException("Packed RGB requires 3 channels, but image has " + nChannels);
		int n = getPixelCount();
		int[] rgb = new int[n];
		for (int i = 0; i < n; i++) {
			int ind = i * 3;
			rgb[i] = ColorTools.packRGB(pixels[ind] & 0xff, pixels[ind+1] & 0xff, pixels[ind+2] & 0xff);
		}
		return rgb;
	}

	/**
	 * Compute the mean value of each channel.
	 * @return an array with one entry per channel
	 */
	public double[] getChannelMeans() {
		double[] means = new double[nChannels];
		for (int i = 0; i < pixels.length; i++)
			means[i % nChannels] += pixels[i] & 0xff;
		int n = getPixelCount();
		for (int c = 0; c < nChannels; c++)
			means[c] /= n;
		return means;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, height, nChannels, Arrays.hashCode(pixels));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ByteImage))
			return false;
		ByteImage other = (ByteImage)obj;
		return width == other.width && height == other.height && nChannels == other.nChannels && 
				Arrays.equals(pixels, other.pixels);
	}

	@Override
	public String toString() {
		return "ByteImage (" + width + "x" + height + "x" + nChannels + ")";
	}

}

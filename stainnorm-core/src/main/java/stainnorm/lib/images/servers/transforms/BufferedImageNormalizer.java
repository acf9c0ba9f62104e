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

package stainnorm.lib.images.servers.transforms;

import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.awt.image.BufferedImageOp;
import java.awt.image.ColorModel;

import stainnorm.lib.awt.common.BufferedImageTools;

/**
 * A {@link BufferedImageOp} that changes the colors of an 8-bit RGB image without changing its geometry.
 * <p>
 * Implementations should be immutable and thread-safe.
 */
public interface BufferedImageNormalizer extends BufferedImageOp {

	/**
	 * Returns the bounds of the source image, which are unchanged by normalization.
	 */
	@Override
	default Rectangle2D getBounds2D(BufferedImage src) {
		return new Rectangle(0, 0, src.getWidth(), src.getHeight());
	}

	/**
	 * Create an 8-bit RGB destination image with the same size as the source.
	 * The source type is retained if it is already an 8-bit color type; otherwise 
	 * {@link BufferedImage#TYPE_INT_RGB} is used. 
	 * The requested color model is ignored, since normalization only ever writes packed RGB values.
	 */
	@Override
	default BufferedImage createCompatibleDestImage(BufferedImage src, ColorModel destCM) {
		int type = BufferedImageTools.is8bitColorType(src.getType()) ? src.getType() : BufferedImage.TYPE_INT_RGB;
		return new BufferedImage(src.getWidth(), src.getHeight(), type);
	}

	/**
	 * Pixel locations are unchanged.
	 */
	@Override
	default Point2D getPoint2D(Point2D srcPt, Point2D dstPt) {
		if (dstPt == null)
			return (Point2D)srcPt.clone();
		dstPt.setLocation(srcPt);
		return dstPt;
	}

	@Override
	default RenderingHints getRenderingHints() {
		return null;
	}

}

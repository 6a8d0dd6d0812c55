/**
 **
 ** ImageTile.java - rectangular part of a band image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImageTile.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.celeste.tiling;

import com.elphel.celeste.images.Image;

/**
 * Read-only view of a rectangle of the parent image. Pixels are addressed
 * by the parent image row/column.
 */
public class ImageTile {
	public final Image image;
	public final int   tileX;  // tile grid column
	public final int   tileY;  // tile grid row
	public final int   h0;     // first row
	public final int   w0;     // first column
	public final int   height;
	public final int   width;

	public ImageTile(Image image, int tileX, int tileY, int h0, int w0, int height, int width) {
		if ((h0 < 0) || (w0 < 0) || (height <= 0) || (width <= 0) || ((h0 + height) > image.H) || ((w0 + width) > image.W)) {
			throw new IllegalArgumentException("ImageTile(): rectangle ("+w0+", "+h0+", "+width+"x"+height+") is outside of "+image);
		}
		this.image =  image;
		this.tileX =  tileX;
		this.tileY =  tileY;
		this.h0 =     h0;
		this.w0 =     w0;
		this.height = height;
		this.width =  width;
	}

	/**
	 * @return line-scan index of the first tile pixel in the parent image
	 */
	public int getOffset() {
		return h0 * image.W + w0;
	}

	public int getNumPixels() {
		return height * width;
	}

	public boolean contains(int h, int w) {
		return (h >= h0) && (h < (h0 + height)) && (w >= w0) && (w < (w0 + width));
	}

	/**
	 * Squared distance (pixels^2) from a point to the closest pixel center of the tile
	 * @param x column coordinate
	 * @param y row coordinate
	 */
	public double distance2(double x, double y) {
		double dx = 0.0, dy = 0.0;
		if      (x < w0)                 dx = w0 - x;
		else if (x > (w0 + width - 1))   dx = x - (w0 + width - 1);
		if      (y < h0)                 dy = h0 - y;
		else if (y > (h0 + height - 1))  dy = y - (h0 + height - 1);
		return dx * dx + dy * dy;
	}

	public double [] getPixels() {
		double [] pixels = new double [height * width];
		for (int dh = 0; dh < height; dh++) {
			for (int dw = 0; dw < width; dw++) {
				pixels[dh * width + dw] = image.getPixel(h0 + dh, w0 + dw);
			}
		}
		return pixels;
	}

	@Override
	public String toString() {
		return "tile["+tileY+"]["+tileX+"] of "+image.name+" ("+w0+", "+h0+", "+width+"x"+height+")";
	}
}

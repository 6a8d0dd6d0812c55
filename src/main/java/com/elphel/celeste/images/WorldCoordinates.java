/**
 **
 ** WorldCoordinates.java - linear (CD matrix) pixel to sky mapping
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WorldCoordinates.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.images;

import Jama.Matrix;

/**
 * world = crval + CD * (pixel - crpix). Pixel coordinates are {x, y}, zero-based,
 * x along the image width (column), y along the height (row), integer values
 * at pixel centers.
 */
public class WorldCoordinates {
	private final double [] crpix;
	private final double [] crval;
	private final Matrix    cd;
	private final Matrix    cd_inv;

	/**
	 * @param crpix zero-based reference pixel {x, y}
	 * @param crval world coordinates {ra, dec} of the reference pixel, degrees
	 * @param cd 2x2 matrix, degrees per pixel
	 */
	public WorldCoordinates(double [] crpix, double [] crval, double [][] cd) {
		if ((crpix.length != 2) || (crval.length != 2) || (cd.length != 2) || (cd[0].length != 2) || (cd[1].length != 2)) {
			throw new IllegalArgumentException("WorldCoordinates(): expecting 2-element reference pixel/value and 2x2 CD matrix");
		}
		this.crpix = crpix.clone();
		this.crval = crval.clone();
		this.cd =    new Matrix(new double [][] {cd[0].clone(), cd[1].clone()});
		if (Math.abs(this.cd.det()) < 1E-30) {
			throw new IllegalArgumentException("WorldCoordinates(): CD matrix is singular");
		}
		this.cd_inv = this.cd.inverse();
	}

	/**
	 * Square pixels aligned with ra (decreasing with x) and dec (increasing with y)
	 * @param crpix zero-based reference pixel
	 * @param crval world coordinates of the reference pixel
	 * @param arcsec_per_pixel pixel scale
	 */
	public static WorldCoordinates simple(double [] crpix, double [] crval, double arcsec_per_pixel) {
		double s = arcsec_per_pixel / 3600;
		return new WorldCoordinates(crpix, crval, new double [][] {{-s, 0.0}, {0.0, s}});
	}

	public double [] worldToPixel(double [] world) {
		double [] d = {world[0] - crval[0], world[1] - crval[1]};
		return new double [] {
				crpix[0] + cd_inv.get(0, 0) * d[0] + cd_inv.get(0, 1) * d[1],
				crpix[1] + cd_inv.get(1, 0) * d[0] + cd_inv.get(1, 1) * d[1]};
	}

	public double [] pixelToWorld(double [] pixel) {
		double [] d = {pixel[0] - crpix[0], pixel[1] - crpix[1]};
		return new double [] {
				crval[0] + cd.get(0, 0) * d[0] + cd.get(0, 1) * d[1],
				crval[1] + cd.get(1, 0) * d[0] + cd.get(1, 1) * d[1]};
	}

	/**
	 * Jacobian of the pixel coordinates with respect to the world ones, used to convert
	 * position gradients between pixel and world units
	 * @return [pixel][world]
	 */
	public double [][] getPixelPerWorld() {
		return cd_inv.getArrayCopy();
	}

	public double [] getCrpix() {
		return crpix.clone();
	}

	public double [] getCrval() {
		return crval.clone();
	}

	public double [][] getCD() {
		return cd.getArrayCopy();
	}
}

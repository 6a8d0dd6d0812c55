/**
 **
 ** Image.java - one band image with its sky mapping, noise model and PSF
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Image.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.celeste.params.ParameterLayout;

/**
 * Read-only band image. Pixels are stored line-scan (index = h * W + w).
 * Noise model: sky background epsilon (nMgy per pixel) and calibration
 * iota (counts per nMgy, per image row); background counts iota*epsilon are
 * Poisson distributed.
 */
public class Image {
	public final int              H;
	public final int              W;
	public final int              band;
	public final String           name;
	private final double []       pixels;
	private final double []       epsilon; // [H*W]
	private final double []       iota;    // [H]
	private final WorldCoordinates wcs;
	private final Psf             psf;

	public Image(
			String           name,
			int              H,
			int              W,
			int              band,
			double []        pixels,
			double []        epsilon,
			double []        iota,
			WorldCoordinates wcs,
			Psf              psf) {
		if ((H <= 0) || (W <= 0)) {
			throw new IllegalArgumentException("Image(): invalid size "+W+"x"+H);
		}
		if ((band < 0) || (band >= ParameterLayout.NUM_BANDS)) {
			throw new IllegalArgumentException("Image(): band "+band+" is outside of 0.."+(ParameterLayout.NUM_BANDS - 1));
		}
		if (pixels.length != H * W) {
			throw new IllegalArgumentException("Image(): pixels.length ("+pixels.length+") != H*W ("+(H * W)+")");
		}
		if (epsilon.length != H * W) {
			throw new IllegalArgumentException("Image(): epsilon.length ("+epsilon.length+") != H*W ("+(H * W)+")");
		}
		if (iota.length != H) {
			throw new IllegalArgumentException("Image(): iota.length ("+iota.length+") != H ("+H+")");
		}
		if ((wcs == null) || (psf == null)) {
			throw new IllegalArgumentException("Image(): world coordinates and PSF are required");
		}
		this.name =    (name == null) ? ("band-"+band) : name;
		this.H =       H;
		this.W =       W;
		this.band =    band;
		this.pixels =  pixels.clone();
		this.epsilon = epsilon.clone();
		this.iota =    iota.clone();
		this.wcs =     wcs;
		this.psf =     psf;
	}

	/**
	 * Image with constant sky level and calibration
	 */
	public static Image uniform(
			String           name,
			int              H,
			int              W,
			int              band,
			double []        pixels,
			double           epsilon,
			double           iota,
			WorldCoordinates wcs,
			Psf              psf) {
		double [] eps = new double [H * W];
		double [] io =  new double [H];
		Arrays.fill(eps, epsilon);
		Arrays.fill(io, iota);
		return new Image(name, H, W, band, pixels, eps, io, wcs, psf);
	}

	public double getPixel(int h, int w) {
		return pixels[h * W + w];
	}

	public double getEpsilon(int h, int w) {
		return epsilon[h * W + w];
	}

	public double getIota(int h) {
		return iota[h];
	}

	/**
	 * Standard deviation of the background counts at a pixel
	 */
	public double getNoise(int h, int w) {
		return Math.sqrt(iota[h] * epsilon[h * W + w]);
	}

	public double [] getPixels() {
		return pixels.clone();
	}

	public WorldCoordinates getWcs() {
		return wcs;
	}

	public Psf getPsf() {
		return psf;
	}

	@Override
	public String toString() {
		return name+" ("+W+"x"+H+", band "+band+")";
	}
}

/**
 **
 ** ImagejImageReader.java - band images opened by ImageJ (FITS), with the
 ** world coordinates taken from the FITS header kept in the "Info" property
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImagejImageReader.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.IJ;
import ij.ImagePlus;

public class ImagejImageReader implements ImageSource {
	private static final Logger LOGGER = LoggerFactory.getLogger(ImagejImageReader.class);

	private final String [] paths;
	private final int []    bands;
	private final Psf []    psfs;
	private final double    epsilon;
	private final double    iota;

	/**
	 * @param paths image files ImageJ can open (FITS)
	 * @param bands band of each file
	 * @param psfs PSF of each file
	 * @param epsilon sky level, nMgy (same for all pixels)
	 * @param iota counts per nMgy (same for all rows)
	 */
	public ImagejImageReader(String [] paths, int [] bands, Psf [] psfs, double epsilon, double iota) {
		if ((paths.length != bands.length) || (paths.length != psfs.length)) {
			throw new IllegalArgumentException("ImagejImageReader(): paths.length ("+paths.length+"), bands.length ("+
					bands.length+") and psfs.length ("+psfs.length+") differ");
		}
		this.paths =   paths.clone();
		this.bands =   bands.clone();
		this.psfs =    psfs.clone();
		this.epsilon = epsilon;
		this.iota =    iota;
	}

	@Override
	public List<Image> loadImages() throws IOException {
		List<Image> images = new ArrayList<Image>();
		for (int i = 0; i < paths.length; i++) {
			LOGGER.info("loadImages(): reading "+paths[i]);
			ImagePlus imp = IJ.openImage(paths[i]);
			if (imp == null) {
				throw new IOException("loadImages(): ImageJ failed to open "+paths[i]);
			}
			images.add(toImage(imp, bands[i], psfs[i], epsilon, iota, true));
		}
		return images;
	}

	/**
	 * Convert an ImageJ image to a band image
	 * @param imp image with the FITS header in its "Info" property
	 * @param band band index
	 * @param psf point-spread function
	 * @param epsilon sky level, nMgy
	 * @param iota counts per nMgy
	 * @param fits_flipped true when ImageJ put the first FITS row at the bottom (FITS reader does)
	 */
	public static Image toImage(
			ImagePlus imp,
			int       band,
			Psf       psf,
			double    epsilon,
			double    iota,
			boolean   fits_flipped) throws IOException {
		Object info = imp.getProperty("Info");
		if (!(info instanceof String)) {
			throw new IOException("toImage(): "+imp.getTitle()+" has no FITS header");
		}
		Map<String, String> header = parseHeader((String) info);
		int W = imp.getWidth();
		int H = imp.getHeight();
		double [] crpix = { // FITS is 1-based
				getKeyword(header, "CRPIX1", imp) - 1.0,
				getKeyword(header, "CRPIX2", imp) - 1.0};
		double [] crval = {
				getKeyword(header, "CRVAL1", imp),
				getKeyword(header, "CRVAL2", imp)};
		double [][] cd = {
				{getKeyword(header, "CD1_1", imp), getKeyword(header, "CD1_2", imp)},
				{getKeyword(header, "CD2_1", imp), getKeyword(header, "CD2_2", imp)}};
		if (fits_flipped) {
			crpix[1] = (H - 1) - crpix[1];
			cd[0][1] = -cd[0][1];
			cd[1][1] = -cd[1][1];
		}
		float [] fpixels = (float []) imp.getProcessor().convertToFloat().getPixels();
		double [] pixels = new double [fpixels.length];
		for (int i = 0; i < pixels.length; i++) {
			pixels[i] = fpixels[i];
		}
		return Image.uniform(
				imp.getTitle(),
				H,
				W,
				band,
				pixels,
				epsilon,
				iota,
				new WorldCoordinates(crpix, crval, cd),
				psf);
	}

	/**
	 * Parse FITS header cards "KEY     = value / comment"
	 */
	public static Map<String, String> parseHeader(String info) {
		Map<String, String> header = new HashMap<String, String>();
		for (String line : info.split("\n")) {
			int eq = line.indexOf('=');
			if (eq <= 0) {
				continue;
			}
			String key = line.substring(0, eq).trim();
			String value = line.substring(eq + 1);
			int slash = value.indexOf('/');
			if ((slash >= 0) && (value.indexOf('\'') < 0)) {
				value = value.substring(0, slash);
			}
			value = value.trim();
			if (value.startsWith("'") && value.endsWith("'") && (value.length() >= 2)) {
				value = value.substring(1, value.length() - 1).trim();
			}
			if (!key.isEmpty()) {
				header.put(key, value);
			}
		}
		return header;
	}

	private static double getKeyword(Map<String, String> header, String key, ImagePlus imp) throws IOException {
		String value = header.get(key);
		if (value == null) {
			throw new IOException("toImage(): "+imp.getTitle()+" is missing "+key);
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IOException("toImage(): "+imp.getTitle()+": invalid "+key+" = "+value, e);
		}
	}
}

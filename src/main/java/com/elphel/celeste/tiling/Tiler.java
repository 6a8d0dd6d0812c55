/**
 **
 ** Tiler.java - splitting band images into tiles and selecting tiles relevant to a source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Tiler.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.celeste.common.TrimmingExhaustedException;
import com.elphel.celeste.images.Image;
import com.elphel.celeste.images.Psf;
import com.elphel.celeste.model.ModelParams;
import com.elphel.celeste.model.SourceFluxes;
import com.elphel.celeste.params.ParameterLayout;

public class Tiler {
	private static final Logger LOGGER = LoggerFactory.getLogger(Tiler.class);

	public static final int    DEFAULT_TILE_WIDTH =  20;
	public static final double FOOTPRINT_SCALES =    3.0; // galaxy footprint beyond the PSF, in e_scale units

	/**
	 * Cover the image with square tiles, the last row and column may be smaller
	 * @param image band image
	 * @param tile_width tile side, pixels
	 * @return tiles in line-scan order, every pixel belongs to exactly one tile
	 */
	public static TiledImage breakIntoTiles(Image image, int tile_width) {
		if (tile_width <= 0) {
			throw new IllegalArgumentException("breakIntoTiles(): tile_width should be positive, got "+tile_width);
		}
		int tilesX = (image.W + tile_width - 1) / tile_width;
		int tilesY = (image.H + tile_width - 1) / tile_width;
		ImageTile [] tiles = new ImageTile [tilesX * tilesY];
		for (int tileY = 0; tileY < tilesY; tileY++) {
			int h0 = tileY * tile_width;
			int height = Math.min(tile_width, image.H - h0);
			for (int tileX = 0; tileX < tilesX; tileX++) {
				int w0 = tileX * tile_width;
				int width = Math.min(tile_width, image.W - w0);
				tiles[tileY * tilesX + tileX] = new ImageTile(image, tileX, tileY, h0, w0, height, width);
			}
		}
		return new TiledImage(image, tile_width, tilesX, tilesY, tiles);
	}

	public static List<TiledImage> breakIntoTiles(List<Image> images, int tile_width) {
		List<TiledImage> tiled_images = new ArrayList<TiledImage>(images.size());
		for (Image image : images) {
			tiled_images.add(breakIntoTiles(image, tile_width));
		}
		return tiled_images;
	}

	public static TrimmedTiles trimSourceTiles(
			int              source,
			ModelParams      mp,
			List<TiledImage> tiled_images,
			double           noise_fraction) throws TrimmingExhaustedException {
		return trimSourceTiles(source, mp, tiled_images, noise_fraction, 0);
	}

	/**
	 * Keep tiles where the source is expected to contribute noticeably. Expected
	 * counts of a pixel are iota * (p_star * F_star * psf + p_gal * F_gal * psf_gal),
	 * where psf_gal is the PSF broadened by e_scale^2. A tile is kept if any of its
	 * pixels has expected counts above noise_fraction * sqrt(iota * epsilon).
	 * @param source source index in mp
	 * @param mp current model parameters (read only)
	 * @param tiled_images all images of the run
	 * @param noise_fraction threshold relative to the background noise
	 * @param debug_level debug level
	 * @return kept tiles, input tiles are not modified
	 * @throws TrimmingExhaustedException no tile of any image is kept
	 */
	public static TrimmedTiles trimSourceTiles(
			int              source,
			ModelParams      mp,
			List<TiledImage> tiled_images,
			double           noise_fraction,
			int              debug_level) throws TrimmingExhaustedException {
		if ((source < 0) || (source >= mp.getNumSources())) {
			throw new IllegalArgumentException("trimSourceTiles(): source index "+source+" is outside of 0.."+(mp.getNumSources() - 1));
		}
		if (!(noise_fraction >= 0)) {
			throw new IllegalArgumentException("trimSourceTiles(): noise_fraction should be non-negative, got "+noise_fraction);
		}
		ParameterLayout layout = mp.getLayout();
		double [] vs = mp.getVp(source);
		double [] world = {vs[layout.index(ParameterLayout.U, 0)], vs[layout.index(ParameterLayout.U, 1)]};
		double e_scale = vs[layout.index(ParameterLayout.E_SCALE)];
		List<List<ImageTile>> kept = new ArrayList<List<ImageTile>>(tiled_images.size());
		int num_kept = 0;
		for (TiledImage tiled_image : tiled_images) {
			Image image = tiled_image.getImage();
			double [] xy = image.getWcs().worldToPixel(world);
			double [] fluxes = SourceFluxes.typeWeightedFlux(layout, vs, image.band); // {star, galaxy}
			Psf psf =     image.getPsf();
			Psf psf_gal = psf.broadened(e_scale * e_scale);
			double footprint = Math.max(psf.supportRadius() + FOOTPRINT_SCALES * e_scale, psf_gal.supportRadius());
			double footprint2 = footprint * footprint;
			List<ImageTile> image_kept = new ArrayList<ImageTile>();
			for (ImageTile tile : tiled_image.getTiles()) {
				if (tile.distance2(xy[0], xy[1]) > footprint2) {
					continue;
				}
				if (isTileVisible(tile, xy, fluxes, psf, psf_gal, noise_fraction)) {
					image_kept.add(tile);
				}
			}
			if (debug_level > 1) {
				LOGGER.debug("trimSourceTiles(): source "+source+", "+image+": source at ("+xy[0]+", "+xy[1]+
						"), footprint "+footprint+" pix, kept "+image_kept.size()+" of "+tiled_image.getNumTiles()+" tiles");
			}
			num_kept += image_kept.size();
			kept.add(image_kept);
		}
		if (num_kept == 0) {
			throw new TrimmingExhaustedException(source, "trimSourceTiles(): no tile in "+tiled_images.size()+
					" images is above "+noise_fraction+" of the noise for source "+source);
		}
		return new TrimmedTiles(source, tiled_images, kept);
	}

	private static boolean isTileVisible(
			ImageTile tile,
			double [] xy,
			double [] fluxes,
			Psf       psf,
			Psf       psf_gal,
			double    noise_fraction) {
		Image image = tile.image;
		for (int h = tile.h0; h < (tile.h0 + tile.height); h++) {
			double dy = h - xy[1];
			double iota = image.getIota(h);
			for (int w = tile.w0; w < (tile.w0 + tile.width); w++) {
				double dx = w - xy[0];
				double counts = iota * (fluxes[0] * psf.evaluate(dx, dy) + fluxes[1] * psf_gal.evaluate(dx, dy));
				if (counts > (noise_fraction * image.getNoise(h, w))) {
					return true;
				}
			}
		}
		return false;
	}
}

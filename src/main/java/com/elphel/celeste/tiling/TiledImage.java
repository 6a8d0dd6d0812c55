/**
 **
 ** TiledImage.java - band image broken into a grid of tiles
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TiledImage.java is free software: you can redistribute it and/or modify
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
import java.util.Collections;
import java.util.List;

import com.elphel.celeste.images.Image;

public class TiledImage {
	private final Image       image;
	private final int         tile_width;
	private final int         tilesX;
	private final int         tilesY;
	private final ImageTile[] tiles;   // line-scan order of the tile grid

	TiledImage(Image image, int tile_width, int tilesX, int tilesY, ImageTile[] tiles) {
		this.image =      image;
		this.tile_width = tile_width;
		this.tilesX =     tilesX;
		this.tilesY =     tilesY;
		this.tiles =      tiles;
	}

	public Image getImage() {
		return image;
	}

	public int getTileWidth() {
		return tile_width;
	}

	public int getTilesX() {
		return tilesX;
	}

	public int getTilesY() {
		return tilesY;
	}

	public int getNumTiles() {
		return tiles.length;
	}

	/**
	 * @return tile at grid position, null if outside of the grid
	 */
	public ImageTile getTile(int tileX, int tileY) {
		if ((tileX < 0) || (tileY < 0) || (tileX >= tilesX) || (tileY >= tilesY)) return null;
		return tiles[tileY * tilesX + tileX];
	}

	public List<ImageTile> getTiles() {
		List<ImageTile> list = new ArrayList<ImageTile>(tiles.length);
		Collections.addAll(list, tiles);
		return Collections.unmodifiableList(list);
	}

	/**
	 * @return tile containing the pixel
	 */
	public ImageTile getTileOf(int h, int w) {
		return getTile(w / tile_width, h / tile_width);
	}
}

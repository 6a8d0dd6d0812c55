/**
 **
 ** TrimmedTiles.java - tiles relevant to one source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrimmedTiles.java is free software: you can redistribute it and/or modify
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

/**
 * Per-image subsets of tiles kept for a source. Images keep their order
 * in the tiled image list, images without any kept tile have empty lists.
 */
public class TrimmedTiles {
	private final int                   source;
	private final List<TiledImage>      tiled_images;
	private final List<List<ImageTile>> kept;

	TrimmedTiles(int source, List<TiledImage> tiled_images, List<List<ImageTile>> kept) {
		this.source = source;
		this.tiled_images = Collections.unmodifiableList(new ArrayList<TiledImage>(tiled_images));
		List<List<ImageTile>> k = new ArrayList<List<ImageTile>>(kept.size());
		for (List<ImageTile> l : kept) {
			k.add(Collections.unmodifiableList(new ArrayList<ImageTile>(l)));
		}
		this.kept = Collections.unmodifiableList(k);
	}

	public int getSource() {
		return source;
	}

	public int getNumImages() {
		return kept.size();
	}

	public TiledImage getTiledImage(int nimg) {
		return tiled_images.get(nimg);
	}

	public List<ImageTile> getTiles(int nimg) {
		return kept.get(nimg);
	}

	public int getNumTiles() {
		int n = 0;
		for (List<ImageTile> l : kept) {
			n += l.size();
		}
		return n;
	}

	public boolean isEmpty() {
		return getNumTiles() == 0;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("TrimmedTiles for source "+source+":");
		for (int nimg = 0; nimg < kept.size(); nimg++) {
			sb.append(" "+kept.get(nimg).size()+"/"+tiled_images.get(nimg).getNumTiles());
		}
		return sb.toString();
	}
}

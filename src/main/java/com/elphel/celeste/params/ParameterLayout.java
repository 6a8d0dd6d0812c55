/**
 **
 ** ParameterLayout.java - named blocks of the per-source variational parameter
 ** vector and the transform of each block
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParameterLayout.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.elphel.celeste.params.ParameterTransform.Kind;

/**
 * Immutable description of the per-source parameter vector: block name -&gt; offset,
 * size and transform. The same instance is shared by every source vector of a run
 * and is passed explicitly to the transforms and the optimizer.
 */
public class ParameterLayout {
	public static final String U =       "u";       // position, world coordinates (ra, dec)
	public static final String E_DEV =   "e_dev";   // de Vaucouleurs mixing fraction
	public static final String E_AXIS =  "e_axis";  // axis ratio
	public static final String E_ANGLE = "e_angle"; // position angle
	public static final String E_SCALE = "e_scale"; // scale radius
	public static final String R1 =      "r1";      // log-flux location, {star, galaxy}
	public static final String R2 =      "r2";      // log-flux scale,    {star, galaxy}
	public static final String C1 =      "c1";      // log color ratio location [type][color]
	public static final String C2 =      "c2";      // log color ratio scale    [type][color]
	public static final String A =       "a";       // {star, galaxy} probabilities

	public static final int    NUM_TYPES =  2; // star, galaxy
	public static final int    NUM_COLORS = 4; // ug, gr, ri, iz
	public static final int    NUM_BANDS =  5; // u, g, r, i, z
	public static final int    TYPE_STAR =  0;
	public static final int    TYPE_GAL =   1;

	/** Degrees of position per free unit (free position is in arcseconds). */
	public static final double POSITION_SCALE = 1.0 / 3600;

	public static final ParameterLayout CELESTE = celeste(POSITION_SCALE);

	public static class Block {
		public final String name;
		public final int    offset;      // in the constrained vector
		public final int    size;        // constrained size
		public final int    free_offset; // in the free vector
		public final Kind   kind;
		public final double scale;       // LINEAR only

		Block(String name, int offset, int size, int free_offset, Kind kind, double scale) {
			this.name =        name;
			this.offset =      offset;
			this.size =        size;
			this.free_offset = free_offset;
			this.kind =        kind;
			this.scale =       scale;
		}

		public int getFreeSize() {
			return ParameterTransform.freeSize(kind, size);
		}

		@Override
		public String toString() {
			return String.format("%-8s [%2d..%2d] -> free [%2d..%2d] %s", name, offset, offset + size - 1,
					free_offset, free_offset + getFreeSize() - 1,
					(kind == Kind.LINEAR) ? (kind + "(" + scale + ")") : kind.toString());
		}
	}

	private final List<Block>        blocks;
	private final Map<String, Block> by_name;
	private final int                size;
	private final int                free_size;
	private final String []          param_names; // per constrained index

	private ParameterLayout(List<Block> blocks) {
		this.blocks = Collections.unmodifiableList(new ArrayList<Block>(blocks));
		Map<String, Block> map = new LinkedHashMap<String, Block>();
		int n = 0, nf = 0;
		for (Block b : blocks) {
			map.put(b.name, b);
			n += b.size;
			nf += b.getFreeSize();
		}
		this.by_name = Collections.unmodifiableMap(map);
		this.size = n;
		this.free_size = nf;
		param_names = new String [n];
		for (Block b : blocks) {
			for (int i = 0; i < b.size; i++) {
				param_names[b.offset + i] = (b.size == 1) ? b.name : (b.name + "[" + i + "]");
			}
		}
	}

	/**
	 * Default layout:
	 * u(2), e_dev, e_axis, e_angle, e_scale, r1(2), r2(2), c1(4x2), c2(4x2), a(2)
	 * @param position_scale degrees per free position unit
	 */
	public static ParameterLayout celeste(double position_scale) {
		return new Builder()
				.add(U,       2,                      Kind.LINEAR, position_scale)
				.add(E_DEV,   1,                      Kind.LOGIT)
				.add(E_AXIS,  1,                      Kind.LOGIT)
				.add(E_ANGLE, 1,                      Kind.IDENTITY)
				.add(E_SCALE, 1,                      Kind.POSITIVE)
				.add(R1,      NUM_TYPES,              Kind.IDENTITY)
				.add(R2,      NUM_TYPES,              Kind.POSITIVE)
				.add(C1,      NUM_COLORS * NUM_TYPES, Kind.IDENTITY)
				.add(C2,      NUM_COLORS * NUM_TYPES, Kind.POSITIVE)
				.add(A,       NUM_TYPES,              Kind.SIMPLEX)
				.build();
	}

	public static class Builder {
		private final List<Block> blocks = new ArrayList<Block>();
		private int offset =      0;
		private int free_offset = 0;

		public Builder add(String name, int size, Kind kind) {
			return add(name, size, kind, 1.0);
		}

		public Builder add(String name, int size, Kind kind, double scale) {
			if (size < 1) {
				throw new IllegalArgumentException("add(): block "+name+" has size "+size);
			}
			if ((kind == Kind.SIMPLEX) && (size < 2)) {
				throw new IllegalArgumentException("add(): simplex block "+name+" needs at least 2 components");
			}
			if ((kind == Kind.LINEAR) && ((scale == 0.0) || Double.isNaN(scale) || Double.isInfinite(scale))) {
				throw new IllegalArgumentException("add(): linear block "+name+" has invalid scale "+scale);
			}
			for (Block b : blocks) {
				if (b.name.equals(name)) {
					throw new IllegalArgumentException("add(): duplicate block name "+name);
				}
			}
			Block block = new Block(name, offset, size, free_offset, kind, scale);
			blocks.add(block);
			offset +=      size;
			free_offset += block.getFreeSize();
			return this;
		}

		public ParameterLayout build() {
			if (blocks.isEmpty()) {
				throw new IllegalStateException("build(): no blocks defined");
			}
			return new ParameterLayout(blocks);
		}
	}

	public int size() {
		return size;
	}

	public int freeSize() {
		return free_size;
	}

	public List<Block> getBlocks() {
		return blocks;
	}

	public Block getBlock(String name) {
		Block b = by_name.get(name);
		if (b == null) {
			throw new IllegalArgumentException("getBlock(): no block named "+name);
		}
		return b;
	}

	public boolean hasBlock(String name) {
		return by_name.containsKey(name);
	}

	/**
	 * Index of a block element in the constrained vector
	 * @param name block name
	 * @param i element in the block
	 * @return offset in the per-source vector
	 */
	public int index(String name, int i) {
		Block b = getBlock(name);
		if ((i < 0) || (i >= b.size)) {
			throw new IllegalArgumentException("index(): element "+i+" is outside of block "+name+" of size "+b.size);
		}
		return b.offset + i;
	}

	public int index(String name) {
		return index(name, 0);
	}

	/**
	 * Color parameter index, c1/c2 blocks are stored type-major
	 * @param name C1 or C2
	 * @param color color index 0..3 (ug, gr, ri, iz)
	 * @param type TYPE_STAR or TYPE_GAL
	 */
	public int colorIndex(String name, int color, int type) {
		return index(name, type * NUM_COLORS + color);
	}

	public String getParamName(int indx) {
		return param_names[indx];
	}

	public String [] getParamNames() {
		return param_names.clone();
	}

	public void checkVector(double [] vs, String caller) {
		if (vs == null) {
			throw new IllegalArgumentException(caller+": parameter vector is null");
		}
		if (vs.length != size) {
			throw new IllegalArgumentException(caller+": vector length ("+vs.length+") != layout size ("+size+")");
		}
	}

	public String [] printLayout() {
		String [] lines = new String [blocks.size()];
		for (int i = 0; i < lines.length; i++) {
			lines[i] = blocks.get(i).toString();
		}
		return lines;
	}
}

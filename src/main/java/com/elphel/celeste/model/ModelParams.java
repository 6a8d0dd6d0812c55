/**
 **
 ** ModelParams.java - variational parameter vectors of all sources and the
 ** set of sources being optimized
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ModelParams.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.model;

import java.util.Arrays;

import com.elphel.celeste.params.ParameterLayout;

public class ModelParams {
	private final ParameterLayout layout;
	private final double [][]     vp;             // [source][layout.size()]
	private int []                active_sources; // indices into vp

	/**
	 * @param layout per-source vector layout
	 * @param vp initial vectors, copied
	 */
	public ModelParams(ParameterLayout layout, double [][] vp) {
		this.layout = layout;
		this.vp = new double [vp.length][];
		for (int s = 0; s < vp.length; s++) {
			layout.checkVector(vp[s], "ModelParams()");
			this.vp[s] = vp[s].clone();
		}
		this.active_sources = new int [0];
	}

	/**
	 * Deep copy: the copy can be modified (vectors and active set) without
	 * affecting this instance
	 */
	public ModelParams copy() {
		ModelParams mp = new ModelParams(layout, vp);
		mp.active_sources = active_sources.clone();
		return mp;
	}

	public ParameterLayout getLayout() {
		return layout;
	}

	public int getNumSources() {
		return vp.length;
	}

	/**
	 * @param s source index
	 * @return live per-source vector, modifications are visible to the model
	 */
	public double [] getVp(int s) {
		return vp[s];
	}

	public double [] getVpCopy(int s) {
		return vp[s].clone();
	}

	public void setVp(int s, double [] vs) {
		layout.checkVector(vs, "setVp()");
		System.arraycopy(vs, 0, vp[s], 0, vs.length);
	}

	public int [] getActiveSources() {
		return active_sources.clone();
	}

	public int getNumActive() {
		return active_sources.length;
	}

	public int getActiveSource(int i) {
		return active_sources[i];
	}

	/**
	 * Select sources that are optimized jointly
	 * @param sources distinct valid source indices
	 */
	public void setActiveSources(int ... sources) {
		boolean [] used = new boolean [vp.length];
		for (int s : sources) {
			if ((s < 0) || (s >= vp.length)) {
				throw new IllegalArgumentException("setActiveSources(): source index "+s+" is outside of 0.."+(vp.length - 1));
			}
			if (used[s]) {
				throw new IllegalArgumentException("setActiveSources(): duplicate source index "+s);
			}
			used[s] = true;
		}
		this.active_sources = sources.clone();
	}

	public double getParameter(int s, String name, int i) {
		return vp[s][layout.index(name, i)];
	}

	@Override
	public String toString() {
		return "ModelParams: "+vp.length+" sources, active="+Arrays.toString(active_sources);
	}
}

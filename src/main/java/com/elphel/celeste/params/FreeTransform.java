/**
 **
 ** FreeTransform.java - block-wise conversion of whole per-source vectors
 ** between constrained and free parameterization
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FreeTransform.java is free software: you can redistribute it and/or modify
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

import com.elphel.celeste.params.ParameterLayout.Block;

public class FreeTransform {
	private final ParameterLayout layout;

	public FreeTransform(ParameterLayout layout) {
		this.layout = layout;
	}

	public ParameterLayout getLayout() {
		return layout;
	}

	/**
	 * Constrained per-source vector to the free one
	 * @param vs constrained vector, layout.size() long
	 * @return free vector, layout.freeSize() long
	 * @throws TransformException if a block violates its constraint
	 */
	public double [] toFree(double [] vs) {
		if (vs.length != layout.size()) {
			throw new TransformException("toFree(): vector length ("+vs.length+") != layout size ("+layout.size()+")");
		}
		double [] free = new double [layout.freeSize()];
		for (Block b : layout.getBlocks()) {
			switch (b.kind) {
			case SIMPLEX:
				try {
					ParameterTransform.simplexToFree(vs, b.offset, free, b.free_offset, b.size);
				} catch (TransformException e) {
					throw new TransformException("toFree(): block "+b.name+": "+e.getMessage());
				}
				break;
			default:
				for (int i = 0; i < b.size; i++) {
					free[b.free_offset + i] = scalarToFree(b, vs[b.offset + i]);
				}
			}
		}
		return free;
	}

	/**
	 * Free vector to the constrained one
	 * @param free free vector, layout.freeSize() long
	 * @param vs output constrained vector (only transformed values are overwritten, all are)
	 */
	public void toConstrained(double [] free, double [] vs) {
		if (free.length != layout.freeSize()) {
			throw new TransformException("toConstrained(): free vector length ("+free.length+") != free size ("+layout.freeSize()+")");
		}
		if (vs.length != layout.size()) {
			throw new TransformException("toConstrained(): vector length ("+vs.length+") != layout size ("+layout.size()+")");
		}
		for (Block b : layout.getBlocks()) {
			switch (b.kind) {
			case SIMPLEX:
				ParameterTransform.simplexToConstrained(free, b.free_offset, vs, b.offset, b.size);
				break;
			default:
				for (int i = 0; i < b.size; i++) {
					vs[b.offset + i] = scalarToConstrained(b, free[b.free_offset + i]);
				}
			}
		}
	}

	public double [] toConstrained(double [] free) {
		double [] vs = new double [layout.size()];
		toConstrained(free, vs);
		return vs;
	}

	/**
	 * Chain rule: gradient with respect to the constrained values to the gradient
	 * with respect to the free ones.
	 * @param vs constrained vector at which the gradient was evaluated
	 * @param dfdz gradient with respect to vs
	 * @return gradient with respect to the free vector
	 * @throws TransformException if vs violates a block constraint
	 */
	public double [] freeGradient(double [] vs, double [] dfdz) {
		if (dfdz.length != layout.size()) {
			throw new TransformException("freeGradient(): gradient length ("+dfdz.length+") != layout size ("+layout.size()+")");
		}
		if (vs.length != layout.size()) {
			throw new TransformException("freeGradient(): vector length ("+vs.length+") != layout size ("+layout.size()+")");
		}
		double [] dfdr = new double [layout.freeSize()];
		for (Block b : layout.getBlocks()) {
			switch (b.kind) {
			case SIMPLEX:
				try {
					ParameterTransform.simplexGradient(vs, b.offset, dfdz, b.offset, dfdr, b.free_offset, b.size);
				} catch (TransformException e) {
					throw new TransformException("freeGradient(): block "+b.name+": "+e.getMessage());
				}
				break;
			default:
				for (int i = 0; i < b.size; i++) {
					dfdr[b.free_offset + i] = scalarGradient(b, vs[b.offset + i], dfdz[b.offset + i]);
				}
			}
		}
		return dfdr;
	}

	/**
	 * Free-vector names, for diagnostics. Simplex blocks lose their last component.
	 */
	public String [] getFreeNames() {
		String [] names = new String [layout.freeSize()];
		for (Block b : layout.getBlocks()) {
			int nf = b.getFreeSize();
			for (int i = 0; i < nf; i++) {
				String base = (b.size == 1) ? b.name : (b.name + "[" + i + "]");
				switch (b.kind) {
				case SIMPLEX:  names[b.free_offset + i] = "log_ratio("+base+")"; break;
				case LOGIT:    names[b.free_offset + i] = "logit("+base+")";     break;
				case POSITIVE: names[b.free_offset + i] = "log("+base+")";       break;
				case LINEAR:   names[b.free_offset + i] = base+"/"+b.scale;      break;
				default:       names[b.free_offset + i] = base;
				}
			}
		}
		return names;
	}

	private static double scalarToFree(Block b, double x) {
		try {
			switch (b.kind) {
			case LOGIT:    return ParameterTransform.logitToFree(x);
			case POSITIVE: return ParameterTransform.positiveToFree(x);
			case LINEAR:   return ParameterTransform.linearToFree(x, b.scale);
			default:       return x;
			}
		} catch (TransformException e) {
			throw new TransformException("toFree(): block "+b.name+": "+e.getMessage());
		}
	}

	private static double scalarToConstrained(Block b, double r) {
		switch (b.kind) {
		case LOGIT:    return ParameterTransform.logitToConstrained(r);
		case POSITIVE: return ParameterTransform.positiveToConstrained(r);
		case LINEAR:   return ParameterTransform.linearToConstrained(r, b.scale);
		default:       return r;
		}
	}

	private static double scalarGradient(Block b, double x, double dfdx) {
		try {
			switch (b.kind) {
			case LOGIT:    return ParameterTransform.logitGradient(x, dfdx);
			case POSITIVE: return ParameterTransform.positiveGradient(x, dfdx);
			case LINEAR:   return ParameterTransform.linearGradient(dfdx, b.scale);
			default:       return dfdx;
			}
		} catch (TransformException e) {
			throw new TransformException("freeGradient(): block "+b.name+": "+e.getMessage());
		}
	}
}

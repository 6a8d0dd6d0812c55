/**
 **
 ** SourceFluxes.java - band fluxes implied by the brightness and color parameters
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SourceFluxes.java is free software: you can redistribute it and/or modify
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

import com.elphel.celeste.params.ParameterLayout;

/*
 * Reference band is r (index 2), its log-flux is normal with mean r1 and variance r2.
 * Colors are log ratios of the adjacent bands:
 *   f_r = exp(r1 + r2/2)
 *   f_i = f_r * exp(c1[ri]),  f_z = f_i * exp(c1[iz])
 *   f_g = f_r / exp(c1[gr]),  f_u = f_g / exp(c1[ug])
 */
public class SourceFluxes {
	public static final int REFERENCE_BAND = 2;

	/**
	 * @param layout parameter layout
	 * @param vs constrained per-source vector
	 * @param type ParameterLayout.TYPE_STAR or TYPE_GAL
	 * @return fluxes (nMgy) for bands u, g, r, i, z
	 */
	public static double [] expectedFluxes(ParameterLayout layout, double [] vs, int type) {
		double [] f = new double [ParameterLayout.NUM_BANDS];
		double r1 = vs[layout.index(ParameterLayout.R1, type)];
		double r2 = vs[layout.index(ParameterLayout.R2, type)];
		f[2] = Math.exp(r1 + 0.5 * r2);
		f[3] = f[2] * Math.exp(vs[layout.colorIndex(ParameterLayout.C1, 2, type)]);
		f[4] = f[3] * Math.exp(vs[layout.colorIndex(ParameterLayout.C1, 3, type)]);
		f[1] = f[2] / Math.exp(vs[layout.colorIndex(ParameterLayout.C1, 1, type)]);
		f[0] = f[1] / Math.exp(vs[layout.colorIndex(ParameterLayout.C1, 0, type)]);
		return f;
	}

	/**
	 * Flux in one band, weighted by the type probabilities
	 * @return {star contribution, galaxy contribution}
	 */
	public static double [] typeWeightedFlux(ParameterLayout layout, double [] vs, int band) {
		double p_star = vs[layout.index(ParameterLayout.A, ParameterLayout.TYPE_STAR)];
		double p_gal =  vs[layout.index(ParameterLayout.A, ParameterLayout.TYPE_GAL)];
		return new double [] {
				p_star * expectedFluxes(layout, vs, ParameterLayout.TYPE_STAR)[band],
				p_gal *  expectedFluxes(layout, vs, ParameterLayout.TYPE_GAL)[band]};
	}
}

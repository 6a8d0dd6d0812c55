/**
 **
 ** ModelInit.java - initial variational parameters from catalog entries and
 ** catalog entries from fitted parameters
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ModelInit.java is free software: you can redistribute it and/or modify
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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.celeste.catalog.CatalogEntry;
import com.elphel.celeste.params.ParameterLayout;

public class ModelInit {
	private static final Logger LOGGER = LoggerFactory.getLogger(ModelInit.class);

	public static final double MIN_BRIGHTNESS =  1E-4;
	public static final double INIT_R2 =         1E-3;
	public static final double INIT_C2 =         1E-2;
	public static final double MAX_COLOR =       9.0;
	public static final double ONE_SIDED_COLOR = 3.0;  // only one of the two fluxes is positive
	public static final double SHAPE_MARGIN =    0.015;
	public static final double STAR_AXIS =       0.8;
	public static final double MIN_SCALE =       0.2;
	public static final double STAR_PROB_STAR =  0.8;  // initial P(star) for catalog stars
	public static final double STAR_PROB_GAL =   0.2;  // initial P(star) for catalog galaxies

	/**
	 * Initial per-source vector
	 * @param layout parameter layout (should contain all Celeste blocks)
	 * @param entry catalog entry
	 * @param max_gal_scale upper limit of the initial galaxy scale (Double.POSITIVE_INFINITY - none)
	 * @return constrained vector
	 */
	public static double [] initSource(ParameterLayout layout, CatalogEntry entry, double max_gal_scale) {
		double [] vs = new double [layout.size()];
		double p_star = entry.is_star ? STAR_PROB_STAR : STAR_PROB_GAL;
		vs[layout.index(ParameterLayout.A, ParameterLayout.TYPE_STAR)] = p_star;
		vs[layout.index(ParameterLayout.A, ParameterLayout.TYPE_GAL)] =  1.0 - p_star;
		vs[layout.index(ParameterLayout.U, 0)] = entry.ra;
		vs[layout.index(ParameterLayout.U, 1)] = entry.dec;
		vs[layout.index(ParameterLayout.R1, ParameterLayout.TYPE_STAR)] =
				Math.log(Math.max(MIN_BRIGHTNESS, entry.getStarFlux(SourceFluxes.REFERENCE_BAND)));
		vs[layout.index(ParameterLayout.R1, ParameterLayout.TYPE_GAL)] =
				Math.log(Math.max(MIN_BRIGHTNESS, entry.getGalFlux(SourceFluxes.REFERENCE_BAND)));
		for (int t = 0; t < ParameterLayout.NUM_TYPES; t++) {
			vs[layout.index(ParameterLayout.R2, t)] = INIT_R2;
			double [] fluxes = (t == ParameterLayout.TYPE_STAR) ? entry.getStarFluxes() : entry.getGalFluxes();
			for (int c = 0; c < ParameterLayout.NUM_COLORS; c++) {
				vs[layout.colorIndex(ParameterLayout.C1, c, t)] = getColor(fluxes[c + 1], fluxes[c]);
				vs[layout.colorIndex(ParameterLayout.C2, c, t)] = INIT_C2;
			}
		}
		vs[layout.index(ParameterLayout.E_DEV)] =   clamp(entry.gal_frac_dev, SHAPE_MARGIN, 1.0 - SHAPE_MARGIN);
		vs[layout.index(ParameterLayout.E_AXIS)] =  entry.is_star ? STAR_AXIS : clamp(entry.gal_ab, SHAPE_MARGIN, 1.0 - SHAPE_MARGIN);
		vs[layout.index(ParameterLayout.E_ANGLE)] = entry.gal_angle;
		vs[layout.index(ParameterLayout.E_SCALE)] = entry.is_star ? MIN_SCALE : Math.min(max_gal_scale, Math.max(entry.gal_scale, MIN_SCALE));
		return vs;
	}

	public static ModelParams initializeModelParams(ParameterLayout layout, List<CatalogEntry> catalog, double max_gal_scale) {
		double [][] vp = new double [catalog.size()][];
		for (int s = 0; s < vp.length; s++) {
			vp[s] = initSource(layout, catalog.get(s), max_gal_scale);
		}
		LOGGER.debug("initializeModelParams(): initialized "+vp.length+" sources");
		return new ModelParams(layout, vp);
	}

	/**
	 * Log ratio of adjacent band fluxes, limited to [-9, 9]
	 * @param f_upper flux in the redder band
	 * @param f_lower flux in the bluer band
	 */
	static double getColor(double f_upper, double f_lower) {
		if ((f_upper > 0) && (f_lower > 0)) {
			return clamp(Math.log(f_upper / f_lower), -MAX_COLOR, MAX_COLOR);
		} else if (f_upper > 0) {
			return ONE_SIDED_COLOR;
		} else if (f_lower > 0) {
			return -ONE_SIDED_COLOR;
		}
		return 0.0;
	}

	static double clamp(double v, double min, double max) {
		return Math.min(Math.max(v, min), max);
	}

	/**
	 * Catalog entry describing the fitted source
	 * @param layout parameter layout
	 * @param vs constrained per-source vector
	 * @param objid object id to keep
	 * @param thing_id thing id to keep
	 */
	public static CatalogEntry toCatalogEntry(ParameterLayout layout, double [] vs, String objid, long thing_id) {
		return new CatalogEntry(
				new double [] {vs[layout.index(ParameterLayout.U, 0)], vs[layout.index(ParameterLayout.U, 1)]},
				vs[layout.index(ParameterLayout.A, ParameterLayout.TYPE_STAR)] > 0.5,
				SourceFluxes.expectedFluxes(layout, vs, ParameterLayout.TYPE_STAR),
				SourceFluxes.expectedFluxes(layout, vs, ParameterLayout.TYPE_GAL),
				vs[layout.index(ParameterLayout.E_DEV)],
				vs[layout.index(ParameterLayout.E_AXIS)],
				vs[layout.index(ParameterLayout.E_ANGLE)],
				vs[layout.index(ParameterLayout.E_SCALE)],
				objid,
				thing_id);
	}
}

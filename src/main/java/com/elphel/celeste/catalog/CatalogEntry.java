/**
 **
 ** CatalogEntry.java - one detected source of an input catalog
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CatalogEntry.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.catalog;

import java.util.Arrays;

import com.elphel.celeste.params.ParameterLayout;

public final class CatalogEntry {
	public final double   ra;
	public final double   dec;
	public final boolean  is_star;
	private final double [] star_fluxes; // nMgy, bands u,g,r,i,z
	private final double [] gal_fluxes;
	public final double   gal_frac_dev;  // de Vaucouleurs fraction
	public final double   gal_ab;        // axis ratio
	public final double   gal_angle;     // position angle, radians
	public final double   gal_scale;     // scale radius, pixels
	public final String   objid;
	public final long     thing_id;

	public CatalogEntry(
			double [] pos,
			boolean   is_star,
			double [] star_fluxes,
			double [] gal_fluxes,
			double    gal_frac_dev,
			double    gal_ab,
			double    gal_angle,
			double    gal_scale,
			String    objid,
			long      thing_id) {
		if ((pos == null) || (pos.length != 2)) {
			throw new IllegalArgumentException("CatalogEntry(): position should have 2 elements");
		}
		if ((star_fluxes == null) || (star_fluxes.length != ParameterLayout.NUM_BANDS)) {
			throw new IllegalArgumentException("CatalogEntry(): star_fluxes should have "+ParameterLayout.NUM_BANDS+" elements");
		}
		if ((gal_fluxes == null) || (gal_fluxes.length != ParameterLayout.NUM_BANDS)) {
			throw new IllegalArgumentException("CatalogEntry(): gal_fluxes should have "+ParameterLayout.NUM_BANDS+" elements");
		}
		this.ra =           pos[0];
		this.dec =          pos[1];
		this.is_star =      is_star;
		this.star_fluxes =  star_fluxes.clone();
		this.gal_fluxes =   gal_fluxes.clone();
		this.gal_frac_dev = gal_frac_dev;
		this.gal_ab =       gal_ab;
		this.gal_angle =    gal_angle;
		this.gal_scale =    gal_scale;
		this.objid =        (objid == null) ? "" : objid;
		this.thing_id =     thing_id;
	}

	public double [] getPos() {
		return new double [] {ra, dec};
	}

	public double [] getStarFluxes() {
		return star_fluxes.clone();
	}

	public double [] getGalFluxes() {
		return gal_fluxes.clone();
	}

	public double getStarFlux(int band) {
		return star_fluxes[band];
	}

	public double getGalFlux(int band) {
		return gal_fluxes[band];
	}

	public double getMaxStarFlux() {
		double m = Double.NEGATIVE_INFINITY;
		for (double f : star_fluxes) {
			if (f > m) m = f;
		}
		return m;
	}

	public boolean isInBox(double ra_min, double ra_max, double dec_min, double dec_max) {
		return (ra_min < ra) && (ra < ra_max) && (dec_min < dec) && (dec < dec_max);
	}

	@Override
	public String toString() {
		return String.format("objid=%s thing_id=%d ra=%.6f dec=%.6f %s star=%s gal=%s",
				objid, thing_id, ra, dec, is_star ? "star" : "galaxy",
				Arrays.toString(star_fluxes), Arrays.toString(gal_fluxes));
	}
}

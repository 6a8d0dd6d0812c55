/**
 **
 ** CatalogUtils.java - magnitudes, colors, merging and matching of catalogs
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CatalogUtils.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.celeste.common.NoMatchFoundException;

public class CatalogUtils {
	private static final Logger LOGGER = LoggerFactory.getLogger(CatalogUtils.class);

	public static final double ARCSEC_PER_PIXEL = 0.396; // SDSS
	public static final double MAG_ZEROPOINT =    22.5;  // nanomaggies
	public static final long   NO_THING_ID =      -1;    // cross-matching failed

	public static double magToFlux(double m) {
		return Math.pow(10.0, 0.4 * (MAG_ZEROPOINT - m));
	}

	public static double fluxToMag(double nm) {
		return (nm > 0) ? (MAG_ZEROPOINT - 2.5 * Math.log10(nm)) : Double.NaN;
	}

	/**
	 * Color mag(f1) - mag(f2) for the same zero point
	 * @return color or NaN if either flux is not positive
	 */
	public static double fluxesToColor(double f1, double f2) {
		if ((f1 <= 0.0) || (f2 <= 0.0)) {
			return Double.NaN;
		}
		return -2.5 * Math.log10(f1 / f2);
	}

	/**
	 * Small-distance approximation of the angular distance, converted to pixels.
	 * Not valid near the poles and across the RA wrap.
	 * @param ra1 degrees
	 * @param dec1 degrees
	 * @param ra2 degrees
	 * @param dec2 degrees
	 * @return distance in pixels
	 */
	public static double dist(double ra1, double dec1, double ra2, double dec2) {
		double ddec = dec2 - dec1;
		double dra =  Math.cos(Math.toRadians(dec1)) * (ra2 - ra1);
		return (3600 / ARCSEC_PER_PIXEL) * Math.sqrt(ddec * ddec + dra * dra);
	}

	/**
	 * Find first position within maxdist of (ra, dec)
	 * @param ras candidate right ascensions
	 * @param decs candidate declinations
	 * @param ra target right ascension
	 * @param dec target declination
	 * @param maxdist tolerance, pixels (same units as {@link #dist(double, double, double, double)})
	 * @return index of the first match
	 * @throws NoMatchFoundException if no candidate is close enough
	 */
	public static int matchPosition(
			double [] ras,
			double [] decs,
			double    ra,
			double    dec,
			double    maxdist) throws NoMatchFoundException {
		if (ras.length != decs.length) {
			throw new IllegalArgumentException("matchPosition(): ras.length ("+ras.length+") != decs.length ("+decs.length+")");
		}
		for (int i = 0; i < ras.length; i++) {
			if (dist(ra, dec, ras[i], decs[i]) < maxdist) {
				return i;
			}
		}
		throw new NoMatchFoundException(String.format("No source found at %f  %f", ra, dec));
	}

	public static int matchPosition(
			List<CatalogEntry> catalog,
			double             ra,
			double             dec,
			double             maxdist) throws NoMatchFoundException {
		double [] ras =  new double [catalog.size()];
		double [] decs = new double [catalog.size()];
		for (int i = 0; i < ras.length; i++) {
			ras[i] =  catalog.get(i).ra;
			decs[i] = catalog.get(i).dec;
		}
		return matchPosition(ras, decs, ra, dec, maxdist);
	}

	public static CatalogEntry findByObjid(List<CatalogEntry> catalog, String objid) throws NoMatchFoundException {
		for (CatalogEntry entry : catalog) {
			if (entry.objid.equals(objid)) {
				return entry;
			}
		}
		throw new NoMatchFoundException("No source with objid "+objid);
	}

	/**
	 * Join catalogs of overlapping fields. Entries that failed cross-matching
	 * (thing_id == -1) are dropped; the remaining thing ids should be unique.
	 * @param fields per-field catalogs
	 * @return single joined catalog
	 * @throws IllegalStateException on duplicate thing ids
	 */
	public static List<CatalogEntry> mergeCatalogs(List<List<CatalogEntry>> fields) {
		List<CatalogEntry> merged = new ArrayList<CatalogEntry>();
		Set<Long> thing_ids = new HashSet<Long>();
		for (int nfield = 0; nfield < fields.size(); nfield++) {
			int num_kept = 0;
			for (CatalogEntry entry : fields.get(nfield)) {
				if (entry.thing_id == NO_THING_ID) {
					continue;
				}
				if (!thing_ids.add(entry.thing_id)) {
					throw new IllegalStateException("mergeCatalogs(): Found duplicate thing_id "+entry.thing_id+
							" (objid="+entry.objid+") in field "+nfield);
				}
				merged.add(entry);
				num_kept++;
			}
			LOGGER.debug("mergeCatalogs(): field "+nfield+": "+fields.get(nfield).size()+" entries, "+num_kept+" kept");
		}
		return merged;
	}
}

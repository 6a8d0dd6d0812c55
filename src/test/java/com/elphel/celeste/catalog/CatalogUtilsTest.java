/**
 **
 ** CatalogUtilsTest.java - tests of the catalog utilities
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CatalogUtilsTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.elphel.celeste.SyntheticSky;
import com.elphel.celeste.common.NoMatchFoundException;

public class CatalogUtilsTest {

	@Test
	public void testMagnitudes() {
		assertEquals(1.0,  CatalogUtils.magToFlux(22.5), 1E-12);
		assertEquals(10.0, CatalogUtils.magToFlux(20.0), 1E-12);
		assertEquals(20.0, CatalogUtils.fluxToMag(10.0), 1E-12);
		assertTrue(Double.isNaN(CatalogUtils.fluxToMag(0.0)));
		assertEquals(-2.5, CatalogUtils.fluxesToColor(10.0, 1.0), 1E-12);
		assertTrue(Double.isNaN(CatalogUtils.fluxesToColor(-1.0, 1.0)));
	}

	@Test
	public void testDistance() {
		// one pixel along declination
		assertEquals(1.0, CatalogUtils.dist(10.0, 0.0, 10.0, 0.396 / 3600), 1E-9);
		// RA offsets shrink with cos(dec)
		assertEquals(0.5, CatalogUtils.dist(10.0, 60.0, 10.0 + 0.396 / 3600, 60.0), 1E-9);
	}

	@Test
	public void testMatchPosition() throws NoMatchFoundException {
		final double [] ras =  {10.0, 10.001, 10.002};
		final double [] decs = {20.0, 20.0,   20.0};
		assertEquals(1, CatalogUtils.matchPosition(ras, decs, 10.001, 20.0 + 1E-5, 1.0));
		try {
			CatalogUtils.matchPosition(ras, decs, 11.0, 20.0, 1.0);
			fail("far position matched");
		} catch (NoMatchFoundException e) {
			assertTrue(e.getMessage().startsWith("No source found"));
		}
	}

	@Test
	public void testFindByObjid() throws NoMatchFoundException {
		final List<CatalogEntry> catalog = Arrays.asList(
				SyntheticSky.entry(10.0, 20.0, true, 5.0, "a", 1),
				SyntheticSky.entry(10.1, 20.0, true, 5.0, "b", 2));
		assertEquals(2, CatalogUtils.findByObjid(catalog, "b").thing_id);
		assertEquals(0, CatalogUtils.matchPosition(catalog, 10.0, 20.0, 0.5));
	}

	@Test
	public void testMergeDropsUnmatchedEntries() {
		final List<CatalogEntry> field1 = Arrays.asList(
				SyntheticSky.entry(10.0, 20.0, true, 5.0, "a", 1),
				SyntheticSky.entry(10.1, 20.0, true, 5.0, "x", CatalogUtils.NO_THING_ID));
		final List<CatalogEntry> field2 = Arrays.asList(
				SyntheticSky.entry(10.2, 20.0, false, 5.0, "c", 3),
				SyntheticSky.entry(10.3, 20.0, true, 5.0, "y", CatalogUtils.NO_THING_ID));
		final List<CatalogEntry> merged = new ListCatalogSource(field1, field2).loadCatalog();
		assertEquals(2, merged.size());
		assertEquals("a", merged.get(0).objid);
		assertEquals("c", merged.get(1).objid);
	}

	@Test(expected = IllegalStateException.class)
	public void testMergeRejectsDuplicates() {
		final List<CatalogEntry> field1 = Arrays.asList(SyntheticSky.entry(10.0, 20.0, true, 5.0, "a", 7));
		final List<CatalogEntry> field2 = Arrays.asList(SyntheticSky.entry(10.0, 20.0, true, 5.0, "a", 7));
		CatalogUtils.mergeCatalogs(Arrays.asList(field1, field2));
	}

	@Test
	public void testEntryIsImmutable() {
		final double [] fluxes = {1, 2, 3, 4, 5};
		final CatalogEntry entry = new CatalogEntry(new double [] {1.0, 2.0}, true, fluxes, fluxes, 0.5, 0.5, 0.0, 1.0, "o", 9);
		fluxes[2] = 100.0;
		assertEquals(3.0, entry.getStarFlux(2), 0.0);
		entry.getGalFluxes()[2] = 100.0;
		assertEquals(3.0, entry.getGalFlux(2), 0.0);
		assertEquals(5.0, entry.getMaxStarFlux(), 0.0);
		assertTrue(entry.isInBox(0.0, 2.0, 1.0, 3.0));
		assertTrue(!entry.isInBox(1.0, 2.0, 1.0, 3.0));
	}
}

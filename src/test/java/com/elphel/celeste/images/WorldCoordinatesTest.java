/**
 **
 ** WorldCoordinatesTest.java - tests of the linear world coordinates
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WorldCoordinatesTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.images;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class WorldCoordinatesTest {

	@Test
	public void testRoundTrip() {
		final WorldCoordinates wcs = new WorldCoordinates(
				new double [] {100.5, 200.0},
				new double [] {150.0, 2.0},
				new double [][] {{-1.0E-4, 2.0E-6}, {3.0E-6, 1.1E-4}});
		final double [] pixel = {12.25, 345.5};
		final double [] world = wcs.pixelToWorld(pixel);
		assertArrayEquals(pixel, wcs.worldToPixel(world), 1E-8);
		assertArrayEquals(new double [] {100.5, 200.0}, wcs.worldToPixel(new double [] {150.0, 2.0}), 1E-9);
	}

	@Test
	public void testSimple() {
		final WorldCoordinates wcs = WorldCoordinates.simple(new double [] {0.0, 0.0}, new double [] {10.0, 20.0}, 0.396);
		final double [] world = wcs.pixelToWorld(new double [] {1.0, 1.0});
		assertEquals(10.0 - 0.396 / 3600, world[0], 1E-12);
		assertEquals(20.0 + 0.396 / 3600, world[1], 1E-12);
		assertEquals(-3600 / 0.396, wcs.getPixelPerWorld()[0][0], 1E-6);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSingular() {
		new WorldCoordinates(new double [] {0, 0}, new double [] {0, 0}, new double [][] {{1.0, 2.0}, {2.0, 4.0}});
	}
}

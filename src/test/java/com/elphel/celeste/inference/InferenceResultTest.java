/**
 **
 ** InferenceResultTest.java - tests of the fitted source record
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InferenceResultTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.inference;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class InferenceResultTest {

	@Test
	public void testVectorIsNotShared() {
		final double [] vs = {1.0, 2.0, 3.0};
		final InferenceResult result = new InferenceResult("1", 7, 0.5, -0.5, vs, 3, true, -1.0, 0.0, 0.0);
		vs[0] = 100.0;
		assertEquals(1.0, result.getVs()[0], 0.0);
		result.getVs()[1] = 200.0;
		assertArrayEquals(new double [] {1.0, 2.0, 3.0}, result.getVs(), 0.0);
	}
}

/**
 **
 ** ModelParamsTest.java - tests of the model parameter container
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ModelParamsTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import com.elphel.celeste.params.ParameterLayout;
import com.elphel.celeste.params.ParameterTransform.Kind;

public class ModelParamsTest {
	private static final ParameterLayout LAYOUT = new ParameterLayout.Builder()
			.add("x", 2, Kind.IDENTITY)
			.add("p", 2, Kind.SIMPLEX)
			.build();

	@Test
	public void testCopyIsDeep() {
		final ModelParams mp = new ModelParams(LAYOUT, new double [][] {{1, 2, 0.5, 0.5}, {3, 4, 0.1, 0.9}});
		mp.setActiveSources(1);
		final ModelParams copy = mp.copy();
		copy.getVp(1)[0] = 100.0;
		copy.setActiveSources(0);
		assertEquals(3.0, mp.getVp(1)[0], 0.0);
		assertArrayEquals(new int [] {1}, mp.getActiveSources());
		assertArrayEquals(new int [] {0}, copy.getActiveSources());
	}

	@Test
	public void testConstructorCopies() {
		final double [][] vp = {{1, 2, 0.5, 0.5}};
		final ModelParams mp = new ModelParams(LAYOUT, vp);
		vp[0][0] = 7.0;
		assertEquals(1.0, mp.getParameter(0, "x", 0), 0.0);
		mp.setVp(0, new double [] {5, 6, 0.2, 0.8});
		assertEquals(0.8, mp.getParameter(0, "p", 1), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testActiveSourceOutOfRange() {
		new ModelParams(LAYOUT, new double [][] {{1, 2, 0.5, 0.5}}).setActiveSources(1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateActiveSource() {
		new ModelParams(LAYOUT, new double [][] {{1, 2, 0.5, 0.5}, {1, 2, 0.5, 0.5}}).setActiveSources(1, 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongVectorLength() {
		new ModelParams(LAYOUT, new double [][] {{1, 2, 0.5}});
	}
}

/**
 **
 ** FreeTransformTest.java - tests of the block-wise vector transform
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FreeTransformTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class FreeTransformTest {
	private static final ParameterLayout LAYOUT = ParameterLayout.CELESTE;

	static double [] sampleVector() {
		final double [] vs = new double [LAYOUT.size()];
		vs[LAYOUT.index(ParameterLayout.U, 0)] = 0.123;
		vs[LAYOUT.index(ParameterLayout.U, 1)] = -0.456;
		vs[LAYOUT.index(ParameterLayout.E_DEV)] =   0.3;
		vs[LAYOUT.index(ParameterLayout.E_AXIS)] =  0.7;
		vs[LAYOUT.index(ParameterLayout.E_ANGLE)] = 1.1;
		vs[LAYOUT.index(ParameterLayout.E_SCALE)] = 2.5;
		for (int t = 0; t < ParameterLayout.NUM_TYPES; t++) {
			vs[LAYOUT.index(ParameterLayout.R1, t)] = 1.0 + t;
			vs[LAYOUT.index(ParameterLayout.R2, t)] = 0.01 * (t + 1);
			for (int c = 0; c < ParameterLayout.NUM_COLORS; c++) {
				vs[LAYOUT.colorIndex(ParameterLayout.C1, c, t)] = 0.1 * c - 0.2 * t;
				vs[LAYOUT.colorIndex(ParameterLayout.C2, c, t)] = 0.02 + 0.01 * c;
			}
		}
		vs[LAYOUT.index(ParameterLayout.A, 0)] = 0.8;
		vs[LAYOUT.index(ParameterLayout.A, 1)] = 0.2;
		return vs;
	}

	@Test
	public void testRoundTrip() {
		final FreeTransform ft = new FreeTransform(LAYOUT);
		final double [] vs = sampleVector();
		final double [] free = ft.toFree(vs);
		assertEquals(27, free.length);
		assertEquals(0.123 * 3600, free[0], 1E-9);
		assertArrayEquals(vs, ft.toConstrained(free), 1E-12);
	}

	// f(vs) = sum(k_i * vs_i^2)
	private static double f(double [] vs) {
		double s = 0.0;
		for (int i = 0; i < vs.length; i++) {
			s += (1.0 + 0.1 * i) * vs[i] * vs[i];
		}
		return s;
	}

	@Test
	public void testFreeGradientMatchesFiniteDifferences() {
		final FreeTransform ft = new FreeTransform(LAYOUT);
		final double [] vs = sampleVector();
		final double [] dfdz = new double [vs.length];
		for (int i = 0; i < vs.length; i++) {
			dfdz[i] = 2 * (1.0 + 0.1 * i) * vs[i];
		}
		final double [] free = ft.toFree(vs);
		final double [] dfdr = ft.freeGradient(vs, dfdz);
		final String [] names = ft.getFreeNames();
		for (int i = 0; i < free.length; i++) {
			final double eps = 1E-6;
			final double [] fp = free.clone();
			final double [] fm = free.clone();
			fp[i] += eps;
			fm[i] -= eps;
			final double numeric = (f(ft.toConstrained(fp)) - f(ft.toConstrained(fm))) / (2 * eps);
			assertEquals(names[i], numeric, dfdr[i], 1E-6 * Math.max(1.0, Math.abs(numeric)));
		}
	}

	@Test
	public void testInvalidBlockIsReported() {
		final FreeTransform ft = new FreeTransform(LAYOUT);
		final double [] vs = sampleVector();
		vs[LAYOUT.index(ParameterLayout.E_SCALE)] = -1.0;
		try {
			ft.toFree(vs);
			fail("negative scale accepted");
		} catch (TransformException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(ParameterLayout.E_SCALE));
		}
	}

	@Test
	public void testInvalidGradientInputIsReported() {
		final FreeTransform ft = new FreeTransform(LAYOUT);
		final double [] dfdz = new double [LAYOUT.size()];
		final double [] vs = sampleVector();
		vs[LAYOUT.index(ParameterLayout.A, 0)] = 0.9;
		vs[LAYOUT.index(ParameterLayout.A, 1)] = 0.9;
		try {
			ft.freeGradient(vs, dfdz);
			fail("simplex summing to 1.8 accepted");
		} catch (TransformException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("block "+ParameterLayout.A));
		}
		final double [] vs_scale = sampleVector();
		vs_scale[LAYOUT.index(ParameterLayout.E_SCALE)] = -2.0;
		try {
			ft.freeGradient(vs_scale, dfdz);
			fail("negative scale accepted");
		} catch (TransformException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(ParameterLayout.E_SCALE));
		}
		final double [] vs_axis = sampleVector();
		vs_axis[LAYOUT.index(ParameterLayout.E_AXIS)] = 1.2;
		try {
			ft.freeGradient(vs_axis, dfdz);
			fail("axis ratio above 1 accepted");
		} catch (TransformException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(ParameterLayout.E_AXIS));
		}
	}

	@Test(expected = TransformException.class)
	public void testLengthMismatch() {
		new FreeTransform(LAYOUT).toFree(new double [LAYOUT.size() - 1]);
	}

	@Test(expected = TransformException.class)
	public void testSimplexNotSummingToOne() {
		final double [] vs = sampleVector();
		vs[LAYOUT.index(ParameterLayout.A, 1)] = 0.3;
		new FreeTransform(LAYOUT).toFree(vs);
	}
}

/**
 **
 ** InferenceParametersTest.java - tests of the run parameters
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InferenceParametersTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.elphel.celeste.optimize.OptimizerParameters;
import com.elphel.celeste.params.ParameterLayout;

public class InferenceParametersTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testDefaultsResource() throws IOException {
		final InferenceParameters params = InferenceParameters.defaults();
		assertEquals(20, params.tile_width);
		assertEquals(2.0, params.min_flux, 0.0);
		assertEquals(50, params.max_iters);
		assertEquals(0.1, params.noise_fraction, 0.0);
		assertEquals("", params.objid);
		assertEquals(-1000.0, params.ra_min, 0.0);
		assertEquals(1000.0, params.dec_max, 0.0);
		assertTrue(Double.isInfinite(params.max_gal_scale));
		assertEquals(1, params.threads);
		assertEquals(1E-8, params.optimizer.f_rel_tol, 0.0);
		assertEquals(ParameterLayout.POSITION_SCALE, params.optimizer.position_scale, 0.0);
		assertEquals(0, params.optimizer.omitted_ids.length);
	}

	@Test
	public void testPropertiesRoundTrip() {
		final InferenceParameters params = new InferenceParameters();
		params.tile_width = 16;
		params.objid = "1237662226208063541";
		params.threads = 4;
		params.optimizer.g_tol = 1E-5;
		params.optimizer.omitted_ids = new int [] {0, 1};
		final Properties properties = new Properties();
		params.setProperties(InferenceParameters.PREFIX, properties);
		assertEquals("16", properties.getProperty("celeste.tile_width"));
		assertEquals("0,1", properties.getProperty("celeste.optimizer.omitted_ids"));

		final InferenceParameters restored = new InferenceParameters();
		restored.getProperties(InferenceParameters.PREFIX, properties);
		assertEquals(16, restored.tile_width);
		assertEquals("1237662226208063541", restored.objid);
		assertEquals(4, restored.threads);
		assertEquals(1E-5, restored.optimizer.g_tol, 0.0);
		assertArrayEquals(new int [] {0, 1}, restored.optimizer.omitted_ids);
	}

	@Test
	public void testLoadKeepsMissingDefaults() throws IOException {
		final File file = folder.newFile("run.properties");
		final Properties properties = new Properties();
		properties.setProperty("celeste.max_iters", "7");
		properties.setProperty("celeste.optimizer.debug_level", "2");
		try (OutputStream os = new FileOutputStream(file)) {
			properties.store(os, "test");
		}
		final InferenceParameters params = InferenceParameters.load(file);
		assertEquals(7, params.max_iters);
		assertEquals(2, params.optimizer.debug_level);
		assertEquals(20, params.tile_width);
		final OptimizerParameters op = params.getOptimizerParameters();
		assertEquals(7, op.max_iters);
	}

	@Test
	public void testCloneIsIndependent() {
		final InferenceParameters params = new InferenceParameters();
		final InferenceParameters copy = params.clone();
		copy.optimizer.max_step = 1.0;
		copy.optimizer.omitted_ids = new int [] {3};
		assertEquals(10.0, params.optimizer.max_step, 0.0);
		assertEquals(0, params.optimizer.omitted_ids.length);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidTileWidth() {
		final InferenceParameters params = new InferenceParameters();
		params.tile_width = 0;
		params.validate();
	}
}

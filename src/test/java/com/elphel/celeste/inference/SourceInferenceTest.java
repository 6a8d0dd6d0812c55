/**
 **
 ** SourceInferenceTest.java - tests of the per-source inference driver
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SourceInferenceTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.elphel.celeste.SyntheticSky;
import com.elphel.celeste.catalog.CatalogEntry;
import com.elphel.celeste.common.NumericalDivergenceException;
import com.elphel.celeste.images.Image;
import com.elphel.celeste.model.ModelParams;
import com.elphel.celeste.objective.ElboObjective;
import com.elphel.celeste.objective.ElboValue;
import com.elphel.celeste.params.ParameterLayout;
import com.elphel.celeste.tiling.TrimmedTiles;

public class SourceInferenceTest {
	private static final double TARGET_ANGLE = 1.0;

	/**
	 * ELBO = -(e_angle - 1)^2. For the source with the bad thing id either the
	 * value or the e_angle gradient is NaN.
	 */
	private static class AngleObjective implements ElboObjective {
		private final List<CatalogEntry> catalog;
		private final long               bad_thing_id;
		private final boolean            bad_gradient;

		AngleObjective(List<CatalogEntry> catalog, long bad_thing_id, boolean bad_gradient) {
			this.catalog =      catalog;
			this.bad_thing_id = bad_thing_id;
			this.bad_gradient = bad_gradient;
		}

		AngleObjective(List<CatalogEntry> catalog, long bad_thing_id) {
			this(catalog, bad_thing_id, false);
		}

		@Override
		public ElboValue evaluate(TrimmedTiles tiles, ModelParams mp) {
			final ParameterLayout layout = mp.getLayout();
			final int s = mp.getActiveSource(0);
			final double [][] gradient = new double [1][layout.size()];
			final double d = mp.getVp(s)[layout.index(ParameterLayout.E_ANGLE)] - TARGET_ANGLE;
			final boolean bad = catalog.get(s).thing_id == bad_thing_id;
			gradient[0][layout.index(ParameterLayout.E_ANGLE)] = (bad && bad_gradient) ? Double.NaN : -2 * d;
			final double value = (bad && !bad_gradient) ? Double.NaN : -d * d;
			return new ElboValue(value, gradient);
		}
	}

	private static List<CatalogEntry> catalog() {
		final double [][] pixels = {{20, 20}, {50, 20}, {80, 20}, {20, 70}, {60, 70}};
		final List<CatalogEntry> catalog = new ArrayList<CatalogEntry>();
		for (int i = 0; i < pixels.length; i++) {
			final double [] world = SyntheticSky.pixelToWorld(pixels[i][0], pixels[i][1]);
			catalog.add(SyntheticSky.entry(world[0], world[1], true, 10.0, "obj-"+i, 101 + i));
		}
		return catalog;
	}

	private static List<Image> images() {
		return Arrays.asList(SyntheticSky.image(100, 100, 2), SyntheticSky.image(100, 100, 3));
	}

	@Test
	public void testFailingSourceIsSkipped() {
		final List<CatalogEntry> catalog = catalog();
		final Map<Long, InferenceResult> results = SourceInference.infer(
				catalog, images(), new InferenceParameters(), new AngleObjective(catalog, 103));
		assertEquals(Arrays.asList(101L, 102L, 104L, 105L), new ArrayList<Long>(results.keySet()));
		final int angle = ParameterLayout.CELESTE.index(ParameterLayout.E_ANGLE);
		for (InferenceResult result : results.values()) {
			assertTrue(result.converged);
			assertEquals(TARGET_ANGLE, result.getVs()[angle], 1E-6);
			assertEquals(0.0, result.elbo, 1E-10);
			assertTrue((result.init_time >= 0) && (result.fit_time >= 0));
		}
		final InferenceResult first = results.get(101L);
		assertEquals("obj-0", first.objid);
		assertEquals(catalog.get(0).ra, first.ra, 0.0);
		assertEquals(catalog.get(0).dec, first.dec, 0.0);
	}

	@Test
	public void testNonFiniteGradientIsSkipped() {
		final List<CatalogEntry> catalog = catalog();
		final List<SourceOutcome> outcomes = SourceInference.inferAll(
				catalog, images(), new InferenceParameters(), new AngleObjective(catalog, 104, true));
		assertEquals(5, outcomes.size());
		for (int i = 0; i < outcomes.size(); i++) {
			assertEquals(outcomes.get(i).getReason(), i != 3, outcomes.get(i).isSuccess());
		}
		assertEquals(104, outcomes.get(3).thing_id);
		assertTrue(outcomes.get(3).getReason(), outcomes.get(3).getReason().startsWith("NumericalDivergenceException"));
		final NumericalDivergenceException cause = (NumericalDivergenceException) outcomes.get(3).getCause();
		assertEquals(0, cause.getIteration());
	}

	@Test
	public void testOutcomes() {
		final List<CatalogEntry> catalog = catalog();
		final List<SourceOutcome> outcomes = SourceInference.inferAll(
				catalog, images(), new InferenceParameters(), new AngleObjective(catalog, 103));
		assertEquals(5, outcomes.size());
		final SourceOutcome failed = outcomes.get(2);
		assertFalse(failed.isSuccess());
		assertEquals(103, failed.thing_id);
		assertEquals("obj-2", failed.objid);
		assertTrue(failed.getReason(), failed.getReason().startsWith("NumericalDivergenceException"));
		assertTrue(outcomes.get(4).isSuccess());
	}

	@Test
	public void testMultiThreaded() {
		final List<CatalogEntry> catalog = catalog();
		final InferenceParameters params = new InferenceParameters();
		params.threads = 3;
		final Map<Long, InferenceResult> results = SourceInference.infer(
				catalog, images(), params, new AngleObjective(catalog, 105));
		assertEquals(Arrays.asList(101L, 102L, 103L, 104L), new ArrayList<Long>(results.keySet()));
	}

	@Test
	public void testWorkerTerminatedByError() {
		final List<CatalogEntry> catalog = catalog();
		final InferenceParameters params = new InferenceParameters();
		params.threads = 2;
		final ElboObjective objective = new AngleObjective(catalog, -5) {
			@Override
			public ElboValue evaluate(TrimmedTiles tiles, ModelParams mp) {
				if (catalog.get(mp.getActiveSource(0)).thing_id == 103) {
					throw new AssertionError("objective failure");
				}
				return super.evaluate(tiles, mp);
			}
		};
		final List<SourceOutcome> outcomes = SourceInference.inferAll(catalog, images(), params, objective);
		assertEquals(5, outcomes.size());
		assertFalse(outcomes.get(2).isSuccess());
		assertEquals(103, outcomes.get(2).thing_id);
		assertTrue(outcomes.get(2).getReason(), outcomes.get(2).getReason().startsWith("IllegalStateException"));
		assertTrue(outcomes.get(0).isSuccess());
		assertTrue(outcomes.get(1).isSuccess());
		// with a single CPU the remaining sources die with the only worker
		for (int i = 3; i < outcomes.size(); i++) {
			assertTrue(outcomes.get(i).isSuccess() || outcomes.get(i).getReason().startsWith("IllegalStateException"));
		}
	}

	@Test
	public void testSourceOutsideOfImagesFails() {
		final List<CatalogEntry> catalog = catalog();
		final double [] world = SyntheticSky.pixelToWorld(1000, 1000);
		catalog.add(SyntheticSky.entry(world[0], world[1], true, 10.0, "far", 200));
		final List<SourceOutcome> outcomes = SourceInference.inferAll(
				catalog, images(), new InferenceParameters(), new AngleObjective(catalog, -5));
		assertEquals(6, outcomes.size());
		assertTrue(outcomes.get(4).isSuccess());
		assertTrue(outcomes.get(5).getReason(), outcomes.get(5).getReason().startsWith("TrimmingExhaustedException"));
	}

	@Test
	public void testPreFilters() {
		final List<CatalogEntry> catalog = catalog();
		final double [] world = SyntheticSky.pixelToWorld(50, 50);
		catalog.add(1, SyntheticSky.entry(world[0], world[1], true, 1.0, "faint", 300));

		final InferenceParameters params = new InferenceParameters();
		List<CatalogEntry> bright = SourceInference.filterByFlux(catalog, params.min_flux);
		assertEquals(5, bright.size());
		assertEquals(5, SourceInference.selectTargets(bright, params).length);

		params.objid = "obj-3";
		assertEquals(Arrays.toString(new int [] {3}), Arrays.toString(SourceInference.selectTargets(bright, params)));

		params.objid = "";
		final double [] corner = SyntheticSky.pixelToWorld(40, 40); // ra decreases with x, dec increases with y
		params.ra_max =  corner[0];
		params.dec_min = corner[1];
		// x > 40 and y > 40: the source at (60, 70)
		assertEquals(Arrays.toString(new int [] {4}), Arrays.toString(SourceInference.selectTargets(bright, params)));
	}

	@Test
	public void testNoTargets() {
		final List<CatalogEntry> catalog = catalog();
		final InferenceParameters params = new InferenceParameters();
		params.objid = "missing";
		assertTrue(SourceInference.infer(catalog, images(), params, new AngleObjective(catalog, -5)).isEmpty());
	}

	@Test(expected = IllegalStateException.class)
	public void testDuplicateThingIds() {
		final List<CatalogEntry> catalog = catalog();
		catalog.add(catalog.get(0));
		SourceInference.infer(catalog, images(), new InferenceParameters(), new AngleObjective(catalog, -5));
	}
}

/**
 **
 ** SourceInference.java - per-source optimization of the catalog sources
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SourceInference.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.celeste.catalog.CatalogEntry;
import com.elphel.celeste.catalog.CatalogSource;
import com.elphel.celeste.common.CelesteException;
import com.elphel.celeste.common.MultiThreading;
import com.elphel.celeste.images.Image;
import com.elphel.celeste.images.ImageSource;
import com.elphel.celeste.model.ModelInit;
import com.elphel.celeste.model.ModelParams;
import com.elphel.celeste.objective.ElboObjective;
import com.elphel.celeste.optimize.ElboMaximizer;
import com.elphel.celeste.optimize.OptimizationResult;
import com.elphel.celeste.optimize.OptimizerParameters;
import com.elphel.celeste.params.ParameterLayout;
import com.elphel.celeste.tiling.Tiler;
import com.elphel.celeste.tiling.TiledImage;
import com.elphel.celeste.tiling.TrimmedTiles;

/**
 * Fits every selected catalog source separately: the source is the only
 * active one, all other sources keep their initial parameters. Failures of
 * individual sources are logged and skipped.
 */
public class SourceInference {
	private static final Logger LOGGER = LoggerFactory.getLogger(SourceInference.class);

	/**
	 * @return fitted sources keyed by thing_id, failed sources are omitted
	 */
	public static Map<Long, InferenceResult> infer(
			List<CatalogEntry>  catalog,
			List<Image>         images,
			InferenceParameters params,
			ElboObjective       objective) {
		Map<Long, InferenceResult> results = new TreeMap<Long, InferenceResult>();
		for (SourceOutcome outcome : inferAll(catalog, images, params, objective)) {
			if (outcome.isSuccess()) {
				results.put(outcome.thing_id, outcome.getResult());
			}
		}
		return results;
	}

	public static Map<Long, InferenceResult> infer(
			CatalogSource       catalog_source,
			ImageSource         image_source,
			InferenceParameters params,
			ElboObjective       objective) throws IOException {
		List<CatalogEntry> catalog = catalog_source.loadCatalog();
		LOGGER.info("infer(): "+catalog.size()+" catalog sources");
		return infer(catalog, image_source.loadImages(), params, objective);
	}

	/**
	 * @return outcomes of all target sources in catalog order, successes and failures
	 */
	public static List<SourceOutcome> inferAll(
			List<CatalogEntry>  catalog,
			List<Image>         images,
			InferenceParameters params,
			final ElboObjective objective) {
		params.validate();
		final int debug_level = params.debug_level;
		final List<CatalogEntry> bright = filterByFlux(catalog, params.min_flux);
		LOGGER.info("inferAll(): "+bright.size()+" of "+catalog.size()+" sources after the min_flux ("+params.min_flux+") cut");
		final int [] targets = selectTargets(bright, params);
		LOGGER.info("inferAll(): processing "+targets.length+" sources");
		if (targets.length == 0) {
			return new ArrayList<SourceOutcome>();
		}
		checkThingIds(bright, targets);

		final OptimizerParameters opt_params = params.getOptimizerParameters();
		ParameterLayout layout = (opt_params.position_scale == ParameterLayout.POSITION_SCALE) ?
				ParameterLayout.CELESTE : ParameterLayout.celeste(opt_params.position_scale);
		final List<TiledImage> tiled_images = Tiler.breakIntoTiles(images, params.tile_width);
		final ModelParams mp = ModelInit.initializeModelParams(layout, bright, params.max_gal_scale);
		final double noise_fraction = params.noise_fraction;

		final Map<Integer, SourceOutcome> outcomes = new ConcurrentHashMap<Integer, SourceOutcome>();
		if (params.threads <= 1) {
			for (int nt = 0; nt < targets.length; nt++) {
				outcomes.put(nt, inferSource(targets[nt], bright.get(targets[nt]), mp.copy(), tiled_images, noise_fraction,
						objective, opt_params, debug_level));
			}
		} else {
			final Thread[] threads = MultiThreading.newThreadArray(params.threads, targets.length);
			final AtomicInteger ai = new AtomicInteger(0);
			for (int ithread = 0; ithread < threads.length; ithread++) {
				threads[ithread] = new Thread() {
					@Override
					public void run() {
						for (int nt = ai.getAndIncrement(); nt < targets.length; nt = ai.getAndIncrement()) {
							outcomes.put(nt, inferSource(targets[nt], bright.get(targets[nt]), mp.copy(), tiled_images,
									noise_fraction, objective, opt_params, debug_level));
						}
					}
				};
			}
			MultiThreading.startAndJoin(threads);
		}
		List<SourceOutcome> list = new ArrayList<SourceOutcome>(targets.length);
		int num_failed = 0;
		for (int nt = 0; nt < targets.length; nt++) {
			SourceOutcome outcome = outcomes.get(nt);
			if (outcome == null) { // worker thread terminated by an Error
				CatalogEntry entry = bright.get(targets[nt]);
				IllegalStateException e = new IllegalStateException("inferAll(): no outcome for source "+targets[nt]);
				LOGGER.error("inferAll(): source "+targets[nt]+" (objid="+entry.objid+", thing_id="+entry.thing_id+") failed: "+e.getMessage());
				outcome = SourceOutcome.failure(targets[nt], entry.objid, entry.thing_id, e);
			}
			if (!outcome.isSuccess()) num_failed++;
			list.add(outcome);
		}
		LOGGER.info("inferAll(): "+(targets.length - num_failed)+" sources fitted, "+num_failed+" failed");
		return list;
	}

	/**
	 * Trim tiles and optimize one source
	 * @param s source index in mp
	 * @param entry catalog entry of the source
	 * @param mp model parameters owned by the caller, updated with the fitted values
	 */
	static SourceOutcome inferSource(
			int                 s,
			CatalogEntry        entry,
			ModelParams         mp,
			List<TiledImage>    tiled_images,
			double              noise_fraction,
			ElboObjective       objective,
			OptimizerParameters opt_params,
			int                 debug_level) {
		if (debug_level > 0) {
			LOGGER.info("inferSource(): processing source "+s+": objid="+entry.objid);
		}
		try {
			mp.setActiveSources(s);
			long t0 = System.nanoTime();
			TrimmedTiles tiles = Tiler.trimSourceTiles(s, mp, tiled_images, noise_fraction, debug_level);
			double init_time = 1E-9 * (System.nanoTime() - t0);
			t0 = System.nanoTime();
			OptimizationResult rslt = ElboMaximizer.maximizeF(objective, tiles, mp, opt_params);
			double fit_time = 1E-9 * (System.nanoTime() - t0);
			InferenceResult result = new InferenceResult(
					entry.objid,
					entry.thing_id,
					entry.ra,
					entry.dec,
					mp.getVpCopy(s),
					rslt.iteration_count,
					rslt.isConverged(),
					rslt.elbo,
					init_time,
					fit_time);
			if (debug_level > 0) {
				LOGGER.info("inferSource(): source "+s+": "+result);
			}
			return SourceOutcome.success(s, result);
		} catch (CelesteException | RuntimeException e) {
			LOGGER.error("inferSource(): source "+s+" (objid="+entry.objid+", thing_id="+entry.thing_id+") failed: "+e.getMessage(), e);
			return SourceOutcome.failure(s, entry.objid, entry.thing_id, e);
		}
	}

	public static List<CatalogEntry> filterByFlux(List<CatalogEntry> catalog, double min_flux) {
		List<CatalogEntry> bright = new ArrayList<CatalogEntry>();
		for (CatalogEntry entry : catalog) {
			if (entry.getMaxStarFlux() >= min_flux) {
				bright.add(entry);
			}
		}
		return bright;
	}

	/**
	 * Indices of the sources to fit: matching objid (if set) and strictly inside the RA/Dec box
	 */
	public static int [] selectTargets(List<CatalogEntry> catalog, InferenceParameters params) {
		List<Integer> targets = new ArrayList<Integer>();
		for (int s = 0; s < catalog.size(); s++) {
			CatalogEntry entry = catalog.get(s);
			if (!params.objid.isEmpty() && !params.objid.equals(entry.objid)) {
				continue;
			}
			if (entry.isInBox(params.ra_min, params.ra_max, params.dec_min, params.dec_max)) {
				targets.add(s);
			}
		}
		int [] rslt = new int [targets.size()];
		for (int i = 0; i < rslt.length; i++) {
			rslt[i] = targets.get(i);
		}
		return rslt;
	}

	private static void checkThingIds(List<CatalogEntry> catalog, int [] targets) {
		Set<Long> seen = new HashSet<Long>();
		for (int s : targets) {
			if (!seen.add(catalog.get(s).thing_id)) {
				throw new IllegalStateException("inferAll(): duplicate thing_id "+catalog.get(s).thing_id+
						" (objid="+catalog.get(s).objid+")");
			}
		}
	}
}

/**
 **
 ** InferenceResult.java - fitted parameters of one source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InferenceResult.java is free software: you can redistribute it and/or modify
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

import com.elphel.celeste.catalog.CatalogEntry;
import com.elphel.celeste.model.ModelInit;
import com.elphel.celeste.params.ParameterLayout;

public class InferenceResult {
	public final String    objid;
	public final long      thing_id;
	public final double    ra;              // catalog position
	public final double    dec;
	private final double [] vs;             // fitted constrained vector
	public final int       iteration_count;
	public final boolean   converged;
	public final double    elbo;
	public final double    init_time;       // seconds, tile trimming
	public final double    fit_time;        // seconds, optimization

	public InferenceResult(
			String    objid,
			long      thing_id,
			double    ra,
			double    dec,
			double [] vs,
			int       iteration_count,
			boolean   converged,
			double    elbo,
			double    init_time,
			double    fit_time) {
		this.objid =           objid;
		this.thing_id =        thing_id;
		this.ra =              ra;
		this.dec =             dec;
		this.vs =              vs.clone();
		this.iteration_count = iteration_count;
		this.converged =       converged;
		this.elbo =            elbo;
		this.init_time =       init_time;
		this.fit_time =        fit_time;
	}

	public double [] getVs() {
		return vs.clone();
	}

	public CatalogEntry toCatalogEntry(ParameterLayout layout) {
		return ModelInit.toCatalogEntry(layout, vs, objid, thing_id);
	}

	@Override
	public String toString() {
		return "objid="+objid+", thing_id="+thing_id+", ELBO="+elbo+", iterations="+iteration_count+
				(converged ? "" : " (not converged)")+", init="+init_time+"s, fit="+fit_time+"s";
	}
}

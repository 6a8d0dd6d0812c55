/**
 **
 ** OptimizationResult.java - outcome of one ELBO maximization
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OptimizationResult.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.optimize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class OptimizationResult {
	public enum Status {
		CONVERGED,       // one of the tolerances is met, or no ascent direction is left
		ITERATION_LIMIT  // max_iters reached
	}

	public final Status      status;
	public final int         iteration_count;
	public final double      elbo;
	public final double [][] vs;             // [active source][param], constrained
	private final List<Double> history;      // ELBO of the initial and every accepted iterate

	public OptimizationResult(Status status, int iteration_count, double elbo, double [][] vs, List<Double> history) {
		this.status =          status;
		this.iteration_count = iteration_count;
		this.elbo =            elbo;
		this.vs =              vs;
		this.history =         Collections.unmodifiableList(new ArrayList<Double>(history));
	}

	public boolean isConverged() {
		return status == Status.CONVERGED;
	}

	public List<Double> getHistory() {
		return history;
	}

	@Override
	public String toString() {
		return status+" after "+iteration_count+" iterations, ELBO="+elbo;
	}
}

/**
 **
 ** ElboMaximizer.java - quasi-Newton (BFGS) ascent of the ELBO over the free parameters of the active sources
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ElboMaximizer.java is free software: you can redistribute it and/or modify
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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.FiniteDifferencesDifferentiator;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.celeste.common.NumericalDivergenceException;
import com.elphel.celeste.model.ModelParams;
import com.elphel.celeste.objective.ElboObjective;
import com.elphel.celeste.objective.ElboValue;
import com.elphel.celeste.optimize.OptimizationResult.Status;
import com.elphel.celeste.params.FreeTransform;
import com.elphel.celeste.params.ParameterLayout;
import com.elphel.celeste.params.ParameterTransform;
import com.elphel.celeste.tiling.TrimmedTiles;

import Jama.Matrix;

/**
 * Maximizes the ELBO over the free (unconstrained) vectors of the active
 * sources. The free vectors of all active sources are concatenated, the
 * coordinates listed in omitted_ids (per source) are held fixed. Only steps
 * that pass the Armijo test are accepted, so the ELBO never decreases.
 * On return the model holds the constrained values of the last accepted iterate.
 */
public class ElboMaximizer {
	private static final Logger LOGGER = LoggerFactory.getLogger(ElboMaximizer.class);

	public static final int    GRADIENT_CHECK_POINTS = 5;
	public static final double GRADIENT_CHECK_STEP =   1E-5;

	private final ElboObjective       objective;
	private final OptimizerParameters params;

	// state of the current run
	private TrimmedTiles   tiles =        null;
	private ModelParams    mp =           null;
	private FreeTransform  free_transform = null;
	private int []         active =       null;
	private int            free_size =    0;
	private double []      full_vector =  null; // all active sources, including omitted coordinates
	private boolean []     par_mask =     null;
	private int []         par_indices =  null;
	private int            iteration =    0;

	private static class Evaluation {
		final double    value;
		final double [] gradient; // over par_indices
		Evaluation(double value, double [] gradient) {
			this.value =    value;
			this.gradient = gradient;
		}
	}

	public ElboMaximizer(ElboObjective objective, OptimizerParameters params) {
		this.objective = objective;
		this.params =    params;
	}

	public static OptimizationResult maximizeF(
			ElboObjective       objective,
			TrimmedTiles        tiles,
			ModelParams         mp,
			OptimizerParameters params) throws NumericalDivergenceException {
		return new ElboMaximizer(objective, params).maximize(tiles, mp);
	}

	/**
	 * @param tiles tiles passed to the objective
	 * @param mp model parameters, vectors of the active sources are updated
	 * @return result with the final constrained vectors of the active sources
	 * @throws NumericalDivergenceException non-finite ELBO or gradient, mp keeps the last accepted iterate
	 */
	public OptimizationResult maximize(TrimmedTiles tiles, ModelParams mp) throws NumericalDivergenceException {
		prepare(tiles, mp);
		int debug_level = params.debug_level;
		double [] x = new double [par_indices.length];
		for (int i = 0; i < x.length; i++) {
			x[i] = full_vector[par_indices[i]];
		}
		iteration = 0;
		Evaluation cur;
		try {
			cur = evaluate(x);
		} catch (NumericalDivergenceException e) {
			applyVector(x);
			throw e;
		}
		List<Double> history = new ArrayList<Double>();
		history.add(cur.value);
		if (debug_level > 3) {
			checkGradient(x, cur.gradient);
		}
		int n = x.length;
		Matrix hinv = Matrix.identity(n, n).times(params.hessian_scale);
		boolean just_reset = true;
		Status status = null;
		if ((n == 0) || (maxAbs(cur.gradient) < params.g_tol)) {
			status = Status.CONVERGED;
		}
		while (status == null) {
			if (iteration >= params.max_iters) {
				status = Status.ITERATION_LIMIT;
				break;
			}
			iteration++;
			double [] d = hinv.times(new Matrix(cur.gradient, n)).getColumnPackedCopy();
			double slope = dot(cur.gradient, d);
			if (!(slope > 0)) { // not an ascent direction
				if (debug_level > 1) {
					LOGGER.debug("maximize(): iteration "+iteration+": resetting inverse Hessian, slope="+slope);
				}
				hinv = Matrix.identity(n, n).times(params.hessian_scale);
				just_reset = true;
				for (int i = 0; i < n; i++) {
					d[i] = params.hessian_scale * cur.gradient[i];
				}
				slope = dot(cur.gradient, d);
			}
			double d_max = maxAbs(d);
			if (d_max > params.max_step) {
				double k = params.max_step / d_max;
				for (int i = 0; i < n; i++) {
					d[i] *= k;
				}
				slope *= k;
			}
			// backtracking line search
			double t = 1.0;
			double [] x_new = null;
			Evaluation next = null;
			for (int ls = 0; ls <= params.ls_max_steps; ls++) {
				double [] xt = new double [n];
				for (int i = 0; i < n; i++) {
					xt[i] = x[i] + t * d[i];
				}
				Evaluation e;
				try {
					e = evaluate(xt);
				} catch (NumericalDivergenceException ex) {
					applyVector(x);
					throw ex;
				}
				if (e.value >= (cur.value + params.armijo * t * slope)) {
					x_new = xt;
					next = e;
					break;
				}
				t *= params.ls_shrink;
			}
			if (next == null) {
				if (just_reset) {
					if (debug_level > 0) {
						LOGGER.debug("maximize(): iteration "+iteration+": no ascent along the gradient, ELBO="+cur.value);
					}
					status = Status.CONVERGED;
					break;
				}
				if (debug_level > 0) {
					LOGGER.debug("maximize(): iteration "+iteration+": line search failed, resetting inverse Hessian");
				}
				hinv = Matrix.identity(n, n).times(params.hessian_scale);
				just_reset = true;
				continue;
			}
			double [] s = new double [n];
			double [] y = new double [n]; // gradient change of -ELBO
			for (int i = 0; i < n; i++) {
				s[i] = x_new[i] - x[i];
				y[i] = cur.gradient[i] - next.gradient[i];
			}
			double sy = dot(s, y);
			double yy = dot(y, y);
			if (sy > (1E-12 * Math.sqrt(dot(s, s) * yy))) {
				if (just_reset) {
					hinv = Matrix.identity(n, n).times(sy / yy);
				}
				hinv = updateInverseHessian(hinv, s, y, sy);
				just_reset = false;
			}
			double f_old = cur.value;
			x =   x_new;
			cur = next;
			history.add(cur.value);
			if (debug_level > 1) {
				LOGGER.debug("maximize(): iteration "+iteration+": ELBO="+cur.value+" ("+f_old+"), step="+t+
						", |g|="+maxAbs(cur.gradient));
			}
			if (((cur.value - f_old) <= (params.f_rel_tol * Math.abs(f_old))) ||
					(maxAbs(cur.gradient) < params.g_tol) ||
					(maxAbs(s) < params.x_tol)) {
				status = Status.CONVERGED;
			}
		}
		applyVector(x);
		double [][] vs = new double [active.length][];
		for (int a = 0; a < active.length; a++) {
			vs[a] = mp.getVpCopy(active[a]);
		}
		if (debug_level > 0) {
			LOGGER.info("maximize(): "+status+" after "+iteration+" iterations, ELBO="+cur.value+" (initial "+history.get(0)+")");
		}
		return new OptimizationResult(status, iteration, cur.value, vs, history);
	}

	private void prepare(TrimmedTiles tiles, ModelParams mp) {
		ParameterLayout layout = mp.getLayout();
		if (layout.hasBlock(ParameterLayout.U)) {
			ParameterLayout.Block u = layout.getBlock(ParameterLayout.U);
			if ((u.kind == ParameterTransform.Kind.LINEAR) &&
					(Math.abs(u.scale - params.position_scale) > (1E-12 * Math.abs(params.position_scale)))) {
				throw new IllegalArgumentException("maximize(): layout position scale ("+u.scale+
						") != position_scale ("+params.position_scale+")");
			}
		}
		this.tiles =          tiles;
		this.mp =             mp;
		this.free_transform = new FreeTransform(layout);
		this.active =         mp.getActiveSources();
		if (active.length == 0) {
			throw new IllegalArgumentException("maximize(): no active sources");
		}
		this.free_size =      layout.freeSize();
		this.full_vector =    new double [active.length * free_size];
		for (int a = 0; a < active.length; a++) {
			double [] free = free_transform.toFree(mp.getVp(active[a]));
			System.arraycopy(free, 0, full_vector, a * free_size, free_size);
		}
		boolean [] omitted = new boolean [free_size];
		for (int id : params.omitted_ids) {
			if ((id < 0) || (id >= free_size)) {
				throw new IllegalArgumentException("maximize(): omitted id "+id+" is outside of 0.."+(free_size - 1));
			}
			omitted[id] = true;
		}
		this.par_mask = new boolean [full_vector.length];
		int num_pars = 0;
		for (int i = 0; i < par_mask.length; i++) {
			par_mask[i] = !omitted[i % free_size];
			if (par_mask[i]) num_pars++;
		}
		this.par_indices = new int [num_pars];
		num_pars = 0;
		for (int i = 0; i < par_mask.length; i++) if (par_mask[i]) par_indices[num_pars++] = i;
	}

	private double [] getFullVector(double [] vector) {
		double [] full = full_vector.clone();
		for (int i = 0; i < par_indices.length; i++) {
			full[par_indices[i]] = vector[i];
		}
		return full;
	}

	/**
	 * Write constrained values corresponding to the free vector into the model
	 */
	private void applyVector(double [] vector) {
		double [] full = getFullVector(vector);
		for (int a = 0; a < active.length; a++) {
			free_transform.toConstrained(
					Arrays.copyOfRange(full, a * free_size, (a + 1) * free_size),
					mp.getVp(active[a]));
		}
	}

	private Evaluation evaluate(double [] vector) throws NumericalDivergenceException {
		applyVector(vector);
		ElboValue elbo = objective.evaluate(tiles, mp);
		if ((elbo == null) || (elbo.gradient == null) || (elbo.gradient.length != active.length)) {
			throw new IllegalArgumentException("evaluate(): objective returned "+
					(((elbo == null) || (elbo.gradient == null)) ? "no gradient" : (elbo.gradient.length+" gradient rows"))+
					" for "+active.length+" active sources");
		}
		if (!elbo.isFinite()) {
			throw new NumericalDivergenceException(iteration, "evaluate(): non-finite ELBO or gradient at iteration "+
					iteration+", ELBO="+elbo.value);
		}
		double [] full_gradient = new double [full_vector.length];
		for (int a = 0; a < active.length; a++) {
			double [] g = free_transform.freeGradient(mp.getVp(active[a]), elbo.gradient[a]);
			System.arraycopy(g, 0, full_gradient, a * free_size, free_size);
		}
		double [] gradient = new double [par_indices.length];
		for (int i = 0; i < gradient.length; i++) {
			gradient[i] = full_gradient[par_indices[i]];
			if (Double.isNaN(gradient[i]) || Double.isInfinite(gradient[i])) {
				throw new NumericalDivergenceException(iteration, "evaluate(): non-finite free gradient at iteration "+
						iteration+", parameter "+par_indices[i]);
			}
		}
		return new Evaluation(elbo.value, gradient);
	}

	/**
	 * Compare analytic free gradient with the finite differences one, log the worst mismatch
	 * @return maximal absolute difference
	 */
	double checkGradient(final double [] vector, double [] gradient) {
		FiniteDifferencesDifferentiator differentiator =
				new FiniteDifferencesDifferentiator(GRADIENT_CHECK_POINTS, GRADIENT_CHECK_STEP);
		String [] names = free_transform.getFreeNames();
		double worst = 0.0;
		int    worst_index = -1;
		for (int i = 0; i < vector.length; i++) {
			final int fi = i;
			UnivariateDifferentiableFunction f = differentiator.differentiate(new UnivariateFunction() {
				@Override
				public double value(double v) {
					double [] xt = vector.clone();
					xt[fi] = v;
					applyVector(xt);
					return objective.evaluate(tiles, mp).value;
				}
			});
			double numeric = f.value(new DerivativeStructure(1, 1, 0, vector[i])).getPartialDerivative(1);
			double diff = Math.abs(numeric - gradient[i]);
			if (!(diff <= worst)) {
				worst = diff;
				worst_index = i;
			}
		}
		applyVector(vector);
		if (worst_index >= 0) {
			int par = par_indices[worst_index];
			LOGGER.debug("checkGradient(): worst mismatch "+worst+" for "+names[par % free_size]+
					" of active source "+(par / free_size)+", analytic="+gradient[worst_index]);
		}
		return worst;
	}

	private static Matrix updateInverseHessian(Matrix hinv, double [] s, double [] y, double sy) {
		int n = s.length;
		double rho = 1.0 / sy;
		Matrix ms = new Matrix(s, n);
		Matrix my = new Matrix(y, n);
		Matrix a = Matrix.identity(n, n).minus(ms.times(my.transpose()).times(rho));
		return a.times(hinv).times(a.transpose()).plus(ms.times(ms.transpose()).times(rho));
	}

	private static double dot(double [] a, double [] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	private static double maxAbs(double [] a) {
		double m = 0.0;
		for (double v : a) {
			m = Math.max(m, Math.abs(v));
		}
		return m;
	}

	public int getIteration() {
		return iteration;
	}
}

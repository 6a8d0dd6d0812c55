/**
 **
 ** GaussianMixturePsf.java - PSF as a sum of truncated 2-d Gaussians
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GaussianMixturePsf.java is free software: you can redistribute it and/or modify
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

import Jama.EigenvalueDecomposition;
import Jama.Matrix;

public class GaussianMixturePsf implements Psf {
	public static final double DEFAULT_NUM_SIGMA = 5.0;

	private final double []   weights;
	private final double [][] means;       // [component]{x, y}
	private final double [][] covariances; // [component]{xx, xy, yy}
	private final double      num_sigma;   // support cut-off

	// derived
	private final double [][] precisions;  // [component]{xx, xy, yy} of the inverse covariance
	private final double []   norms;       // weight / (2*pi*sqrt(det))
	private final double []   radii;       // per-component support radius around the mean
	private final double      support_radius;

	/**
	 * @param weights component weights (sum to 1 for a normalized PSF)
	 * @param means component offsets from the source center, {x, y} pixels
	 * @param covariances {xx, xy, yy}, pixels^2
	 * @param num_sigma truncation distance in units of the largest component sigma
	 */
	public GaussianMixturePsf(
			double []   weights,
			double [][] means,
			double [][] covariances,
			double      num_sigma) {
		int n = weights.length;
		if ((means.length != n) || (covariances.length != n)) {
			throw new IllegalArgumentException("GaussianMixturePsf(): weights.length ("+n+"), means.length ("+
					means.length+") and covariances.length ("+covariances.length+") differ");
		}
		if (!(num_sigma > 0)) {
			throw new IllegalArgumentException("GaussianMixturePsf(): num_sigma should be positive, got "+num_sigma);
		}
		this.weights =     weights.clone();
		this.means =       new double [n][];
		this.covariances = new double [n][];
		this.num_sigma =   num_sigma;
		this.precisions =  new double [n][];
		this.norms =       new double [n];
		this.radii =       new double [n];
		double r_max = 0.0;
		for (int k = 0; k < n; k++) {
			this.means[k] =       means[k].clone();
			this.covariances[k] = covariances[k].clone();
			Matrix cov = new Matrix(new double [][] {
				{covariances[k][0], covariances[k][1]},
				{covariances[k][1], covariances[k][2]}});
			double det = cov.det();
			if (!(det > 0) || !(covariances[k][0] > 0)) {
				throw new IllegalArgumentException("GaussianMixturePsf(): covariance of component "+k+" is not positive definite");
			}
			Matrix prec = cov.inverse();
			precisions[k] = new double [] {prec.get(0, 0), prec.get(0, 1), prec.get(1, 1)};
			norms[k] = weights[k] / (2 * Math.PI * Math.sqrt(det));
			double [] eigen = new EigenvalueDecomposition(cov).getRealEigenvalues();
			double lambda_max = Math.max(eigen[0], eigen[1]);
			radii[k] = num_sigma * Math.sqrt(lambda_max);
			double r = Math.sqrt(means[k][0] * means[k][0] + means[k][1] * means[k][1]) + radii[k];
			if (r > r_max) r_max = r;
		}
		this.support_radius = r_max;
	}

	public GaussianMixturePsf(double [] weights, double [][] means, double [][] covariances) {
		this(weights, means, covariances, DEFAULT_NUM_SIGMA);
	}

	/**
	 * Single circular Gaussian
	 * @param sigma pixels
	 */
	public static GaussianMixturePsf gaussian(double sigma) {
		double v = sigma * sigma;
		return new GaussianMixturePsf(
				new double [] {1.0},
				new double [][] {{0.0, 0.0}},
				new double [][] {{v, 0.0, v}});
	}

	@Override
	public double evaluate(double dx, double dy) {
		double s = 0.0;
		for (int k = 0; k < weights.length; k++) {
			double x = dx - means[k][0];
			double y = dy - means[k][1];
			if ((x * x + y * y) > (radii[k] * radii[k])) {
				continue;
			}
			double [] p = precisions[k];
			double q = p[0] * x * x + 2 * p[1] * x * y + p[2] * y * y;
			s += norms[k] * Math.exp(-0.5 * q);
		}
		return s;
	}

	@Override
	public double supportRadius() {
		return support_radius;
	}

	@Override
	public GaussianMixturePsf broadened(double extra_variance) {
		if (!(extra_variance >= 0)) {
			throw new IllegalArgumentException("broadened(): variance should be non-negative, got "+extra_variance);
		}
		double [][] cov = new double [covariances.length][];
		for (int k = 0; k < cov.length; k++) {
			cov[k] = new double [] {
					covariances[k][0] + extra_variance,
					covariances[k][1],
					covariances[k][2] + extra_variance};
		}
		return new GaussianMixturePsf(weights, means, cov, num_sigma);
	}

	public int getNumComponents() {
		return weights.length;
	}
}

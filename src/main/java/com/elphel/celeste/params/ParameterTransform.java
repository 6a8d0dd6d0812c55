/**
 **
 ** ParameterTransform.java - constrained to free (unconstrained) parameter
 ** maps and the chain rule through them
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParameterTransform.java is free software: you can redistribute it and/or modify
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

/*
 * Families of transforms (z - constrained, r - free):
 *
 * SIMPLEX  n-way probability vector, n-1 free values:
 *          z_i = exp(r_i) / (1 + sum_{j<n} exp(r_j)), i < n
 *          z_n = 1 / (1 + sum_{j<n} exp(r_j))
 *          r_i = log(z_i) - log(z_n)
 *          df/dr_i = z_i * (df/dz_i - sum_j (df/dz_j * z_j)), j over all n
 * LOGIT    single stored component of a binary simplex, z in (0,1):
 *          z = 1/(1+exp(-r)), df/dr = df/dz * z * (1-z)
 * POSITIVE beta = exp(b), df/db = df/dbeta * beta
 * LINEAR   x = alpha * y,  df/dy = alpha * df/dx
 */
public class ParameterTransform {
	public static final double SIMPLEX_TOLERANCE = 1E-6;

	public enum Kind {
		IDENTITY, // already unconstrained
		LINEAR,   // fixed multiple of a free value
		LOGIT,    // (0,1) scalar
		POSITIVE, // > 0 scalar
		SIMPLEX   // probabilities summing to 1
	}

	/**
	 * Free size of a block of the specified kind
	 * @param kind transform kind
	 * @param size constrained size
	 * @return number of free values
	 */
	public static int freeSize(Kind kind, int size) {
		return (kind == Kind.SIMPLEX) ? (size - 1) : size;
	}

	// ---------------------------------- SIMPLEX ----------------------------------

	/**
	 * Map n-1 free values to an n-way simplex. A running maximum (including
	 * the implicit 0 of the last component) is subtracted before exponentiation,
	 * so any finite r produces finite z.
	 * @param r free values
	 * @param r_offset index of the first free value in r
	 * @param z output simplex
	 * @param z_offset index of the first output component
	 * @param n number of simplex components (n >= 2)
	 */
	public static void simplexToConstrained(
			final double [] r,
			final int       r_offset,
			final double [] z,
			final int       z_offset,
			final int       n) {
		if (n < 2) {
			throw new TransformException("simplexToConstrained(): simplex size "+n+" < 2");
		}
		double m = 0.0; // z_n has r = 0
		for (int i = 0; i < n - 1; i++) {
			double ri = r[r_offset + i];
			if (Double.isNaN(ri)) {
				throw new TransformException("simplexToConstrained(): free value "+i+" is NaN");
			}
			if (ri > m) m = ri;
		}
		double s = Math.exp(-m);
		for (int i = 0; i < n - 1; i++) {
			s += Math.exp(r[r_offset + i] - m);
		}
		for (int i = 0; i < n - 1; i++) {
			z[z_offset + i] = Math.exp(r[r_offset + i] - m) / s;
		}
		z[z_offset + n - 1] = Math.exp(-m) / s;
	}

	public static double [] simplexToConstrained(double [] r) {
		double [] z = new double [r.length + 1];
		simplexToConstrained(r, 0, z, 0, z.length);
		return z;
	}

	/**
	 * Inverse of {@link #simplexToConstrained(double[], int, double[], int, int)}
	 * @throws TransformException if components are outside of (0,1) or do not sum to 1
	 */
	public static void simplexToFree(
			final double [] z,
			final int       z_offset,
			final double [] r,
			final int       r_offset,
			final int       n) {
		if (n < 2) {
			throw new TransformException("simplexToFree(): simplex size "+n+" < 2");
		}
		checkSimplex("simplexToFree()", z, z_offset, n, false);
		double log_zn = Math.log(z[z_offset + n - 1]);
		for (int i = 0; i < n - 1; i++) {
			r[r_offset + i] = Math.log(z[z_offset + i]) - log_zn;
		}
	}

	public static double [] simplexToFree(double [] z) {
		double [] r = new double [z.length - 1];
		simplexToFree(z, 0, r, 0, z.length);
		return r;
	}

	/**
	 * Verify simplex components
	 * @param method caller name for the message
	 * @param closed allow components equal to 0 or 1 (forward map may round to them)
	 * @throws TransformException if a component is out of range or the sum differs from 1
	 */
	static void checkSimplex(
			final String    method,
			final double [] z,
			final int       z_offset,
			final int       n,
			final boolean   closed) {
		double sum = 0.0;
		for (int i = 0; i < n; i++) {
			double zi = z[z_offset + i];
			boolean ok = closed ? ((zi >= 0.0) && (zi <= 1.0)) : ((zi > 0.0) && (zi < 1.0));
			if (!ok) {
				throw new TransformException(method+": component "+i+" = "+zi+" is outside of "+(closed ? "[0,1]" : "(0,1)"));
			}
			sum += zi;
		}
		if (Math.abs(sum - 1.0) > SIMPLEX_TOLERANCE) {
			throw new TransformException(method+": components sum to "+sum+", not 1.0");
		}
	}

	/**
	 * Chain rule through the simplex map
	 * @param z constrained simplex (result of the forward map)
	 * @param dfdz gradient with respect to all n components
	 * @param dfdr output gradient with respect to n-1 free values
	 * @throws TransformException if z is not a valid simplex
	 */
	public static void simplexGradient(
			final double [] z,
			final int       z_offset,
			final double [] dfdz,
			final int       dfdz_offset,
			final double [] dfdr,
			final int       dfdr_offset,
			final int       n) {
		if (n < 2) {
			throw new TransformException("simplexGradient(): simplex size "+n+" < 2");
		}
		checkSimplex("simplexGradient()", z, z_offset, n, true);
		double zg = 0.0;
		for (int j = 0; j < n; j++) {
			zg += z[z_offset + j] * dfdz[dfdz_offset + j];
		}
		for (int i = 0; i < n - 1; i++) {
			dfdr[dfdr_offset + i] = z[z_offset + i] * (dfdz[dfdz_offset + i] - zg);
		}
	}

	public static double [] simplexGradient(double [] z, double [] dfdz) {
		if (dfdz.length != z.length) {
			throw new TransformException("simplexGradient(): dfdz.length ("+dfdz.length+") != z.length ("+z.length+")");
		}
		double [] dfdr = new double [z.length - 1];
		simplexGradient(z, 0, dfdz, 0, dfdr, 0, z.length);
		return dfdr;
	}

	// ---------------------------------- LOGIT ----------------------------------

	public static double logitToConstrained(double r) {
		if (r >= 0) {
			return 1.0 / (1.0 + Math.exp(-r));
		}
		double e = Math.exp(r);
		return e / (1.0 + e);
	}

	public static double logitToFree(double z) {
		if (!(z > 0.0) || !(z < 1.0)) {
			throw new TransformException("logitToFree(): value "+z+" is outside of (0,1)");
		}
		return Math.log(z) - Math.log1p(-z);
	}

	public static double logitGradient(double z, double dfdz) {
		if (!(z >= 0.0) || !(z <= 1.0)) {
			throw new TransformException("logitGradient(): value "+z+" is outside of [0,1]");
		}
		return dfdz * z * (1.0 - z);
	}

	// ---------------------------------- POSITIVE ----------------------------------

	public static double positiveToConstrained(double b) {
		return Math.exp(b);
	}

	public static double positiveToFree(double beta) {
		if (!(beta > 0.0) || Double.isInfinite(beta)) {
			throw new TransformException("positiveToFree(): value "+beta+" is not a finite positive number");
		}
		return Math.log(beta);
	}

	public static double positiveGradient(double beta, double dfdbeta) {
		if (!(beta > 0.0)) {
			throw new TransformException("positiveGradient(): value "+beta+" is not positive");
		}
		return dfdbeta * beta;
	}

	// ---------------------------------- LINEAR ----------------------------------

	public static double linearToConstrained(double y, double alpha) {
		return alpha * y;
	}

	public static double linearToFree(double x, double alpha) {
		if (alpha == 0.0) {
			throw new TransformException("linearToFree(): scale is 0");
		}
		return x / alpha;
	}

	public static double linearGradient(double dfdx, double alpha) {
		return alpha * dfdx;
	}
}

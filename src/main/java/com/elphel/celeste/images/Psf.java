/**
 **
 ** Psf.java - parametric point-spread function with finite support
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Psf.java is free software: you can redistribute it and/or modify
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

public interface Psf {
	/**
	 * Fraction of a unit point source flux received by the pixel centered at
	 * (dx, dy) pixels from the source
	 * @return non-negative value, 0 outside of {@link #supportRadius()}
	 */
	double evaluate(double dx, double dy);

	/**
	 * @return radius (pixels) beyond which {@link #evaluate(double, double)} is 0
	 */
	double supportRadius();

	/**
	 * PSF convolved with an isotropic Gaussian, an approximate galaxy footprint
	 * @param extra_variance variance (pixels^2) added to every component
	 */
	Psf broadened(double extra_variance);
}

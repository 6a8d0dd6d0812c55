/**
 **
 ** NumericalDivergenceException.java - non-finite ELBO or gradient during fitting
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NumericalDivergenceException.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.common;

public class NumericalDivergenceException extends CelesteException {
	private static final long serialVersionUID = 8832671407734195542L;
	private final int iteration;

	public NumericalDivergenceException(int iteration, String msg) {
		super(msg);
		this.iteration = iteration;
	}

	/**
	 * @return optimizer iteration where the non-finite value was met (0 - initial evaluation)
	 */
	public int getIteration() {
		return iteration;
	}
}

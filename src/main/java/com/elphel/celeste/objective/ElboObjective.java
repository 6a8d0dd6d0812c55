/**
 **
 ** ElboObjective.java - evidence lower bound of the model given the image tiles
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ElboObjective.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.objective;

import com.elphel.celeste.model.ModelParams;
import com.elphel.celeste.tiling.TrimmedTiles;

/**
 * ELBO and its gradient with respect to the constrained parameters of the
 * active sources. Implementations must not modify mp.
 */
public interface ElboObjective {
	/**
	 * @param tiles tiles used for the active sources
	 * @param mp model parameters, active sources are the ones differentiated
	 * @return value and gradient[active source][layout.size()], rows in active set order
	 */
	ElboValue evaluate(TrimmedTiles tiles, ModelParams mp);
}

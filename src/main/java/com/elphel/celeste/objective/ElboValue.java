/**
 **
 ** ElboValue.java - ELBO value with its gradient
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ElboValue.java is free software: you can redistribute it and/or modify
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

public class ElboValue {
	public final double      value;
	public final double [][] gradient; // [active source][param]

	public ElboValue(double value, double [][] gradient) {
		this.value =    value;
		this.gradient = gradient;
	}

	/**
	 * @return true if the value and all gradient components are finite
	 */
	public boolean isFinite() {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return false;
		}
		for (double [] row : gradient) {
			for (double d : row) {
				if (Double.isNaN(d) || Double.isInfinite(d)) {
					return false;
				}
			}
		}
		return true;
	}
}

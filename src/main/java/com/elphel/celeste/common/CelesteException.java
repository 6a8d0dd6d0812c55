/**
 **
 ** CelesteException.java - base of the per-source failures
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CelesteException.java is free software: you can redistribute it and/or modify
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

/**
 * Failure that is local to one source (or one lookup) and is not fatal to a run.
 */
public class CelesteException extends Exception {
	private static final long serialVersionUID = 3318406712389523419L;

	public CelesteException(String msg) {
		super(msg);
	}

	public CelesteException(String msg, Throwable cause) {
		super(msg, cause);
	}
}

/**
 **
 ** TrimmingExhaustedException.java - no image tile is relevant for a source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrimmingExhaustedException.java is free software: you can redistribute it and/or modify
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

public class TrimmingExhaustedException extends CelesteException {
	private static final long serialVersionUID = -6027739166262128760L;
	private final int source;

	public TrimmingExhaustedException(int source, String msg) {
		super(msg);
		this.source = source;
	}

	public int getSource() {
		return source;
	}
}

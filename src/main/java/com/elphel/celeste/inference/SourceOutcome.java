/**
 **
 ** SourceOutcome.java - result or failure reason of one source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SourceOutcome.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.inference;

public class SourceOutcome {
	public final int             source;   // index in the model parameters
	public final String          objid;
	public final long            thing_id;
	private final InferenceResult result;  // null for a failure
	private final String          reason;  // null for a success
	private final Exception       cause;

	private SourceOutcome(int source, String objid, long thing_id, InferenceResult result, String reason, Exception cause) {
		this.source =   source;
		this.objid =    objid;
		this.thing_id = thing_id;
		this.result =   result;
		this.reason =   reason;
		this.cause =    cause;
	}

	public static SourceOutcome success(int source, InferenceResult result) {
		return new SourceOutcome(source, result.objid, result.thing_id, result, null, null);
	}

	public static SourceOutcome failure(int source, String objid, long thing_id, Exception cause) {
		String reason = cause.getClass().getSimpleName()+": "+cause.getMessage();
		return new SourceOutcome(source, objid, thing_id, null, reason, cause);
	}

	public boolean isSuccess() {
		return result != null;
	}

	public InferenceResult getResult() {
		return result;
	}

	public String getReason() {
		return reason;
	}

	public Exception getCause() {
		return cause;
	}

	@Override
	public String toString() {
		return "source "+source+" (objid="+objid+", thing_id="+thing_id+"): "+(isSuccess() ? result.toString() : reason);
	}
}

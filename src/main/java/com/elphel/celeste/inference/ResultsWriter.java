/**
 **
 ** ResultsWriter.java - JSON files with the inference results
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResultsWriter.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

public class ResultsWriter {
	private static final Logger LOGGER = LoggerFactory.getLogger(ResultsWriter.class);

	private static final Type RESULTS_TYPE = new TypeToken<TreeMap<Long, InferenceResult>>(){}.getType();

	private static Gson getGson() {
		return new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
	}

	/**
	 * Results file name for a field
	 */
	public static String getFieldFileName(int run, int camcol, int field) {
		return String.format("celeste-%06d-%d-%04d.json", run, camcol, field);
	}

	/**
	 * Results file name for a single object
	 */
	public static String getObjidFileName(String objid) {
		return String.format("celeste-objid-%s.json", objid);
	}

	public static File getResultsFile(File outdir, int run, int camcol, int field, String objid) {
		String name = ((objid == null) || objid.isEmpty()) ? getFieldFileName(run, camcol, field) : getObjidFileName(objid);
		return new File(outdir, name);
	}

	public static void write(Map<Long, InferenceResult> results, File file) throws IOException {
		String json = getGson().toJson(new TreeMap<Long, InferenceResult>(results), RESULTS_TYPE);
		try (Writer writer = new FileWriter(file)) {
			writer.write(json);
		}
		LOGGER.info("write(): saved "+results.size()+" results to "+file);
	}

	public static Map<Long, InferenceResult> read(File file) throws IOException {
		try (Reader reader = new FileReader(file)) {
			Map<Long, InferenceResult> results = getGson().fromJson(reader, RESULTS_TYPE);
			if (results == null) {
				throw new IOException("read(): "+file+" is empty");
			}
			return results;
		} catch (JsonParseException e) {
			throw new IOException("read(): failed to parse "+file, e);
		}
	}
}

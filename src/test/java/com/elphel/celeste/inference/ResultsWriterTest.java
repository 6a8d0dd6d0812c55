/**
 **
 ** ResultsWriterTest.java - tests of the JSON results files
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResultsWriterTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.elphel.celeste.catalog.CatalogEntry;
import com.elphel.celeste.model.ModelInit;
import com.elphel.celeste.params.ParameterLayout;

public class ResultsWriterTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testFileNames() {
		assertEquals("celeste-003900-6-0269.json", ResultsWriter.getFieldFileName(3900, 6, 269));
		assertEquals("celeste-objid-1237662226208063541.json", ResultsWriter.getObjidFileName("1237662226208063541"));
		final File dir = new File("out");
		assertEquals(new File(dir, "celeste-003900-6-0269.json"), ResultsWriter.getResultsFile(dir, 3900, 6, 269, ""));
		assertEquals(new File(dir, "celeste-objid-7.json"), ResultsWriter.getResultsFile(dir, 3900, 6, 269, "7"));
	}

	@Test
	public void testWriteRead() throws IOException {
		final ParameterLayout layout = ParameterLayout.CELESTE;
		final CatalogEntry entry = new CatalogEntry(
				new double [] {0.5, -0.25}, false,
				new double [] {1, 2, 3, 4, 5}, new double [] {2, 3, 4, 5, 6},
				0.3, 0.6, 1.2, 2.5, "1237", 17);
		final double [] vs = ModelInit.initSource(layout, entry, 10.0);
		final Map<Long, InferenceResult> results = new TreeMap<Long, InferenceResult>();
		results.put(17L, new InferenceResult("1237", 17, 0.5, -0.25, vs, 12, true, -123.5, 0.01, 0.5));
		results.put(3L,  new InferenceResult("1238", 3,  0.6, -0.35, vs, 50, false, Double.NaN, 0.02, 1.5));
		final File file = new File(folder.getRoot(), ResultsWriter.getFieldFileName(1, 2, 3));
		ResultsWriter.write(results, file);

		final Map<Long, InferenceResult> restored = ResultsWriter.read(file);
		assertEquals(results.keySet(), restored.keySet());
		final InferenceResult r17 = restored.get(17L);
		assertEquals("1237", r17.objid);
		assertEquals(12, r17.iteration_count);
		assertEquals(-123.5, r17.elbo, 0.0);
		assertArrayEquals(vs, r17.getVs(), 0.0);
		assertFalse(restored.get(3L).converged);
		assertEquals(Double.NaN, restored.get(3L).elbo, 0.0);
		assertEquals(2.5, r17.toCatalogEntry(layout).gal_scale, 0.0);
	}

	@Test(expected = IOException.class)
	public void testMalformedFile() throws IOException {
		final File file = folder.newFile("bad.json");
		try (Writer writer = new FileWriter(file)) {
			writer.write("{\"17\": [1, 2");
		}
		ResultsWriter.read(file);
	}
}

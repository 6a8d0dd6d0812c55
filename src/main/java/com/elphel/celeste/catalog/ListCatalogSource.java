/**
 **
 ** ListCatalogSource.java - in-memory catalog, merged from one or more fields
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ListCatalogSource.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ListCatalogSource implements CatalogSource {
	private final List<List<CatalogEntry>> fields;

	@SafeVarargs
	public ListCatalogSource(List<CatalogEntry> ... fields) {
		this.fields = new ArrayList<List<CatalogEntry>>();
		for (List<CatalogEntry> field : fields) {
			this.fields.add(new ArrayList<CatalogEntry>(field));
		}
	}

	@Override
	public List<CatalogEntry> loadCatalog() {
		return Collections.unmodifiableList(CatalogUtils.mergeCatalogs(fields));
	}
}

/**
 **
 ** CatalogSource.java - provider of the catalog used to seed the model
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CatalogSource.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.util.List;

public interface CatalogSource {
	/**
	 * @return catalog entries, order is not significant, thing ids are unique
	 * @throws IOException when the underlying catalog can not be read
	 */
	List<CatalogEntry> loadCatalog() throws IOException;
}

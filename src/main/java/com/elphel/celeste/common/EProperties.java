/**
 **
 ** EProperties.java - java.util.Properties with typed getters
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883045L;

	public EProperties() {
		super();
	}

	public EProperties(Properties defaults) {
		super();
		if (defaults != null) {
			putAll(defaults);
		}
	}

	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public long getProperty(String key, long value){
		return Long.parseLong(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value).trim());
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}

	/**
	 * Comma-separated list of doubles, such as "0.0, 1.5, 2"
	 * @param key property name
	 * @param value default returned when the property is missing
	 * @return parsed values
	 */
	public double [] getProperty(String key, double [] value){
		String s = getProperty(key);
		if (s == null) {
			return value;
		}
		s = s.trim();
		if (s.isEmpty()) {
			return new double[0];
		}
		String [] tokens = s.split(",");
		double [] rslt = new double [tokens.length];
		for (int i = 0; i < tokens.length; i++) {
			rslt[i] = Double.parseDouble(tokens[i].trim());
		}
		return rslt;
	}

	public int [] getProperty(String key, int [] value){
		double [] d = getProperty(key, (double []) null);
		if (d == null) {
			return value;
		}
		int [] rslt = new int [d.length];
		for (int i = 0; i < d.length; i++) {
			rslt[i] = (int) Math.round(d[i]);
		}
		return rslt;
	}

	public void setProperty(String key, int [] value) {
		setProperty(key, join(value));
	}

	public static String join(int [] value) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < value.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(value[i]);
		}
		return sb.toString();
	}

	public void setProperty(String key, double [] value) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < value.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(value[i]);
		}
		setProperty(key, sb.toString());
	}

	public static EProperties load(File file) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = new FileInputStream(file)) {
			properties.load(is);
		}
		return properties;
	}

	public static EProperties loadResource(String name) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = EProperties.class.getClassLoader().getResourceAsStream(name)) {
			if (is == null) {
				throw new IOException("loadResource(): resource "+name+" is not found");
			}
			properties.load(is);
		}
		return properties;
	}
}

/**
 **
 ** InferenceParameters.java - parameters of the per-source inference run
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InferenceParameters.java is free software: you can redistribute it and/or modify
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
import java.io.IOException;
import java.util.Properties;

import com.elphel.celeste.common.EProperties;
import com.elphel.celeste.optimize.OptimizerParameters;

public class InferenceParameters {
	public static final String PREFIX =           "celeste.";
	public static final String OPTIMIZER_PREFIX = "optimizer.";
	public static final String DEFAULTS_RESOURCE = "celeste-default.properties";

	public int      tile_width =     20;
	public double   min_flux =       2.0;    // nMgy, brightest star flux should be at least this
	public int      max_iters =      50;     // overrides optimizer max_iters
	public double   noise_fraction = 0.1;    // tile trimming threshold relative to the background noise
	public String   objid =          "";     // process only this object, "" - all
	public double   ra_min =        -1000.0; // strict limits
	public double   ra_max =         1000.0;
	public double   dec_min =       -1000.0;
	public double   dec_max =        1000.0;
	public double   max_gal_scale =  Double.POSITIVE_INFINITY; // limit of the initial galaxy scale, pixels
	public int      threads =        1;      // 1 - sequential
	public int      debug_level =    0;
	public OptimizerParameters optimizer = new OptimizerParameters();

	public void setProperties(String prefix, Properties properties){
		properties.setProperty(prefix+"tile_width",     this.tile_width+"");
		properties.setProperty(prefix+"min_flux",       this.min_flux+"");
		properties.setProperty(prefix+"max_iters",      this.max_iters+"");
		properties.setProperty(prefix+"noise_fraction", this.noise_fraction+"");
		properties.setProperty(prefix+"objid",          this.objid);
		properties.setProperty(prefix+"ra_min",         this.ra_min+"");
		properties.setProperty(prefix+"ra_max",         this.ra_max+"");
		properties.setProperty(prefix+"dec_min",        this.dec_min+"");
		properties.setProperty(prefix+"dec_max",        this.dec_max+"");
		properties.setProperty(prefix+"max_gal_scale",  this.max_gal_scale+"");
		properties.setProperty(prefix+"threads",        this.threads+"");
		properties.setProperty(prefix+"debug_level",    this.debug_level+"");
		optimizer.setProperties(prefix+OPTIMIZER_PREFIX, properties);
	}

	public void getProperties(String prefix, Properties properties){
		EProperties ep = new EProperties(properties);
		this.tile_width =     ep.getProperty(prefix+"tile_width",     this.tile_width);
		this.min_flux =       ep.getProperty(prefix+"min_flux",       this.min_flux);
		this.max_iters =      ep.getProperty(prefix+"max_iters",      this.max_iters);
		this.noise_fraction = ep.getProperty(prefix+"noise_fraction", this.noise_fraction);
		this.objid =          ep.getProperty(prefix+"objid",          this.objid).trim();
		this.ra_min =         ep.getProperty(prefix+"ra_min",         this.ra_min);
		this.ra_max =         ep.getProperty(prefix+"ra_max",         this.ra_max);
		this.dec_min =        ep.getProperty(prefix+"dec_min",        this.dec_min);
		this.dec_max =        ep.getProperty(prefix+"dec_max",        this.dec_max);
		this.max_gal_scale =  ep.getProperty(prefix+"max_gal_scale",  this.max_gal_scale);
		this.threads =        ep.getProperty(prefix+"threads",        this.threads);
		this.debug_level =    ep.getProperty(prefix+"debug_level",    this.debug_level);
		optimizer.getProperties(prefix+OPTIMIZER_PREFIX, properties);
	}

	/**
	 * Check values that would make the whole run meaningless
	 * @throws IllegalArgumentException on the first invalid value
	 */
	public void validate() {
		if (tile_width <= 0) {
			throw new IllegalArgumentException("validate(): tile_width should be positive, got "+tile_width);
		}
		if (max_iters < 0) {
			throw new IllegalArgumentException("validate(): max_iters should be non-negative, got "+max_iters);
		}
		if (!(noise_fraction >= 0)) {
			throw new IllegalArgumentException("validate(): noise_fraction should be non-negative, got "+noise_fraction);
		}
		if (!(optimizer.position_scale != 0) || Double.isInfinite(optimizer.position_scale)) {
			throw new IllegalArgumentException("validate(): invalid position_scale "+optimizer.position_scale);
		}
	}

	/**
	 * Optimizer parameters for one source, with the run-level overrides applied
	 */
	public OptimizerParameters getOptimizerParameters() {
		OptimizerParameters op = optimizer.clone();
		op.max_iters =   max_iters;
		op.debug_level = Math.max(op.debug_level, debug_level - 1);
		return op;
	}

	@Override
	public InferenceParameters clone() {
		InferenceParameters ip = new InferenceParameters();
		ip.tile_width =     this.tile_width;
		ip.min_flux =       this.min_flux;
		ip.max_iters =      this.max_iters;
		ip.noise_fraction = this.noise_fraction;
		ip.objid =          this.objid;
		ip.ra_min =         this.ra_min;
		ip.ra_max =         this.ra_max;
		ip.dec_min =        this.dec_min;
		ip.dec_max =        this.dec_max;
		ip.max_gal_scale =  this.max_gal_scale;
		ip.threads =        this.threads;
		ip.debug_level =    this.debug_level;
		ip.optimizer =      this.optimizer.clone();
		return ip;
	}

	/**
	 * Parameters from a properties file, missing values keep the built-in defaults
	 */
	public static InferenceParameters load(File file) throws IOException {
		InferenceParameters ip = new InferenceParameters();
		ip.getProperties(PREFIX, EProperties.load(file));
		return ip;
	}

	public static InferenceParameters defaults() throws IOException {
		InferenceParameters ip = new InferenceParameters();
		ip.getProperties(PREFIX, EProperties.loadResource(DEFAULTS_RESOURCE));
		return ip;
	}
}

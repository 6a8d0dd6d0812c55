/**
 **
 ** OptimizerParameters.java - parameters of the ELBO maximization
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OptimizerParameters.java is free software: you can redistribute it and/or modify
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
package com.elphel.celeste.optimize;

import java.util.Properties;

import com.elphel.celeste.common.EProperties;
import com.elphel.celeste.params.ParameterLayout;

public class OptimizerParameters {
	public int      max_iters =      50;     // hard limit on BFGS iterations
	public double   f_rel_tol =      1E-8;   // exit if relative ELBO improvement drops below
	public double   g_tol =          1E-7;   // exit if free gradient max-norm drops below
	public double   x_tol =          1E-10;  // exit if step max-norm drops below
	public double   hessian_scale =  1.0;    // initial inverse Hessian = hessian_scale * I
	public double   max_step =       10.0;   // limit on the max-norm of a trial step
	public double   armijo =         1E-4;   // sufficient increase constant
	public double   ls_shrink =      0.5;    // step reduction in the line search
	public int      ls_max_steps =   30;     // maximal number of step reductions
	public double   position_scale = ParameterLayout.POSITION_SCALE; // world units per free position unit
	public int []   omitted_ids =    {};     // free-vector indices held fixed
	public int      debug_level =    0;

	public void setProperties(String prefix, Properties properties){
		properties.setProperty(prefix+"max_iters",      this.max_iters+"");
		properties.setProperty(prefix+"f_rel_tol",      this.f_rel_tol+"");
		properties.setProperty(prefix+"g_tol",          this.g_tol+"");
		properties.setProperty(prefix+"x_tol",          this.x_tol+"");
		properties.setProperty(prefix+"hessian_scale",  this.hessian_scale+"");
		properties.setProperty(prefix+"max_step",       this.max_step+"");
		properties.setProperty(prefix+"armijo",         this.armijo+"");
		properties.setProperty(prefix+"ls_shrink",      this.ls_shrink+"");
		properties.setProperty(prefix+"ls_max_steps",   this.ls_max_steps+"");
		properties.setProperty(prefix+"position_scale", this.position_scale+"");
		properties.setProperty(prefix+"omitted_ids",    EProperties.join(this.omitted_ids));
		properties.setProperty(prefix+"debug_level",    this.debug_level+"");
	}

	public void getProperties(String prefix, Properties properties){
		EProperties ep = new EProperties(properties);
		this.max_iters =      ep.getProperty(prefix+"max_iters",      this.max_iters);
		this.f_rel_tol =      ep.getProperty(prefix+"f_rel_tol",      this.f_rel_tol);
		this.g_tol =          ep.getProperty(prefix+"g_tol",          this.g_tol);
		this.x_tol =          ep.getProperty(prefix+"x_tol",          this.x_tol);
		this.hessian_scale =  ep.getProperty(prefix+"hessian_scale",  this.hessian_scale);
		this.max_step =       ep.getProperty(prefix+"max_step",       this.max_step);
		this.armijo =         ep.getProperty(prefix+"armijo",         this.armijo);
		this.ls_shrink =      ep.getProperty(prefix+"ls_shrink",      this.ls_shrink);
		this.ls_max_steps =   ep.getProperty(prefix+"ls_max_steps",   this.ls_max_steps);
		this.position_scale = ep.getProperty(prefix+"position_scale", this.position_scale);
		this.omitted_ids =    ep.getProperty(prefix+"omitted_ids",    this.omitted_ids);
		this.debug_level =    ep.getProperty(prefix+"debug_level",    this.debug_level);
	}

	@Override
	public OptimizerParameters clone() {
		OptimizerParameters op = new OptimizerParameters();
		op.max_iters =      this.max_iters;
		op.f_rel_tol =      this.f_rel_tol;
		op.g_tol =          this.g_tol;
		op.x_tol =          this.x_tol;
		op.hessian_scale =  this.hessian_scale;
		op.max_step =       this.max_step;
		op.armijo =         this.armijo;
		op.ls_shrink =      this.ls_shrink;
		op.ls_max_steps =   this.ls_max_steps;
		op.position_scale = this.position_scale;
		op.omitted_ids =    this.omitted_ids.clone();
		op.debug_level =    this.debug_level;
		return op;
	}
}

package crnsynthesis;
/*

    CRN Synthesis
    Copyright (C) 2016-2026 the CRN Synthesis authors

    This file is part of CRN Synthesis.

    CRN Synthesis is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    CRN Synthesis is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with CRN Synthesis.  If not, see <http://www.gnu.org/licenses/>.

*/

import java.util.*;

import gnu.trove.map.hash.TObjectDoubleHashMap;

/**
 * Numerical integration of a flow with no free parameters.
 *
 * <p>Uses the Dormand-Prince 5(4) embedded Runge-Kutta pair with adaptive step
 * size control. The state is reported at each point of the time grid; the
 * integrator takes as many internal steps between grid points as the error
 * tolerances require.
 */
public class Simulator {
    // Name under which the current time is visible to flow expressions.
    public static final String TIME="time";

    private static final double[] C={0, 1.0/5, 3.0/10, 4.0/5, 8.0/9, 1, 1};
    private static final double[][] A={
        {},
        {1.0/5},
        {3.0/40, 9.0/40},
        {44.0/45, -56.0/15, 32.0/9},
        {19372.0/6561, -25360.0/2187, 64448.0/6561, -212.0/729},
        {9017.0/3168, -355.0/33, 46732.0/5247, 49.0/176, -5103.0/18656},
        {35.0/384, 0, 500.0/1113, 125.0/192, -2187.0/6784, 11.0/84}
    };
    //  Fifth order weights are the last row of A. E is the difference between
    //  the fifth and fourth order weights.
    private static final double[] E={71.0/57600, 0, -71.0/16695, 71.0/1920, -17253.0/339200, 22.0/525, -1.0/40};

    private static final int MAX_STEPS=1000000;

    private final double rtol;
    private final double atol;

    public Simulator() {
        this(1e-8, 1e-10);
    }

    public Simulator(double rtol, double atol) {
        this.rtol=rtol;
        this.atol=atol;
    }

    // n evenly spaced points from start to end inclusive.
    public static double[] linspace(double start, double end, int n) {
        double[] t=new double[n];
        for(int i=0; i<n; i++) {
            t[i]=(n==1) ? start : start+(end-start)*i/(n-1);
        }
        return t;
    }

    public Trajectory simulate(Solution sol, double[] times) {
        return simulate(sol.getInitialConditions(), sol.getFlow(), times);
    }

    // Simulate over 100 points in [0, 1].
    public Trajectory simulate(Map<String, Double> initialConditions, Flow flow) {
        return simulate(initialConditions, flow, linspace(0, 1, 100));
    }

    /**
     * @param initialConditions initial value of every species in the flow
     * @param flow derivative of each species; the columns of the result follow its order
     * @param times non-decreasing time grid; the first point is the initial time
     * @throws NoSuchElementException if a species of the flow has no initial condition
     * @throws IllegalArgumentException if the time grid decreases, or an expression
     *     contains a symbol that is neither a species nor the time
     */
    public Trajectory simulate(Map<String, Double> initialConditions, Flow flow, double[] times) {
        ArrayList<String> species=flow.getSpecies();
        int n=species.size();

        ASTNode[] exprs=new ASTNode[n];
        double[] y=new double[n];
        for(int i=0; i<n; i++) {
            String s=species.get(i);
            Double v=initialConditions.get(s);
            if(v==null) {
                throw new NoSuchElementException("No initial condition for "+s);
            }
            y[i]=v;
            exprs[i]=flow.get(s);
        }

        double[][] states=new double[times.length][];
        if(times.length==0) {
            return new Trajectory(times, states, species);
        }
        states[0]=y.clone();

        Derivative f=new Derivative(species, exprs);
        double span=times[times.length-1]-times[0];
        double h=(span>0) ? span/100 : 1e-3;

        for(int k=1; k<times.length; k++) {
            if(times[k]<times[k-1]) {
                throw new IllegalArgumentException("Time grid must not decrease: "+times[k-1]+" then "+times[k]);
            }
            h=advance(f, times[k-1], times[k], y, h);
            states[k]=y.clone();
        }
        return new Trajectory(times, states, species);
    }

    // Integrate y in place from t0 to t1. Returns the step size to try next.
    private double advance(Derivative f, double t0, double t1, double[] y, double h) {
        int n=y.length;
        double[][] k=new double[7][];
        double[] ytmp=new double[n];
        double[] ynew=new double[n];

        double t=t0;
        int steps=0;
        while(t<t1) {
            if(++steps>MAX_STEPS) {
                throw new IllegalStateException("Too many integration steps between t="+t0+" and t="+t1);
            }
            double step=Math.min(h, t1-t);

            k[0]=f.evaluate(t, y);
            for(int s=1; s<7; s++) {
                for(int i=0; i<n; i++) {
                    double acc=y[i];
                    for(int j=0; j<s; j++) {
                        acc+=step*A[s][j]*k[j][i];
                    }
                    ytmp[i]=acc;
                }
                if(s==6) {
                    System.arraycopy(ytmp, 0, ynew, 0, n);
                }
                k[s]=f.evaluate(t+C[s]*step, ytmp);
            }

            double err=0;
            for(int i=0; i<n; i++) {
                double e=0;
                for(int s=0; s<7; s++) {
                    e+=E[s]*k[s][i];
                }
                e*=step;
                double sc=atol+rtol*Math.max(Math.abs(y[i]), Math.abs(ynew[i]));
                err+=(e/sc)*(e/sc);
            }
            err=(n>0) ? Math.sqrt(err/n) : 0;

            if(err<=1) {
                t=(step==t1-t) ? t1 : t+step;
                System.arraycopy(ynew, 0, y, 0, n);
                double factor=(err==0) ? 5 : Math.min(5, Math.max(0.2, 0.9*Math.pow(err, -0.2)));
                //  A step cut short by the grid point does not shrink the next one.
                h=(step<h) ? Math.max(h, step*factor) : step*factor;
            }
            else {
                h=step*Math.max(0.2, (Double.isNaN(err) ? 0.2 : 0.9*Math.pow(err, -0.2)));
                if(h<=1e-14*Math.max(1, Math.abs(t))) {
                    throw new IllegalStateException("Step size too small at t="+t);
                }
            }
        }
        return h;
    }

    //  Evaluates the flow at a given time and state.
    private static class Derivative {
        final String[] names;
        final ASTNode[] exprs;
        final TObjectDoubleHashMap<String> bindings;

        Derivative(List<String> species, ASTNode[] exprs) {
            names=species.toArray(new String[0]);
            this.exprs=exprs;
            bindings=new TObjectDoubleHashMap<String>();
        }

        double[] evaluate(double t, double[] y) {
            bindings.put(TIME, t);
            for(int i=0; i<names.length; i++) {
                bindings.put(names[i], y[i]);
            }
            double[] dy=new double[exprs.length];
            for(int i=0; i<exprs.length; i++) {
                dy[i]=exprs[i].evaluate(bindings);
            }
            return dy;
        }
    }
}

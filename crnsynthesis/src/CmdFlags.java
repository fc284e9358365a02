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
import java.io.*;
import java.math.BigDecimal;

public final class CmdFlags {
    private static boolean verbose = false;

    private static String modelfile = null;
    private static Backend backend = Backend.ISAT;
    private static String solverpath = null;     // Defaults to the backend's usual binary name.
    private static double precision = SolverConfig.DEFAULT_PRECISION;
    private static double msw = 0;               // 0 means precision*5
    private static int maxdepth = SolverConfig.DEFAULT_MAX_DEPTH;
    private static ArrayList<String> solverflags = null;   // null means the backend's default flags.
    private static String workdir = null;

    //  Cost schedule. A single -cost sets both ends.
    private static double maxcost = 0;
    private static double mincost = 0;

    //  Simulation of the synthesised systems.
    private static String flowfile = null;
    private static double scalefactor = 1;
    private static double simtime = 1;
    private static int simpoints = 100;

    public static String version="1.0.0";

    public static void setVerbose(boolean v) {
        verbose=v;
    }
    public static String getModelFile() {
        return modelfile;
    }
    public static Backend getBackend() {
        return backend;
    }
    public static String getFlowFile() {
        return flowfile;
    }
    public static double getScaleFactor() {
        return scalefactor;
    }
    public static double[] getSimulationTimes() {
        return Simulator.linspace(0, simtime, simpoints);
    }

    public static CostSchedule getCostSchedule() {
        return new CostSchedule(maxcost, mincost);
    }

    public static SolverConfig getSolverConfig() {
        String bin=(solverpath==null) ? backend.getDefaultSolverPath() : solverpath;
        List<String> flags=(solverflags==null) ? backend.getDefaultExtraFlags() : solverflags;
        File dir=new File((workdir==null) ? System.getProperty("user.dir") : workdir);
        return new SolverConfig(backend, bin, precision, msw, maxdepth, flags, dir);
    }

    // Print numbers the way they appear in model files and file names:
    // 20 rather than 20.0, 0.0001 rather than 1.0E-4.
    public static String formatNumber(double d) {
        if(Double.isNaN(d) || Double.isInfinite(d)) {
            return String.valueOf(d);
        }
        if(d==0) {
            return "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    public static void printlnIfVerbose(Object o) {
        if (verbose) {
            System.out.println(o);
        }
    }

    public static void println(Object o) {
        System.out.println(o);
    }

    //  Print error message to stderr and bail out.
    public static void errorExit(String errmsg) {
        System.err.println("ERROR: "+errmsg);
        CmdFlags.exit();
    }
    public static void errorExit(String errmsg1, String errmsg2) {
        System.err.println("ERROR: "+errmsg1);
        System.err.println("ERROR: "+errmsg2);
        CmdFlags.exit();
    }
    public static void warning(String warn) {
        System.err.println("WARNING: "+warn);
    }

    public static void cmdLineExit(String errmsg) {
        System.err.println("ERROR: "+errmsg);
        System.err.println("For command line help, use the -help flag.");
        CmdFlags.exit();
    }

    // Exit with non-zero code.
    public static void exit() {
        System.exit(1);
    }

    private static void setDefaults() {
        verbose=false;
        modelfile=null;
        backend=Backend.ISAT;
        solverpath=null;
        precision=SolverConfig.DEFAULT_PRECISION;
        msw=0;
        maxdepth=SolverConfig.DEFAULT_MAX_DEPTH;
        solverflags=null;
        workdir=null;
        maxcost=0;
        mincost=0;
        flowfile=null;
        scalefactor=1;
        simtime=1;
        simpoints=100;
    }

    public static void parseArguments(String[] args) {
        setDefaults();
        ArrayList<String> arglist=new ArrayList<String>(Arrays.asList(args));

        boolean costgiven=false;
        boolean rangegiven=false;

        while(arglist.size()>0) {
            String cur=arglist.remove(0);

            if(cur.equals("-help")) {
                printHelp();
                System.exit(0);
            }
            else if(cur.equals("-v")) {
                CmdFlags.setVerbose(true);
            }
            else if(cur.equals("-model")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Missing model file following -model");
                modelfile=arglist.remove(0);
            }
            else if(cur.equals("-backend")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("-backend expects one of isat, dreal, dreal-json.");
                try {
                    backend=Backend.fromName(arglist.remove(0));
                }
                catch(IllegalArgumentException e) {
                    CmdFlags.cmdLineExit(e.getMessage());
                }
            }
            else if(cur.equals("-solver-bin")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Missing solver path following -solver-bin");
                solverpath=arglist.remove(0);
            }
            else if(cur.equals("-solver-flags")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Missing solver flags string");
                ArrayList<String> temp=new ArrayList<String>(Arrays.asList(arglist.remove(0).split(" ")));
                for(int i=0; i<temp.size(); i++) {
                    if(temp.get(i).equals("")) {
                        temp.remove(i); i--;
                    }
                }
                solverflags=temp;
            }
            else if(cur.equals("-workdir")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Missing directory following -workdir");
                workdir=arglist.remove(0);
            }
            else if(cur.equals("-precision")) {
                precision=numberArgument(cur, arglist);
            }
            else if(cur.equals("-msw")) {
                msw=numberArgument(cur, arglist);
            }
            else if(cur.equals("-max-depth")) {
                maxdepth=(int) numberArgument(cur, arglist);
            }
            else if(cur.equals("-cost")) {
                maxcost=numberArgument(cur, arglist);
                mincost=maxcost;
                costgiven=true;
            }
            else if(cur.equals("-max-cost")) {
                maxcost=numberArgument(cur, arglist);
                rangegiven=true;
            }
            else if(cur.equals("-min-cost")) {
                mincost=numberArgument(cur, arglist);
                rangegiven=true;
            }
            else if(cur.equals("-flow")) {
                if(arglist.size()==0) CmdFlags.cmdLineExit("Missing flow file following -flow");
                flowfile=arglist.remove(0);
            }
            else if(cur.equals("-scale-factor")) {
                scalefactor=numberArgument(cur, arglist);
            }
            else if(cur.equals("-sim-time")) {
                simtime=numberArgument(cur, arglist);
            }
            else if(cur.equals("-sim-points")) {
                simpoints=(int) numberArgument(cur, arglist);
            }
            else {
                CmdFlags.cmdLineExit("Failed to parse the following argument: "+cur);
            }
        }

        if(modelfile==null) {
            CmdFlags.cmdLineExit("No model file given. Use -model <file>.");
        }
        if(costgiven && rangegiven) {
            CmdFlags.cmdLineExit("-cost cannot be combined with -max-cost or -min-cost.");
        }
        if(precision<=0) {
            CmdFlags.cmdLineExit("-precision must be positive.");
        }
        if(maxdepth<1) {
            CmdFlags.cmdLineExit("-max-depth must be a positive integer.");
        }
        if(simpoints<1) {
            CmdFlags.cmdLineExit("-sim-points must be a positive integer.");
        }
        if(maxcost<mincost) {
            CmdFlags.warning("Maximum cost is below minimum cost; the solver will not be called.");
        }
    }

    private static double numberArgument(String flag, ArrayList<String> arglist) {
        if(arglist.size()==0) CmdFlags.cmdLineExit(flag+" expects a numerical argument.");
        String a=arglist.remove(0);
        try {
            return Double.parseDouble(a);
        }
        catch(NumberFormatException e) {
            CmdFlags.cmdLineExit(flag+" expects a numerical argument, not "+a);
            return 0;
        }
    }

    public static void printHelp() {
        println("CRN Synthesis "+version);
        println("Usage: crnsynthesis -model <file> [options]");
        println("");
        println("  -model <file>          Solver input file (.hys or .drh) holding the cost bound declarations.");
        println("  -backend <name>        isat (default), dreal (proof output) or dreal-json (trace output).");
        println("  -solver-bin <path>     Solver binary. Default isat-ode or dReach.");
        println("  -solver-flags \"<f>\"    Extra flags for the solver, replacing the backend defaults.");
        println("  -workdir <dir>         Directory the solver runs in.");
        println("  -precision <p>         Solver precision. Default "+formatNumber(SolverConfig.DEFAULT_PRECISION)+".");
        println("  -msw <w>               iSAT minimum splitting width. Default precision*5.");
        println("  -max-depth <k>         Maximum unrolling depth. Default "+SolverConfig.DEFAULT_MAX_DEPTH+".");
        println("  -cost <c>              Call the solver once with cost bound c (0 for no bound).");
        println("  -max-cost <c>          First cost bound to try.");
        println("  -min-cost <c>          Last cost bound to try. The bound decreases by 1 per call.");
        println("  -flow <file>           Flow of the network; simulate each solution found.");
        println("  -scale-factor <s>      Value of the scale factor SF in the flow. Default 1.");
        println("  -sim-time <t>          Simulate from 0 to t. Default 1.");
        println("  -sim-points <n>        Number of time points in the simulation. Default 100.");
        println("  -v                     Verbose output.");
        println("  -help                  Print this message.");
    }
}

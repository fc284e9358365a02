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

/**
 * Builds the solver command line for a model file and runs it, saving the
 * solver's standard output in the results directory.
 */
public class SolverInvoker {
    private final SolverConfig config;

    public SolverInvoker(SolverConfig config) {
        this.config=config;
    }

    public SolverConfig getConfig() {
        return config;
    }

    public ArrayList<String> getCommand(ModelFile model) {
        ArrayList<String> command=new ArrayList<String>();
        command.add(config.getSolverPath());

        String modelpath=model.getPath().getAbsolutePath();
        String precision=CmdFlags.formatNumber(config.getPrecision());

        if(config.getBackend()==Backend.ISAT) {
            command.add("--i");
            command.add(modelpath);
            command.add("--prabs="+precision);
            command.add("--msw="+CmdFlags.formatNumber(config.getMinSplitWidth()));
            command.add("--max-depth="+config.getMaxDepth());
        }
        else {
            command.add("-k");
            command.add(String.valueOf(config.getMaxDepth()));
            command.add(modelpath);
            command.add("--precision");
            command.add(precision);
            command.add("--proof");
            if(config.getBackend()==Backend.DREAL_JSON) {
                command.add("--visualize");
            }
        }

        command.addAll(config.getExtraFlags());
        return command;
    }

    // File that receives the solver's standard output for this cost.
    public File getOutputFile(ModelFile model, double cost) {
        String name=model.getModelName()+"_"+CmdFlags.formatNumber(cost)+"_"
            +CmdFlags.formatNumber(config.getPrecision())+"-"+config.getBackend().getSuffix()+".txt";
        return new File(model.getResultsDir(), name);
    }

    // File the parser should read. For dReach this is the proof (or JSON trace)
    // for the last unrolling depth, whatever the cost.
    public File getResultFile(ModelFile model, double cost) {
        switch (config.getBackend()) {
            case DREAL:
                return new File(config.getWorkingDirectory(), model.getModelName()+"_"+(config.getMaxDepth()-1)+"_0.smt2.proof");
            case DREAL_JSON:
                return new File(config.getWorkingDirectory(), model.getModelName()+"_"+(config.getMaxDepth()-1)+"_0.smt2.json");
            default:
                return getOutputFile(model, cost);
        }
    }

    public File invoke(ModelFile model, double cost) throws IOException, InterruptedException {
        return invoke(model, cost, new Stats());
    }

    /**
     * Run the solver once. A non-zero exit value is recorded in stats but is
     * not an error: a failed run shows up as a result file with no values.
     *
     * @return the file to be parsed
     * @throws IOException if the solver cannot be started or the output file cannot be created
     */
    public File invoke(ModelFile model, double cost, Stats stats) throws IOException, InterruptedException {
        model.createResultsDir();

        File outfile=getOutputFile(model, cost);
        ArrayList<String> command=getCommand(model);

        CmdFlags.println("Calling solver: "+String.join(" ", command));

        long solvertime=System.nanoTime();
        int exitValue=RunCommand.runCommand(command, config.getWorkingDirectory(), outfile);
        solvertime=System.nanoTime()-solvertime;

        if(exitValue!=0) {
            CmdFlags.printlnIfVerbose("Solver exited with error code:"+exitValue);
        }

        File result=getResultFile(model, cost);

        stats.putValue("Cost", CmdFlags.formatNumber(cost));
        stats.putValue("Precision", CmdFlags.formatNumber(config.getPrecision()));
        stats.putValue("MaxDepth", String.valueOf(config.getMaxDepth()));
        stats.putValue("SolverCommand", String.join(" ", command));
        stats.putValue("SolverExitCode", String.valueOf(exitValue));
        stats.putValue("SolverTotalTime", String.valueOf(((double)solvertime)/1000000000));
        stats.putValue("SolverOutputFile", outfile.getPath());
        stats.putValue("ResultFile", result.getPath());
        return result;
    }
}

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

import com.google.gson.JsonParseException;

//  Command-line entry point: runs the cost-decreasing synthesis loop on a
//  model file, reports the values in each result, and if a flow is given,
//  simulates each solution and writes the trajectory next to the result file.

public final class CRNSynthesis {
    public static void main(String[] args) {
        CmdFlags.parseArguments(args);

        try {
            synthesise();
        }
        catch(IOException e) {
            CmdFlags.errorExit("I/O error: "+e.getMessage());
        }
        catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            CmdFlags.errorExit("Interrupted while waiting for the solver.");
        }
        catch(JsonParseException e) {
            CmdFlags.errorExit("Malformed dReach trace file.", e.getMessage());
        }
    }

    static void synthesise() throws IOException, InterruptedException {
        SolverConfig config=CmdFlags.getSolverConfig();
        ModelFile model=new ModelFile(CmdFlags.getModelFile());
        CmdFlags.printlnIfVerbose("Solver configuration: "+config);

        Pair<Flow, ArrayList<String>> flow=null;
        if(CmdFlags.getFlowFile()!=null) {
            flow=FlowReader.readFlowFile(new File(CmdFlags.getFlowFile()));
        }

        SynthesisLoop loop=new SynthesisLoop(config, model);
        ArrayList<File> results=loop.run(CmdFlags.getCostSchedule());

        OutputParser parser=config.getBackend().getParser();
        for(File result : results) {
            if(!result.exists()) {
                CmdFlags.warning("Solver did not write "+result);
                continue;
            }
            SolverValues values=parser.parse(result);
            CmdFlags.println("Result file: "+result);
            if(values.isEmpty()) {
                CmdFlags.println("No solution found.");
                continue;
            }
            CmdFlags.println("Constant values: "+values.getConstantValues());
            CmdFlags.println("All values: "+values.getAllValues());
            if(!values.getTimes().isEmpty()) {
                CmdFlags.println("Mode transition times: "+values.getTimes());
            }

            if(flow!=null) {
                simulate(flow.getFirst(), flow.getSecond(), values, result);
            }
        }
    }

    static void simulate(Flow flow, List<String> derivatives, SolverValues values, File result) throws IOException {
        Solution sol=new SolutionAssembler().assemble(flow, values, derivatives, CmdFlags.getScaleFactor());
        CmdFlags.println(sol);

        Trajectory traj;
        try {
            traj=new Simulator().simulate(sol, CmdFlags.getSimulationTimes());
        }
        catch(NoSuchElementException | IllegalArgumentException e) {
            CmdFlags.warning("Cannot simulate "+result+": "+e.getMessage());
            return;
        }
        File csv=new File(result.getPath()+"-simulation.csv");
        traj.writeCSV(csv);
        CmdFlags.println("Simulation of "+traj.getVariableNames()+" written to "+csv);
    }
}

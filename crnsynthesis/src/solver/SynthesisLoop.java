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
 * Optimisation by repeated solving: the solver is called once per cost bound,
 * from the largest cost down to the smallest, and the result of every call
 * is kept.
 */
public class SynthesisLoop {
    private final ModelFile model;
    private final SolverInvoker invoker;
    private final ArrayList<Stats> iterationStats=new ArrayList<Stats>();

    public SynthesisLoop(SolverConfig config, ModelFile model) {
        this.model=model;
        this.invoker=new SolverInvoker(config);
    }

    /**
     * Call the solver for each cost in the schedule. Every cost is tried,
     * whatever the solver reports for the previous one.
     *
     * @return the result file of each call, in schedule order
     */
    public ArrayList<File> run(CostSchedule schedule) throws IOException, InterruptedException {
        ArrayList<File> resultFiles=new ArrayList<File>();
        iterationStats.clear();

        ArrayList<Double> costs=schedule.getCosts();
        if(costs.size()>1 && invoker.getConfig().getBackend().hasFixedResultPath()) {
            CmdFlags.warning("dReach writes every result to the same file; only the result for cost "
                +CmdFlags.formatNumber(schedule.getMinCost())+" will remain after this run.");
        }

        for(double cost : costs) {
            Stats stats=new Stats();
            File result;

            //  Nobody else may edit the model file until the solver has read it.
            synchronized(model.getLock()) {
                model.setCostBound(cost, invoker.getConfig().getBackend());
                result=invoker.invoke(model, cost, stats);
            }

            writeInfoFile(stats);
            iterationStats.add(stats);
            resultFiles.add(result);
        }
        return resultFiles;
    }

    // One call to the solver with the given cost bound (0 for no bound).
    public ArrayList<File> singleSynthesis(double cost) throws IOException, InterruptedException {
        return run(CostSchedule.single(cost));
    }

    // Statistics of each call made by the last run.
    public List<Stats> getIterationStats() {
        return Collections.unmodifiableList(iterationStats);
    }

    private void writeInfoFile(Stats stats) throws IOException {
        String out=stats.getValue("SolverOutputFile");
        if(out.endsWith(".txt")) {
            out=out.substring(0, out.length()-4);
        }
        stats.writeInfoFile(new File(out+".info"));
    }
}

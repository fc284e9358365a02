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

/**
 * Substitutes the values found by a solver into a parametrised flow.
 *
 * <p>Every value is reduced to the midpoint of its interval. Values for
 * species become initial conditions; all other values are parameters and are
 * substituted into the flow.
 */
public class SolutionAssembler {
    public static final String SCALE_FACTOR="SF";

    private final String scaleFactorSymbol;

    public SolutionAssembler() {
        this(SCALE_FACTOR);
    }

    public SolutionAssembler(String scaleFactorSymbol) {
        this.scaleFactorSymbol=scaleFactorSymbol;
    }

    /**
     * @param flow parametrised flow; not modified
     * @param values values extracted from a solver result (the all-values map is used)
     * @param derivativeNames flow entries that are derivative bookkeeping and are not integrated
     * @param scaleFactor value of the scale factor symbol
     */
    public Solution assemble(Flow flow, SolverValues values, Collection<String> derivativeNames, double scaleFactor) {
        Flow parametrised=new Flow(flow);
        LinkedHashMap<String, Double> initialConditions=new LinkedHashMap<String, Double>();

        for(Map.Entry<String, Interval> e : values.getAllValues().entrySet()) {
            String name=e.getKey();
            double mid=e.getValue().midpoint();
            if(flow.hasSpecies(name)) {
                initialConditions.put(name, mid);
            }
            else {
                parametrised.substitute(name, mid);
            }
        }

        parametrised.substitute(scaleFactorSymbol, scaleFactor);

        for(String d : derivativeNames) {
            parametrised.remove(d);
        }

        Set<String> unresolved=parametrised.getSymbols();
        unresolved.removeAll(parametrised.getSpecies());
        unresolved.remove(Simulator.TIME);
        if(!unresolved.isEmpty()) {
            CmdFlags.warning("No value found for "+unresolved+"; the flow cannot be simulated.");
        }

        return new Solution(initialConditions, parametrised);
    }
}

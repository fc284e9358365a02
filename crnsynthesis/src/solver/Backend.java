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

//  The solvers that can be driven. Each one fixes the syntax of the cost
//  bound declarations, the command line, where the result ends up and which
//  parser reads it.

public enum Backend {
    ISAT("isat", "isat-ode"),
    DREAL("dreal", "dReach"),
    DREAL_JSON("dreal", "dReach");

    private final String suffix;
    private final String defaultSolverPath;

    Backend(String suffix, String defaultSolverPath) {
        this.suffix=suffix;
        this.defaultSolverPath=defaultSolverPath;
    }

    // Suffix of the file holding the solver's standard output.
    public String getSuffix() {
        return suffix;
    }

    public String getDefaultSolverPath() {
        return defaultSolverPath;
    }

    public static Backend fromName(String name) {
        switch (name) {
            case "isat":
                return ISAT;
            case "dreal":
                return DREAL;
            case "dreal-json":
                return DREAL_JSON;
            default:
                throw new IllegalArgumentException("Unknown solver backend: "+name);
        }
    }

    // dReach writes its result next to the working directory under a name
    // that does not depend on the cost bound.
    public boolean hasFixedResultPath() {
        return this!=ISAT;
    }

    public List<String> getDefaultExtraFlags() {
        if(this==ISAT) {
            return Arrays.asList("--ode-opts", "--continue-after-not-reaching-horizon");
        }
        return Collections.emptyList();
    }

    public String costBoundLine(String cost) {
        if(this==ISAT) {
            return "define MAX_COST = "+cost+";";
        }
        return "#define MAX_COST "+cost;
    }

    public String noCostLimitLine(boolean noLimit) {
        String flag=noLimit ? "1" : "0";
        if(this==ISAT) {
            return "define NO_COST_LIMIT = "+flag+";";
        }
        return "#define NO_COST_LIMIT "+flag;
    }

    public OutputParser getParser() {
        switch (this) {
            case ISAT:
                return new ISATOutputParser();
            case DREAL:
                return new DRealProofParser();
            default:
                return new DRealTraceParser();
        }
    }
}

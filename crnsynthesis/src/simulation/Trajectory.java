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

import gnu.trove.map.hash.TObjectIntHashMap;

//  Result of a simulation: one row of states per time point, one column per
//  variable.

public class Trajectory {
    private final double[] times;
    private final double[][] states;
    private final List<String> variableNames;
    private final TObjectIntHashMap<String> columns;

    public Trajectory(double[] times, double[][] states, List<String> variableNames) {
        this.times=times;
        this.states=states;
        this.variableNames=Collections.unmodifiableList(new ArrayList<String>(variableNames));
        columns=new TObjectIntHashMap<String>(variableNames.size(), 0.5f, -1);
        for(int i=0; i<variableNames.size(); i++) {
            columns.put(variableNames.get(i), i);
        }
    }

    public double[] getTimes() {
        return times;
    }

    public double[][] getStates() {
        return states;
    }

    public List<String> getVariableNames() {
        return variableNames;
    }

    public int numPoints() {
        return times.length;
    }

    // Value of one variable at every time point.
    public double[] getColumn(String name) {
        int c=columns.get(name);
        if(c==-1) {
            throw new NoSuchElementException("No variable "+name+" in trajectory");
        }
        double[] col=new double[states.length];
        for(int i=0; i<states.length; i++) {
            col[i]=states[i][c];
        }
        return col;
    }

    // One comma-separated line of states per time point.
    public void writeCSV(File f) throws IOException {
        BufferedWriter out=new BufferedWriter(new FileWriter(f));
        try {
            for(double[] row : states) {
                for(int i=0; i<row.length; i++) {
                    if(i>0) {
                        out.write(",");
                    }
                    out.write(String.valueOf(row[i]));
                }
                out.newLine();
            }
        }
        finally {
            out.close();
        }
    }
}

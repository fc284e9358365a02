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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Parser for the .smt2.json trace document written by dReach.
 *
 * <p>Each trace in the first trace group holds the enclosures of one variable
 * in one mode over time. A trace whose enclosure never changes is a constant.
 */
public class DRealTraceParser implements OutputParser {
    private final Gson gson=new Gson();

    public SolverValues parse(Reader in) throws IOException {
        StringBuilder b=new StringBuilder();
        char[] buf=new char[8192];
        int n;
        while((n=in.read(buf))!=-1) {
            b.append(buf, 0, n);
        }
        SolverValues values=new SolverValues();
        if(b.toString().trim().isEmpty()) {
            //  The solver did not get as far as writing the trace.
            return values;
        }

        DRealTrace doc=gson.fromJson(b.toString(), DRealTrace.class);
        if(doc==null || doc.traces==null || doc.traces.isEmpty() || doc.traces.get(0)==null) {
            throw new JsonParseException("Trace document has no traces");
        }

        for(DRealTrace.Entry t : doc.traces.get(0)) {
            if(t==null || t.key==null) {
                throw new JsonParseException("Trace without a key");
            }
            if(t.values==null || t.values.isEmpty()) {
                throw new JsonParseException("Trace "+t.key+" has no values");
            }

            String name=OutputParser.stripIndices(t.key);
            if(name.isEmpty()) {
                //  Mode transition times, e.g. time_0.
                continue;
            }

            Interval first=enclosure(t.key, t.values.get(0));
            boolean single=true;
            for(DRealTrace.Value v : t.values) {
                if(!enclosure(t.key, v).equals(first)) {
                    single=false;
                    break;
                }
            }

            if(single) {
                values.record(name, first);
            }
            else {
                values.recordVarying(name, first);
            }
        }
        return values;
    }

    private static Interval enclosure(String key, DRealTrace.Value v) {
        if(v==null || v.enclosure==null || v.enclosure.size()!=2) {
            throw new JsonParseException("Trace "+key+" has a value without a two-element enclosure");
        }
        return new Interval(v.enclosure.get(0), v.enclosure.get(1));
    }
}

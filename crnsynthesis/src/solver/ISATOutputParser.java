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
import java.util.regex.*;
import java.io.*;

/**
 * Parser for the text printed by iSAT-ODE.
 *
 * <p>A solution lists each variable under a header line such as
 * {@code k_1 (float):}, followed by one line per unrolling step giving its
 * interval, e.g. {@code @0: [0.2,0.4] (prev. interval)}. The parser is a
 * two-state machine: either it has a current variable, in which case interval
 * lines are attributed to that variable, or it has none and interval lines are
 * skipped.
 */
public class ISATOutputParser implements OutputParser {
    static final Pattern HEADER=Pattern.compile("(.+?) \\(.+?\\):");
    static final Pattern INTERVAL=Pattern.compile(".+?[\\[(](.+?),(.+?)[\\])].*");

    public static final String TIME="time";

    public SolverValues parse(Reader r) throws IOException {
        BufferedReader in=(r instanceof BufferedReader) ? (BufferedReader) r : new BufferedReader(r);
        SolverValues values=new SolverValues();

        String current=null;   //  Variable the next interval lines belong to, or null.
        String line;
        while((line=in.readLine())!=null) {
            String header=headerName(line);
            if(header!=null) {
                current=isIgnored(header) ? null : header;
            }
            else if(current!=null) {
                Interval iv=dataInterval(line);
                if(iv!=null) {
                    if(current.equals(TIME)) {
                        values.addTime(iv.getHigh());
                    }
                    else {
                        values.record(current, iv);
                    }
                }
            }
        }
        return values;
    }

    // Variable name if line is a header line, otherwise null.
    static String headerName(String line) {
        Matcher m=HEADER.matcher(line);
        if(m.lookingAt()) {
            return m.group(1).trim();
        }
        return null;
    }

    // Interval on a data line, or null if there is none.
    static Interval dataInterval(String line) {
        Matcher m=INTERVAL.matcher(line);
        if(m.lookingAt()) {
            return new Interval(m.group(1), m.group(2));
        }
        return null;
    }

    // Solver internals, trigger variables and the input time are not parameters.
    static boolean isIgnored(String name) {
        return name.contains("solver") || name.contains("_trigger") || name.equals("inputTime");
    }
}

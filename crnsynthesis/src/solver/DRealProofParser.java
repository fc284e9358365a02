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
 * Parser for the .smt2.proof file written by dReach.
 *
 * <p>Each assignment line looks like {@code k_1_0_0 : [0.2, 0.4]}. The last two
 * underscore-separated parts of a name are the mode and step, so
 * {@code k_1_0_0} is the variable {@code k_1}. Mode transition times are named
 * {@code time_<n>}.
 */
public class DRealProofParser implements OutputParser {
    static final Pattern ASSIGNMENT=Pattern.compile("\\s*([A-Za-z_0-9]+) : [\\[(]([-+0-9.eE]+?), ([-+0-9.eE]+?)[\\])]");

    public SolverValues parse(Reader r) throws IOException {
        BufferedReader in=(r instanceof BufferedReader) ? (BufferedReader) r : new BufferedReader(r);
        SolverValues values=new SolverValues();

        String line;
        while((line=in.readLine())!=null) {
            Matcher m=ASSIGNMENT.matcher(line);
            if(!m.lookingAt()) {
                continue;
            }
            String rawname=m.group(1);
            String name=OutputParser.stripIndices(rawname);

            if(name.equals("inputTime")) {
                continue;
            }
            if(name.isEmpty()) {
                if(rawname.startsWith("time_")) {
                    CmdFlags.printlnIfVerbose("Mode transition "+rawname.substring(5)+" at time "+m.group(3));
                    values.addTime(m.group(3));
                }
                continue;
            }
            if(name.contains("mode_")) {
                //  Mode choice variables are not parameters.
                continue;
            }

            values.record(name, new Interval(m.group(2), m.group(3)));
        }
        return values;
    }
}

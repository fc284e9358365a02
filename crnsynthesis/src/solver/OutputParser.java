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

//  Reads the values out of a solver result file. Output with no recognisable
//  values (empty, truncated, or from a failed run) gives empty SolverValues.

public interface OutputParser {
    SolverValues parse(Reader in) throws IOException;

    default SolverValues parse(File resultFile) throws IOException {
        Reader in=new BufferedReader(new FileReader(resultFile));
        try {
            return parse(in);
        }
        finally {
            in.close();
        }
    }

    // Strip the mode and step indices from a dReach variable name, e.g. k_1_0_2 -> k_1
    static String stripIndices(String rawname) {
        String[] parts=rawname.split("_", -1);
        if(parts.length<=2) {
            return "";
        }
        return String.join("_", Arrays.asList(parts).subList(0, parts.length-2));
    }
}

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

//  Reads a flow from a text file. Each line is either
//      species = expression
//  or
//      derivatives: name1, name2, ...
//  naming the derivative symbols that are not integrated. # starts a comment.

public class FlowReader {
    public static Pair<Flow, ArrayList<String>> readFlowFile(File f) throws IOException {
        BufferedReader in=new BufferedReader(new FileReader(f));
        try {
            return readFlow(in, f.getPath());
        }
        finally {
            in.close();
        }
    }

    static Pair<Flow, ArrayList<String>> readFlow(BufferedReader in, String source) throws IOException {
        Flow flow=new Flow();
        ArrayList<String> derivatives=new ArrayList<String>();

        String line;
        int lineno=0;
        while((line=in.readLine())!=null) {
            lineno++;
            int comment=line.indexOf('#');
            if(comment>=0) {
                line=line.substring(0, comment);
            }
            line=line.trim();
            if(line.isEmpty()) {
                continue;
            }

            if(line.startsWith("derivatives:")) {
                for(String d : line.substring("derivatives:".length()).split(",")) {
                    if(!d.trim().isEmpty()) {
                        derivatives.add(d.trim());
                    }
                }
                continue;
            }

            int eq=line.indexOf('=');
            if(eq<=0) {
                throw new IOException(source+":"+lineno+": expected 'species = expression'");
            }
            String species=line.substring(0, eq).trim();
            try {
                flow.put(species, ExpressionParser.parse(line.substring(eq+1)));
            }
            catch(IllegalArgumentException e) {
                throw new IOException(source+":"+lineno+": "+e.getMessage(), e);
            }
        }
        return new Pair<Flow, ArrayList<String>>(flow, derivatives);
    }
}

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

//  Key/value record of one solver run. Values that were never reported read as "NA".

public class Stats
{
    private LinkedHashMap<String, String> values=new LinkedHashMap<String, String>();

    public void putValue(String name, String value) {
        values.put(name, value);
    }

    public String getValue(String name) {
        String v=values.get(name);
        if(v==null) {
            return "NA";
        }
        return v;
    }

    public boolean hasValue(String name) {
        return values.containsKey(name);
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    // Write one name:value line per statistic.
    public void writeInfoFile(File infofile) throws IOException {
        BufferedWriter out=new BufferedWriter(new FileWriter(infofile));
        try {
            for(Map.Entry<String, String> e : values.entrySet()) {
                out.write(e.getKey()+":"+e.getValue());
                out.newLine();
            }
        }
        finally {
            out.close();
        }
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        for(Map.Entry<String, String> e : values.entrySet()) {
            b.append(e.getKey());
            b.append(":");
            b.append(e.getValue());
            b.append("\n");
        }
        return b.toString();
    }
}

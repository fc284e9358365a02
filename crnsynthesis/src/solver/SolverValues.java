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
 * Values extracted from one solver result.
 *
 * <p>The solver reports an interval for each variable in each mode. A
 * variable whose interval is the same every time it is reported is a constant
 * parameter. Once a second, different interval is seen the variable is state,
 * and it stays out of the constant values for the rest of the parse. All
 * values keep the first interval seen for every variable.
 */
public class SolverValues {
    private final LinkedHashMap<String, Interval> constantValues=new LinkedHashMap<String, Interval>();
    private final LinkedHashMap<String, Interval> allValues=new LinkedHashMap<String, Interval>();
    private final ArrayList<String> times=new ArrayList<String>();

    public void record(String name, Interval value) {
        if(!allValues.containsKey(name)) {
            //  First value for this variable.
            constantValues.put(name, value);
            allValues.put(name, value);
        }
        else if(constantValues.containsKey(name) && !constantValues.get(name).equals(value)) {
            constantValues.remove(name);
        }
    }

    // Record a variable that is already known to change over time.
    public void recordVarying(String name, Interval first) {
        if(!allValues.containsKey(name)) {
            allValues.put(name, first);
        }
        constantValues.remove(name);
    }

    // Mode transition time, in the order reported.
    public void addTime(String t) {
        times.add(t.trim());
    }

    public Map<String, Interval> getConstantValues() {
        return Collections.unmodifiableMap(constantValues);
    }

    public Map<String, Interval> getAllValues() {
        return Collections.unmodifiableMap(allValues);
    }

    public List<String> getTimes() {
        return Collections.unmodifiableList(times);
    }

    public boolean isEmpty() {
        return allValues.isEmpty() && times.isEmpty();
    }

    public String toString() {
        return "constant="+constantValues+" all="+allValues+" time="+times;
    }
}

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

//  A numeric model ready to simulate: initial state of each species and a
//  flow with every parameter replaced by a number.

public class Solution {
    private final LinkedHashMap<String, Double> initialConditions;
    private final Flow flow;

    public Solution(LinkedHashMap<String, Double> initialConditions, Flow flow) {
        this.initialConditions=initialConditions;
        this.flow=flow;
    }

    public Map<String, Double> getInitialConditions() {
        return Collections.unmodifiableMap(initialConditions);
    }

    public Flow getFlow() {
        return flow;
    }

    public String toString() {
        return "Initial conditions: "+initialConditions+"\nFlow: "+flow;
    }
}

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
 * A flow: the time derivative of each state variable, in a fixed order.
 *
 * <p>The order in which species were added is the order used for the
 * columns of a simulated trajectory.
 */
public class Flow implements Iterable<Map.Entry<String, ASTNode>> {
    private final LinkedHashMap<String, ASTNode> derivatives;

    public Flow() {
        derivatives=new LinkedHashMap<String, ASTNode>();
    }

    public Flow(Flow f) {
        derivatives=new LinkedHashMap<String, ASTNode>(f.derivatives);
    }

    public void put(String species, ASTNode derivative) {
        derivatives.put(species, derivative);
    }

    public void put(String species, String derivative) {
        put(species, ExpressionParser.parse(derivative));
    }

    public ASTNode get(String species) {
        return derivatives.get(species);
    }

    public ASTNode remove(String species) {
        return derivatives.remove(species);
    }

    public boolean hasSpecies(String species) {
        return derivatives.containsKey(species);
    }

    public ArrayList<String> getSpecies() {
        return new ArrayList<String>(derivatives.keySet());
    }

    public int size() {
        return derivatives.size();
    }

    public Iterator<Map.Entry<String, ASTNode>> iterator() {
        return Collections.unmodifiableMap(derivatives).entrySet().iterator();
    }

    // Replace a symbol by a value in every derivative.
    public void substitute(String name, double value) {
        NumberConstant n=new NumberConstant(value);
        for(Map.Entry<String, ASTNode> e : derivatives.entrySet()) {
            e.setValue(e.getValue().substitute(name, n));
        }
    }

    // All symbols occurring in any derivative.
    public Set<String> getSymbols() {
        LinkedHashSet<String> s=new LinkedHashSet<String>();
        for(ASTNode e : derivatives.values()) {
            s.addAll(e.getSymbols());
        }
        return s;
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        b.append("{");
        boolean first=true;
        for(Map.Entry<String, ASTNode> e : derivatives.entrySet()) {
            if(!first) {
                b.append(", ");
            }
            first=false;
            b.append(e.getKey());
            b.append(": ");
            b.append(e.getValue());
        }
        b.append("}");
        return b.toString();
    }
}

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

import gnu.trove.map.hash.TObjectDoubleHashMap;

public class Identifier extends ASTNode {
    private final String name;

    public Identifier(String id) {
        super();
        name = id.intern();
    }

    public String getName() {
        return name;
    }

    public String toString() {
        return name;
    }

    protected ASTNode rebuild(List<ASTNode> ch) {
        return this;
    }

    int precedence() {
        return ATOM;
    }

    @Override
    public ASTNode substitute(String n, ASTNode replacement) {
        if(name.equals(n)) {
            return replacement;
        }
        return this;
    }

    public double evaluate(TObjectDoubleHashMap<String> bindings) {
        if(!bindings.containsKey(name)) {
            throw new IllegalArgumentException("No value for symbol "+name);
        }
        return bindings.get(name);
    }

    @Override
    void collectSymbols(Set<String> s) {
        s.add(name);
    }

    @Override
    public boolean equals(Object other) {
        if (! (other instanceof Identifier)) {
            return false;
        }
        return ((Identifier) other).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}

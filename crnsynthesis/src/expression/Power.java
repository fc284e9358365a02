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

public class Power extends ASTNode {
    public Power(ASTNode base, ASTNode exponent) {
        super(base, exponent);
    }

    protected ASTNode rebuild(List<ASTNode> ch) {
        return new Power(ch.get(0), ch.get(1));
    }

    int precedence() {
        return POWER;
    }

    public double evaluate(TObjectDoubleHashMap<String> bindings) {
        return Math.pow(getChild(0).evaluate(bindings), getChild(1).evaluate(bindings));
    }

    public String toString() {
        //  Right associative: a^b^c is a^(b^c).
        return childString(getChild(0), ATOM)+"^"+childString(getChild(1), UNARY);
    }
}

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

public class NumberConstant extends ASTNode {
    private final double num;

    public NumberConstant(double n) {
        super();
        num = n;
    }

    public double getValue() {
        return num;
    }

    public boolean isConstant() {
        return true;
    }

    protected ASTNode rebuild(List<ASTNode> ch) {
        return this;
    }

    int precedence() {
        //  A negative number prints with a leading minus.
        return (num<0) ? UNARY : ATOM;
    }

    public double evaluate(TObjectDoubleHashMap<String> bindings) {
        return num;
    }

    public String toString() {
        return CmdFlags.formatNumber(num);
    }

    @Override
    public boolean equals(Object b) {
        if (! (b instanceof NumberConstant)) {
            return false;
        }
        return Double.compare(num, ((NumberConstant) b).num)==0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(num);
    }
}

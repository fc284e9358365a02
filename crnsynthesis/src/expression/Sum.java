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

//  n-ary sum. Subtraction is a sum with a UnaryMinus child.

public class Sum extends ASTNode {
    public Sum(ASTNode... ch) {
        super(ch);
    }
    public Sum(List<ASTNode> ch) {
        super(ch);
    }

    protected ASTNode rebuild(List<ASTNode> ch) {
        return new Sum(ch);
    }

    int precedence() {
        return SUM;
    }

    public double evaluate(TObjectDoubleHashMap<String> bindings) {
        double total=0.0;
        for(int i=0; i<numChildren(); i++) {
            total+=getChild(i).evaluate(bindings);
        }
        return total;
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        for(int i=0; i<numChildren(); i++) {
            ASTNode c=getChild(i);
            if(i==0) {
                b.append(childString(c, SUM));
            }
            else if(c instanceof UnaryMinus) {
                b.append(" - ");
                b.append(childString(c.getChild(0), PRODUCT));
            }
            else if(c instanceof NumberConstant && ((NumberConstant)c).getValue()<0) {
                b.append(" - ");
                b.append(CmdFlags.formatNumber(-((NumberConstant)c).getValue()));
            }
            else {
                b.append(" + ");
                b.append(childString(c, SUM));
            }
        }
        return b.toString();
    }
}

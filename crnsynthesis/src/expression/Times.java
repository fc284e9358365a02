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

//  n-ary product.

public class Times extends ASTNode {
    public Times(ASTNode... ch) {
        super(ch);
    }
    public Times(List<ASTNode> ch) {
        super(ch);
    }

    protected ASTNode rebuild(List<ASTNode> ch) {
        return new Times(ch);
    }

    int precedence() {
        return PRODUCT;
    }

    public double evaluate(TObjectDoubleHashMap<String> bindings) {
        double prod=1.0;
        for(int i=0; i<numChildren(); i++) {
            prod*=getChild(i).evaluate(bindings);
        }
        return prod;
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        for(int i=0; i<numChildren(); i++) {
            if(i>0) {
                b.append("*");
            }
            //  Only the leading factor may print a bare minus sign.
            b.append(childString(getChild(i), (i==0) ? PRODUCT : POWER));
        }
        return b.toString();
    }
}

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

/**
 * Node of a real-valued symbolic expression, as used for the time derivatives
 * in a flow.
 *
 * <p>Trees are never modified once built. {@link #substitute} returns a new
 * tree sharing the unchanged subtrees.
 */
public abstract class ASTNode {
    //  Precedence levels used when printing.
    static final int SUM=1;
    static final int PRODUCT=2;
    static final int UNARY=3;
    static final int POWER=4;
    static final int ATOM=5;

    private final ArrayList<ASTNode> children;

    protected ASTNode(ASTNode... ch) {
        children=new ArrayList<ASTNode>(Arrays.asList(ch));
    }

    protected ASTNode(List<ASTNode> ch) {
        children=new ArrayList<ASTNode>(ch);
    }

    public int numChildren() {
        return children.size();
    }

    public ASTNode getChild(int i) {
        return children.get(i);
    }

    public List<ASTNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isConstant() {
        return false;
    }

    // Make a node of the same type with new children.
    protected abstract ASTNode rebuild(List<ASTNode> ch);

    abstract int precedence();

    /**
     * Evaluate the expression.
     *
     * @param bindings value of every symbol in the expression
     * @throws IllegalArgumentException if a symbol has no binding
     */
    public abstract double evaluate(TObjectDoubleHashMap<String> bindings);

    // Replace every occurrence of the named symbol.
    public ASTNode substitute(String name, ASTNode replacement) {
        ArrayList<ASTNode> newch=null;
        for(int i=0; i<children.size(); i++) {
            ASTNode c=children.get(i);
            ASTNode s=c.substitute(name, replacement);
            if(s!=c && newch==null) {
                newch=new ArrayList<ASTNode>(children.subList(0, i));
            }
            if(newch!=null) {
                newch.add(s);
            }
        }
        if(newch==null) {
            return this;
        }
        return rebuild(newch);
    }

    public ASTNode substitute(String name, double value) {
        return substitute(name, new NumberConstant(value));
    }

    // Names of all symbols occurring in the expression, in order of first occurrence.
    public Set<String> getSymbols() {
        LinkedHashSet<String> s=new LinkedHashSet<String>();
        collectSymbols(s);
        return s;
    }

    void collectSymbols(Set<String> s) {
        for(ASTNode c : children) {
            c.collectSymbols(s);
        }
    }

    // Print a child, adding brackets if it binds less tightly than prec.
    static String childString(ASTNode c, int prec) {
        if(c.precedence()<prec) {
            return "("+c+")";
        }
        return c.toString();
    }

    @Override
    public boolean equals(Object other) {
        if(other==null || other.getClass()!=getClass()) {
            return false;
        }
        return ((ASTNode) other).children.equals(children);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode()*31+children.hashCode();
    }
}

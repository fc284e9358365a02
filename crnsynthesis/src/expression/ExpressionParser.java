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
 * Recursive descent parser for flow expressions.
 *
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/') unary)*
 *   unary   := ('-' | '+') unary | power
 *   power   := primary (('^' | '**') unary)?
 *   primary := number | identifier | '(' expr ')'
 * </pre>
 */
public class ExpressionParser {
    private final String text;
    private int pos;

    private ExpressionParser(String s) {
        text=s;
        pos=0;
    }

    /**
     * Parse a complete expression.
     *
     * @throws IllegalArgumentException if the text is not a well-formed expression
     */
    public static ASTNode parse(String s) {
        ExpressionParser p=new ExpressionParser(s);
        ASTNode e=p.parseExpr();
        p.skipSpace();
        if(p.pos<p.text.length()) {
            throw p.error("Unexpected '"+p.text.charAt(p.pos)+"'");
        }
        return e;
    }

    private ASTNode parseExpr() {
        ArrayList<ASTNode> terms=new ArrayList<ASTNode>();
        terms.add(parseTerm());
        while(true) {
            if(accept('+')) {
                terms.add(parseTerm());
            }
            else if(accept('-')) {
                terms.add(new UnaryMinus(parseTerm()));
            }
            else {
                break;
            }
        }
        return (terms.size()==1) ? terms.get(0) : new Sum(terms);
    }

    private ASTNode parseTerm() {
        ArrayList<ASTNode> factors=new ArrayList<ASTNode>();
        ASTNode left=parseUnary();
        while(true) {
            skipSpace();
            if(peek('*') && !peekPower()) {
                pos++;
                factors.add(left);
                left=parseUnary();
            }
            else if(accept('/')) {
                //  Division binds to the factor on its left only.
                left=new Divide(left, parseUnary());
            }
            else {
                break;
            }
        }
        if(factors.isEmpty()) {
            return left;
        }
        factors.add(left);
        return new Times(factors);
    }

    private ASTNode parseUnary() {
        if(accept('-')) {
            return new UnaryMinus(parseUnary());
        }
        if(accept('+')) {
            return parseUnary();
        }
        return parsePower();
    }

    private ASTNode parsePower() {
        ASTNode base=parsePrimary();
        skipSpace();
        if(peekPower()) {
            pos+=2;
            return new Power(base, parseUnary());
        }
        if(accept('^')) {
            return new Power(base, parseUnary());
        }
        return base;
    }

    private ASTNode parsePrimary() {
        skipSpace();
        if(pos>=text.length()) {
            throw error("Unexpected end of expression");
        }
        char c=text.charAt(pos);
        if(c=='(') {
            pos++;
            ASTNode e=parseExpr();
            if(!accept(')')) {
                throw error("Expected ')'");
            }
            return e;
        }
        if(Character.isDigit(c) || c=='.') {
            return parseNumber();
        }
        if(Character.isLetter(c) || c=='_') {
            int start=pos;
            while(pos<text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos)=='_')) {
                pos++;
            }
            return new Identifier(text.substring(start, pos));
        }
        throw error("Unexpected '"+c+"'");
    }

    private ASTNode parseNumber() {
        int start=pos;
        while(pos<text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos)=='.')) {
            pos++;
        }
        //  Exponent part, e.g. 1.5e-3
        if(pos<text.length() && (text.charAt(pos)=='e' || text.charAt(pos)=='E')) {
            int save=pos;
            pos++;
            if(pos<text.length() && (text.charAt(pos)=='+' || text.charAt(pos)=='-')) {
                pos++;
            }
            if(pos<text.length() && Character.isDigit(text.charAt(pos))) {
                while(pos<text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
            else {
                pos=save;
            }
        }
        String num=text.substring(start, pos);
        try {
            return new NumberConstant(Double.parseDouble(num));
        }
        catch(NumberFormatException e) {
            throw error("Malformed number "+num);
        }
    }

    private void skipSpace() {
        while(pos<text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(char c) {
        return pos<text.length() && text.charAt(pos)==c;
    }

    private boolean peekPower() {
        return text.startsWith("**", pos);
    }

    private boolean accept(char c) {
        skipSpace();
        if(peek(c)) {
            pos++;
            return true;
        }
        return false;
    }

    private IllegalArgumentException error(String msg) {
        return new IllegalArgumentException(msg+" at position "+pos+" in expression: "+text);
    }
}

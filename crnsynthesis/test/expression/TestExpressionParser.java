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

import org.junit.Assert;
import org.junit.Test;

public class TestExpressionParser {
    private static TObjectDoubleHashMap<String> bind(Object... kv) {
        TObjectDoubleHashMap<String> b = new TObjectDoubleHashMap<String>();
        for (int i = 0; i < kv.length; i += 2) {
            b.put((String) kv[i], ((Number) kv[i + 1]).doubleValue());
        }
        return b;
    }

    @Test
    public void precedenceAndAssociativity() {
        TObjectDoubleHashMap<String> none = bind();
        Assert.assertEquals(7.0, ExpressionParser.parse("1 + 2*3").evaluate(none), 0);
        Assert.assertEquals(-1.0, ExpressionParser.parse("1 - 2").evaluate(none), 0);
        Assert.assertEquals(2.0, ExpressionParser.parse("8/2/2").evaluate(none), 0);
        Assert.assertEquals(512.0, ExpressionParser.parse("2^3^2").evaluate(none), 0);
        Assert.assertEquals(-4.0, ExpressionParser.parse("-2**2").evaluate(none), 0);
        Assert.assertEquals(9.0, ExpressionParser.parse("(1 + 2)*3").evaluate(none), 0);
        Assert.assertEquals(0.0015, ExpressionParser.parse("1.5e-3").evaluate(none), 0);
    }

    @Test
    public void substitutionLeavesInputAlone() {
        ASTNode e = ExpressionParser.parse("-k_1*X + k_2*SF");
        ASTNode s = e.substitute("k_1", 0.5);

        Assert.assertEquals(new LinkedHashSet<String>(Arrays.asList("k_1", "X", "k_2", "SF")), e.getSymbols());
        Assert.assertEquals(new LinkedHashSet<String>(Arrays.asList("X", "k_2", "SF")), s.getSymbols());
        Assert.assertEquals(-1.0 + 6.0, s.evaluate(bind("X", 2, "k_2", 3, "SF", 2)), 1e-12);
    }

    @Test
    public void substitutingAbsentSymbolReturnsSameTree() {
        ASTNode e = ExpressionParser.parse("a*b + c");
        Assert.assertSame(e, e.substitute("z", 1.0));
    }

    @Test
    public void printedFormParsesBack() {
        String[] exprs = { "a - b*c", "-(a + b)*c", "a/(b*c)", "(a^b)^c", "-a^2", "a*(-b)" };
        TObjectDoubleHashMap<String> vals = bind("a", 1.5, "b", 2, "c", 3);
        for (String s : exprs) {
            ASTNode e = ExpressionParser.parse(s);
            ASTNode back = ExpressionParser.parse(e.toString());
            Assert.assertEquals(s, e.evaluate(vals), back.evaluate(vals), 1e-12);
        }
    }

    @Test
    public void substitutedNumberPrints() {
        ASTNode e = ExpressionParser.parse("-k_1 * X").substitute("k_1", 0.5);
        Assert.assertEquals("-0.5*X", e.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unboundSymbol() {
        ExpressionParser.parse("k*X").evaluate(bind("X", 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void trailingGarbage() {
        ExpressionParser.parse("k*X )");
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyExpression() {
        ExpressionParser.parse("   ");
    }
}

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

public class TestSolutionAssembler {
    private static Flow decay() {
        Flow f = new Flow();
        f.put("X", "-k_1*X");
        return f;
    }

    @Test
    public void parametersAndInitialConditions() {
        SolverValues v = new SolverValues();
        v.record("k_1", new Interval("0.25", "0.75"));
        v.record("X", new Interval("0.5", "1.5"));

        Solution s = new SolutionAssembler().assemble(decay(), v, Collections.<String>emptyList(), 1);
        Assert.assertEquals(Collections.singletonMap("X", 1.0), s.getInitialConditions());
        Assert.assertEquals("-0.5*X", s.getFlow().get("X").toString());
        Assert.assertEquals("{X: -0.5*X}", s.getFlow().toString());
    }

    @Test
    public void demotedValuesAreStillUsed() {
        SolverValues v = new SolverValues();
        v.record("k_1", new Interval("0.25", "0.75"));
        v.record("k_1", new Interval("1", "2"));
        v.record("X", new Interval("2", "2"));
        Assert.assertFalse(v.getConstantValues().containsKey("k_1"));

        Solution s = new SolutionAssembler().assemble(decay(), v, Collections.<String>emptyList(), 1);
        Assert.assertEquals("-0.5*X", s.getFlow().get("X").toString());
    }

    @Test
    public void scaleFactor() {
        Flow f = new Flow();
        f.put("A", "-k*A*SF");
        f.put("B", "k*A*SF");
        SolverValues v = new SolverValues();
        v.record("k", new Interval("1", "1"));

        Solution s = new SolutionAssembler().assemble(f, v, Collections.<String>emptyList(), 100);
        Assert.assertEquals(Collections.singleton("A"), s.getFlow().get("B").getSymbols());

        TObjectDoubleHashMap<String> b = new TObjectDoubleHashMap<String>();
        b.put("A", 0.5);
        Assert.assertEquals(50.0, s.getFlow().get("B").evaluate(b), 1e-12);

        Solution named = new SolutionAssembler("S").assemble(f, v, Collections.<String>emptyList(), 100);
        Assert.assertTrue(named.getFlow().get("B").getSymbols().contains("SF"));
    }

    @Test
    public void derivativesRemoved() {
        Flow f = decay();
        f.put("dX", "-k_1*dX");
        SolverValues v = new SolverValues();
        v.record("k_1", new Interval("1", "1"));

        Solution s = new SolutionAssembler().assemble(f, v, Arrays.asList("dX", "dY"), 1);
        Assert.assertEquals(Arrays.asList("X"), s.getFlow().getSpecies());
        Assert.assertTrue(s.getInitialConditions().isEmpty());
    }

    @Test
    public void inputFlowUnchanged() {
        Flow f = decay();
        SolverValues v = new SolverValues();
        v.record("k_1", new Interval("1", "1"));
        new SolutionAssembler().assemble(f, v, Arrays.asList("X"), 1);
        Assert.assertEquals("{X: -k_1*X}", f.toString());
    }

    @Test
    public void unresolvedParameterLeftInFlow() {
        Solution s = new SolutionAssembler().assemble(decay(), new SolverValues(), Collections.<String>emptyList(), 1);
        Assert.assertTrue(s.getFlow().get("X").getSymbols().contains("k_1"));
    }
}

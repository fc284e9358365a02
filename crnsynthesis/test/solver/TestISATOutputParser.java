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
import java.io.*;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestISATOutputParser {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static SolverValues parse(String text) throws IOException {
        return new ISATOutputParser().parse(new StringReader(text));
    }

    @Test
    public void repeatedEqualIntervalIsConstant() throws Exception {
        SolverValues v = parse(
            "k_1 (1):\n" +
            "   @0: [0.2,0.4] (width 0.2)\n" +
            "X (1):\n" +
            "   @0: [0.9,1.1] (width 0.2)\n" +
            "k_1 (1):\n" +
            "   @1: [0.2,0.4] (width 0.2)\n");
        Assert.assertEquals(new Interval("0.2", "0.4"), v.getConstantValues().get("k_1"));
        Assert.assertEquals(new Interval("0.2", "0.4"), v.getAllValues().get("k_1"));
    }

    @Test
    public void differingIntervalDemotes() throws Exception {
        SolverValues v = parse(
            "k_1 (1):\n" +
            "   @0: [0.2,0.4] (width 0.2)\n" +
            "k_1 (1):\n" +
            "   @1: [0.5,0.6] (width 0.1)\n");
        Assert.assertFalse(v.getConstantValues().containsKey("k_1"));
        Assert.assertEquals(new Interval("0.2", "0.4"), v.getAllValues().get("k_1"));
    }

    @Test
    public void severalIntervalsUnderOneHeader() throws Exception {
        SolverValues v = parse(
            "X (float):\n" +
            "   @0: [1,1] (point interval)\n" +
            "   @1: [0.05,0.06] (width 0.01)\n");
        Assert.assertFalse(v.getConstantValues().containsKey("X"));
        Assert.assertEquals(new Interval("1", "1"), v.getAllValues().get("X"));
    }

    @Test
    public void timeGoesToTimeSequence() throws Exception {
        SolverValues v = parse(
            "time (float):\n" +
            "   @0: [0,0.25] (width 0.25)\n" +
            "   @1: [0.25,0.75] (width 0.5)\n");
        Assert.assertEquals(Arrays.asList("0.25", "0.75"), v.getTimes());
        Assert.assertFalse(v.getAllValues().containsKey("time"));
    }

    @Test
    public void internalVariablesAreSkipped() throws Exception {
        SolverValues v = parse(
            "solver_aux_3 (float):\n" +
            "   @0: [1,2] (width 1)\n" +
            "mode_trigger (bool):\n" +
            "   @0: [0,1] (width 1)\n" +
            "inputTime (float):\n" +
            "   @0: [0,1] (width 1)\n" +
            "k_2 (float):\n" +
            "   @0: [3,4] (width 1)\n");
        Assert.assertEquals(Collections.singleton("k_2"), v.getAllValues().keySet());
    }

    @Test
    public void intervalBeforeAnyHeaderIgnored() throws Exception {
        SolverValues v = parse(
            "SOLUTION: [0,1] (candidate)\n" +
            "   @0: [0.2,0.4] (width 0.2)\n");
        Assert.assertTrue(v.isEmpty());
    }

    @Test
    public void emptyAndTruncatedOutput() throws Exception {
        Assert.assertTrue(parse("").isEmpty());
        SolverValues v = parse("k_1 (float):\n   @0: [0.2,");
        Assert.assertTrue(v.isEmpty());
    }

    @Test
    public void unsatOutputHasNoValues() throws Exception {
        File f = folder.newFile("bell_5_0.01-isat.txt");
        try (PrintWriter w = new PrintWriter(f)) {
            w.println("iSAT-ODE");
            w.println("Result: UNSATISFIABLE");
        }
        Assert.assertTrue(new ISATOutputParser().parse(f).isEmpty());
    }

    @Test(expected = FileNotFoundException.class)
    public void missingResultFile() throws Exception {
        new ISATOutputParser().parse(new File(folder.getRoot(), "none.txt"));
    }

    @Test
    public void lineClassification() {
        Assert.assertEquals("k_1", ISATOutputParser.headerName("k_1 (float):"));
        Assert.assertNull(ISATOutputParser.headerName("   @0: [0.2,0.4] (width 0.2)"));
        Assert.assertEquals(new Interval("0.2", "0.4"), ISATOutputParser.dataInterval("   @0: [0.2, 0.4] (width 0.2)"));
        Assert.assertNull(ISATOutputParser.dataInterval("Result: SATISFIABLE"));
        Assert.assertTrue(ISATOutputParser.isIgnored("inputTime"));
        Assert.assertFalse(ISATOutputParser.isIgnored("inputTime_2"));
    }
}

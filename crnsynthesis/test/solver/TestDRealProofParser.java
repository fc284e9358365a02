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
import org.junit.Test;

public class TestDRealProofParser {
    private static SolverValues parse(String text) throws IOException {
        return new DRealProofParser().parse(new StringReader(text));
    }

    @Test
    public void indicesAreStripped() throws Exception {
        SolverValues v = parse(
            "SAT with the following box:\n" +
            "\tk_1_0_0 : [0.2, 0.4];\n" +
            "\tk_1_0_1 : [0.2, 0.4];\n" +
            "\tX_0_0 : [1, 1];\n" +
            "\tX_0_1 : [0.55, 0.6];\n");
        Assert.assertEquals(new Interval("0.2", "0.4"), v.getConstantValues().get("k_1"));
        Assert.assertEquals(new Interval("1", "1"), v.getAllValues().get("X"));
        Assert.assertFalse(v.getConstantValues().containsKey("X"));
    }

    @Test
    public void transitionTimes() throws Exception {
        SolverValues v = parse(
            "\ttime_0 : [0, 0.5];\n" +
            "\ttime_1 : [0, 0.25];\n");
        Assert.assertEquals(Arrays.asList("0.5", "0.25"), v.getTimes());
        Assert.assertTrue(v.getAllValues().isEmpty());
    }

    @Test
    public void modeAndInputTimeSkipped() throws Exception {
        SolverValues v = parse(
            "\tmode_1_0_0 : [1, 1];\n" +
            "\tinputTime_0_0 : [0, 1];\n" +
            "\tmode_2_1_0 : [0, 0];\n" +
            "\tk_3_0_0 : [-1.5e-2, +2.0E1];\n");
        Assert.assertEquals(Collections.singleton("k_3"), v.getAllValues().keySet());
        Assert.assertEquals(new Interval("-1.5e-2", "+2.0E1"), v.getAllValues().get("k_3"));
    }

    @Test
    public void openBracketsAndSpaces() throws Exception {
        SolverValues v = parse("  rate_0_0 : (0.1, 0.3)\n");
        Assert.assertEquals(new Interval("0.1", "0.3"), v.getAllValues().get("rate"));
    }

    @Test
    public void unrelatedLinesIgnored() throws Exception {
        Assert.assertTrue(parse("unsat\n").isEmpty());
        Assert.assertTrue(parse("").isEmpty());
        Assert.assertTrue(parse("k_1_0_0 : [a, b]\n").isEmpty());
    }
}

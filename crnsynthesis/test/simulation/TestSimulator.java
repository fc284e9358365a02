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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestSimulator {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Map<String, Double> state(Object... nameValue) {
        LinkedHashMap<String, Double> m = new LinkedHashMap<String, Double>();
        for (int i = 0; i < nameValue.length; i += 2) {
            m.put((String) nameValue[i], ((Number) nameValue[i + 1]).doubleValue());
        }
        return m;
    }

    @Test
    public void exponentialDecay() {
        Flow f = new Flow();
        f.put("X", "-0.5*X");
        double[] t = Simulator.linspace(0, 4, 41);
        Trajectory tr = new Simulator().simulate(state("X", 1), f, t);
        double[] x = tr.getColumn("X");
        for (int i = 0; i < t.length; i++) {
            Assert.assertEquals(Math.exp(-0.5 * t[i]), x[i], 1e-7);
        }
    }

    @Test
    public void massIsConserved() {
        Flow f = new Flow();
        f.put("A", "-2*A");
        f.put("B", "2*A");
        Trajectory tr = new Simulator().simulate(state("A", 0.75, "B", 0.25), f, Simulator.linspace(0, 3, 31));
        double[] a = tr.getColumn("A");
        double[] b = tr.getColumn("B");
        for (int i = 0; i < a.length; i++) {
            Assert.assertEquals(1.0, a[i] + b[i], 1e-9);
        }
        Assert.assertEquals(0.75 * Math.exp(-6), a[a.length - 1], 1e-7);
    }

    @Test
    public void timeIsVisibleToTheFlow() {
        Flow f = new Flow();
        f.put("X", "time");
        Trajectory tr = new Simulator().simulate(state("X", 0), f, new double[] { 0, 1, 2 });
        Assert.assertArrayEquals(new double[] { 0, 0.5, 2.0 }, tr.getColumn("X"), 1e-9);
    }

    @Test
    public void firstRowIsInitialState() {
        Flow f = new Flow();
        f.put("Y", "Y*Y");
        f.put("X", "-X");
        Trajectory tr = new Simulator().simulate(state("X", 3, "Y", 0.1), f, new double[] { 0 });
        Assert.assertEquals(1, tr.numPoints());
        Assert.assertEquals(Arrays.asList("Y", "X"), tr.getVariableNames());
        Assert.assertArrayEquals(new double[] { 0.1, 3 }, tr.getStates()[0], 0);
    }

    @Test
    public void repeatedTimePoint() {
        Flow f = new Flow();
        f.put("X", "-X");
        Trajectory tr = new Simulator().simulate(state("X", 1), f, new double[] { 0, 1, 1 });
        double[] x = tr.getColumn("X");
        Assert.assertEquals(x[1], x[2], 0);
    }

    @Test
    public void defaultGrid() {
        Flow f = new Flow();
        f.put("X", "0");
        Trajectory tr = new Simulator().simulate(state("X", 2), f);
        Assert.assertEquals(100, tr.numPoints());
        Assert.assertEquals(1.0, tr.getTimes()[99], 0);
        Assert.assertEquals(2.0, tr.getColumn("X")[99], 0);
    }

    @Test
    public void solutionSimulation() {
        Flow f = new Flow();
        f.put("X", "-X");
        LinkedHashMap<String, Double> ic = new LinkedHashMap<String, Double>();
        ic.put("X", 1.0);
        Trajectory tr = new Simulator().simulate(new Solution(ic, f), new double[] { 0, 1 });
        Assert.assertEquals(Math.exp(-1), tr.getColumn("X")[1], 1e-7);
    }

    @Test(expected = NoSuchElementException.class)
    public void missingInitialCondition() {
        Flow f = new Flow();
        f.put("X", "-X");
        f.put("Y", "X");
        new Simulator().simulate(state("X", 1), f, new double[] { 0, 1 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void decreasingGrid() {
        Flow f = new Flow();
        f.put("X", "-X");
        new Simulator().simulate(state("X", 1), f, new double[] { 0, 1, 0.5 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void unboundParameter() {
        Flow f = new Flow();
        f.put("X", "-k*X");
        new Simulator().simulate(state("X", 1), f, new double[] { 0, 1 });
    }

    @Test(expected = NoSuchElementException.class)
    public void unknownColumn() {
        Flow f = new Flow();
        f.put("X", "0");
        new Simulator().simulate(state("X", 1), f, new double[] { 0 }).getColumn("Z");
    }

    @Test
    public void csvHasOneLinePerTimePoint() throws IOException {
        Flow f = new Flow();
        f.put("A", "0");
        f.put("B", "1");
        Trajectory tr = new Simulator().simulate(state("A", 1, "B", 0), f, new double[] { 0, 2 });
        File csv = folder.newFile("out.csv");
        tr.writeCSV(csv);
        List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals(2, lines.size());
        Assert.assertEquals("1.0,0.0", lines.get(0));
        String[] last = lines.get(1).split(",");
        Assert.assertEquals(2, last.length);
        Assert.assertEquals(1.0, Double.parseDouble(last[0]), 0);
        Assert.assertEquals(2.0, Double.parseDouble(last[1]), 1e-12);
    }

    @Test
    public void linspace() {
        Assert.assertArrayEquals(new double[] { 0, 0.25, 0.5, 0.75, 1 }, Simulator.linspace(0, 1, 5), 1e-15);
        Assert.assertArrayEquals(new double[] { 3 }, Simulator.linspace(3, 5, 1), 0);
        Assert.assertEquals(0, Simulator.linspace(0, 1, 0).length);
    }
}

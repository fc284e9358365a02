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

/**
 * Settings for one synthesis run. Immutable.
 */
public final class SolverConfig {
    public static final double DEFAULT_PRECISION=0.01;
    public static final int DEFAULT_MAX_DEPTH=2;

    private final Backend backend;
    private final String solverPath;
    private final double precision;
    private final double msw;
    private final int maxDepth;
    private final List<String> extraFlags;
    private final File workingDirectory;

    /**
     * @param backend which solver is driven
     * @param solverPath path of the solver binary
     * @param precision precision passed to the solver (iSAT --prabs, dReach --precision)
     * @param msw minimum splitting width for iSAT; 0 means precision*5. Ignored by dReach.
     * @param maxDepth maximum unrolling depth, normally the number of modes
     * @param extraFlags further flags appended to the command line
     * @param workingDirectory directory the solver runs in
     */
    public SolverConfig(Backend backend, String solverPath, double precision, double msw, int maxDepth,
        List<String> extraFlags, File workingDirectory) {
        if(precision<=0) {
            throw new IllegalArgumentException("Precision must be positive: "+precision);
        }
        if(msw<0) {
            throw new IllegalArgumentException("Minimum splitting width must not be negative: "+msw);
        }
        if(maxDepth<1) {
            throw new IllegalArgumentException("Maximum depth must be a positive integer: "+maxDepth);
        }
        this.backend=backend;
        this.solverPath=solverPath;
        this.precision=precision;
        this.msw=msw;
        this.maxDepth=maxDepth;
        this.extraFlags=Collections.unmodifiableList(new ArrayList<String>(extraFlags));
        this.workingDirectory=workingDirectory;
    }

    public SolverConfig(Backend backend, String solverPath) {
        this(backend, solverPath, DEFAULT_PRECISION, 0, DEFAULT_MAX_DEPTH, backend.getDefaultExtraFlags(),
            new File(System.getProperty("user.dir")));
    }

    public Backend getBackend() {
        return backend;
    }
    public String getSolverPath() {
        return solverPath;
    }
    public double getPrecision() {
        return precision;
    }
    public double getMinSplitWidth() {
        if(msw==0) {
            return precision*5;
        }
        return msw;
    }
    public int getMaxDepth() {
        return maxDepth;
    }
    public List<String> getExtraFlags() {
        return extraFlags;
    }
    public File getWorkingDirectory() {
        return workingDirectory;
    }

    public SolverConfig withWorkingDirectory(File dir) {
        return new SolverConfig(backend, solverPath, precision, msw, maxDepth, extraFlags, dir);
    }

    public String toString() {
        return backend+" "+solverPath+" precision="+CmdFlags.formatNumber(precision)
            +" msw="+CmdFlags.formatNumber(getMinSplitWidth())+" max-depth="+maxDepth
            +" flags="+extraFlags;
    }
}

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
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * A solver input file (.hys for iSAT, .drh for dReach) whose cost bound is
 * edited in place between solver calls.
 *
 * <p>Every edit reads and rewrites the whole file. Callers that edit the file
 * and then run the solver on it must hold {@link #getLock()} for the pair of
 * operations.
 */
public class ModelFile {
    private static final Pattern MAX_COST=Pattern.compile("\\bdefine\\s+MAX_COST\\b");
    private static final Pattern NO_COST_LIMIT=Pattern.compile("\\bdefine\\s+NO_COST_LIMIT\\b");

    //  One lock object per model file, keyed by canonical path.
    private static final ConcurrentHashMap<String, Object> locks=new ConcurrentHashMap<String, Object>();

    private final File path;
    private final String modelName;
    private final File resultsDir;

    public ModelFile(File path) {
        this.path=path;
        String filename=path.getName();
        int dot=filename.lastIndexOf('.');
        modelName=(dot>0) ? filename.substring(0, dot) : filename;
        File dir=path.getAbsoluteFile().getParentFile();
        resultsDir=new File(dir, "results");
    }

    public ModelFile(String path) {
        this(new File(path));
    }

    public File getPath() {
        return path;
    }

    // File name without extension.
    public String getModelName() {
        return modelName;
    }

    public File getResultsDir() {
        return resultsDir;
    }

    // Create the results directory if it is not already there.
    public File createResultsDir() throws IOException {
        if(!resultsDir.isDirectory() && !resultsDir.mkdirs() && !resultsDir.isDirectory()) {
            throw new IOException("Could not create results directory "+resultsDir);
        }
        return resultsDir;
    }

    public Object getLock() throws IOException {
        String key=path.getCanonicalPath();
        locks.putIfAbsent(key, new Object());
        return locks.get(key);
    }

    /**
     * Rewrite the MAX_COST and NO_COST_LIMIT declarations. A cost of 0 switches
     * the cost limit off. All other lines are written back unchanged.
     */
    public void setCostBound(double cost, Backend backend) throws IOException {
        String contents=new String(Files.readAllBytes(path.toPath()), StandardCharsets.UTF_8);
        String[] lines=contents.split("\n", -1);

        String costString=CmdFlags.formatNumber(cost);
        int edited=0;
        for(int i=0; i<lines.length; i++) {
            if(MAX_COST.matcher(lines[i]).find()) {
                lines[i]=backend.costBoundLine(costString);
                edited++;
            }
            else if(NO_COST_LIMIT.matcher(lines[i]).find()) {
                lines[i]=backend.noCostLimitLine(cost==0);
                edited++;
            }
        }

        if(edited==0) {
            CmdFlags.warning("No cost bound declarations found in "+path);
        }

        Files.write(path.toPath(), String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    public String toString() {
        return path.getPath();
    }
}

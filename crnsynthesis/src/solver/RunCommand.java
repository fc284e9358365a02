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

public class RunCommand {
    // Run command in workingDir, sending standard output to outfile and
    // discarding standard error. Blocks until the process exits and returns
    // its exit value.
    public static int runCommand(List<String> command, File workingDir, File outfile) throws IOException, InterruptedException {
        ProcessBuilder pb=new ProcessBuilder(command);
        pb.directory(workingDir);
        pb.redirectOutput(outfile);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process=pb.start();
        try {
            return process.waitFor();
        }
        catch(InterruptedException e) {
            //  Do not leave the solver running behind us.
            process.destroy();
            throw e;
        }
    }
}

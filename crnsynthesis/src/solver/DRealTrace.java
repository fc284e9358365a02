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

import com.google.gson.annotations.SerializedName;

/**
 * Gson binding of the JSON trace document written by dReach --visualize.
 * Fields not listed here (e.g. the time of each value) are ignored.
 */
public class DRealTrace {
    @SerializedName("traces")
    public List<List<Entry>> traces;

    public static class Entry {
        @SerializedName("key")    public String key;
        @SerializedName("values") public List<Value> values;
    }

    public static class Value {
        //  Bounds are read as text, as printed by the solver.
        @SerializedName("enclosure") public List<String> enclosure;
    }
}

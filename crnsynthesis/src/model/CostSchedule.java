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
import java.math.BigDecimal;

//  Cost bounds from maxCost down to minCost inclusive in steps of 1.
//  Empty when maxCost < minCost.

public class CostSchedule implements Iterable<Double> {
    private final double maxCost;
    private final double minCost;

    public CostSchedule(double maxCost, double minCost) {
        this.maxCost=maxCost;
        this.minCost=minCost;
    }

    // A schedule with the single cost value c.
    public static CostSchedule single(double c) {
        return new CostSchedule(c, c);
    }

    public double getMaxCost() {
        return maxCost;
    }
    public double getMinCost() {
        return minCost;
    }

    public ArrayList<Double> getCosts() {
        ArrayList<Double> costs=new ArrayList<Double>();
        //  BigDecimal so that non-integer costs do not drift.
        BigDecimal cost=BigDecimal.valueOf(maxCost);
        BigDecimal min=BigDecimal.valueOf(minCost);
        while(cost.compareTo(min)>=0) {
            costs.add(cost.doubleValue());
            cost=cost.subtract(BigDecimal.ONE);
        }
        return costs;
    }

    public int size() {
        return getCosts().size();
    }

    public Iterator<Double> iterator() {
        return getCosts().iterator();
    }

    public String toString() {
        return CmdFlags.formatNumber(maxCost)+".."+CmdFlags.formatNumber(minCost);
    }
}

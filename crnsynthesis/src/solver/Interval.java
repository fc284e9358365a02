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

//  Bounds reported by a solver for one variable. The bounds are kept as the
//  text the solver printed and only converted when a number is needed.

public final class Interval {
    private final String low;
    private final String high;

    public Interval(String low, String high) {
        this.low=low.trim();
        this.high=high.trim();
    }

    public String getLow() {
        return low;
    }
    public String getHigh() {
        return high;
    }

    public double lowerBound() {
        return Double.parseDouble(low);
    }
    public double upperBound() {
        return Double.parseDouble(high);
    }

    public double midpoint() {
        return (lowerBound()+upperBound())/2;
    }

    //  Textual comparison: "0.5" and "0.50" are different intervals.
    @Override
    public boolean equals(Object other) {
        if (! (other instanceof Interval)) {
            return false;
        }
        Interval i=(Interval) other;
        return i.low.equals(low) && i.high.equals(high);
    }

    @Override
    public int hashCode() {
        return low.hashCode()*31+high.hashCode();
    }

    public String toString() {
        return "["+low+", "+high+"]";
    }
}

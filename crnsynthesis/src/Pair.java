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

public class Pair<A, B> {
    private A first;
    private B second;

    public Pair(A first, B second) {
        this.first = first;
        this.second = second;
    }

    public A getFirst() {
        return first;
    }
    public B getSecond() {
        return second;
    }

    @Override
    public boolean equals(Object other) {
        if (! (other instanceof Pair)) {
            return false;
        }
        Pair<?, ?> p = (Pair<?, ?>) other;
        return (first==null ? p.first==null : first.equals(p.first))
            && (second==null ? p.second==null : second.equals(p.second));
    }

    @Override
    public int hashCode() {
        return 31*(first==null ? 0 : first.hashCode()) + (second==null ? 0 : second.hashCode());
    }

    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.util.Tuples;

/**
 * Pairwise compatibility test between two cage assignments.
 */
public final class ConstraintEvaluator {

    /**
     * Tuple value matching any other value, see {@link #wildcard(Cage)}.
     */
    public static final int ANY = -1;

    private ConstraintEvaluator() {}

    /**
     * Two cage assignments conflict when some member of {@code a} and some member of {@code b}
     * are in the same row or in the same column (but not both) and receive the same value.
     * Positions holding {@link #ANY} are equal to every value.
     *
     * @param a first cage
     * @param ta values of the members of a, in member order
     * @param b second cage, possibly a itself
     * @param tb values of the members of b, in member order
     * @return true if the two assignments conflict
     */
    public static boolean conflicting(Cage a, int[] ta, Cage b, int[] tb) {
        if (ta.length != a.size() || tb.length != b.size())
            throw new IllegalArgumentException("tuple length does not match cage size");
        for (int i = 0; i < a.size(); i++) {
            Cell ma = a.member(i);
            for (int j = 0; j < b.size(); j++) {
                if (ma.sharesRowXorColumn(b.member(j)) && sameValue(ta[i], tb[j]))
                    return true;
            }
        }
        return false;
    }

    /**
     * @return a tuple that conflicts with anything sharing a row or column with the cage
     */
    public static int[] wildcard(Cage cage) {
        return Tuples.filled(cage.size(), ANY);
    }

    private static boolean sameValue(int u, int v) {
        return u == v || u == ANY || v == ANY;
    }
}

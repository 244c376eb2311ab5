/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.util.Tuples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Computes the admissible value tuples of each cage.
 * A tuple of {@code [1,size]^|cage|} is kept when
 * <ul>
 *     <li>no two members of the cage sharing a row or a column get the same value</li>
 *     <li>some ordering of its values folds to the target under the cage operator</li>
 * </ul>
 * The candidates are enumerated exhaustively, which is only practical for small cages.
 * An empty domain is a legitimate outcome: the puzzle is then unsatisfiable.
 */
public final class DomainBuilder {

    private DomainBuilder() {}

    public static Map<Cage, List<int[]>> build(Puzzle puzzle) {
        Map<Cage, List<int[]>> domains = new LinkedHashMap<>();
        for (Cage cage : puzzle.cages()) {
            domains.put(cage, Collections.unmodifiableList(domain(puzzle.size(), cage)));
        }
        return Collections.unmodifiableMap(domains);
    }

    /**
     * @return the tuples of the cage, in lexicographic order
     */
    public static List<int[]> domain(int size, Cage cage) {
        List<int[]> domain = new ArrayList<>();
        Tuples.product(cage.size(), 1, size, t -> {
            if (!ConstraintEvaluator.conflicting(cage, t, cage, t) && satisfies(t, cage.operator(), cage.target()))
                domain.add(t.clone());
        });
        return domain;
    }

    /**
     * @return true if folding op over some permutation of values gives exactly target
     */
    public static boolean satisfies(int[] values, Operator op, int target) {
        if (op.isCommutative())
            return matches(op.fold(values), target);
        int[] p = values.clone();
        java.util.Arrays.sort(p);
        do {
            if (matches(op.fold(p), target))
                return true;
        } while (Tuples.nextPermutation(p));
        return false;
    }

    private static boolean matches(OptionalLong result, int target) {
        return result.isPresent() && result.getAsLong() == target;
    }
}

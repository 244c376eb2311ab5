/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.util.HashMultimap;

import java.util.List;

/**
 * Builds the neighbor relation between cages: two distinct cages are neighbors
 * when some of their members share a row or a column, that is when some assignment
 * of them could conflict. The relation only depends on the geometry of the cages.
 */
public final class ConflictGraphBuilder {

    private ConflictGraphBuilder() {}

    /**
     * @return a symmetric and irreflexive relation; every cage is a key, possibly without neighbor
     */
    public static HashMultimap<Cage, Cage> build(List<Cage> cages) {
        HashMultimap<Cage, Cage> neighbors = new HashMultimap<>();
        for (Cage cage : cages)
            neighbors.putKey(cage);
        for (int i = 0; i < cages.size(); i++) {
            Cage a = cages.get(i);
            for (int j = i + 1; j < cages.size(); j++) {
                Cage b = cages.get(j);
                if (ConstraintEvaluator.conflicting(a, ConstraintEvaluator.wildcard(a), b, ConstraintEvaluator.wildcard(b))) {
                    neighbors.put(a, b);
                    neighbors.put(b, a);
                }
            }
        }
        return neighbors;
    }
}

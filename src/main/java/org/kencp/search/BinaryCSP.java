/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

import java.util.List;
import java.util.Set;

/**
 * A constraint satisfaction problem with table domains and one binary constraint.
 * Each variable takes one tuple of its domain; two neighbor variables must take
 * compatible tuples.
 * Implementations are read-only: searches keep their own state.
 *
 * @param <V> the variable type
 */
public interface BinaryCSP<V> {

    /**
     * @return the variables, in a fixed order
     */
    List<V> variables();

    /**
     * @return the initial domain of the variable
     */
    List<int[]> domain(V var);

    /**
     * @return the variables that share a constraint with var, never var itself
     */
    Set<V> neighbors(V var);

    /**
     * @return true if var a taking ta and var b taking tb do not violate the constraint
     */
    boolean compatible(V a, int[] ta, V b, int[] tb);
}

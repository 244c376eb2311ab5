/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

public enum VariableOrdering {
    /**
     * First unassigned variable in declaration order.
     */
    STATIC,
    /**
     * Unassigned variable with the fewest remaining tuples, ties broken by declaration order.
     */
    FIRST_FAIL
}

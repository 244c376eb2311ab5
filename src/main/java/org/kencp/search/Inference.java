/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

/**
 * Filtering performed by {@link BacktrackingSearch} after each assignment.
 */
public enum Inference {
    /**
     * Plain backtracking: a value is only checked against the assigned neighbors.
     */
    NONE,
    /**
     * Removes from the domain of each unassigned neighbor the tuples incompatible with the new assignment.
     */
    FORWARD_CHECKING,
    /**
     * Maintains arc consistency (AC-3) from the assigned variable.
     */
    MAC
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.List;

/**
 * Unvalidated cage, as exchanged with the outside world.
 *
 * @param members cells, possibly repeated or out of the board
 * @param operator one of {@code + - * / .} for a legal cage
 * @param target the value the operator must produce
 */
public record CageDescription(List<Cell> members, String operator, int target) {

    public CageDescription {
        members = List.copyOf(members);
    }

    @Override
    public String toString() {
        return "(" + members + ", '" + operator + "', " + target + ")";
    }
}

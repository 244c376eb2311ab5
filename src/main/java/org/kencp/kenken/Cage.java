/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.List;

/**
 * A set of cells bound by one arithmetic rule.
 * The order of {@code members} is fixed once and indexes every tuple of the cage domain.
 *
 * @param members the distinct cells of the cage
 * @param operator the rule
 * @param target the value the rule must produce
 */
public record Cage(List<Cell> members, Operator operator, int target) {

    public Cage {
        members = List.copyOf(members);
        if (members.isEmpty())
            throw new IllegalArgumentException("a cage has at least one member");
    }

    public int size() {
        return members.size();
    }

    public Cell member(int i) {
        return members.get(i);
    }

    /**
     * @return the first cell of the cage in row-major order
     */
    public Cell anchor() {
        return members.stream().min(Cell.ROW_MAJOR).get();
    }

    /**
     * @return the label displayed on the anchor cell, e.g. {@code "6 +"} or {@code "3"}
     */
    public String annotation() {
        return operator == Operator.NONE ? String.valueOf(target) : target + " " + operator.symbol();
    }

    public CageDescription toDescription() {
        return new CageDescription(members, operator.symbol(), target);
    }

    @Override
    public String toString() {
        return members + " " + annotation();
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.Comparator;

/**
 * A grid position, 1-indexed: {@code x} is the column, {@code y} the row.
 * Cells are ordered row-major.
 */
public record Cell(int x, int y) implements Comparable<Cell> {

    public static final Comparator<Cell> ROW_MAJOR = Comparator.comparingInt(Cell::y).thenComparingInt(Cell::x);

    /**
     * @return true if other differs by exactly one in exactly one coordinate
     */
    public boolean isAdjacent(Cell other) {
        int dx = Math.abs(x - other.x);
        int dy = Math.abs(y - other.y);
        return (dx == 0 && dy == 1) || (dy == 0 && dx == 1);
    }

    /**
     * @return true if both cells are in the same row or in the same column, but not both.
     *         A cell never shares a line with itself in that sense.
     */
    public boolean sharesRowXorColumn(Cell other) {
        return (x == other.x) != (y == other.y);
    }

    public boolean isInside(int size) {
        return x >= 1 && x <= size && y >= 1 && y <= size;
    }

    @Override
    public int compareTo(Cell o) {
        return ROW_MAJOR.compare(this, o);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}

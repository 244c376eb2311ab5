/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.kencp.kenken.Cell;

/**
 * Values of a full {@code size x size} board, used as scratch during generation.
 */
public class Grid {

    private final int size;
    // values[y-1][x-1]
    private final int[][] values;

    Grid(int[][] values) {
        this.size = values.length;
        this.values = new int[size][];
        for (int r = 0; r < size; r++) {
            if (values[r].length != size)
                throw new IllegalArgumentException("grid must be square");
            this.values[r] = values[r].clone();
        }
    }

    /**
     * @param rows the values, {@code rows[y-1][x-1]} is the value of cell (x,y)
     */
    public static Grid of(int[][] rows) {
        return new Grid(rows);
    }

    public int size() {
        return size;
    }

    public int get(Cell c) {
        return values[c.y() - 1][c.x() - 1];
    }

    /**
     * @return true if every row and every column is a permutation of 1..size
     */
    public boolean isLatinSquare() {
        for (int i = 0; i < size; i++) {
            boolean[] inRow = new boolean[size + 1];
            boolean[] inCol = new boolean[size + 1];
            for (int j = 0; j < size; j++) {
                int r = values[i][j];
                int c = values[j][i];
                if (r < 1 || r > size || inRow[r] || c < 1 || c > size || inCol[c])
                    return false;
                inRow[r] = true;
                inCol[c] = true;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] row : values)
            sb.append(java.util.Arrays.toString(row)).append("\n");
        return sb.toString();
    }
}

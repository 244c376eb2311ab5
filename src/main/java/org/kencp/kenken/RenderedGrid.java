/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.List;

/**
 * A rendered board, row by row. Row {@code i} holds the cells of {@code y = i + 1}.
 */
public record RenderedGrid(int size, List<List<RenderedCell>> rows) {

    public RenderedGrid {
        rows = rows.stream().map(List::copyOf).toList();
    }

    public RenderedCell cell(Cell c) {
        return rows.get(c.y() - 1).get(c.x() - 1);
    }

    /**
     * Draws the board with cage walls. Each cell is two lines high: the annotation, then the value.
     * <pre>
     * +-----+-----+
     * |3 -  |1    |
     * |  2  |  1  |
     * +     +-----+
     * </pre>
     */
    public String toText() {
        int width = 2;
        for (List<RenderedCell> row : rows)
            for (RenderedCell rc : row) {
                width = Math.max(width, rc.annotation().map(String::length).orElse(0));
                width = Math.max(width, rc.value().map(v -> String.valueOf(v).length()).orElse(0));
            }
        width += 2;
        String dashes = "-".repeat(width);
        String blanks = " ".repeat(width);

        StringBuilder sb = new StringBuilder();
        sb.append("+");
        for (int x = 0; x < size; x++)
            sb.append(dashes).append("+");
        sb.append("\n");
        for (List<RenderedCell> row : rows) {
            StringBuilder top = new StringBuilder("|");
            StringBuilder mid = new StringBuilder("|");
            StringBuilder bottom = new StringBuilder("+");
            for (RenderedCell rc : row) {
                String wall = rc.wallRight() ? "|" : " ";
                top.append(pad(rc.annotation().orElse(""), width, false)).append(wall);
                mid.append(pad(rc.value().map(String::valueOf).orElse(""), width, true)).append(wall);
                bottom.append(rc.wallBelow() ? dashes : blanks).append("+");
            }
            sb.append(top).append("\n").append(mid).append("\n").append(bottom).append("\n");
        }
        return sb.toString();
    }

    private static String pad(String s, int width, boolean center) {
        int left = center ? (width - s.length()) / 2 : 0;
        return " ".repeat(left) + s + " ".repeat(width - s.length() - left);
    }

    @Override
    public String toString() {
        return toText();
    }
}

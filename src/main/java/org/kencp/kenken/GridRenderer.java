/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.search.Assignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Projects a (possibly partial or absent) assignment of the cages onto the cells of the board.
 */
public final class GridRenderer {

    private GridRenderer() {}

    /**
     * @param model the compiled puzzle
     * @param assignment the cage values, null renders a blank board with the cage annotations only
     */
    public static RenderedGrid render(KenKenModel model, Assignment<Cage> assignment) {
        Assignment<Cage> values = assignment == null ? new Assignment<>() : assignment;
        int n = model.size();
        List<List<RenderedCell>> rows = new ArrayList<>(n);
        for (int y = 1; y <= n; y++) {
            List<RenderedCell> row = new ArrayList<>(n);
            for (int x = 1; x <= n; x++) {
                Cell cell = new Cell(x, y);
                Cage cage = model.cageOf(cell);
                Optional<String> annotation = cage.anchor().equals(cell) ? Optional.of(cage.annotation()) : Optional.empty();
                boolean wallRight = x == n || !model.cageOf(new Cell(x + 1, y)).equals(cage);
                boolean wallBelow = y == n || !model.cageOf(new Cell(x, y + 1)).equals(cage);
                row.add(new RenderedCell(cell, cage, model.valueOf(cell, values), annotation, wallRight, wallBelow));
            }
            rows.add(row);
        }
        return new RenderedGrid(n, rows);
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.List;

/**
 * A structurally valid KenKen board: the cages partition the {@code size x size} cells.
 * Instances come from the generator or from {@link PuzzleValidator}.
 */
public record Puzzle(int size, List<Cage> cages) {

    public Puzzle {
        cages = List.copyOf(cages);
    }

    public PuzzleDescription toDescription() {
        return new PuzzleDescription(size, cages.stream().map(Cage::toDescription).toList());
    }
}

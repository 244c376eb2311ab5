/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.List;

/**
 * Unvalidated puzzle: a board size and an ordered list of cages.
 * {@link PuzzleValidator} turns it into a {@link Puzzle}.
 */
public record PuzzleDescription(int size, List<CageDescription> cages) {

    public PuzzleDescription {
        cages = List.copyOf(cages);
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.kencp.kenken.Puzzle;

/**
 * A generated puzzle together with the Latin square it was carved from,
 * which is one of its solutions.
 */
public record GeneratedPuzzle(Puzzle puzzle, Grid grid) {
}

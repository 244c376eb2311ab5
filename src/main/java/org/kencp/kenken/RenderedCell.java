/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import java.util.Optional;

/**
 * Display data of one cell.
 *
 * @param cell the position
 * @param cage the owning cage
 * @param value the assigned value, empty when the cage is unassigned
 * @param annotation target and operator glyph, only on the first cell of the cage
 * @param wallRight true if the right neighbor belongs to another cage or this is the last column
 * @param wallBelow true if the neighbor below belongs to another cage or this is the last row
 */
public record RenderedCell(Cell cell, Cage cage, Optional<Integer> value, Optional<String> annotation,
                           boolean wallRight, boolean wallBelow) {
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

import org.kencp.kenken.CageDescription;
import org.kencp.kenken.Cell;

import java.util.List;

public class CellOutOfBoundsException extends InvalidPuzzleException {

    public CellOutOfBoundsException(CageDescription cage, List<Cell> cells, int size) {
        super(ErrorKind.CELL_OUT_OF_BOUNDS, cage, cells,
                "Members " + cells + " of cage " + cage + " are out of bounds for size " + size);
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

import org.kencp.kenken.Cell;

import java.util.List;

public class IncompleteCoverageException extends InvalidPuzzleException {

    public IncompleteCoverageException(List<Cell> cells) {
        super(ErrorKind.INCOMPLETE_COVERAGE, null, cells,
                "Positions " + cells + " are not mentioned in any cage");
    }
}

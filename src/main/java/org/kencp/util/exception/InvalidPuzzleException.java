/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

import org.kencp.kenken.CageDescription;
import org.kencp.kenken.Cell;

import java.util.List;
import java.util.Optional;

/**
 * Raised when a puzzle description does not describe a valid KenKen board.
 * The input cannot be repaired, the caller has to supply a corrected one.
 */
public abstract class InvalidPuzzleException extends RuntimeException {

    private final ErrorKind kind;
    private final CageDescription cage;
    private final List<Cell> cells;

    protected InvalidPuzzleException(ErrorKind kind, CageDescription cage, List<Cell> cells, String message) {
        super(message);
        this.kind = kind;
        this.cage = cage;
        this.cells = List.copyOf(cells);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the offending cage, empty when the error concerns the whole board
     */
    public Optional<CageDescription> cage() {
        return Optional.ofNullable(cage);
    }

    /**
     * @return the offending cells, in row-major order
     */
    public List<Cell> cells() {
        return cells;
    }
}

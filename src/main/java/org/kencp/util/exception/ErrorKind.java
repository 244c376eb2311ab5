/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

/**
 * The ways a puzzle description can be structurally broken.
 */
public enum ErrorKind {
    INVALID_OPERATOR,
    CELL_OUT_OF_BOUNDS,
    DUPLICATE_MEMBERSHIP,
    INCOMPLETE_COVERAGE
}

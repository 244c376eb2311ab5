/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

import org.kencp.kenken.CageDescription;

import java.util.List;

public class InvalidOperatorException extends InvalidPuzzleException {

    public InvalidOperatorException(CageDescription cage) {
        super(ErrorKind.INVALID_OPERATOR, cage, List.of(),
                "Operation " + cage.operator() + " of cage " + cage + " is unacceptable");
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util.exception;

import org.kencp.kenken.CageDescription;
import org.kencp.kenken.Cell;

import java.util.List;

public class DuplicateMembershipException extends InvalidPuzzleException {

    public DuplicateMembershipException(CageDescription cage, List<Cell> cells) {
        super(ErrorKind.DUPLICATE_MEMBERSHIP, cage, cells,
                "Members " + cells + " of cage " + cage + " already belong to another cage");
    }
}

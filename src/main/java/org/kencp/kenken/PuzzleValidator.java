/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.util.exception.CellOutOfBoundsException;
import org.kencp.util.exception.DuplicateMembershipException;
import org.kencp.util.exception.IncompleteCoverageException;
import org.kencp.util.exception.InvalidOperatorException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks the integrity of a puzzle description as a KenKen board.
 * For each cage, in order:
 * <ul>
 *     <li>duplicate members are removed (first occurrence kept)</li>
 *     <li>the operator must be one of {@code + - * / .}</li>
 *     <li>every member must lie on the board</li>
 *     <li>no member may belong to a previous cage</li>
 * </ul>
 * Then the cages must cover the whole board.
 * Validation stops at the first violation.
 */
public final class PuzzleValidator {

    private PuzzleValidator() {}

    /**
     * @param description the board to check
     * @return the board with deduplicated cages
     * @throws InvalidOperatorException if a cage uses an unknown operator
     * @throws CellOutOfBoundsException if a cage has a member outside {@code [1,size]^2}
     * @throws DuplicateMembershipException if a cell is claimed by two cages
     * @throws IncompleteCoverageException if some cell belongs to no cage
     */
    public static Puzzle validate(PuzzleDescription description) {
        int size = description.size();
        if (size < 1)
            throw new IllegalArgumentException("board size must be positive, got " + size);

        Set<Cell> mentioned = new TreeSet<>(Cell.ROW_MAJOR);
        List<Cage> cages = new ArrayList<>(description.cages().size());
        for (CageDescription raw : description.cages()) {
            CageDescription cage = new CageDescription(new ArrayList<>(new LinkedHashSet<>(raw.members())), raw.operator(), raw.target());

            Operator operator = Operator.fromSymbol(cage.operator())
                    .orElseThrow(() -> new InvalidOperatorException(cage));

            List<Cell> problematic = cage.members().stream()
                    .filter(c -> !c.isInside(size))
                    .sorted(Cell.ROW_MAJOR)
                    .toList();
            if (!problematic.isEmpty())
                throw new CellOutOfBoundsException(cage, problematic, size);

            problematic = cage.members().stream()
                    .filter(mentioned::contains)
                    .sorted(Cell.ROW_MAJOR)
                    .toList();
            if (!problematic.isEmpty())
                throw new DuplicateMembershipException(cage, problematic);

            mentioned.addAll(cage.members());
            if (!cage.members().isEmpty())
                cages.add(new Cage(cage.members(), operator, cage.target()));
        }

        List<Cell> missing = new ArrayList<>();
        for (int y = 1; y <= size; y++) {
            for (int x = 1; x <= size; x++) {
                Cell c = new Cell(x, y);
                if (!mentioned.contains(c))
                    missing.add(c);
            }
        }
        if (!missing.isEmpty())
            throw new IncompleteCoverageException(missing);

        return new Puzzle(size, cages);
    }
}

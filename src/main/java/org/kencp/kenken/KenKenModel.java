/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.search.Assignment;
import org.kencp.search.BinaryCSP;
import org.kencp.util.HashMultimap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A KenKen puzzle compiled into a binary CSP.
 * Variables are the cages, the domain of a cage holds the value tuples of its members
 * and two cages are neighbors when some of their members share a row or a column.
 * The model is immutable and can be shared by several searches.
 */
public class KenKenModel implements BinaryCSP<Cage> {

    private final Puzzle puzzle;
    private final Map<Cage, List<int[]>> domains;
    private final HashMultimap<Cage, Cage> neighbors;
    private final Map<Cell, Cage> owner = new HashMap<>();

    private KenKenModel(Puzzle puzzle) {
        this.puzzle = puzzle;
        this.domains = DomainBuilder.build(puzzle);
        this.neighbors = ConflictGraphBuilder.build(puzzle.cages());
        for (Cage cage : puzzle.cages())
            for (Cell c : cage.members())
                owner.put(c, cage);
    }

    /**
     * Validates then compiles a puzzle description.
     *
     * @throws org.kencp.util.exception.InvalidPuzzleException if the description is not a valid board
     */
    public static KenKenModel compile(PuzzleDescription description) {
        return new KenKenModel(PuzzleValidator.validate(description));
    }

    /**
     * Compiles a puzzle, typically a generated one.
     * The cages are checked like a description, they must partition the board.
     *
     * @throws org.kencp.util.exception.InvalidPuzzleException if the cages are not a valid board
     */
    public static KenKenModel of(Puzzle puzzle) {
        return new KenKenModel(PuzzleValidator.validate(puzzle.toDescription()));
    }

    public int size() {
        return puzzle.size();
    }

    public Puzzle puzzle() {
        return puzzle;
    }

    public List<Cage> cages() {
        return puzzle.cages();
    }

    public Cage cageOf(Cell cell) {
        Cage cage = owner.get(cell);
        if (cage == null)
            throw new IllegalArgumentException("cell " + cell + " is not on the board");
        return cage;
    }

    @Override
    public List<Cage> variables() {
        return puzzle.cages();
    }

    @Override
    public List<int[]> domain(Cage var) {
        return domains.getOrDefault(var, List.of());
    }

    @Override
    public Set<Cage> neighbors(Cage var) {
        return neighbors.get(var);
    }

    /**
     * A cage is compatible with itself; two distinct cages are compatible unless
     * some row or column would hold the same value twice.
     */
    @Override
    public boolean compatible(Cage a, int[] ta, Cage b, int[] tb) {
        return a.equals(b) || !ConstraintEvaluator.conflicting(a, ta, b, tb);
    }

    /**
     * @return the value of the cell under the assignment, empty if its cage is unassigned
     */
    public Optional<Integer> valueOf(Cell cell, Assignment<Cage> assignment) {
        Cage cage = cageOf(cell);
        return assignment.get(cage).map(t -> t[cage.members().indexOf(cell)]);
    }

    /**
     * @return true if every cage takes a tuple of its domain and no two neighbors conflict
     */
    public boolean isSolution(Assignment<Cage> assignment) {
        for (Cage cage : cages()) {
            Optional<int[]> t = assignment.get(cage);
            if (t.isEmpty() || domain(cage).stream().noneMatch(d -> java.util.Arrays.equals(d, t.get())))
                return false;
        }
        for (Cage a : cages())
            for (Cage b : neighbors(a))
                if (!compatible(a, assignment.get(a).get(), b, assignment.get(b).get()))
                    return false;
        return true;
    }

    public PuzzleDescription toDescription() {
        return puzzle.toDescription();
    }
}

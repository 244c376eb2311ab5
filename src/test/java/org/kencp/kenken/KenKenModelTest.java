/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.junit.jupiter.api.Test;
import org.kencp.kenken.generator.GeneratedPuzzle;
import org.kencp.kenken.generator.PuzzleGenerator;
import org.kencp.search.Assignment;
import org.kencp.util.exception.CellOutOfBoundsException;
import org.kencp.util.exception.DuplicateMembershipException;
import org.kencp.util.exception.IncompleteCoverageException;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class KenKenModelTest {

    private static Cell c(int x, int y) {
        return new Cell(x, y);
    }

    static PuzzleDescription twoColumns() {
        return new PuzzleDescription(2, List.of(
                new CageDescription(List.of(c(1, 1), c(1, 2)), "-", 1),
                new CageDescription(List.of(c(2, 1), c(2, 2)), "/", 2)));
    }

    @Test
    public void compile() {
        KenKenModel model = KenKenModel.compile(twoColumns());
        assertEquals(2, model.size());
        assertEquals(2, model.variables().size());
        Cage left = model.cageOf(c(1, 2));
        Cage right = model.cageOf(c(2, 1));
        assertEquals(Operator.SUB, left.operator());
        assertEquals(2, model.domain(left).size());
        assertEquals(2, model.domain(right).size());
        assertEquals(List.of(right), List.copyOf(model.neighbors(left)));
        assertEquals(twoColumns(), model.toDescription());
    }

    @Test
    public void compileValidates() {
        PuzzleDescription d = new PuzzleDescription(2, List.of(new CageDescription(List.of(c(1, 1)), ".", 1)));
        assertThrows(IncompleteCoverageException.class, () -> KenKenModel.compile(d));
    }

    @Test
    public void compatible() {
        KenKenModel model = KenKenModel.compile(twoColumns());
        Cage left = model.cageOf(c(1, 1));
        Cage right = model.cageOf(c(2, 1));
        assertTrue(model.compatible(left, new int[]{2, 1}, right, new int[]{1, 2}));
        assertFalse(model.compatible(left, new int[]{2, 1}, right, new int[]{2, 1}));
        assertTrue(model.compatible(left, new int[]{2, 1}, left, new int[]{2, 1}));
    }

    @Test
    public void valueOfAndIsSolution() {
        KenKenModel model = KenKenModel.compile(twoColumns());
        Cage left = model.cageOf(c(1, 1));
        Cage right = model.cageOf(c(2, 1));
        Assignment<Cage> a = new Assignment<>();
        a.assign(left, new int[]{2, 1});
        assertEquals(Optional.of(1), model.valueOf(c(1, 2), a));
        assertEquals(Optional.empty(), model.valueOf(c(2, 2), a));
        assertFalse(model.isSolution(a));
        a.assign(right, new int[]{2, 1});
        assertFalse(model.isSolution(a));
        a.assign(right, new int[]{1, 2});
        assertTrue(model.isSolution(a));
    }

    @Test
    public void generatorGridIsASolution() {
        for (int seed = 0; seed < 10; seed++) {
            GeneratedPuzzle g = PuzzleGenerator.generateWithSolution(5, new Random(seed));
            KenKenModel model = KenKenModel.of(g.puzzle());
            Assignment<Cage> a = new Assignment<>();
            for (Cage cage : model.cages())
                a.assign(cage, cage.members().stream().mapToInt(g.grid()::get).toArray());
            assertTrue(model.isSolution(a));
        }
    }

    @Test
    public void unknownCell() {
        KenKenModel model = KenKenModel.compile(twoColumns());
        assertThrows(IllegalArgumentException.class, () -> model.cageOf(c(3, 1)));
    }

    @Test
    public void puzzleCagesMustPartitionTheBoard() {
        Puzzle uncovered = new Puzzle(2, List.of(new Cage(List.of(c(1, 1)), Operator.NONE, 1)));
        assertThrows(IncompleteCoverageException.class, () -> KenKenModel.of(uncovered));

        Puzzle overlapping = new Puzzle(1, List.of(
                new Cage(List.of(c(1, 1)), Operator.NONE, 1),
                new Cage(List.of(c(1, 1)), Operator.NONE, 1)));
        assertThrows(DuplicateMembershipException.class, () -> KenKenModel.of(overlapping));

        Puzzle outside = new Puzzle(1, List.of(new Cage(List.of(c(1, 1), c(2, 1)), Operator.SUB, 1)));
        assertThrows(CellOutOfBoundsException.class, () -> KenKenModel.of(outside));
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.junit.jupiter.api.Test;
import org.kencp.kenken.Cage;
import org.kencp.kenken.Cell;
import org.kencp.kenken.Operator;
import org.kencp.kenken.Puzzle;
import org.kencp.kenken.PuzzleValidator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CliqueCarverTest {

    /**
     * Returns the given ints, then bound - 1, and always the same boolean (true by default).
     */
    private static class ScriptedRandom extends Random {
        private final Deque<Integer> ints = new ArrayDeque<>();
        private final boolean bool;

        ScriptedRandom(int... values) {
            this(true, values);
        }

        ScriptedRandom(boolean bool, int... values) {
            this.bool = bool;
            for (int v : values) ints.add(v);
        }

        @Override
        public int nextInt(int bound) {
            return ints.isEmpty() ? bound - 1 : ints.poll();
        }

        @Override
        public boolean nextBoolean() {
            return bool;
        }
    }

    private static Cell c(int x, int y) {
        return new Cell(x, y);
    }

    @Test
    public void singleCells() {
        Grid grid = Grid.of(new int[][]{{1, 2}, {2, 1}});
        Puzzle p = new CliqueCarver(new ScriptedRandom(0, 0, 0, 0)).carve(grid);
        assertEquals(List.of(
                new Cage(List.of(c(1, 1)), Operator.NONE, 1),
                new Cage(List.of(c(2, 1)), Operator.NONE, 2),
                new Cage(List.of(c(1, 2)), Operator.NONE, 2),
                new Cage(List.of(c(2, 2)), Operator.NONE, 1)), p.cages());
    }

    @Test
    public void largeCageWalksFromTheLastAddedCell() {
        Grid grid = Grid.of(new int[][]{{1, 2}, {2, 1}});
        // size 4, then always the last adjacent candidate in row-major order
        Puzzle p = new CliqueCarver(new ScriptedRandom()).carve(grid);
        assertEquals(1, p.cages().size());
        Cage cage = p.cages().get(0);
        assertEquals(List.of(c(1, 1), c(1, 2), c(2, 2), c(2, 1)), cage.members());
        assertEquals(Operator.ADD, cage.operator());
        assertEquals(6, cage.target());
    }

    @Test
    public void pairsUseOnlyFirstOverSecondForDivision() {
        Grid grid = Grid.of(new int[][]{{2, 4}, {3, 1}});
        Puzzle p = new CliqueCarver(new ScriptedRandom(1, 0, 1, 0)).carve(grid);
        assertEquals(List.of(
                new Cage(List.of(c(1, 1), c(2, 1)), Operator.SUB, -2),
                new Cage(List.of(c(1, 2), c(2, 2)), Operator.DIV, 3)), p.cages());
    }

    @Test
    public void growthStopsWhenStuck() {
        // 1x1 board, a cage of size 4 cannot grow
        Puzzle p = new CliqueCarver(new ScriptedRandom()).carve(Grid.of(new int[][]{{1}}));
        assertEquals(List.of(new Cage(List.of(c(1, 1)), Operator.NONE, 1)), p.cages());
    }

    @Test
    public void partitionProperty() {
        for (int n = 1; n <= 7; n++) {
            for (int seed = 0; seed < 10; seed++) {
                GeneratedPuzzle g = PuzzleGenerator.generateWithSolution(n, new Random(seed));
                Set<Cell> seen = new HashSet<>();
                int count = 0;
                for (Cage cage : g.puzzle().cages()) {
                    assertTrue(cage.size() >= 1 && cage.size() <= CliqueCarver.MAX_CAGE_SIZE);
                    for (Cell cell : cage.members()) {
                        assertTrue(cell.isInside(n));
                        seen.add(cell);
                        count++;
                    }
                }
                assertEquals(n * n, count);
                assertEquals(n * n, seen.size());
                // the validator accepts what the generator produces
                assertEquals(g.puzzle(), PuzzleValidator.validate(g.puzzle().toDescription()));
            }
        }
    }

    @Test
    public void cagesArePathsAndTargetsMatchTheGrid() {
        for (int seed = 0; seed < 30; seed++) {
            GeneratedPuzzle g = PuzzleGenerator.generateWithSolution(5, new Random(seed));
            for (Cage cage : g.puzzle().cages()) {
                for (int i = 1; i < cage.size(); i++)
                    assertTrue(cage.member(i - 1).isAdjacent(cage.member(i)));
                int[] values = cage.members().stream().mapToInt(g.grid()::get).toArray();
                if (cage.size() == 1) {
                    assertEquals(Operator.NONE, cage.operator());
                    assertEquals(values[0], cage.target());
                } else if (cage.size() == 2) {
                    if (values[0] % values[1] == 0) {
                        assertEquals(Operator.DIV, cage.operator());
                        assertEquals(values[0] / values[1], cage.target());
                    } else {
                        assertEquals(Operator.SUB, cage.operator());
                        assertEquals(values[0] - values[1], cage.target());
                    }
                } else {
                    assertTrue(cage.operator() == Operator.ADD || cage.operator() == Operator.MUL);
                    assertEquals(cage.operator().fold(values).getAsLong(), cage.target());
                }
            }
        }
    }

    @Test
    public void deterministicForAFixedSeed() {
        for (int seed = 0; seed < 5; seed++) {
            Puzzle p1 = PuzzleGenerator.generate(6, new Random(seed));
            Puzzle p2 = PuzzleGenerator.generate(6, new Random(seed));
            assertEquals(p1, p2);
        }
    }

    @Test
    public void maxCageSizeIsConfigurable() {
        Puzzle p = PuzzleGenerator.generateWithSolution(4, new Random(5), 1).puzzle();
        assertEquals(16, p.cages().size());
        assertTrue(p.cages().stream().allMatch(cage -> cage.operator() == Operator.NONE));
        assertThrows(IllegalArgumentException.class, () -> new CliqueCarver(new Random(), 0));
    }

    @Test
    public void maxCageSizeIsBoundedByFour() {
        assertThrows(IllegalArgumentException.class, () -> new CliqueCarver(new Random(), CliqueCarver.MAX_CAGE_SIZE + 1));
        assertThrows(IllegalArgumentException.class, () -> PuzzleGenerator.generateWithSolution(9, new Random(0), 30));
    }

    @Test
    public void productTargetThatDoesNotFitInAnIntIsRejected() {
        Grid grid = Grid.of(new int[][]{{50000, 50000}, {50000, 50000}});
        // one cage of size 4, multiplied: 50000^4 fits in a long but not in an int
        CliqueCarver carver = new CliqueCarver(new ScriptedRandom(false));
        assertThrows(IllegalArgumentException.class, () -> carver.carve(grid));
    }

    @Test
    public void productTargetIsKeptWhenItFits() {
        Grid grid = Grid.of(new int[][]{{100, 100}, {100, 100}});
        Puzzle p = new CliqueCarver(new ScriptedRandom(false)).carve(grid);
        assertEquals(List.of(new Cage(List.of(c(1, 1), c(1, 2), c(2, 2), c(2, 1)), Operator.MUL, 100_000_000)), p.cages());
    }
}

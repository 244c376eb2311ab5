/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.kencp.kenken.Cage;
import org.kencp.kenken.Cell;
import org.kencp.kenken.Operator;
import org.kencp.kenken.Puzzle;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * Partitions the cells of a filled grid into connected cages and derives
 * the operator and target of each cage from the grid values.
 * <ul>
 *     <li>the root of each cage is the first uncaged cell in row-major order</li>
 *     <li>a cage grows by random steps to an uncaged cell adjacent to the last added cell,
 *     up to a size drawn uniformly in {@code [1, maxCageSize]}</li>
 *     <li>one cell: no operator, the target is the value</li>
 *     <li>two cells {@code (fst, snd)}: division when {@code snd} divides {@code fst},
 *     subtraction {@code fst - snd} otherwise</li>
 *     <li>more cells: addition or multiplication, chosen at random</li>
 * </ul>
 * With the same random sequence, the same cages are produced.
 */
public class CliqueCarver {

    /**
     * Largest cage the carver builds. Domains are enumerated over {@code size^|cage|} tuples,
     * which bounds the cage size of a practical model.
     */
    public static final int MAX_CAGE_SIZE = 4;

    private final Random random;
    private final int maxCageSize;

    public CliqueCarver(Random random) {
        this(random, MAX_CAGE_SIZE);
    }

    public CliqueCarver(Random random, int maxCageSize) {
        if (maxCageSize < 1 || maxCageSize > MAX_CAGE_SIZE)
            throw new IllegalArgumentException("maximum cage size must be in [1," + MAX_CAGE_SIZE + "], got " + maxCageSize);
        this.random = random;
        this.maxCageSize = maxCageSize;
    }

    public Puzzle carve(Grid grid) {
        int n = grid.size();
        TreeSet<Cell> uncaged = new TreeSet<>(Cell.ROW_MAJOR);
        for (int y = 1; y <= n; y++)
            for (int x = 1; x <= n; x++)
                uncaged.add(new Cell(x, y));

        List<Cage> cages = new ArrayList<>();
        while (!uncaged.isEmpty()) {
            int size = random.nextInt(maxCageSize) + 1;
            Cell cell = uncaged.pollFirst();
            List<Cell> members = new ArrayList<>(size);
            members.add(cell);
            for (int i = 1; i < size; i++) {
                List<Cell> adjacent = new ArrayList<>();
                for (Cell other : uncaged)
                    if (cell.isAdjacent(other))
                        adjacent.add(other);
                if (adjacent.isEmpty())
                    break;
                cell = adjacent.get(random.nextInt(adjacent.size()));
                uncaged.remove(cell);
                members.add(cell);
            }
            cages.add(classify(members, grid));
        }
        return new Puzzle(n, cages);
    }

    private Cage classify(List<Cell> members, Grid grid) {
        int[] values = members.stream().mapToInt(grid::get).toArray();
        if (values.length == 1)
            return new Cage(members, Operator.NONE, values[0]);
        if (values.length == 2) {
            // only fst / snd is tried, an exact snd / fst still gives a subtraction
            if (values[0] % values[1] == 0)
                return new Cage(members, Operator.DIV, values[0] / values[1]);
            return new Cage(members, Operator.SUB, values[0] - values[1]);
        }
        Operator op = random.nextBoolean() ? Operator.ADD : Operator.MUL;
        long target = op.fold(values).orElseThrow(() -> new IllegalArgumentException("no target for cage " + members));
        if (target < Integer.MIN_VALUE || target > Integer.MAX_VALUE)
            throw new IllegalArgumentException("target " + target + " of cage " + members + " does not fit in an int");
        return new Cage(members, op, (int) target);
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.kencp.kenken.Puzzle;

import java.util.Random;

/**
 * Generates random KenKen puzzles that are satisfiable by construction.
 */
public final class PuzzleGenerator {

    private PuzzleGenerator() {}

    public static Puzzle generate(int size, Random random) {
        return generateWithSolution(size, random).puzzle();
    }

    public static GeneratedPuzzle generateWithSolution(int size, Random random) {
        return generateWithSolution(size, random, CliqueCarver.MAX_CAGE_SIZE);
    }

    public static GeneratedPuzzle generateWithSolution(int size, Random random, int maxCageSize) {
        Grid grid = LatinSquareGenerator.generate(size, random);
        Puzzle puzzle = new CliqueCarver(random, maxCageSize).carve(grid);
        return new GeneratedPuzzle(puzzle, grid);
    }
}

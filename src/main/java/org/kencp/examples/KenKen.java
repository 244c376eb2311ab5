/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 *
 */

package org.kencp.examples;

import org.kencp.kenken.Cage;
import org.kencp.kenken.GridRenderer;
import org.kencp.kenken.KenKenModel;
import org.kencp.kenken.Puzzle;
import org.kencp.kenken.generator.PuzzleGenerator;
import org.kencp.kenken.io.PuzzleJson;
import org.kencp.search.BacktrackingSearch;
import org.kencp.search.Inference;
import org.kencp.search.SearchStatistics;
import org.kencp.search.VariableOrdering;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * The KenKen puzzle: fill a n x n grid with 1..n so that no value repeats in a row or a column
 * and the values of each cage produce its target with its operator.
 * <a href="https://en.wikipedia.org/wiki/KenKen">KenKen</a>.
 * <p>
 * Generates a puzzle (or reads one given as a JSON file) and solves it with each inference.
 */
public class KenKen {

    public static void main(String[] args) {

        KenKenModel model;
        try {
            model = load(args);
        } catch (IOException e) {
            System.err.println("Error reading instance: " + e.getMessage());
            return;
        }

        System.out.println(GridRenderer.render(model, null));

        for (Inference inference : Inference.values()) {
            BacktrackingSearch<Cage> search = new BacktrackingSearch<>(model, inference, VariableOrdering.FIRST_FAIL);
            SearchStatistics stats = search.solve(s -> s.numberOfSolutions() >= 1);
            System.out.format("%s: %s\n", inference, stats.numberOfSolutions() > 0 ? "Success" : "Failure");
            System.out.format("Statistics: %s\n", stats);
            search.solution().ifPresent(solution -> System.out.println(GridRenderer.render(model, solution)));
        }
    }

    private static KenKenModel load(String[] args) throws IOException {
        if (args.length > 0)
            return KenKenModel.compile(PuzzleJson.read(Path.of(args[0])));
        int n = 5;
        Puzzle puzzle = PuzzleGenerator.generate(n, new Random(42));
        System.out.println(PuzzleJson.write(puzzle.toDescription()));
        return KenKenModel.of(puzzle);
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds a random Latin square: the cyclic square {@code ((x + y) mod n) + 1}
 * with its rows shuffled n times, then each pair of columns swapped on a coin flip.
 * Both transformations keep every value once per row and once per column.
 */
public final class LatinSquareGenerator {

    private LatinSquareGenerator() {}

    public static Grid generate(int n, Random random) {
        if (n < 1)
            throw new IllegalArgumentException("size must be positive, got " + n);
        List<int[]> rows = new ArrayList<>(n);
        for (int y = 1; y <= n; y++) {
            int[] row = new int[n];
            for (int x = 1; x <= n; x++)
                row[x - 1] = ((x + y) % n) + 1;
            rows.add(row);
        }
        for (int i = 0; i < n; i++)
            Collections.shuffle(rows, random);

        for (int c1 = 0; c1 < n; c1++) {
            for (int c2 = c1 + 1; c2 < n; c2++) {
                if (random.nextBoolean()) {
                    for (int[] row : rows) {
                        int tmp = row[c1];
                        row[c1] = row[c2];
                        row[c2] = tmp;
                    }
                }
            }
        }
        return new Grid(rows.toArray(new int[0][]));
    }
}

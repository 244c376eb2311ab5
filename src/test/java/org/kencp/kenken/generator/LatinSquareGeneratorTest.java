/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken.generator;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class LatinSquareGeneratorTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 9})
    public void producesLatinSquares(int n) {
        for (int seed = 0; seed < 10; seed++) {
            Grid grid = LatinSquareGenerator.generate(n, new Random(seed));
            assertEquals(n, grid.size());
            assertTrue(grid.isLatinSquare(), grid.toString());
        }
    }

    @Test
    public void reproducibleWithSameSeed() {
        Grid g1 = LatinSquareGenerator.generate(6, new Random(1234));
        Grid g2 = LatinSquareGenerator.generate(6, new Random(1234));
        assertEquals(g1.toString(), g2.toString());
    }

    @Test
    public void isLatinSquareDetectsRepeats() {
        assertTrue(Grid.of(new int[][]{{1, 2}, {2, 1}}).isLatinSquare());
        assertFalse(Grid.of(new int[][]{{1, 2}, {1, 2}}).isLatinSquare());
        assertFalse(Grid.of(new int[][]{{1, 3}, {3, 1}}).isLatinSquare());
    }

    @Test
    public void rejectsBadSizes() {
        assertThrows(IllegalArgumentException.class, () -> LatinSquareGenerator.generate(0, new Random()));
        assertThrows(IllegalArgumentException.class, () -> Grid.of(new int[][]{{1, 2}, {2}}));
    }
}

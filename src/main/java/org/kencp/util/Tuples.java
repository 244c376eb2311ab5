/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Helpers on int tuples: cartesian products, permutations, fills.
 */
public class Tuples {

    /**
     * @param length the tuple length
     * @param value the value of every position
     * @return a tuple of the given length filled with value
     */
    public static int[] filled(int length, int value) {
        int[] t = new int[length];
        java.util.Arrays.fill(t, value);
        return t;
    }

    /**
     * Enumerates every tuple of {@code [min..max]^length} in lexicographic order.
     * The array given to the consumer is reused between calls, copy it to keep it.
     *
     * @param length the tuple length
     * @param min smallest value (inclusive)
     * @param max largest value (inclusive)
     * @param consumer called once per tuple
     */
    public static void product(int length, int min, int max, Consumer<int[]> consumer) {
        if (length < 0)
            throw new IllegalArgumentException("negative tuple length " + length);
        if (min > max)
            return;
        int[] t = filled(length, min);
        while (true) {
            consumer.accept(t);
            int i = length - 1;
            while (i >= 0 && t[i] == max) {
                t[i] = min;
                i--;
            }
            if (i < 0)
                return;
            t[i]++;
        }
    }

    /**
     * @return all the tuples of {@code [min..max]^length}, in lexicographic order
     */
    public static List<int[]> product(int length, int min, int max) {
        List<int[]> res = new ArrayList<>();
        product(length, min, max, t -> res.add(t.clone()));
        return res;
    }

    /**
     * Rearranges the values into the next lexicographic permutation.
     * Starting from a sorted array, repeated calls visit each distinct permutation once.
     *
     * @param a the values, modified in place
     * @return false if a was the last permutation (a is then left sorted again)
     */
    public static boolean nextPermutation(int[] a) {
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) i--;
        if (i < 0) {
            reverse(a, 0, a.length - 1);
            return false;
        }
        int j = a.length - 1;
        while (a[j] <= a[i]) j--;
        swap(a, i, j);
        reverse(a, i + 1, a.length - 1);
        return true;
    }

    private static void reverse(int[] a, int from, int to) {
        while (from < to) {
            swap(a, from++, to--);
        }
    }

    private static void swap(int[] a, int i, int j) {
        int tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}

/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util;

import java.util.OptionalLong;

/**
 * Overflow-aware integer arithmetic used when folding cage operators.
 * Every method returns an empty result instead of a wrong one.
 */
public final class NumberUtils {

    private NumberUtils() {}

    public static OptionalLong safeAdd(long a, long b) {
        try {
            return OptionalLong.of(Math.addExact(a, b));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    public static OptionalLong safeSub(long a, long b) {
        try {
            return OptionalLong.of(Math.subtractExact(a, b));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    public static OptionalLong safeMul(long a, long b) {
        try {
            return OptionalLong.of(Math.multiplyExact(a, b));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * @return a / b if b divides a exactly, empty otherwise (including b == 0)
     */
    public static OptionalLong exactDiv(long a, long b) {
        if (b == 0 || a % b != 0)
            return OptionalLong.empty();
        if (a == Long.MIN_VALUE && b == -1)
            return OptionalLong.empty();
        return OptionalLong.of(a / b);
    }
}

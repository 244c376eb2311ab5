/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.kenken;

import org.kencp.util.NumberUtils;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Arithmetic rule of a cage.
 * Evaluation is exact: an operator yields no result rather than an approximate one,
 * in particular {@link #DIV} only yields a value when the division has no remainder.
 */
public enum Operator {

    ADD("+") {
        @Override
        public OptionalLong apply(long a, long b) {
            return NumberUtils.safeAdd(a, b);
        }
    },
    SUB("-") {
        @Override
        public OptionalLong apply(long a, long b) {
            return NumberUtils.safeSub(a, b);
        }
    },
    MUL("*") {
        @Override
        public OptionalLong apply(long a, long b) {
            return NumberUtils.safeMul(a, b);
        }
    },
    DIV("/") {
        @Override
        public OptionalLong apply(long a, long b) {
            return NumberUtils.exactDiv(a, b);
        }
    },
    /**
     * No operation, only meaningful on a single value.
     */
    NONE(".") {
        @Override
        public OptionalLong apply(long a, long b) {
            return OptionalLong.empty();
        }
    };

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the glyph of the operator in the interchange format
     */
    public String symbol() {
        return symbol;
    }

    public abstract OptionalLong apply(long a, long b);

    /**
     * @return true if the order of the operands never changes a fold
     */
    public boolean isCommutative() {
        return this == ADD || this == MUL || this == NONE;
    }

    /**
     * Left fold of the operator over the values, starting from the first one.
     * A single value folds to itself whatever the operator.
     *
     * @param values at least one value
     * @return the result, empty if some step has no exact integer result
     */
    public OptionalLong fold(int[] values) {
        if (values.length == 0)
            throw new IllegalArgumentException("cannot fold an empty tuple");
        OptionalLong acc = OptionalLong.of(values[0]);
        for (int i = 1; i < values.length && acc.isPresent(); i++) {
            acc = apply(acc.getAsLong(), values[i]);
        }
        return acc;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol))
                return Optional.of(op);
        }
        return Optional.empty();
    }
}

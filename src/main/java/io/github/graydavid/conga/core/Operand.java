/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Something that can be passed as an argument to an operation in a {@link Builder}: either a {@link Node} already in
 * the graph or a numeric literal. Literals are promoted into constant nodes at the moment the operation is recorded, so
 * an operation only ever refers to nodes.
 *
 * The set of Operand implementations is closed: only Node and the literal returned by {@link #literal(Number)}.
 */
public abstract class Operand {
    Operand() {}

    /**
     * Creates a literal operand. The constant node it becomes will be labeled with the literal's text (e.g. "5" or
     * "0.25").
     *
     * @throws NullPointerException if value is null
     */
    public static Operand literal(Number value) {
        return new Literal(value);
    }

    /** A human-readable name for this operand, used in error messages. */
    public abstract String getName();

    /** Whether this operand can be used in operations recorded against the given registry. */
    abstract boolean isKnownTo(NodeRegistry registry);

    /**
     * Returns the node this operand stands for, asking constantFactory to create one if this operand is a literal.
     */
    abstract Node resolve(Function<Number, Node> constantFactory);

    private static class Literal extends Operand {
        private final Number value;

        private Literal(Number value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public String getName() {
            return String.valueOf(value);
        }

        @Override
        boolean isKnownTo(NodeRegistry registry) {
            return true;
        }

        @Override
        Node resolve(Function<Number, Node> constantFactory) {
            return constantFactory.apply(value);
        }

        @Override
        public String toString() {
            return "literal(" + value + ")";
        }
    }
}

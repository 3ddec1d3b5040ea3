/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/**
 * The kinds of operations a graph supports. The evaluator dispatches on the kind, so adding a kind means teaching
 * {@link GraphEvaluator} how to run it.
 */
public enum OperationKind {
    ADD("add", 2),
    MUL("mul", 2),
    ASSERT_EQUAL("equal", 2),
    /** Runs a client-supplied function over any positive number of operands. */
    HINT("hint");

    private final String idPrefix;
    private final int fixedArity; // 0 means any positive number of operands

    private OperationKind(String idPrefix, int fixedArity) {
        this.idPrefix = idPrefix;
        this.fixedArity = fixedArity;
    }

    private OperationKind(String idPrefix) {
        this(idPrefix, 0);
    }

    /** The prefix of the ids of operations of this kind, and their default label in error messages. */
    public String getIdPrefix() {
        return idPrefix;
    }

    public boolean hasFixedArity() {
        return fixedArity > 0;
    }

    /**
     * Checks that operandCount operands are acceptable for this kind.
     *
     * @throws IllegalArgumentException if they're not.
     */
    public void requireValidOperandCount(int operandCount) {
        if (hasFixedArity() && operandCount != fixedArity) {
            String message = String.format("The %s operation takes exactly %d operands but was given %d", idPrefix,
                    fixedArity, operandCount);
            throw new IllegalArgumentException(message);
        }
        if (operandCount < 1) {
            throw new IllegalArgumentException("The " + idPrefix + " operation needs at least one operand");
        }
    }
}

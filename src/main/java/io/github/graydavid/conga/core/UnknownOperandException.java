/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;

/**
 * Thrown when an operation is given an operand that doesn't belong to the graph being built, usually a node created by
 * another Builder. The operation is not recorded, and the graph is otherwise left untouched, so the caller may retry
 * with a corrected operand.
 */
public class UnknownOperandException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final String operandName;
    private final String operationLabel;

    public UnknownOperandException(String operandName, String operationLabel) {
        super(String.format("Node %s isn't in graph. Unable to add the %s operation.", operandName, operationLabel));
        this.operandName = Objects.requireNonNull(operandName);
        this.operationLabel = Objects.requireNonNull(operationLabel);
    }

    /** The name of the offending operand. */
    public String getOperandName() {
        return operandName;
    }

    /** The label of the operation that couldn't be added. */
    public String getOperationLabel() {
        return operationLabel;
    }
}

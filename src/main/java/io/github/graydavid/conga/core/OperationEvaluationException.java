/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;

/**
 * Thrown when running an operation fails: e.g. an arithmetic overflow or an operand value of the wrong type. Names both
 * the operation and the node it was supposed to produce.
 */
public class OperationEvaluationException extends EvaluationException {
    private static final long serialVersionUID = 1;

    private final String operationLabel;

    public OperationEvaluationException(String operationLabel, String nodeLabel, String reason) {
        super(createMessage(operationLabel, nodeLabel, reason), Objects.requireNonNull(nodeLabel));
        this.operationLabel = operationLabel;
    }

    public OperationEvaluationException(String operationLabel, String nodeLabel, String reason, Throwable cause) {
        super(createMessage(operationLabel, nodeLabel, reason), Objects.requireNonNull(nodeLabel), cause);
        this.operationLabel = operationLabel;
    }

    private static String createMessage(String operationLabel, String nodeLabel, String reason) {
        return String.format("Operation %s failed to compute node %s: %s", operationLabel, nodeLabel, reason);
    }

    public String getOperationLabel() {
        return operationLabel;
    }

    @Override
    public Diagnostic.Kind getDiagnosticKind() {
        return Diagnostic.Kind.OPERATION_FAILURE;
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/**
 * Thrown when a hint's client-supplied function throws, returns null, or is given a value that isn't a number. Aborts
 * the whole evaluation.
 */
public class HintEvaluationException extends OperationEvaluationException {
    private static final long serialVersionUID = 1;

    public HintEvaluationException(String operationLabel, String nodeLabel, String reason) {
        super(operationLabel, nodeLabel, reason);
    }

    public HintEvaluationException(String operationLabel, String nodeLabel, String reason, Throwable cause) {
        super(operationLabel, nodeLabel, reason, cause);
    }

    @Override
    public Diagnostic.Kind getDiagnosticKind() {
        return Diagnostic.Kind.HINT_FAILURE;
    }
}

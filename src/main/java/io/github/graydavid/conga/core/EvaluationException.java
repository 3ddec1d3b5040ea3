/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;
import java.util.Optional;

/**
 * The base of all exceptions that stop {@link GraphEvaluator} from producing values. An evaluation that throws never
 * returns partial results. {@link Builder} turns these exceptions into {@link Diagnostic}s via {@link #toDiagnostic()}.
 */
public abstract class EvaluationException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final String nodeLabel; // May be null

    protected EvaluationException(String message, String nodeLabel) {
        super(message);
        this.nodeLabel = nodeLabel;
    }

    protected EvaluationException(String message, String nodeLabel, Throwable cause) {
        super(message, Objects.requireNonNull(cause));
        this.nodeLabel = nodeLabel;
    }

    /** The display label of the node that evaluation failed on, if any. */
    public Optional<String> getNodeLabel() {
        return Optional.ofNullable(nodeLabel);
    }

    /** The kind of diagnostic this exception is reported as. */
    public abstract Diagnostic.Kind getDiagnosticKind();

    public Diagnostic toDiagnostic() {
        return nodeLabel == null ? Diagnostic.of(getDiagnosticKind(), getMessage())
                : Diagnostic.of(getDiagnosticKind(), nodeLabel, getMessage());
    }
}

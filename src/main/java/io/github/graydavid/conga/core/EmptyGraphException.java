/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/** Thrown when a graph without any operations is evaluated. */
public class EmptyGraphException extends EvaluationException {
    private static final long serialVersionUID = 1;

    public EmptyGraphException() {
        super("No operations in graph. Cannot run graph without any operations defined.", null);
    }

    @Override
    public Diagnostic.Kind getDiagnosticKind() {
        return Diagnostic.Kind.EMPTY_GRAPH;
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/**
 * Thrown when a graph's structure doesn't allow every node to get exactly one value: an operand with neither a bound
 * value nor a producing operation, a node produced by several operations, a node from outside the graph, or a cycle.
 * The Builder never creates such graphs itself.
 */
public class IncompleteGraphException extends EvaluationException {
    private static final long serialVersionUID = 1;

    public IncompleteGraphException(String message) {
        super(message, null);
    }

    public IncompleteGraphException(String message, String nodeLabel) {
        super(message, nodeLabel);
    }

    @Override
    public Diagnostic.Kind getDiagnosticKind() {
        return Diagnostic.Kind.INCOMPLETE_GRAPH;
    }
}

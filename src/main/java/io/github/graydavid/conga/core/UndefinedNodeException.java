/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/** Thrown when an input node has no value bound to it at evaluation time. */
public class UndefinedNodeException extends EvaluationException {
    private static final long serialVersionUID = 1;

    public UndefinedNodeException(String nodeLabel) {
        super("Node " + nodeLabel + " is undefined. Must define node in order to check constraints.", nodeLabel);
    }

    @Override
    public Diagnostic.Kind getDiagnosticKind() {
        return Diagnostic.Kind.UNDEFINED_NODE;
    }
}

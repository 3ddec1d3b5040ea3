/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A problem found while evaluating or checking a graph, or while binding values to it. Diagnostics are returned to the
 * caller rather than only printed, so that every problem found in one pass can be inspected programmatically.
 */
public final class Diagnostic {
    private final Kind kind;
    private final String nodeLabel; // May be null
    private final String message;
    private final List<Object> values;

    private Diagnostic(Kind kind, String nodeLabel, String message, List<Object> values) {
        this.kind = Objects.requireNonNull(kind);
        this.nodeLabel = nodeLabel;
        this.message = Objects.requireNonNull(message);
        // Values may contain nulls for "no value", so List.copyOf won't do
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /** Creates a diagnostic that isn't about any specific node. */
    public static Diagnostic of(Kind kind, String message) {
        return new Diagnostic(kind, null, message, List.of());
    }

    /**
     * Creates a diagnostic about a specific node.
     *
     * @param values the values relevant to the problem, e.g. the expected and computed value of a mismatch.
     */
    public static Diagnostic of(Kind kind, String nodeLabel, String message, Object... values) {
        Objects.requireNonNull(nodeLabel);
        List<Object> valueList = new ArrayList<>();
        Collections.addAll(valueList, values);
        return new Diagnostic(kind, nodeLabel, message, valueList);
    }

    public Kind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return kind.getSeverity();
    }

    /** The display label of the node this diagnostic is about, if any. */
    public Optional<String> getNodeLabel() {
        return Optional.ofNullable(nodeLabel);
    }

    public String getMessage() {
        return message;
    }

    /**
     * The values relevant to this diagnostic. For {@link Kind#VALUE_MISMATCH}: the expected and then the computed
     * value. For {@link Kind#FAILED_ASSERTION}: the values of both operands. Empty for other kinds.
     */
    public List<Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Diagnostic)) {
            return false;
        }

        Diagnostic other = (Diagnostic) object;
        return kind == other.kind && Objects.equals(nodeLabel, other.nodeLabel)
                && Objects.equals(message, other.message) && Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, nodeLabel, message, values);
    }

    @Override
    public String toString() {
        return "[" + kind + "] " + message;
    }

    /** How bad a diagnostic is. */
    public enum Severity {
        /** Evaluation couldn't produce any values. */
        ERROR,
        /** Evaluation succeeded, but a constraint doesn't hold. */
        VIOLATION,
        /** Something was skipped, but everything else went ahead. */
        WARNING;
    }

    public enum Kind {
        EMPTY_GRAPH(Severity.ERROR),
        UNDEFINED_NODE(Severity.ERROR),
        INCOMPLETE_GRAPH(Severity.ERROR),
        OPERATION_FAILURE(Severity.ERROR),
        HINT_FAILURE(Severity.ERROR),
        VALUE_MISMATCH(Severity.VIOLATION),
        FAILED_ASSERTION(Severity.VIOLATION),
        UNKNOWN_NODE(Severity.WARNING);

        private final Severity severity;

        private Kind(Severity severity) {
            this.severity = severity;
        }

        public Severity getSeverity() {
            return severity;
        }
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of one {@link Builder#evaluate()} call: either the values of every node or the diagnostic explaining why
 * there are none. Never both.
 */
public class Evaluation {
    private final EvaluationResult result; // Null iff evaluation failed
    private final List<Diagnostic> diagnostics;

    private Evaluation(EvaluationResult result, List<Diagnostic> diagnostics) {
        this.result = result;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static Evaluation success(EvaluationResult result) {
        return new Evaluation(Objects.requireNonNull(result), List.of());
    }

    static Evaluation failure(Diagnostic diagnostic) {
        return new Evaluation(null, List.of(diagnostic));
    }

    public boolean isSuccessful() {
        return result != null;
    }

    /** The value of every node, present only if evaluation succeeded. */
    public Optional<EvaluationResult> getResult() {
        return Optional.ofNullable(result);
    }

    /** Why evaluation failed. Empty if evaluation succeeded. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return isSuccessful() ? "Evaluation(" + result + ")" : "Evaluation(failed: " + diagnostics + ")";
    }
}

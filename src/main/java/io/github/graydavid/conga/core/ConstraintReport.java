/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of checking a graph's constraints: whether they all hold, plus every problem found along the way.
 */
public class ConstraintReport {
    private final boolean satisfied;
    private final List<Diagnostic> diagnostics;

    private ConstraintReport(boolean satisfied, List<Diagnostic> diagnostics) {
        this.satisfied = satisfied;
        this.diagnostics = List.copyOf(diagnostics);
    }

    /** Creates a report that's satisfied iff diagnostics contains no errors or violations. */
    public static ConstraintReport from(List<Diagnostic> diagnostics) {
        boolean satisfied = diagnostics.stream()
                .allMatch(diagnostic -> diagnostic.getSeverity() == Diagnostic.Severity.WARNING);
        return new ConstraintReport(satisfied, diagnostics);
    }

    /** Whether evaluation succeeded, every expected value matched, and every assertion held. */
    public boolean isSatisfied() {
        return satisfied;
    }

    /** All diagnostics, in the order they were found. */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** Returns just the diagnostics of the given kind. */
    public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream()
                .filter(diagnostic -> diagnostic.getKind() == kind)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ConstraintReport(satisfied=" + satisfied + ", diagnostics=" + diagnostics + ")";
    }
}

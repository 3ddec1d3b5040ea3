/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks an {@link EvaluationResult} against the constraints of its {@link CompiledGraph}: every bound value must match
 * the value computed for its node, and every equality assertion must hold. Reports every violation rather than stopping
 * at the first, and never throws for a violation.
 */
public class ConstraintChecker {
    private static final Logger LOG = LogManager.getLogger(ConstraintChecker.class);

    public ConstraintReport check(CompiledGraph graph, EvaluationResult result) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        checkBoundValues(graph, graph.getSeeds(), result, diagnostics);
        checkBoundValues(graph, graph.getExpectations(), result, diagnostics);
        checkAssertions(graph, result, diagnostics);
        diagnostics.forEach(diagnostic -> LOG.warn(diagnostic.getMessage()));
        return ConstraintReport.from(diagnostics);
    }

    private static void checkBoundValues(CompiledGraph graph, Map<Node, Number> boundValues,
            EvaluationResult result, List<Diagnostic> diagnostics) {
        boundValues.forEach((node, expected) -> {
            Optional<Object> computed = result.find(node);
            if (computed.isEmpty() || !graph.getTolerance().matches(expected, computed.get())) {
                String label = graph.label(node);
                Object computedValue = computed.orElse(null);
                String message = String.format(
                        "Node %s has an expected value of %s, but this does not match the calculated value of %s",
                        label, expected, computed.map(String::valueOf).orElse("<none>"));
                diagnostics.add(Diagnostic.of(Diagnostic.Kind.VALUE_MISMATCH, label, message, expected, computedValue));
            }
        });
    }

    private static void checkAssertions(CompiledGraph graph, EvaluationResult result, List<Diagnostic> diagnostics) {
        graph.getAssertions().forEach((assertion, operands) -> {
            boolean held = result.find(assertion).map(Boolean.TRUE::equals).orElse(false);
            if (!held) {
                Node a = operands.get(0);
                Node b = operands.get(1);
                Object aValue = result.find(a).orElse(null);
                Object bValue = result.find(b).orElse(null);
                String label = graph.label(assertion);
                String message = String.format(
                        "Node %s has failed assertion that node %s (%s) and node %s (%s) are equal.", label,
                        a.getName(), aValue, b.getName(), bValue);
                diagnostics.add(Diagnostic.of(Diagnostic.Kind.FAILED_ASSERTION, label, message, aValue, bValue));
            }
        });
    }
}

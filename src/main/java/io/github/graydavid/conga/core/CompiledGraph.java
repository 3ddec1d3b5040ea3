/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable snapshot of a {@link Builder}'s graph, ready to be evaluated and checked. Later changes to the Builder
 * don't affect a CompiledGraph, and evaluating one never changes it.
 *
 * A CompiledGraph keeps two kinds of bound values apart. Seeds are the values of input and constant nodes: evaluation
 * starts from them. Expectations are values bound to constant or result nodes: they never override anything, and only
 * the {@link ConstraintChecker} looks at them.
 */
public class CompiledGraph {
    private final List<Node> nodes;
    private final List<Operation> operations;
    private final Map<Node, Number> seeds;
    private final Map<Node, Number> expectations;
    private final Map<Node, String> labels;
    private final Map<Node, List<Node>> assertions;
    private final Tolerance tolerance;

    CompiledGraph(List<Node> nodes, List<Operation> operations, Map<Node, Number> seeds,
            Map<Node, Number> expectations, Map<Node, String> labels, Map<Node, List<Node>> assertions,
            Tolerance tolerance) {
        this.nodes = List.copyOf(nodes);
        this.operations = List.copyOf(operations);
        this.seeds = copyOf(seeds);
        this.expectations = copyOf(expectations);
        this.labels = copyOf(labels);
        this.assertions = copyOf(assertions);
        this.tolerance = Objects.requireNonNull(tolerance);
    }

    // Map.copyOf would lose the creation order
    private static <K, V> Map<K, V> copyOf(Map<K, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /** All nodes, in creation order. */
    public List<Node> getNodes() {
        return nodes;
    }

    /** All operations, in declaration order. */
    public List<Operation> getOperations() {
        return operations;
    }

    /** The values bound to input and constant nodes. Unbound input nodes are absent. */
    public Map<Node, Number> getSeeds() {
        return seeds;
    }

    /** The values the client expects constant or result nodes to have after evaluation. */
    public Map<Node, Number> getExpectations() {
        return expectations;
    }

    /** Maps each equality assertion's result node to its two operand nodes. */
    public Map<Node, List<Node>> getAssertions() {
        return assertions;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    /** Returns node's display label at the time this graph was compiled, falling back to its name. */
    public String label(Node node) {
        return Optional.ofNullable(labels.get(node)).orElseGet(node::getName);
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The values of every node in a graph after a successful evaluation: inputs and constants as bound, and operation
 * results as computed. Values are Numbers, except for the Booleans produced by equality assertions.
 */
public class EvaluationResult {
    private final Map<Node, Object> values;

    EvaluationResult(Map<Node, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Whether this result has a value for node. */
    public boolean contains(Node node) {
        return values.containsKey(node);
    }

    /**
     * Returns the value of node.
     *
     * @throws IllegalArgumentException if this result has no value for node: i.e. node is from another graph.
     */
    public Object get(Node node) {
        Object value = values.get(node);
        if (value == null) {
            throw new IllegalArgumentException("No value for node " + node.getName() + ". Is it in this graph?");
        }
        return value;
    }

    /** Returns the value of node, if present. */
    public Optional<Object> find(Node node) {
        return Optional.ofNullable(values.get(node));
    }

    /**
     * Returns the numeric value of node.
     *
     * @throws IllegalArgumentException if this result has no value for node.
     * @throws ClassCastException if the value isn't a Number.
     */
    public Number getNumber(Node node) {
        return (Number) get(node);
    }

    /**
     * Returns the boolean value of node, e.g. the outcome of an equality assertion.
     *
     * @throws IllegalArgumentException if this result has no value for node.
     * @throws ClassCastException if the value isn't a Boolean.
     */
    public boolean getBoolean(Node node) {
        return (Boolean) get(node);
    }

    /** Returns every node's value, in node creation order. */
    public Map<Node, Object> asMap() {
        return values;
    }

    /** Returns every node's value keyed by node id, in node creation order. */
    public Map<String, Object> byId() {
        Map<String, Object> byId = new LinkedHashMap<>();
        values.forEach((node, value) -> byId.put(node.getId(), value));
        return Collections.unmodifiableMap(byId);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof EvaluationResult)) {
            return false;
        }

        EvaluationResult other = (EvaluationResult) object;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return byId().toString();
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * A recorded computation: an ordered list of operand nodes, exactly one result node, and a kind that decides what runs.
 * Operations are the edges of the graph: operand -> operation -> result. Operations are created only by
 * {@link OperationLedger} and are immutable.
 */
public class Operation {
    private final String id;
    private final OperationKind kind;
    private final String label;
    private final List<Node> operands;
    private final Node result;
    private final NAryFunction<Number, Number> hintFunction; // Only for HINT operations

    Operation(String id, OperationKind kind, String label, List<Node> operands, Node result,
            NAryFunction<Number, Number> hintFunction) {
        this.id = Objects.requireNonNull(id);
        this.kind = Objects.requireNonNull(kind);
        this.label = Objects.requireNonNull(label);
        this.operands = List.copyOf(operands);
        this.result = Objects.requireNonNull(result);
        this.hintFunction = hintFunction;
    }

    /** The id of this operation, unique within its graph, e.g. "add0". */
    public String getId() {
        return id;
    }

    public OperationKind getKind() {
        return kind;
    }

    /** The display label of this operation, which defaults to its id. */
    public String getLabel() {
        return label;
    }

    /** The operand nodes, in the order they're passed to this operation's function. */
    public List<Node> getOperands() {
        return operands;
    }

    public Node getResult() {
        return result;
    }

    /** The client-supplied function backing this operation, present only for {@link OperationKind#HINT}. */
    public Optional<NAryFunction<Number, Number>> getHintFunction() {
        return Optional.ofNullable(hintFunction);
    }

    @Override
    public String toString() {
        return "[" + kind + "][" + id + "] " + label;
    }
}

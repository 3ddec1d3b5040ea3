/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * The append-only record of a graph's operations, in declaration order (which is not necessarily execution order). The
 * ledger guarantees that every recorded operation only refers to nodes of its registry and that no two operations
 * produce the same node.
 */
public class OperationLedger {
    private final NodeRegistry registry;
    private final List<Operation> operations = new ArrayList<>();
    private final Set<Node> results = new HashSet<>();

    public OperationLedger(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    /**
     * Checks that every operand can be used in an operation of this ledger's graph. Literals always can; nodes only if
     * they belong to the registry. Callers use this before creating any nodes for the operation, so that a failure
     * leaves the graph untouched.
     *
     * @param operationLabel the label of the intended operation, used in the error message.
     * @throws UnknownOperandException naming the first operand that doesn't belong to the graph.
     */
    public void requireKnownOperands(List<? extends Operand> operands, String operationLabel) {
        for (Operand operand : operands) {
            if (!operand.isKnownTo(registry)) {
                throw new UnknownOperandException(operand.getName(), operationLabel);
            }
        }
    }

    /**
     * Records a new operation. Either the operation is recorded in full or, if validation fails, nothing changes.
     *
     * @param hintFunction the function to run; required for {@link OperationKind#HINT} and forbidden for other kinds.
     * @param label the display label of the operation. May be null, in which case the operation's id is used.
     * @throws UnknownOperandException if any operand doesn't belong to this ledger's registry.
     * @throws IllegalArgumentException if the number of operands is wrong for kind, if result doesn't belong to the
     *         registry, if result is already the result of another operation, or if hintFunction's presence doesn't
     *         match kind.
     */
    public Operation record(OperationKind kind, List<Node> operands, Node result,
            NAryFunction<Number, Number> hintFunction, String label) {
        kind.requireValidOperandCount(operands.size());
        requireKnownOperands(operands, label == null ? kind.getIdPrefix() : label);
        requireFreshResult(result);
        requireHintFunctionMatchesKind(kind, hintFunction);

        String id = kind.getIdPrefix() + operations.size();
        Operation operation = new Operation(id, kind, label == null ? id : label, operands, result, hintFunction);
        operations.add(operation);
        results.add(result);
        return operation;
    }

    private void requireFreshResult(Node result) {
        if (!registry.contains(result)) {
            throw new IllegalArgumentException("Result node " + result.getName() + " isn't in graph.");
        }
        if (result.getKind() != Node.Kind.RESULT) {
            throw new IllegalArgumentException(
                    "Result node " + result.getName() + " is a(n) " + result.getKind() + " node, not a RESULT node.");
        }
        if (results.contains(result)) {
            throw new IllegalArgumentException(
                    "Node " + result.getName() + " is already the result of another operation.");
        }
    }

    private static void requireHintFunctionMatchesKind(OperationKind kind, NAryFunction<Number, Number> hintFunction) {
        boolean isHint = kind == OperationKind.HINT;
        boolean hasHintFunction = hintFunction != null;
        if (isHint != hasHintFunction) {
            String message = String.format("Operation kind %s %s a hint function", kind,
                    isHint ? "requires" : "doesn't accept");
            throw new IllegalArgumentException(message);
        }
    }

    /** Returns all operations in declaration order. */
    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    /** Whether node is the result of some recorded operation. */
    public boolean isResult(Node node) {
        return results.contains(node);
    }
}

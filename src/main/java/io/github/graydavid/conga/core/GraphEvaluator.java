/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * Computes a value for every node in a {@link CompiledGraph}. Operations run in an order consistent with a topological
 * sort of the graph (Kahn's algorithm over operand -> operation -> result edges), each exactly once. Operations that
 * are ready at the same time run in declaration order, though any order would give the same values, since operations
 * are pure.
 *
 * Evaluation is all or nothing: either every node gets exactly one value or an {@link EvaluationException} is thrown
 * and no values are returned. Each call builds a fresh value map; nothing is cached between calls.
 */
public class GraphEvaluator {
    private static final Logger LOG = LogManager.getLogger(GraphEvaluator.class);

    /**
     * Evaluates graph.
     *
     * @throws EmptyGraphException if the graph has no operations.
     * @throws UndefinedNodeException naming the first input node (in creation order) without a bound value.
     * @throws IncompleteGraphException if the graph's structure doesn't let every node get exactly one value.
     * @throws OperationEvaluationException if an operation fails; {@link HintEvaluationException} for hints.
     */
    public EvaluationResult evaluate(CompiledGraph graph) {
        requireOperations(graph);
        requireDefinedInputs(graph);

        Set<Node> graphNodes = new HashSet<>(graph.getNodes());
        Map<Node, Operation> producers = mapResultsToProducers(graph, graphNodes);
        Map<Node, Object> values = new HashMap<>();
        graph.getSeeds().forEach((node, value) -> {
            if (!producers.containsKey(node)) {
                values.put(node, value);
            }
        });

        ExecutionPlan plan = ExecutionPlan.from(graph, graphNodes, producers, values);
        LOG.debug("Evaluating {} operations over {} nodes", graph.getOperations().size(), graph.getNodes().size());
        int executed = 0;
        while (!plan.ready.isEmpty()) {
            Operation operation = plan.ready.remove();
            Object value = apply(operation, graph, values);
            values.put(operation.getResult(), value);
            LOG.debug("Operation {} produced {} for node {}", operation.getLabel(), value,
                    graph.label(operation.getResult()));
            executed++;
            plan.markComputed(operation.getResult());
        }

        if (executed < graph.getOperations().size()) {
            throw cycleException(graph, values);
        }
        return collectResult(graph, values);
    }

    private static void requireOperations(CompiledGraph graph) {
        if (graph.getOperations().isEmpty()) {
            throw new EmptyGraphException();
        }
    }

    private static void requireDefinedInputs(CompiledGraph graph) {
        for (Node node : graph.getNodes()) {
            if (node.getKind() == Node.Kind.INPUT && !graph.getSeeds().containsKey(node)) {
                throw new UndefinedNodeException(graph.label(node));
            }
        }
    }

    private static Map<Node, Operation> mapResultsToProducers(CompiledGraph graph, Set<Node> graphNodes) {
        Map<Node, Operation> producers = new HashMap<>();
        for (Operation operation : graph.getOperations()) {
            Node result = operation.getResult();
            requireInGraph(result, operation, graph, graphNodes);
            Operation previous = producers.put(result, operation);
            if (previous != null) {
                String message = String.format("Node %s is produced by both operation %s and operation %s",
                        graph.label(result), previous.getLabel(), operation.getLabel());
                throw new IncompleteGraphException(message, graph.label(result));
            }
        }
        return producers;
    }

    private static void requireInGraph(Node node, Operation operation, CompiledGraph graph, Set<Node> graphNodes) {
        if (!graphNodes.contains(node)) {
            String message = String.format("Operation %s refers to node %s, which isn't in graph", operation.getLabel(),
                    node.getName());
            throw new IncompleteGraphException(message, node.getName());
        }
    }

    /** Tracks which operations are waiting on which not-yet-computed nodes. */
    private static class ExecutionPlan {
        private final Map<Operation, Integer> pendingOperandCounts = new HashMap<>();
        private final Map<Node, List<Operation>> waitingConsumers = new HashMap<>();
        private final Queue<Operation> ready = new ArrayDeque<>();

        static ExecutionPlan from(CompiledGraph graph, Set<Node> graphNodes, Map<Node, Operation> producers,
                Map<Node, Object> seededValues) {
            ExecutionPlan plan = new ExecutionPlan();
            for (Operation operation : graph.getOperations()) {
                // The same node may be used several times as an operand (e.g. x * x) but is computed only once
                Set<Node> pendingOperands = new LinkedHashSet<>();
                for (Node operand : operation.getOperands()) {
                    requireInGraph(operand, operation, graph, graphNodes);
                    if (producers.containsKey(operand)) {
                        pendingOperands.add(operand);
                    } else if (!seededValues.containsKey(operand)) {
                        String message = String.format("Node %s is used by operation %s but neither has a value "
                                + "nor is produced by an operation", graph.label(operand), operation.getLabel());
                        throw new IncompleteGraphException(message, graph.label(operand));
                    }
                }
                pendingOperands.forEach(operand -> plan.waitingConsumers
                        .computeIfAbsent(operand, n -> new ArrayList<>())
                        .add(operation));
                plan.pendingOperandCounts.put(operation, pendingOperands.size());
                if (pendingOperands.isEmpty()) {
                    plan.ready.add(operation);
                }
            }
            return plan;
        }

        void markComputed(Node node) {
            for (Operation consumer : waitingConsumers.getOrDefault(node, List.of())) {
                int remaining = pendingOperandCounts.merge(consumer, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(consumer);
                }
            }
        }
    }

    private static IncompleteGraphException cycleException(CompiledGraph graph, Map<Node, Object> values) {
        String stuckOperations = graph.getOperations()
                .stream()
                .filter(operation -> !values.containsKey(operation.getResult()))
                .map(Operation::getLabel)
                .collect(Collectors.joining(", ", "(", ")"));
        return new IncompleteGraphException(
                "Operations " + stuckOperations + " depend on each other in a cycle and can never run");
    }

    private static Object apply(Operation operation, CompiledGraph graph, Map<Node, Object> values) {
        List<Object> arguments = operation.getOperands()
                .stream()
                .map(values::get)
                .collect(Collectors.toList());
        switch (operation.getKind()) {
            case ADD:
                return applyArithmetic(operation, graph, arguments, Arithmetic::add);
            case MUL:
                return applyArithmetic(operation, graph, arguments, Arithmetic::multiply);
            case ASSERT_EQUAL:
                return graph.getTolerance().matches(arguments.get(0), arguments.get(1));
            case HINT:
                return applyHint(operation, graph, arguments);
            default:
                throw new AssertionError("Unknown operation kind: " + operation.getKind());
        }
    }

    private interface BinaryArithmetic {
        Number apply(Number a, Number b);
    }

    private static Number applyArithmetic(Operation operation, CompiledGraph graph, List<Object> arguments,
            BinaryArithmetic arithmetic) {
        String resultLabel = graph.label(operation.getResult());
        List<Number> numbers = new ArrayList<>();
        for (int i = 0; i < arguments.size(); ++i) {
            Object argument = arguments.get(i);
            if (!(argument instanceof Number)) {
                throw new OperationEvaluationException(operation.getLabel(), resultLabel,
                        nonNumericOperandReason(operation, graph, i, argument));
            }
            numbers.add((Number) argument);
        }

        try {
            return arithmetic.apply(numbers.get(0), numbers.get(1));
        } catch (ArithmeticException e) {
            throw new OperationEvaluationException(operation.getLabel(), resultLabel, e.getMessage(), e);
        }
    }

    private static Number applyHint(Operation operation, CompiledGraph graph, List<Object> arguments) {
        String resultLabel = graph.label(operation.getResult());
        List<Number> numbers = new ArrayList<>();
        for (int i = 0; i < arguments.size(); ++i) {
            Object argument = arguments.get(i);
            if (!(argument instanceof Number)) {
                throw new HintEvaluationException(operation.getLabel(), resultLabel,
                        nonNumericOperandReason(operation, graph, i, argument));
            }
            numbers.add((Number) argument);
        }

        NAryFunction<Number, Number> function = operation.getHintFunction()
                .orElseThrow(() -> new IncompleteGraphException(
                        "Hint operation " + operation.getLabel() + " has no function", resultLabel));
        Number result;
        try {
            result = function.apply(List.copyOf(numbers));
        } catch (RuntimeException e) {
            throw new HintEvaluationException(operation.getLabel(), resultLabel, "the hint function threw " + e, e);
        }
        if (result == null) {
            throw new HintEvaluationException(operation.getLabel(), resultLabel, "the hint function returned null");
        }
        return result;
    }

    private static String nonNumericOperandReason(Operation operation, CompiledGraph graph, int index,
            Object argument) {
        Node operand = operation.getOperands().get(index);
        return String.format("operand %s has non-numeric value %s", graph.label(operand), argument);
    }

    private static EvaluationResult collectResult(CompiledGraph graph, Map<Node, Object> values) {
        Map<Node, Object> ordered = new LinkedHashMap<>();
        for (Node node : graph.getNodes()) {
            Object value = values.get(node);
            if (value == null) {
                String message = String.format("Node %s neither has a value nor is produced by an operation",
                        graph.label(node));
                throw new IncompleteGraphException(message, graph.label(node));
            }
            ordered.put(node, value);
        }
        return new EvaluationResult(ordered);
    }
}

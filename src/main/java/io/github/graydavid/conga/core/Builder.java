/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.github.graydavid.naryfunctions.NAryFunction;
import io.github.graydavid.naryfunctions.ThreeAryFunction;

/**
 * The entry point for describing, evaluating, and checking a graph of values and operations. A Builder owns exactly one
 * graph for its whole lifetime: its {@link NodeRegistry}, its {@link OperationLedger}, and the values bound to its
 * nodes.
 *
 * Execution is deferred. Adding operations never computes anything; it only records what to compute. Values are
 * computed when the client calls {@link #evaluate()}, {@link #getGraphResults()}, or {@link #checkConstraints()}, each
 * of which compiles an immutable snapshot of the graph and evaluates it from scratch.
 *
 * Every operation accepts nodes from this Builder or numeric literals. Literals are promoted to fresh constant nodes,
 * so {@code add(x, 1)} and {@code add(x, constant(1))} describe the same computation. Operations produce one new node
 * each. To give that node or the operation itself a human-readable label, start with {@link #labeled(String)} or
 * {@link #operationLabel(String)}: e.g. {@code builder.labeled("x + 1").add(x, 1)}.
 *
 * A Builder is meant to be used from a single thread. Its lifecycle goes from {@link State#BUILDING} to
 * {@link State#EVALUATED} after the first evaluation. Adding to the graph after that is possible but not the supported
 * contract.
 */
public class Builder {
    private static final Logger LOG = LogManager.getLogger(Builder.class);

    private final Tolerance tolerance;
    private final GraphEvaluator evaluator;
    private final ConstraintChecker checker;
    private final NodeRegistry registry = new NodeRegistry();
    private final OperationLedger ledger = new OperationLedger(registry);
    private final Map<Node, Number> seeds = new LinkedHashMap<>();
    private final Map<Node, Number> expectations = new LinkedHashMap<>();
    private final Map<Node, List<Node>> assertions = new LinkedHashMap<>();
    private State state = State.BUILDING;

    Builder(Tolerance tolerance, GraphEvaluator evaluator, ConstraintChecker checker) {
        this.tolerance = Objects.requireNonNull(tolerance);
        this.evaluator = Objects.requireNonNull(evaluator);
        this.checker = Objects.requireNonNull(checker);
    }

    /** Creates a Builder for a new, empty graph that compares values with {@link Tolerance#DEFAULT}. */
    public static Builder create() {
        return create(Tolerance.DEFAULT);
    }

    /** Creates a Builder for a new, empty graph that compares values with the given tolerance. */
    public static Builder create(Tolerance tolerance) {
        return new Builder(tolerance, new GraphEvaluator(), new ConstraintChecker());
    }

    public State getState() {
        return state;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    /**
     * Creates an input node: a node whose value must be bound with {@link #fillValues(Map)} before the graph is
     * evaluated.
     */
    public Node init() {
        return registry.createNode(Node.Kind.INPUT);
    }

    /** Same as {@link #init()}, except the node is labeled with label. */
    public Node init(String label) {
        return registry.createNode(Node.Kind.INPUT, Objects.requireNonNull(label));
    }

    /** Creates a constant node, labeled with the text of value. */
    public Node constant(Number value) {
        return constant(value, String.valueOf(value));
    }

    /** Creates a constant node with the given label. The value of a constant never changes. */
    public Node constant(Number value, String label) {
        Objects.requireNonNull(value);
        Node constant = registry.createNode(Node.Kind.CONSTANT, Objects.requireNonNull(label));
        seeds.put(constant, value);
        return constant;
    }

    /** Starts an operation whose result node will be labeled with nodeLabel. */
    public OperationLabels labeled(String nodeLabel) {
        return new OperationLabels(this, Objects.requireNonNull(nodeLabel), null);
    }

    /** Starts an operation that will itself be labeled with operationLabel. */
    public OperationLabels operationLabel(String operationLabel) {
        return new OperationLabels(this, null, Objects.requireNonNull(operationLabel));
    }

    private OperationLabels unlabeled() {
        return new OperationLabels(this, null, null);
    }

    /**
     * Adds a node for a + b.
     *
     * @throws UnknownOperandException if a or b is a node from another graph. Nothing is added to the graph then.
     */
    public Node add(Operand a, Operand b) {
        return unlabeled().add(a, b);
    }

    /** Same as {@link #add(Operand, Operand)}, with b promoted to a constant node. */
    public Node add(Operand a, Number b) {
        return unlabeled().add(a, b);
    }

    /** Same as {@link #add(Operand, Operand)}, with a promoted to a constant node. */
    public Node add(Number a, Operand b) {
        return unlabeled().add(a, b);
    }

    /**
     * Adds a node for a * b.
     *
     * @throws UnknownOperandException if a or b is a node from another graph. Nothing is added to the graph then.
     */
    public Node mul(Operand a, Operand b) {
        return unlabeled().mul(a, b);
    }

    public Node mul(Operand a, Number b) {
        return unlabeled().mul(a, b);
    }

    public Node mul(Number a, Operand b) {
        return unlabeled().mul(a, b);
    }

    /**
     * Adds a boolean node for whether a equals b (within this Builder's tolerance) and registers it as an assertion
     * that {@link #checkConstraints()} will check.
     *
     * @throws UnknownOperandException if a or b is a node from another graph. Nothing is added to the graph then.
     */
    public Node assertEqual(Operand a, Operand b) {
        return unlabeled().assertEqual(a, b);
    }

    public Node assertEqual(Operand a, Number b) {
        return unlabeled().assertEqual(a, b);
    }

    public Node assertEqual(Number a, Operand b) {
        return unlabeled().assertEqual(a, b);
    }

    /**
     * Adds a node whose value is function applied to the values of operands, in order, at evaluation time. The function
     * is opaque to the graph: it can't add nodes, and it should be pure for evaluation to be deterministic.
     *
     * @throws IllegalArgumentException if operands is empty.
     * @throws UnknownOperandException if any operand is a node from another graph. Nothing is added to the graph then.
     */
    public Node hint(NAryFunction<Number, Number> function, List<? extends Operand> operands) {
        return unlabeled().hint(function, operands);
    }

    /** Same as {@link #hint(NAryFunction, List)}, for a single operand. */
    public Node hint(Function<Number, ? extends Number> function, Operand operand) {
        return unlabeled().hint(function, operand);
    }

    /** Same as {@link #hint(NAryFunction, List)}, for two operands. */
    public Node hint(BiFunction<Number, Number, ? extends Number> function, Operand a, Operand b) {
        return unlabeled().hint(function, a, b);
    }

    /** Same as {@link #hint(NAryFunction, List)}, for three operands. */
    public Node hint(ThreeAryFunction<Number, Number, Number, ? extends Number> function, Operand a, Operand b,
            Operand c) {
        return unlabeled().hint(function, a, b, c);
    }

    private Node record(OperationKind kind, List<? extends Operand> operands, NAryFunction<Number, Number> function,
            String nodeLabel, String operationLabel) {
        // Validate everything before creating any node, so that a failure leaves the graph untouched
        kind.requireValidOperandCount(operands.size());
        ledger.requireKnownOperands(operands, operationLabel == null ? kind.getIdPrefix() : operationLabel);

        Node result = registry.createNode(Node.Kind.RESULT, nodeLabel);
        List<Node> operandNodes = operands.stream()
                .map(operand -> operand.resolve(this::constant))
                .collect(Collectors.toList());
        ledger.record(kind, operandNodes, result, function, operationLabel);
        if (kind == OperationKind.ASSERT_EQUAL) {
            assertions.put(result, operandNodes);
        }
        return result;
    }

    /**
     * Binds values to nodes. Binding an input node sets the value evaluation starts from. Binding a constant or result
     * node instead declares the value that node is expected to have, which {@link #checkConstraints()} will check; it
     * never overrides the node's value. Either way, the node's display label becomes "label = value".
     *
     * Entries are processed one at a time. A node that isn't in this graph is skipped with a warning, and the remaining
     * entries are still bound.
     *
     * @return a warning for each skipped entry.
     */
    public List<Diagnostic> fillValues(Map<Node, ? extends Number> values) {
        List<Diagnostic> warnings = new ArrayList<>();
        values.forEach((node, value) -> {
            Objects.requireNonNull(value);
            if (!registry.contains(node)) {
                String message = "Node " + node.getName() + " isn't in graph. Cannot set its value.";
                LOG.warn(message);
                warnings.add(Diagnostic.of(Diagnostic.Kind.UNKNOWN_NODE, node.getName(), message, value));
                return;
            }

            if (node.getKind() == Node.Kind.INPUT) {
                seeds.put(node, value);
            } else {
                expectations.put(node, value);
            }
            registry.relabel(node, node.getName() + " = " + value);
        });
        return Collections.unmodifiableList(warnings);
    }

    /** Takes an immutable snapshot of the graph as it currently stands. */
    public CompiledGraph compile() {
        return new CompiledGraph(registry.getNodes(), ledger.getOperations(), seeds, expectations,
                registry.snapshotLabels(), assertions, tolerance);
    }

    /** Evaluates the graph from scratch. Never throws for a malformed graph: problems come back as diagnostics. */
    public Evaluation evaluate() {
        return evaluate(compile());
    }

    private Evaluation evaluate(CompiledGraph graph) {
        state = State.EVALUATED;
        try {
            return Evaluation.success(evaluator.evaluate(graph));
        } catch (EvaluationException e) {
            Diagnostic diagnostic = e.toDiagnostic();
            LOG.warn(diagnostic.getMessage());
            LOG.debug("Evaluation failure details", e);
            return Evaluation.failure(diagnostic);
        }
    }

    /** Evaluates the graph and returns the values of all nodes, or empty if the graph couldn't be evaluated. */
    public Optional<EvaluationResult> getGraphResults() {
        return evaluate().getResult();
    }

    /**
     * Evaluates the graph and checks every assertion and expected value. An evaluation failure makes for an
     * unsatisfied report containing its diagnostic.
     */
    public ConstraintReport checkConstraints() {
        CompiledGraph graph = compile();
        Evaluation evaluation = evaluate(graph);
        return evaluation.getResult()
                .map(result -> checker.check(graph, result))
                .orElseGet(() -> ConstraintReport.from(evaluation.getDiagnostics()));
    }

    /** Where a Builder is in its lifecycle. */
    public enum State {
        /** Nothing has been evaluated yet. */
        BUILDING,
        /** At least one evaluation has happened, successful or not. */
        EVALUATED;
    }

    /**
     * Adds an operation with optional labels for its result node and for the operation itself. Unset labels default to
     * the node id and the operation id.
     */
    public static class OperationLabels {
        private final Builder builder;
        private final String nodeLabel; // May be null
        private final String operationLabel; // May be null

        private OperationLabels(Builder builder, String nodeLabel, String operationLabel) {
            this.builder = builder;
            this.nodeLabel = nodeLabel;
            this.operationLabel = operationLabel;
        }

        public OperationLabels labeled(String nodeLabel) {
            return new OperationLabels(builder, Objects.requireNonNull(nodeLabel), operationLabel);
        }

        public OperationLabels operationLabel(String operationLabel) {
            return new OperationLabels(builder, nodeLabel, Objects.requireNonNull(operationLabel));
        }

        private Node record(OperationKind kind, List<? extends Operand> operands,
                NAryFunction<Number, Number> function) {
            return builder.record(kind, operands, function, nodeLabel, operationLabel);
        }

        /** See {@link Builder#add(Operand, Operand)}. */
        public Node add(Operand a, Operand b) {
            return record(OperationKind.ADD, List.of(a, b), null);
        }

        public Node add(Operand a, Number b) {
            return add(a, Operand.literal(b));
        }

        public Node add(Number a, Operand b) {
            return add(Operand.literal(a), b);
        }

        /** See {@link Builder#mul(Operand, Operand)}. */
        public Node mul(Operand a, Operand b) {
            return record(OperationKind.MUL, List.of(a, b), null);
        }

        public Node mul(Operand a, Number b) {
            return mul(a, Operand.literal(b));
        }

        public Node mul(Number a, Operand b) {
            return mul(Operand.literal(a), b);
        }

        /** See {@link Builder#assertEqual(Operand, Operand)}. */
        public Node assertEqual(Operand a, Operand b) {
            return record(OperationKind.ASSERT_EQUAL, List.of(a, b), null);
        }

        public Node assertEqual(Operand a, Number b) {
            return assertEqual(a, Operand.literal(b));
        }

        public Node assertEqual(Number a, Operand b) {
            return assertEqual(Operand.literal(a), b);
        }

        /** See {@link Builder#hint(NAryFunction, List)}. */
        public Node hint(NAryFunction<Number, Number> function, List<? extends Operand> operands) {
            return record(OperationKind.HINT, List.copyOf(operands), Objects.requireNonNull(function));
        }

        public Node hint(Function<Number, ? extends Number> function, Operand operand) {
            Objects.requireNonNull(function);
            return hint(arguments -> function.apply(arguments.get(0)), List.of(operand));
        }

        public Node hint(BiFunction<Number, Number, ? extends Number> function, Operand a, Operand b) {
            Objects.requireNonNull(function);
            return hint(arguments -> function.apply(arguments.get(0), arguments.get(1)), List.of(a, b));
        }

        public Node hint(ThreeAryFunction<Number, Number, Number, ? extends Number> function, Operand a, Operand b,
                Operand c) {
            Objects.requireNonNull(function);
            return hint(arguments -> function.apply(arguments.get(0), arguments.get(1), arguments.get(2)),
                    List.of(a, b, c));
        }
    }
}

package io.github.graydavid.conga.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.google.common.base.Throwables;

import io.github.graydavid.naryfunctions.NAryFunction;

public class GraphEvaluatorTest {
    private final GraphEvaluator evaluator = new GraphEvaluator();
    private final NodeRegistry registry = new NodeRegistry();
    private final List<Operation> operations = new ArrayList<>();
    private final Map<Node, Number> seeds = new LinkedHashMap<>();

    private Node input(String name, Number value) {
        Node node = registry.createNode(Node.Kind.INPUT, name);
        if (value != null) {
            seeds.put(node, value);
        }
        return node;
    }

    private Node constant(Number value) {
        Node node = registry.createNode(Node.Kind.CONSTANT, String.valueOf(value));
        seeds.put(node, value);
        return node;
    }

    private Node result(String name) {
        return registry.createNode(Node.Kind.RESULT, name);
    }

    private Operation operation(OperationKind kind, Node result, Node... operands) {
        return hint(null, kind, result, operands);
    }

    private Operation hint(NAryFunction<Number, Number> function, OperationKind kind, Node result, Node... operands) {
        String id = kind.getIdPrefix() + operations.size();
        Operation operation = new Operation(id, kind, id, List.of(operands), result, function);
        operations.add(operation);
        return operation;
    }

    private CompiledGraph compile() {
        return compile(Tolerance.DEFAULT);
    }

    private CompiledGraph compile(Tolerance tolerance) {
        return new CompiledGraph(registry.getNodes(), operations, seeds, Map.of(), registry.snapshotLabels(), Map.of(),
                tolerance);
    }

    @Test
    public void evaluatesEveryNodeInCreationOrder() {
        Node x = input("x", 3);
        Node two = constant(2);
        Node sum = result("sum");
        Node product = result("product");
        operation(OperationKind.ADD, sum, x, two);
        operation(OperationKind.MUL, product, sum, x);

        EvaluationResult result = evaluator.evaluate(compile());

        assertThat(result.asMap().keySet(), contains(x, two, sum, product));
        assertThat(result.getNumber(sum).longValue(), is(5L));
        assertThat(result.getNumber(product).longValue(), is(15L));
    }

    @Test
    public void runsOperationsAfterTheirOperandsRegardlessOfDeclarationOrder() {
        Node x = input("x", 2);
        Node first = result("first");
        Node second = result("second");
        // second is declared before the operation producing its operand
        operation(OperationKind.MUL, second, first, first);
        operation(OperationKind.ADD, first, x, x);

        EvaluationResult result = evaluator.evaluate(compile());

        assertThat(result.getNumber(first).longValue(), is(4L));
        assertThat(result.getNumber(second).longValue(), is(16L));
    }

    @Test
    public void runsEachOperationExactlyOnceEvenWhenResultIsSharedByManyConsumers() {
        AtomicInteger calls = new AtomicInteger();
        Node x = input("x", 1);
        Node counted = result("counted");
        Node a = result("a");
        Node b = result("b");
        Node c = result("c");
        hint(arguments -> {
            calls.incrementAndGet();
            return arguments.get(0);
        }, OperationKind.HINT, counted, x);
        operation(OperationKind.ADD, a, counted, counted);
        operation(OperationKind.MUL, b, counted, a);
        operation(OperationKind.ADD, c, a, b);

        evaluator.evaluate(compile());

        assertThat(calls.get(), is(1));
    }

    @Test
    public void emptyGraphIsRejected() {
        input("x", 1);

        EmptyGraphException thrown = assertThrows(EmptyGraphException.class, () -> evaluator.evaluate(compile()));

        assertThat(thrown.getDiagnosticKind(), is(Diagnostic.Kind.EMPTY_GRAPH));
        assertFalse(thrown.getNodeLabel().isPresent());
    }

    @Test
    public void firstUnboundInputIsUndefined() {
        Node x = input("x", 1);
        Node y = input("y", null);
        Node z = input("z", null);
        Node sum = result("sum");
        Node total = result("total");
        operation(OperationKind.ADD, sum, x, y);
        operation(OperationKind.ADD, total, sum, z);

        UndefinedNodeException thrown = assertThrows(UndefinedNodeException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getNodeLabel().get(), is("y"));
        assertThat(thrown.toDiagnostic().getKind(), is(Diagnostic.Kind.UNDEFINED_NODE));
    }

    @Test
    public void unusedUnboundInputIsStillUndefined() {
        Node x = input("x", 1);
        input("unused", null);
        operation(OperationKind.ADD, result("sum"), x, x);

        assertThrows(UndefinedNodeException.class, () -> evaluator.evaluate(compile()));
    }

    @Test
    public void cyclesAreReportedAsIncompleteGraphs() {
        Node x = input("x", 1);
        Node first = result("first");
        Node second = result("second");
        operation(OperationKind.ADD, first, x, second);
        operation(OperationKind.ADD, second, x, first);

        IncompleteGraphException thrown = assertThrows(IncompleteGraphException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getMessage(), containsString("cycle"));
        assertThat(thrown.getMessage(), containsString("add0"));
        assertThat(thrown.getMessage(), containsString("add1"));
    }

    @Test
    public void resultWithoutProducerIsIncomplete() {
        Node x = input("x", 1);
        Node orphan = result("orphan");
        operation(OperationKind.ADD, result("sum"), x, orphan);

        IncompleteGraphException thrown = assertThrows(IncompleteGraphException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getNodeLabel().get(), is("orphan"));
    }

    @Test
    public void unusedResultWithoutProducerIsIncomplete() {
        Node x = input("x", 1);
        operation(OperationKind.ADD, result("sum"), x, x);
        result("orphan");

        IncompleteGraphException thrown = assertThrows(IncompleteGraphException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getNodeLabel().get(), is("orphan"));
    }

    @Test
    public void resultProducedTwiceIsIncomplete() {
        Node x = input("x", 1);
        Node sum = result("sum");
        operation(OperationKind.ADD, sum, x, x);
        operation(OperationKind.MUL, sum, x, x);

        IncompleteGraphException thrown = assertThrows(IncompleteGraphException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getMessage(), containsString("produced by both"));
    }

    @Test
    public void operandsFromOutsideTheGraphAreIncomplete() {
        Node x = input("x", 1);
        Node foreign = new NodeRegistry().createNode(Node.Kind.INPUT, "foreign");
        operation(OperationKind.ADD, result("sum"), x, foreign);

        IncompleteGraphException thrown = assertThrows(IncompleteGraphException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getMessage(), containsString("foreign"));
    }

    @Test
    public void integralOperandsProduceLongsAndOthersProduceDoubles() {
        Node two = constant(2);
        Node three = constant((short) 3);
        Node half = constant(0.5f);
        Node integral = result("integral");
        Node floating = result("floating");
        operation(OperationKind.MUL, integral, two, three);
        operation(OperationKind.ADD, floating, two, half);

        EvaluationResult result = evaluator.evaluate(compile());

        assertThat(result.get(integral), instanceOf(Long.class));
        assertThat(result.getNumber(integral).longValue(), is(6L));
        assertThat(result.get(floating), instanceOf(Double.class));
        assertThat(result.getNumber(floating).doubleValue(), is(2.5));
    }

    @Test
    public void integralOverflowFailsTheOperation() {
        Node max = constant(Long.MAX_VALUE);
        Node product = result("product");
        operation(OperationKind.MUL, product, max, max);

        OperationEvaluationException thrown = assertThrows(OperationEvaluationException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getOperationLabel(), is("mul0"));
        assertThat(thrown.getNodeLabel().get(), is("product"));
        assertThat(thrown.getDiagnosticKind(), is(Diagnostic.Kind.OPERATION_FAILURE));
        assertThat(thrown.getCause(), instanceOf(ArithmeticException.class));
    }

    @Test
    public void arithmeticOnAssertionOutcomesFails() {
        Node x = input("x", 1);
        Node equal = result("equal");
        operation(OperationKind.ASSERT_EQUAL, equal, x, x);
        operation(OperationKind.ADD, result("sum"), equal, x);

        OperationEvaluationException thrown = assertThrows(OperationEvaluationException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getMessage(), containsString("non-numeric value true"));
    }

    @Test
    public void assertEqualUsesTheGraphTolerance() {
        Node third = constant(1.0 / 3);
        Node approximately = constant(0.333333333333);
        Node equal = result("equal");
        operation(OperationKind.ASSERT_EQUAL, equal, third, approximately);

        assertTrue(evaluator.evaluate(compile(Tolerance.of(1e-6, 0))).getBoolean(equal));
        assertFalse(evaluator.evaluate(compile(Tolerance.exact())).getBoolean(equal));
    }

    @Test
    public void hintFunctionsReceiveOperandValuesInOrder() {
        Node a = input("a", 10);
        Node b = input("b", 4);
        Node difference = result("difference");
        hint(arguments -> arguments.get(0).longValue() - arguments.get(1).longValue(), OperationKind.HINT, difference,
                b, a);

        EvaluationResult result = evaluator.evaluate(compile());

        assertThat(result.getNumber(difference).longValue(), is(-6L));
    }

    @Test
    public void throwingHintFunctionsFailWithTheirCause() {
        IllegalStateException failure = new IllegalStateException("hint failed");
        Node x = input("x", 1);
        Node hinted = result("hinted");
        hint(arguments -> {
            throw failure;
        }, OperationKind.HINT, hinted, x);

        HintEvaluationException thrown = assertThrows(HintEvaluationException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(Throwables.getCausalChain(thrown), hasItem(failure));
        assertThat(thrown.getDiagnosticKind(), is(Diagnostic.Kind.HINT_FAILURE));
        assertThat(thrown.getNodeLabel().get(), is("hinted"));
    }

    @Test
    public void hintFunctionsReturningNullFail() {
        Node x = input("x", 1);
        hint(arguments -> null, OperationKind.HINT, result("hinted"), x);

        HintEvaluationException thrown = assertThrows(HintEvaluationException.class,
                () -> evaluator.evaluate(compile()));

        assertThat(thrown.getMessage(), containsString("returned null"));
    }

    @Test
    public void evaluationNeverChangesTheCompiledGraph() {
        Node x = input("x", 2);
        operation(OperationKind.ADD, result("sum"), x, x);
        CompiledGraph graph = compile();

        EvaluationResult first = evaluator.evaluate(graph);
        EvaluationResult second = evaluator.evaluate(graph);

        assertThat(first, is(second));
        assertThat(graph.getSeeds().size(), is(1));
    }
}

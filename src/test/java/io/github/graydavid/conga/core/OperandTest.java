package io.github.graydavid.conga.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.function.Function;

import org.junit.jupiter.api.Test;

public class OperandTest {
    private final NodeRegistry registry = new NodeRegistry();

    @Test
    public void literalIsNamedAfterItsValue() {
        assertThat(Operand.literal(5).getName(), is("5"));
        assertThat(Operand.literal(0.25).getName(), is("0.25"));
    }

    @Test
    public void literalRejectsNull() {
        assertThrows(NullPointerException.class, () -> Operand.literal(null));
    }

    @Test
    public void literalIsKnownToEveryRegistry() {
        assertTrue(Operand.literal(1).isKnownTo(registry));
        assertTrue(Operand.literal(1).isKnownTo(new NodeRegistry()));
    }

    @Test
    public void literalResolvesThroughConstantFactory() {
        Node constant = registry.createNode(Node.Kind.CONSTANT, "7");
        @SuppressWarnings("unchecked")
        Function<Number, Node> constantFactory = mock(Function.class);
        when(constantFactory.apply(7)).thenReturn(constant);

        Node resolved = Operand.literal(7).resolve(constantFactory);

        assertThat(resolved, sameInstance(constant));
        verify(constantFactory).apply(7);
    }

    @Test
    public void nodeResolvesToItselfWithoutCreatingConstants() {
        Node node = registry.createNode(Node.Kind.INPUT, "x");
        @SuppressWarnings("unchecked")
        Function<Number, Node> constantFactory = mock(Function.class);

        assertThat(node.resolve(constantFactory), sameInstance(node));
        verifyNoInteractions(constantFactory);
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value in a graph: an input supplied by the client, a constant, or the result of exactly one operation. Nodes are
 * lightweight handles created by a {@link NodeRegistry}; they know nothing about their values, which live in the
 * Builder (bindings) and in {@link EvaluationResult}s.
 *
 * The id is guaranteed to be unique only within the registry that created the Node. Nodes use identity equality:
 * two nodes from different graphs are never equal, even if their ids collide. Whether a node may take part in
 * a graph is decided by {@link NodeRegistry#contains(Node)}, never by comparing ids.
 */
public final class Node extends Operand {
    private final NodeRegistry registry;
    private final String id;
    private final Kind kind;
    private final String name; // May be null

    Node(NodeRegistry registry, String id, Kind kind, String name) {
        this.registry = Objects.requireNonNull(registry);
        this.id = Objects.requireNonNull(id);
        this.kind = Objects.requireNonNull(kind);
        this.name = name;
    }

    /** The id of this node, unique within its graph. */
    public String getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the human-readable name given to this node at creation or, if no name was given, the node's id. This
     * name never changes; the display label tracked by the registry may, when a value is bound to the node.
     */
    @Override
    public String getName() {
        return name == null ? id : name;
    }

    /** Whether this node was created by the given registry. */
    boolean isOwnedBy(NodeRegistry registry) {
        return this.registry == registry;
    }

    @Override
    boolean isKnownTo(NodeRegistry registry) {
        return registry.contains(this);
    }

    @Override
    Node resolve(Function<Number, Node> constantFactory) {
        return this;
    }

    @Override
    public String toString() {
        return "[" + kind + "][" + id + "] " + getName();
    }

    /** How a Node gets its value. */
    public enum Kind {
        /** Supplied by the client before evaluation (created through {@link Builder#init()}). */
        INPUT,
        /** Bound once, at creation. */
        CONSTANT,
        /** Computed by the single operation that declares this node as its result. */
        RESULT;
    }
}

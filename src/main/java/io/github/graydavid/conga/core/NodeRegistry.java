/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owns node identity for a single graph: hands out unique ids, remembers which nodes belong to the graph, and tracks
 * each node's current display label.
 *
 * Not thread safe. A registry has exactly one writer, the {@link Builder} that owns it.
 */
public class NodeRegistry {
    private final List<Node> nodes = new ArrayList<>();
    private final Set<Node> members = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Node, String> labels = new HashMap<>();
    private int nextId = 0;

    /**
     * Creates a new node with the next available id. Never fails, and never returns an id that this registry has
     * returned before.
     *
     * @param label the human-readable name of the node. May be null, in which case the node is labeled by its id.
     */
    public Node createNode(Node.Kind kind, String label) {
        Node node = new Node(this, String.valueOf(nextId), kind, label);
        nextId++;
        nodes.add(node);
        members.add(node);
        labels.put(node, node.getName());
        return node;
    }

    /** Same as {@link #createNode(Node.Kind, String)}, except with no label. */
    public Node createNode(Node.Kind kind) {
        return createNode(kind, null);
    }

    /** Whether node was created by this registry. Nodes from other registries are never contained. */
    public boolean contains(Node node) {
        return node.isOwnedBy(this) && members.contains(node);
    }

    /**
     * Returns the current display label of node: its name, possibly updated by {@link #relabel(Node, String)}.
     *
     * @throws IllegalArgumentException if node doesn't belong to this registry.
     */
    public String label(Node node) {
        requireMember(node);
        return labels.get(node);
    }

    /**
     * Updates the display label of node. The node's own name is unaffected.
     *
     * @throws IllegalArgumentException if node doesn't belong to this registry.
     */
    public void relabel(Node node, String label) {
        requireMember(node);
        labels.put(node, Objects.requireNonNull(label));
    }

    private void requireMember(Node node) {
        if (!contains(node)) {
            throw new IllegalArgumentException("Node " + node.getName() + " isn't in graph.");
        }
    }

    /** Returns all nodes in creation order. */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Returns a copy of the current display labels, in node creation order. */
    Map<Node, String> snapshotLabels() {
        Map<Node, String> snapshot = new LinkedHashMap<>();
        nodes.forEach(node -> snapshot.put(node, labels.get(node)));
        return Collections.unmodifiableMap(snapshot);
    }
}

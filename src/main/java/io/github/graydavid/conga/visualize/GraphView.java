/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.conga.core.CompiledGraph;
import io.github.graydavid.conga.core.Node;
import io.github.graydavid.conga.core.Operation;

/**
 * A read-only, renderable description of a graph. Every node and every operation is a vertex (operations are drawn as
 * vertices of their own, not just as edges), and the edges run from each operand to its operation and from each
 * operation to its result. A node used twice by the same operation (e.g. x * x) yields a single edge.
 */
public class GraphView {
    private static final GraphView EMPTY = new GraphView(List.of(), Set.of());

    private final List<Vertex> vertices;
    private final List<Edge> edges;
    private final Set<Edge> edgeSet;

    private GraphView(List<Vertex> vertices, Set<Edge> edges) {
        this.vertices = List.copyOf(vertices);
        this.edges = List.copyOf(edges);
        this.edgeSet = Set.copyOf(edges);
    }

    /** A view with no vertices and no edges. */
    public static GraphView empty() {
        return EMPTY;
    }

    /**
     * Creates a view of graph: one vertex per node and one per operation, labeled with the graph's display labels.
     */
    public static GraphView of(CompiledGraph graph) {
        Map<String, Vertex> vertices = new LinkedHashMap<>();
        for (Node node : graph.getNodes()) {
            vertices.put(node.getId(), new Vertex(node.getId(), graph.label(node), Vertex.Shape.VALUE));
        }
        Set<Edge> edges = new LinkedHashSet<>();
        for (Operation operation : graph.getOperations()) {
            vertices.put(operation.getId(),
                    new Vertex(operation.getId(), operation.getLabel(), Vertex.Shape.OPERATION));
            for (Node operand : operation.getOperands()) {
                edges.add(new Edge(operand.getId(), operation.getId()));
            }
            edges.add(new Edge(operation.getId(), operation.getResult().getId()));
        }
        return new GraphView(new ArrayList<>(vertices.values()), edges);
    }

    /** All vertices: nodes in creation order, then operations in declaration order. */
    public List<Vertex> getVertices() {
        return vertices;
    }

    /** All edges, in the order they were discovered. */
    public List<Edge> getEdges() {
        return edges;
    }

    public boolean containsEdge(String fromId, String toId) {
        return edgeSet.contains(new Edge(fromId, toId));
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    /** A vertex in a GraphView: either a value node or an operation. */
    public static class Vertex {
        private final String id;
        private final String label;
        private final Shape shape;

        Vertex(String id, String label, Shape shape) {
            this.id = Objects.requireNonNull(id);
            this.label = Objects.requireNonNull(label);
            this.shape = Objects.requireNonNull(shape);
        }

        /** The id of the node or operation. Unique within a view. */
        public String getId() {
            return id;
        }

        public String getLabel() {
            return label;
        }

        public Shape getShape() {
            return shape;
        }

        @Override
        public boolean equals(Object object) {
            if (!(object instanceof Vertex)) {
                return false;
            }

            Vertex other = (Vertex) object;
            return id.equals(other.id) && label.equals(other.label) && shape == other.shape;
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, label, shape);
        }

        @Override
        public String toString() {
            return id + "(" + label + ")";
        }

        /** How a vertex is drawn. */
        public enum Shape {
            /** A node: drawn as a rectangle. */
            VALUE,
            /** An operation: drawn as a circle. */
            OPERATION;
        }
    }

    /** A directed edge between two vertices, identified by their ids. */
    public static class Edge {
        private final String fromId;
        private final String toId;

        Edge(String fromId, String toId) {
            this.fromId = Objects.requireNonNull(fromId);
            this.toId = Objects.requireNonNull(toId);
        }

        public String getFromId() {
            return fromId;
        }

        public String getToId() {
            return toId;
        }

        @Override
        public boolean equals(Object object) {
            if (!(object instanceof Edge)) {
                return false;
            }

            Edge other = (Edge) object;
            return Objects.equals(this.fromId, other.fromId) && Objects.equals(this.toId, other.toId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fromId, toId);
        }

        @Override
        public String toString() {
            return "{" + fromId + "}->{" + toId + "}";
        }
    }
}

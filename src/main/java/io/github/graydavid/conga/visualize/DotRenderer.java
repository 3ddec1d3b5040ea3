/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link GraphView} in Graphviz's DOT language. Nodes are drawn as rectangles and operations as circles.
 * Supports only {@link RenderFormat#DOT}; see {@link GraphvizRenderer} for images.
 */
public class DotRenderer implements GraphRenderer {

    /** Returns the DOT description of view. */
    public String toDot(GraphView view) {
        StringBuilder dot = new StringBuilder("digraph G {\n");
        for (GraphView.Vertex vertex : view.getVertices()) {
            dot.append("  ")
                    .append(quote(vertex.getId()))
                    .append(" [label=")
                    .append(quote(vertex.getLabel()))
                    .append(", shape=")
                    .append(vertex.getShape() == GraphView.Vertex.Shape.VALUE ? "rect" : "circle")
                    .append("];\n");
        }
        for (GraphView.Edge edge : view.getEdges()) {
            dot.append("  ").append(quote(edge.getFromId())).append(" -> ").append(quote(edge.getToId())).append(";\n");
        }
        return dot.append("}\n").toString();
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public void render(GraphView view, RenderFormat format, Path output) {
        if (format != RenderFormat.DOT) {
            throw new IllegalArgumentException("DotRenderer only supports the DOT format, not " + format);
        }
        try {
            Files.writeString(output, toDot(view), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RenderException("Unable to write graph to " + output, e);
        }
    }
}

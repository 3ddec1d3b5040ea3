/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.nio.file.Path;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.github.graydavid.conga.core.Builder;
import io.github.graydavid.conga.core.CompiledGraph;
import io.github.graydavid.conga.core.ConstraintReport;

/**
 * Plots the graph of a {@link Builder}. Plotting first checks the graph's constraints: only a graph that evaluates and
 * satisfies every constraint is plotted; any other graph yields an empty view and no file.
 *
 * Textual formats are written by a {@link DotRenderer}, images by a {@link GraphvizRenderer}.
 */
public class GraphPlotter {
    private static final Logger LOG = LogManager.getLogger(GraphPlotter.class);

    private final GraphRenderer textRenderer;
    private final GraphRenderer imageRenderer;

    public GraphPlotter() {
        this(new DotRenderer(), new GraphvizRenderer());
    }

    public GraphPlotter(GraphRenderer textRenderer, GraphRenderer imageRenderer) {
        this.textRenderer = Objects.requireNonNull(textRenderer);
        this.imageRenderer = Objects.requireNonNull(imageRenderer);
    }

    /** Returns the view of builder's graph, without writing any file. */
    public GraphView plot(Builder builder) {
        CompiledGraph graph = builder.compile();
        ConstraintReport report = builder.checkConstraints();
        if (!report.isSatisfied()) {
            LOG.warn("Not plotting a graph with unsatisfied constraints: {}", report.getDiagnostics());
            return GraphView.empty();
        }
        return GraphView.of(graph);
    }

    /**
     * Same as {@link #plot(Builder)}, but also writes the view to output in the format its extension selects.
     *
     * @throws UnsupportedRenderFormatException if output's extension doesn't name a supported format. Checked before
     *         anything is evaluated.
     * @throws RenderException if writing fails.
     */
    public GraphView plot(Builder builder, Path output) {
        RenderFormat format = RenderFormat.fromPath(output);
        GraphView view = plot(builder);
        if (view.isEmpty()) {
            return view;
        }

        GraphRenderer renderer = format.isTextual() ? textRenderer : imageRenderer;
        renderer.render(view, format, output);
        LOG.info("Plotted graph to {}", output);
        return view;
    }
}

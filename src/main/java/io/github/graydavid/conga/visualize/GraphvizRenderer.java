/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a {@link GraphView} to an image by piping its DOT description through the Graphviz "dot" executable, which
 * must be installed separately.
 */
public class GraphvizRenderer implements GraphRenderer {
    private static final Logger LOG = LogManager.getLogger(GraphvizRenderer.class);

    private final String executable;
    private final DotRenderer dotRenderer;

    /** Creates a renderer that runs "dot" from the PATH. */
    public GraphvizRenderer() {
        this("dot");
    }

    /** @param executable the path to (or name of) the Graphviz "dot" executable. */
    public GraphvizRenderer(String executable) {
        this(executable, new DotRenderer());
    }

    GraphvizRenderer(String executable, DotRenderer dotRenderer) {
        this.executable = Objects.requireNonNull(executable);
        this.dotRenderer = Objects.requireNonNull(dotRenderer);
    }

    /** The command used to render to format at output. */
    List<String> command(RenderFormat format, Path output) {
        return List.of(executable, "-T" + format.getGraphvizType(), "-o", output.toString());
    }

    @Override
    public void render(GraphView view, RenderFormat format, Path output) {
        List<String> command = command(format, output);
        LOG.debug("Rendering graph with command {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
        } catch (IOException e) {
            throw new RenderException("Unable to start Graphviz with command " + command, e);
        }

        try {
            try (OutputStream input = process.getOutputStream()) {
                input.write(dotRenderer.toDot(view).getBytes(StandardCharsets.UTF_8));
            }
            String errors;
            try (InputStream errorStream = process.getErrorStream()) {
                errors = new String(errorStream.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                String message = String.format("Graphviz exited with code %d while rendering %s: %s", exitCode, output,
                        errors.strip());
                throw new RenderException(message);
            }
        } catch (IOException e) {
            process.destroy();
            throw new RenderException("Unable to render graph to " + output, e);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while rendering graph to " + output, e);
        }
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.nio.file.Path;

/** Writes a {@link GraphView} to a file in some {@link RenderFormat}. */
@FunctionalInterface
public interface GraphRenderer {
    /**
     * Renders view into output.
     *
     * @throws IllegalArgumentException if this renderer doesn't support format.
     * @throws RenderException if rendering fails.
     */
    void render(GraphView view, RenderFormat format, Path output);
}

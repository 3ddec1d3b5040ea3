/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** The file formats a graph can be rendered to. The format is chosen by the output file's extension. */
public enum RenderFormat {
    PNG("png", List.of(".png")),
    JPEG("jpeg", List.of(".jpg", ".jpeg")),
    SVG("svg", List.of(".svg")),
    PDF("pdf", List.of(".pdf")),
    /** Graphviz's textual graph description language. */
    DOT("dot", List.of(".dot"));

    private final String graphvizType;
    private final List<String> extensions;

    private RenderFormat(String graphvizType, List<String> extensions) {
        this.graphvizType = graphvizType;
        this.extensions = extensions;
    }

    /** The name Graphviz uses for this format, as in "dot -T&lt;type&gt;". */
    public String getGraphvizType() {
        return graphvizType;
    }

    /** Whether this format is plain text that can be written without Graphviz. */
    public boolean isTextual() {
        return this == DOT;
    }

    /**
     * Returns the format selected by output's extension. Extensions are compared case-insensitively.
     *
     * @throws UnsupportedRenderFormatException if the extension is missing or unknown. There is no fallback format.
     */
    public static RenderFormat fromPath(Path output) {
        String extension = extensionOf(output);
        String lowered = extension.toLowerCase(Locale.ROOT);
        for (RenderFormat format : values()) {
            if (format.extensions.contains(lowered)) {
                return format;
            }
        }
        throw new UnsupportedRenderFormatException(extension);
    }

    private static String extensionOf(Path output) {
        Path fileName = Objects.requireNonNull(output).getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        // A leading dot marks a hidden file, not an extension
        return dot <= 0 ? "" : name.substring(dot);
    }
}

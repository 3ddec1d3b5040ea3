/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

/** Thrown when asked to render to a file whose extension doesn't name a supported format. */
public class UnsupportedRenderFormatException extends IllegalArgumentException {
    private static final long serialVersionUID = 1;

    private final String extension;

    public UnsupportedRenderFormatException(String extension) {
        super("Unknown file format for saving graph: " + extension);
        this.extension = extension;
    }

    /** The unsupported extension, including its leading dot, or "" if there was none. */
    public String getExtension() {
        return extension;
    }
}

/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.visualize;

/** Thrown when a graph couldn't be written out, e.g. because of an I/O failure or a failing Graphviz process. */
public class RenderException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}

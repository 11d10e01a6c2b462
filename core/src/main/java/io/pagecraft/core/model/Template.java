package io.pagecraft.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed template. Has no delimiters of its own; its children are the top-level nodes of
 * the document. Immutable and safe to render concurrently with separate environments.
 *
 * @param name     name used in logs and diagnostics (file name, or {@value #DEFAULT_NAME})
 * @param children top-level nodes in document order
 */
public record Template(String name, List<Node> children) {

    public static final String DEFAULT_NAME = "<template>";

    public Template {
        Objects.requireNonNull(name, "name must not be null");
        children = List.copyOf(children);
    }
}

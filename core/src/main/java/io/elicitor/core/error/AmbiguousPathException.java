package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Thrown when two questions of one schema share a path, or when two distinct paths spell the same
 * dotted name (a literal {@code a.b} key next to a nested {@code a} / {@code b}). Dotted lookups
 * could not tell them apart, so the shape is rejected instead of picking one.
 */
public final class AmbiguousPathException extends DerivationException {

    private static final long serialVersionUID = 1L;

    private final transient ResponsePath other;

    public AmbiguousPathException(String message, Class<?> shapeType, ResponsePath path, ResponsePath other) {
        super(message, shapeType, path);
        this.other = other;
    }

    /** The second path that collides with {@link #path()}. */
    public ResponsePath other() {
        return other;
    }
}

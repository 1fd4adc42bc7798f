package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Thrown when a shape declaration is malformed: a nested shape without a prompt, a multi-select
 * over a non-enum element, an unsupported field type, misplaced attributes, and so on.
 */
public final class ShapeDefinitionException extends DerivationException {

    private static final long serialVersionUID = 1L;

    public ShapeDefinitionException(String message, Class<?> shapeType, ResponsePath path) {
        super(message, shapeType, path);
    }

    public ShapeDefinitionException(String message, Throwable cause, Class<?> shapeType, ResponsePath path) {
        super(message, cause, shapeType, path);
    }
}

package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Abstract parent for authoring errors found while describing a shape or deriving its schema.
 * These are fatal: a shape that raises one never produces a schema. Carries the shape type that
 * declared the offending element.
 */
public abstract class DerivationException extends SurveyException {

    private static final long serialVersionUID = 1L;

    private final transient Class<?> shapeType;

    protected DerivationException(String message, Class<?> shapeType, ResponsePath path) {
        super(message, path, Phase.DERIVATION);
        this.shapeType = shapeType;
    }

    protected DerivationException(String message, Throwable cause, Class<?> shapeType, ResponsePath path) {
        super(message, cause, path, Phase.DERIVATION);
        this.shapeType = shapeType;
    }

    /** The shape type whose declaration is malformed, or {@code null} if unknown. */
    public Class<?> shapeType() {
        return shapeType;
    }
}

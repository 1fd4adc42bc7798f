package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Thrown when every answer was read but the target record's constructor rejected the values
 * (for example a compact constructor that checks an invariant).
 */
public final class ShapeInstantiationException extends ReconstructionException {

    private static final long serialVersionUID = 1L;

    public ShapeInstantiationException(String message, Throwable cause, ResponsePath path) {
        super(message, cause, path);
    }

    @Override
    public ShapeInstantiationException reroot(ResponsePath prefix) {
        return new ShapeInstantiationException(getMessage(), getCause(), path().reroot(prefix));
    }
}

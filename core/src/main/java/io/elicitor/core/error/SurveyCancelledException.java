package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Thrown when the user aborts collection. Any partially collected responses are discarded; the
 * engine is never handed a partial store.
 */
public final class SurveyCancelledException extends PresentationException {

    private static final long serialVersionUID = 1L;

    public SurveyCancelledException(String message, ResponsePath path) {
        super(message, path);
    }
}

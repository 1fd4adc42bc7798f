package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Abstract base for all elicitor exceptions. Never thrown directly; use the concrete subclasses
 * under {@link DerivationException}, {@link ReconstructionException}, {@link
 * PresentationException} or {@link ResponsesFormatException}.
 */
public abstract class SurveyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DERIVATION,
        RECONSTRUCTION,
        PRESENTATION,
        CODEC
    }

    private final transient ResponsePath path;
    private final Phase phase;

    protected SurveyException(String message, ResponsePath path, Phase phase) {
        super(message);
        this.path = path;
        this.phase = phase;
    }

    protected SurveyException(String message, Throwable cause, ResponsePath path, Phase phase) {
        super(message, cause);
        this.path = path;
        this.phase = phase;
    }

    /** The offending location, or {@code null} if the error is not tied to one path. */
    public ResponsePath path() {
        return path;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

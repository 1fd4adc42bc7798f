package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Thrown by or on behalf of a presenter: I/O failures, a required question left unanswered, or
 * answers that still fail validation when presentation ends. The engine treats the cause as
 * opaque and simply propagates it.
 */
public class PresentationException extends SurveyException {

    private static final long serialVersionUID = 1L;

    public PresentationException(String message, ResponsePath path) {
        super(message, path, Phase.PRESENTATION);
    }

    public PresentationException(String message, Throwable cause, ResponsePath path) {
        super(message, cause, path, Phase.PRESENTATION);
    }
}

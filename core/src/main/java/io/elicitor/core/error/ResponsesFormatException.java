package io.elicitor.core.error;

/** Thrown when a serialized responses document is malformed or fails its JSON Schema. */
public final class ResponsesFormatException extends SurveyException {

    private static final long serialVersionUID = 1L;

    public ResponsesFormatException(String message) {
        super(message, null, Phase.CODEC);
    }

    public ResponsesFormatException(String message, Throwable cause) {
        super(message, cause, null, Phase.CODEC);
    }
}

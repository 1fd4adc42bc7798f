package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/**
 * Abstract parent for errors raised while rebuilding a typed value from {@code Responses}. A
 * store produced by validating every required question cannot trigger these, so their presence
 * points at the presenter that produced the store rather than at user input.
 */
public abstract class ReconstructionException extends SurveyException {

    private static final long serialVersionUID = 1L;

    protected ReconstructionException(String message, ResponsePath path) {
        super(message, path, Phase.RECONSTRUCTION);
    }

    protected ReconstructionException(String message, Throwable cause, ResponsePath path) {
        super(message, cause, path, Phase.RECONSTRUCTION);
    }

    /**
     * Returns a copy of this exception whose path is re-rooted under {@code prefix}. Used when a
     * nested reconstruction fails on a prefix-filtered store.
     */
    public abstract ReconstructionException reroot(ResponsePath prefix);
}

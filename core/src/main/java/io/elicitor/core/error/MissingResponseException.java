package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/** Thrown when a required path has no value in the store. */
public final class MissingResponseException extends ReconstructionException {

    private static final long serialVersionUID = 1L;

    public MissingResponseException(ResponsePath path) {
        super("Missing response for path '" + path + "'", path);
    }

    @Override
    public MissingResponseException reroot(ResponsePath prefix) {
        return new MissingResponseException(path().reroot(prefix));
    }
}

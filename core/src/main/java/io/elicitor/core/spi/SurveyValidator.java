package io.elicitor.core.spi;

import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import java.util.Map;
import java.util.Optional;

/**
 * Validation entry points handed to a {@link Presenter}. Validation failures are messages, never
 * exceptions: at most one message per path.
 */
public interface SurveyValidator {

    /**
     * Validates one candidate answer before it is stored.
     *
     * @param path absolute path of the answer (for a {@code OneOf}, its {@code selected_alternative}
     *     path)
     * @param value the candidate value
     * @param responses answers collected so far
     * @return the rejection message, or empty if the value is accepted
     */
    Optional<String> validateField(ResponsePath path, ResponseValue value, Responses responses);

    /**
     * Validates a complete store: field-level checks for every answered path, then, only if all of
     * them pass, composite checks.
     *
     * @return messages keyed by path; empty if the store is valid
     */
    Map<ResponsePath, String> validateAll(Responses responses);
}

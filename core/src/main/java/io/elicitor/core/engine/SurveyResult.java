package io.elicitor.core.engine;

import io.elicitor.core.model.Responses;
import java.util.Objects;

/**
 * Outcome of {@link SurveyBuilder#collect}: the reconstructed value and the validated store it was
 * built from.
 *
 * @param <T> the shape type
 */
public record SurveyResult<T>(T value, Responses responses) {

    public SurveyResult {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(responses, "responses must not be null");
    }
}

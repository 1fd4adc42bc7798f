package io.elicitor.core.engine;

import io.elicitor.core.model.Responses;
import io.elicitor.core.model.SurveyDefinition;
import java.util.Objects;

/**
 * A survey ready to be handed to a presenter.
 *
 * @param definition the schema with suggested and assumed defaults applied
 * @param prefilled the assumed values, keyed by value path
 */
public record PreparedSurvey(SurveyDefinition definition, Responses prefilled) {

    public PreparedSurvey {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(prefilled, "prefilled must not be null");
    }
}

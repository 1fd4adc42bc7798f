package io.elicitor.core.spi;

import io.elicitor.core.model.Responses;
import io.elicitor.core.model.SurveyDefinition;

/**
 * Presentation collaborator SPI. Turns a {@link SurveyDefinition} into a completed {@link
 * Responses} store by whatever means the implementation chooses: sequential prompting, a
 * simultaneous form, or a scripted harness.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>Questions whose default is {@code Assumed} must not be presented. Their values are already
 * in {@code prefilled} and must be kept in the returned store.
 * <li>Questions whose default is {@code Suggested} are presented with the suggestion pre-filled.
 * <li>Only the selected variant group of a {@code OneOf} is presented.
 * <li>Each collected answer should be checked with {@link SurveyValidator#validateField} and
 * re-asked while it is rejected; {@link SurveyValidator#validateAll} should be run once every
 * field is answered.
 * </ul>
 *
 * <p>
 * Cancellation is reported by throwing {@link io.elicitor.core.error.SurveyCancelledException};
 * other collaborator failures by throwing {@link io.elicitor.core.error.PresentationException}.
 * In either case the partial store is discarded and nothing is reconstructed.
 */
public interface Presenter {

    /**
     * Collects answers for {@code definition}.
     *
     * @param definition the schema to present, with defaults already applied
     * @param prefilled assumed values; never re-queried
     * @param validator field and composite validation bound to the shape being collected
     * @return the completed store, including {@code prefilled}
     */
    Responses present(SurveyDefinition definition, Responses prefilled, SurveyValidator validator);
}

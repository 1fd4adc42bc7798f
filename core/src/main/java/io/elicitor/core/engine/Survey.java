package io.elicitor.core.engine;

import io.elicitor.core.error.ReconstructionException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import io.elicitor.core.model.SurveyDefinition;
import io.elicitor.core.shape.ShapeDescriptor;
import io.elicitor.core.shape.ShapeRegistry;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for one shape type: its derived schema, reconstruction, validation and a builder for
 * pre-filled surveys.
 *
 * <pre>{@code
 * Survey<Signup> survey = Survey.of(Signup.class);
 * SurveyDefinition schema = survey.definition();
 * Signup signup = survey.builder().assume("country", "NZ").run(presenter);
 * }</pre>
 *
 * <p>
 * Instances are immutable and thread-safe.
 *
 * @param <T> the shape type
 */
public final class Survey<T> {

    private final Class<T> type;
    private final ShapeDescriptor shape;
    private final SurveyDefinition definition;
    private final ValidationDispatcher validator;
    private final Reconstructor reconstructor = new Reconstructor();
    private final SuggestionExtractor extractor = new SuggestionExtractor();

    private Survey(Class<T> type, ShapeDescriptor shape) {
        this.type = type;
        this.shape = shape;
        this.definition = new SchemaDeriver().derive(shape);
        this.validator = new ValidationDispatcher(shape);
    }

    /**
     * Creates the survey of {@code type}, introspecting it through the shared {@link ShapeRegistry}.
     *
     * @throws io.elicitor.core.error.DerivationException if the type is not a well-formed shape
     */
    public static <T> Survey<T> of(Class<T> type) {
        return of(type, ShapeRegistry.shared());
    }

    public static <T> Survey<T> of(Class<T> type, ShapeRegistry registry) {
        return new Survey<>(type, registry.describe(type));
    }

    public Class<T> type() {
        return type;
    }

    public ShapeDescriptor shape() {
        return shape;
    }

    /** The derived schema, without any defaults. */
    public SurveyDefinition definition() {
        return definition;
    }

    /** Validation bound to this shape, as handed to presenters. */
    public ValidationDispatcher validator() {
        return validator;
    }

    /**
     * Builds a value from a completed store. The store is not modified.
     *
     * @throws ReconstructionException naming the first failing path
     */
    public T reconstruct(Responses responses) {
        return type.cast(reconstructor.reconstruct(shape, responses));
    }

    /** @see ValidationDispatcher#validateField */
    public Optional<String> validateField(ResponsePath path, ResponseValue value, Responses responses) {
        return validator.validateField(path, value, responses);
    }

    /** @see ValidationDispatcher#validateAll */
    public Map<ResponsePath, String> validateAll(Responses responses) {
        return validator.validateAll(responses);
    }

    /** Reads an existing value into the store that reconstructs it. */
    public Responses toResponses(T value) {
        return extractor.extract(shape, value);
    }

    public SurveyBuilder<T> builder() {
        return new SurveyBuilder<>(this);
    }

    SuggestionExtractor extractor() {
        return extractor;
    }

    @Override
    public String toString() {
        return "Survey[" + type.getName() + "]";
    }
}

package io.elicitor.core.engine;

import io.elicitor.core.error.PresentationException;
import io.elicitor.core.error.SurveyCancelledException;
import io.elicitor.core.model.DefaultValue;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.QuestionKind;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import io.elicitor.core.model.SurveyDefinition;
import io.elicitor.core.shape.EnumShape;
import io.elicitor.core.shape.FieldDescriptor;
import io.elicitor.core.shape.FieldType;
import io.elicitor.core.shape.ShapeDescriptor;
import io.elicitor.core.shape.StructShape;
import io.elicitor.core.shape.VariantDescriptor;
import io.elicitor.core.spi.Presenter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates suggested and assumed answers before a survey is presented.
 *
 * <p>
 * Paths are dotted strings resolved against the derived question tree, so {@code "address.city"}
 * names the {@code city} question of the nested {@code address} record. Values are plain Java
 * values and are converted to the answer type of the question: enum constants and variant records
 * become a selection, records become answers for all their fields, lists of variants become a
 * multi-select. Later calls for the same answer replace earlier ones.
 *
 * <p>
 * Not thread-safe; create one builder per survey run.
 *
 * @param <T> the shape type
 */
public final class SurveyBuilder<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SurveyBuilder.class);

    private final Survey<T> survey;
    private final Map<ResponsePath, DefaultValue> defaults = new LinkedHashMap<>();

    SurveyBuilder(Survey<T> survey) {
        this.survey = Objects.requireNonNull(survey, "survey must not be null");
    }

    /**
     * Pre-fills the question at {@code dottedPath}; the question is still presented.
     *
     * @throws IllegalArgumentException if no question has that path or the value does not fit it
     */
    public SurveyBuilder<T> suggest(String dottedPath, Object value) {
        entries(dottedPath, value).asMap().forEach((path, v) -> defaults.put(path, DefaultValue.suggested(v)));
        return this;
    }

    /**
     * Answers the question at {@code dottedPath} in advance; the question is never presented.
     *
     * @throws IllegalArgumentException if no question has that path or the value does not fit it
     */
    public SurveyBuilder<T> assume(String dottedPath, Object value) {
        entries(dottedPath, value).asMap().forEach((path, v) -> defaults.put(path, DefaultValue.assumed(v)));
        return this;
    }

    /** Suggests every answer of an existing value, so each question starts from its current state. */
    public SurveyBuilder<T> withExisting(T value) {
        Objects.requireNonNull(value, "value must not be null");
        survey.toResponses(value).asMap().forEach((path, v) -> defaults.put(path, DefaultValue.suggested(v)));
        return this;
    }

    /** Applies the accumulated defaults to the schema and collects the assumed values. */
    public PreparedSurvey prepare() {
        SurveyDefinition definition = survey.definition();
        Map<ResponsePath, ResponsePath> questionByValuePath = new HashMap<>();
        for (Question question : definition.allQuestions()) {
            ResponsePath valuePath = question.valuePath();
            if (valuePath != null) {
                questionByValuePath.put(valuePath, question.path());
            }
        }
        Map<ResponsePath, DefaultValue> byQuestion = new LinkedHashMap<>();
        Responses.Builder prefilled = Responses.builder();
        defaults.forEach((valuePath, defaultValue) -> {
            ResponsePath questionPath = questionByValuePath.get(valuePath);
            if (questionPath == null) {
                throw new IllegalArgumentException("No question stores a value at '" + valuePath + "'");
            }
            byQuestion.put(questionPath, defaultValue);
            if (defaultValue.isAssumed()) {
                prefilled.put(valuePath, defaultValue.value());
            }
        });
        return new PreparedSurvey(definition.withDefaults(byQuestion), prefilled.build());
    }

    /**
     * Prepares the survey, hands it to {@code presenter}, validates the collected store and
     * reconstructs the value.
     *
     * @throws SurveyCancelledException if the presenter reports a cancellation
     * @throws PresentationException if the presenter fails or returns a store that does not validate
     * @throws io.elicitor.core.error.ReconstructionException if the validated store still cannot be
     *     reconstructed
     */
    public T run(Presenter presenter) {
        return collect(presenter).value();
    }

    /**
     * Like {@link #run}, but also returns the store the value was reconstructed from: the
     * presenter's answers merged with the assumed ones, in collection order.
     */
    public SurveyResult<T> collect(Presenter presenter) {
        PreparedSurvey prepared = prepare();
        String typeName = survey.type().getName();
        LOG.info(
                "survey.started type={} questions={} assumed={}",
                typeName,
                prepared.definition().allQuestions().size(),
                prepared.prefilled().size());
        Responses collected;
        try {
            collected = presenter.present(prepared.definition(), prepared.prefilled(), survey.validator());
        } catch (SurveyCancelledException e) {
            LOG.info("survey.cancelled type={} path={}", typeName, e.path());
            throw e;
        }
        if (collected == null) {
            throw new PresentationException("Presenter returned no responses for " + typeName, null);
        }
        // Assumed answers are never re-queried, so the prefilled values win.
        Responses responses = collected.merge(prepared.prefilled());
        Map<ResponsePath, String> messages = survey.validateAll(responses);
        if (!messages.isEmpty()) {
            Map.Entry<ResponsePath, String> first = messages.entrySet().iterator().next();
            LOG.warn("survey.invalid type={} messages={}", typeName, messages);
            throw new PresentationException(
                    "Collected responses do not validate at '" + first.getKey() + "': " + first.getValue(),
                    first.getKey());
        }
        T value = survey.reconstruct(responses);
        LOG.info("survey.completed type={} answers={}", typeName, responses.size());
        return new SurveyResult<>(value, responses);
    }

    // ── Path resolution ──

    /** Converts {@code value} into the entries it stands for under the question at {@code dottedPath}. */
    private Responses entries(String dottedPath, Object value) {
        Objects.requireNonNull(dottedPath, "path must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Question question = resolve(dottedPath);
        QuestionKind kind = question.kind();
        if (value instanceof ResponseValue responseValue) {
            if (kind.valueTag() == null || responseValue.tag() != kind.valueTag()) {
                throw new IllegalArgumentException("Question '" + dottedPath + "' does not take a "
                        + responseValue.tag() + " value");
            }
            checkOptions(dottedPath, kind, responseValue);
            return Responses.builder().put(question.valuePath(), responseValue).build();
        }
        Object target = locate(question.path());
        SuggestionExtractor extractor = survey.extractor();
        if (target instanceof FieldDescriptor field) {
            FieldType type = field.type();
            if (type instanceof FieldType.Scalar scalar) {
                Object present = field.optional() ? unwrap(dottedPath, value) : value;
                return single(question, SuggestionExtractor.scalar(scalar.scalar(), present));
            }
            if (type instanceof FieldType.ListOf list) {
                return single(question, SuggestionExtractor.list(list.element(), asList(dottedPath, value)));
            }
            if (type instanceof FieldType.MultiSelect multi) {
                return extractor.extractSelection(multi.shape(), asList(dottedPath, value)).reroot(question.path());
            }
            target = ((FieldType.Nested) type).shape();
        }
        if (target instanceof EnumShape enumShape && value instanceof Integer index) {
            if (index < 0 || index >= enumShape.variants().size()) {
                throw new IllegalArgumentException("Question '" + dottedPath + "' has no option " + index);
            }
            return single(question, ResponseValue.chosen(index));
        }
        if (target instanceof ShapeDescriptor shape) {
            return extractor.extract(shape, value).reroot(question.path());
        }
        throw new IllegalArgumentException("Question '" + dottedPath + "' carries no value");
    }

    /** Rejects selections naming options the question does not offer. */
    private static void checkOptions(String dottedPath, QuestionKind kind, ResponseValue value) {
        int count;
        List<Integer> indices;
        if (kind instanceof QuestionKind.OneOf oneOf && value instanceof ResponseValue.ChosenVariant chosen) {
            count = oneOf.variants().size();
            indices = List.of(chosen.index());
        } else if (kind instanceof QuestionKind.AnyOf anyOf && value instanceof ResponseValue.ChosenVariants many) {
            count = anyOf.variants().size();
            indices = many.indices();
        } else {
            return;
        }
        for (int index : indices) {
            if (index >= count) {
                throw new IllegalArgumentException(
                        "Question '" + dottedPath + "' has no option " + index + " (" + count + " options)");
            }
        }
    }

    private static Object unwrap(String dottedPath, Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.orElseThrow(() -> new IllegalArgumentException(
                    "Question '" + dottedPath + "' is optional; leave it unset instead of passing Optional.empty()"));
        }
        return value;
    }

    private static Responses single(Question question, ResponseValue value) {
        return Responses.builder().put(question.valuePath(), value).build();
    }

    private static List<?> asList(String dottedPath, Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Question '" + dottedPath + "' takes a List, got " + SuggestionExtractor.describe(value));
    }

    /** Finds the question whose path, or whose value path, spells {@code dottedPath}. */
    private Question resolve(String dottedPath) {
        for (Question question : survey.definition().allQuestions()) {
            if (question.path().asDottedString().equals(dottedPath)) {
                return question;
            }
            ResponsePath valuePath = question.valuePath();
            if (valuePath != null && valuePath.asDottedString().equals(dottedPath)) {
                return question;
            }
        }
        throw new IllegalArgumentException("No question at path '" + dottedPath + "' in " + survey.type().getName());
    }

    /**
     * Walks the shape along {@code path}: returns the {@link FieldDescriptor} a path ends on, or the
     * {@link ShapeDescriptor} of an enum root or variant payload, or {@code null} for a unit variant.
     */
    private Object locate(ResponsePath path) {
        ShapeDescriptor current = survey.shape();
        List<String> segments = path.segments();
        int i = 0;
        while (i < segments.size()) {
            if (current instanceof StructShape struct) {
                FieldDescriptor field = field(struct, segments.get(i));
                i++;
                if (i == segments.size()) {
                    return field;
                }
                if (field.type() instanceof FieldType.Nested nested) {
                    current = nested.shape();
                } else if (field.type() instanceof FieldType.MultiSelect multi) {
                    current = multi.shape();
                } else {
                    break;
                }
            } else {
                EnumShape enumShape = (EnumShape) current;
                if (i + 1 >= segments.size() || !ResponsePath.ALTERNATIVES.equals(segments.get(i))) {
                    break;
                }
                VariantDescriptor variant = enumShape.variants().get(Integer.parseInt(segments.get(i + 1)));
                i += 2;
                if (variant.isUnit()) {
                    return i == segments.size() ? null : fail(path);
                }
                current = variant.payload();
            }
        }
        if (i == segments.size()) {
            return current;
        }
        return fail(path);
    }

    private static FieldDescriptor field(StructShape struct, String segment) {
        for (FieldDescriptor field : struct.fields()) {
            if (field.segment().equals(segment)) {
                return field;
            }
        }
        throw new IllegalStateException("No field '" + segment + "' in " + struct.type().getName());
    }

    private static Object fail(ResponsePath path) {
        throw new IllegalStateException("Question path '" + path + "' does not match the shape");
    }
}

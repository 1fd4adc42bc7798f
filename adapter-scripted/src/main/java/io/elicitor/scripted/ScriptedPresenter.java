package io.elicitor.scripted;

import com.fasterxml.jackson.databind.JsonNode;
import io.elicitor.core.error.PresentationException;
import io.elicitor.core.error.SurveyCancelledException;
import io.elicitor.core.model.DefaultValue;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.QuestionKind;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import io.elicitor.core.model.SurveyDefinition;
import io.elicitor.core.spi.Presenter;
import io.elicitor.core.spi.SurveyValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-interactive {@link Presenter} that answers every question from an {@link AnswerScript}.
 *
 * <p>
 * Questions are walked in schema order. Assumed questions are skipped. For a choice only the
 * selected variant's questions are asked; for a multi-select, those of every selected variant.
 * Each scripted candidate is converted to the question's answer type and checked with
 * {@link SurveyValidator#validateField}; a candidate that fails either step counts as a rejected
 * attempt and the next one is tried, up to {@code maxAttempts}. A question the script leaves out
 * takes its suggested default when {@code acceptSuggestions} is on; an optional question with
 * neither, or scripted as {@code null}, is left unanswered.
 *
 * <p>
 * Stateless between runs and safe to reuse.
 */
public final class ScriptedPresenter implements Presenter {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptedPresenter.class);

    private final AnswerScript script;
    private final int maxAttempts;
    private final boolean acceptSuggestions;

    public ScriptedPresenter(AnswerScript script, int maxAttempts, boolean acceptSuggestions) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.script = script;
        this.maxAttempts = maxAttempts;
        this.acceptSuggestions = acceptSuggestions;
    }

    @Override
    public Responses present(SurveyDefinition definition, Responses prefilled, SurveyValidator validator) {
        Run run = new Run(validator, prefilled);
        if (definition.prelude() != null) {
            LOG.debug("presenter.prelude text={}", definition.prelude());
        }
        for (Question question : definition.questions()) {
            run.visit(question);
        }
        Responses collected = run.store.build();
        Map<ResponsePath, String> messages = validator.validateAll(collected);
        if (!messages.isEmpty()) {
            Map.Entry<ResponsePath, String> first = messages.entrySet().iterator().next();
            throw new PresentationException(
                    "Scripted answers fail validation at '" + first.getKey() + "': " + first.getValue(), first.getKey());
        }
        LOG.info("presenter.completed answers={} attempts={}", collected.size(), run.attempts);
        return collected;
    }

    /** State of one {@link #present} call. */
    private final class Run {

        private final SurveyValidator validator;
        private final Responses.Builder store = Responses.builder();
        private int attempts;

        Run(SurveyValidator validator, Responses prefilled) {
            this.validator = validator;
            store.putAll(prefilled);
        }

        void visit(Question question) {
            if (script.cancelsAt(question)) {
                throw new SurveyCancelledException("Scripted cancellation at '" + question.path() + "'", question.path());
            }
            QuestionKind kind = question.kind();
            if (kind instanceof QuestionKind.Unit) {
                return;
            }
            if (kind instanceof QuestionKind.AllOf allOf) {
                allOf.questions().forEach(this::visit);
                return;
            }
            ResponseValue answer = question.defaultValue().isAssumed()
                    ? question.defaultValue().value()
                    : ask(question);
            if (kind instanceof QuestionKind.OneOf oneOf) {
                if (!(answer instanceof ResponseValue.ChosenVariant chosen)) {
                    throw notAChoice(question, answer);
                }
                visit(variant(question, oneOf.variants(), chosen.index()));
            } else if (kind instanceof QuestionKind.AnyOf anyOf) {
                if (!(answer instanceof ResponseValue.ChosenVariants chosen)) {
                    throw notAChoice(question, answer);
                }
                for (int index : chosen.indices()) {
                    visit(variant(question, anyOf.variants(), index));
                }
            }
        }

        private Question variant(Question question, List<Question> variants, int index) {
            if (index >= variants.size()) {
                throw new PresentationException(
                        "Answer for '" + question.path() + "' selects option " + index + " of " + variants.size(),
                        question.valuePath());
            }
            return variants.get(index);
        }

        private PresentationException notAChoice(Question question, ResponseValue answer) {
            return new PresentationException(
                    "Answer for '" + question.path() + "' is not a selection: " + answer, question.valuePath());
        }

        private ResponseValue ask(Question question) {
            ResponsePath valuePath = question.valuePath();
            List<Candidate> candidates = candidatesFor(question);
            if (candidates.isEmpty()) {
                LOG.debug("presenter.skipped path={}", valuePath);
                return null;
            }
            String lastMessage = null;
            int tried = 0;
            for (Candidate candidate : candidates) {
                if (tried == maxAttempts) {
                    break;
                }
                tried++;
                attempts++;
                Optional<String> message = candidate.value != null
                        ? validator.validateField(valuePath, candidate.value, store.build())
                        : Optional.of(candidate.error);
                if (message.isEmpty()) {
                    store.put(valuePath, candidate.value);
                    LOG.debug("presenter.answered path={} attempt={}", valuePath, tried);
                    return candidate.value;
                }
                lastMessage = message.get();
                LOG.info("presenter.retry path={} attempt={} reason={}", valuePath, tried, lastMessage);
            }
            throw new PresentationException(
                    "No valid answer for '" + question.path() + "' after " + tried + " attempt(s): " + lastMessage,
                    question.path());
        }

        private List<Candidate> candidatesFor(Question question) {
            List<JsonNode> scripted = script.candidates(question);
            if (question.optional() && scripted.size() == 1 && scripted.get(0).isNull()) {
                return List.of();
            }
            List<Candidate> candidates = new ArrayList<>(scripted.size());
            for (JsonNode node : scripted) {
                try {
                    candidates.add(new Candidate(AnswerConverter.convert(question, node), null));
                } catch (IllegalArgumentException e) {
                    candidates.add(new Candidate(null, e.getMessage()));
                }
            }
            DefaultValue defaultValue = question.defaultValue();
            if (candidates.isEmpty() && acceptSuggestions && defaultValue instanceof DefaultValue.Suggested) {
                candidates.add(new Candidate(defaultValue.value(), null));
            }
            if (candidates.isEmpty() && !question.optional()) {
                throw new PresentationException("No scripted answer for '" + question.path() + "'", question.path());
            }
            return candidates;
        }
    }

    /** A converted candidate, or the reason it could not be converted. */
    private record Candidate(ResponseValue value, String error) {}
}

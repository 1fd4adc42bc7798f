package io.elicitor.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One node of a {@link SurveyDefinition}: a path, the prompt shown to the user, what is asked
 * ({@link QuestionKind}) and the default-value policy.
 *
 * <p>
 * An {@code optional} question may be left unanswered; its field then reconstructs to
 * {@link java.util.Optional#empty()}. Only leaf questions of scalar kinds are optional.
 *
 * <p>
 * Thread-safe and immutable. Rewrites ({@link #withDefault}, {@link #map}) return new trees.
 */
public record Question(
        ResponsePath path, String prompt, QuestionKind kind, DefaultValue defaultValue, boolean optional) {

    public Question {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        defaultValue = defaultValue != null ? defaultValue : DefaultValue.NONE;
    }

    public Question(ResponsePath path, String prompt, QuestionKind kind, DefaultValue defaultValue) {
        this(path, prompt, kind, defaultValue, false);
    }

    public Question(ResponsePath path, String prompt, QuestionKind kind) {
        this(path, prompt, kind, DefaultValue.NONE, false);
    }

    /**
     * Where this question's answer is stored: its own path, except for {@link QuestionKind.OneOf}
     * whose selection lives at {@code path.selected_alternative}.
     *
     * @return the value path, or {@code null} for kinds that store nothing
     */
    public ResponsePath valuePath() {
        if (kind instanceof QuestionKind.OneOf) {
            return path.selectedAlternative();
        }
        return kind.valueTag() != null ? path : null;
    }

    /** Direct child questions of a group kind; empty for leaf kinds. */
    public List<Question> children() {
        if (kind instanceof QuestionKind.AllOf allOf) {
            return allOf.questions();
        }
        if (kind instanceof QuestionKind.OneOf oneOf) {
            return oneOf.variants();
        }
        if (kind instanceof QuestionKind.AnyOf anyOf) {
            return anyOf.variants();
        }
        return List.of();
    }

    public Question withDefault(DefaultValue newDefault) {
        return new Question(path, prompt, kind, newDefault, optional);
    }

    /** Returns this question re-rooted under {@code prefix}, descendants included. */
    public Question reroot(ResponsePath prefix) {
        if (prefix.isRoot()) {
            return this;
        }
        return map(q -> new Question(q.path.reroot(prefix), q.prompt, q.kind, q.defaultValue, q.optional));
    }

    /**
     * Applies {@code fn} bottom-up to every question of this subtree: children are rewritten first
     * and the rebuilt parent is then passed to {@code fn}.
     */
    public Question map(UnaryOperator<Question> fn) {
        QuestionKind rebuilt = kind;
        if (kind instanceof QuestionKind.AllOf allOf) {
            rebuilt = new QuestionKind.AllOf(mapAll(allOf.questions(), fn));
        } else if (kind instanceof QuestionKind.OneOf oneOf) {
            rebuilt = new QuestionKind.OneOf(mapAll(oneOf.variants(), fn));
        } else if (kind instanceof QuestionKind.AnyOf anyOf) {
            rebuilt = new QuestionKind.AnyOf(mapAll(anyOf.variants(), fn));
        }
        return fn.apply(rebuilt == kind ? this : new Question(path, prompt, rebuilt, defaultValue, optional));
    }

    private static List<Question> mapAll(List<Question> questions, UnaryOperator<Question> fn) {
        List<Question> out = new ArrayList<>(questions.size());
        for (Question question : questions) {
            out.add(question.map(fn));
        }
        return out;
    }
}

package io.elicitor.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The derived schema of a shape: ordered top-level questions plus optional prelude and epilogue
 * text. This is all a presenter or a document generator needs to render the survey.
 *
 * <p>
 * No two questions anywhere in the tree share a path. Thread-safe and immutable.
 */
public final class SurveyDefinition {

    private final String prelude;
    private final String epilogue;
    private final List<Question> questions;

    public SurveyDefinition(String prelude, String epilogue, List<Question> questions) {
        this.prelude = prelude;
        this.epilogue = epilogue;
        this.questions = List.copyOf(Objects.requireNonNull(questions, "questions must not be null"));
    }

    /** Text shown before the first question, or {@code null}. */
    public String prelude() {
        return prelude;
    }

    /** Text shown after the last question, or {@code null}. */
    public String epilogue() {
        return epilogue;
    }

    public List<Question> questions() {
        return questions;
    }

    /** Every question of the tree, depth-first, parents before children. */
    public List<Question> allQuestions() {
        List<Question> out = new ArrayList<>();
        for (Question question : questions) {
            collect(question, out);
        }
        return Collections.unmodifiableList(out);
    }

    private static void collect(Question question, List<Question> out) {
        out.add(question);
        for (Question child : question.children()) {
            collect(child, out);
        }
    }

    /** Looks up a question by its exact path. */
    public Optional<Question> find(ResponsePath path) {
        for (Question question : allQuestions()) {
            if (question.path().equals(path)) {
                return Optional.of(question);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of this definition in which the question at {@code path} carries {@code
     * defaultValue}.
     *
     * @throws IllegalArgumentException if no question has that path
     */
    public SurveyDefinition withDefault(ResponsePath path, DefaultValue defaultValue) {
        return withDefaults(Map.of(path, defaultValue));
    }

    /**
     * Returns a copy of this definition with several defaults applied in one pass, keyed by
     * question path.
     *
     * @throws IllegalArgumentException if a key is not the path of any question
     */
    public SurveyDefinition withDefaults(Map<ResponsePath, DefaultValue> defaults) {
        Set<ResponsePath> known = new HashSet<>();
        for (Question question : allQuestions()) {
            known.add(question.path());
        }
        for (ResponsePath path : defaults.keySet()) {
            if (!known.contains(path)) {
                throw new IllegalArgumentException("No question at path '" + path + "'");
            }
        }
        if (defaults.isEmpty()) {
            return this;
        }
        List<Question> rewritten = new ArrayList<>(questions.size());
        for (Question question : questions) {
            rewritten.add(question.map(q -> {
                DefaultValue replacement = defaults.get(q.path());
                return replacement != null ? q.withDefault(replacement) : q;
            }));
        }
        return new SurveyDefinition(prelude, epilogue, rewritten);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurveyDefinition that)) return false;
        return Objects.equals(prelude, that.prelude)
                && Objects.equals(epilogue, that.epilogue)
                && questions.equals(that.questions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prelude, epilogue, questions);
    }

    @Override
    public String toString() {
        return "SurveyDefinition[questions=" + questions.size() + "]";
    }
}

package io.elicitor.scripted;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.scripted.config.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-recorded answers for a {@link ScriptedPresenter}, keyed by dotted question path.
 *
 * <pre>{@code
 * answers:
 *   name: Alice
 *   age:
 *     attempts: [17, 30]      # 17 is rejected by @Min(18), 30 is accepted
 *   tags: [a, b]              # a list question takes a list
 *   payment: Card             # a choice takes a variant label or index
 *   payment.alternatives.1.number: "4111"
 *   features: [Gps, Camera]   # a multi-select takes a list of labels or indices
 * cancel-at: notes            # optional: cancel when this question is reached
 * }</pre>
 *
 * <p>
 * A plain value is a single attempt; an object with an {@code attempts} list holds several
 * candidates tried in order. A choice question may be keyed by its own path or by its {@code
 * selected_alternative} path. Immutable.
 */
public final class AnswerScript {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, List<JsonNode>> answers;
    private final String cancelAt;

    private AnswerScript(Map<String, List<JsonNode>> answers, String cancelAt) {
        this.answers = answers;
        this.cancelAt = cancelAt;
    }

    /**
     * Reads a script from a YAML file.
     *
     * @throws ConfigLoadException if the file is missing or malformed
     */
    public static AnswerScript load(Path file) {
        if (!Files.exists(file)) {
            throw new ConfigLoadException("Answer script not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return fromTree(YAML_MAPPER.readTree(in), file.toString());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse answer script: " + file, e);
        }
    }

    /**
     * Reads a script from YAML text.
     *
     * @throws ConfigLoadException if the text is malformed
     */
    public static AnswerScript parse(String yaml) {
        try {
            return fromTree(YAML_MAPPER.readTree(yaml), "<inline>");
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse answer script", e);
        }
    }

    private static AnswerScript fromTree(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new AnswerScript(Map.of(), null);
        }
        JsonNode answersNode = root.path("answers");
        if (!answersNode.isMissingNode() && !answersNode.isObject()) {
            throw new ConfigLoadException("'answers' in " + source + " must be a mapping of path to answer");
        }
        Map<String, List<JsonNode>> answers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = answersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            answers.put(entry.getKey(), candidates(entry.getKey(), entry.getValue(), source));
        }
        String cancelAt = root.hasNonNull("cancel-at") ? root.get("cancel-at").asText() : null;
        return new AnswerScript(Collections.unmodifiableMap(answers), cancelAt);
    }

    private static List<JsonNode> candidates(String path, JsonNode value, String source) {
        if (value.isObject() && value.has("attempts")) {
            JsonNode attempts = value.get("attempts");
            if (!attempts.isArray() || attempts.isEmpty()) {
                throw new ConfigLoadException(
                        "'attempts' of '" + path + "' in " + source + " must be a non-empty list");
            }
            List<JsonNode> list = new ArrayList<>(attempts.size());
            attempts.forEach(list::add);
            return List.copyOf(list);
        }
        return List.of(value);
    }

    /** Candidate answers for {@code question}, in order; empty if the script does not answer it. */
    public List<JsonNode> candidates(Question question) {
        List<JsonNode> byPath = answers.get(question.path().asDottedString());
        if (byPath != null) {
            return byPath;
        }
        ResponsePath valuePath = question.valuePath();
        if (valuePath != null) {
            List<JsonNode> byValuePath = answers.get(valuePath.asDottedString());
            if (byValuePath != null) {
                return byValuePath;
            }
        }
        return List.of();
    }

    /** True if the run should be cancelled when {@code question} is reached. */
    public boolean cancelsAt(Question question) {
        return cancelAt != null && cancelAt.equals(question.path().asDottedString());
    }

    /** Number of scripted paths. */
    public int size() {
        return answers.size();
    }
}

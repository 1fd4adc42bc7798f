package io.elicitor.scripted;

import com.fasterxml.jackson.databind.JsonNode;
import io.elicitor.core.model.Question;
import io.elicitor.core.model.QuestionKind;
import io.elicitor.core.model.ResponseValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Converts a scripted YAML answer to the {@link ResponseValue} a question expects. */
final class AnswerConverter {

    private AnswerConverter() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if {@code node} cannot answer {@code question}
     */
    static ResponseValue convert(Question question, JsonNode node) {
        QuestionKind kind = question.kind();
        if (kind instanceof QuestionKind.Input
                || kind instanceof QuestionKind.Multiline
                || kind instanceof QuestionKind.Masked) {
            return ResponseValue.of(text(node));
        }
        if (kind instanceof QuestionKind.Int) {
            return ResponseValue.of(integer(node));
        }
        if (kind instanceof QuestionKind.Float) {
            return ResponseValue.of(decimal(node));
        }
        if (kind instanceof QuestionKind.Confirm) {
            return ResponseValue.of(bool(node));
        }
        if (kind instanceof QuestionKind.ListOf list) {
            return list(list.elementType(), array(node));
        }
        if (kind instanceof QuestionKind.OneOf oneOf) {
            return ResponseValue.chosen(variantIndex(oneOf.variants(), node));
        }
        if (kind instanceof QuestionKind.AnyOf anyOf) {
            List<Integer> indices = new ArrayList<>();
            for (JsonNode item : array(node)) {
                indices.add(variantIndex(anyOf.variants(), item));
            }
            return new ResponseValue.ChosenVariants(indices);
        }
        throw new IllegalArgumentException("Question '" + question.path() + "' does not take an answer");
    }

    private static String text(JsonNode node) {
        if (node.isContainerNode() || node.isNull()) {
            throw new IllegalArgumentException("Expected text, got " + node);
        }
        return node.asText();
    }

    private static long integer(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected an integer, got '" + node.asText() + "'", e);
            }
        }
        throw new IllegalArgumentException("Expected an integer, got " + node);
    }

    private static double decimal(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a number, got '" + node.asText() + "'", e);
            }
        }
        throw new IllegalArgumentException("Expected a number, got " + node);
    }

    private static boolean bool(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            Boolean parsed = switch (node.asText().trim().toLowerCase(Locale.ROOT)) {
                case "y", "yes", "true" -> Boolean.TRUE;
                case "n", "no", "false" -> Boolean.FALSE;
                default -> null;
            };
            if (parsed != null) {
                return parsed;
            }
        }
        throw new IllegalArgumentException("Expected yes or no, got " + node);
    }

    private static JsonNode array(JsonNode node) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected a list, got " + node);
        }
        return node;
    }

    private static ResponseValue list(QuestionKind.ElementType elementType, JsonNode items) {
        return switch (elementType) {
            case INT -> {
                List<Long> values = new ArrayList<>(items.size());
                items.forEach(item -> values.add(integer(item)));
                yield new ResponseValue.IntList(values);
            }
            case FLOAT -> {
                List<Double> values = new ArrayList<>(items.size());
                items.forEach(item -> values.add(decimal(item)));
                yield new ResponseValue.FloatList(values);
            }
            case STRING -> {
                List<String> values = new ArrayList<>(items.size());
                items.forEach(item -> values.add(text(item)));
                yield new ResponseValue.StringList(values);
            }
        };
    }

    /** Resolves a variant by index or by label; exact label match first, then ignoring case. */
    private static int variantIndex(List<Question> variants, JsonNode node) {
        if (node.isIntegralNumber()) {
            int index = node.intValue();
            if (index < 0 || index >= variants.size()) {
                throw new IllegalArgumentException("No option " + index + " (" + variants.size() + " options)");
            }
            return index;
        }
        String label = text(node).trim();
        for (int i = 0; i < variants.size(); i++) {
            if (variants.get(i).prompt().equals(label)) {
                return i;
            }
        }
        for (int i = 0; i < variants.size(); i++) {
            if (variants.get(i).prompt().equalsIgnoreCase(label)) {
                return i;
            }
        }
        throw new IllegalArgumentException("No option labelled '" + label + "'");
    }
}

package io.elicitor.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.elicitor.core.error.ResponsesFormatException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.ResponseValue.ValueTag;
import io.elicitor.core.model.Responses;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of a {@link Responses} store.
 *
 * <pre>{@code
 * {
 *   "format": "elicitor-responses",
 *   "version": 1,
 *   "entries": [
 *     {"path": ["address", "city"], "type": "string", "value": "Reno"},
 *     {"path": ["payment", "selected_alternative"], "type": "chosen_variant", "value": 1}
 *   ]
 * }
 * }</pre>
 *
 * <p>
 * Paths are written as segment arrays, so segments containing dots survive a round trip. Entry
 * order and value tags are preserved exactly. Non-finite floats are written as the strings {@code
 * "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
 *
 * <p>
 * Input is validated against the bundled JSON Schema before decoding. Thread-safe.
 */
public final class ResponsesCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ResponsesCodec.class);

    public static final String FORMAT = "elicitor-responses";
    public static final int VERSION = 1;

    private static final String SCHEMA_RESOURCE = "responses.schema.json";
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final ObjectMapper mapper;
    private final JsonSchema schema;

    public ResponsesCodec() {
        this(new ObjectMapper());
    }

    public ResponsesCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.schema = loadSchema(mapper);
    }

    // ── Encoding ──

    /** Encodes {@code responses} as a JSON document tree. */
    public ObjectNode toJson(Responses responses) {
        ObjectNode root = mapper.createObjectNode();
        root.put("format", FORMAT);
        root.put("version", VERSION);
        ArrayNode entries = root.putArray("entries");
        responses.asMap().forEach((path, value) -> {
            ObjectNode entry = entries.addObject();
            ArrayNode segments = entry.putArray("path");
            path.segments().forEach(segments::add);
            entry.put("type", typeName(value.tag()));
            writeValue(entry, value);
        });
        return root;
    }

    /** Encodes {@code responses} as pretty-printed JSON text. */
    public String encode(Responses responses) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(responses));
        } catch (JsonProcessingException e) {
            throw new ResponsesFormatException("Cannot write responses: " + e.getOriginalMessage(), e);
        }
    }

    private static void writeValue(ObjectNode entry, ResponseValue value) {
        if (value instanceof ResponseValue.StringValue v) {
            entry.put("value", v.value());
        } else if (value instanceof ResponseValue.IntValue v) {
            entry.put("value", v.value());
        } else if (value instanceof ResponseValue.FloatValue v) {
            putFloat(entry, v.value());
        } else if (value instanceof ResponseValue.BoolValue v) {
            entry.put("value", v.value());
        } else if (value instanceof ResponseValue.ChosenVariant v) {
            entry.put("value", v.index());
        } else if (value instanceof ResponseValue.ChosenVariants v) {
            ArrayNode array = entry.putArray("value");
            v.indices().forEach(array::add);
        } else if (value instanceof ResponseValue.StringList v) {
            ArrayNode array = entry.putArray("value");
            v.values().forEach(array::add);
        } else if (value instanceof ResponseValue.IntList v) {
            ArrayNode array = entry.putArray("value");
            v.values().forEach(array::add);
        } else if (value instanceof ResponseValue.FloatList v) {
            ArrayNode array = entry.putArray("value");
            for (double d : v.values()) {
                if (Double.isFinite(d)) {
                    array.add(d);
                } else {
                    array.add(Double.toString(d));
                }
            }
        }
    }

    private static void putFloat(ObjectNode entry, double value) {
        if (Double.isFinite(value)) {
            entry.put("value", value);
        } else {
            entry.put("value", Double.toString(value));
        }
    }

    // ── Decoding ──

    /**
     * Decodes a JSON document.
     *
     * @throws ResponsesFormatException if the text is not JSON, violates the schema or repeats a path
     */
    public Responses decode(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ResponsesFormatException("Responses document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(node);
    }

    /** Decodes a JSON document from a stream. The stream is not closed. */
    public Responses decode(InputStream in) {
        JsonNode node;
        try {
            node = mapper.readTree(in);
        } catch (IOException e) {
            throw new ResponsesFormatException("Cannot read responses document: " + e.getMessage(), e);
        }
        return fromJson(node);
    }

    /** Decodes a JSON document tree. */
    public Responses fromJson(JsonNode document) {
        if (document == null || document.isMissingNode()) {
            throw new ResponsesFormatException("Responses document is empty");
        }
        Set<ValidationMessage> errors = schema.validate(document);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ResponsesFormatException("Responses document violates the schema: " + detail);
        }
        Responses.Builder builder = Responses.builder();
        for (JsonNode entry : document.get("entries")) {
            ResponsePath path = readPath(entry.get("path"));
            if (builder.contains(path)) {
                throw new ResponsesFormatException("Duplicate entry for path " + path.segments());
            }
            builder.put(path, readValue(path, entry.get("type").asText(), entry.get("value")));
        }
        Responses responses = builder.build();
        LOG.debug("responses.decoded entries={}", responses.size());
        return responses;
    }

    private static ResponsePath readPath(JsonNode node) {
        List<String> segments = new ArrayList<>(node.size());
        node.forEach(segment -> segments.add(segment.asText()));
        return ResponsePath.of(segments);
    }

    private static ResponseValue readValue(ResponsePath path, String type, JsonNode value) {
        return switch (tagOf(type)) {
            case STRING -> ResponseValue.of(value.asText());
            case INT -> ResponseValue.of(readLong(path, value));
            case FLOAT -> ResponseValue.of(readDouble(value));
            case BOOL -> ResponseValue.of(value.booleanValue());
            case CHOSEN_VARIANT -> ResponseValue.chosen(readIndex(path, value));
            case CHOSEN_VARIANTS -> {
                List<Integer> indices = new ArrayList<>(value.size());
                value.forEach(index -> indices.add(readIndex(path, index)));
                yield new ResponseValue.ChosenVariants(indices);
            }
            case STRING_LIST -> {
                List<String> strings = new ArrayList<>(value.size());
                value.forEach(item -> strings.add(item.asText()));
                yield new ResponseValue.StringList(strings);
            }
            case INT_LIST -> {
                List<Long> longs = new ArrayList<>(value.size());
                value.forEach(item -> longs.add(readLong(path, item)));
                yield new ResponseValue.IntList(longs);
            }
            case FLOAT_LIST -> {
                List<Double> doubles = new ArrayList<>(value.size());
                value.forEach(item -> doubles.add(readDouble(item)));
                yield new ResponseValue.FloatList(doubles);
            }
        };
    }

    private static long readLong(ResponsePath path, JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new ResponsesFormatException("Value at " + path.segments() + " is not a 64-bit integer: " + node);
        }
        return node.longValue();
    }

    private static int readIndex(ResponsePath path, JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 0) {
            throw new ResponsesFormatException("Variant index at " + path.segments() + " is invalid: " + node);
        }
        return node.intValue();
    }

    private static double readDouble(JsonNode node) {
        return node.isTextual() ? Double.parseDouble(node.asText()) : node.doubleValue();
    }

    static String typeName(ValueTag tag) {
        return tag.name().toLowerCase(Locale.ROOT);
    }

    static ValueTag tagOf(String typeName) {
        try {
            return ValueTag.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponsesFormatException("Unknown value type '" + typeName + "'", e);
        }
    }

    private static JsonSchema loadSchema(ObjectMapper mapper) {
        try (InputStream in = ResponsesCodec.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(mapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load bundled resource " + SCHEMA_RESOURCE, e);
        }
    }
}

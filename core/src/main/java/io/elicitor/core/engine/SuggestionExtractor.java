package io.elicitor.core.engine;

import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import io.elicitor.core.shape.EnumShape;
import io.elicitor.core.shape.FieldDescriptor;
import io.elicitor.core.shape.FieldType;
import io.elicitor.core.shape.ScalarType;
import io.elicitor.core.shape.ShapeDescriptor;
import io.elicitor.core.shape.StructShape;
import io.elicitor.core.shape.VariantDescriptor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The inverse of {@link Reconstructor}: reads an existing shape value into the store that would
 * reconstruct it. Used to pre-fill a survey with an instance's current values.
 *
 * <p>
 * Components that are {@code null} are skipped, leaving their questions without a suggestion.
 * Elements of a multi-select list that fall on the same variant keep the first occurrence's
 * payload, since the store holds one payload per variant.
 */
public final class SuggestionExtractor {

    /**
     * Extracts every answer of {@code value}.
     *
     * @throws IllegalArgumentException if {@code value} is not an instance of {@code shape}
     */
    public Responses extract(ShapeDescriptor shape, Object value) {
        Responses.Builder out = Responses.builder();
        shape(shape, value, ResponsePath.root(), out);
        return out.build();
    }

    /**
     * Extracts a multi-select selection. The {@code ChosenVariants} entry is stored at the root path
     * and payloads at {@code alternatives.N}, ready to be re-rooted under the field's path.
     */
    Responses extractSelection(EnumShape shape, List<?> elements) {
        Responses.Builder out = Responses.builder();
        multiSelect(shape, elements, ResponsePath.root(), out);
        return out.build();
    }

    private void shape(ShapeDescriptor shape, Object value, ResponsePath prefix, Responses.Builder out) {
        if (shape instanceof StructShape struct) {
            struct(struct, value, prefix, out);
        } else {
            enumValue((EnumShape) shape, value, prefix, out);
        }
    }

    private void struct(StructShape shape, Object value, ResponsePath prefix, Responses.Builder out) {
        if (!shape.type().isInstance(value)) {
            throw new IllegalArgumentException(
                    "Expected " + shape.type().getName() + " at '" + prefix + "', got " + describe(value));
        }
        for (FieldDescriptor field : shape.fields()) {
            Object component = field.read(value);
            if (field.optional() && component instanceof Optional<?> optional) {
                component = optional.orElse(null);
            }
            if (component == null) {
                continue;
            }
            ResponsePath path = prefix.child(field.segment());
            FieldType type = field.type();
            if (type instanceof FieldType.Scalar scalar) {
                out.put(path, scalar(scalar.scalar(), component));
            } else if (type instanceof FieldType.ListOf list) {
                out.put(path, list(list.element(), (List<?>) component));
            } else if (type instanceof FieldType.MultiSelect multi) {
                multiSelect(multi.shape(), (List<?>) component, path, out);
            } else {
                shape(((FieldType.Nested) type).shape(), component, path, out);
            }
        }
    }

    private void enumValue(EnumShape shape, Object value, ResponsePath prefix, Responses.Builder out) {
        int index = indexOf(shape, value, prefix);
        out.put(prefix.selectedAlternative(), ResponseValue.chosen(index));
        payload(shape.variants().get(index), value, prefix.alternative(index), out);
    }

    private void multiSelect(EnumShape shape, List<?> elements, ResponsePath path, Responses.Builder out) {
        List<Integer> indices = new ArrayList<>(elements.size());
        for (Object element : elements) {
            int index = indexOf(shape, element, path);
            if (indices.contains(index)) {
                continue;
            }
            indices.add(index);
            payload(shape.variants().get(index), element, path.alternative(index), out);
        }
        out.put(path, new ResponseValue.ChosenVariants(indices));
    }

    private void payload(VariantDescriptor variant, Object value, ResponsePath payloadPath, Responses.Builder out) {
        if (!variant.isUnit()) {
            struct(variant.payload(), value, payloadPath, out);
        }
    }

    private static int indexOf(EnumShape shape, Object value, ResponsePath path) {
        int index = shape.indexOf(value);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "Expected a variant of " + shape.type().getName() + " at '" + path + "', got " + describe(value));
        }
        return index;
    }

    // ── Primitives ──

    static ResponseValue scalar(ScalarType type, Object value) {
        if (type == ScalarType.STRING && value instanceof String s) {
            return ResponseValue.of(s);
        }
        if (type == ScalarType.PATH && value instanceof Path p) {
            return ResponseValue.of(p.toString());
        }
        if (type == ScalarType.BOOL && value instanceof Boolean b) {
            return ResponseValue.of(b.booleanValue());
        }
        if (type.isIntegral() && isIntegral(value)) {
            return ResponseValue.of(((Number) value).longValue());
        }
        if (type.isFloating() && value instanceof Number n) {
            return ResponseValue.of(n.doubleValue());
        }
        throw new IllegalArgumentException("Cannot read " + describe(value) + " as " + type);
    }

    static ResponseValue list(ScalarType element, List<?> values) {
        if (element.isText()) {
            List<String> strings = new ArrayList<>(values.size());
            for (Object value : values) {
                strings.add(Objects.toString(Objects.requireNonNull(value, "list elements must not be null")));
            }
            return new ResponseValue.StringList(strings);
        }
        if (element.isIntegral()) {
            List<Long> longs = new ArrayList<>(values.size());
            for (Object value : values) {
                if (!isIntegral(value)) {
                    throw new IllegalArgumentException("Cannot read " + describe(value) + " as " + element);
                }
                longs.add(((Number) value).longValue());
            }
            return new ResponseValue.IntList(longs);
        }
        List<Double> doubles = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException("Cannot read " + describe(value) + " as " + element);
            }
            doubles.add(number.doubleValue());
        }
        return new ResponseValue.FloatList(doubles);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName() + " '" + value + "'";
    }
}

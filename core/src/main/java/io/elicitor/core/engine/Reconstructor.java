package io.elicitor.core.engine;

import io.elicitor.core.error.ReconstructionException;
import io.elicitor.core.error.ResponseTypeMismatchException;
import io.elicitor.core.error.ShapeInstantiationException;
import io.elicitor.core.error.UnknownVariantException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.ResponseValue.ValueTag;
import io.elicitor.core.model.Responses;
import io.elicitor.core.shape.EnumShape;
import io.elicitor.core.shape.FieldDescriptor;
import io.elicitor.core.shape.FieldType;
import io.elicitor.core.shape.ScalarType;
import io.elicitor.core.shape.ShapeDescriptor;
import io.elicitor.core.shape.StructShape;
import io.elicitor.core.shape.VariantDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a shape value from a {@link Responses} store.
 *
 * <p>
 * A read-only traversal: the store is never modified, and reconstructing twice from the same
 * store yields equal values. Nested shapes are reconstructed from a prefix-filtered sub-store, and
 * any failure inside them is re-rooted so that the reported path is relative to the store passed
 * in.
 *
 * <p>
 * Reconstruction does not run validators. A store produced by a presenter that validated every
 * answer cannot fail here; a failure signals a presenter bug.
 */
public final class Reconstructor {

    private static final Logger LOG = LoggerFactory.getLogger(Reconstructor.class);

    /**
     * Reconstructs a value of {@code shape}.
     *
     * @throws ReconstructionException naming the first failing path
     */
    public Object reconstruct(ShapeDescriptor shape, Responses responses) {
        Object value = shape(shape, responses);
        LOG.debug("reconstruct.completed type={} entries={}", shape.type().getName(), responses.size());
        return value;
    }

    private Object shape(ShapeDescriptor shape, Responses responses) {
        if (shape instanceof StructShape struct) {
            return struct(struct, responses);
        }
        return enumValue((EnumShape) shape, responses);
    }

    // ── Structs ──

    private Object struct(StructShape shape, Responses responses) {
        List<FieldDescriptor> fields = shape.fields();
        Object[] args = new Object[fields.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = field(fields.get(i), responses);
        }
        try {
            return shape.constructor().newInstance(args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            throw new ShapeInstantiationException(
                    "Cannot construct " + shape.type().getSimpleName() + ": " + cause.getMessage(),
                    cause,
                    ResponsePath.root());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new ShapeInstantiationException(
                    "Cannot construct " + shape.type().getSimpleName() + ": " + e.getMessage(),
                    e,
                    ResponsePath.root());
        }
    }

    private Object field(FieldDescriptor field, Responses responses) {
        ResponsePath path = ResponsePath.of(field.segment());
        FieldType type = field.type();
        if (type instanceof FieldType.Scalar scalar) {
            if (field.optional()) {
                return responses.contains(path)
                        ? Optional.of(scalar(scalar.scalar(), responses, path))
                        : Optional.empty();
            }
            return scalar(scalar.scalar(), responses, path);
        }
        if (type instanceof FieldType.ListOf list) {
            return list(list.element(), responses, path);
        }
        if (type instanceof FieldType.MultiSelect multi) {
            return multiSelect(multi.shape(), responses, path);
        }
        ShapeDescriptor nested = ((FieldType.Nested) type).shape();
        return nested(nested, responses.filterPrefix(path), path);
    }

    private Object nested(ShapeDescriptor shape, Responses sub, ResponsePath prefix) {
        try {
            return shape(shape, sub);
        } catch (ReconstructionException e) {
            throw e.reroot(prefix);
        }
    }

    // ── Primitives ──

    private static Object scalar(ScalarType type, Responses responses, ResponsePath path) {
        return switch (type) {
            case STRING -> responses.getString(path);
            case PATH -> toPath(responses.getString(path), path);
            case BOOL -> responses.getBool(path);
            case FLOAT -> toFloat(responses.getFloat(path), path, ValueTag.FLOAT);
            case DOUBLE -> responses.getFloat(path);
            default -> narrow(type, responses.getInt(path), path, ValueTag.INT);
        };
    }

    private static Object list(ScalarType element, Responses responses, ResponsePath path) {
        List<Object> out = new ArrayList<>();
        if (element.isText()) {
            for (String value : responses.getStringList(path)) {
                out.add(element == ScalarType.PATH ? toPath(value, path) : value);
            }
        } else if (element.isIntegral()) {
            for (Long value : responses.getIntList(path)) {
                out.add(narrow(element, value, path, ValueTag.INT_LIST));
            }
        } else {
            for (Double value : responses.getFloatList(path)) {
                out.add(element == ScalarType.FLOAT ? (Object) toFloat(value, path, ValueTag.FLOAT_LIST) : value);
            }
        }
        return List.copyOf(out);
    }

    /** Converts a 64-bit answer to the component's integral type, rejecting overflow. */
    private static Object narrow(ScalarType type, long value, ResponsePath path, ValueTag tag) {
        if (value < type.minValue() || value > type.maxValue()) {
            throw new ResponseTypeMismatchException(
                    path, tag, "value " + value + " does not fit " + type.name().toLowerCase(Locale.ROOT));
        }
        return switch (type) {
            case BYTE -> (byte) value;
            case SHORT -> (short) value;
            case INT -> (int) value;
            default -> value;
        };
    }

    /** Narrows to {@code float}; finite values beyond its range are a mismatch, not infinity. */
    private static float toFloat(double value, ResponsePath path, ValueTag tag) {
        if (Double.isFinite(value) && Math.abs(value) > Float.MAX_VALUE) {
            throw new ResponseTypeMismatchException(path, tag, "value " + value + " does not fit float");
        }
        return (float) value;
    }

    private static Path toPath(String value, ResponsePath path) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new ResponseTypeMismatchException(path, ValueTag.STRING, "'" + value + "' is not a valid path");
        }
    }

    // ── Enums ──

    /** Reads the selection at {@code selected_alternative} of the store's root. */
    private Object enumValue(EnumShape shape, Responses responses) {
        ResponsePath selectedPath = ResponsePath.root().selectedAlternative();
        int index = responses.getChosenVariant(selectedPath);
        if (index >= shape.variants().size()) {
            throw new UnknownVariantException(selectedPath, index, shape.variants().size());
        }
        VariantDescriptor variant = shape.variants().get(index);
        if (variant.constant() != null) {
            return variant.constant();
        }
        ResponsePath payloadPath = ResponsePath.root().alternative(index);
        return nested(variant.payload(), responses.filterPrefix(payloadPath), payloadPath);
    }

    /**
     * Builds one element per selected index, ascending. Each element is reconstructed by the
     * single-choice path from a synthesized store holding the index and that variant's payload
     * answers.
     */
    private Object multiSelect(EnumShape shape, Responses responses, ResponsePath path) {
        List<Integer> indices = responses.getChosenVariants(path);
        Responses field = responses.filterPrefix(path);
        List<Object> elements = new ArrayList<>(indices.size());
        for (int index : indices) {
            if (index >= shape.variants().size()) {
                throw new UnknownVariantException(path, index, shape.variants().size());
            }
            ResponsePath payloadPath = ResponsePath.root().alternative(index);
            Responses selection = Responses.builder()
                    .put(ResponsePath.root().selectedAlternative(), ResponseValue.chosen(index))
                    .putAll(field.filterPrefix(payloadPath).reroot(payloadPath))
                    .build();
            elements.add(nested(shape, selection, path));
        }
        return List.copyOf(elements);
    }
}

package io.elicitor.core.engine;

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
import io.elicitor.core.spi.CompositeValidator;
import io.elicitor.core.spi.FieldValidator;
import io.elicitor.core.spi.SurveyValidator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs field-level and composite validation for one shape.
 *
 * <p>
 * A path is dispatched segment by segment: the first segment selects a field of the current
 * record, and if the path goes deeper the field's prefix is stripped and the remainder is handed to
 * the nested shape together with the prefix-filtered store. Validators therefore always see paths
 * and stores relative to the record that declares them.
 *
 * <p>
 * For every field the checks run in this order, stopping at the first message: value tag, declared
 * bounds (and the range of the component's integral type), declared validators, propagated
 * validators. Composite validators run only once every answered field passes.
 *
 * <p>
 * Thread-safe if the declared validators are.
 */
public final class ValidationDispatcher implements SurveyValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationDispatcher.class);

    private final ShapeDescriptor shape;

    public ValidationDispatcher(ShapeDescriptor shape) {
        this.shape = shape;
    }

    /**
     * @throws IllegalArgumentException if {@code path} is not the value path of any question
     */
    @Override
    public Optional<String> validateField(ResponsePath path, ResponseValue value, Responses responses) {
        Optional<String> message = dispatch(shape, path, path, value, responses);
        message.ifPresent(m -> LOG.debug("validation.rejected path={} message={}", path, m));
        return message;
    }

    @Override
    public Map<ResponsePath, String> validateAll(Responses responses) {
        Map<ResponsePath, String> messages = new LinkedHashMap<>();
        collectFieldMessages(shape, responses, ResponsePath.root(), messages);
        if (messages.isEmpty()) {
            collectCompositeMessages(shape, responses, ResponsePath.root(), messages);
        }
        if (!messages.isEmpty()) {
            LOG.debug("validation.failed type={} messages={}", shape.type().getName(), messages.size());
        }
        return Collections.unmodifiableMap(messages);
    }

    // ── Field dispatch ──

    private Optional<String> dispatch(
            ShapeDescriptor current, ResponsePath full, ResponsePath path, ResponseValue value, Responses responses) {
        if (current instanceof EnumShape enumShape) {
            return dispatchEnum(enumShape, full, path, value, responses);
        }
        StructShape struct = (StructShape) current;
        FieldDescriptor field = fieldFor(struct, path.firstSegment(), full);
        ResponsePath fieldPath = ResponsePath.of(field.segment());
        if (path.depth() == 1) {
            return checkField(field, value, responses, fieldPath);
        }
        ResponsePath rest = path.stripPrefix(fieldPath);
        Responses sub = responses.filterPrefix(fieldPath);
        if (field.type() instanceof FieldType.Nested nested) {
            return dispatch(nested.shape(), full, rest, value, sub);
        }
        if (field.type() instanceof FieldType.MultiSelect multi
                && ResponsePath.ALTERNATIVES.equals(rest.firstSegment())) {
            return dispatch(multi.shape(), full, rest, value, sub);
        }
        throw unknownPath(full);
    }

    private Optional<String> dispatchEnum(
            EnumShape shape, ResponsePath full, ResponsePath path, ResponseValue value, Responses responses) {
        List<String> segments = path.segments();
        if (segments.size() == 1 && ResponsePath.SELECTED_ALTERNATIVE.equals(segments.get(0))) {
            if (value.tag() != ValueTag.CHOSEN_VARIANT) {
                return Optional.of(tagMessage(ValueTag.CHOSEN_VARIANT, value));
            }
            int index = ((ResponseValue.ChosenVariant) value).index();
            return index < shape.variants().size()
                    ? Optional.empty()
                    : Optional.of(optionMessage(index, shape.variants().size()));
        }
        if (segments.size() > 2 && ResponsePath.ALTERNATIVES.equals(segments.get(0))) {
            VariantDescriptor variant = variantAt(shape, segments.get(1), full);
            ResponsePath payloadPath = ResponsePath.of(segments.subList(0, 2));
            return dispatch(
                    variant.payload(),
                    full,
                    path.stripPrefix(payloadPath),
                    value,
                    responses.filterPrefix(payloadPath));
        }
        throw unknownPath(full);
    }

    private static FieldDescriptor fieldFor(StructShape struct, String segment, ResponsePath full) {
        for (FieldDescriptor field : struct.fields()) {
            if (field.segment().equals(segment)) {
                return field;
            }
        }
        throw unknownPath(full);
    }

    private static VariantDescriptor variantAt(EnumShape shape, String segment, ResponsePath full) {
        int index;
        try {
            index = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw unknownPath(full);
        }
        if (index < 0 || index >= shape.variants().size() || shape.variants().get(index).isUnit()) {
            throw unknownPath(full);
        }
        return shape.variants().get(index);
    }

    private static IllegalArgumentException unknownPath(ResponsePath path) {
        return new IllegalArgumentException("No question stores a value at '" + path + "'");
    }

    // ── Field checks ──

    private static Optional<String> checkField(
            FieldDescriptor field, ResponseValue value, Responses responses, ResponsePath path) {
        ValueTag expected = expectedTag(field.type());
        if (expected == null) {
            throw unknownPath(path);
        }
        if (value.tag() != expected) {
            return Optional.of(tagMessage(expected, value));
        }
        Optional<String> implicit = implicitCheck(field, value);
        if (implicit.isPresent()) {
            return implicit;
        }
        for (FieldValidator validator : field.validators()) {
            Optional<String> message = validator.validate(value, responses, path);
            if (message != null && message.isPresent()) {
                return message;
            }
        }
        return Optional.empty();
    }

    private static ValueTag expectedTag(FieldType type) {
        if (type instanceof FieldType.Scalar scalar) {
            ScalarType s = scalar.scalar();
            if (s == ScalarType.BOOL) {
                return ValueTag.BOOL;
            }
            if (s.isIntegral()) {
                return ValueTag.INT;
            }
            return s.isFloating() ? ValueTag.FLOAT : ValueTag.STRING;
        }
        if (type instanceof FieldType.ListOf list) {
            ScalarType element = list.element();
            if (element.isIntegral()) {
                return ValueTag.INT_LIST;
            }
            return element.isFloating() ? ValueTag.FLOAT_LIST : ValueTag.STRING_LIST;
        }
        if (type instanceof FieldType.MultiSelect) {
            return ValueTag.CHOSEN_VARIANTS;
        }
        return null;
    }

    /** Declared bounds, the range of the integral type and multi-select option indices. */
    private static Optional<String> implicitCheck(FieldDescriptor field, ResponseValue value) {
        if (value instanceof ResponseValue.IntValue intValue) {
            return integralBounds(field, ((FieldType.Scalar) field.type()).scalar(), intValue.value());
        }
        if (value instanceof ResponseValue.FloatValue floatValue) {
            return floatBounds(field, ((FieldType.Scalar) field.type()).scalar(), floatValue.value());
        }
        if (value instanceof ResponseValue.IntList list) {
            ScalarType element = ((FieldType.ListOf) field.type()).element();
            for (Long item : list.values()) {
                Optional<String> message = integralBounds(field, element, item);
                if (message.isPresent()) {
                    return message;
                }
            }
        }
        if (value instanceof ResponseValue.FloatList list) {
            ScalarType element = ((FieldType.ListOf) field.type()).element();
            for (Double item : list.values()) {
                Optional<String> message = floatBounds(field, element, item);
                if (message.isPresent()) {
                    return message;
                }
            }
        }
        if (value instanceof ResponseValue.ChosenVariants chosen) {
            int count = ((FieldType.MultiSelect) field.type()).shape().variants().size();
            for (int index : chosen.indices()) {
                if (index >= count) {
                    return Optional.of(optionMessage(index, count));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> integralBounds(FieldDescriptor field, ScalarType type, long value) {
        long min = field.min() != null ? field.min().longValue() : type.minValue();
        long max = field.max() != null ? field.max().longValue() : type.maxValue();
        if (value < min) {
            return Optional.of("Value must be at least " + min + ", got " + value);
        }
        if (value > max) {
            return Optional.of("Value must be at most " + max + ", got " + value);
        }
        return Optional.empty();
    }

    private static Optional<String> floatBounds(FieldDescriptor field, ScalarType type, double value) {
        if (Double.isNaN(value)) {
            return Optional.of("Value must be a number");
        }
        if (type == ScalarType.FLOAT && Double.isFinite(value) && Math.abs(value) > Float.MAX_VALUE) {
            return Optional.of("Value " + value + " does not fit float");
        }
        if (field.min() != null && value < field.min()) {
            return Optional.of("Value must be at least " + field.min() + ", got " + value);
        }
        if (field.max() != null && value > field.max()) {
            return Optional.of("Value must be at most " + field.max() + ", got " + value);
        }
        return Optional.empty();
    }

    private static String tagMessage(ValueTag expected, ResponseValue value) {
        return "Expected a " + expected + " answer, got " + value.tag();
    }

    private static String optionMessage(int index, int count) {
        return "Unknown option " + index + "; choose one of " + count + " options";
    }

    // ── Whole-store validation ──

    private static void collectFieldMessages(
            ShapeDescriptor current, Responses responses, ResponsePath prefix, Map<ResponsePath, String> out) {
        if (current instanceof EnumShape enumShape) {
            collectEnumFieldMessages(enumShape, responses, prefix, out);
            return;
        }
        for (FieldDescriptor field : ((StructShape) current).fields()) {
            ResponsePath fieldPath = ResponsePath.of(field.segment());
            FieldType type = field.type();
            if (type instanceof FieldType.Nested nested) {
                collectFieldMessages(
                        nested.shape(), responses.filterPrefix(fieldPath), prefix.concat(fieldPath), out);
                continue;
            }
            ResponseValue value = responses.get(fieldPath);
            if (value == null) {
                continue;
            }
            Optional<String> message = checkField(field, value, responses, fieldPath);
            if (message.isPresent()) {
                out.putIfAbsent(prefix.concat(fieldPath), message.get());
                continue;
            }
            if (type instanceof FieldType.MultiSelect multi) {
                Responses sub = responses.filterPrefix(fieldPath);
                for (int index : ((ResponseValue.ChosenVariants) value).indices()) {
                    collectPayloadMessages(multi.shape(), index, sub, prefix.concat(fieldPath), out, true);
                }
            }
        }
    }

    private static void collectEnumFieldMessages(
            EnumShape shape, Responses responses, ResponsePath prefix, Map<ResponsePath, String> out) {
        ResponsePath selectedPath = ResponsePath.root().selectedAlternative();
        ResponseValue selected = responses.get(selectedPath);
        if (selected == null) {
            return;
        }
        Optional<String> message = selected.tag() != ValueTag.CHOSEN_VARIANT
                ? Optional.of(tagMessage(ValueTag.CHOSEN_VARIANT, selected))
                : rangeMessage(shape, ((ResponseValue.ChosenVariant) selected).index());
        if (message.isPresent()) {
            out.putIfAbsent(prefix.concat(selectedPath), message.get());
            return;
        }
        collectPayloadMessages(
                shape, ((ResponseValue.ChosenVariant) selected).index(), responses, prefix, out, true);
    }

    private static Optional<String> rangeMessage(EnumShape shape, int index) {
        int count = shape.variants().size();
        return index < count ? Optional.empty() : Optional.of(optionMessage(index, count));
    }

    /** Field or composite messages of the payload of variant {@code index}, if it has one. */
    private static void collectPayloadMessages(
            EnumShape shape,
            int index,
            Responses enumRooted,
            ResponsePath prefix,
            Map<ResponsePath, String> out,
            boolean fieldLevel) {
        VariantDescriptor variant = shape.variants().get(index);
        if (variant.isUnit()) {
            return;
        }
        ResponsePath payloadPath = ResponsePath.root().alternative(index);
        Responses payload = enumRooted.filterPrefix(payloadPath);
        if (fieldLevel) {
            collectFieldMessages(variant.payload(), payload, prefix.concat(payloadPath), out);
        } else {
            collectCompositeMessages(variant.payload(), payload, prefix.concat(payloadPath), out);
        }
    }

    private static void collectCompositeMessages(
            ShapeDescriptor current, Responses responses, ResponsePath prefix, Map<ResponsePath, String> out) {
        if (current instanceof EnumShape enumShape) {
            ResponseValue selected = responses.get(ResponsePath.root().selectedAlternative());
            if (selected instanceof ResponseValue.ChosenVariant chosen
                    && chosen.index() < enumShape.variants().size()) {
                collectPayloadMessages(enumShape, chosen.index(), responses, prefix, out, false);
            }
            return;
        }
        StructShape struct = (StructShape) current;
        for (CompositeValidator composite : struct.composites()) {
            Map<ResponsePath, String> messages = composite.validate(responses);
            if (messages != null) {
                messages.forEach((path, message) -> out.putIfAbsent(prefix.concat(path), message));
            }
        }
        for (FieldDescriptor field : struct.fields()) {
            ResponsePath fieldPath = ResponsePath.of(field.segment());
            if (field.type() instanceof FieldType.Nested nested) {
                collectCompositeMessages(
                        nested.shape(), responses.filterPrefix(fieldPath), prefix.concat(fieldPath), out);
            } else if (field.type() instanceof FieldType.MultiSelect multi
                    && responses.get(fieldPath) instanceof ResponseValue.ChosenVariants chosen) {
                Responses sub = responses.filterPrefix(fieldPath);
                for (int index : chosen.indices()) {
                    if (index < multi.shape().variants().size()) {
                        collectPayloadMessages(multi.shape(), index, sub, prefix.concat(fieldPath), out, false);
                    }
                }
            }
        }
    }
}

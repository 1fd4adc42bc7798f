package io.elicitor.core.shape;

import io.elicitor.core.error.ShapeDefinitionException;
import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.spi.CompositeValidator;
import io.elicitor.core.spi.FieldValidator;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reflectively walks a shape type and builds its {@link ShapeDescriptor}.
 *
 * <p>
 * Supported shapes are records (structs), Java enums (unit-only enum shapes) and sealed interfaces
 * whose permitted subclasses are records (data-carrying enum shapes). Every authoring mistake is
 * reported as a {@link ShapeDefinitionException} before any schema exists.
 *
 * <p>
 * An introspector instance is not thread-safe: it tracks the types currently being walked to
 * reject recursive shapes. {@link ShapeRegistry} creates one per lookup.
 */
public final class ShapeIntrospector {

    private static final Logger LOG = LoggerFactory.getLogger(ShapeIntrospector.class);

    private final Deque<Class<?>> inProgress = new ArrayDeque<>();

    /**
     * Builds the descriptor of {@code type}.
     *
     * @throws ShapeDefinitionException if {@code type} is not a shape or is malformed
     */
    public ShapeDescriptor introspect(Class<?> type) {
        if (inProgress.contains(type)) {
            String cycle = inProgress.stream()
                    .map(Class::getSimpleName)
                    .collect(Collectors.joining(" -> "));
            throw new ShapeDefinitionException(
                    "Recursive shape: " + cycle + " -> " + type.getSimpleName(), type, null);
        }
        inProgress.push(type);
        try {
            ShapeDescriptor descriptor;
            if (type.isEnum()) {
                descriptor = enumConstants(type);
            } else if (type.isInterface() && type.isSealed()) {
                descriptor = sealedVariants(type);
            } else if (type.isRecord()) {
                descriptor = struct(type);
            } else {
                throw new ShapeDefinitionException(
                        "Not a shape: " + type.getName() + " (expected a record, an enum or a sealed interface)",
                        type,
                        null);
            }
            LOG.debug("shape.introspected type={} kind={}", type.getName(), descriptor.getClass().getSimpleName());
            return descriptor;
        } finally {
            inProgress.pop();
        }
    }

    // ── Enum shapes ──

    private EnumShape enumConstants(Class<?> type) {
        Object[] constants = type.getEnumConstants();
        if (constants.length == 0) {
            throw new ShapeDefinitionException("Enum shape " + type.getName() + " has no constants", type, null);
        }
        List<VariantDescriptor> variants = new ArrayList<>(constants.length);
        for (Object constant : constants) {
            Enum<?> value = (Enum<?>) constant;
            Ask ask = constantAnnotation(type, value);
            variants.add(VariantDescriptor.ofConstant(value, ask != null ? ask.value() : value.name()));
        }
        return new EnumShape(type, variants, prelude(type), epilogue(type));
    }

    private static Ask constantAnnotation(Class<?> type, Enum<?> constant) {
        try {
            return type.getField(constant.name()).getAnnotation(Ask.class);
        } catch (NoSuchFieldException e) {
            throw new ShapeDefinitionException(
                    "Cannot read enum constant " + constant.name() + " of " + type.getName(), e, type, null);
        }
    }

    private EnumShape sealedVariants(Class<?> type) {
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null || permitted.length == 0) {
            throw new ShapeDefinitionException("Sealed shape " + type.getName() + " permits no variants", type, null);
        }
        List<VariantDescriptor> variants = new ArrayList<>(permitted.length);
        for (Class<?> variant : permitted) {
            if (!variant.isRecord()) {
                throw new ShapeDefinitionException(
                        "Variant " + variant.getName() + " of " + type.getName() + " must be a record",
                        type,
                        null);
            }
            inProgress.push(variant);
            StructShape payload;
            try {
                payload = struct(variant);
            } finally {
                inProgress.pop();
            }
            Ask ask = variant.getAnnotation(Ask.class);
            variants.add(VariantDescriptor.ofRecord(payload, ask != null ? ask.value() : variant.getSimpleName()));
        }
        return new EnumShape(type, variants, prelude(type), epilogue(type));
    }

    // ── Structs ──

    private StructShape struct(Class<?> type) {
        RecordComponent[] components = type.getRecordComponents();
        boolean positional = type.isAnnotationPresent(Positional.class);
        ValidateFields propagated = type.getAnnotation(ValidateFields.class);
        FieldValidator propagatedValidator =
                propagated != null ? instantiate(propagated.value(), type, ResponsePath.root()) : null;

        List<FieldDescriptor> fields = new ArrayList<>(components.length);
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            RecordComponent component = components[i];
            parameterTypes[i] = component.getType();
            fields.add(field(type, component, i, positional, propagatedValidator));
        }

        List<CompositeValidator> composites = new ArrayList<>();
        ValidateComposite composite = type.getAnnotation(ValidateComposite.class);
        if (composite != null) {
            for (Class<? extends CompositeValidator> validatorType : composite.value()) {
                composites.add(instantiate(validatorType, type, ResponsePath.root()));
            }
        }
        return new StructShape(
                type, fields, prelude(type), epilogue(type), composites, canonicalConstructor(type, parameterTypes));
    }

    private FieldDescriptor field(
            Class<?> owner,
            RecordComponent component,
            int index,
            boolean positional,
            FieldValidator propagatedValidator) {
        String name = component.getName();
        Key key = component.getAnnotation(Key.class);
        if (positional && key != null) {
            throw definitionError(owner, name, "@Key cannot be combined with @Positional");
        }
        String segment = positional ? ResponsePath.positional(index) : key != null ? key.value() : name;
        if (segment.isEmpty()) {
            throw definitionError(owner, name, "@Key must not be empty");
        }
        ResponsePath path = ResponsePath.of(segment);

        FieldType fieldType = fieldType(owner, component, path);
        boolean optional = Optional.class.equals(component.getType());
        Ask ask = component.getAnnotation(Ask.class);
        if (ask == null && fieldType instanceof FieldType.Nested) {
            throw new ShapeDefinitionException(
                    "Component '" + name + "' of " + owner.getName() + " is a nested shape and needs @Ask",
                    owner,
                    path);
        }
        String prompt = ask != null ? ask.value() : name;

        boolean masked = component.isAnnotationPresent(Mask.class);
        boolean multiline = component.isAnnotationPresent(Multiline.class);
        if ((masked || multiline) && !isText(fieldType)) {
            throw new ShapeDefinitionException(
                    "@Mask and @Multiline apply to string components only, not '" + name + "' of " + owner.getName(),
                    owner,
                    path);
        }

        Double min = bound(component.getAnnotation(Min.class));
        Double max = bound(component.getAnnotation(Max.class));
        checkBounds(owner, name, path, fieldType, min, max);

        List<FieldValidator> validators = new ArrayList<>();
        Validate validate = component.getAnnotation(Validate.class);
        if (validate != null) {
            if (fieldType instanceof FieldType.Nested) {
                throw new ShapeDefinitionException(
                        "@Validate cannot be used on nested shape component '" + name + "' of " + owner.getName()
                                + "; declare validators inside the nested shape",
                        owner,
                        path);
            }
            for (Class<? extends FieldValidator> validatorType : validate.value()) {
                validators.add(instantiate(validatorType, owner, path));
            }
        }
        if (propagatedValidator != null
                && fieldType instanceof FieldType.Scalar scalar
                && scalar.scalar().isNumeric()) {
            validators.add(propagatedValidator);
        }

        Method accessor = component.getAccessor();
        accessor.setAccessible(true);
        return new FieldDescriptor(
                name, segment, prompt, fieldType, optional, validators, min, max, masked, multiline, accessor);
    }

    private FieldType fieldType(Class<?> owner, RecordComponent component, ResponsePath path) {
        Class<?> raw = component.getType();
        boolean multiSelect = component.isAnnotationPresent(MultiSelect.class);

        if (Optional.class.equals(raw)) {
            Class<?> element = typeArgument(owner, component, path);
            ScalarType scalar = ScalarType.forClass(element);
            if (multiSelect || scalar == null) {
                throw new ShapeDefinitionException(
                        "Optional component '" + component.getName() + "' of " + owner.getName()
                                + " must wrap a primitive, found " + element.getName(),
                        owner,
                        path);
            }
            return new FieldType.Scalar(scalar);
        }
        if (List.class.equals(raw)) {
            Class<?> element = typeArgument(owner, component, path);
            if (multiSelect) {
                if (!isEnumShape(element)) {
                    throw new ShapeDefinitionException(
                            "@MultiSelect on '" + component.getName() + "' of " + owner.getName()
                                    + " requires an enum element type, found " + element.getName(),
                            owner,
                            path);
                }
                return new FieldType.MultiSelect((EnumShape) introspect(element));
            }
            ScalarType scalar = ScalarType.forClass(element);
            if (scalar != null && scalar != ScalarType.BOOL) {
                return new FieldType.ListOf(scalar);
            }
            if (isEnumShape(element)) {
                throw new ShapeDefinitionException(
                        "List of enum shape '" + component.getName() + "' of " + owner.getName()
                                + " needs @MultiSelect",
                        owner,
                        path);
            }
            throw unsupported(owner, component, path);
        }

        if (multiSelect) {
            throw new ShapeDefinitionException(
                    "@MultiSelect requires a List component, not '" + component.getName() + "' of " + owner.getName(),
                    owner,
                    path);
        }
        ScalarType scalar = ScalarType.forClass(raw);
        if (scalar != null) {
            return new FieldType.Scalar(scalar);
        }
        if (raw.isRecord() || isEnumShape(raw)) {
            return new FieldType.Nested(introspect(raw));
        }
        throw unsupported(owner, component, path);
    }

    private static Class<?> typeArgument(Class<?> owner, RecordComponent component, ResponsePath path) {
        Type generic = component.getGenericType();
        if (generic instanceof ParameterizedType parameterized
                && parameterized.getActualTypeArguments()[0] instanceof Class<?> element) {
            return element;
        }
        throw new ShapeDefinitionException(
                "Component '" + component.getName() + "' of " + owner.getName()
                        + " needs a concrete type argument, found " + generic.getTypeName(),
                owner,
                path);
    }

    private static boolean isEnumShape(Class<?> type) {
        return type.isEnum() || (type.isInterface() && type.isSealed());
    }

    private static boolean isText(FieldType type) {
        return type instanceof FieldType.Scalar scalar && scalar.scalar().isText();
    }

    private static ShapeDefinitionException unsupported(Class<?> owner, RecordComponent component, ResponsePath path) {
        return new ShapeDefinitionException(
                "Unsupported type " + component.getGenericType().getTypeName() + " of component '"
                        + component.getName() + "' in " + owner.getName(),
                owner,
                path);
    }

    // ── Bounds ──

    private static Double bound(Min min) {
        return min != null ? min.value() : null;
    }

    private static Double bound(Max max) {
        return max != null ? max.value() : null;
    }

    private static void checkBounds(
            Class<?> owner, String name, ResponsePath path, FieldType fieldType, Double min, Double max) {
        if (min == null && max == null) {
            return;
        }
        ScalarType numeric = null;
        if (fieldType instanceof FieldType.Scalar scalar && scalar.scalar().isNumeric()) {
            numeric = scalar.scalar();
        } else if (fieldType instanceof FieldType.ListOf list && list.element().isNumeric()) {
            numeric = list.element();
        }
        if (numeric == null) {
            throw definitionError(owner, name, "@Min and @Max apply to numeric components only");
        }
        if (min != null && max != null && min > max) {
            throw new ShapeDefinitionException(
                    "Component '" + name + "' of " + owner.getName() + " has @Min " + min + " above @Max " + max,
                    owner,
                    path);
        }
        if (numeric.isIntegral()) {
            for (Double bound : new Double[] {min, max}) {
                if (bound != null && (bound != Math.rint(bound) || bound < numeric.minValue() || bound > numeric.maxValue())) {
                    throw new ShapeDefinitionException(
                            "Bound " + bound + " of integral component '" + name + "' in " + owner.getName()
                                    + " must be a whole number within the range of " + numeric,
                            owner,
                            path);
                }
            }
        }
    }

    // ── Reflection helpers ──

    private static Constructor<?> canonicalConstructor(Class<?> type, Class<?>[] parameterTypes) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new ShapeDefinitionException(
                    "Cannot access the canonical constructor of " + type.getName(), e, type, null);
        }
    }

    private static <V> V instantiate(Class<? extends V> validatorType, Class<?> owner, ResponsePath path) {
        try {
            Constructor<? extends V> constructor = validatorType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ShapeDefinitionException(
                    "Cannot instantiate validator " + validatorType.getName() + " declared on " + owner.getName()
                            + " (a no-arg constructor is required)",
                    e,
                    owner,
                    path);
        }
    }

    private static ShapeDefinitionException definitionError(Class<?> owner, String component, String reason) {
        return new ShapeDefinitionException(
                reason + " (component '" + component + "' of " + owner.getName() + ")", owner, ResponsePath.of(component));
    }

    private static String prelude(Class<?> type) {
        Prelude prelude = type.getAnnotation(Prelude.class);
        return prelude != null ? prelude.value() : null;
    }

    private static String epilogue(Class<?> type) {
        Epilogue epilogue = type.getAnnotation(Epilogue.class);
        return epilogue != null ? epilogue.value() : null;
    }
}

package io.elicitor.core.shape;

import io.elicitor.core.spi.FieldValidator;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/**
 * One record component of a {@link StructShape}.
 *
 * @param name component name
 * @param segment path segment ({@code name}, a {@code @Key} override or {@code field_N})
 * @param prompt question prompt
 * @param type declared type, unwrapped from {@code Optional}
 * @param optional the component is an {@code Optional} and may stay unanswered
 * @param validators declared validators followed by propagated ones
 * @param min inclusive lower bound, or {@code null}
 * @param max inclusive upper bound, or {@code null}
 * @param masked input is hidden
 * @param multiline input spans lines
 * @param accessor the component accessor
 */
public record FieldDescriptor(
        String name,
        String segment,
        String prompt,
        FieldType type,
        boolean optional,
        List<FieldValidator> validators,
        Double min,
        Double max,
        boolean masked,
        boolean multiline,
        Method accessor) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(segment, "segment must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(accessor, "accessor must not be null");
        validators = List.copyOf(validators);
    }

    /** Reads this component from a record instance. */
    public Object read(Object instance) {
        try {
            return accessor.invoke(instance);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read component '" + name + "'", e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Accessor of component '" + name + "' failed", e.getCause());
        }
    }
}

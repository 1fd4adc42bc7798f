package io.elicitor.core.shape;

import io.elicitor.core.spi.CompositeValidator;
import java.lang.reflect.Constructor;
import java.util.List;
import java.util.Objects;

/**
 * A record shape: ordered fields, composite validators and the canonical constructor used to
 * build instances.
 */
public record StructShape(
        Class<?> type,
        List<FieldDescriptor> fields,
        String prelude,
        String epilogue,
        List<CompositeValidator> composites,
        Constructor<?> constructor)
        implements ShapeDescriptor {

    public StructShape {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(constructor, "constructor must not be null");
        fields = List.copyOf(fields);
        composites = List.copyOf(composites);
    }
}

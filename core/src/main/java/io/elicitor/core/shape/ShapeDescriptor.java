package io.elicitor.core.shape;

/**
 * Introspected description of a shape type: a record ({@link StructShape}) or an enum shape
 * ({@link EnumShape}). Descriptors are immutable, built once per type by {@link ShapeIntrospector}
 * and cached by {@link ShapeRegistry}.
 */
public sealed interface ShapeDescriptor permits StructShape, EnumShape {

    /** The Java type this descriptor describes. */
    Class<?> type();

    /** Text shown before the first question, or {@code null}. */
    String prelude();

    /** Text shown after the last question, or {@code null}. */
    String epilogue();
}

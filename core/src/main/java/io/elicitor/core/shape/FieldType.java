package io.elicitor.core.shape;

import java.util.Objects;

/** The declared type of a record component, as far as a survey is concerned. */
public sealed interface FieldType {

    /** A single primitive. */
    record Scalar(ScalarType scalar) implements FieldType {
        public Scalar {
            Objects.requireNonNull(scalar, "scalar must not be null");
        }
    }

    /** A {@code List} of one primitive type. */
    record ListOf(ScalarType element) implements FieldType {
        public ListOf {
            Objects.requireNonNull(element, "element must not be null");
        }
    }

    /** A nested record or enum shape. */
    record Nested(ShapeDescriptor shape) implements FieldType {
        public Nested {
            Objects.requireNonNull(shape, "shape must not be null");
        }
    }

    /** A {@code @MultiSelect List<E>} over an enum shape. */
    record MultiSelect(EnumShape shape) implements FieldType {
        public MultiSelect {
            Objects.requireNonNull(shape, "shape must not be null");
        }
    }
}

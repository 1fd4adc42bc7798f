package io.elicitor.core.model;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One concrete answer stored in {@link Responses}. A closed hierarchy: every variant is known at
 * compile time and carries a {@link ValueTag} that must match the kind of the question bound to
 * the same path.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface ResponseValue {

    /** The tag of this value. */
    ValueTag tag();

    /** Tags of the value variants, used for kind/value matching and in error messages. */
    enum ValueTag {
        STRING,
        INT,
        FLOAT,
        BOOL,
        CHOSEN_VARIANT,
        CHOSEN_VARIANTS,
        STRING_LIST,
        INT_LIST,
        FLOAT_LIST
    }

    // ── Factories ──

    static ResponseValue of(String value) {
        return new StringValue(value);
    }

    static ResponseValue of(long value) {
        return new IntValue(value);
    }

    static ResponseValue of(double value) {
        return new FloatValue(value);
    }

    static ResponseValue of(boolean value) {
        return new BoolValue(value);
    }

    static ResponseValue chosen(int index) {
        return new ChosenVariant(index);
    }

    static ResponseValue chosenAll(int... indices) {
        Integer[] boxed = new Integer[indices.length];
        for (int i = 0; i < indices.length; i++) {
            boxed[i] = indices[i];
        }
        return new ChosenVariants(List.of(boxed));
    }

    // ── Implementations ──

    record StringValue(String value) implements ResponseValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public ValueTag tag() {
            return ValueTag.STRING;
        }
    }

    record IntValue(long value) implements ResponseValue {
        @Override
        public ValueTag tag() {
            return ValueTag.INT;
        }
    }

    record FloatValue(double value) implements ResponseValue {
        @Override
        public ValueTag tag() {
            return ValueTag.FLOAT;
        }
    }

    record BoolValue(boolean value) implements ResponseValue {
        @Override
        public ValueTag tag() {
            return ValueTag.BOOL;
        }
    }

    /** The single selected variant of a one-of question. */
    record ChosenVariant(int index) implements ResponseValue {
        public ChosenVariant {
            if (index < 0) {
                throw new IllegalArgumentException("Variant index must not be negative, got: " + index);
            }
        }

        @Override
        public ValueTag tag() {
            return ValueTag.CHOSEN_VARIANT;
        }
    }

    /**
     * The selected variants of an any-of question. Indices are stored ascending and distinct, so
     * two selections made in a different order are equal.
     */
    record ChosenVariants(List<Integer> indices) implements ResponseValue {
        public ChosenVariants {
            Objects.requireNonNull(indices, "indices must not be null");
            TreeSet<Integer> sorted = new TreeSet<>();
            for (Integer index : indices) {
                if (index == null || index < 0) {
                    throw new IllegalArgumentException("Variant indices must be non-negative, got: " + indices);
                }
                sorted.add(index);
            }
            indices = List.copyOf(sorted);
        }

        @Override
        public ValueTag tag() {
            return ValueTag.CHOSEN_VARIANTS;
        }
    }

    record StringList(List<String> values) implements ResponseValue {
        public StringList {
            values = List.copyOf(values);
        }

        @Override
        public ValueTag tag() {
            return ValueTag.STRING_LIST;
        }
    }

    record IntList(List<Long> values) implements ResponseValue {
        public IntList {
            values = List.copyOf(values);
        }

        @Override
        public ValueTag tag() {
            return ValueTag.INT_LIST;
        }
    }

    record FloatList(List<Double> values) implements ResponseValue {
        public FloatList {
            values = List.copyOf(values);
        }

        @Override
        public ValueTag tag() {
            return ValueTag.FLOAT_LIST;
        }
    }
}

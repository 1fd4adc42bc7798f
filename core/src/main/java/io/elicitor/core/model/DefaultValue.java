package io.elicitor.core.model;

import java.util.Objects;

/**
 * Default-value policy of a {@link Question}.
 *
 * <ul>
 * <li>{@link None}: the question must be answered.
 * <li>{@link Suggested}: the value is pre-filled but the question is still presented.
 * <li>{@link Assumed}: the question is never presented; the value is injected into the
 * responses as-is and the engine treats the question as answered.
 * </ul>
 */
public sealed interface DefaultValue {

    /** Shared instance of {@link None}. */
    DefaultValue NONE = new None();

    static DefaultValue suggested(ResponseValue value) {
        return new Suggested(value);
    }

    static DefaultValue assumed(ResponseValue value) {
        return new Assumed(value);
    }

    /** The pre-filled value, or {@code null} for {@link None}. */
    ResponseValue value();

    /** True if a presenter must skip the question. */
    default boolean isAssumed() {
        return this instanceof Assumed;
    }

    record None() implements DefaultValue {
        @Override
        public ResponseValue value() {
            return null;
        }
    }

    record Suggested(ResponseValue value) implements DefaultValue {
        public Suggested {
            Objects.requireNonNull(value, "suggested value must not be null");
        }
    }

    record Assumed(ResponseValue value) implements DefaultValue {
        public Assumed {
            Objects.requireNonNull(value, "assumed value must not be null");
        }
    }
}

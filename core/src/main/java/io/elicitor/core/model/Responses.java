package io.elicitor.core.model;

import io.elicitor.core.error.MissingResponseException;
import io.elicitor.core.error.ResponseTypeMismatchException;
import io.elicitor.core.model.ResponseValue.ValueTag;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The answer store: a flat mapping from {@link ResponsePath} to {@link ResponseValue}.
 *
 * <p>
 * Keys are unique and iteration follows insertion order, so a serialized store round-trips with
 * its entry order intact. The class is immutable: the engine can only read a store or derive new
 * ones ({@link #filterPrefix}, {@link #reroot}, {@link #merge}). Presenters and builders
 * accumulate entries through {@link Builder}.
 */
public final class Responses {

    private static final Responses EMPTY = new Responses(Map.of());

    private final Map<ResponsePath, ResponseValue> values;

    private Responses(Map<ResponsePath, ResponseValue> values) {
        this.values = values;
    }

    public static Responses empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Creates a store from an ordered map. The map is copied. */
    public static Responses of(Map<ResponsePath, ResponseValue> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return builder().putAll(values).build();
    }

    /**
     * Value at {@code path}.
     *
     * @return the value, or {@code null} if absent
     */
    public ResponseValue get(ResponsePath path) {
        return values.get(path);
    }

    public boolean contains(ResponsePath path) {
        return values.containsKey(path);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Keys in insertion order. */
    public Set<ResponsePath> paths() {
        return values.keySet();
    }

    /** Unmodifiable, insertion-ordered view of all entries. */
    public Map<ResponsePath, ResponseValue> asMap() {
        return values;
    }

    // ── Typed accessors ──

    public String getString(ResponsePath path) {
        return require(path, ValueTag.STRING, ResponseValue.StringValue.class).value();
    }

    public long getInt(ResponsePath path) {
        return require(path, ValueTag.INT, ResponseValue.IntValue.class).value();
    }

    public double getFloat(ResponsePath path) {
        return require(path, ValueTag.FLOAT, ResponseValue.FloatValue.class).value();
    }

    public boolean getBool(ResponsePath path) {
        return require(path, ValueTag.BOOL, ResponseValue.BoolValue.class).value();
    }

    public int getChosenVariant(ResponsePath path) {
        return require(path, ValueTag.CHOSEN_VARIANT, ResponseValue.ChosenVariant.class).index();
    }

    /** Selected indices, ascending. */
    public List<Integer> getChosenVariants(ResponsePath path) {
        return require(path, ValueTag.CHOSEN_VARIANTS, ResponseValue.ChosenVariants.class).indices();
    }

    public List<String> getStringList(ResponsePath path) {
        return require(path, ValueTag.STRING_LIST, ResponseValue.StringList.class).values();
    }

    public List<Long> getIntList(ResponsePath path) {
        return require(path, ValueTag.INT_LIST, ResponseValue.IntList.class).values();
    }

    public List<Double> getFloatList(ResponsePath path) {
        return require(path, ValueTag.FLOAT_LIST, ResponseValue.FloatList.class).values();
    }

    /**
     * Returns the value at {@code path} checked against {@code expected}.
     *
     * @throws MissingResponseException if the path has no value
     * @throws ResponseTypeMismatchException if the value carries another tag
     */
    public ResponseValue require(ResponsePath path, ValueTag expected) {
        ResponseValue value = values.get(path);
        if (value == null) {
            throw new MissingResponseException(path);
        }
        if (value.tag() != expected) {
            throw new ResponseTypeMismatchException(path, expected, value.tag());
        }
        return value;
    }

    private <V extends ResponseValue> V require(ResponsePath path, ValueTag expected, Class<V> type) {
        return type.cast(require(path, expected));
    }

    // ── Derived stores ──

    /**
     * Keeps the entries whose path starts with {@code prefix} and strips the prefix from each
     * retained key. The result is what a nested shape rooted at {@code prefix} reconstructs from.
     */
    public Responses filterPrefix(ResponsePath prefix) {
        if (prefix.isRoot()) {
            return this;
        }
        Builder builder = builder();
        values.forEach((path, value) -> {
            if (path.startsWith(prefix)) {
                builder.put(path.stripPrefix(prefix), value);
            }
        });
        return builder.build();
    }

    /** Prepends {@code prefix} to every key. The inverse of {@link #filterPrefix}. */
    public Responses reroot(ResponsePath prefix) {
        if (prefix.isRoot() || values.isEmpty()) {
            return this;
        }
        Builder builder = builder();
        values.forEach((path, value) -> builder.put(path.reroot(prefix), value));
        return builder.build();
    }

    /** Entries of this store overlaid with {@code other}; on a key clash {@code other} wins. */
    public Responses merge(Responses other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return builder().putAll(values).putAll(other.values).build();
    }

    /** Returns a copy of this store with one entry added or replaced. */
    public Responses with(ResponsePath path, ResponseValue value) {
        return builder().putAll(values).put(path, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Responses that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Responses" + values;
    }

    /** Accumulates entries for a new {@link Responses}. Later puts replace earlier ones. */
    public static final class Builder {

        private final Map<ResponsePath, ResponseValue> values = new LinkedHashMap<>();

        Builder() {}

        public Builder put(ResponsePath path, ResponseValue value) {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(value, "value must not be null");
            values.put(path, value);
            return this;
        }

        /** Convenience for tests and scripts: {@code put("address.city", ...)}. */
        public Builder put(String dottedPath, ResponseValue value) {
            return put(ResponsePath.parse(dottedPath), value);
        }

        public Builder putAll(Map<ResponsePath, ResponseValue> entries) {
            entries.forEach(this::put);
            return this;
        }

        public Builder putAll(Responses responses) {
            return putAll(responses.values);
        }

        public Builder remove(ResponsePath path) {
            values.remove(path);
            return this;
        }

        public boolean contains(ResponsePath path) {
            return values.containsKey(path);
        }

        public Responses build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Responses(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}

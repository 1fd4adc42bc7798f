package io.elicitor.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location of one question or answer within a (possibly nested) shape. A path is an ordered list
 * of segment names and is the join key between a {@link SurveyDefinition} and {@link Responses}.
 *
 * <p>
 * Segments are struct field names, {@code field_N} for positional components, or one of the
 * reserved segments {@link #SELECTED_ALTERNATIVE} and {@link #ALTERNATIVES} used by enum shapes.
 *
 * <p>
 * Immutable. Child paths are built by appending; a parent is never mutated.
 */
public final class ResponsePath {

    /** Segment holding the chosen variant index of an enum shape. */
    public static final String SELECTED_ALTERNATIVE = "selected_alternative";

    /** Segment under which each variant's payload questions live ({@code alternatives.N}). */
    public static final String ALTERNATIVES = "alternatives";

    private static final ResponsePath ROOT = new ResponsePath(List.of());

    private final List<String> segments;

    private ResponsePath(List<String> segments) {
        this.segments = segments;
    }

    /** The empty path. Top-level questions of an enum shape are rooted here. */
    public static ResponsePath root() {
        return ROOT;
    }

    /**
     * Creates a path from explicit segments. Segments are taken literally, so a segment may
     * itself contain a dot.
     *
     * @throws IllegalArgumentException if any segment is null or empty
     */
    public static ResponsePath of(String... segments) {
        return of(List.of(segments));
    }

    /** Creates a path from a list of literal segments. */
    public static ResponsePath of(List<String> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            return ROOT;
        }
        for (String segment : segments) {
            requireSegment(segment);
        }
        return new ResponsePath(List.copyOf(segments));
    }

    /**
     * Parses a dotted path such as {@code address.city}. The empty string parses to
     * {@link #root()}.
     *
     * @throws IllegalArgumentException if the string has empty segments ({@code a..b})
     */
    public static ResponsePath parse(String dotted) {
        Objects.requireNonNull(dotted, "dotted path must not be null");
        if (dotted.isEmpty()) {
            return ROOT;
        }
        String[] parts = dotted.split("\\.", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Path has an empty segment: '" + dotted + "'");
            }
        }
        return new ResponsePath(List.of(parts));
    }

    /** Positional segment name for the component at {@code index} ({@code field_0}, ...). */
    public static String positional(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Positional index must not be negative: " + index);
        }
        return "field_" + index;
    }

    /** Returns a new path with {@code segment} appended. */
    public ResponsePath child(String segment) {
        requireSegment(segment);
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new ResponsePath(Collections.unmodifiableList(next));
    }

    /** Returns a new path with the decimal form of {@code index} appended. */
    public ResponsePath childIndex(int index) {
        return child(Integer.toString(index));
    }

    /** Path of the chosen-variant answer for an enum question rooted at this path. */
    public ResponsePath selectedAlternative() {
        return child(SELECTED_ALTERNATIVE);
    }

    /** Path of the payload group of variant {@code index} for an enum rooted at this path. */
    public ResponsePath alternative(int index) {
        return child(ALTERNATIVES).childIndex(index);
    }

    /** Returns {@code prefix + this}, i.e. this path re-rooted under {@code prefix}. */
    public ResponsePath reroot(ResponsePath prefix) {
        return prefix.concat(this);
    }

    /** Returns {@code this + suffix}. */
    public ResponsePath concat(ResponsePath suffix) {
        if (suffix.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return suffix;
        }
        List<String> next = new ArrayList<>(segments.size() + suffix.segments.size());
        next.addAll(segments);
        next.addAll(suffix.segments);
        return new ResponsePath(Collections.unmodifiableList(next));
    }

    /** True if this path's segments are an ordered prefix of {@code other}'s (or equal). */
    public boolean isPrefixOf(ResponsePath other) {
        return other.startsWith(this);
    }

    /** True if {@code prefix}'s segments are an ordered prefix of this path's (or equal). */
    public boolean startsWith(ResponsePath prefix) {
        if (prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    /**
     * Removes {@code prefix} from the front of this path.
     *
     * @throws IllegalArgumentException if this path does not start with {@code prefix}
     */
    public ResponsePath stripPrefix(ResponsePath prefix) {
        if (!startsWith(prefix)) {
            throw new IllegalArgumentException("Path '" + this + "' does not start with '" + prefix + "'");
        }
        if (prefix.isRoot()) {
            return this;
        }
        return new ResponsePath(segments.subList(prefix.segments.size(), segments.size()));
    }

    /** The path without its last segment; the root is its own parent. */
    public ResponsePath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new ResponsePath(segments.subList(0, segments.size() - 1));
    }

    /** First segment, or {@code null} for the root. */
    public String firstSegment() {
        return segments.isEmpty() ? null : segments.get(0);
    }

    /** Last segment, or {@code null} for the root. */
    public String lastSegment() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /** Unmodifiable view of the segments. */
    public List<String> segments() {
        return segments;
    }

    public int depth() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Segments joined with {@code .}. Not reversible when a segment contains a dot. */
    public String asDottedString() {
        return String.join(".", segments);
    }

    private static void requireSegment(String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new IllegalArgumentException("Path segment must not be null or empty");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponsePath that)) return false;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : asDottedString();
    }
}

package io.elicitor.core.shape;

import io.elicitor.core.error.ShapeDefinitionException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of shape descriptors keyed by {@code Class} identity. Append-only: a
 * descriptor is built on first lookup and never replaced. Thread-safe; two threads racing on the
 * same type may both introspect it, and the first stored descriptor wins.
 */
public final class ShapeRegistry {

    private static final ShapeRegistry SHARED = new ShapeRegistry();

    private final Map<Class<?>, ShapeDescriptor> descriptors = new ConcurrentHashMap<>();

    /** The registry used by {@code Survey.of}. */
    public static ShapeRegistry shared() {
        return SHARED;
    }

    /**
     * Returns the descriptor of {@code type}, introspecting it on first use. Failed introspections
     * are not cached.
     *
     * @throws ShapeDefinitionException if {@code type} is not a well-formed shape
     */
    public ShapeDescriptor describe(Class<?> type) {
        if (type == null) {
            throw new NullPointerException("type must not be null");
        }
        ShapeDescriptor cached = descriptors.get(type);
        if (cached != null) {
            return cached;
        }
        // Introspection recurses into nested types, so it runs outside any map operation.
        ShapeDescriptor built = new ShapeIntrospector().introspect(type);
        ShapeDescriptor existing = descriptors.putIfAbsent(type, built);
        return existing != null ? existing : built;
    }

    /** Returns {@code true} if {@code type} has already been described. */
    public boolean isCached(Class<?> type) {
        return descriptors.containsKey(type);
    }

    /** Returns the number of cached descriptors. */
    public int size() {
        return descriptors.size();
    }
}

package io.elicitor.core.shape;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/** Primitive Java types a shape component may have, with their boxes. */
public enum ScalarType {
    STRING(String.class, null),
    PATH(Path.class, null),
    BOOL(Boolean.class, boolean.class),
    BYTE(Byte.class, byte.class),
    SHORT(Short.class, short.class),
    INT(Integer.class, int.class),
    LONG(Long.class, long.class),
    FLOAT(Float.class, float.class),
    DOUBLE(Double.class, double.class);

    private static final Map<Class<?>, ScalarType> BY_CLASS = index();

    private final Class<?> boxed;
    private final Class<?> primitive;

    ScalarType(Class<?> boxed, Class<?> primitive) {
        this.boxed = boxed;
        this.primitive = primitive;
    }

    /**
     * Scalar type of {@code type}, primitives and boxes alike.
     *
     * @return the scalar type, or {@code null} if {@code type} is not a supported primitive
     */
    public static ScalarType forClass(Class<?> type) {
        return BY_CLASS.get(type);
    }

    public Class<?> boxed() {
        return boxed;
    }

    public boolean isText() {
        return this == STRING || this == PATH;
    }

    public boolean isIntegral() {
        return this == BYTE || this == SHORT || this == INT || this == LONG;
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isNumeric() {
        return isIntegral() || isFloating();
    }

    /** Smallest value of an integral type. */
    public long minValue() {
        return switch (this) {
            case BYTE -> Byte.MIN_VALUE;
            case SHORT -> Short.MIN_VALUE;
            case INT -> Integer.MIN_VALUE;
            case LONG -> Long.MIN_VALUE;
            default -> throw new IllegalStateException(this + " is not integral");
        };
    }

    /** Largest value of an integral type. */
    public long maxValue() {
        return switch (this) {
            case BYTE -> Byte.MAX_VALUE;
            case SHORT -> Short.MAX_VALUE;
            case INT -> Integer.MAX_VALUE;
            case LONG -> Long.MAX_VALUE;
            default -> throw new IllegalStateException(this + " is not integral");
        };
    }

    private static Map<Class<?>, ScalarType> index() {
        Map<Class<?>, ScalarType> map = new HashMap<>();
        for (ScalarType type : values()) {
            map.put(type.boxed, type);
            if (type.primitive != null) {
                map.put(type.primitive, type);
            }
        }
        return Map.copyOf(map);
    }
}

package io.elicitor.core.shape;

import java.util.Objects;

/**
 * One option of an {@link EnumShape}. An enum constant carries its {@code constant}; a record
 * variant of a sealed interface carries its {@code payload} struct, which may have no fields.
 */
public record VariantDescriptor(String name, String prompt, Object constant, StructShape payload) {

    public VariantDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        if ((constant == null) == (payload == null)) {
            throw new IllegalArgumentException("Variant '" + name + "' needs exactly one of constant or payload");
        }
    }

    static VariantDescriptor ofConstant(Enum<?> constant, String prompt) {
        return new VariantDescriptor(constant.name(), prompt, constant, null);
    }

    static VariantDescriptor ofRecord(StructShape payload, String prompt) {
        return new VariantDescriptor(payload.type().getSimpleName(), prompt, null, payload);
    }

    /** True if choosing this variant collects no further answers. */
    public boolean isUnit() {
        return payload == null || payload.fields().isEmpty();
    }

    boolean matches(Object value) {
        if (constant != null) {
            return constant.equals(value);
        }
        return payload.type().isInstance(value);
    }
}

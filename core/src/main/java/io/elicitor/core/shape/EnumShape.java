package io.elicitor.core.shape;

import java.util.List;
import java.util.Objects;

/**
 * An enum shape: a Java {@code enum} or a sealed interface over records. Variant order is the
 * declaration order (enum constants) or the {@code permits} order (sealed interfaces), and a
 * variant's position is the index stored as its {@code ChosenVariant}.
 */
public record EnumShape(Class<?> type, List<VariantDescriptor> variants, String prelude, String epilogue)
        implements ShapeDescriptor {

    public EnumShape {
        Objects.requireNonNull(type, "type must not be null");
        variants = List.copyOf(variants);
    }

    /**
     * Index of the variant {@code value} belongs to.
     *
     * @return the index, or -1 if {@code value} is not an instance of any variant
     */
    public int indexOf(Object value) {
        for (int i = 0; i < variants.size(); i++) {
            if (variants.get(i).matches(value)) {
                return i;
            }
        }
        return -1;
    }
}

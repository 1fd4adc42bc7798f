package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;

/** Thrown when a chosen variant index is out of range for the enum shape's variant count. */
public final class UnknownVariantException extends ReconstructionException {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final int variantCount;

    public UnknownVariantException(ResponsePath path, int index, int variantCount) {
        super("Unknown variant " + index + " at '" + path + "' (shape has " + variantCount + " variants)", path);
        this.index = index;
        this.variantCount = variantCount;
    }

    public int index() {
        return index;
    }

    public int variantCount() {
        return variantCount;
    }

    @Override
    public UnknownVariantException reroot(ResponsePath prefix) {
        return new UnknownVariantException(path().reroot(prefix), index, variantCount);
    }
}

package io.elicitor.core.error;

import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue.ValueTag;

/**
 * Thrown when the value stored at a path carries a different tag than the question kind requires,
 * or does not fit the Java type of the target field.
 */
public final class ResponseTypeMismatchException extends ReconstructionException {

    private static final long serialVersionUID = 1L;

    private final ValueTag expected;
    private final ValueTag actual;
    private final String reason;

    public ResponseTypeMismatchException(ResponsePath path, ValueTag expected, ValueTag actual) {
        this(path, expected, actual, "expected " + expected + ", found " + actual);
    }

    /** Mismatch where the tag is right but the value does not fit the field's Java type. */
    public ResponseTypeMismatchException(ResponsePath path, ValueTag expected, String reason) {
        this(path, expected, expected, reason);
    }

    private ResponseTypeMismatchException(ResponsePath path, ValueTag expected, ValueTag actual, String reason) {
        super("Type mismatch at '" + path + "': " + reason, path);
        this.expected = expected;
        this.actual = actual;
        this.reason = reason;
    }

    public ValueTag expected() {
        return expected;
    }

    public ValueTag actual() {
        return actual;
    }

    @Override
    public ResponseTypeMismatchException reroot(ResponsePath prefix) {
        return new ResponseTypeMismatchException(path().reroot(prefix), expected, actual, reason);
    }
}

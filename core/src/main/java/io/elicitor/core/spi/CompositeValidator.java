package io.elicitor.core.spi;

import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.Responses;
import java.util.Map;

/**
 * Cross-field check declared on a record with {@code @ValidateComposite}, for invariants spanning
 * several sibling fields (e.g. two passwords must match). Runs once, after every individual field
 * of the survey has passed.
 *
 * <p>
 * Implementations need a public no-arg constructor and must be stateless.
 */
@FunctionalInterface
public interface CompositeValidator {

    /**
     * @param responses the answers under the declaring record, with its prefix stripped
     * @return messages keyed by relative path; empty if the invariant holds
     */
    Map<ResponsePath, String> validate(Responses responses);
}

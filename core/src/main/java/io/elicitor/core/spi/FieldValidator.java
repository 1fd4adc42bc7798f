package io.elicitor.core.spi;

import io.elicitor.core.model.ResponsePath;
import io.elicitor.core.model.ResponseValue;
import io.elicitor.core.model.Responses;
import java.util.Optional;

/**
 * User-declared check attached to one field with {@code @Validate}, or to every numeric field of a
 * record with {@code @ValidateFields}.
 *
 * <p>
 * Implementations need a public no-arg constructor. They are instantiated once per shape and may
 * be called concurrently, so they must be stateless.
 *
 * <p>
 * {@code responses} and {@code path} are relative to the record that declares the field: a
 * validator on {@code Address.zip} sees {@code zip}, not {@code order.shipping.zip}.
 */
@FunctionalInterface
public interface FieldValidator {

    /**
     * @param value candidate value, already within any declared bounds
     * @param responses answers collected so far, relative to the declaring record
     * @param path path of the field, relative to the declaring record
     * @return the rejection message, or empty to accept
     */
    Optional<String> validate(ResponseValue value, Responses responses, ResponsePath path);
}

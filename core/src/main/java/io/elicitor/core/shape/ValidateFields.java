package io.elicitor.core.shape;

import io.elicitor.core.spi.FieldValidator;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validator appended to every numeric scalar component of the annotated record, after that
 * component's own validators.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ValidateFields {
    Class<? extends FieldValidator> value();
}

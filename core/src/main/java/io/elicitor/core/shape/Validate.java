package io.elicitor.core.shape;

import io.elicitor.core.spi.FieldValidator;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Field validators run, in order, after any declared bounds. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Validate {
    Class<? extends FieldValidator>[] value();
}

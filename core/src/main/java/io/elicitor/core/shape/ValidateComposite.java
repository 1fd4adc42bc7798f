package io.elicitor.core.shape;

import io.elicitor.core.spi.CompositeValidator;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Cross-field validators of the annotated record. */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ValidateComposite {
    Class<? extends CompositeValidator>[] value();
}

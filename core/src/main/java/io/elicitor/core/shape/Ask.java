package io.elicitor.core.shape;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Prompt text. On a record component it is the question prompt; on an enum constant or a variant
 * record it is the label of that option. Required on components whose type is a nested shape.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD, ElementType.TYPE})
public @interface Ask {
    String value();
}

package io.elicitor.core.shape;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the path segment of a component, which defaults to the component name. The segment is
 * taken literally; a key containing a dot is accepted but must not spell the same dotted path as
 * another question.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Key {
    String value();
}

package asdl.generator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates node classes for a schema at compile time. The schema is given one line per array
 * element; the generated holder class is placed in the annotated type's package.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface AsdlSchema {
  String[] value();
}

package ru.dimension.inject.reflect;

import java.lang.annotation.*;

/**
 * Marks a parameter of an {@code @Inject} method as provided by the caller
 * rather than resolved from the dependency map.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Assisted {
}

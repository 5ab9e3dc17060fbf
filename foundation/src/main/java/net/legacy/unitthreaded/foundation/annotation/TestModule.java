package net.legacy.unitthreaded.foundation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a test module so that package scanning can find it.
 *
 * <p>A test module contains test functions and nested test classes. Modules can also
 * be passed to the test factory explicitly, in which case this annotation is not
 * required.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 19:10
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TestModule {

    /**
     * Human-readable description of what the module covers.
     *
     * @return the module description
     */
    String description() default "";

}

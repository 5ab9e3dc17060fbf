package net.legacy.unitthreaded.foundation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requests serialized execution for tests that share a module.
 *
 * <p>All single-threaded tests of one module are grouped into a single composite test
 * case whose children always run one after the other, whatever execution policy the
 * caller applies to the overall set of tests.
 *
 * <p>On a test module class the flag applies to every test of the module. On a test
 * function or nested test class it applies to that test only.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 19:10
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface SingleThreaded {
}

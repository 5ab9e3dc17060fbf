package net.legacy.unitthreaded.core.data;

/**
 * A zero-argument test callable.
 *
 * <p>Returning normally means the test passed. Anything thrown means it failed.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 10:00
 */
@FunctionalInterface
public interface TestFunction {
    /**
     * Runs the test body.
     *
     * @throws Exception if the test fails
     */
    void invoke() throws Exception;
}

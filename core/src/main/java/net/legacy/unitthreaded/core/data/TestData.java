package net.legacy.unitthreaded.core.data;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable description of one discoverable test.
 *
 * <p>Function-based tests carry their callable in {@link #getTest()}. Class-based tests
 * leave it {@code null} and are constructed by name through the test case registry
 * instead.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 10:00
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TestData {

    /**
     * The fully qualified, dot-separated test name.
     */
    @NonNull
    String name;

    /**
     * Whether the test is excluded from default selection.
     */
    boolean hidden;

    /**
     * The test callable, or {@code null} for class-based tests.
     */
    TestFunction test;

    /**
     * Whether the test must run serialized with the other single-threaded tests of its module.
     */
    boolean singleThreaded;

    /**
     * Creates the description of a visible, class-based test.
     *
     * @param name the qualified test name
     * @return the test data
     */
    public static TestData of(String name) {
        return TestData.builder().name(name).build();
    }

    /**
     * Creates the description of a class-based test.
     *
     * @param name   the qualified test name
     * @param hidden whether the test is hidden
     * @return the test data
     */
    public static TestData of(String name, boolean hidden) {
        return TestData.builder().name(name).hidden(hidden).build();
    }

    /**
     * Creates the description of a function-based test.
     *
     * @param name   the qualified test name
     * @param hidden whether the test is hidden
     * @param test   the test callable
     * @return the test data
     */
    public static TestData of(String name, boolean hidden, TestFunction test) {
        return TestData.builder().name(name).hidden(hidden).test(test).build();
    }

    /**
     * Checks whether this test is backed by a callable.
     *
     * @return true for function-based tests
     */
    public boolean isFunctionTest() {
        return test != null;
    }

}

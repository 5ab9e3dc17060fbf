package net.legacy.unitthreaded.core.testcase;

import lombok.Value;

import java.util.List;

/**
 * Outcome of running one test case.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 10:30
 */
@Value
public class TestOutcome {

    /**
     * The path of the test case that was run.
     */
    String path;

    /**
     * Failure descriptions, empty when the test case passed.
     */
    List<String> failures;

    long durationMs;

    /**
     * The number of individual tests behind the test case.
     */
    int testsRun;

    public TestOutcome(String path, List<String> failures, long durationMs, int testsRun) {
        this.path = path;
        this.failures = List.copyOf(failures);
        this.durationMs = durationMs;
        this.testsRun = testsRun;
    }

    /**
     * Checks whether the test case passed.
     *
     * @return true if no failure was recorded
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

}

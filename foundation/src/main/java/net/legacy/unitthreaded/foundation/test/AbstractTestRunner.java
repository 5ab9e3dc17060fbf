package net.legacy.unitthreaded.foundation.test;

import lombok.Getter;

import java.util.Map;

/**
 * Abstract base class for test runners.
 *
 * <p>This class handles the lifecycle shared by every runner: setup, execution,
 * cleanup, timing and result generation. Subclasses implement {@link #executeTests()}
 * and record their outcomes in the {@link TestExecutionContext}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 20:30
 */
public abstract class AbstractTestRunner {
    /**
     * The execution context for this test run.
     */
    @Getter
    protected final TestExecutionContext context;

    /**
     * The name of the test suite being run.
     */
    protected final String suiteName;

    /**
     * Creates a new test runner.
     *
     * @param suiteName the name of the test suite being run
     */
    protected AbstractTestRunner(String suiteName) {
        this.suiteName = suiteName;
        this.context = new TestExecutionContext(suiteName);
    }

    /**
     * Runs all tests and returns a result summary.
     *
     * <p>This method orchestrates the complete test lifecycle:
     * <ol>
     *   <li>Calls {@link #beforeTests()} for setup</li>
     *   <li>Executes {@link #executeTests()} for main test logic</li>
     *   <li>Calls {@link #afterTests()} for cleanup</li>
     *   <li>Generates and returns a {@link TestResultSummary}</li>
     * </ol>
     *
     * <p>Test failures are expected to be recorded by {@link #executeTests()} itself.
     * An exception escaping the lifecycle means the runner could not do its job and
     * produces a failure summary.
     *
     * @return the test result summary
     */
    public final TestResultSummary runTests() {
        long startTime = System.currentTimeMillis();

        try {
            beforeTests();
            executeTests();
            afterTests();

            return generateSuccessResult(System.currentTimeMillis() - startTime);
        } catch (Exception exception) {
            context.incrementException();
            return generateFailureResult(System.currentTimeMillis() - startTime, exception);
        } finally {
            finalizeTests();
        }
    }

    /**
     * Executes the tests of this runner.
     *
     * @throws Exception if the runner itself cannot continue
     */
    protected abstract void executeTests() throws Exception;

    /**
     * Performs setup operations before test execution.
     *
     * @throws Exception if setup fails
     */
    protected void beforeTests() throws Exception {
        // Default implementation does nothing
    }

    /**
     * Performs cleanup operations after test execution.
     *
     * @throws Exception if cleanup fails
     */
    protected void afterTests() throws Exception {
        // Default implementation does nothing
    }

    /**
     * Performs final cleanup operations that always execute.
     */
    protected void finalizeTests() {
        // Default implementation does nothing
    }

    /**
     * Generates the summary of a run whose lifecycle completed.
     *
     * <p>The run is successful only if no test failure was recorded in the context.
     *
     * @param duration the test execution duration in milliseconds
     * @return the result summary
     */
    protected TestResultSummary generateSuccessResult(long duration) {
        int failureCount = context.getFailureCount().get();
        int successCount = context.getSuccessCount().get();
        int totalCount = context.getProcessedCount().get();

        boolean success = failureCount == 0;
        String message = success
                ? String.format("All %d %s tests passed", totalCount, suiteName)
                : String.format("%s tests completed with %d failures out of %d", suiteName, failureCount, totalCount);

        return TestResultSummary.builder()
                .suiteName(suiteName)
                .success(success)
                .message(message)
                .durationMs(duration)
                .totalCount(totalCount)
                .successCount(successCount)
                .failureCount(failureCount)
                .testsRun(context.getTestsRun().get())
                .details(context.getMetricsSummary())
                .build();
    }

    /**
     * Generates a failure result summary.
     *
     * @param duration  the test execution duration in milliseconds
     * @param exception the exception that caused the failure
     * @return the failure result summary
     */
    protected TestResultSummary generateFailureResult(long duration, Exception exception) {
        String message = new StringBuilder()
                .append(suiteName)
                .append(" tests failed: ")
                .append(exception.getMessage())
                .toString();

        TestResultSummary aborted = TestResultSummary.aborted(suiteName, message, duration, exception);
        Map<String, Object> details = context.getMetricsSummary();
        details.putAll(aborted.getDetails());

        return aborted.toBuilder()
                .failureCount(context.getFailureCount().get())
                .details(details)
                .build();
    }

    /**
     * Records the outcome of one test case in the context.
     *
     * @param passed   whether the test case passed
     * @param testsRun the number of individual tests behind the test case
     */
    protected void recordOutcome(boolean passed, int testsRun) {
        context.incrementProcessed();
        context.addTestsRun(testsRun);

        if (passed) {
            context.incrementSuccess();
        } else {
            context.incrementFailure();
        }
    }
}

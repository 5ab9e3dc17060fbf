package net.legacy.unitthreaded.foundation.test;

import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.foundation.util.TestLogger;

/**
 * Utility class for running test suites with standardized logging.
 *
 * <p>Every runner goes through here so the final lines of a run look the same no
 * matter which runner produced them.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 20:30
 */
@UtilityClass
public class TestExecutionUtil {

    /**
     * Runs a test runner and logs its result.
     *
     * @param suiteName  the name of the test suite
     * @param testRunner the test runner instance
     * @param <T>        the type of test runner
     * @return the result summary of the run
     */
    public static <T extends AbstractTestRunner> TestResultSummary executeTestRunner(String suiteName, T testRunner) {
        return executeTests(suiteName, testRunner::runTests);
    }

    /**
     * Runs arbitrary test logic and logs its result.
     *
     * <p>An exception escaping the test logic is logged as a critical error and turned
     * into a failed summary.
     *
     * @param suiteName     the name of the test suite
     * @param testExecution functional interface for test execution
     * @return the result summary of the run
     */
    public static TestResultSummary executeTests(String suiteName, TestExecution testExecution) {
        long startTime = System.currentTimeMillis();
        try {
            TestLogger.logInfo(suiteName, "Initializing %s test runner...", suiteName);
            TestResultSummary result = testExecution.execute();
            logTestResults(suiteName, result);
            return result;
        } catch (Exception exception) {
            TestLogger.logFailure(suiteName, "Critical error while running %s tests", exception, suiteName);
            return TestResultSummary.aborted(suiteName, "Critical error: " + exception.getMessage(),
                    System.currentTimeMillis() - startTime, exception);
        }
    }

    private static void logTestResults(String suiteName, TestResultSummary result) {
        TestMetrics metrics = extractTestMetrics(result);

        if (result.isSuccess()) {
            TestLogger.logSuccess(suiteName,
                    "All %s tests completed successfully in %dms (Total: %d, Passed: %d, Failed: %d)",
                    suiteName, result.getDurationMs(), metrics.operationsCount(),
                    metrics.successCount(), metrics.failureCount());
            return;
        }

        TestLogger.logFailure(suiteName,
                "%s tests completed with failures in %dms (Total: %d, Passed: %d, Failed: %d)",
                suiteName, result.getDurationMs(), metrics.operationsCount(),
                metrics.successCount(), metrics.failureCount());
        logDetailedTestSummary(suiteName, result, metrics);
    }

    private static TestMetrics extractTestMetrics(TestResultSummary result) {
        int totalCount = result.getTotalCount();
        if (totalCount == 0) {
            totalCount = result.getSuccessCount() + result.getFailureCount();
        }

        return TestMetrics.builder()
                .durationMs(result.getDurationMs())
                .operationsCount(totalCount)
                .successCount(result.getSuccessCount())
                .failureCount(result.getFailureCount())
                .build()
                .calculate();
    }

    private static void logDetailedTestSummary(String suiteName, TestResultSummary result, TestMetrics metrics) {
        TestLogger.logInfo(suiteName, "Test Results Summary:");
        TestLogger.logInfo(suiteName, "    Passed: %d tests", metrics.successCount());
        TestLogger.logInfo(suiteName, "    Failed: %d tests", metrics.failureCount());
        TestLogger.logInfo(suiteName, "    Total:  %d tests", metrics.operationsCount());
        TestLogger.logInfo(suiteName, "    Duration: %dms", metrics.durationMs());

        if (metrics.averageOperationDurationMs() > 0) {
            TestLogger.logInfo(suiteName, "    Avg Duration: %.2fms per test", metrics.averageOperationDurationMs());
        }

        if (metrics.getSuccessRate() > 0) {
            TestLogger.logInfo(suiteName, "    Success Rate: %.1f%%", metrics.getSuccessRate());
        }

        result.getFailures().forEach(failure -> TestLogger.logFailure(suiteName, "%s", failure));
    }

}

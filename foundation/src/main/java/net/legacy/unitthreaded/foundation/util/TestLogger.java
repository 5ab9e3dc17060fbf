package net.legacy.unitthreaded.foundation.util;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standardized logging utility for test runs.
 *
 * <p>This utility class keeps the log lines of every test run in one format,
 * {@code [TEST] [<suite>] <icon> <message>}, so that output produced by different
 * runners can be read and grepped the same way. Messages are {@link String#format}
 * patterns; the formatted line is handed to SLF4J.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 20:00
 */
@UtilityClass
public class TestLogger {
    private static final Logger logger = LoggerFactory.getLogger(TestLogger.class);

    private static final String TEST_PREFIX = "[TEST]";
    private static final String SUCCESS_ICON = "✅";
    private static final String FAILURE_ICON = "❌";
    private static final String INFO_ICON = "ℹ️";
    private static final String WARNING_ICON = "⚠️";

    /**
     * Logs a test start message.
     *
     * @param suiteName the name of the test suite being run
     * @param testName  the name of the test being started
     */
    public static void logTestStart(String suiteName, String testName) {
        logInfo(suiteName, "Starting test: %s", testName);
    }

    /**
     * Logs a test completion message.
     *
     * @param suiteName  the name of the test suite being run
     * @param testName   the name of the test that completed
     * @param durationMs the test duration in milliseconds
     */
    public static void logTestComplete(String suiteName, String testName, long durationMs) {
        logger.info("{} [{}] {} Test completed: {} (took {}ms)", TEST_PREFIX, suiteName, "🏁", testName, durationMs);
    }

    /**
     * Logs a test success message.
     *
     * @param suiteName the name of the test suite being run
     * @param message   the success message
     * @param replace   format arguments for message string formatting
     */
    public static void logSuccess(String suiteName, String message, Object... replace) {
        logger.info("{} [{}] {} {}", TEST_PREFIX, suiteName, SUCCESS_ICON, String.format(message, replace));
    }

    /**
     * Logs a test failure message.
     *
     * @param suiteName the name of the test suite being run
     * @param message   the failure message
     * @param replace   format arguments for message string formatting
     */
    public static void logFailure(String suiteName, String message, Object... replace) {
        logger.warn("{} [{}] {} {}", TEST_PREFIX, suiteName, FAILURE_ICON, String.format(message, replace));
    }

    /**
     * Logs a test failure message with exception details.
     *
     * @param suiteName the name of the test suite being run
     * @param message   the failure message
     * @param exception the exception that caused the failure
     * @param replace   format arguments for message string formatting
     */
    public static void logFailure(String suiteName, String message, Throwable exception, Object... replace) {
        logger.error("{} [{}] {} {}", TEST_PREFIX, suiteName, FAILURE_ICON, String.format(message, replace), exception);
    }

    /**
     * Logs general test information.
     *
     * @param suiteName the name of the test suite being run
     * @param message   the information message
     * @param replace   format arguments for message string formatting
     */
    public static void logInfo(String suiteName, String message, Object... replace) {
        logger.info("{} [{}] {} {}", TEST_PREFIX, suiteName, INFO_ICON, String.format(message, replace));
    }

    /**
     * Logs a test warning message.
     *
     * @param suiteName the name of the test suite being run
     * @param message   the warning message
     * @param replace   format arguments for message string formatting
     */
    public static void logWarning(String suiteName, String message, Object... replace) {
        logger.warn("{} [{}] {} {}", TEST_PREFIX, suiteName, WARNING_ICON, String.format(message, replace));
    }

    /**
     * Logs test execution statistics.
     *
     * @param suiteName    the name of the test suite being run
     * @param totalTests   the total number of tests
     * @param successCount the number of successful tests
     * @param failureCount the number of failed tests
     * @param durationMs   the total execution duration in milliseconds
     */
    public static void logStatistics(String suiteName, int totalTests, int successCount,
                                     int failureCount, long durationMs) {
        logger.info("{} [{}] {} Statistics: Total={}, Success={}, Failed={}, Duration={}ms", TEST_PREFIX, suiteName,
                "📊", totalTests, successCount, failureCount, durationMs);
    }

    /**
     * Logs a debug message (only if debug mode is enabled).
     *
     * @param suiteName the name of the test suite being run
     * @param message   the debug message
     * @param debugMode whether debug mode is enabled
     * @param replace   format arguments for message string formatting
     */
    public static void logDebug(String suiteName, String message, boolean debugMode, Object... replace) {
        if (debugMode) {
            logger.info("{} [{}] [DEBUG] {}", TEST_PREFIX, suiteName, String.format(message, replace));
        }
    }
}

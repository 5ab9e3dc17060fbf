package net.legacy.unitthreaded.core.runner;

import lombok.Getter;
import net.legacy.unitthreaded.core.testcase.TestCase;
import net.legacy.unitthreaded.core.testcase.TestOutcome;
import net.legacy.unitthreaded.foundation.test.AbstractTestRunner;
import net.legacy.unitthreaded.foundation.test.TestResultSummary;
import net.legacy.unitthreaded.foundation.util.TestLogger;
import net.legacy.unitthreaded.foundation.util.TestTimer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs a collection of test cases one after the other.
 *
 * <p>Each test case runs its full lifecycle through {@link TestCase#run()}; a failing
 * test case never stops the ones after it. Outcomes are recorded in the execution
 * context and the summary carries every failure description in
 * {@link TestResultSummary#getFailures()}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 16:00
 */
public class TestCaseRunner extends AbstractTestRunner {

    private static final String TOTAL_TIMER = "total-execution";

    private final List<TestCase> testCases;
    private final TestTimer timer = new TestTimer();

    @Getter
    private final List<TestOutcome> outcomes = new ArrayList<>();

    public TestCaseRunner(String suiteName, Collection<? extends TestCase> testCases) {
        super(suiteName);
        this.testCases = List.copyOf(testCases);
    }

    @Override
    protected void beforeTests() {
        if (testCases.isEmpty()) {
            TestLogger.logWarning(suiteName, "No test cases selected");
        }
        TestLogger.logTestStart(suiteName, testCases.size() + " test cases");
        outcomes.clear();
        timer.startTimer(TOTAL_TIMER);
    }

    @Override
    protected void executeTests() {
        for (TestCase testCase : testCases) {
            String path = testCase.getPath();
            TestLogger.logDebug(suiteName, "Running %s", context.isDebugMode(), path);

            timer.startTimer(path);
            TestOutcome outcome = testCase.run();
            timer.stopTimer(path);

            outcomes.add(outcome);
            recordOutcome(outcome.isSuccess(), outcome.getTestsRun());

            if (!outcome.isSuccess()) {
                outcome.getFailures().forEach(failure -> TestLogger.logFailure(suiteName, "%s", failure));
            }
        }
    }

    @Override
    protected void afterTests() {
        long duration = timer.stopTimer(TOTAL_TIMER);
        TestLogger.logTestComplete(suiteName, testCases.size() + " test cases", duration);
        TestLogger.logStatistics(suiteName, context.getProcessedCount().get(), context.getSuccessCount().get(),
                context.getFailureCount().get(), duration);
    }

    @Override
    protected TestResultSummary generateSuccessResult(long duration) {
        List<String> failures = new ArrayList<>();
        outcomes.forEach(outcome -> failures.addAll(outcome.getFailures()));

        return super.generateSuccessResult(duration).toBuilder()
                .failures(List.copyOf(failures))
                .build()
                .withDetail("timingDetails", timer.getTimingSummary());
    }

}

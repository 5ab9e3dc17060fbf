package net.legacy.unitthreaded.core.testcase;

import net.legacy.unitthreaded.foundation.exception.UnitTestException;

import java.util.ArrayList;
import java.util.List;

/**
 * A runnable unit of the test framework.
 *
 * <p>Test classes extend this class directly; the framework adapts test functions and
 * inline test blocks into subclasses of it so that the caller runs every test the same
 * way, whatever its origin.
 *
 * <p>Test cases are identified by reference. {@link #equals(Object)} and
 * {@link #hashCode()} are final and identity-based, so a set of test cases never holds
 * the same instance twice and never merges two distinct instances.
 *
 * <p>A concrete test class needs a zero-argument constructor to be constructed by name.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 10:30
 */
public abstract class TestCase {

    /**
     * Gets the qualified name used for selection and reporting.
     *
     * <p>The default is the canonical name of the test class.
     *
     * @return the test path
     */
    public String getPath() {
        String canonicalName = getClass().getCanonicalName();
        return canonicalName != null ? canonicalName : getClass().getName();
    }

    /**
     * Runs the test body.
     *
     * <p>Failures are signalled by throwing, preferably a {@link UnitTestException}.
     *
     * @throws Exception if the test fails
     */
    public abstract void test() throws Exception;

    /**
     * Prepares the test. Called by {@link #run()} before {@link #test()}.
     *
     * @throws Exception if setup fails, which fails the test
     */
    protected void setup() throws Exception {
        // Default implementation does nothing
    }

    /**
     * Cleans up after the test. Called by {@link #run()} even when the test failed.
     *
     * @throws Exception if cleanup fails, which fails the test
     */
    protected void shutdown() throws Exception {
        // Default implementation does nothing
    }

    /**
     * Gets the number of individual tests this test case stands for.
     *
     * @return the number of tests, 1 unless overridden
     */
    public int numTestsRun() {
        return 1;
    }

    /**
     * Runs the full lifecycle of this test case and records its failures.
     *
     * <p>Every failure of setup, test body or shutdown is turned into a failure
     * description, never propagated, so one failing test case cannot stop the run.
     * {@link VirtualMachineError}s are the exception and still propagate.
     *
     * @return the outcome of the test case
     */
    public TestOutcome run() {
        long startTime = System.currentTimeMillis();
        List<String> failures = new ArrayList<>();

        try {
            setup();
            test();
        } catch (UnitTestException exception) {
            failures.addAll(describe(exception));
        } catch (VirtualMachineError error) {
            throw error;
        } catch (Throwable throwable) {
            failures.add(describe(throwable));
        } finally {
            try {
                shutdown();
            } catch (VirtualMachineError error) {
                throw error;
            } catch (Throwable throwable) {
                failures.add(getPath() + " failed during shutdown: " + throwable);
            }
        }

        return new TestOutcome(getPath(), failures, System.currentTimeMillis() - startTime, numTestsRun());
    }

    /**
     * Describes a failure signalled through the failure channel.
     *
     * @param exception the failure
     * @return one description per failure message
     */
    protected List<String> describe(UnitTestException exception) {
        List<String> descriptions = new ArrayList<>();
        for (String message : exception.getFailureMessages()) {
            descriptions.add(getPath() + " failed in " + exception.getLocation() + " - " + message);
        }
        return descriptions;
    }

    /**
     * Describes a failure thrown outside the failure channel.
     *
     * @param throwable the failure
     * @return the description
     */
    protected String describe(Throwable throwable) {
        StackTraceElement[] stackTrace = throwable.getStackTrace();
        String location = stackTrace.length > 0
                ? stackTrace[0].getFileName() + ":" + stackTrace[0].getLineNumber()
                : "unknown:0";
        return getPath() + " failed with " + throwable.getClass().getName()
                + " in " + location + " - " + throwable.getMessage();
    }

    @Override
    public final boolean equals(Object other) {
        return this == other;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{path='" + getPath() + "'}";
    }

}

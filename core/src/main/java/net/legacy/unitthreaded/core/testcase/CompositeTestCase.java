package net.legacy.unitthreaded.core.testcase;

import com.google.common.base.Preconditions;
import net.legacy.unitthreaded.foundation.exception.UnitTestException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Test case running the single-threaded tests of one module, one after the other.
 *
 * <p>Every child runs its full lifecycle even when an earlier child failed; the failures
 * of all children are reported together. Two callers running the same composite at the
 * same time are serialized, so children never overlap.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 11:30
 */
public class CompositeTestCase extends TestCase {

    private final String moduleName;
    private final List<TestCase> tests = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public CompositeTestCase(String moduleName) {
        this.moduleName = moduleName;
    }

    /**
     * Appends a child test case.
     *
     * @param testCase the child, whose path must lie inside this composite's module
     * @throws IllegalArgumentException if the child belongs to another module
     */
    public void add(TestCase testCase) {
        Preconditions.checkArgument(testCase.getPath().startsWith(moduleName + "."),
                "Test %s does not belong to module %s", testCase.getPath(), moduleName);

        lock.lock();
        try {
            tests.add(testCase);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the children in insertion order.
     *
     * @return an unmodifiable snapshot of the children
     */
    public List<TestCase> getTests() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(tests));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getPath() {
        return moduleName;
    }

    @Override
    public int numTestsRun() {
        return getTests().size();
    }

    /**
     * Runs every child and raises one failure carrying all child failures.
     *
     * <p>The raised failure has no location of its own; each message already names
     * the child and where it failed.
     *
     * @throws UnitTestException if any child failed
     */
    @Override
    public void test() {
        List<String> failures = runChildren();
        if (!failures.isEmpty()) {
            throw new UnitTestException(failures, null, 0, null);
        }
    }

    /**
     * Runs every child and aggregates their outcomes.
     *
     * <p>Child failures are already described with the child's path, so they are
     * reported unchanged.
     *
     * @return the aggregated outcome
     */
    @Override
    public TestOutcome run() {
        long startTime = System.currentTimeMillis();
        List<String> failures = runChildren();
        return new TestOutcome(moduleName, failures, System.currentTimeMillis() - startTime, numTestsRun());
    }

    private List<String> runChildren() {
        lock.lock();
        try {
            List<String> failures = new ArrayList<>();
            for (TestCase test : tests) {
                failures.addAll(test.run().getFailures());
            }
            return failures;
        } finally {
            lock.unlock();
        }
    }

}

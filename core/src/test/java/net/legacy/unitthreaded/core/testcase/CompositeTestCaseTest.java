package net.legacy.unitthreaded.core.testcase;

import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.data.TestFunction;
import net.legacy.unitthreaded.foundation.check.Failures;
import net.legacy.unitthreaded.foundation.exception.UnitTestException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CompositeTestCaseTest {

    private static FunctionTestCase function(String name, TestFunction function) {
        return new FunctionTestCase(TestData.of(name, false, function));
    }

    @Test
    void pathIsTheModuleName() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testA", () -> {
        }));

        assertEquals("tests.composite", composite.getPath());
        assertEquals(1, composite.numTestsRun());
    }

    @Test
    void childFromAnotherModuleIsRejected() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");

        assertThrows(IllegalArgumentException.class, () -> composite.add(function("tests.other.testA", () -> {
        })));
        assertThrows(IllegalArgumentException.class, () -> composite.add(function("tests.compositeX.testA", () -> {
        })));
    }

    @Test
    void everyChildRunsAndAllFailuresAreAggregated() {
        List<String> calls = new ArrayList<>();
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testA", () -> {
            calls.add("A");
            Failures.fail("A failed");
        }));
        composite.add(function("tests.composite.testB", () -> calls.add("B")));
        composite.add(function("tests.composite.testC", () -> {
            calls.add("C");
            throw new IllegalStateException("C failed");
        }));

        UnitTestException failure = assertThrows(UnitTestException.class, composite::test);

        assertEquals(List.of("A", "B", "C"), calls);
        assertEquals(2, failure.getFailureMessages().size());
        assertTrue(failure.getFailureMessages().get(0).startsWith("tests.composite.testA failed"));
        assertTrue(failure.getFailureMessages().get(1).startsWith("tests.composite.testC failed"));
    }

    @Test
    void aggregatedFailureHasNoLocationOfItsOwn() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testA", () -> Failures.fail("A failed", "ModuleA.java", 7)));

        UnitTestException failure = assertThrows(UnitTestException.class, composite::test);

        assertEquals("unknown:0", failure.getLocation());
        assertEquals(List.of("tests.composite.testA failed in ModuleA.java:7 - A failed"), failure.getFailureMessages());
    }

    @Test
    void childWithFailingShutdownDoesNotStopLaterChildren() {
        List<String> calls = new ArrayList<>();
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(new TestCase() {
            @Override
            public void test() {
                calls.add("before");
            }

            @Override
            protected void shutdown() {
                throw new AssertionError("cleanup assertion");
            }

            @Override
            public String getPath() {
                return "tests.composite.testBadShutdown";
            }
        });
        composite.add(function("tests.composite.testAfter", () -> calls.add("after")));

        TestOutcome outcome = assertDoesNotThrow(composite::run);

        assertEquals(List.of("before", "after"), calls);
        assertEquals(List.of("tests.composite.testBadShutdown failed during shutdown: java.lang.AssertionError: cleanup assertion"),
                outcome.getFailures());
    }

    @Test
    void childWithFailingSetupIsReportedThroughTest() {
        List<String> calls = new ArrayList<>();
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(new TestCase() {
            @Override
            protected void setup() {
                throw new AssertionError("setup assertion");
            }

            @Override
            public void test() {
                calls.add("skipped");
            }

            @Override
            public String getPath() {
                return "tests.composite.testBadSetup";
            }
        });
        composite.add(function("tests.composite.testAfter", () -> calls.add("after")));

        UnitTestException failure = assertThrows(UnitTestException.class, composite::test);

        assertEquals(List.of("after"), calls);
        assertEquals(1, failure.getFailureMessages().size());
        assertTrue(failure.getFailureMessages().get(0).startsWith("tests.composite.testBadSetup failed with java.lang.AssertionError"));
    }

    @Test
    void runReturnsAggregatedOutcome() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testA", () -> Failures.fail("A failed")));
        composite.add(function("tests.composite.testB", () -> {
        }));

        TestOutcome outcome = composite.run();

        assertEquals("tests.composite", outcome.getPath());
        assertEquals(2, outcome.getTestsRun());
        assertEquals(1, outcome.getFailures().size());
    }

    @Test
    void passesWhenEveryChildPasses() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testA", () -> {
        }));

        assertDoesNotThrow(composite::test);
        assertTrue(composite.run().isSuccess());
    }

    @Test
    void childrenAreReturnedInInsertionOrder() {
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        FunctionTestCase first = function("tests.composite.testB", () -> {
        });
        FunctionTestCase second = function("tests.composite.testA", () -> {
        });
        composite.add(first);
        composite.add(second);

        assertEquals(List.of(first, second), composite.getTests());
        assertThrows(UnsupportedOperationException.class, () -> composite.getTests().clear());
    }

    @Test
    void concurrentRunsAreSerialized() throws Exception {
        AtomicInteger running = new AtomicInteger();
        List<Integer> observed = Collections.synchronizedList(new ArrayList<>());
        CompositeTestCase composite = new CompositeTestCase("tests.composite");
        composite.add(function("tests.composite.testSlow", () -> {
            observed.add(running.incrementAndGet());
            Thread.sleep(20);
            running.decrementAndGet();
        }));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TestOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return composite.run();
                }));
            }
            start.countDown();
            for (Future<TestOutcome> future : futures) {
                assertTrue(future.get(5, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of(1, 1, 1, 1), observed);
    }

}

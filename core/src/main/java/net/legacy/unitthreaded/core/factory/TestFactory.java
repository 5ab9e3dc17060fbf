package net.legacy.unitthreaded.core.factory;

import com.google.common.base.Preconditions;
import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.discovery.TestDiscoveryService;
import net.legacy.unitthreaded.core.discovery.TestDiscoveryServiceInterface;
import net.legacy.unitthreaded.core.registry.BuiltinTestRegistry;
import net.legacy.unitthreaded.core.registry.TestCaseRegistry;
import net.legacy.unitthreaded.core.selection.TestNames;
import net.legacy.unitthreaded.core.selection.TestSelector;
import net.legacy.unitthreaded.core.testcase.BuiltinTestCase;
import net.legacy.unitthreaded.core.testcase.CompositeTestCase;
import net.legacy.unitthreaded.core.testcase.FunctionTestCase;
import net.legacy.unitthreaded.core.testcase.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the test cases of a run.
 *
 * <p>Discovers the tests of the given modules, keeps the selected ones, constructs a
 * test case for each and adds the selected deferred inline tests. Single-threaded tests
 * of the same module end up in one {@link CompositeTestCase}, so they never run
 * concurrently with each other.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 15:00
 */
public class TestFactory {

    private static final Logger logger = LoggerFactory.getLogger(TestFactory.class);

    private final TestDiscoveryServiceInterface discoveryService;

    public TestFactory() {
        this(new TestDiscoveryService());
    }

    public TestFactory(TestDiscoveryServiceInterface discoveryService) {
        this.discoveryService = discoveryService;
    }

    /**
     * Creates the test cases of the given modules selected by the patterns.
     *
     * @param modules  the test module classes
     * @param patterns the selection patterns, empty for every visible test
     * @return the test cases in discovery order, deferred inline tests last, each instance once
     * @throws IllegalStateException    if a function-based test yields no test case
     * @throws IllegalArgumentException if a selected single-threaded test has no module part in
     *                                  its name, such as a test case class in the default package
     */
    public Set<TestCase> createTests(List<Class<?>> modules, List<String> patterns) {
        Set<TestCase> tests = new LinkedHashSet<>();
        Map<String, CompositeTestCase> composites = new HashMap<>();

        for (TestData data : discoveryService.getTestClassesAndFunctions(modules)) {
            if (!TestSelector.isWantedTest(data, patterns)) {
                continue;
            }

            TestCase test = createTestCase(data, composites);
            if (test != null) {
                tests.add(test);
            }
        }

        for (BuiltinTestCase builtin : BuiltinTestRegistry.getTests()) {
            if (TestSelector.isWantedTest(TestData.of(builtin.getPath()), patterns)) {
                tests.add(builtin);
            }
        }

        logger.debug("Created {} test cases from {} modules", tests.size(), modules.size());
        return tests;
    }

    /**
     * Constructs the test case of one test.
     *
     * <p>A single-threaded test goes into its module's composite, which is returned in
     * its place.
     *
     * @param data       the test
     * @param composites the composites of the current invocation, by module name
     * @return the test case, or {@code null} if a class-based test cannot be constructed
     */
    TestCase createTestCase(TestData data, Map<String, CompositeTestCase> composites) {
        TestCase test = createImpl(data);
        if (test == null) {
            logger.debug("Skipping {}, no test case could be constructed", data.getName());
            return null;
        }

        if (!data.isSingleThreaded()) {
            return test;
        }

        String moduleName = TestNames.getModuleName(data.getName());
        CompositeTestCase composite = composites.computeIfAbsent(moduleName, CompositeTestCase::new);
        composite.add(test);
        return composite;
    }

    private TestCase createImpl(TestData data) {
        TestCase test = data.isFunctionTest()
                ? new FunctionTestCase(data)
                : TestCaseRegistry.create(data.getName());

        Preconditions.checkState(test != null || !data.isFunctionTest(),
                "Could not create FunctionTestCase object for function %s", data.getName());
        return test;
    }

}

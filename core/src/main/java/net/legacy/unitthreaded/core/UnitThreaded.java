package net.legacy.unitthreaded.core;

import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.core.config.UnitThreadedConfiguration;
import net.legacy.unitthreaded.core.discovery.TestDiscoveryService;
import net.legacy.unitthreaded.core.factory.TestFactory;
import net.legacy.unitthreaded.core.runner.TestCaseRunner;
import net.legacy.unitthreaded.core.runtime.DeferringModuleUnitTester;
import net.legacy.unitthreaded.core.runtime.InlineTestRuntime;
import net.legacy.unitthreaded.core.runtime.ModuleInfoSource;
import net.legacy.unitthreaded.core.runtime.ReflectionsModuleInfoSource;
import net.legacy.unitthreaded.core.testcase.TestCase;
import net.legacy.unitthreaded.foundation.test.TestExecutionUtil;
import net.legacy.unitthreaded.foundation.test.TestResultSummary;
import net.legacy.unitthreaded.foundation.util.TestLogger;

import java.util.List;
import java.util.Set;

/**
 * Entry point of the test engine.
 *
 * <p>A typical run initializes once, so the inline tests of the process are either run
 * or deferred, then creates and runs the tests of its modules:
 * <pre>{@code
 * UnitThreaded.initialize();
 * TestResultSummary summary = UnitThreaded.runTests(UnitThreaded.findModules("com.example"), List.of());
 * }</pre>
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 17:00
 */
@UtilityClass
public class UnitThreaded {

    public static final String SUITE_NAME = "unit-threaded";

    private static volatile UnitThreadedConfiguration configuration = UnitThreadedConfiguration.defaults();

    /**
     * Initializes the engine with the configuration read from system properties.
     *
     * @return the result of the inline-test hook
     */
    public static boolean initialize() {
        return initialize(UnitThreadedConfiguration.fromSystemProperties());
    }

    /**
     * Initializes the engine, scanning the configured packages for inline tests.
     *
     * @param config the configuration
     * @return the result of the inline-test hook
     */
    public static boolean initialize(UnitThreadedConfiguration config) {
        return initialize(config, new ReflectionsModuleInfoSource(config.getInlineTestPackages()));
    }

    /**
     * Initializes the engine: installs the deferring inline-test hook and hands it the
     * modules of the source. Only the first initialization of the process runs the hook.
     *
     * @param config the configuration
     * @param source the modules carrying inline tests
     * @return the result of the inline-test hook
     * @throws IllegalStateException if an internal inline test fails with a checked exception
     */
    public static boolean initialize(UnitThreadedConfiguration config, ModuleInfoSource source) {
        configuration = config;

        if (InlineTestRuntime.hasRun()) {
            TestLogger.logDebug(SUITE_NAME, "Inline tests already handled", config.isDebugMode());
        } else {
            InlineTestRuntime.setModuleUnitTester(new DeferringModuleUnitTester(config.getInternalNamespace()));
        }

        try {
            return InlineTestRuntime.runModuleUnitTests(source);
        } catch (RuntimeException exception) {
            throw exception;
        } catch (Exception exception) {
            throw new IllegalStateException("Internal inline tests failed", exception);
        }
    }

    public static UnitThreadedConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Finds the {@link net.legacy.unitthreaded.foundation.annotation.TestModule} classes
     * in the given packages.
     *
     * @param basePackages the packages to scan
     * @return the module classes ordered by name
     */
    public static List<Class<?>> findModules(String... basePackages) {
        return new TestDiscoveryService().findTestModules(basePackages);
    }

    public static Set<TestCase> createTests(List<Class<?>> modules, List<String> patterns) {
        return new TestFactory().createTests(modules, patterns);
    }

    /**
     * Creates and runs the tests of the given modules.
     *
     * @param modules  the test module classes
     * @param patterns the selection patterns, empty for every visible test
     * @return the result summary, with the failure descriptions under {@code failures}
     */
    public static TestResultSummary runTests(List<Class<?>> modules, List<String> patterns) {
        TestCaseRunner runner = new TestCaseRunner(SUITE_NAME, createTests(modules, patterns));
        runner.getContext().setDebugMode(configuration.isDebugMode());
        return TestExecutionUtil.executeTestRunner(SUITE_NAME, runner);
    }

}

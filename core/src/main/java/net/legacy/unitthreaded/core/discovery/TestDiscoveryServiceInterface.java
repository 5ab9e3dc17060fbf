package net.legacy.unitthreaded.core.discovery;

import net.legacy.unitthreaded.core.data.TestData;

import java.util.List;

/**
 * Interface for discovering the tests of a set of modules.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 13:20
 */
public interface TestDiscoveryServiceInterface {

    /**
     * Discovers every test of the given modules.
     *
     * <p>The result lists the class-based tests of all modules first, then the
     * function-based tests, each group following the order of the modules.
     *
     * @param modules the test module classes
     * @return the discovered tests
     */
    List<TestData> getTestClassesAndFunctions(List<Class<?>> modules);

    /**
     * Discovers the class-based tests of one module.
     *
     * @param module the test module class
     * @return the class-based tests ordered by name
     */
    List<TestData> getTestClassNames(Class<?> module);

    /**
     * Discovers the function-based tests of one module.
     *
     * @param module the test module class
     * @return the function-based tests ordered by name
     */
    List<TestData> getTestFunctions(Class<?> module);

}

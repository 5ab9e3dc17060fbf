package net.legacy.unitthreaded.core.runtime;

import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.registry.BuiltinTestRegistry;
import net.legacy.unitthreaded.core.testcase.BuiltinTestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Module unit tester running the framework's own inline tests at once and deferring
 * every other module's inline tests into the {@link BuiltinTestRegistry}.
 *
 * <p>Deferred modules become {@link BuiltinTestCase}s named {@code <module>.unittest},
 * so they are selected and reported like any other test.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:20
 */
public class DeferringModuleUnitTester implements ModuleUnitTester {

    private static final Logger logger = LoggerFactory.getLogger(DeferringModuleUnitTester.class);

    static final String UNITTEST_SUFFIX = ".unittest";

    private final String internalNamespace;

    /**
     * @param internalNamespace name prefix of the modules whose inline tests run at once
     */
    public DeferringModuleUnitTester(String internalNamespace) {
        this.internalNamespace = internalNamespace;
    }

    /**
     * Runs or defers the unit tests of the given modules.
     *
     * @param modules the modules carrying inline test blocks
     * @return always true
     * @throws Exception the first failure of an internal module's inline tests
     */
    @Override
    public boolean runModuleUnitTests(List<ModuleInfo> modules) throws Exception {
        for (ModuleInfo module : modules) {
            if (module.getName().startsWith(internalNamespace)) {
                logger.debug("Running internal inline tests of {}", module.getName());
                module.getUnitTest().invoke();
                continue;
            }

            logger.debug("Deferring inline tests of {}", module.getName());
            BuiltinTestRegistry.register(new BuiltinTestCase(
                    TestData.of(module.getName() + UNITTEST_SUFFIX, false, module.getUnitTest())));
        }
        return true;
    }

    @Override
    public String toString() {
        return "DeferringModuleUnitTester{internalNamespace='" + internalNamespace + "'}";
    }

}

package net.legacy.unitthreaded.core.runtime;

import java.util.List;

/**
 * Hook deciding what happens with the inline tests of the process.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:00
 */
@FunctionalInterface
public interface ModuleUnitTester {

    /**
     * Handles the unit tests of the given modules.
     *
     * @param modules the modules carrying inline test blocks
     * @return true if the process may continue
     * @throws Exception if a module unit test that runs immediately fails
     */
    boolean runModuleUnitTests(List<ModuleInfo> modules) throws Exception;

}

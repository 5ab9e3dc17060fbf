package net.legacy.unitthreaded.core.runtime;

import com.google.common.annotations.VisibleForTesting;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Process-wide entry point for inline tests.
 *
 * <p>Holds the installed {@link ModuleUnitTester} and hands it the modules of the
 * process exactly once. Without an installed hook every inline block runs right away,
 * failures being logged and counted.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:10
 */
@UtilityClass
public class InlineTestRuntime {

    private static final Logger logger = LoggerFactory.getLogger(InlineTestRuntime.class);

    private static final ModuleUnitTester NATIVE_TESTER = InlineTestRuntime::runNatively;

    private static volatile ModuleUnitTester moduleUnitTester = NATIVE_TESTER;
    private static Boolean result;

    public static void setModuleUnitTester(ModuleUnitTester tester) {
        moduleUnitTester = tester == null ? NATIVE_TESTER : tester;
    }

    public static ModuleUnitTester getModuleUnitTester() {
        return moduleUnitTester;
    }

    /**
     * Hands the modules of the given source to the installed hook, once per process.
     *
     * <p>Later calls return the result of the first call without touching the source or
     * the hook. When the hook throws, the run still counts as done and its result as
     * {@code false}.
     *
     * @param source the modules carrying inline test blocks
     * @return the result of the hook
     * @throws Exception whatever the hook throws
     */
    public static synchronized boolean runModuleUnitTests(ModuleInfoSource source) throws Exception {
        if (result != null) {
            logger.debug("Inline tests already handled, skipping");
            return result;
        }

        result = Boolean.FALSE;
        List<ModuleInfo> modules = source.getModules();
        logger.debug("Handing {} modules with inline tests to {}", modules.size(), moduleUnitTester);

        result = moduleUnitTester.runModuleUnitTests(modules);
        return result;
    }

    public static synchronized boolean hasRun() {
        return result != null;
    }

    @VisibleForTesting
    public static synchronized void reset() {
        result = null;
        moduleUnitTester = NATIVE_TESTER;
    }

    private static boolean runNatively(List<ModuleInfo> modules) {
        int failures = 0;
        for (ModuleInfo module : modules) {
            try {
                module.getUnitTest().invoke();
            } catch (VirtualMachineError error) {
                throw error;
            } catch (Throwable throwable) {
                failures++;
                logger.error("Inline tests of {} failed", module.getName(), throwable);
            }
        }

        if (failures > 0) {
            logger.error("{}/{} modules FAILED inline tests", failures, modules.size());
        }
        return failures == 0;
    }

}

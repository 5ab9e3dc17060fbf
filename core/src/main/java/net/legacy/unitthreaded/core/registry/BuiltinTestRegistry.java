package net.legacy.unitthreaded.core.registry;

import com.google.common.annotations.VisibleForTesting;
import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.core.testcase.BuiltinTestCase;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-wide list of deferred inline test cases.
 *
 * <p>Filled once by the inline-test hook and read by every test factory invocation.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 12:20
 */
@UtilityClass
public class BuiltinTestRegistry {

    private static final List<BuiltinTestCase> BUILTIN_TESTS = new CopyOnWriteArrayList<>();

    public static void register(BuiltinTestCase testCase) {
        BUILTIN_TESTS.add(testCase);
    }

    /**
     * Gets the registered builtin test cases in registration order.
     *
     * @return a snapshot of the registered test cases
     */
    public static List<BuiltinTestCase> getTests() {
        return new ArrayList<>(BUILTIN_TESTS);
    }

    @VisibleForTesting
    public static void clear() {
        BUILTIN_TESTS.clear();
    }

}

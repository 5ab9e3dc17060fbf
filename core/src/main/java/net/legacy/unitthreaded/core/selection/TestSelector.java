package net.legacy.unitthreaded.core.selection;

import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.core.data.TestData;

import java.util.List;

/**
 * Decides which tests a run includes.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 12:00
 */
@UtilityClass
public class TestSelector {

    /**
     * Checks whether a test is selected by the given patterns.
     *
     * <p>Without patterns every test that is not hidden is selected. Otherwise a test is
     * selected when some pattern equals its name, which also selects hidden tests, or
     * when its name lies strictly below a pattern used as a package prefix and the test
     * is not hidden. A package prefix only matches when the rest of the name still
     * contains a dot, so {@code "a.b"} matches {@code "a.b.c"} but not {@code "a.bFoo"}.
     *
     * @param data     the test
     * @param patterns the selection patterns, possibly empty
     * @return true if the test is selected
     */
    public static boolean isWantedTest(TestData data, List<String> patterns) {
        if (patterns.isEmpty()) {
            return !data.isHidden();
        }

        for (String pattern : patterns) {
            if (pattern.equals(data.getName()) || matchesPackage(data, pattern)) {
                return true;
            }
        }

        return false;
    }

    private static boolean matchesPackage(TestData data, String pattern) {
        String name = data.getName();
        return !data.isHidden()
                && name.length() > pattern.length()
                && name.startsWith(pattern)
                && name.substring(pattern.length()).contains(".");
    }

}

package net.legacy.unitthreaded.core.testcase;

import com.google.common.base.Preconditions;
import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.data.TestFunction;

/**
 * Test case backed by a test function.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 10:30
 */
public class FunctionTestCase extends TestCase {

    private final String name;
    private final TestFunction function;

    /**
     * Creates a test case from a function-based test description.
     *
     * @param data the test description, must carry a test function
     * @throws IllegalArgumentException if the description has no test function
     */
    public FunctionTestCase(TestData data) {
        Preconditions.checkArgument(data.isFunctionTest(), "Test %s has no test function", data.getName());
        this.name = data.getName();
        this.function = data.getTest();
    }

    /**
     * Invokes the test function. Failures propagate unchanged.
     *
     * @throws Exception whatever the test function throws
     */
    @Override
    public void test() throws Exception {
        function.invoke();
    }

    @Override
    public String getPath() {
        return name;
    }

}

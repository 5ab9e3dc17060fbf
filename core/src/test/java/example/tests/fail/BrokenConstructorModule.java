package example.tests.fail;

import net.legacy.unitthreaded.core.testcase.TestCase;

public class BrokenConstructorModule {

    public static class Broken extends TestCase {
        public Broken() {
            throw new IllegalStateException("constructor failed");
        }

        @Override
        public void test() {
        }
    }

}

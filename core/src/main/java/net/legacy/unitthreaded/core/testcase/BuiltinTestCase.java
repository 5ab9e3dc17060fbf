package net.legacy.unitthreaded.core.testcase;

import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.selection.TestNames;
import net.legacy.unitthreaded.foundation.check.Failures;
import net.legacy.unitthreaded.foundation.exception.UnitTestException;

/**
 * Test case wrapping the inline test blocks of one module.
 *
 * <p>Inline blocks fail with whatever their code throws. This test case adapts every
 * such failure into a {@link UnitTestException} so builtin tests report exactly like
 * every other test case, source location included.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 11:10
 */
public class BuiltinTestCase extends FunctionTestCase {

    private final String moduleName;

    /**
     * Creates a builtin test case.
     *
     * @param data the test description, named {@code <module>.unittest}
     */
    public BuiltinTestCase(TestData data) {
        super(data);
        this.moduleName = TestNames.getModuleName(data.getName());
    }

    /**
     * Runs the inline blocks, re-signalling any failure through the failure channel.
     *
     * @throws UnitTestException if an inline block failed
     */
    @Override
    public void test() {
        try {
            super.test();
        } catch (UnitTestException exception) {
            Failures.fail(exception.getMessage(), exception.getSourceFile(), exception.getLine(), exception);
        } catch (VirtualMachineError error) {
            throw error;
        } catch (Throwable throwable) {
            StackTraceElement frame = findFailureFrame(throwable);
            String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName();

            if (frame == null) {
                Failures.fail(message, null, 0, throwable);
            } else {
                Failures.fail(message, frame.getFileName(), frame.getLineNumber(), throwable);
            }
        }
    }

    private StackTraceElement findFailureFrame(Throwable throwable) {
        StackTraceElement[] stackTrace = throwable.getStackTrace();

        for (StackTraceElement element : stackTrace) {
            if (element.getClassName().replace('$', '.').equals(moduleName)) {
                return element;
            }
        }

        return stackTrace.length > 0 ? stackTrace[0] : null;
    }

}

package net.legacy.unitthreaded.foundation.check;

import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.foundation.exception.UnitTestException;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry points into the framework's failure channel.
 *
 * <p>Assertion libraries and test bodies call these methods to fail a test. Every
 * method raises a {@link UnitTestException}; the ones without an explicit location
 * use the location of their caller.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 19:45
 */
@UtilityClass
public class Failures {

    private static final StackWalker STACK_WALKER = StackWalker.getInstance();

    /**
     * Fails the current test at the caller's location.
     *
     * @param message the failure message
     * @throws UnitTestException always
     */
    public static void fail(String message) {
        StackWalker.StackFrame caller = findCaller().orElse(null);
        if (caller == null) {
            throw new UnitTestException(message, null, 0);
        }
        throw new UnitTestException(message, caller.getFileName(), caller.getLineNumber());
    }

    /**
     * Fails the current test at the given location.
     *
     * @param message    the failure message
     * @param sourceFile the source file of the failure
     * @param line       the line number of the failure
     * @throws UnitTestException always
     */
    public static void fail(String message, String sourceFile, int line) {
        throw new UnitTestException(message, sourceFile, line);
    }

    /**
     * Fails the current test at the given location, keeping the original failure as cause.
     *
     * @param message    the failure message
     * @param sourceFile the source file of the failure
     * @param line       the line number of the failure
     * @param cause      the original failure
     * @throws UnitTestException always
     */
    public static void fail(String message, String sourceFile, int line, Throwable cause) {
        throw new UnitTestException(message, sourceFile, line, cause);
    }

    /**
     * Fails the current test when the condition does not hold.
     *
     * @param condition the condition to check
     * @param message   the failure message, a {@link String#format} pattern
     * @param replace   format arguments for the message
     * @throws UnitTestException if the condition is false
     */
    public static void check(boolean condition, String message, Object... replace) {
        if (!condition) {
            fail(String.format(message, replace));
        }
    }

    /**
     * Fails the current test when the two values are not equal.
     *
     * @param actual   the actual value
     * @param expected the expected value
     * @throws UnitTestException if the values differ
     */
    public static void checkEqual(Object actual, Object expected) {
        if (!Objects.equals(actual, expected)) {
            fail("Expected <" + expected + "> but got <" + actual + ">");
        }
    }

    private static Optional<StackWalker.StackFrame> findCaller() {
        String self = Failures.class.getName();
        return STACK_WALKER.walk(frames -> frames
                .filter(frame -> !frame.getClassName().equals(self))
                .findFirst());
    }

}

package net.legacy.unitthreaded.foundation.exception;

import lombok.Getter;

import java.util.List;

/**
 * The failure signal of the test framework.
 *
 * <p>A test fails by raising this exception, directly through
 * {@link net.legacy.unitthreaded.foundation.check.Failures} or through an assertion
 * library that reports into it. It carries the failure description together with the
 * source file and line of the failure so every test case, whatever its origin, can be
 * reported the same way.
 *
 * <p>Composite test cases raise a single instance holding the failure descriptions of
 * all of their failing children.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 19:30
 */
@Getter
public class UnitTestException extends RuntimeException {

    /**
     * The individual failure descriptions, at least one.
     */
    private final List<String> failureMessages;

    /**
     * The source file the failure was raised from, or {@code "unknown"}.
     */
    private final String sourceFile;

    /**
     * The line number the failure was raised from, or {@code 0} when unknown.
     */
    private final int line;

    /**
     * Constructs a new unit test exception.
     *
     * @param message    the failure message
     * @param sourceFile the source file of the failure
     * @param line       the line number of the failure
     */
    public UnitTestException(String message, String sourceFile, int line) {
        this(List.of(String.valueOf(message)), sourceFile, line, null);
    }

    /**
     * Constructs a new unit test exception adapted from another failure.
     *
     * @param message    the failure message
     * @param sourceFile the source file of the failure
     * @param line       the line number of the failure
     * @param cause      the original failure
     */
    public UnitTestException(String message, String sourceFile, int line, Throwable cause) {
        this(List.of(String.valueOf(message)), sourceFile, line, cause);
    }

    /**
     * Constructs a new unit test exception carrying several failure descriptions.
     *
     * @param failureMessages the failure descriptions, must not be empty
     * @param sourceFile      the source file of the failure
     * @param line            the line number of the failure
     * @param cause           the original failure, may be {@code null}
     */
    public UnitTestException(List<String> failureMessages, String sourceFile, int line, Throwable cause) {
        super(String.join("\n", failureMessages), cause);
        if (failureMessages.isEmpty()) {
            throw new IllegalArgumentException("A unit test failure needs at least one message");
        }
        this.failureMessages = List.copyOf(failureMessages);
        this.sourceFile = sourceFile == null ? "unknown" : sourceFile;
        this.line = line;
    }

    /**
     * Gets the failure location in {@code file:line} form.
     *
     * @return the failure location
     */
    public String getLocation() {
        return sourceFile + ":" + line;
    }

}

package net.legacy.unitthreaded.foundation.exception;

import lombok.Getter;

/**
 * Exception thrown when a test module named by the caller cannot be resolved.
 *
 * <p>This is a configuration error of the caller, not a test failure.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 19:30
 */
@Getter
public class ModuleResolutionException extends RuntimeException {

    private final String moduleName;

    /**
     * Constructs a new module resolution exception.
     *
     * @param moduleName the module name that could not be resolved
     * @param cause      the cause of the exception
     */
    public ModuleResolutionException(String moduleName, Throwable cause) {
        super("Unable to resolve test module: " + moduleName, cause);
        this.moduleName = moduleName;
    }

}

package net.legacy.unitthreaded.core.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the modules of the process that carry inline test blocks.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:00
 */
@FunctionalInterface
public interface ModuleInfoSource {

    /**
     * Gets the modules carrying inline test blocks.
     *
     * @return the modules, in the order their unit tests should run
     */
    List<ModuleInfo> getModules();

    /**
     * Creates a source over an explicit list of classes. Classes without inline blocks
     * are left out.
     *
     * @param moduleClasses the classes
     * @return the module source
     */
    static ModuleInfoSource of(Class<?>... moduleClasses) {
        return () -> {
            List<ModuleInfo> modules = new ArrayList<>();
            for (Class<?> moduleClass : moduleClasses) {
                ModuleInfo.fromClass(moduleClass).ifPresent(modules::add);
            }
            return modules;
        };
    }

}

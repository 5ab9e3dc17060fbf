package net.legacy.unitthreaded.core.runtime;

import net.legacy.unitthreaded.core.discovery.util.AnnotationScanner;
import net.legacy.unitthreaded.foundation.annotation.InlineTest;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Module source scanning packages for {@link InlineTest} methods.
 *
 * <p>Modules are returned ordered by class name.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:00
 */
public class ReflectionsModuleInfoSource implements ModuleInfoSource {

    private final List<String> basePackages;

    public ReflectionsModuleInfoSource(List<String> basePackages) {
        this.basePackages = List.copyOf(basePackages);
    }

    @Override
    public List<ModuleInfo> getModules() {
        Set<Class<?>> moduleClasses = new TreeSet<>(Comparator.comparing(Class::getName));
        for (String basePackage : basePackages) {
            for (Method method : AnnotationScanner.findAnnotatedMethods(basePackage, InlineTest.class)) {
                moduleClasses.add(method.getDeclaringClass());
            }
        }

        List<ModuleInfo> modules = new ArrayList<>();
        moduleClasses.forEach(moduleClass -> ModuleInfo.fromClass(moduleClass).ifPresent(modules::add));
        return modules;
    }

}

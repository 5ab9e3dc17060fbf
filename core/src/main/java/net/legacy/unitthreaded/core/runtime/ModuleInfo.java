package net.legacy.unitthreaded.core.runtime;

import lombok.Value;
import net.legacy.unitthreaded.core.data.TestFunction;
import net.legacy.unitthreaded.core.discovery.util.ReflectUtil;
import net.legacy.unitthreaded.foundation.annotation.InlineTest;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A module together with its module unit test, the sequence of its inline test blocks.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 14:00
 */
@Value
public class ModuleInfo {

    /**
     * The module name, the canonical name of the class declaring the inline blocks.
     */
    String name;

    /**
     * Runs the module's inline blocks in method-name order, stopping at the first failure.
     */
    TestFunction unitTest;

    /**
     * Builds the module information of a class from its {@link InlineTest} methods.
     *
     * <p>Methods that are not static or take parameters are ignored.
     *
     * @param moduleClass the class declaring the inline blocks
     * @return the module information, or empty if the class has no inline block
     */
    public static Optional<ModuleInfo> fromClass(Class<?> moduleClass) {
        List<Method> blocks = new ArrayList<>();
        for (Method method : moduleClass.getDeclaredMethods()) {
            if (method.isAnnotationPresent(InlineTest.class) && ReflectUtil.isStaticNoArg(method)) {
                blocks.add(method);
            }
        }

        if (blocks.isEmpty()) {
            return Optional.empty();
        }

        blocks.sort(Comparator.comparing(Method::getName));
        List<TestFunction> functions = new ArrayList<>();
        blocks.forEach(block -> functions.add(ReflectUtil.staticMethodFunction(block)));

        String canonicalName = moduleClass.getCanonicalName();
        String name = canonicalName != null ? canonicalName : moduleClass.getName();

        return Optional.of(new ModuleInfo(name, () -> {
            for (TestFunction function : functions) {
                function.invoke();
            }
        }));
    }

}

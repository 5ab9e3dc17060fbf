package net.legacy.unitthreaded.core.discovery;

import net.legacy.unitthreaded.core.data.TestData;
import net.legacy.unitthreaded.core.discovery.util.AnnotationScanner;
import net.legacy.unitthreaded.core.discovery.util.ReflectUtil;
import net.legacy.unitthreaded.core.registry.TestCaseRegistry;
import net.legacy.unitthreaded.core.testcase.TestCase;
import net.legacy.unitthreaded.foundation.annotation.DontTest;
import net.legacy.unitthreaded.foundation.annotation.HiddenTest;
import net.legacy.unitthreaded.foundation.annotation.InlineTest;
import net.legacy.unitthreaded.foundation.annotation.SingleThreaded;
import net.legacy.unitthreaded.foundation.annotation.TestModule;
import net.legacy.unitthreaded.foundation.annotation.UnitTest;
import net.legacy.unitthreaded.foundation.exception.ModuleResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reflective test discovery.
 *
 * <p>A module is a class. Its class-based tests are the module class itself when it
 * extends {@link TestCase}, plus every static member class extending {@link TestCase}.
 * Its function-based tests are its static zero-argument methods that are annotated
 * with {@link UnitTest} or whose name starts with {@code test}. {@link DontTest}
 * removes an entity from discovery and {@link InlineTest} methods are never function
 * tests.
 *
 * <p>Every class-based test found is registered in {@link TestCaseRegistry} so it can
 * be constructed by name later.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 13:20
 */
public class TestDiscoveryService implements TestDiscoveryServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TestDiscoveryService.class);

    private static final String TEST_METHOD_PREFIX = "test";

    @Override
    public List<TestData> getTestClassesAndFunctions(List<Class<?>> modules) {
        List<TestData> result = new ArrayList<>();
        modules.forEach(module -> result.addAll(getTestClassNames(module)));
        modules.forEach(module -> result.addAll(getTestFunctions(module)));

        logger.debug("Discovered {} tests in {} modules", result.size(), modules.size());
        return result;
    }

    @Override
    public List<TestData> getTestClassNames(Class<?> module) {
        List<Class<?>> candidates = new ArrayList<>();
        candidates.add(module);

        for (Class<?> member : module.getDeclaredClasses()) {
            if (Modifier.isStatic(member.getModifiers())) {
                candidates.add(member);
            }
        }

        List<TestData> result = new ArrayList<>();
        for (Class<?> candidate : candidates) {
            if (!TestCase.class.isAssignableFrom(candidate) || candidate.isAnnotationPresent(DontTest.class)) {
                continue;
            }

            String name = qualifiedName(candidate);
            TestCaseRegistry.registerClass(name, candidate.asSubclass(TestCase.class));
            result.add(TestData.builder()
                    .name(name)
                    .hidden(candidate.isAnnotationPresent(HiddenTest.class))
                    .singleThreaded(isSingleThreaded(module, candidate))
                    .build());
        }

        result.sort(Comparator.comparing(TestData::getName));
        return result;
    }

    @Override
    public List<TestData> getTestFunctions(Class<?> module) {
        String moduleName = qualifiedName(module);
        List<TestData> result = new ArrayList<>();

        for (Method method : module.getDeclaredMethods()) {
            if (!isTestFunction(method)) {
                continue;
            }

            result.add(TestData.builder()
                    .name(moduleName + "." + method.getName())
                    .hidden(method.isAnnotationPresent(HiddenTest.class))
                    .test(ReflectUtil.staticMethodFunction(method))
                    .singleThreaded(isSingleThreaded(module, method))
                    .build());
        }

        result.sort(Comparator.comparing(TestData::getName));
        return result;
    }

    /**
     * Finds the classes annotated with {@link TestModule} in the given packages.
     *
     * @param basePackages the packages to scan, sub-packages included
     * @return the module classes ordered by name
     */
    public List<Class<?>> findTestModules(String... basePackages) {
        Set<Class<?>> modules = new LinkedHashSet<>();
        for (String basePackage : basePackages) {
            modules.addAll(AnnotationScanner.findAnnotatedClasses(basePackage, TestModule.class));
        }

        List<Class<?>> result = new ArrayList<>(modules);
        result.sort(Comparator.comparing(Class::getName));
        return result;
    }

    /**
     * Resolves module classes from their binary names.
     *
     * @param moduleNames the class names
     * @return the module classes in the given order
     * @throws ModuleResolutionException if a name does not resolve to a class
     */
    public List<Class<?>> resolveModules(List<String> moduleNames) {
        List<Class<?>> result = new ArrayList<>();
        for (String moduleName : moduleNames) {
            try {
                result.add(Class.forName(moduleName));
            } catch (ClassNotFoundException | LinkageError exception) {
                throw new ModuleResolutionException(moduleName, exception);
            }
        }
        return result;
    }

    private static boolean isTestFunction(Method method) {
        if (method.isSynthetic() || !ReflectUtil.isStaticNoArg(method)) {
            return false;
        }
        if (method.isAnnotationPresent(DontTest.class) || method.isAnnotationPresent(InlineTest.class)) {
            return false;
        }
        return method.isAnnotationPresent(UnitTest.class) || method.getName().startsWith(TEST_METHOD_PREFIX);
    }

    private static boolean isSingleThreaded(Class<?> module, AnnotatedElement element) {
        return module.isAnnotationPresent(SingleThreaded.class) || element.isAnnotationPresent(SingleThreaded.class);
    }

    private static String qualifiedName(Class<?> type) {
        String canonicalName = type.getCanonicalName();
        return canonicalName != null ? canonicalName : type.getName();
    }

}

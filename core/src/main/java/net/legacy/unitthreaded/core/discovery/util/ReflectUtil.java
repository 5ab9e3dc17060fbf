package net.legacy.unitthreaded.core.discovery.util;

import com.google.common.collect.Sets;
import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.core.data.TestFunction;
import org.reflections.util.ClasspathHelper;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.Collection;
import java.util.List;

/**
 * Utility class for reflection-related operations.
 *
 * @author qwq-dev
 * @since 2025-07-03 13:00
 */
@UtilityClass
public class ReflectUtil {

    /**
     * Resolves the classpath URLs holding the given base packages.
     *
     * @param basePackages the fully qualified package names
     * @param classLoaders the class loaders used for resolving
     * @return the URLs, without duplicates
     */
    public static Collection<URL> resolveUrlsForPackages(List<String> basePackages, List<ClassLoader> classLoaders) {
        Collection<URL> urls = Sets.newHashSet();
        basePackages.forEach(basePackage -> urls.addAll(
                ClasspathHelper.forPackage(basePackage, classLoaders.toArray(new ClassLoader[0]))));
        return urls;
    }

    /**
     * Checks whether a method can be called as a test: static and without parameters.
     *
     * @param method the method
     * @return true if the method is static and takes no parameters
     */
    public static boolean isStaticNoArg(Method method) {
        return Modifier.isStatic(method.getModifiers()) && method.getParameterCount() == 0;
    }

    /**
     * Adapts a static zero-argument method into a test function.
     *
     * <p>The function throws what the method throws, not the reflective wrapper.
     *
     * @param method the static zero-argument method
     * @return the test function invoking the method
     */
    public static TestFunction staticMethodFunction(Method method) {
        method.setAccessible(true);
        return () -> {
            try {
                method.invoke(null);
            } catch (InvocationTargetException exception) {
                Throwable cause = exception.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw exception;
            }
        };
    }

}

package net.legacy.unitthreaded.core.discovery.util;

import lombok.experimental.UtilityClass;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.net.URL;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Utility class for scanning the classpath for annotated classes and methods.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-07-03 13:00
 */
@UtilityClass
public class AnnotationScanner {

    /**
     * Finds the classes annotated with the specified annotation within the given package
     * and its sub-packages.
     *
     * <p>Only classes inside the package are returned, even when the package shares a
     * classpath root with other code.
     *
     * @param basePackage     the base package to scan
     * @param annotationClass the annotation class to look for
     * @param classLoaders    optional class loaders used to locate the package
     * @return the annotated classes
     */
    public static Set<Class<?>> findAnnotatedClasses(String basePackage, Class<? extends Annotation> annotationClass,
                                                     ClassLoader... classLoaders) {
        return findAnnotatedClasses(ReflectUtil.resolveUrlsForPackages(List.of(basePackage), List.of(classLoaders)),
                basePackage, annotationClass);
    }

    /**
     * Finds the classes annotated with the specified annotation from the provided URLs.
     *
     * @param urls            the URLs to scan
     * @param basePackage     the package the result is restricted to
     * @param annotationClass the annotation class to look for
     * @return the annotated classes
     */
    public static Set<Class<?>> findAnnotatedClasses(Collection<URL> urls, String basePackage,
                                                     Class<? extends Annotation> annotationClass) {
        return reflections(urls, basePackage).getTypesAnnotatedWith(annotationClass);
    }

    /**
     * Finds the methods annotated with the specified annotation within the given package
     * and its sub-packages.
     *
     * @param basePackage     the base package to scan
     * @param annotationClass the annotation class to look for
     * @param classLoaders    optional class loaders used to locate the package
     * @return the annotated methods
     */
    public static Set<Method> findAnnotatedMethods(String basePackage, Class<? extends Annotation> annotationClass,
                                                   ClassLoader... classLoaders) {
        return reflections(ReflectUtil.resolveUrlsForPackages(List.of(basePackage), List.of(classLoaders)), basePackage)
                .getMethodsAnnotatedWith(annotationClass);
    }

    private static Reflections reflections(Collection<URL> urls, String basePackage) {
        return new Reflections(new ConfigurationBuilder()
                .setUrls(urls)
                .setScanners(Scanners.TypesAnnotated, Scanners.SubTypes, Scanners.MethodsAnnotated)
                .filterInputsBy(new FilterBuilder().includePackage(basePackage)));
    }

}

package net.legacy.unitthreaded.core.registry;

import com.google.common.annotations.VisibleForTesting;
import lombok.experimental.UtilityClass;
import net.legacy.unitthreaded.core.testcase.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide registry constructing test cases by qualified name.
 *
 * <p>Discovery registers every class-based test it finds; callers may register their
 * own constructors as well. A later registration under the same name replaces the
 * earlier one.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 12:20
 */
@UtilityClass
public class TestCaseRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TestCaseRegistry.class);

    private static final Map<String, Supplier<? extends TestCase>> CONSTRUCTORS = new ConcurrentHashMap<>();

    /**
     * Registers a constructor function under a qualified name.
     *
     * @param name        the qualified test name
     * @param constructor the constructor function, may return {@code null}
     */
    public static void register(String name, Supplier<? extends TestCase> constructor) {
        CONSTRUCTORS.put(name, constructor);
    }

    /**
     * Registers a test class under a qualified name, constructed through its
     * zero-argument constructor.
     *
     * @param name      the qualified test name
     * @param testClass the test class
     */
    public static void registerClass(String name, Class<? extends TestCase> testClass) {
        register(name, () -> instantiate(testClass));
    }

    public static boolean isRegistered(String name) {
        return CONSTRUCTORS.containsKey(name);
    }

    /**
     * Constructs the test case registered under a name.
     *
     * @param name the qualified test name
     * @return the new test case, or {@code null} if nothing is registered under the name
     * or the registered class cannot be instantiated
     * @throws IllegalStateException if the test class constructor itself throws
     */
    public static TestCase create(String name) {
        Supplier<? extends TestCase> constructor = CONSTRUCTORS.get(name);
        if (constructor == null) {
            logger.debug("No test case registered under {}", name);
            return null;
        }
        return constructor.get();
    }

    @VisibleForTesting
    public static void clear() {
        CONSTRUCTORS.clear();
    }

    private static TestCase instantiate(Class<? extends TestCase> testClass) {
        if (testClass.isInterface() || Modifier.isAbstract(testClass.getModifiers())) {
            logger.debug("Skipping abstract test class {}", testClass.getName());
            return null;
        }

        try {
            Constructor<? extends TestCase> constructor = testClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException exception) {
            logger.debug("Cannot instantiate test class {}: {}", testClass.getName(), exception.toString());
            return null;
        } catch (InvocationTargetException exception) {
            throw new IllegalStateException("Constructor of test class " + testClass.getName() + " failed",
                    exception.getCause());
        }
    }

}

package net.legacy.unitthreaded.core.config;

import com.google.common.base.Splitter;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Properties;

/**
 * Settings of the test engine.
 *
 * <p>Read from system properties by default:
 * <ul>
 *   <li>{@value #INTERNAL_NAMESPACE_PROPERTY}: name prefix of the modules whose inline
 *       tests run immediately, default {@value #DEFAULT_INTERNAL_NAMESPACE}</li>
 *   <li>{@value #INLINE_PACKAGES_PROPERTY}: comma separated packages scanned for inline
 *       tests, default none</li>
 *   <li>{@value #DEBUG_PROPERTY}: enables debug logging of runners, default false</li>
 * </ul>
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 16:30
 */
@Value
@Builder(toBuilder = true)
public class UnitThreadedConfiguration {

    public static final String INTERNAL_NAMESPACE_PROPERTY = "unitthreaded.internal-namespace";
    public static final String INLINE_PACKAGES_PROPERTY = "unitthreaded.inline-packages";
    public static final String DEBUG_PROPERTY = "unitthreaded.debug";

    public static final String DEFAULT_INTERNAL_NAMESPACE = "net.legacy.unitthreaded.";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    @Builder.Default
    String internalNamespace = DEFAULT_INTERNAL_NAMESPACE;

    @Builder.Default
    List<String> inlineTestPackages = List.of();

    @Builder.Default
    boolean debugMode = false;

    public static UnitThreadedConfiguration defaults() {
        return builder().build();
    }

    public static UnitThreadedConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set. Missing properties keep their default.
     *
     * @param properties the properties
     * @return the configuration
     */
    public static UnitThreadedConfiguration fromProperties(Properties properties) {
        UnitThreadedConfigurationBuilder builder = builder();

        String internalNamespace = properties.getProperty(INTERNAL_NAMESPACE_PROPERTY);
        if (internalNamespace != null && !internalNamespace.isBlank()) {
            builder.internalNamespace(internalNamespace.trim());
        }

        String inlinePackages = properties.getProperty(INLINE_PACKAGES_PROPERTY);
        if (inlinePackages != null) {
            builder.inlineTestPackages(LIST_SPLITTER.splitToList(inlinePackages));
        }

        String debug = properties.getProperty(DEBUG_PROPERTY);
        if (debug != null) {
            builder.debugMode(Boolean.parseBoolean(debug.trim()));
        }

        return builder.build();
    }

}

package net.legacy.unitthreaded.core.selection;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Helpers for dotted test names.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-03 12:00
 */
@UtilityClass
public class TestNames {

    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Joiner DOT_JOINER = Joiner.on('.');

    /**
     * Gets the module part of a qualified test name, that is every segment but the last.
     *
     * <p>{@code "tests.fail.composite.Test1"} gives {@code "tests.fail.composite"}.
     *
     * @param name the qualified test name
     * @return the module name
     * @throws IllegalArgumentException if the name has no module part
     */
    public static String getModuleName(String name) {
        List<String> segments = DOT_SPLITTER.splitToList(name);
        Preconditions.checkArgument(segments.size() > 1, "Test name %s has no module part", name);
        return DOT_JOINER.join(segments.subList(0, segments.size() - 1));
    }

}

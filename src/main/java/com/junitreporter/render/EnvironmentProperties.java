package com.junitreporter.render;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The environment metadata rendered into every {@code <properties>} block.
 *
 * The key set is fixed and its order stable; a key the JVM does not define is
 * rendered with an empty value rather than dropped.
 */
public final class EnvironmentProperties {

    public static final List<String> KEYS = List.of(
        "java.version",
        "java.vendor",
        "os.name",
        "os.arch",
        "os.version",
        "java.vm.version",
        "file.encoding"
    );

    private final Map<String, String> values;

    private EnvironmentProperties(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Snapshot of the running JVM's system properties for {@link #KEYS}. */
    public static EnvironmentProperties system() {
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : KEYS) {
            String v = System.getProperty(key);
            values.put(key, v != null ? v : "");
        }
        return new EnvironmentProperties(values);
    }

    /** Fixed values, in the given iteration order. Used where output must not depend on the JVM. */
    public static EnvironmentProperties of(Map<String, String> values) {
        return new EnvironmentProperties(new LinkedHashMap<>(values));
    }

    public Map<String, String> asMap() {
        return values;
    }
}

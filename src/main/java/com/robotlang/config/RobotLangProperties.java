package com.robotlang.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/** Settings from {@code robotlang.properties}; a system property of the same key wins. */
public record RobotLangProperties(
        int requiredGlobals,
        boolean rejectDuplicateProcedures,
        int maxSourceLength,
        int maxNestingDepth
) {

    public static final String RESOURCE = "robotlang.properties";

    public static final String REQUIRED_GLOBALS = "robotlang.globals.required";
    public static final String REJECT_DUPLICATE_PROCEDURES = "robotlang.procedures.rejectDuplicates";
    public static final String MAX_SOURCE_LENGTH = "robotlang.source.maxLength";
    public static final String MAX_NESTING_DEPTH = "robotlang.nesting.maxDepth";

    private static final Logger logger = LoggerFactory.getLogger(RobotLangProperties.class);

    public RobotLangProperties {
        if (requiredGlobals < 0) {
            throw new IllegalArgumentException(REQUIRED_GLOBALS + " must not be negative: " + requiredGlobals);
        }
        if (maxSourceLength < 0) {
            throw new IllegalArgumentException(MAX_SOURCE_LENGTH + " must not be negative: " + maxSourceLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException(MAX_NESTING_DEPTH + " must be positive: " + maxNestingDepth);
        }
    }

    public RobotLangProperties() {
        // 0 means no length limit
        this(4, false, 0, 256);
    }

    public static RobotLangProperties load() {
        Properties props = new Properties();
        try (InputStream in = RobotLangProperties.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        return from(props);
    }

    public static RobotLangProperties from(Properties props) {
        RobotLangProperties defaults = new RobotLangProperties();
        return new RobotLangProperties(
                intValue(props, REQUIRED_GLOBALS, defaults.requiredGlobals()),
                boolValue(props, REJECT_DUPLICATE_PROCEDURES, defaults.rejectDuplicateProcedures()),
                intValue(props, MAX_SOURCE_LENGTH, defaults.maxSourceLength()),
                intValue(props, MAX_NESTING_DEPTH, defaults.maxNestingDepth())
        );
    }

    private static String lookup(Properties props, String key) {
        String v = System.getProperty(key);
        if (v == null) v = props.getProperty(key);
        return v == null ? null : v.trim();
    }

    private static int intValue(Properties props, String key, int fallback) {
        String v = lookup(props, key);
        if (v == null || v.isEmpty()) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }

    private static boolean boolValue(Properties props, String key, boolean fallback) {
        String v = lookup(props, key);
        if (v == null || v.isEmpty()) return fallback;
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(key + " is not true/false: " + v);
    }
}

package com.mathdocx.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable settings shared by the parsers and the converter.
 *
 * <ul>
 *   <li>{@code maxDepth} - maximum nesting of groups, arguments, scripts and
 *       chained large operators (LaTeX) or elements (MathML). Deeper input fails with a parse error
 *       instead of exhausting the stack.</li>
 *   <li>{@code strict} - when true, unknown commands and elements raise
 *       {@link com.mathdocx.exception.UnsupportedConstructException}; when false
 *       (default) they degrade to literal text.</li>
 * </ul>
 *
 * <p>{@link #fromSystemProperties()} reads {@value #PROP_MAX_DEPTH} and
 * {@value #PROP_STRICT}; unset or invalid values keep the defaults.
 */
public final class ConverterConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConverterConfig.class);

    public static final String PROP_MAX_DEPTH = "mathdocx.maxDepth";
    public static final String PROP_STRICT = "mathdocx.strict";

    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final ConverterConfig DEFAULTS = builder().build();

    private final int maxDepth;
    private final boolean strict;

    private ConverterConfig(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.strict = builder.strict;
    }

    /**
     * Returns the default configuration (depth 64, lenient).
     *
     * @return the defaults
     */
    public static ConverterConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a configuration built from JVM system properties over the defaults.
     *
     * @return the configuration
     */
    public static ConverterConfig fromSystemProperties() {
        return builder()
            .maxDepth(getConfiguredMaxDepth())
            .strict(getConfiguredStrict())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean strict() {
        return strict;
    }

    /**
     * Returns a builder initialised with this configuration's values.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder().maxDepth(maxDepth).strict(strict);
    }

    @Override
    public String toString() {
        return "ConverterConfig{maxDepth=" + maxDepth + ", strict=" + strict + "}";
    }

    // ========== Configuration Helpers ==========

    private static int getConfiguredMaxDepth() {
        String value = System.getProperty(PROP_MAX_DEPTH);
        if (value != null) {
            try {
                int depth = Integer.parseInt(value.trim());
                if (depth > 0) {
                    return depth;
                }
                logger.warn("Ignoring non-positive {}={}, using {}", PROP_MAX_DEPTH, value, DEFAULT_MAX_DEPTH);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}, using {}", PROP_MAX_DEPTH, value, DEFAULT_MAX_DEPTH);
            }
        }
        return DEFAULT_MAX_DEPTH;
    }

    private static boolean getConfiguredStrict() {
        String value = System.getProperty(PROP_STRICT);
        if (value == null) {
            return false;
        }
        return switch (value.trim().toLowerCase()) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off", "" -> false;
            default -> {
                logger.warn("Ignoring invalid {}={}, using lenient mode", PROP_STRICT, value);
                yield false;
            }
        };
    }

    /**
     * Builder for {@link ConverterConfig}.
     */
    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean strict = false;

        private Builder() {}

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(this);
        }
    }
}

package io.surfworks.warploop.core;

import java.util.Locale;

/**
 * Configuration for compute-at map diagnostics.
 *
 * <p>Dumping is DISABLED by default. Set {@code WARPLOOP_DUMP_COMPUTE_AT_MAP=true}
 * (or the {@code warploop.dump.computeAtMap} system property), or use
 * {@link #enableDump()}, to log the full map at {@code INFO} every time a resolver
 * finishes building.
 */
public final class LoopMapConfig {

    /**
     * Environment variable to enable/disable the compute-at map dump.
     */
    public static final String ENV_DUMP = "WARPLOOP_DUMP_COMPUTE_AT_MAP";

    /**
     * Environment variable selecting the dump format.
     *
     * <p>Valid values: "text", "json"
     */
    public static final String ENV_DUMP_FORMAT = "WARPLOOP_DUMP_FORMAT";

    /**
     * System property overriding {@link #ENV_DUMP}.
     */
    public static final String PROP_DUMP = "warploop.dump.computeAtMap";

    /**
     * System property overriding {@link #ENV_DUMP_FORMAT}.
     */
    public static final String PROP_DUMP_FORMAT = "warploop.dump.format";

    /**
     * Output format of the compute-at map dump.
     */
    public enum DumpFormat {
        TEXT,
        JSON;

        /**
         * Parses a format name, falling back to {@link #TEXT} for null or unknown values.
         */
        public static DumpFormat parse(String value) {
            if (value == null || value.isBlank()) {
                return TEXT;
            }
            return "json".equals(value.trim().toLowerCase(Locale.ROOT)) ? JSON : TEXT;
        }
    }

    // Singleton state
    private static volatile boolean dumpEnabled = false;
    private static volatile DumpFormat format = DumpFormat.TEXT;
    private static volatile boolean initialized = false;

    private LoopMapConfig() {}

    /**
     * Check if the compute-at map dump is enabled.
     *
     * <p>System properties take precedence over environment variables.
     */
    public static boolean isDumpEnabled() {
        if (!initialized) {
            initialize();
        }
        return dumpEnabled;
    }

    public static DumpFormat getDumpFormat() {
        if (!initialized) {
            initialize();
        }
        return format;
    }

    /**
     * Enable the dump programmatically, keeping the configured format.
     */
    public static void enableDump() {
        enableDump(getDumpFormat());
    }

    public static void enableDump(DumpFormat dumpFormat) {
        format = dumpFormat;
        dumpEnabled = true;
        initialized = true;
    }

    /**
     * Disable the dump programmatically.
     */
    public static void disableDump() {
        if (!initialized) {
            initialize();
        }
        dumpEnabled = false;
    }

    private static synchronized void initialize() {
        if (initialized) return;

        String enabledValue = firstNonNull(System.getProperty(PROP_DUMP), System.getenv(ENV_DUMP));
        dumpEnabled = "true".equalsIgnoreCase(enabledValue) || "1".equals(enabledValue);
        format = DumpFormat.parse(firstNonNull(System.getProperty(PROP_DUMP_FORMAT), System.getenv(ENV_DUMP_FORMAT)));
        initialized = true;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    /**
     * Reset state (for testing).
     */
    static void reset() {
        initialized = false;
        dumpEnabled = false;
        format = DumpFormat.TEXT;
    }
}

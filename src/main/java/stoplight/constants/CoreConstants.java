package stoplight.constants;

/**
 * Library-wide defaults. The worker settings can be overridden at JVM start
 * with {@code -Dstoplight.worker.prefix=...} and {@code -Dstoplight.worker.daemon=false}.
 */
public final class CoreConstants {

    private CoreConstants() {}

    /* ────────────── Worker threads ────────────── */
    public static final String DEFAULT_NAME_PREFIX =
            System.getProperty("stoplight.worker.prefix", "Stoplight-Worker-");

    // Daemon by default: an un-joined worker must not hold the JVM open.
    public static final boolean DEFAULT_DAEMON =
            Boolean.parseBoolean(System.getProperty("stoplight.worker.daemon", "true"));
}

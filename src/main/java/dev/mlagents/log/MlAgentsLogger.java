package dev.mlagents.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized logging for the evaluation engine's integration layer. Everything logged here goes
 * through a single named logger so provider traffic can be turned up or down on its own.
 */
public final class MlAgentsLogger {
    private static final String LOGGER_NAME = "mlagents";

    /**
     * Get or create the mlagents logger
     *
     * <p>Note: this calls LoggerFactory which may initialize a global logger. Set your desired
     * logging globals before calling this method.
     */
    public static Logger get() {
        return LoggerFactory.getLogger(LOGGER_NAME);
    }

    public static void debug(String format, Object... args) {
        get().debug(format, args);
    }

    public static void info(String format, Object... args) {
        get().info(format, args);
    }

    public static void warn(String format, Object... args) {
        get().warn(format, args);
    }

    public static void error(String format, Object... args) {
        get().error(format, args);
    }

    private MlAgentsLogger() {}
}

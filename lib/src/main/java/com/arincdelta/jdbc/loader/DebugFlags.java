package com.arincdelta.jdbc.loader;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Opt-in FINE logging for the whole {@code com.arincdelta.jdbc} hierarchy. */
public final class DebugFlags {
    private static final String DEBUG_PROPERTY = "arincdelta.debug";
    /** Read only when the system property is unset. */
    private static final String DEBUG_ENV = "ARINCDELTA_DEBUG";
    private static final String ROOT_LOGGER = "com.arincdelta.jdbc";

    private DebugFlags() {}

    public static boolean isDebugEnabled() {
        String value = System.getProperty(DEBUG_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(DEBUG_ENV));
    }

    /** Raises the package logger to FINE when debugging was requested; otherwise leaves logging untouched. */
    public static void applyLogging() {
        if (!isDebugEnabled()) {
            return;
        }
        Logger logger = Logger.getLogger(ROOT_LOGGER);
        logger.setLevel(Level.FINE);
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
    }
}

package com.pyformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Hands out {@code java.util.logging} loggers, configuring the logging system on first use.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;

    /**
     * Initializes the logging system from {@code /logging.properties}, falling back to a plain
     * console setup when the resource is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureConsoleLogging();
            }
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            configureConsoleLogging();
        }
        initialized = true;
    }

    private static void configureConsoleLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }
}

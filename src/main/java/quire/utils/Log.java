package quire.utils;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Server log. One console handler, lines formatted as {@code HH:mm:ss.SSS [LEVEL] message}.
 * Debug output is off unless {@code debug: true} is configured.
 */
public class Log {
    private static final Logger logger = Logger.getLogger("Quire");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    static {
        logger.setUseParentHandlers(false);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                return String.format("%s [%s] %s%n", LocalTime.now().format(TIME), levelName(record.getLevel()), record.getMessage());
            }
        });
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    private static String levelName(Level level) {
        if (level == Level.SEVERE) return "ERROR";
        if (level == Level.WARNING) return "WARN";
        if (level == Level.INFO) return "INFO";
        return "DEBUG";
    }

    public static void setDebug(boolean enabled) {
        logger.setLevel(enabled ? Level.FINE : Level.INFO);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}

package alpha.waypoint.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    private static final Formatter MESSAGE_ONLY = new SimpleFormatter();
    
    /**
     * Create an AssertJ Tuple of a JUL level and a formatted message, for
     * comparison with {@link LogRecorder#assertContainsOnlyOnce}
     * and friends.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * @throws NullPointerException if {@code level} is {@code null}
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Returns the record's message with parameters substituted.
     * 
     * @param rec log record
     * @return the formatted message
     */
    public static String message(LogRecord rec) {
        return MESSAGE_ONLY.formatMessage(rec);
    }
    
    /**
     * Maps a {@code System.Logger} level to the JUL level that the JDK's
     * default logger binding publishes it as.
     * 
     * @param level to convert
     * @return the JUL level
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static Level toJUL(System.Logger.Level level) {
        return switch (requireNonNull(level)) {
            case ALL     -> Level.ALL;
            case TRACE   -> Level.FINER;
            case DEBUG   -> Level.FINE;
            case INFO    -> Level.INFO;
            case WARNING -> Level.WARNING;
            case ERROR   -> Level.SEVERE;
            case OFF     -> Level.OFF;
        };
    }
}

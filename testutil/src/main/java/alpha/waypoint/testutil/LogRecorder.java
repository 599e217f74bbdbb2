package alpha.waypoint.testutil;

import org.assertj.core.api.AbstractThrowableAssert;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static alpha.waypoint.testutil.LogRecords.rec;
import static alpha.waypoint.testutil.LogRecords.toJUL;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Records the log records of a logger, and its children, for assertions.<p>
 * 
 * Methods with an "assertRemove" prefix remove the earliest matching record,
 * so that a record is matched at most once and later assertions apply to what
 * is left. A record matches if its level is equal to the given level, and its
 * message starts with the given text.
 * 
 * <pre>{@code
 *     var logs = LogRecorder.startRecording(RouteTree.class);
 *     try {
 *         // Build a router with a shadowed route...
 *         logs.assertRemove(WARNING, "Regex segment")
 *             .assertNoProblem();
 *     } finally {
 *         logs.stopRecording();
 *     }
 * }</pre>
 * 
 * While recording, the logger's level is {@code ALL}; the previous level is
 * restored by {@link #stopRecording()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecorder extends Handler
{
    /**
     * The root logger name of the library.
     */
    public static final String ROOT_LOGGER = "alpha.waypoint";
    
    /**
     * Starts recording log records of all the library's loggers.
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return new LogRecorder(Logger.getLogger(ROOT_LOGGER));
    }
    
    /**
     * Starts recording log records of the given component's package.
     * 
     * @param component to extract package from
     * @return a new log recorder
     * @throws NullPointerException
     *             if {@code component} is {@code null}
     */
    public static LogRecorder startRecording(Class<?> component) {
        return new LogRecorder(Logger.getLogger(component.getPackageName()));
    }
    
    // JUL keeps only a weak reference to the logger
    private final Logger logger;
    private final Level restore;
    private final Deque<LogRecord> records;
    
    private LogRecorder(Logger logger) {
        this.logger = logger;
        this.restore = logger.getLevel();
        this.records = new ConcurrentLinkedDeque<>();
        setLevel(Level.ALL);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level of record
     * @param messageStartsWith message prefix of record
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        removeFirst(matcher(level, messageStartsWith));
        return this;
    }
    
    /**
     * Removes the matched record, which must also have a throwable of the
     * given type.
     * 
     * @param level of record
     * @param messageStartsWith message prefix of record
     * @param thr type of the record's throwable
     * @return an assert object of the throwable
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public AbstractThrowableAssert<?, ? extends Throwable> assertRemove(
            System.Logger.Level level, String messageStartsWith,
            Class<? extends Throwable> thr) {
        requireNonNull(thr);
        var rec = removeFirst(matcher(level, messageStartsWith)
                .and(r -> thr.isInstance(r.getThrown())));
        return assertThat(rec.getThrown());
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     * @throws AssertionError
     *             if a record has a throwable or a level greater than
     *             {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(r -> r.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(r -> r.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that exactly one record has the given level and message.
     * 
     * @param level of record
     * @param message of record
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(LogRecord::getLevel, LogRecords::message)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * {@return all records recorded so far, in order of publication}
     */
    public List<LogRecord> records() {
        return List.copyOf(records);
    }
    
    /**
     * Stops recording.
     */
    public void stopRecording() {
        logger.removeHandler(this);
        logger.setLevel(restore);
    }
    
    private static Predicate<LogRecord> matcher(System.Logger.Level level, String prefix) {
        var jul = toJUL(level);
        requireNonNull(prefix);
        return r -> r.getLevel().equals(jul) &&
                    LogRecords.message(r).startsWith(prefix);
    }
    
    private LogRecord removeFirst(Predicate<LogRecord> test) {
        var it = records.iterator();
        while (it.hasNext()) {
            var r = it.next();
            if (test.test(r)) {
                it.remove();
                return r;
            }
        }
        return fail("No log record matched, have: " +
                    records.stream().map(LogRecords::message).toList());
    }
    
    @Override
    public void publish(LogRecord record) {
        records.add(record);
    }
    
    @Override
    public void flush() {
        // Nothing buffered
    }
    
    @Override
    public void close() {
        // Nothing to release
    }
}

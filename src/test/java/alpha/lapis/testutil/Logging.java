package alpha.lapis.testutil;

import alpha.lapis.HttpServer;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.util.Arrays.stream;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Utils for test logging.<p>
 *
 * The server logs through {@code System.Logger}, which by default is backed
 * by {@code java.util.logging}. This class configures the backend and records
 * log records so that tests can assert what was logged.
 */
public final class Logging
{
    private Logging() {
        // Empty
    }

    /**
     * Set the logging level of all server components.
     *
     * @param level to set
     */
    public static void setLevel(System.Logger.Level level) {
        setLevel(HttpServer.class, level);
    }

    /**
     * Set the logging level of the given component's package (and
     * sub-packages).
     *
     * @param component class of package
     * @param level to set
     */
    public static void setLevel(Class<?> component, System.Logger.Level level) {
        Logger.getLogger(component.getPackageName()).setLevel(toJUL(level));
    }

    /**
     * Start recording log records of all server components.<p>
     *
     * The level of the logger is lowered to {@code ALL} for as long as the
     * recording is active; {@link Recorder#close()} restores it.
     *
     * @return a recorder
     */
    public static Recorder startRecording() {
        return startRecording(HttpServer.class);
    }

    /**
     * Start recording log records of the given component's package.
     *
     * @param component class of package
     * @return a recorder
     */
    public static Recorder startRecording(Class<?> component) {
        return new Recorder(Logger.getLogger(component.getPackageName()));
    }

    /**
     * Translate a {@code System.Logger.Level} to the JUL level of the same
     * severity.
     *
     * @param level to translate
     * @return the JUL level
     * @throws IllegalArgumentException if no match is found
     */
    public static Level toJUL(System.Logger.Level level) {
        requireNonNull(level);
        if (level == System.Logger.Level.ALL) {
            return Level.ALL;
        }
        if (level == System.Logger.Level.OFF) {
            return Level.OFF;
        }
        return stream(new Level[]{
                    Level.FINEST, Level.FINER, Level.FINE, Level.CONFIG,
                    Level.INFO, Level.WARNING, Level.SEVERE})
                .filter(l -> l.intValue() == level.getSeverity())
                .findAny().orElseThrow(() -> new IllegalArgumentException(
                        "No JUL match for this level: " + level));
    }

    /**
     * Records log records published to a logger.<p>
     *
     * Meant to be used in a try-with-resources block.
     */
    public static final class Recorder extends Handler implements AutoCloseable
    {
        private final Logger logger;
        private final Level before;
        private final Deque<LogRecord> records;
        private final CountDownLatch closed;
        private volatile Predicate<LogRecord> awaiting;
        private volatile CountDownLatch hit;

        Recorder(Logger logger) {
            this.logger = logger;
            this.before = logger.getLevel();
            this.records = new ConcurrentLinkedDeque<>();
            this.closed = new CountDownLatch(1);
            setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }

        /**
         * Returns all records published so far.
         *
         * @return all records published so far
         */
        public Stream<LogRecord> records() {
            return records.stream();
        }

        /**
         * Returns {@code true} if a record of the given level and message
         * prefix has been published.
         *
         * @param level of record
         * @param messageStartsWith message prefix
         * @return see JavaDoc
         */
        public boolean has(System.Logger.Level level, String messageStartsWith) {
            return records().anyMatch(matches(level, messageStartsWith));
        }

        /**
         * Wait at most 3 seconds for a record of the given level and message
         * prefix.
         *
         * @param level of record
         * @param messageStartsWith message prefix
         * @return {@code true} if found, otherwise {@code false}
         * @throws InterruptedException if interrupted while waiting
         */
        public boolean await(System.Logger.Level level, String messageStartsWith)
                throws InterruptedException
        {
            Predicate<LogRecord> test = matches(level, messageStartsWith);
            CountDownLatch cl = new CountDownLatch(1);
            synchronized (this) {
                if (records().anyMatch(test)) {
                    return true;
                }
                awaiting = test;
                hit = cl;
            }
            return cl.await(3, SECONDS);
        }

        private static Predicate<LogRecord> matches(System.Logger.Level level, String prefix) {
            final Level jul = toJUL(level);
            return r -> r.getLevel().equals(jul) &&
                        r.getMessage() != null &&
                        r.getMessage().startsWith(prefix);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            records.add(record);
            var t = awaiting;
            if (t != null && t.test(record)) {
                hit.countDown();
            }
        }

        @Override
        public void flush() {
            // Empty
        }

        @Override
        public void close() {
            if (closed.getCount() == 0) {
                return;
            }
            closed.countDown();
            logger.removeHandler(this);
            logger.setLevel(before);
        }
    }
}

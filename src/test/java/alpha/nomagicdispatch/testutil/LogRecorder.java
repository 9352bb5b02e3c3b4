package alpha.nomagicdispatch.testutil;

import alpha.nomagicdispatch.internal.Dispatcher;
import alpha.nomagicdispatch.transport.JdkTransport;
import org.assertj.core.api.AbstractThrowableAssert;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static alpha.nomagicdispatch.testutil.LogRecords.rec;
import static alpha.nomagicdispatch.testutil.LogRecords.toJUL;
import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A utility for asserting and optionally awaiting log records.<p>
 * 
 * Methods with an "assert" prefix throw an {@code AssertionError} if the
 * record can not be found. Methods with "await" in the name block waiting on
 * the record if it hasn't already been published, for at most 3 seconds.
 * Waiting is needed for records logged by server threads.<p>
 * 
 * Methods with "remove" in their name remove the earliest matching record,
 * so that subsequent assertions are limited to what is left behind.
 * 
 * <pre>{@code
 *   recorder.assertAwaitRemove(ERROR, "Error handling ", IOException.class);
 *   recorder.assertNoProblem();
 * }</pre>
 * 
 * Recording is implemented by adding a JUL handler to the logger of each
 * targeted package.
 * Create a recorder using {@link #startRecording()}, and stop it using
 * {@link #stopRecording()}.
 */
public final class LogRecorder
{
    /**
     * Starts recording the loggers of the dispatch and transport packages.
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return startRecording(Dispatcher.class, JdkTransport.class);
    }
    
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.
     * 
     * @param firstComponent at least one
     * @param more may be provided
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(c -> {
                    var rh = new RecordHandler(c);
                    rh.logger().addHandler(rh);
                    return rh;
                }).toArray(RecordHandler[]::new);
        return new LogRecorder(h);
    }
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     * 
     * @return an assert object of the throwable
     * 
     * @throws AssertionError
     *             if a match could not be found
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertRemove(System.Logger.Level level, String messageStartsWith,
           Class<? extends Throwable> thr)
    {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        requireNonNull(thr);
        var rec = assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith) &&
                thr.isInstance(r.getThrown()));
        return assertThat(rec.getThrown());
    }
    
    /**
     * Removes and returns a matched record immediately, or awaits its
     * arrival.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     * 
     * @return an assert object of the throwable
     * 
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws AssertionError
     *             on timeout (record not observed)
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertAwaitRemove(
               System.Logger.Level level, String messageStartsWith,
               Class<? extends Throwable> thr)
           throws InterruptedException
    {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        requireNonNull(thr);
        return assertAwait(r ->
                   r.getLevel().equals(jul) &&
                   r.getMessage().startsWith(messageStartsWith) &&
                   thr.isInstance(r.getThrown()))
              .assertRemove(level, messageStartsWith, thr);
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > java.util.logging.Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.<p>
     * 
     * The record's throwable, if present, has no effect.
     * 
     * @param level record's level predicate
     * @param message record's message predicate
     * 
     * @return this for chaining/fluency
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Stop recording log records.
     */
    public void stopRecording() {
        Stream.of(handlers).forEach(r -> r.logger().removeHandler(r));
    }
    
    private Stream<LogRecord> records() {
        return Stream.of(handlers)
                .flatMap(RecordHandler::recordsStream)
                .sorted(comparing(LogRecord::getInstant));
    }
    
    private LogRecord assertRemoveIf(Predicate<LogRecord> test) {
        LogRecord match = null;
        search: for (var h : handlers) {
            var it = h.recordsDeque().iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (test.test(r)) {
                    it.remove();
                    match = r;
                    break search;
                }
            }
        }
        assertNotNull(match);
        return match;
    }
    
    private LogRecorder assertAwait(Predicate<LogRecord> test)
                throws InterruptedException {
        var latch = new CountDownLatch(1);
        for (RecordHandler h : handlers) {
            h.monitor(rec -> {
                if (latch.getCount() > 0 && test.test(rec)) {
                    latch.countDown();
                }
            });
            if (latch.getCount() == 0) {
                return this;
            }
        }
        assertTrue(latch.await(3, SECONDS));
        return this;
    }
    
    private static final class RecordHandler extends Handler {
        // JUL holds loggers weakly; the handler would be lost with the logger
        private final Logger log;
        private final Deque<LogRecord> deq;
        private final List<Consumer<LogRecord>> mon;
        
        RecordHandler(Class<?> component) {
            log = Logger.getLogger(component.getPackageName());
            deq = new ConcurrentLinkedDeque<>();
            mon = new ArrayList<>();
            super.setLevel(java.util.logging.Level.ALL);
        }
        
        // Replays observed records, then subscribes to future ones
        synchronized void monitor(Consumer<LogRecord> consumer) {
            recordsStream().forEach(consumer);
            mon.add(consumer);
        }
        
        Logger logger() {
            return log;
        }
        
        Deque<LogRecord> recordsDeque() {
            return deq;
        }
        
        Stream<LogRecord> recordsStream() {
            return deq.stream();
        }
        
        @Override
        public synchronized void publish(LogRecord record) {
            deq.add(record);
            mon.forEach(c -> c.accept(record));
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}

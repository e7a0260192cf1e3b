package work.labsim.simulator.trace;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.MDC;

/**
 * Logback sink that queues raw records for the {@link SpanTracer}. The emitting thread never
 * takes a lock; nested emissions enqueue in call order.
 *
 * <p>Each interceptor tags its run through the {@link #RUN_KEY} MDC entry of the attaching
 * thread and only buffers records carrying its own tag. Several interceptors may share one
 * logger: its original level and additivity are saved by the first attach and restored by the
 * last detach.
 */
final class LogInterceptor extends UnsynchronizedAppenderBase<ILoggingEvent> {
    static final String RUN_KEY = "labsimRun";

    private static final String APPENDER_PREFIX = "LABSIM_RUNLOG_";
    private static final AtomicLong RUN_IDS = new AtomicLong();
    private static final Map<String, SharedLogger> SHARED = new HashMap<>();
    private static final ThreadLocal<Deque<String>> ACTIVE_RUNS = ThreadLocal.withInitial(ArrayDeque::new);

    private final Logger source;
    private final Level threshold;
    private final boolean propagate;
    private final String runId;
    private final Queue<LogRecord> buffer = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean detached = new AtomicBoolean(false);

    private LogInterceptor(Logger source, Level threshold, boolean propagate) {
        this.source = source;
        this.threshold = threshold;
        this.propagate = propagate;
        this.runId = "run-" + RUN_IDS.incrementAndGet();
    }

    static LogInterceptor attach(Logger source, Level threshold, boolean propagate) {
        var interceptor = new LogInterceptor(source, threshold, propagate);
        interceptor.setName(APPENDER_PREFIX + interceptor.runId);
        interceptor.setContext(source.getLoggerContext());
        interceptor.start();
        synchronized (SHARED) {
            var shared = SHARED.computeIfAbsent(source.getName(),
                name -> new SharedLogger(source.getLevel(), source.isAdditive()));
            shared.active.add(interceptor);
            shared.apply(source);
            source.addAppender(interceptor);
        }
        var runs = ACTIVE_RUNS.get();
        runs.addLast(interceptor.runId);
        MDC.put(RUN_KEY, interceptor.runId);
        return interceptor;
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (event == null || !event.getLevel().isGreaterOrEqual(threshold)) {
            return;
        }
        if (!runId.equals(event.getMDCPropertyMap().get(RUN_KEY))) {
            return;
        }
        Object[] rawArgs = event.getArgumentArray();
        List<Object> args = rawArgs == null ? List.of() : new ArrayList<>(Arrays.asList(rawArgs));
        buffer.add(new LogRecord(Severity.fromLogback(event.getLevel()), moduleOf(event.getLoggerName()), event.getMessage(), args));
    }

    List<LogRecord> drain() {
        var drained = new ArrayList<LogRecord>();
        LogRecord next;
        while ((next = buffer.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    void detach() {
        if (!detached.compareAndSet(false, true)) {
            return;
        }
        synchronized (SHARED) {
            source.detachAppender(this);
            var shared = SHARED.get(source.getName());
            if (shared != null) {
                shared.active.remove(this);
                if (shared.active.isEmpty()) {
                    source.setLevel(shared.savedLevel);
                    source.setAdditive(shared.savedAdditive);
                    SHARED.remove(source.getName());
                } else {
                    shared.apply(source);
                }
            }
        }
        stop();
        untag();
        buffer.clear();
    }

    // Only the attaching thread holds the tag; a detach from elsewhere leaves its MDC alone.
    private void untag() {
        var runs = ACTIVE_RUNS.get();
        if (!runs.remove(runId)) {
            return;
        }
        if (runs.isEmpty()) {
            MDC.remove(RUN_KEY);
            ACTIVE_RUNS.remove();
        } else {
            MDC.put(RUN_KEY, runs.peekLast());
        }
    }

    private static String moduleOf(String loggerName) {
        if (loggerName == null) {
            return "";
        }
        int dot = loggerName.lastIndexOf('.');
        return dot < 0 ? loggerName : loggerName.substring(dot + 1);
    }

    private static final class SharedLogger {
        private final Level savedLevel;
        private final boolean savedAdditive;
        private final List<LogInterceptor> active = new ArrayList<>();

        private SharedLogger(Level savedLevel, boolean savedAdditive) {
            this.savedLevel = savedLevel;
            this.savedAdditive = savedAdditive;
        }

        // Most verbose threshold wins; propagation stays on while any run asks for it.
        private void apply(Logger logger) {
            Level level = null;
            boolean additive = false;
            for (var interceptor : active) {
                if (level == null || interceptor.threshold.toInt() < level.toInt()) {
                    level = interceptor.threshold;
                }
                additive |= interceptor.propagate;
            }
            logger.setLevel(level);
            logger.setAdditive(additive);
        }
    }
}

package work.labsim.simulator.trace;

import ch.qos.logback.classic.Logger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import work.labsim.simulator.api.LogLevel;
import work.labsim.simulator.bus.EventBus;
import work.labsim.simulator.bus.Subscription;

/**
 * Turns BEFORE/AFTER lifecycle events into nested {@link Span}s and attributes captured log
 * records to the span that was open when they were drained.
 *
 * <p>One tracer per run. Acquire with try-with-resources; {@link #close()} may be called any
 * number of times. Records still buffered at release are discarded.
 */
public final class SpanTracer implements AutoCloseable {
    private final RunLog runLog = RunLog.open();
    private final Subscription subscription;
    private final LogInterceptor interceptor;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private int depth;

    public SpanTracer(EventBus bus, String topic, Logger logSource, LogLevel level) {
        this(bus, topic, logSource, level, false);
    }

    public SpanTracer(EventBus bus, String topic, Logger logSource, LogLevel level, boolean propagateLogs) {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(level, "level");
        if (level.captures()) {
            Objects.requireNonNull(logSource, "logSource");
            this.interceptor = LogInterceptor.attach(logSource, level.logbackLevel().orElseThrow(), propagateLogs);
        } else {
            this.interceptor = null;
        }
        this.subscription = bus.subscribe(topic, this::onMessage);
    }

    private void onMessage(Object message) {
        if (!(message instanceof LifecycleEvent event) || released.get()) {
            return;
        }
        if (event.phase() == Phase.BEFORE) {
            runLog.append(new Span(depth, event.payload()));
            depth++;
        } else {
            drainInto();
            depth = Math.max(depth - 1, 0);
        }
    }

    private void drainInto() {
        if (interceptor == null) {
            return;
        }
        var records = interceptor.drain();
        if (records.isEmpty()) {
            return;
        }
        runLog.last().ifPresent(span -> records.forEach(span::appendLog));
    }

    /**
     * Live read-only view; keeps growing until the run finishes.
     */
    public RunLog runLog() {
        return runLog;
    }

    public RunLog snapshot() {
        return runLog.snapshot();
    }

    public int depth() {
        return depth;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        subscription.release();
        if (interceptor != null) {
            interceptor.detach();
        }
    }

    @Override
    public void close() {
        release();
    }
}

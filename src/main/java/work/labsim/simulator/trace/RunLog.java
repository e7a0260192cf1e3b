package work.labsim.simulator.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered spans of one simulated run. Only the {@link SpanTracer} appends; everything else sees
 * a read-only view or a frozen {@link #snapshot()}.
 */
public final class RunLog implements Iterable<Span> {
    private final List<Span> spans;
    private final boolean frozen;

    private RunLog(List<Span> spans, boolean frozen) {
        this.spans = spans;
        this.frozen = frozen;
    }

    static RunLog open() {
        return new RunLog(new ArrayList<>(), false);
    }

    public static RunLog empty() {
        return new RunLog(List.of(), true);
    }

    public List<Span> spans() {
        return Collections.unmodifiableList(spans);
    }

    public int size() {
        return spans.size();
    }

    public boolean isEmpty() {
        return spans.isEmpty();
    }

    public Span get(int index) {
        return spans.get(index);
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<String> texts() {
        var texts = new ArrayList<String>(spans.size());
        for (var span : spans) {
            texts.add(span.text());
        }
        return texts;
    }

    Optional<Span> last() {
        return spans.isEmpty() ? Optional.empty() : Optional.of(spans.get(spans.size() - 1));
    }

    void append(Span span) {
        if (frozen) {
            throw new IllegalStateException("run log is frozen");
        }
        spans.add(span);
    }

    public RunLog snapshot() {
        if (frozen) {
            return this;
        }
        var copy = new ArrayList<Span>(spans.size());
        for (var span : spans) {
            copy.add(span.freeze());
        }
        return new RunLog(List.copyOf(copy), true);
    }

    @Override
    public Iterator<Span> iterator() {
        return spans().iterator();
    }
}

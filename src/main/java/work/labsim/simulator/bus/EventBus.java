package work.labsim.simulator.bus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Synchronous topic-based publish/subscribe channel. A publish invokes every listener of the
 * topic, in registration order, before returning.
 */
public final class EventBus {
    private final Map<String, List<Listener>> listeners = new ConcurrentHashMap<>();

    public Subscription subscribe(String topic, Consumer<Object> callback) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(callback, "callback");
        var listener = new Listener(topic, callback);
        listeners.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(listener);
        return listener;
    }

    public void publish(String topic, Object message) {
        var current = listeners.get(topic);
        if (current == null) {
            return;
        }
        for (var listener : current) {
            listener.callback.accept(message);
        }
    }

    public int subscriberCount(String topic) {
        var current = listeners.get(topic);
        return current == null ? 0 : current.size();
    }

    private final class Listener implements Subscription {
        private final String topic;
        private final Consumer<Object> callback;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Listener(String topic, Consumer<Object> callback) {
            this.topic = topic;
            this.callback = callback;
        }

        @Override
        public void release() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            var current = listeners.get(topic);
            if (current != null) {
                current.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}

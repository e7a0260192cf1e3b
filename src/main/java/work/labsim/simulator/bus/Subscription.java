package work.labsim.simulator.bus;

/**
 * Handle returned by {@link EventBus#subscribe}. Releasing is idempotent.
 */
public interface Subscription extends AutoCloseable {
    void release();

    boolean isActive();

    @Override
    default void close() {
        release();
    }
}

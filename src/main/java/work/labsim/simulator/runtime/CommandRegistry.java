package work.labsim.simulator.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Step handlers by command name.
 */
public final class CommandRegistry {
    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();

    public CommandRegistry register(String command, CommandHandler handler) {
        handlers.put(command, handler);
        return this;
    }

    public CommandHandler get(String command) {
        return command == null ? null : handlers.get(command);
    }
}

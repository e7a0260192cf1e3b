package work.labsim.simulator.runtime;

import java.util.List;
import java.util.Map;

/**
 * Where a step sits in the protocol (for error messages) and the nested steps it owns.
 */
public final class StepMeta {
    private final String path;
    private final List<Map<String, Object>> children;

    public StepMeta(String path, List<Map<String, Object>> children) {
        this.path = path == null ? "" : path;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public String path() {
        return path;
    }

    public List<Map<String, Object>> children() {
        return children;
    }

    public String childPath() {
        return path + ".steps";
    }
}

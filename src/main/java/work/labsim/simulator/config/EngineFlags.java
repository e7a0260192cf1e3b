package work.labsim.simulator.config;

/**
 * The two switches that decide which engine runs a protocol.
 *
 * @param v2Enabled  run protocols on the current engine
 * @param backcompat let the current engine run protocols that declare the legacy API level
 */
public record EngineFlags(boolean v2Enabled, boolean backcompat) {
    public static final EngineFlags DEFAULTS = new EngineFlags(true, false);
}

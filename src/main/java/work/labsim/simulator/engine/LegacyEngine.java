package work.labsim.simulator.engine;

import work.labsim.simulator.runtime.SimulationContext;

/**
 * Legacy engine generation. Its context is disconnected first so no state from an earlier
 * session leaks into the run.
 */
public final class LegacyEngine extends AbstractProtocolEngine {
    @Override
    public EngineGeneration generation() {
        return EngineGeneration.LEGACY;
    }

    @Override
    protected void onPrepared(SimulationContext ctx) {
        ctx.disconnect();
    }
}

package work.labsim.simulator.engine;

import work.labsim.simulator.runtime.SimulationContext;

/**
 * Current engine generation; a prepared context starts homed.
 */
public final class CurrentEngine extends AbstractProtocolEngine {
    @Override
    public EngineGeneration generation() {
        return EngineGeneration.CURRENT;
    }

    @Override
    protected void onPrepared(SimulationContext ctx) {
        ctx.home();
    }
}

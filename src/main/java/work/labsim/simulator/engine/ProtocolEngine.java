package work.labsim.simulator.engine;

import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.runtime.SimulationContext.CancellationToken;

/**
 * One generation of the protocol execution engine.
 *
 * <p>{@link #prepare} builds a fresh context for the run; callers attach their tracer to the
 * context's bus before calling {@link #execute}.
 */
public interface ProtocolEngine {
    EngineGeneration generation();

    SimulationContext prepare(ProtocolDescriptor descriptor, CancellationToken token);

    void execute(ProtocolDescriptor descriptor, SimulationContext ctx) throws Exception;
}

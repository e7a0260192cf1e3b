package work.labsim.simulator.engine;

import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.protocol.ProtocolKind;
import work.labsim.simulator.runtime.CommandRegistry;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.runtime.SimulationContext.CancellationToken;

abstract class AbstractProtocolEngine implements ProtocolEngine {
    @Override
    public SimulationContext prepare(ProtocolDescriptor descriptor, CancellationToken token) {
        var ctx = new SimulationContext(registryFor(descriptor.kind()), generation().namingStyle(), descriptor, token);
        onPrepared(ctx);
        return ctx;
    }

    /**
     * Generation-specific hardware setup before any tracer is attached.
     */
    protected abstract void onPrepared(SimulationContext ctx);

    @Override
    public void execute(ProtocolDescriptor descriptor, SimulationContext ctx) throws Exception {
        if (descriptor.kind() == ProtocolKind.JSON_INSTRUCTIONS) {
            JsonProtocolInterpreter.run(descriptor, ctx);
        } else {
            SourceProtocolInterpreter.run(descriptor, ctx);
        }
    }

    private static CommandRegistry registryFor(ProtocolKind kind) {
        return kind == ProtocolKind.JSON_INSTRUCTIONS ? JsonProtocolCommands.registry() : SourceProtocolCommands.registry();
    }
}

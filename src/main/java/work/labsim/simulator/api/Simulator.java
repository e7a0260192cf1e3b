package work.labsim.simulator.api;

import work.labsim.simulator.dispatch.ProtocolDispatcher;
import work.labsim.simulator.protocol.ProtocolParser;

/**
 * Public entry point for embedding the simulator: parse, dispatch, trace.
 *
 * <p>Failures surface as {@link work.labsim.simulator.error.SimulationException} subclasses;
 * execution failures carry the run log recorded up to the failure.
 */
public final class Simulator {
    private final ProtocolDispatcher dispatcher;

    public Simulator() {
        this(new ProtocolDispatcher());
    }

    public Simulator(ProtocolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public SimulationOutcome simulate(SimulationConfiguration configuration) {
        var descriptor = ProtocolParser.parse(configuration.source());
        return dispatcher.dispatch(
            descriptor,
            configuration.flags(),
            configuration.traceOptions(),
            configuration.cancellationToken().orElse(null)
        );
    }
}

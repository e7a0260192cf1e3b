package work.labsim.simulator.dispatch;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labsim.simulator.api.SimulationOutcome;
import work.labsim.simulator.bundle.BundleAssembler;
import work.labsim.simulator.bundle.BundleContents;
import work.labsim.simulator.config.EngineFlags;
import work.labsim.simulator.engine.CurrentEngine;
import work.labsim.simulator.engine.EngineGeneration;
import work.labsim.simulator.engine.LegacyEngine;
import work.labsim.simulator.engine.ProtocolEngine;
import work.labsim.simulator.error.ConfigurationException;
import work.labsim.simulator.error.ProtocolExecutionException;
import work.labsim.simulator.protocol.ApiLevel;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.protocol.ProtocolKind;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.runtime.SimulationContext.CancellationToken;
import work.labsim.simulator.runtime.SimulationContext.SimulationCancelledException;
import work.labsim.simulator.trace.LifecycleEvent;
import work.labsim.simulator.trace.SpanTracer;

/**
 * Picks the engine for a protocol, runs it under a {@link SpanTracer} and assembles a bundle
 * when the run qualifies for one.
 */
public final class ProtocolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ProtocolDispatcher.class);

    private final ProtocolEngine currentEngine;
    private final ProtocolEngine legacyEngine;

    public ProtocolDispatcher() {
        this(new CurrentEngine(), new LegacyEngine());
    }

    public ProtocolDispatcher(ProtocolEngine currentEngine, ProtocolEngine legacyEngine) {
        this.currentEngine = Objects.requireNonNull(currentEngine, "currentEngine");
        this.legacyEngine = Objects.requireNonNull(legacyEngine, "legacyEngine");
    }

    /**
     * Engine for the descriptor under the given flags. A protocol declaring the legacy API level
     * is refused while the current engine is enabled without backwards compatibility.
     */
    public ProtocolEngine select(ProtocolDescriptor descriptor, EngineFlags flags) {
        if (!flags.v2Enabled()) {
            return legacyEngine;
        }
        var declared = descriptor.declaredApiLevel();
        if (declared.isPresent() && declared.get() == ApiLevel.V1 && !flags.backcompat()) {
            throw new ConfigurationException(
                "Protocol " + descriptor.fileName() + " declares API level 1 but the current engine is enabled. "
                    + "Set apiLevel: \"2\" in the protocol metadata or disable useProtocolApi2.");
        }
        return currentEngine;
    }

    public SimulationOutcome dispatch(ProtocolDescriptor descriptor, EngineFlags flags, TraceOptions options) {
        return dispatch(descriptor, flags, options, null);
    }

    public SimulationOutcome dispatch(ProtocolDescriptor descriptor, EngineFlags flags, TraceOptions options, CancellationToken token) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(options, "options");
        var engine = select(descriptor, flags);
        log.debug("Simulating {} ({}) on the {} engine", descriptor.fileName(), descriptor.kind(), engine.generation());
        var logSource = logSourceFor(options);
        var ctx = engine.prepare(descriptor, token);
        try (var tracer = new SpanTracer(ctx.bus(), LifecycleEvent.TOPIC, logSource, options.logLevel(), options.propagateLogs())) {
            try {
                engine.execute(descriptor, ctx);
            } catch (SimulationCancelledException ex) {
                throw new ProtocolExecutionException(ProtocolExecutionException.CANCELLED,
                    "Simulation of " + descriptor.fileName() + " was cancelled", tracer.snapshot(), ex);
            } catch (Exception ex) {
                throw new ProtocolExecutionException(ProtocolExecutionException.EXECUTION_ERROR,
                    "Simulation of " + descriptor.fileName() + " failed: " + ex.getMessage(), tracer.snapshot(), ex);
            }
            return new SimulationOutcome(tracer.snapshot(), bundleFor(engine, descriptor, ctx));
        }
    }

    private static Optional<BundleContents> bundleFor(ProtocolEngine engine, ProtocolDescriptor descriptor, SimulationContext ctx) {
        if (engine.generation() != EngineGeneration.CURRENT
            || descriptor.kind() != ProtocolKind.SOURCE
            || descriptor.hasBundledLabware()) {
            return Optional.empty();
        }
        return Optional.of(BundleAssembler.assemble(descriptor, ctx));
    }

    /**
     * Logback logger the run log captures from, or null when capture is off.
     */
    static ch.qos.logback.classic.Logger logSourceFor(TraceOptions options) {
        return options.logLevel().captures() ? stackLogger(options.stackLoggerName()) : null;
    }

    private static ch.qos.logback.classic.Logger stackLogger(String name) {
        var logger = LoggerFactory.getLogger(name);
        if (!(logger instanceof ch.qos.logback.classic.Logger logbackLogger)) {
            throw new ConfigurationException("Run-log capture needs Logback as the SLF4J backend, found " + logger.getClass().getName());
        }
        return logbackLogger;
    }
}

package work.labsim.simulator.runtime;

import java.util.Map;

/**
 * Executes one protocol step against the simulation context.
 */
@FunctionalInterface
public interface CommandHandler {
    void invoke(SimulationContext ctx, Map<String, Object> step, StepMeta meta) throws Exception;
}

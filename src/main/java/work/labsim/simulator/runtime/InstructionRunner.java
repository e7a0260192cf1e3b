package work.labsim.simulator.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs protocol steps sequentially. Each step names its handler under {@code command}; nested
 * {@code steps} are handed to the handler through {@link StepMeta}.
 */
public final class InstructionRunner {
    private InstructionRunner() {}

    public static void runSteps(SimulationContext ctx, List<Map<String, Object>> steps, String path) throws Exception {
        var safe = steps == null ? List.<Map<String, Object>>of() : steps;
        for (int index = 0; index < safe.size(); index++) {
            ctx.ensureNotCancelled();
            var step = safe.get(index);
            if (step == null) continue;
            var stepPath = path + "[" + index + "]";
            var command = Objects.toString(step.get("command"), null);
            var handler = ctx.registry().get(command);
            if (handler == null) {
                throw new StepFailureException(stepPath, String.valueOf(command), new IllegalArgumentException("Unknown command"));
            }
            try {
                handler.invoke(ctx, step, new StepMeta(stepPath, castStepList(step.get("steps"))));
            } catch (StepFailureException | SimulationContext.SimulationCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new StepFailureException(stepPath, command, ex);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> castStepList(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> steps = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                steps.add((Map<String, Object>) map);
            }
        }
        return steps;
    }
}

package work.labsim.simulator.engine;

import java.util.Map;
import work.labsim.simulator.runtime.CommandRegistry;
import work.labsim.simulator.runtime.SimulatedPipette;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.shared.DurationParser;

/**
 * Handlers for JSON instruction protocols; each command keeps its arguments under
 * {@code params}.
 */
final class JsonProtocolCommands {
    private JsonProtocolCommands() {}

    static CommandRegistry registry() {
        return new CommandRegistry()
            .register("pickUpTip", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).pickUpTip(StepParams.location(ctx, params));
            })
            .register("dropTip", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).dropTip(StepParams.optionalLocation(ctx, params));
            })
            .register("aspirate", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).aspirate(
                    StepParams.requireNumber(params, "volume"),
                    StepParams.location(ctx, params),
                    StepParams.number(params, "flowRate", 1.0));
            })
            .register("dispense", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).dispense(
                    StepParams.requireNumber(params, "volume"),
                    StepParams.location(ctx, params),
                    StepParams.number(params, "flowRate", 1.0));
            })
            .register("touchTip", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).touchTip(StepParams.optionalLocation(ctx, params));
            })
            .register("blowout", (ctx, step, meta) -> {
                var params = params(step);
                pipette(ctx, params).blowOut(StepParams.location(ctx, params));
            })
            .register("delay", (ctx, step, meta) -> delay(ctx, params(step)));
    }

    /**
     * {@code wait: <seconds>} delays; {@code wait: true} pauses, which a simulation reports as
     * its message.
     */
    private static void delay(SimulationContext ctx, Map<String, Object> params) {
        var wait = params.get("wait");
        if (Boolean.TRUE.equals(wait)) {
            var message = StepParams.string(params, "message");
            ctx.comment(message == null ? "Pausing until resumed" : message);
            return;
        }
        ctx.delay(DurationParser.ofSeconds(StepParams.requireNumber(params, "wait")));
    }

    private static SimulatedPipette pipette(SimulationContext ctx, Map<String, Object> params) {
        return ctx.pipette(StepParams.requireString(params, "pipette"));
    }

    private static Map<String, Object> params(Map<String, Object> step) {
        return StepParams.map(step, "params");
    }
}

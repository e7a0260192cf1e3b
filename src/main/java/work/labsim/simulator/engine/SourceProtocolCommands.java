package work.labsim.simulator.engine;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labsim.simulator.runtime.CommandRegistry;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.runtime.StepMeta;
import work.labsim.simulator.shared.DurationParser;

/**
 * Step handlers of protocol scripts.
 */
final class SourceProtocolCommands {
    private static final Logger scriptLog = LoggerFactory.getLogger("work.labsim.simulator.script");

    private SourceProtocolCommands() {}

    static CommandRegistry registry() {
        return new CommandRegistry()
            .register("pickUpTip", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).pickUpTip(StepParams.optionalLocation(ctx, step)))
            .register("dropTip", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).dropTip(StepParams.optionalLocation(ctx, step)))
            .register("aspirate", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).aspirate(
                    StepParams.requireNumber(step, "volume"),
                    StepParams.location(ctx, step),
                    StepParams.number(step, "rate", 1.0)))
            .register("dispense", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).dispense(
                    StepParams.number(step, "volume"),
                    StepParams.location(ctx, step),
                    StepParams.number(step, "rate", 1.0)))
            .register("touchTip", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).touchTip(StepParams.optionalLocation(ctx, step)))
            .register("blowout", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).blowOut(StepParams.optionalLocation(ctx, step)))
            .register("mix", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).mix(
                    repetitions(step),
                    StepParams.requireNumber(step, "volume"),
                    StepParams.location(ctx, step),
                    StepParams.number(step, "rate", 1.0)))
            .register("transfer", (ctx, step, meta) ->
                ctx.pipette(StepParams.requireString(step, "pipette")).transfer(
                    StepParams.requireNumber(step, "volume"),
                    StepParams.location(ctx, StepParams.map(step, "source")),
                    StepParams.location(ctx, StepParams.map(step, "dest")),
                    StepParams.number(step, "rate", 1.0)))
            .register("delay", (ctx, step, meta) -> ctx.delay(delayOf(step)))
            .register("comment", (ctx, step, meta) -> ctx.comment(StepParams.string(step, "message")))
            .register("home", (ctx, step, meta) -> ctx.homeCommand())
            .register("repeat", SourceProtocolCommands::repeat)
            .register("log", (ctx, step, meta) -> log(step))
            .register("loadLabware", (ctx, step, meta) -> SourceProtocolInterpreter.loadLabware(ctx, step));
    }

    private static void repeat(SimulationContext ctx, Map<String, Object> step, StepMeta meta) throws Exception {
        var times = StepParams.integer(step, "times");
        if (times == null || times < 0) {
            throw new IllegalArgumentException("repeat requires a non-negative 'times'");
        }
        for (int i = 0; i < times; i++) {
            ctx.runChildren(meta);
        }
    }

    private static void log(Map<String, Object> step) {
        var message = StepParams.requireString(step, "message");
        var level = StepParams.string(step, "level");
        switch (level == null ? "info" : level.toLowerCase(Locale.ROOT)) {
            case "debug":
                scriptLog.debug(message);
                break;
            case "warn":
            case "warning":
                scriptLog.warn(message);
                break;
            case "error":
                scriptLog.error(message);
                break;
            case "info":
                scriptLog.info(message);
                break;
            default:
                throw new IllegalArgumentException("Unsupported log level: " + level);
        }
    }

    private static int repetitions(Map<String, Object> step) {
        var repetitions = StepParams.integer(step, "repetitions");
        return repetitions == null ? 1 : repetitions;
    }

    private static Duration delayOf(Map<String, Object> step) {
        var duration = StepParams.string(step, "duration");
        if (duration != null) {
            return DurationParser.parse(duration)
                .orElseThrow(() -> new IllegalArgumentException("delay requires a duration"));
        }
        double seconds = StepParams.number(step, "seconds", 0.0) + 60.0 * StepParams.number(step, "minutes", 0.0);
        return DurationParser.ofSeconds(seconds);
    }
}

package work.labsim.simulator.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.labsim.simulator.api.LogLevel;
import work.labsim.simulator.config.EngineFlags;
import work.labsim.simulator.engine.EngineGeneration;
import work.labsim.simulator.error.ConfigurationException;
import work.labsim.simulator.error.ProtocolExecutionException;
import work.labsim.simulator.format.RunLogFormatter;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.support.LogbackSupport;
import work.labsim.simulator.support.ProtocolFixtures;
import work.labsim.simulator.trace.Severity;
import work.labsim.simulator.trace.Span;

class ProtocolDispatcherTest {
    private static final EngineFlags V2 = new EngineFlags(true, false);
    private static final EngineFlags V2_BACKCOMPAT = new EngineFlags(true, true);
    private static final EngineFlags LEGACY = new EngineFlags(false, false);

    private final ProtocolDispatcher dispatcher = new ProtocolDispatcher();

    @Test
    void selectsEngineFromFlagsAndDeclaredLevel() {
        var v2 = ProtocolFixtures.descriptor("flat_v2.yaml");
        var v1 = ProtocolFixtures.descriptor("legacy_v1.yaml");
        var json = ProtocolFixtures.descriptor("simple.json");

        assertEquals(EngineGeneration.CURRENT, dispatcher.select(v2, V2).generation());
        assertEquals(EngineGeneration.CURRENT, dispatcher.select(json, V2).generation());
        assertEquals(EngineGeneration.CURRENT, dispatcher.select(v1, V2_BACKCOMPAT).generation());
        assertEquals(EngineGeneration.LEGACY, dispatcher.select(v1, LEGACY).generation());
        assertEquals(EngineGeneration.LEGACY, dispatcher.select(v2, LEGACY).generation());
        assertEquals(EngineGeneration.LEGACY, dispatcher.select(json, new EngineFlags(false, true)).generation());
    }

    @Test
    void refusesLegacyLevelWithoutBackcompat() {
        var logger = LogbackSupport.logger(TraceOptions.DEFAULT_STACK_LOGGER);
        var appenders = LogbackSupport.appenderNames(logger);
        var level = logger.getLevel();

        var ex = assertThrows(ConfigurationException.class,
            () -> dispatcher.dispatch(ProtocolFixtures.descriptor("legacy_v1.yaml"), V2, TraceOptions.defaults()));

        assertTrue(ex.getMessage().contains("apiLevel"));
        assertEquals(appenders, LogbackSupport.appenderNames(logger));
        assertEquals(level, logger.getLevel());
    }

    @Test
    void absentLevelInScriptsMeansLegacy() {
        var descriptor = ProtocolFixtures.descriptor("no_metadata.yaml");
        assertThrows(ConfigurationException.class, () -> dispatcher.select(descriptor, V2));
        var outcome = dispatcher.dispatch(descriptor, LEGACY, TraceOptions.defaults());
        assertEquals(List.of("hello from a script"), outcome.runLog().texts());
    }

    @Test
    void flatProtocolGivesLevelZeroSpans() {
        var outcome = dispatcher.dispatch(ProtocolFixtures.descriptor("flat_v2.yaml"), V2, TraceOptions.defaults());
        var runLog = outcome.runLog();
        assertEquals(4, runLog.size());
        runLog.forEach(span -> assertEquals(0, span.level()));
        assertTrue(runLog.isFrozen());
    }

    @Test
    void transferGivesOneParentAndFourChildren() {
        var outcome = dispatcher.dispatch(ProtocolFixtures.descriptor("transfer_v2.yaml"), V2, TraceOptions.defaults());
        var levels = outcome.runLog().spans().stream().map(Span::level).toList();
        assertEquals(List.of(0, 1, 1, 1, 1), levels);
        assertEquals(
            "Transferring 1.0 from A1 of Corning 96 Well Plate 360 µL Flat on 2 to A4 of Corning 96 Well Plate 360 µL Flat on 2\n"
                + "\tPicking up tip A1 of Opentrons 96 Tip Rack 300 µL on 1\n"
                + "\tAspirating 1.0 uL from A1 of Corning 96 Well Plate 360 µL Flat on 2 at 1.0 speed\n"
                + "\tDispensing 1.0 uL into A4 of Corning 96 Well Plate 360 µL Flat on 2\n"
                + "\tDropping tip A1 of Opentrons Fixed Trash on 12",
            RunLogFormatter.format(outcome.runLog()));
    }

    @Test
    void engineWarningsLandInTheCommandThatCausedThem() {
        var outcome = dispatcher.dispatch(ProtocolFixtures.descriptor("overflow_v2.yaml"), V2, TraceOptions.defaults());
        var aspirate = outcome.runLog().get(1);
        assertEquals(1, aspirate.logs().size());
        var record = aspirate.logs().get(0);
        assertEquals(Severity.WARNING, record.severity());
        assertEquals("SimulatedPipette", record.moduleName());
        assertTrue(record.formattedMessage().contains("400"));
        assertTrue(outcome.runLog().get(2).logs().isEmpty());
    }

    @Test
    void logLevelNoneCapturesNothing() {
        var outcome = dispatcher.dispatch(ProtocolFixtures.descriptor("overflow_v2.yaml"), V2, TraceOptions.of(LogLevel.NONE));
        outcome.runLog().forEach(span -> assertTrue(span.logs().isEmpty()));
    }

    @Test
    void logSourceIsOnlyResolvedWhenCapturing() {
        var stackLogger = "work.labsim.simulator.nocapture";
        assertNull(ProtocolDispatcher.logSourceFor(new TraceOptions(LogLevel.NONE, false, stackLogger)));
        assertEquals(stackLogger, ProtocolDispatcher.logSourceFor(new TraceOptions(LogLevel.ERROR, false, stackLogger)).getName());
    }

    @Test
    void scriptLogRecordsAttachToTheNextCompletedCommand() {
        var outcome = dispatcher.dispatch(ProtocolFixtures.descriptor("nested_v2.yaml"), V2, TraceOptions.defaults());
        var spans = outcome.runLog().spans();
        assertEquals("round", spans.get(2).text());
        assertEquals(1, spans.get(2).logs().size());
        assertEquals("script", spans.get(2).logs().get(0).moduleName());
        // the second record drains when the pick-up completes
        assertEquals(1, spans.get(3).logs().size());
    }

    @Test
    void failureCarriesThePartialRunLogAndRestoresTheLogger() {
        var logger = LogbackSupport.logger(TraceOptions.DEFAULT_STACK_LOGGER);
        var appenders = LogbackSupport.appenderNames(logger);
        var level = logger.getLevel();
        var additive = logger.isAdditive();

        var ex = assertThrows(ProtocolExecutionException.class,
            () -> dispatcher.dispatch(ProtocolFixtures.descriptor("failing_v2.yaml"), V2, TraceOptions.defaults()));

        assertEquals(ProtocolExecutionException.EXECUTION_ERROR, ex.code());
        assertFalse(ex.isCancellation());
        assertEquals(List.of("first"), ex.partialRunLog().texts());
        assertTrue(ex.partialRunLog().isFrozen());
        assertTrue(ex.getMessage().contains("steps[1]"));
        assertEquals(appenders, LogbackSupport.appenderNames(logger));
        assertEquals(level, logger.getLevel());
        assertEquals(additive, logger.isAdditive());
    }

    @Test
    void cancellationIsReportedAsCancelled() {
        var token = new SimulationContext.CancellationToken();
        token.cancel();
        var ex = assertThrows(ProtocolExecutionException.class,
            () -> dispatcher.dispatch(ProtocolFixtures.descriptor("flat_v2.yaml"), V2, TraceOptions.defaults(), token));
        assertTrue(ex.isCancellation());
        assertTrue(ex.partialRunLog().isEmpty());
    }

    @Test
    void bundleOnlyForScriptsOnTheCurrentEngine() {
        assertTrue(dispatcher.dispatch(ProtocolFixtures.descriptor("flat_v2.yaml"), V2, TraceOptions.defaults()).bundle().isPresent());
        assertFalse(dispatcher.dispatch(ProtocolFixtures.descriptor("simple.json"), V2, TraceOptions.defaults()).bundle().isPresent());
        assertFalse(dispatcher.dispatch(ProtocolFixtures.descriptor("flat_v2.yaml"), LEGACY, TraceOptions.defaults()).bundle().isPresent());
    }

    @Test
    void identicalRunsRenderIdentically() {
        var first = dispatcher.dispatch(ProtocolFixtures.descriptor("nested_v2.yaml"), V2, TraceOptions.defaults());
        var second = dispatcher.dispatch(ProtocolFixtures.descriptor("nested_v2.yaml"), V2, TraceOptions.defaults());
        assertEquals(RunLogFormatter.format(first.runLog()), RunLogFormatter.format(second.runLog()));
    }
}

package work.labsim.simulator.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.labsim.simulator.format.TemplateRenderer;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.runtime.NamingStyle;
import work.labsim.simulator.runtime.SimulationContext;
import work.labsim.simulator.runtime.StepFailureException;
import work.labsim.simulator.support.ProtocolFixtures;
import work.labsim.simulator.trace.LifecycleEvent;
import work.labsim.simulator.trace.Phase;

class ProtocolEngineTest {
    @Test
    void currentEngineStartsHomed() {
        var engine = new CurrentEngine();
        var ctx = engine.prepare(ProtocolFixtures.descriptor("flat_v2.yaml"), null);
        assertEquals(EngineGeneration.CURRENT, engine.generation());
        assertEquals(NamingStyle.CURRENT, ctx.namingStyle());
        assertTrue(ctx.isHomed());
    }

    @Test
    void legacyEngineStartsDisconnected() {
        var engine = new LegacyEngine();
        var ctx = engine.prepare(ProtocolFixtures.descriptor("legacy_v1.yaml"), null);
        assertEquals(NamingStyle.LEGACY, ctx.namingStyle());
        assertFalse(ctx.isConnected());
    }

    @Test
    void currentEngineRunsScripts() throws Exception {
        var texts = run(new CurrentEngine(), ProtocolFixtures.descriptor("flat_v2.yaml"));
        assertEquals(List.of(
            "Picking up tip A1 of Opentrons 96 Tip Rack 300 µL on 1",
            "Aspirating 10.0 uL from A1 of Corning 96 Well Plate 360 µL Flat on 2 at 1.0 speed",
            "Dispensing 10.0 uL into B1 of Corning 96 Well Plate 360 µL Flat on 2",
            "Dropping tip A1 of Opentrons Fixed Trash on 12"
        ), texts);
    }

    @Test
    void legacyEngineUsesLegacyWording() throws Exception {
        var texts = run(new LegacyEngine(), ProtocolFixtures.descriptor("legacy_v1.yaml"));
        assertEquals(List.of(
            "Picking up tip well A1 in \"1\"",
            "Delaying for 0:01:15",
            "Dropping tip well A1 in \"12\""
        ), texts);
    }

    @Test
    void jsonInstructionsRunOnEitherEngine() throws Exception {
        var descriptor = ProtocolFixtures.descriptor("simple.json");
        assertEquals(List.of(
            "Picking up tip A1 of Tiprack on 1",
            "Aspirating 5.0 uL from A1 of Plate on 2 at 3.0 speed",
            "Dispensing 5.0 uL into B1 of Plate on 2",
            "Delaying for 1m 30.0s",
            "Dropping tip A1 of Trash on 12"
        ), run(new CurrentEngine(), descriptor));
        assertEquals("Delaying for 0:01:30", run(new LegacyEngine(), descriptor).get(3));
    }

    @Test
    void scriptStepsCoverRepeatHomeMixAndDelay() throws Exception {
        var texts = run(new CurrentEngine(), ProtocolFixtures.descriptor("nested_v2.yaml"));
        assertEquals(List.of(
            "Homing",
            "round",
            "round",
            "Picking up tip A1 of Opentrons 96 Tip Rack 300 µL on 1",
            "Mixing 2 times with a volume of 50.0 uL",
            "Aspirating 50.0 uL from C3 of Corning 96 Well Plate 360 µL Flat on 5 at 1.0 speed",
            "Dispensing 50.0 uL into C3 of Corning 96 Well Plate 360 µL Flat on 5",
            "Aspirating 50.0 uL from C3 of Corning 96 Well Plate 360 µL Flat on 5 at 1.0 speed",
            "Dispensing 50.0 uL into C3 of Corning 96 Well Plate 360 µL Flat on 5",
            "Dropping tip A1 of Opentrons Fixed Trash on 12",
            "Delaying for 1m 30.0s"
        ), texts);
    }

    @Test
    void failingStepReportsItsPath() {
        var engine = new CurrentEngine();
        var descriptor = ProtocolFixtures.descriptor("failing_v2.yaml");
        var ctx = engine.prepare(descriptor, null);
        var ex = assertThrows(StepFailureException.class, () -> engine.execute(descriptor, ctx));
        assertEquals("steps[1]", ex.path());
    }

    @Test
    void unknownPipetteInScriptFails() {
        var engine = new CurrentEngine();
        var descriptor = ProtocolFixtures.inline("metadata: { apiLevel: '2' }\nsteps:\n  - { command: pickUpTip, pipette: ghost }\n");
        var ctx = engine.prepare(descriptor, null);
        var ex = assertThrows(StepFailureException.class, () -> engine.execute(descriptor, ctx));
        assertTrue(ex.getMessage().contains("ghost"));
    }

    private static List<String> run(ProtocolEngine engine, ProtocolDescriptor descriptor) throws Exception {
        SimulationContext ctx = engine.prepare(descriptor, null);
        List<String> texts = new ArrayList<>();
        ctx.bus().subscribe(LifecycleEvent.TOPIC, message -> {
            var event = (LifecycleEvent) message;
            if (event.phase() == Phase.BEFORE) {
                texts.add(TemplateRenderer.render(event.payload().get("text").toString(), event.payload()));
            }
        });
        engine.execute(descriptor, ctx);
        return texts;
    }
}

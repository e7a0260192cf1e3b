package work.labsim.simulator.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.runtime.InstructionRunner;
import work.labsim.simulator.runtime.LoadedLabware;
import work.labsim.simulator.runtime.PipetteModel;
import work.labsim.simulator.runtime.SimulationContext;

/**
 * Evaluates a protocol script: labware declarations, then instruments, then steps.
 */
final class SourceProtocolInterpreter {
    private SourceProtocolInterpreter() {}

    static void run(ProtocolDescriptor descriptor, SimulationContext ctx) throws Exception {
        var document = descriptor.document();
        for (var declaration : InstructionRunner.castStepList(document.get("labware"))) {
            loadLabware(ctx, declaration);
        }
        for (var declaration : InstructionRunner.castStepList(document.get("instruments"))) {
            loadInstrument(ctx, declaration);
        }
        InstructionRunner.runSteps(ctx, InstructionRunner.castStepList(document.get("steps")), "steps");
    }

    static LoadedLabware loadLabware(SimulationContext ctx, Map<String, Object> declaration) {
        var loadName = StepParams.requireString(declaration, "loadName");
        var slot = StepParams.requireString(declaration, "slot");
        var name = StepParams.string(declaration, "name");
        var definition = ctx.resolveLabware(loadName, StepParams.string(declaration, "namespace"), StepParams.integer(declaration, "version"));
        return ctx.loadLabware(name == null ? loadName : name, slot, definition, StepParams.string(declaration, "label"));
    }

    private static void loadInstrument(SimulationContext ctx, Map<String, Object> declaration) {
        var model = PipetteModel.fromName(StepParams.requireString(declaration, "model"));
        var name = StepParams.string(declaration, "name");
        var mount = StepParams.requireString(declaration, "mount");
        List<LoadedLabware> tipRacks = new ArrayList<>();
        for (var rack : StepParams.strings(declaration, "tipRacks")) {
            tipRacks.add(ctx.labware(rack));
        }
        ctx.loadInstrument(name == null ? mount : name, model, mount, tipRacks);
    }
}

package work.labsim.simulator.engine;

import java.util.List;
import java.util.Map;
import work.labsim.simulator.protocol.LabwareDefinition;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.runtime.InstructionRunner;
import work.labsim.simulator.runtime.PipetteModel;
import work.labsim.simulator.runtime.SimulationContext;

/**
 * Executes JSON instruction protocols. Labware entries reference either an embedded definition
 * ({@code definitionId}) or a library load name ({@code model}); pipettes are keyed by id.
 */
final class JsonProtocolInterpreter {
    private JsonProtocolInterpreter() {}

    static void run(ProtocolDescriptor descriptor, SimulationContext ctx) throws Exception {
        var document = descriptor.document();
        var definitions = StepParams.map(document, "labwareDefinitions");
        for (var entry : StepParams.map(document, "labware").entrySet()) {
            loadLabware(ctx, entry.getKey(), asMap(entry.getValue(), "labware " + entry.getKey()), definitions);
        }
        for (var entry : StepParams.map(document, "pipettes").entrySet()) {
            var pipette = asMap(entry.getValue(), "pipette " + entry.getKey());
            ctx.loadInstrument(
                entry.getKey(),
                PipetteModel.fromName(StepParams.requireString(pipette, "name")),
                StepParams.requireString(pipette, "mount"),
                List.of());
        }
        InstructionRunner.runSteps(ctx, InstructionRunner.castStepList(document.get("commands")), "commands");
    }

    private static void loadLabware(SimulationContext ctx, String id, Map<String, Object> entry, Map<String, Object> definitions) {
        var slot = StepParams.requireString(entry, "slot");
        var label = StepParams.string(entry, "displayName");
        var definitionId = StepParams.string(entry, "definitionId");
        LabwareDefinition definition;
        if (definitionId != null) {
            var document = definitions.get(definitionId);
            if (document == null) {
                throw new IllegalArgumentException("Labware " + id + " references unknown definition " + definitionId);
            }
            definition = new LabwareDefinition(asMap(document, "definition " + definitionId));
        } else {
            definition = ctx.resolveLabware(StepParams.requireString(entry, "model"), null, null);
        }
        ctx.loadLabware(id, slot, definition, label);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(what + " must be a mapping");
        }
        return (Map<String, Object>) map;
    }
}

package work.labsim.simulator.bundle;

import java.util.LinkedHashMap;
import java.util.Map;
import work.labsim.simulator.protocol.LabwareDefinition;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.runtime.SimulationContext;

/**
 * Collects what a finished run needs to be replayed on its own: the source text, one copy of
 * every labware type loaded (in load order) and the data the run had access to.
 */
public final class BundleAssembler {
    private BundleAssembler() {}

    public static BundleContents assemble(ProtocolDescriptor descriptor, SimulationContext ctx) {
        Map<String, LabwareDefinition> labware = new LinkedHashMap<>();
        for (var loaded : ctx.loadedLabware()) {
            labware.putIfAbsent(loaded.uri(), loaded.definition());
        }
        return new BundleContents(descriptor.rawText(), ctx.data(), labware, Map.of());
    }
}

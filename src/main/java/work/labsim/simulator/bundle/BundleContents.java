package work.labsim.simulator.bundle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.labsim.simulator.protocol.LabwareDefinition;

/**
 * Logical content of a protocol bundle. {@code bundledAuxiliaryModules} is reserved and
 * always empty for assembled bundles.
 */
public record BundleContents(
    String protocolSourceText,
    Map<String, byte[]> bundledData,
    Map<String, LabwareDefinition> bundledLabware,
    Map<String, String> bundledAuxiliaryModules
) {
    public BundleContents {
        Objects.requireNonNull(protocolSourceText, "protocolSourceText");
        bundledData = bundledData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bundledData));
        bundledLabware = bundledLabware == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bundledLabware));
        bundledAuxiliaryModules = bundledAuxiliaryModules == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(bundledAuxiliaryModules));
    }
}

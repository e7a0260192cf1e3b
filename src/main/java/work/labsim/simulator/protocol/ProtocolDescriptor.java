package work.labsim.simulator.protocol;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed protocol plus the external resources it may use.
 *
 * <p>{@code bundledLabware}/{@code bundledData} are present only for bundle archives; when
 * present they are the only resources the run may load.
 */
public record ProtocolDescriptor(
    ProtocolKind kind,
    Optional<ApiLevel> declaredApiLevel,
    String fileName,
    String rawText,
    Map<String, Object> document,
    List<Path> extraLabwarePaths,
    List<Path> extraDataPaths,
    Map<String, LabwareDefinition> extraLabware,
    Map<String, byte[]> extraData,
    Optional<Map<String, LabwareDefinition>> bundledLabware,
    Optional<Map<String, byte[]>> bundledData
) {
    public ProtocolDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(declaredApiLevel, "declaredApiLevel");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(bundledLabware, "bundledLabware");
        Objects.requireNonNull(bundledData, "bundledData");
        document = document == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(document));
        extraLabwarePaths = extraLabwarePaths == null ? List.of() : List.copyOf(extraLabwarePaths);
        extraDataPaths = extraDataPaths == null ? List.of() : List.copyOf(extraDataPaths);
        extraLabware = extraLabware == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraLabware));
        extraData = extraData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraData));
        bundledLabware = bundledLabware.map(map -> Collections.unmodifiableMap(new LinkedHashMap<>(map)));
        bundledData = bundledData.map(map -> Collections.unmodifiableMap(new LinkedHashMap<>(map)));
    }

    public boolean hasBundledLabware() {
        return bundledLabware.isPresent();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> metadata() {
        var metadata = document.get("metadata");
        return metadata instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    public String protocolName() {
        var name = metadata().get("protocolName");
        return name == null ? fileName : name.toString();
    }

    /**
     * Data visible to the protocol: the bundle's data when bundled, otherwise the external data.
     */
    public Map<String, byte[]> availableData() {
        return bundledData.orElse(extraData);
    }
}

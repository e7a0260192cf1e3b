package work.labsim.simulator.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import work.labsim.simulator.error.ResourceException;
import work.labsim.simulator.shared.DocumentReader;

/**
 * Built-in labware definitions shipped under {@code /labware/<loadName>.json}.
 */
public final class LabwareLibrary {
    private static final String RESOURCE_ROOT = "/labware/";
    private static final Map<String, Optional<LabwareDefinition>> CACHE = new ConcurrentHashMap<>();

    private LabwareLibrary() {}

    public static Optional<LabwareDefinition> find(String loadName, String namespace, Integer version) {
        if (loadName == null || loadName.isBlank() || !loadName.matches("[A-Za-z0-9_.-]+")) {
            return Optional.empty();
        }
        return CACHE.computeIfAbsent(loadName, LabwareLibrary::load)
            .filter(definition -> definition.matches(loadName, namespace, version));
    }

    private static Optional<LabwareDefinition> load(String loadName) {
        try (InputStream in = LabwareLibrary.class.getResourceAsStream(RESOURCE_ROOT + loadName + ".json")) {
            if (in == null) {
                return Optional.empty();
            }
            var document = DocumentReader.readJsonObject(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            return Optional.of(new LabwareDefinition(document));
        } catch (IOException | IllegalArgumentException ex) {
            throw new ResourceException("Built-in labware definition " + loadName + " is unreadable: " + ex.getMessage(), ex);
        }
    }
}

package work.labsim.simulator.protocol;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.labsim.simulator.bundle.BundleArchive;
import work.labsim.simulator.error.ProtocolParseException;
import work.labsim.simulator.shared.DocumentReader;

/**
 * Turns raw protocol content into a {@link ProtocolDescriptor}. External resources are loaded
 * here, so resource errors surface before anything is dispatched.
 */
public final class ProtocolParser {
    private ProtocolParser() {}

    public static ProtocolDescriptor parse(ProtocolSource source) {
        var extraLabware = ExternalResources.labwareFromPaths(source.labwarePaths());
        var extraData = ExternalResources.dataFromPaths(source.dataPaths());
        var kind = ProtocolKind.fromFileName(source.fileName());
        switch (kind) {
            case JSON_INSTRUCTIONS:
                return parseJson(source, extraLabware, extraData);
            case BUNDLE_ARCHIVE:
                return parseBundle(source, extraLabware, extraData);
            default:
                return parseSource(source, source.text(), extraLabware, extraData, Optional.empty(), Optional.empty(), ProtocolKind.SOURCE);
        }
    }

    private static ProtocolDescriptor parseSource(
        ProtocolSource source,
        String text,
        Map<String, LabwareDefinition> extraLabware,
        Map<String, byte[]> extraData,
        Optional<Map<String, LabwareDefinition>> bundledLabware,
        Optional<Map<String, byte[]>> bundledData,
        ProtocolKind kind
    ) {
        Map<String, Object> document;
        try {
            document = DocumentReader.readYamlObject(text);
        } catch (IOException ex) {
            throw new ProtocolParseException("Protocol " + source.fileName() + " is not a valid protocol script: " + ex.getMessage(), ex);
        }
        requireList(document, "steps", source.fileName());
        var apiLevel = declaredLevel(document).orElse(ApiLevel.V1);
        return new ProtocolDescriptor(
            kind,
            Optional.of(apiLevel),
            source.fileName(),
            text,
            document,
            source.labwarePaths(),
            source.dataPaths(),
            extraLabware,
            extraData,
            bundledLabware,
            bundledData
        );
    }

    private static ProtocolDescriptor parseJson(
        ProtocolSource source,
        Map<String, LabwareDefinition> extraLabware,
        Map<String, byte[]> extraData
    ) {
        var text = source.text();
        Map<String, Object> document;
        try {
            document = DocumentReader.readJsonObject(text);
        } catch (IOException ex) {
            throw new ProtocolParseException("Protocol " + source.fileName() + " is not valid JSON: " + ex.getMessage(), ex);
        }
        if (!(document.get("schemaVersion") instanceof Number)) {
            throw new ProtocolParseException("JSON protocol " + source.fileName() + " is missing a numeric schemaVersion");
        }
        requireList(document, "commands", source.fileName());
        return new ProtocolDescriptor(
            ProtocolKind.JSON_INSTRUCTIONS,
            Optional.empty(),
            source.fileName(),
            text,
            document,
            source.labwarePaths(),
            source.dataPaths(),
            extraLabware,
            extraData,
            Optional.empty(),
            Optional.empty()
        );
    }

    private static ProtocolDescriptor parseBundle(
        ProtocolSource source,
        Map<String, LabwareDefinition> extraLabware,
        Map<String, byte[]> extraData
    ) {
        var contents = BundleArchive.read(source.content());
        return parseSource(
            source,
            contents.protocolSourceText(),
            extraLabware,
            extraData,
            Optional.of(contents.bundledLabware()),
            Optional.of(contents.bundledData()),
            ProtocolKind.BUNDLE_ARCHIVE
        );
    }

    private static Optional<ApiLevel> declaredLevel(Map<String, Object> document) {
        var metadata = document.get("metadata");
        if (metadata == null) {
            return Optional.empty();
        }
        if (!(metadata instanceof Map<?, ?> map)) {
            throw new ProtocolParseException("metadata must be a mapping");
        }
        var raw = map.get("apiLevel");
        return raw == null ? Optional.empty() : Optional.of(ApiLevel.parse(raw));
    }

    private static void requireList(Map<String, Object> document, String key, String fileName) {
        if (!(document.get(key) instanceof List<?>)) {
            throw new ProtocolParseException("Protocol " + fileName + " must declare a '" + key + "' list");
        }
    }
}

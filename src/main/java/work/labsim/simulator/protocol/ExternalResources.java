package work.labsim.simulator.protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.labsim.simulator.error.ResourceException;
import work.labsim.simulator.shared.DocumentReader;

/**
 * Loads extra labware definitions and data files from caller-supplied paths. Directories are
 * scanned non-recursively, in file-name order.
 */
public final class ExternalResources {
    private static final Logger log = LoggerFactory.getLogger(ExternalResources.class);

    private ExternalResources() {}

    /**
     * Reads every {@code *.json} labware definition directly inside the given directories (plain
     * files are accepted too). Files that are not labware definitions are skipped.
     *
     * @throws ResourceException when a path is missing or unreadable, or when two files define the same URI
     */
    public static Map<String, LabwareDefinition> labwareFromPaths(List<Path> paths) {
        var definitions = new LinkedHashMap<String, LabwareDefinition>();
        var origins = new LinkedHashMap<String, Path>();
        for (var file : expand(paths, true)) {
            var definition = readDefinition(file);
            if (definition == null) {
                continue;
            }
            var previous = origins.putIfAbsent(definition.uri(), file);
            if (previous != null) {
                throw new ResourceException(
                    "Labware " + definition.uri() + " is defined twice: " + previous + " and " + file
                );
            }
            definitions.put(definition.uri(), definition);
        }
        return definitions;
    }

    /**
     * Reads data files keyed by bare file name. A later file with the same name replaces an
     * earlier one.
     */
    public static Map<String, byte[]> dataFromPaths(List<Path> paths) {
        var data = new LinkedHashMap<String, byte[]>();
        for (var file : expand(paths, false)) {
            var name = file.getFileName().toString();
            try {
                var bytes = Files.readAllBytes(file);
                if (data.put(name, bytes) != null) {
                    log.warn("Data file {} replaces an earlier file with the same name", file);
                }
            } catch (IOException ex) {
                throw new ResourceException("Cannot read data file " + file + ": " + ex.getMessage(), ex);
            }
        }
        return data;
    }

    private static List<Path> expand(List<Path> paths, boolean jsonOnly) {
        var files = new ArrayList<Path>();
        if (paths == null) {
            return files;
        }
        for (var raw : paths) {
            var path = raw.toAbsolutePath().normalize();
            if (Files.isDirectory(path)) {
                files.addAll(listDirectory(path, jsonOnly));
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                throw new ResourceException("Resource path does not exist: " + path);
            }
        }
        return files;
    }

    private static List<Path> listDirectory(Path dir, boolean jsonOnly) {
        try (var stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(file -> !jsonOnly || file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ResourceException("Cannot list directory " + dir + ": " + ex.getMessage(), ex);
        }
    }

    private static LabwareDefinition readDefinition(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ResourceException("Cannot read labware file " + file + ": " + ex.getMessage(), ex);
        }
        try {
            var document = DocumentReader.readJsonObject(text);
            if (!LabwareDefinition.looksLikeDefinition(document)) {
                log.info("{} is not a labware definition, skipping", file);
                return null;
            }
            return new LabwareDefinition(document);
        } catch (IOException ex) {
            log.info("{} is not valid JSON, skipping: {}", file, ex.getMessage());
            return null;
        }
    }
}

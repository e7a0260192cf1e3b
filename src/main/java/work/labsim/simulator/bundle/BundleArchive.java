package work.labsim.simulator.bundle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import work.labsim.simulator.error.ProtocolParseException;
import work.labsim.simulator.protocol.LabwareDefinition;
import work.labsim.simulator.shared.DocumentReader;

/**
 * Zip layout of a bundle: {@code protocol.yaml}, {@code labware/<index>.json} and
 * {@code data/<name>}. Entries carry a fixed timestamp so equal contents give equal bytes.
 */
public final class BundleArchive {
    public static final String PROTOCOL_ENTRY = "protocol.yaml";
    public static final String LABWARE_DIR = "labware/";
    public static final String DATA_DIR = "data/";
    public static final String MODULES_DIR = "modules/";

    // 1980-01-02T00:00:00Z, inside the DOS date range
    private static final long ENTRY_TIME = 315_619_200_000L;
    private static final ObjectWriter LABWARE_WRITER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .writerWithDefaultPrettyPrinter();

    private BundleArchive() {}

    public static void write(BundleContents contents, OutputStream out) throws IOException {
        out.write(toBytes(contents));
        out.flush();
    }

    public static byte[] toBytes(BundleContents contents) throws IOException {
        var buffer = new ByteArrayOutputStream();
        try (var zip = new ZipArchiveOutputStream(buffer)) {
            zip.setEncoding(StandardCharsets.UTF_8.name());
            putEntry(zip, PROTOCOL_ENTRY, contents.protocolSourceText().getBytes(StandardCharsets.UTF_8));
            int index = 0;
            for (var definition : contents.bundledLabware().values()) {
                putEntry(zip, LABWARE_DIR + index + ".json", LABWARE_WRITER.writeValueAsBytes(definition.document()));
                index++;
            }
            for (var entry : contents.bundledData().entrySet()) {
                putEntry(zip, DATA_DIR + entry.getKey(), entry.getValue());
            }
            for (var entry : contents.bundledAuxiliaryModules().entrySet()) {
                putEntry(zip, MODULES_DIR + entry.getKey(), entry.getValue().getBytes(StandardCharsets.UTF_8));
            }
        }
        return buffer.toByteArray();
    }

    public static void writeTo(BundleContents contents, Path destination) throws IOException {
        var parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var out = Files.newOutputStream(destination)) {
            write(contents, out);
        }
    }

    public static BundleContents read(byte[] archive) {
        String protocol = null;
        var labware = new LinkedHashMap<String, LabwareDefinition>();
        var data = new LinkedHashMap<String, byte[]>();
        var modules = new LinkedHashMap<String, String>();
        try (var zip = new ZipArchiveInputStream(new ByteArrayInputStream(archive), StandardCharsets.UTF_8.name())) {
            ZipArchiveEntry entry;
            while ((entry = zip.getNextZipEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                var name = entry.getName();
                var bytes = zip.readAllBytes();
                if (PROTOCOL_ENTRY.equals(name)) {
                    protocol = new String(bytes, StandardCharsets.UTF_8);
                } else if (name.startsWith(LABWARE_DIR) && name.endsWith(".json")) {
                    var definition = readDefinition(name, bytes);
                    labware.putIfAbsent(definition.uri(), definition);
                } else if (name.startsWith(DATA_DIR) && name.length() > DATA_DIR.length()) {
                    data.put(name.substring(DATA_DIR.length()), bytes);
                } else if (name.startsWith(MODULES_DIR) && name.length() > MODULES_DIR.length()) {
                    modules.put(name.substring(MODULES_DIR.length()), new String(bytes, StandardCharsets.UTF_8));
                }
            }
        } catch (IOException ex) {
            throw new ProtocolParseException("Bundle is not a readable zip archive: " + ex.getMessage(), ex);
        }
        if (protocol == null) {
            throw new ProtocolParseException("Bundle does not contain " + PROTOCOL_ENTRY);
        }
        return new BundleContents(protocol, data, labware, modules);
    }

    private static LabwareDefinition readDefinition(String name, byte[] bytes) {
        try {
            return new LabwareDefinition(DocumentReader.readJsonObject(new String(bytes, StandardCharsets.UTF_8)));
        } catch (IOException | IllegalArgumentException ex) {
            throw new ProtocolParseException("Bundled labware " + name + " is invalid: " + ex.getMessage(), ex);
        }
    }

    private static void putEntry(ZipArchiveOutputStream zip, String name, byte[] bytes) throws IOException {
        var entry = new ZipArchiveEntry(name);
        entry.setTime(ENTRY_TIME);
        entry.setSize(bytes.length);
        zip.putArchiveEntry(entry);
        zip.write(bytes);
        zip.closeArchiveEntry();
    }
}

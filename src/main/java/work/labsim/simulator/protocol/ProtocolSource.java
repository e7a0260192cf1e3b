package work.labsim.simulator.protocol;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Raw protocol intake: content, the file name it was declared under and external resource paths.
 */
public record ProtocolSource(byte[] content, String fileName, List<Path> labwarePaths, List<Path> dataPaths) {
    public ProtocolSource {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(fileName, "fileName");
        labwarePaths = labwarePaths == null ? List.of() : List.copyOf(labwarePaths);
        dataPaths = dataPaths == null ? List.of() : List.copyOf(dataPaths);
    }

    public static ProtocolSource of(String text, String fileName) {
        return new ProtocolSource(text.getBytes(StandardCharsets.UTF_8), fileName, List.of(), List.of());
    }

    public ProtocolSource withLabwarePaths(List<Path> paths) {
        return new ProtocolSource(content, fileName, paths, dataPaths);
    }

    public ProtocolSource withDataPaths(List<Path> paths) {
        return new ProtocolSource(content, fileName, labwarePaths, paths);
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }
}

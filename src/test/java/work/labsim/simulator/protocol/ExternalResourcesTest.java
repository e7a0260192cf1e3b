package work.labsim.simulator.protocol;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.labsim.simulator.error.ResourceException;

class ExternalResourcesTest {
    private static final String RACK = "{\"namespace\":\"custom_beta\",\"version\":1,"
        + "\"metadata\":{\"displayName\":\"Rack\"},\"parameters\":{\"loadName\":\"rack\"},"
        + "\"grid\":{\"rows\":2,\"columns\":2}}";

    @Test
    void skipsFilesThatAreNotDefinitions(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("b_rack.json"), RACK);
        Files.writeString(dir.resolve("a_notes.json"), "{\"comment\":true}");
        Files.writeString(dir.resolve("c_broken.json"), "{oops");
        Files.writeString(dir.resolve("readme.txt"), "ignored");
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("nested").resolve("other.json"), RACK.replace("\"rack\"", "\"nested_rack\""));

        var labware = ExternalResources.labwareFromPaths(List.of(dir));

        assertEquals(List.of("custom_beta/rack/1"), List.copyOf(labware.keySet()));
    }

    @Test
    void sameUriTwiceIsAnError(@TempDir Path dir) throws Exception {
        var first = Files.createDirectories(dir.resolve("first"));
        var second = Files.createDirectories(dir.resolve("second"));
        Files.writeString(first.resolve("rack.json"), RACK);
        Files.writeString(second.resolve("rack_copy.json"), RACK);

        var ex = assertThrows(ResourceException.class, () -> ExternalResources.labwareFromPaths(List.of(first, second)));
        assertEquals("resource_error", ex.code());
    }

    @Test
    void dataIsKeyedByBareNameAndLastWins(@TempDir Path dir) throws Exception {
        var first = Files.createDirectories(dir.resolve("first"));
        var second = Files.createDirectories(dir.resolve("second"));
        Files.writeString(first.resolve("map.csv"), "old");
        Files.writeString(first.resolve("extra.txt"), "extra");
        Files.writeString(second.resolve("map.csv"), "new");

        var data = ExternalResources.dataFromPaths(List.of(first, second.resolve("map.csv")));

        assertEquals(List.of("extra.txt", "map.csv"), List.copyOf(data.keySet()));
        assertArrayEquals("new".getBytes(StandardCharsets.UTF_8), data.get("map.csv"));
    }

    @Test
    void missingPathIsAnError(@TempDir Path dir) {
        assertThrows(ResourceException.class, () -> ExternalResources.dataFromPaths(List.of(dir.resolve("nope"))));
        assertThrows(ResourceException.class, () -> ExternalResources.labwareFromPaths(List.of(dir.resolve("nope"))));
    }
}

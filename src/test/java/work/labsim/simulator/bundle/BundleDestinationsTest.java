package work.labsim.simulator.bundle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.labsim.simulator.error.ConfigurationException;

class BundleDestinationsTest {
    @Test
    void noRequestMeansNoBundle(@TempDir Path dir) {
        assertTrue(BundleDestinations.resolve(null, "demo.yaml", dir.resolve("demo.yaml"), dir).isEmpty());
    }

    @Test
    void bareFlagUsesTheProtocolStem(@TempDir Path dir) {
        var destination = BundleDestinations.resolve("", "demo.yaml", dir.resolve("demo.yaml"), dir).orElseThrow();
        assertEquals(dir.resolve("demo.bundle.zip").toAbsolutePath().normalize(), destination);
        assertEquals("demo.bundle.zip", BundleDestinations.defaultName("old.bundle.zip"));
        assertEquals("protocol.bundle.zip", BundleDestinations.defaultName(null));
    }

    @Test
    void explicitPathIsResolvedAgainstWorkingDirectory(@TempDir Path dir) {
        var destination = BundleDestinations.resolve("out/run.zip", "demo.yaml", dir.resolve("demo.yaml"), dir).orElseThrow();
        assertEquals(dir.resolve("out/run.zip").toAbsolutePath().normalize(), destination);
    }

    @Test
    void bundlePathMustDifferFromProtocolPath(@TempDir Path dir) {
        var ex = assertThrows(ConfigurationException.class,
            () -> BundleDestinations.resolve("demo.yaml", "demo.yaml", dir.resolve("demo.yaml"), dir));
        assertEquals("Bundle path and input path must be different", ex.getMessage());
    }

    @Test
    void directoryIsNotADestination(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> BundleDestinations.resolve(".", "demo.yaml", null, dir));
    }
}

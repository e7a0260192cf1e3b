package work.labsim.simulator.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.labsim.simulator.bundle.BundleArchive;
import work.labsim.simulator.support.ProtocolFixtures;

class SimulateCommandTest {
    @TempDir
    Path dir;

    private SimulateCommand command;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path settings;

    @BeforeEach
    void setUp() throws Exception {
        command = new SimulateCommand();
        command.workingDirectory = dir;
        settings = dir.resolve("settings.toml");
        Files.writeString(settings, "useProtocolApi2 = true\nenableApi1BackCompat = false\n");
        for (var name : List.of("flat_v2.yaml", "failing_v2.yaml", "custom_labware_v2.yaml", "legacy_v1.yaml")) {
            Files.write(dir.resolve(name), ProtocolFixtures.bytes(name));
        }
    }

    @Test
    void printsTheRunLog() {
        int code = run("flat_v2.yaml");
        assertEquals(0, code, err::toString);
        var lines = out.toString().strip().split("\\R");
        assertEquals(4, lines.length);
        assertEquals("Picking up tip A1 of Opentrons 96 Tip Rack 300 µL on 1", lines[0]);
        assertFalse(Files.exists(dir.resolve("flat_v2.bundle.zip")));
    }

    @Test
    void outputNothingPrintsNothing() {
        assertEquals(0, run("flat_v2.yaml", "-o", "nothing"));
        assertEquals("", out.toString());
    }

    @Test
    void bareBundleFlagWritesDefaultBundle() throws Exception {
        assertEquals(0, run("flat_v2.yaml", "-b"), err::toString);
        var archive = dir.resolve("flat_v2.bundle.zip");
        assertTrue(Files.isRegularFile(archive));
        var contents = BundleArchive.read(Files.readAllBytes(archive));
        assertEquals(ProtocolFixtures.text("flat_v2.yaml"), contents.protocolSourceText());
    }

    @Test
    void bundlePathEqualToProtocolIsRejected() {
        int code = run("flat_v2.yaml", "--bundle", "flat_v2.yaml");
        assertEquals(1, code);
        assertTrue(err.toString().contains("Bundle path and input path must be different"));
        assertEquals("", out.toString());
    }

    @Test
    void executionFailureReportsCodeAndPartialRunLog() {
        int code = run("failing_v2.yaml");
        assertEquals(ExitCodes.SIMULATION_FAILED, code);
        var lines = List.of(err.toString().split("\\R"));
        assertTrue(lines.get(0).startsWith("labsim-simulate: [execution_error] Simulation of failing_v2.yaml failed"), err::toString);
        assertEquals(FailureReporter.PARTIAL_RUN_LOG_HEADER, lines.get(1));
        assertEquals("  first", lines.get(2));
        assertFalse(err.toString().contains("never reached"));
        assertEquals("", out.toString());
    }

    @Test
    void failuresBeforeTheRunHaveNoRunLog() {
        assertEquals(ExitCodes.SIMULATION_FAILED, run("absent.yaml"));
        assertTrue(err.toString().startsWith("labsim-simulate: [resource_error] "), err::toString);
        assertFalse(err.toString().contains(FailureReporter.PARTIAL_RUN_LOG_HEADER));
    }

    @Test
    void helpListsExitCodes() {
        assertEquals(ExitCodes.OK, run("--help"));
        assertTrue(out.toString().contains("Exit codes:"), out::toString);
        assertTrue(out.toString().lines().anyMatch(line -> line.contains("70") && line.contains("Internal error")), out::toString);
    }

    @Test
    void versionNamesTheSettingsFile() {
        assertEquals(ExitCodes.OK, run("--version"));
        var lines = out.toString().strip().split("\\R");
        assertEquals("labsim-simulate " + VersionProvider.DEVELOPMENT_VERSION, lines[0]);
        assertTrue(lines[2].endsWith("settings.toml"), out::toString);
    }

    @Test
    void legacyLevelIsRefusedByDefault() {
        assertEquals(1, run("legacy_v1.yaml"));
        assertTrue(err.toString().contains("configuration_error"), err::toString);
    }

    @Test
    void customLabwareDirectoriesAreUsed() {
        Path labwareDir = ProtocolFixtures.CUSTOM_LABWARE_DIR;
        assertEquals(0, run("custom_labware_v2.yaml", "-L", labwareDir.toString()), err::toString);
        assertTrue(out.toString().contains("A1 of Custom 6 Tube Rack on 4"));
    }

    @Test
    void readsProtocolFromStdin() {
        command.stdin = new ByteArrayInputStream(ProtocolFixtures.bytes("simple.json"));
        assertEquals(0, run("-", "--name", "simple.json"), err::toString);
        assertTrue(out.toString().contains("Picking up tip A1 of Tiprack on 1"));
    }

    @Test
    void unknownOutputModeIsAUsageError() {
        assertEquals(ExitCodes.USAGE, run("flat_v2.yaml", "-o", "json"));
        assertTrue(err.toString().contains("Unsupported output: json"), err::toString);
    }

    private int run(String... args) {
        var all = new ArrayList<>(List.of(args));
        all.add("--settings");
        all.add(settings.toString());
        var commandLine = Main.commandLine(command);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(all.toArray(new String[0]));
    }
}

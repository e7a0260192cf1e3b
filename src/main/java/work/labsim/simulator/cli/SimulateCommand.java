package work.labsim.simulator.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.labsim.simulator.api.LogLevel;
import work.labsim.simulator.api.SimulationConfiguration;
import work.labsim.simulator.api.Simulator;
import work.labsim.simulator.bundle.BundleArchive;
import work.labsim.simulator.bundle.BundleContents;
import work.labsim.simulator.bundle.BundleDestinations;
import work.labsim.simulator.config.FeatureFlags;
import work.labsim.simulator.error.ResourceException;
import work.labsim.simulator.protocol.ProtocolSource;

@CommandLine.Command(
    name = "labsim-simulate",
    description = "Simulate a protocol without hardware and print its run log.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    exitCodeOnSuccess = ExitCodes.OK,
    exitCodeOnInvalidInput = ExitCodes.USAGE,
    exitCodeOnExecutionException = ExitCodes.SIMULATION_FAILED,
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        " 0:Simulation finished",
        " 1:Simulation failed (parse, configuration, resource or execution error)",
        " 2:Invalid command line",
        "70:Internal error"
    }
)
final class SimulateCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);
    static final String STDIN = "-";

    enum Output { RUNLOG, NOTHING }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "PROTOCOL",
        description = "Protocol file (.yaml script, .json instructions or .zip bundle); '-' reads stdin."
    )
    private String protocol;

    @CommandLine.Option(
        names = "--name",
        description = "File name of a protocol read from stdin; its extension selects the format.",
        defaultValue = "protocol.yaml"
    )
    private String stdinName;

    @CommandLine.Option(
        names = {"-l", "--log-level"},
        description = "Minimum severity captured into the run log (debug|info|warning|error|none).",
        defaultValue = "warning"
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-L", "--custom-labware-path"},
        paramLabel = "DIR",
        description = "Directory of extra labware definitions; repeatable."
    )
    private List<Path> labwarePaths = new ArrayList<>();

    @CommandLine.Option(
        names = {"-D", "--custom-data-path"},
        paramLabel = "DIR",
        arity = "0..1",
        fallbackValue = ".",
        description = "Directory whose files become protocol data (default without a value: current directory); repeatable."
    )
    private List<Path> dataDirectories = new ArrayList<>();

    @CommandLine.Option(
        names = {"-d", "--custom-data-file"},
        paramLabel = "FILE",
        description = "Single file made available as protocol data; repeatable."
    )
    private List<Path> dataFiles = new ArrayList<>();

    @CommandLine.Option(
        names = {"-b", "--bundle"},
        paramLabel = "PATH",
        arity = "0..1",
        fallbackValue = "",
        description = "Write a bundle of the protocol and everything it used (default name: <protocol>.bundle.zip).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String bundle;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "What to print on success (runlog|nothing).",
        defaultValue = "runlog"
    )
    private String outputRaw;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "PATH",
        description = "Feature flag settings file (default: ~/.labsim/settings.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settings;

    @CommandLine.Option(
        names = "--propagate-logs",
        description = "Also send captured log records to the regular log output."
    )
    private boolean propagateLogs;

    InputStream stdin = System.in;
    Path workingDirectory = Paths.get("").toAbsolutePath();

    @Override
    public Integer call() throws Exception {
        var logLevel = parseLogLevel();
        var output = parseOutput();
        var fromStdin = STDIN.equals(protocol);
        var protocolPath = fromStdin ? null : workingDirectory.resolve(protocol).normalize();
        var fileName = fromStdin ? stdinName : protocolPath.getFileName().toString();
        var bundleDestination = BundleDestinations.resolve(bundle, fileName, protocolPath, workingDirectory);

        var dataPaths = new ArrayList<Path>(dataDirectories);
        dataPaths.addAll(dataFiles);
        var source = new ProtocolSource(readProtocol(protocolPath), fileName, resolveAll(labwarePaths), resolveAll(dataPaths));
        var flags = settings == null
            ? FeatureFlags.load()
            : FeatureFlags.load(workingDirectory.resolve(settings), System.getenv());

        var configuration = SimulationConfiguration.builder()
            .source(source)
            .flags(flags)
            .logLevel(logLevel)
            .propagateLogs(propagateLogs)
            .build();
        var outcome = new Simulator().simulate(configuration);

        if (bundleDestination.isPresent()) {
            if (outcome.bundle().isPresent()) {
                writeBundle(outcome.bundle().get(), bundleDestination.get());
                log.info("Wrote bundle {}", bundleDestination.get());
            } else {
                log.warn("No bundle written: only protocol scripts run on the current engine can be bundled");
            }
        }
        if (output == Output.RUNLOG) {
            var out = spec.commandLine().getOut();
            out.println(outcome.formattedRunLog());
            out.flush();
        }
        return ExitCodes.OK;
    }

    private static void writeBundle(BundleContents bundle, Path destination) {
        try {
            BundleArchive.writeTo(bundle, destination);
        } catch (IOException ex) {
            throw new ResourceException("Unable to write bundle " + destination + ": " + ex.getMessage(), ex);
        }
    }

    private byte[] readProtocol(Path protocolPath) {
        try {
            return protocolPath == null ? stdin.readAllBytes() : Files.readAllBytes(protocolPath);
        } catch (IOException ex) {
            var where = protocolPath == null ? "stdin" : protocolPath.toString();
            throw new ResourceException("Unable to read protocol from " + where + ": " + ex.getMessage(), ex);
        }
    }

    private List<Path> resolveAll(List<Path> paths) {
        var resolved = new ArrayList<Path>(paths.size());
        for (var path : paths) {
            resolved.add(workingDirectory.resolve(path).normalize());
        }
        return resolved;
    }

    private LogLevel parseLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Output parseOutput() {
        try {
            return Output.valueOf(outputRaw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported output: " + outputRaw + " (runlog|nothing)");
        }
    }
}

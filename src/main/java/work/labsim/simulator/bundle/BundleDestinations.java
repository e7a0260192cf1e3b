package work.labsim.simulator.bundle;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import work.labsim.simulator.error.ConfigurationException;

/**
 * Decides where a bundle archive is written.
 */
public final class BundleDestinations {
    public static final String SUFFIX = ".bundle.zip";

    private BundleDestinations() {}

    /**
     * @param requested  {@code null} when no bundle was asked for, an empty string for the
     *                   default name, otherwise the explicit path
     * @param protocolFileName the protocol's file name, used for the default name
     * @param protocolPath the protocol's path on disk, when it came from a file
     */
    public static Optional<Path> resolve(String requested, String protocolFileName, Path protocolPath, Path workingDirectory) {
        if (requested == null) {
            return Optional.empty();
        }
        var destination = requested.isBlank()
            ? workingDirectory.resolve(defaultName(protocolFileName))
            : workingDirectory.resolve(requested);
        destination = destination.toAbsolutePath().normalize();
        if (protocolPath != null && destination.equals(protocolPath.toAbsolutePath().normalize())) {
            throw new ConfigurationException("Bundle path and input path must be different");
        }
        if (Files.isDirectory(destination)) {
            throw new ConfigurationException("Bundle path " + destination + " is a directory");
        }
        return Optional.of(destination);
    }

    public static String defaultName(String protocolFileName) {
        var name = protocolFileName == null || protocolFileName.isBlank() ? "protocol" : Path.of(protocolFileName).getFileName().toString();
        int dot = name.lastIndexOf('.');
        var stem = dot > 0 ? name.substring(0, dot) : name;
        if (stem.endsWith(".bundle")) {
            stem = stem.substring(0, stem.length() - ".bundle".length());
        }
        return stem + SUFFIX;
    }
}

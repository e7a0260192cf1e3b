package work.labsim.simulator.cli;

import picocli.CommandLine;
import work.labsim.simulator.config.FeatureFlags;

/**
 * {@code --version} text: build version, accepted protocol formats and the default settings file.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_VERSION = "development";

    @Override
    public String[] getVersion() {
        var version = VersionProvider.class.getPackage().getImplementationVersion();
        return new String[] {
            "labsim-simulate " + (version == null ? DEVELOPMENT_VERSION : version),
            "Protocols: .json instructions, .zip bundles, any other file as a YAML script",
            "Default settings: " + FeatureFlags.defaultSettingsFile()
        };
    }
}

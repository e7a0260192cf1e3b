package work.labsim.simulator.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.labsim.simulator.error.ConfigurationException;

/**
 * Loads {@link EngineFlags} from a TOML settings file, with environment variables taking
 * precedence over the file.
 */
public final class FeatureFlags {
    private static final Logger log = LoggerFactory.getLogger(FeatureFlags.class);

    public static final String V2_KEY = "useProtocolApi2";
    public static final String BACKCOMPAT_KEY = "enableApi1BackCompat";
    public static final String V2_ENV = "LABSIM_USE_PROTOCOL_API2";
    public static final String BACKCOMPAT_ENV = "LABSIM_ENABLE_API1_BACKCOMPAT";

    private FeatureFlags() {}

    public static Path defaultSettingsFile() {
        return Paths.get(System.getProperty("user.home"), ".labsim", "settings.toml");
    }

    public static EngineFlags load() {
        return load(defaultSettingsFile(), System.getenv());
    }

    /**
     * A missing file yields the defaults; a malformed file or value is a configuration error.
     */
    public static EngineFlags load(Path settingsFile, Map<String, String> env) {
        boolean v2 = EngineFlags.DEFAULTS.v2Enabled();
        boolean backcompat = EngineFlags.DEFAULTS.backcompat();
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            var settings = parse(settingsFile);
            v2 = booleanSetting(settings, V2_KEY, v2, settingsFile);
            backcompat = booleanSetting(settings, BACKCOMPAT_KEY, backcompat, settingsFile);
        } else if (settingsFile != null) {
            log.debug("No settings file at {}, using defaults", settingsFile);
        }
        var environment = env == null ? Map.<String, String>of() : env;
        v2 = envOverride(environment, V2_ENV, v2);
        backcompat = envOverride(environment, BACKCOMPAT_ENV, backcompat);
        return new EngineFlags(v2, backcompat);
    }

    private static TomlParseResult parse(Path settingsFile) {
        try {
            TomlParseResult result = Toml.parse(Files.readString(settingsFile));
            if (result.hasErrors()) {
                var problems = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
                throw new ConfigurationException("Settings file " + settingsFile + " is malformed: " + problems);
            }
            return result;
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read settings file " + settingsFile + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean booleanSetting(TomlParseResult settings, String key, boolean fallback, Path source) {
        var value = settings.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean flag)) {
            throw new ConfigurationException("Setting " + key + " in " + source + " must be true or false, got " + value);
        }
        return flag;
    }

    private static boolean envOverride(Map<String, String> env, String name, boolean fallback) {
        var raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw new ConfigurationException("Environment variable " + name + " must be true|false|1|0, got " + raw);
        }
    }
}

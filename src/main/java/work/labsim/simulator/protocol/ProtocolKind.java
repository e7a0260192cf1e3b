package work.labsim.simulator.protocol;

import java.util.Locale;

/**
 * Shape of the protocol content handed to the simulator.
 */
public enum ProtocolKind {
    /** YAML protocol script evaluated step by step. */
    SOURCE,
    /** JSON document of flat, pre-resolved instructions. */
    JSON_INSTRUCTIONS,
    /** Zip archive carrying a source protocol plus its labware and data. */
    BUNDLE_ARCHIVE;

    public static ProtocolKind fromFileName(String fileName) {
        var lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return JSON_INSTRUCTIONS;
        }
        if (lower.endsWith(".zip")) {
            return BUNDLE_ARCHIVE;
        }
        return SOURCE;
    }
}

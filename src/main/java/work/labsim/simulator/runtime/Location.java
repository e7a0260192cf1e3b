package work.labsim.simulator.runtime;

import java.util.Objects;

/**
 * A well of a loaded labware.
 */
public record Location(LoadedLabware labware, String well) {
    public Location {
        Objects.requireNonNull(labware, "labware");
        Objects.requireNonNull(well, "well");
        if (!labware.hasWell(well)) {
            throw new IllegalArgumentException("Labware " + labware.name() + " has no well " + well);
        }
    }
}

package work.labsim.simulator.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.labsim.simulator.protocol.LabwareDefinition;

/**
 * Labware placed on a deck slot for one run. Tip racks also track which tips were taken.
 */
public final class LoadedLabware {
    private final String name;
    private final String slot;
    private final LabwareDefinition definition;
    private String label;
    private final List<String> wells;
    private final Set<String> usedTips = new HashSet<>();

    LoadedLabware(String name, String slot, LabwareDefinition definition, String label) {
        this.name = Objects.requireNonNull(name, "name");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.label = label;
        this.wells = definition.wellNames();
    }

    public String name() {
        return name;
    }

    public String slot() {
        return slot;
    }

    public LabwareDefinition definition() {
        return definition;
    }

    public String uri() {
        return definition.uri();
    }

    public String displayName() {
        return label == null || label.isBlank() ? definition.displayName() : label;
    }

    void relabel(String label) {
        this.label = label;
    }

    public boolean hasWell(String well) {
        return wells.contains(well);
    }

    public Location well(String well) {
        return new Location(this, well);
    }

    public Location firstWell() {
        return new Location(this, wells.get(0));
    }

    /**
     * Next tip for a pipette with the given channel count; multi-channel pipettes take a full
     * column. Marks the tips used.
     */
    Optional<Location> takeNextTip(int channels) {
        if (channels <= 1) {
            for (var well : wells) {
                if (usedTips.add(well)) {
                    return Optional.of(new Location(this, well));
                }
            }
            return Optional.empty();
        }
        for (var column : columns().values()) {
            if (column.stream().noneMatch(usedTips::contains)) {
                usedTips.addAll(column);
                return Optional.of(new Location(this, column.get(0)));
            }
        }
        return Optional.empty();
    }

    void markTipUsed(String well) {
        usedTips.add(well);
    }

    void resetTips() {
        usedTips.clear();
    }

    private Map<String, List<String>> columns() {
        var columns = new LinkedHashMap<String, List<String>>();
        for (var well : wells) {
            columns.computeIfAbsent(well.substring(1), key -> new ArrayList<>()).add(well);
        }
        return columns;
    }

    @Override
    public String toString() {
        return name + " (" + uri() + ") on " + slot;
    }
}

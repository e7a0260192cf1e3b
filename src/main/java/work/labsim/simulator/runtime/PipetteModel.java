package work.labsim.simulator.runtime;

import java.util.Locale;

public enum PipetteModel {
    P10_SINGLE("p10_single", 10.0, 1),
    P10_MULTI("p10_multi", 10.0, 8),
    P50_SINGLE("p50_single", 50.0, 1),
    P50_MULTI("p50_multi", 50.0, 8),
    P300_SINGLE("p300_single", 300.0, 1),
    P300_MULTI("p300_multi", 300.0, 8),
    P1000_SINGLE("p1000_single", 1000.0, 1);

    private final String id;
    private final double maxVolume;
    private final int channels;

    PipetteModel(String id, double maxVolume, int channels) {
        this.id = id;
        this.maxVolume = maxVolume;
        this.channels = channels;
    }

    public String id() {
        return id;
    }

    public double maxVolume() {
        return maxVolume;
    }

    public int channels() {
        return channels;
    }

    /**
     * Accepts {@code p300_single}, generation suffixes such as {@code p300_single_gen2} and
     * version suffixes such as {@code p300_single_v1.5}.
     */
    public static PipetteModel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipette model is required");
        }
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var model : values()) {
            if (normalized.equals(model.id) || normalized.startsWith(model.id + "_")) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown pipette model: " + name);
    }
}

package work.labsim.simulator.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hardware-free pipette. Every public operation is announced as a command on the context's bus;
 * compound operations nest the commands they issue.
 */
public final class SimulatedPipette {
    private static final Logger log = LoggerFactory.getLogger(SimulatedPipette.class);

    private final SimulationContext ctx;
    private final String name;
    private final PipetteModel model;
    private final String mount;
    private final List<LoadedLabware> tipRacks;
    private Location tip;
    private double currentVolume;

    SimulatedPipette(SimulationContext ctx, String name, PipetteModel model, String mount, List<LoadedLabware> tipRacks) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.name = Objects.requireNonNull(name, "name");
        this.model = Objects.requireNonNull(model, "model");
        this.mount = Objects.requireNonNull(mount, "mount");
        this.tipRacks = List.copyOf(tipRacks);
    }

    public String name() {
        return name;
    }

    public PipetteModel model() {
        return model;
    }

    public String mount() {
        return mount;
    }

    public boolean hasTip() {
        return tip != null;
    }

    public double currentVolume() {
        return currentVolume;
    }

    public void pickUpTip(Location location) {
        if (tip != null) {
            throw new IllegalStateException("Pipette " + name + " already has a tip attached");
        }
        var target = location != null ? location : nextTip();
        if (location != null) {
            location.labware().markTipUsed(location.well());
        }
        ctx.command(payload("pickUpTip", "Picking up tip {location}", fields("location", describe(target))), () -> {
            log.debug("{} picked up tip at {}", name, target.well());
            tip = target;
            currentVolume = 0.0;
        });
    }

    public void dropTip(Location location) {
        requireTip("drop a tip");
        var target = location != null ? location : ctx.trash().firstWell();
        ctx.command(payload("dropTip", "Dropping tip {location}", fields("location", describe(target))), () -> {
            log.debug("{} dropped tip into {}", name, target.labware().name());
            tip = null;
            currentVolume = 0.0;
        });
    }

    public void aspirate(double volume, Location location, double rate) {
        Objects.requireNonNull(location, "location");
        requireTip("aspirate");
        requirePositive(volume);
        double available = model.maxVolume() - currentVolume;
        double actual = volume;
        if (volume > available) {
            log.warn("{} cannot hold {} uL more (capacity {} uL, holding {} uL); aspirating {} uL",
                name, volume, model.maxVolume(), currentVolume, available);
            actual = available;
        }
        var fields = fields("volume", volume);
        fields.put("location", describe(location));
        fields.put("rate", rate);
        double taken = actual;
        ctx.command(payload("aspirate", "Aspirating {volume} uL from {location} at {rate} speed", fields), () -> {
            currentVolume += taken;
            log.debug("{} now holds {} uL", name, currentVolume);
        });
    }

    /**
     * Dispenses {@code volume}, or everything held when {@code volume} is null.
     */
    public void dispense(Double volume, Location location, double rate) {
        Objects.requireNonNull(location, "location");
        requireTip("dispense");
        double requested = volume == null ? currentVolume : volume;
        if (volume != null) {
            requirePositive(volume);
        }
        double actual = requested;
        if (requested > currentVolume) {
            log.warn("{} holds only {} uL; dispensing {} uL instead of {} uL", name, currentVolume, currentVolume, requested);
            actual = currentVolume;
        }
        var fields = fields("volume", requested);
        fields.put("location", describe(location));
        fields.put("rate", rate);
        double released = actual;
        ctx.command(payload("dispense", "Dispensing {volume} uL into {location}", fields), () -> {
            currentVolume -= released;
            log.debug("{} now holds {} uL", name, currentVolume);
        });
    }

    public void touchTip(Location location) {
        requireTip("touch tip");
        var fields = new LinkedHashMap<String, Object>();
        if (location != null) {
            fields.put("location", describe(location));
        }
        ctx.command(payload("touchTip", "Touching tip", fields), () -> log.debug("{} touched tip", name));
    }

    public void blowOut(Location location) {
        var target = location != null ? location : ctx.trash().firstWell();
        ctx.command(payload("blowout", "Blowing out at {location}", fields("location", describe(target))), () -> {
            log.debug("{} blew out {} uL", name, currentVolume);
            currentVolume = 0.0;
        });
    }

    public void mix(int repetitions, double volume, Location location, double rate) {
        Objects.requireNonNull(location, "location");
        if (repetitions < 1) {
            throw new IllegalArgumentException("mix repetitions must be at least 1");
        }
        var fields = fields("repetitions", repetitions);
        fields.put("volume", volume);
        fields.put("location", describe(location));
        ctx.command(payload("mix", "Mixing {repetitions} times with a volume of {volume} uL", fields), () -> {
            for (int i = 0; i < repetitions; i++) {
                aspirate(volume, location, rate);
                dispense(volume, location, rate);
            }
        });
    }

    /**
     * Moves {@code volume} from {@code source} to {@code dest}, picking up a fresh tip (and
     * dropping it afterwards) unless one is already attached.
     */
    public void transfer(double volume, Location source, Location dest, double rate) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(dest, "dest");
        requirePositive(volume);
        var fields = fields("volume", volume);
        fields.put("source", describe(source));
        fields.put("dest", describe(dest));
        ctx.command(payload("transfer", "Transferring {volume} from {source} to {dest}", fields), () -> {
            boolean ownTip = !hasTip();
            if (ownTip) {
                pickUpTip(null);
            }
            double remaining = volume;
            while (remaining > 0) {
                double chunk = Math.min(remaining, model.maxVolume());
                aspirate(chunk, source, rate);
                dispense(chunk, dest, rate);
                remaining -= chunk;
            }
            if (ownTip) {
                dropTip(null);
            }
        });
    }

    void reset() {
        tip = null;
        currentVolume = 0.0;
    }

    private Location nextTip() {
        if (tipRacks.isEmpty()) {
            throw new IllegalStateException("Pipette " + name + " has no tip racks assigned");
        }
        for (var rack : tipRacks) {
            var next = rack.takeNextTip(model.channels());
            if (next.isPresent()) {
                return next.get();
            }
        }
        throw new IllegalStateException("Tip racks of pipette " + name + " are exhausted");
    }

    private void requireTip(String action) {
        if (tip == null) {
            throw new IllegalStateException("Pipette " + name + " cannot " + action + " without a tip");
        }
    }

    private static void requirePositive(double volume) {
        if (!(volume > 0)) {
            throw new IllegalArgumentException("Volume must be positive: " + volume);
        }
    }

    private String describe(Location location) {
        return ctx.namingStyle().describe(location);
    }

    private static CommandPayload payload(String kind, String template, Map<String, Object> fields) {
        return CommandPayload.of(kind, template, fields);
    }

    private static Map<String, Object> fields(String key, Object value) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put(key, value);
        return fields;
    }
}

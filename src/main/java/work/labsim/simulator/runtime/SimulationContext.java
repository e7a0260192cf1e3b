package work.labsim.simulator.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.labsim.simulator.bus.EventBus;
import work.labsim.simulator.protocol.LabwareDefinition;
import work.labsim.simulator.protocol.LabwareLibrary;
import work.labsim.simulator.protocol.ProtocolDescriptor;
import work.labsim.simulator.trace.LifecycleEvent;

/**
 * Per-run simulation state handed explicitly to every step handler: the deck, loaded
 * instruments, the resources the protocol may load and the bus commands are announced on.
 */
public final class SimulationContext {
    public static final String TRASH_SLOT = "12";
    public static final String TRASH_LOAD_NAME = "opentrons_1_trash_1100ml_fixed";
    public static final String TRASH_NAME = "trash";

    private final CommandRegistry registry;
    private final EventBus bus = new EventBus();
    private final NamingStyle namingStyle;
    private final CancellationToken cancellationToken;
    private final Optional<Map<String, LabwareDefinition>> bundledLabware;
    private final Map<String, LabwareDefinition> extraLabware;
    private final Map<String, byte[]> data;
    private final Map<String, LoadedLabware> deck = new LinkedHashMap<>();
    private final List<LoadedLabware> loadOrder = new ArrayList<>();
    private final Map<String, LoadedLabware> labwareByName = new LinkedHashMap<>();
    private final Map<String, SimulatedPipette> pipettes = new LinkedHashMap<>();
    private final LoadedLabware trash;
    private boolean homed;
    private boolean connected = true;

    public SimulationContext(CommandRegistry registry, NamingStyle namingStyle, ProtocolDescriptor descriptor, CancellationToken token) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.namingStyle = Objects.requireNonNull(namingStyle, "namingStyle");
        Objects.requireNonNull(descriptor, "descriptor");
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.bundledLabware = descriptor.bundledLabware();
        this.extraLabware = descriptor.extraLabware();
        this.data = descriptor.availableData();
        this.trash = loadLabware(TRASH_NAME, TRASH_SLOT, resolveTrash(), null);
    }

    public CommandRegistry registry() {
        return registry;
    }

    public EventBus bus() {
        return bus;
    }

    public NamingStyle namingStyle() {
        return namingStyle;
    }

    public LoadedLabware trash() {
        return trash;
    }

    public boolean isHomed() {
        return homed;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Every labware loaded during the run, fixed trash first, in load order.
     */
    public List<LoadedLabware> loadedLabware() {
        return Collections.unmodifiableList(loadOrder);
    }

    public Map<String, byte[]> data() {
        return data;
    }

    public Optional<LoadedLabware> labwareInSlot(String slot) {
        return Optional.ofNullable(deck.get(slot));
    }

    public LoadedLabware labware(String name) {
        var labware = labwareByName.get(name);
        if (labware == null) {
            throw new IllegalArgumentException("Unknown labware: " + name);
        }
        return labware;
    }

    public SimulatedPipette pipette(String name) {
        var pipette = pipettes.get(name);
        if (pipette == null) {
            throw new IllegalArgumentException("Unknown pipette: " + name);
        }
        return pipette;
    }

    /**
     * Bundled definitions exclusively when the protocol came from a bundle, otherwise external
     * definitions first and the built-in library second.
     */
    public LabwareDefinition resolveLabware(String loadName, String namespace, Integer version) {
        if (bundledLabware.isPresent()) {
            return find(bundledLabware.get(), loadName, namespace, version)
                .orElseThrow(() -> unknownLabware(loadName, "the bundle"));
        }
        return find(extraLabware, loadName, namespace, version)
            .or(() -> LabwareLibrary.find(loadName, namespace, version))
            .orElseThrow(() -> unknownLabware(loadName, "custom labware paths or the built-in library"));
    }

    public LoadedLabware loadLabware(String name, String slot, LabwareDefinition definition, String label) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(definition, "definition");
        if (labwareByName.containsKey(name) && !TRASH_NAME.equals(name)) {
            throw new IllegalStateException("Labware name already in use: " + name);
        }
        var occupant = deck.get(slot);
        if (occupant != null) {
            if (occupant == trash && occupant.uri().equals(definition.uri())) {
                occupant.relabel(label);
                labwareByName.put(name, occupant);
                return occupant;
            }
            throw new IllegalStateException("Slot " + slot + " is already occupied by " + occupant);
        }
        var loaded = new LoadedLabware(name, slot, definition, label);
        deck.put(slot, loaded);
        loadOrder.add(loaded);
        labwareByName.put(name, loaded);
        return loaded;
    }

    public SimulatedPipette loadInstrument(String name, PipetteModel model, String mount, List<LoadedLabware> tipRacks) {
        if (pipettes.containsKey(name)) {
            throw new IllegalStateException("Instrument name already in use: " + name);
        }
        for (var pipette : pipettes.values()) {
            if (pipette.mount().equals(mount)) {
                throw new IllegalStateException("Mount " + mount + " already holds pipette " + pipette.name());
            }
        }
        var pipette = new SimulatedPipette(this, name, model, mount, tipRacks == null ? List.of() : tipRacks);
        pipettes.put(name, pipette);
        return pipette;
    }

    /**
     * Announces a command, runs it, and announces completion only if it returned normally.
     */
    public void command(CommandPayload payload, Runnable body) {
        ensureNotCancelled();
        var values = payload.asMap();
        bus.publish(LifecycleEvent.TOPIC, LifecycleEvent.before(payload.name(), values));
        body.run();
        bus.publish(LifecycleEvent.TOPIC, LifecycleEvent.after(payload.name(), values));
    }

    public void home() {
        pipettes.values().forEach(SimulatedPipette::reset);
        homed = true;
        connected = true;
    }

    public void homeCommand() {
        command(CommandPayload.of("home", "Homing", Map.of()), this::home);
    }

    /**
     * Drops any state a previous connection left behind.
     */
    public void disconnect() {
        pipettes.values().forEach(SimulatedPipette::reset);
        loadOrder.forEach(LoadedLabware::resetTips);
        homed = false;
        connected = false;
    }

    public void delay(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + duration);
        }
        command(namingStyle.delayPayload(duration), () -> { });
    }

    public void comment(String message) {
        var text = message == null ? "" : message;
        command(CommandPayload.of("comment", "{message}", Map.of("message", text)), () -> { });
    }

    public void runChildren(StepMeta meta) throws Exception {
        ensureNotCancelled();
        InstructionRunner.runSteps(this, meta.children(), meta.childPath());
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new SimulationCancelledException("Simulation cancelled");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    private LabwareDefinition resolveTrash() {
        if (bundledLabware.isPresent()) {
            var bundled = find(bundledLabware.get(), TRASH_LOAD_NAME, null, null);
            if (bundled.isPresent()) {
                return bundled.get();
            }
        }
        return LabwareLibrary.find(TRASH_LOAD_NAME, LabwareDefinition.DEFAULT_NAMESPACE, 1)
            .orElseThrow(() -> new IllegalStateException("Built-in fixed trash definition is missing"));
    }

    private static Optional<LabwareDefinition> find(Map<String, LabwareDefinition> definitions, String loadName, String namespace, Integer version) {
        return definitions.values().stream()
            .filter(definition -> definition.matches(loadName, namespace, version))
            .findFirst();
    }

    private static IllegalArgumentException unknownLabware(String loadName, String where) {
        return new IllegalArgumentException("Unable to find labware " + loadName + " in " + where);
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }

    public static final class SimulationCancelledException extends RuntimeException {
        public SimulationCancelledException(String message) {
            super(message);
        }
    }
}

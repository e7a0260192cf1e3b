package work.labsim.simulator.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Labware type definition. The document itself is opaque; only the identity fields and the
 * well layout are read by the simulator.
 */
public record LabwareDefinition(Map<String, Object> document) {
    public static final String DEFAULT_NAMESPACE = "opentrons";

    public LabwareDefinition {
        Objects.requireNonNull(document, "document");
        document = Collections.unmodifiableMap(new LinkedHashMap<>(document));
        if (loadNameOf(document) == null) {
            throw new IllegalArgumentException("labware definition is missing parameters.loadName");
        }
    }

    public static boolean looksLikeDefinition(Map<String, Object> document) {
        return document != null && loadNameOf(document) != null;
    }

    /**
     * Identity of this labware type and version, {@code namespace/loadName/version}.
     */
    public String uri() {
        return namespace() + "/" + loadName() + "/" + version();
    }

    public String namespace() {
        var ns = document.get("namespace");
        return ns == null || ns.toString().isBlank() ? DEFAULT_NAMESPACE : ns.toString();
    }

    public String loadName() {
        return loadNameOf(document);
    }

    public int version() {
        var raw = document.get("version");
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return 1;
    }

    public String displayName() {
        var metadata = asMap(document.get("metadata"));
        var name = metadata.get("displayName");
        return name == null ? loadName() : name.toString();
    }

    public boolean isTipRack() {
        return Boolean.TRUE.equals(asMap(document.get("parameters")).get("isTiprack"));
    }

    /**
     * Well names in column-major order, from {@code ordering} or else a {@code grid} block.
     */
    public List<String> wellNames() {
        var ordering = document.get("ordering");
        if (ordering instanceof List<?> columns && !columns.isEmpty()) {
            var names = new ArrayList<String>();
            for (var column : columns) {
                if (column instanceof List<?> wells) {
                    wells.forEach(well -> names.add(String.valueOf(well)));
                }
            }
            return List.copyOf(names);
        }
        var grid = asMap(document.get("grid"));
        int rows = intOr(grid.get("rows"), 1);
        int cols = intOr(grid.get("columns"), 1);
        var names = new ArrayList<String>(rows * cols);
        for (int col = 1; col <= cols; col++) {
            for (int row = 0; row < rows; row++) {
                names.add((char) ('A' + row) + Integer.toString(col));
            }
        }
        return List.copyOf(names);
    }

    public boolean matches(String loadName, String namespace, Integer version) {
        if (!loadName().equals(loadName)) {
            return false;
        }
        if (namespace != null && !namespace.isBlank() && !namespace().equals(namespace)) {
            return false;
        }
        return version == null || version() == version;
    }

    private static String loadNameOf(Map<String, Object> document) {
        var loadName = asMap(document.get("parameters")).get("loadName");
        return loadName == null || loadName.toString().isBlank() ? null : loadName.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static int intOr(Object raw, int fallback) {
        return raw instanceof Number number ? number.intValue() : fallback;
    }
}

package work.labsim.simulator.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.labsim.simulator.runtime.Location;
import work.labsim.simulator.runtime.SimulationContext;

/**
 * Typed access to the loosely-typed parameter maps of protocol steps.
 */
final class StepParams {
    private StepParams() {}

    static String string(Map<String, Object> params, String key) {
        var value = params.get(key);
        return value == null ? null : value.toString();
    }

    static String requireString(Map<String, Object> params, String key) {
        var value = string(params, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "'");
        }
        return value;
    }

    static Double number(Map<String, Object> params, String key) {
        var value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("'" + key + "' must be a number: " + value);
        }
    }

    static double number(Map<String, Object> params, String key, double fallback) {
        var value = number(params, key);
        return value == null ? fallback : value;
    }

    static double requireNumber(Map<String, Object> params, String key) {
        var value = number(params, key);
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + key + "'");
        }
        return value;
    }

    static Integer integer(Map<String, Object> params, String key) {
        var value = number(params, key);
        return value == null ? null : (int) Math.round(value);
    }

    static List<String> strings(Map<String, Object> params, String key) {
        var value = params.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            return List.of(value.toString());
        }
        var result = new ArrayList<String>(list.size());
        list.forEach(item -> result.add(String.valueOf(item)));
        return result;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Map<String, Object> params, String key) {
        var value = params.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) map;
    }

    /**
     * Location from {@code labware}/{@code well} keys; the well defaults to the first one.
     * Returns null when no labware is named.
     */
    static Location optionalLocation(SimulationContext ctx, Map<String, Object> params) {
        var labwareName = string(params, "labware");
        if (labwareName == null) {
            return null;
        }
        var labware = ctx.labware(labwareName);
        var well = string(params, "well");
        return well == null ? labware.firstWell() : labware.well(well);
    }

    static Location location(SimulationContext ctx, Map<String, Object> params) {
        var location = optionalLocation(ctx, params);
        if (location == null) {
            throw new IllegalArgumentException("Missing 'labware'");
        }
        return location;
    }
}

package work.labsim.simulator.protocol;

import java.util.Locale;
import work.labsim.simulator.error.ProtocolParseException;

/**
 * Protocol API generation a source protocol declares in {@code metadata.apiLevel}.
 */
public enum ApiLevel {
    V1("1"),
    V2("2");

    private final String tag;

    ApiLevel(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ApiLevel parse(Object raw) {
        if (raw == null) {
            throw new ProtocolParseException("apiLevel must not be empty");
        }
        var text = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (text.startsWith("v")) {
            text = text.substring(1);
        }
        int dot = text.indexOf('.');
        var major = dot < 0 ? text : text.substring(0, dot);
        switch (major) {
            case "1":
                return V1;
            case "2":
                return V2;
            default:
                throw new ProtocolParseException("Unsupported apiLevel: " + raw);
        }
    }
}

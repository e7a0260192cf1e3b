package work.labsim.simulator.shared;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads JSON/YAML documents into plain ordered maps and lists.
 */
public final class DocumentReader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DocumentReader() {}

    public static Map<String, Object> readJsonObject(String text) throws IOException {
        return toObject(JSON_MAPPER.readTree(text));
    }

    public static Map<String, Object> readYamlObject(String text) throws IOException {
        return toObject(YAML_MAPPER.readTree(text));
    }

    private static Map<String, Object> toObject(JsonNode root) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new IOException("document is empty");
        }
        if (!root.isObject()) {
            throw new IOException("document root must be an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) convertNode(root);
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}

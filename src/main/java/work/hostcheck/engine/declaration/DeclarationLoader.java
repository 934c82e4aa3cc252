package work.hostcheck.engine.declaration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads declaration documents written in the Salt state layout:
 * <pre>
 * nginx_is_installed:
 *   hostcheck.package:
 *     - name: nginx
 *     - is_installed: true
 * </pre>
 * The {@code hostcheck.} prefix is optional and the argument list may also be a single mapping.
 * {@code name} is the subject and defaults to the declaration id.
 */
public final class DeclarationLoader {
    public static final String NAMESPACE_PREFIX = "hostcheck.";
    static final String SUBJECT_KEY = "name";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DeclarationLoader() {}

    public static List<Declaration> loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read declarations: " + path, ex);
        }
    }

    public static List<Declaration> loadFromString(String yaml) {
        try {
            return parse(YAML_MAPPER.readTree(yaml), "<inline>");
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse declarations: " + ex.getMessage(), ex);
        }
    }

    private static List<Declaration> parse(InputStream in, String source) throws IOException {
        return parse(YAML_MAPPER.readTree(in), source);
    }

    private static List<Declaration> parse(JsonNode root, String source) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Declaration document " + source + " must be a mapping of ids");
        }
        var declarations = new ArrayList<Declaration>();
        var ids = root.fields();
        while (ids.hasNext()) {
            var entry = ids.next();
            declarations.add(toDeclaration(entry.getKey(), entry.getValue(), source));
        }
        return declarations;
    }

    private static Declaration toDeclaration(String id, JsonNode body, String source) {
        if (body == null || !body.isObject() || body.size() != 1) {
            throw new IllegalArgumentException("Declaration " + id + " in " + source + " must name exactly one resource");
        }
        var resource = body.fields().next();
        String resourceType = resource.getKey().startsWith(NAMESPACE_PREFIX)
            ? resource.getKey().substring(NAMESPACE_PREFIX.length())
            : resource.getKey();
        Map<String, Object> arguments = readArguments(id, resource.getValue(), source);
        Object subject = arguments.remove(SUBJECT_KEY);
        return new Declaration(id, resourceType, subject == null ? id : String.valueOf(subject), arguments);
    }

    private static Map<String, Object> readArguments(String id, JsonNode node, String source) {
        var arguments = new LinkedHashMap<String, Object>();
        if (node == null || node.isNull()) {
            return arguments;
        }
        if (node.isObject()) {
            node.fields().forEachRemaining(field -> arguments.put(field.getKey(), toValue(field.getValue())));
            return arguments;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Arguments of " + id + " in " + source + " must be a list or a mapping");
        }
        for (JsonNode item : node) {
            if (!item.isObject() || item.size() != 1) {
                throw new IllegalArgumentException(
                    "Each argument of " + id + " in " + source + " must be a single-key mapping, got: " + item
                );
            }
            var field = item.fields().next();
            arguments.put(field.getKey(), toValue(field.getValue()));
        }
        return arguments;
    }

    private static Object toValue(JsonNode node) {
        return YAML_MAPPER.convertValue(node, Object.class);
    }
}

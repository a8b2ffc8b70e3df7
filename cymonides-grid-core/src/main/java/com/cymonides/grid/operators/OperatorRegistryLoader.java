package com.cymonides.grid.operators;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads an {@link OperatorRegistry} from a JSON or YAML file or classpath resource.
 * <p>
 * Accepted shapes: {@code {"operators": [...]}}, {@code {"operators": {"id": {...}}}} or a
 * bare list. A missing resource yields an empty registry; a malformed one is an error.
 */
public final class OperatorRegistryLoader {

    private static final Logger LOG = Logger.getLogger(OperatorRegistryLoader.class);
    private static final TypeReference<Map<String, Object>> ENTRY = new TypeReference<>() {
    };

    private final ObjectMapper json = new ObjectMapper();
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public OperatorRegistry loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = OperatorRegistryLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                LOG.warnf("Operator registry resource %s not found, using an empty registry", resourcePath);
                return OperatorRegistry.empty();
            }
            return load(in, resourcePath);
        }
    }

    public OperatorRegistry loadFromPath(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.warnf("Operator registry file %s not found, using an empty registry", path);
            return OperatorRegistry.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.getFileName().toString());
        }
    }

    public OperatorRegistry load(InputStream in, String name) throws IOException {
        ObjectMapper mapper = isYaml(name) ? yaml : json;
        JsonNode root = mapper.readTree(in);
        OperatorRegistry registry = new OperatorRegistry(toDescriptors(mapper, root));
        LOG.infof("Loaded %d operators from %s", registry.total(), name);
        return registry;
    }

    private static List<OperatorDescriptor> toDescriptors(ObjectMapper mapper, JsonNode root) {
        List<OperatorDescriptor> out = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return out;
        }
        JsonNode ops = root.has("operators") ? root.get("operators") : root;
        if (ops.isArray()) {
            ops.elements().forEachRemaining(entry -> add(mapper, entry, null, out));
        } else if (ops.isObject()) {
            // keyed by id; the key fills in a missing "id" field
            Iterator<Map.Entry<String, JsonNode>> fields = ops.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                add(mapper, field.getValue(), field.getKey(), out);
            }
        }
        return out;
    }

    private static void add(ObjectMapper mapper, JsonNode entry, String key, List<OperatorDescriptor> out) {
        if (!entry.isObject()) {
            LOG.debugf("Skipping non-object operator entry %s", entry);
            return;
        }
        Map<String, Object> fields = new LinkedHashMap<>(mapper.convertValue(entry, ENTRY));
        if (key != null) {
            fields.putIfAbsent("id", key);
        }
        out.add(OperatorDescriptor.fromMap(fields));
    }

    private static boolean isYaml(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}

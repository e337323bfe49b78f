package com.wayfinder.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.tree.PopBehavior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads {@link NavigatorConfig} from a JSON object such as:
 *
 * <pre>
 * {
 *   "defaultPopBehavior": "CASCADE",
 *   "compactLayout": false,
 *   "keyLength": 12
 * }
 * </pre>
 *
 * Missing fields take their defaults and a missing file yields the default
 * configuration.
 */
public class NavigatorConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(NavigatorConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final ConfigSchema SCHEMA = createSchema();

    private static ConfigSchema createSchema() {
        NavigatorConfig defaults = NavigatorConfig.defaults();
        Set<String> popBehaviors = Arrays.stream(PopBehavior.values())
            .map(Enum::name)
            .collect(Collectors.toSet());

        Map<String, ConfigSchema.FieldDefinition> fields = new LinkedHashMap<>();
        fields.put("defaultPopBehavior", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.STRING)
            .allowed(popBehaviors)
            .defaultValue(defaults.defaultPopBehavior().name())
            .build());
        fields.put("compactLayout", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.BOOLEAN)
            .defaultValue(defaults.compactLayout())
            .build());
        fields.put("keyLength", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.INTEGER)
            .range(NavigatorConfig.MIN_KEY_LENGTH, NavigatorConfig.MAX_KEY_LENGTH)
            .defaultValue(defaults.keyLength())
            .build());
        fields.put("validateOnUpdate", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.BOOLEAN)
            .defaultValue(defaults.validateOnUpdate())
            .build());
        fields.put("maxDepth", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.INTEGER)
            .range(1, 1_000)
            .defaultValue(defaults.maxDepth())
            .build());
        fields.put("maxNodeCount", new ConfigSchema.FieldDefinition.Builder()
            .type(ConfigSchema.FieldType.INTEGER)
            .range(1, 1_000_000)
            .defaultValue(defaults.maxNodeCount())
            .build());
        return new ConfigSchema(fields);
    }

    /**
     * Loads configuration from a file.
     *
     * @param configFile path of the JSON file
     * @return the configuration, defaults if the file does not exist
     * @throws ConfigLoadException if the file cannot be read or parsed
     * @throws ConfigValidationException if a value is invalid
     */
    public NavigatorConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        if (!Files.exists(configFile)) {
            LOGGER.debug("No navigator config at {}, using defaults", configFile);
            return NavigatorConfig.defaults();
        }

        String content;
        try {
            content = Files.readString(configFile);
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to read navigator config from '%s'", configFile), e
            );
        }

        NavigatorConfig config = parse(content);
        LOGGER.info("Loaded navigator config from {}", configFile);
        return config;
    }

    /**
     * Parses configuration from JSON text.
     *
     * @throws ConfigLoadException if the text is not valid JSON
     * @throws ConfigValidationException if it is not an object or a value is invalid
     */
    public NavigatorConfig parse(String json) throws ConfigLoadException, ConfigValidationException {
        JsonNode jsonNode;
        try {
            jsonNode = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Navigator config is not valid JSON", e);
        }
        if (jsonNode == null || !jsonNode.isObject()) {
            throw new ConfigValidationException("Navigator config must be a JSON object");
        }

        Map<String, Object> raw = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = jsonNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            raw.put(field.getKey(), convertJsonNode(field.getValue()));
        }

        Map<String, Object> values = SCHEMA.validate(raw);
        return NavigatorConfig.builder()
            .defaultPopBehavior(PopBehavior.valueOf((String) values.get("defaultPopBehavior")))
            .compactLayout((Boolean) values.get("compactLayout"))
            .keyLength((Integer) values.get("keyLength"))
            .validateOnUpdate((Boolean) values.get("validateOnUpdate"))
            .maxDepth((Integer) values.get("maxDepth"))
            .maxNodeCount((Integer) values.get("maxNodeCount"))
            .build();
    }

    /**
     * Converts a scalar JsonNode to a Java object. Containers are kept as
     * JsonNode so that type validation rejects them.
     */
    private Object convertJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isInt()) {
            return node.asInt();
        } else if (node.isNumber()) {
            return node.numberValue();
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isNull()) {
            return null;
        }
        return node;
    }
}

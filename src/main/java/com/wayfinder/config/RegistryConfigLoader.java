package com.wayfinder.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.node.PaneRole;
import com.wayfinder.scope.MapPaneRoleRegistry;
import com.wayfinder.scope.MapScopeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Loads route-based scope and pane role tables from JSON:
 *
 * <pre>
 * {
 *   "scopes": { "main-tabs": ["home", "search"] },
 *   "paneRoles": { "list-detail": { "detail": "SUPPORTING" } }
 * }
 * </pre>
 *
 * Both sections are optional.
 */
public class RegistryConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Registries built from one configuration document.
     */
    public record Registries(MapScopeRegistry scopeRegistry, MapPaneRoleRegistry paneRoleRegistry) {}

    /**
     * Loads registries from a file.
     *
     * @throws ConfigLoadException if the file cannot be read or parsed
     * @throws ConfigValidationException if the document has the wrong shape
     */
    public Registries load(Path file) throws ConfigLoadException, ConfigValidationException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to read registry config from '%s'", file), e
            );
        }
        Registries registries = parse(content);
        LOGGER.info("Loaded scope and pane role registries from {}", file);
        return registries;
    }

    /**
     * Parses registries from JSON text.
     *
     * @throws ConfigLoadException if the text is not valid JSON
     * @throws ConfigValidationException if the document has the wrong shape
     */
    public Registries parse(String json) throws ConfigLoadException, ConfigValidationException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Registry config is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigValidationException("Registry config must be a JSON object");
        }

        MapScopeRegistry.Builder scopes = MapScopeRegistry.builder();
        JsonNode scopesNode = root.path("scopes");
        if (!scopesNode.isMissingNode()) {
            requireObject(scopesNode, "scopes");
            Iterator<Map.Entry<String, JsonNode>> entries = scopesNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String path = "scopes." + entry.getKey();
                if (!entry.getValue().isArray()) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' must be an array of routes", path), path);
                }
                for (JsonNode route : entry.getValue()) {
                    if (!route.isTextual()) {
                        throw new ConfigValidationException(
                            String.format("Field '%s' contains a non-string route", path), path);
                    }
                    scopes.scopeRoutes(entry.getKey(), route.asText());
                }
            }
        }

        MapPaneRoleRegistry.Builder paneRoles = MapPaneRoleRegistry.builder();
        JsonNode rolesNode = root.path("paneRoles");
        if (!rolesNode.isMissingNode()) {
            requireObject(rolesNode, "paneRoles");
            Iterator<Map.Entry<String, JsonNode>> entries = rolesNode.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String scopePath = "paneRoles." + entry.getKey();
                requireObject(entry.getValue(), scopePath);
                Iterator<Map.Entry<String, JsonNode>> routes = entry.getValue().fields();
                while (routes.hasNext()) {
                    Map.Entry<String, JsonNode> route = routes.next();
                    String path = scopePath + "." + route.getKey();
                    paneRoles.routeRole(entry.getKey(), route.getKey(), parseRole(route.getValue(), path));
                }
            }
        }

        return new Registries(scopes.build(), paneRoles.build());
    }

    private static void requireObject(JsonNode node, String path) throws ConfigValidationException {
        if (!node.isObject()) {
            throw new ConfigValidationException(String.format("Field '%s' must be an object", path), path);
        }
    }

    private static PaneRole parseRole(JsonNode value, String path) throws ConfigValidationException {
        String message = String.format("Field '%s' must be one of PRIMARY, SUPPORTING, EXTRA, got %s", path, value);
        if (!value.isTextual()) {
            throw new ConfigValidationException(message, path);
        }
        try {
            return PaneRole.valueOf(value.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(message, e);
        }
    }
}

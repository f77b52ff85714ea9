package com.factmarrow.config;

import com.factmarrow.exception.ConfigInvalidException;
import com.factmarrow.exception.ConfigMissingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a YAML configuration resource and returns one top-level section of it.
 */
public final class YamlConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new YAMLMapper();

    private YamlConfigLoader() {
    }

    /**
     * Loads {@code resource} and returns the object under {@code section}.
     * A missing or null section yields an empty object.
     *
     * @throws ConfigMissingException if the resource does not exist
     * @throws ConfigInvalidException if the resource is not YAML, or the section is not a mapping
     */
    public static ObjectNode loadSection(Resource resource, String section) {
        if (resource == null || !resource.exists()) {
            throw new ConfigMissingException(describe(resource));
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigInvalidException("Unable to parse " + describe(resource) + ": " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!root.isObject()) {
            throw new ConfigInvalidException(describe(resource) + ": expected a mapping at the top level");
        }

        JsonNode node = root.get(section);
        if (node == null || node.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            throw new ConfigInvalidException(describe(resource) + ": '" + section + "' must be a mapping");
        }
        return (ObjectNode) node;
    }

    private static String describe(Resource resource) {
        return resource != null ? resource.getDescription() : "<no resource>";
    }
}

package com.factmarrow.agent;

import com.factmarrow.config.YamlConfigLoader;
import com.factmarrow.exception.ConfigInvalidException;
import com.factmarrow.exception.NotFoundException;
import com.factmarrow.model.AgentDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Agent table loaded once from YAML:
 * <pre>
 * agents:
 *   fact_extractor:
 *     model: anthropic/claude-sonnet-4-0
 *     instruction: |
 *       ...
 *     sub_agents: []
 * </pre>
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public static final String DEFAULT_MODEL = "anthropic/claude-sonnet-4-0";

    private final Map<String, AgentDefinition> agents;

    public AgentRegistry(Resource config) {
        AgentTable table = new AgentTable(YamlConfigLoader.loadSection(config, "agents"));
        this.agents = Collections.unmodifiableMap(table.parse(config.getDescription()));
        log.info("Loaded {} agent configurations from {}", agents.size(), config.getDescription());
    }

    /**
     * @throws NotFoundException if no agent has this name
     */
    public AgentDefinition get(String name) {
        AgentDefinition definition = agents.get(name);
        if (definition == null) {
            throw new NotFoundException("Agent", name);
        }
        return definition;
    }

    public List<String> subAgents(String name) {
        return get(name).subAgents();
    }

    /** Model of the agent; {@value #DEFAULT_MODEL} when the table does not name one. */
    public String model(String name) {
        return get(name).model();
    }

    public boolean contains(String name) {
        return agents.containsKey(name);
    }

    public Set<String> names() {
        return agents.keySet();
    }

    public int size() {
        return agents.size();
    }

    private record AgentTable(ObjectNode node) {

        Map<String, AgentDefinition> parse(String source) {
            Map<String, AgentDefinition> parsed = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> {
                String name = entry.getKey();
                JsonNode body = entry.getValue();
                if (body == null || body.isNull()) {
                    parsed.put(name, new AgentDefinition(name, DEFAULT_MODEL, "", List.of()));
                    return;
                }
                if (!body.isObject()) {
                    throw new ConfigInvalidException(source + ": agent '" + name + "' must be a mapping");
                }
                parsed.put(name, new AgentDefinition(
                        name,
                        text(body, "model", DEFAULT_MODEL, source, name),
                        text(body, "instruction", "", source, name),
                        names(body, "sub_agents", source, name)
                ));
            });
            return parsed;
        }

        private static String text(JsonNode body, String field, String fallback, String source, String agent) {
            JsonNode value = body.get(field);
            if (value == null || value.isNull()) {
                return fallback;
            }
            if (!value.isValueNode()) {
                throw new ConfigInvalidException(source + ": agent '" + agent + "' field '" + field + "' must be a scalar");
            }
            String text = value.asText();
            return text.isBlank() ? fallback : text;
        }

        private static List<String> names(JsonNode body, String field, String source, String agent) {
            JsonNode value = body.get(field);
            if (value == null || value.isNull()) {
                return List.of();
            }
            if (!value.isArray()) {
                throw new ConfigInvalidException(source + ": agent '" + agent + "' field '" + field + "' must be a list");
            }
            List<String> result = new ArrayList<>();
            value.forEach(item -> result.add(item.asText()));
            return result;
        }
    }
}

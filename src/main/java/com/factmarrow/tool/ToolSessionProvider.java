package com.factmarrow.tool;

import com.factmarrow.config.YamlConfigLoader;
import com.factmarrow.exception.ConfigInvalidException;
import com.factmarrow.model.AgentRole;
import com.factmarrow.model.ToolServerConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.io.Resource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Tool access for agents.
 * <p>
 * Holds the static role → tool table and one lazily opened {@link ToolServerSession}
 * per configured server. Servers are read from YAML:
 * <pre>
 * mcp_servers:
 *   filesystem:
 *     url: http://localhost:3001
 *     read_timeout: 30s
 *     tools: [read_file, list_directory, write_file]
 * </pre>
 */
public class ToolSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(ToolSessionProvider.class);

    /** Table entry granting every tool of every configured server. */
    public static final String ALL_TOOLS = "all";

    private static final Map<AgentRole, List<String>> ROLE_TOOLS = new EnumMap<>(AgentRole.class);

    static {
        ROLE_TOOLS.put(AgentRole.ROOT_COORDINATOR, List.of(ALL_TOOLS));
        ROLE_TOOLS.put(AgentRole.DOCUMENT_PROCESSOR, List.of("read_file", "list_directory"));
        ROLE_TOOLS.put(AgentRole.FACT_EXTRACTOR, List.of("read_file", "search"));
        ROLE_TOOLS.put(AgentRole.VERIFICATION_SPECIALIST, List.of("search", "query_health_data"));
        ROLE_TOOLS.put(AgentRole.REPORT_WRITER, List.of("write_file", "create_issue"));
        ROLE_TOOLS.put(AgentRole.QUALITY_REVIEWER, List.of("read_file", "search"));
    }

    private final Map<String, ToolServerConfig> servers;
    private final Function<ToolServerConfig, ToolServerSession> sessionFactory;
    private final ConcurrentMap<String, ToolServerSession> sessions = new ConcurrentHashMap<>();

    public ToolSessionProvider(Resource config) {
        this(parse(YamlConfigLoader.loadSection(config, "mcp_servers"), config.getDescription()),
                ToolServerSession::new);
        log.info("Loaded {} MCP server configurations from {}", servers.size(), config.getDescription());
    }

    ToolSessionProvider(Map<String, ToolServerConfig> servers,
                        Function<ToolServerConfig, ToolServerSession> sessionFactory) {
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        this.sessionFactory = sessionFactory;
    }

    // ── Tool table ──────────────────────────────────────────────────────────

    /** Tool names granted to the role, as written in the table ({@code all} unexpanded). */
    public List<String> toolsFor(AgentRole role) {
        return ROLE_TOOLS.getOrDefault(role, List.of());
    }

    /**
     * Tool names granted to the role with {@code all} expanded to every tool
     * hosted by a configured server.
     */
    public List<String> resolveTools(AgentRole role) {
        List<String> granted = toolsFor(role);
        if (!granted.contains(ALL_TOOLS)) {
            return granted;
        }
        return servers.values().stream()
                .flatMap(server -> server.tools().stream())
                .distinct()
                .toList();
    }

    /** Name of the first configured server hosting {@code tool}. */
    public Optional<String> serverFor(String tool) {
        return servers.values().stream()
                .filter(server -> server.tools().contains(tool))
                .map(ToolServerConfig::name)
                .findFirst();
    }

    // ── Sessions ────────────────────────────────────────────────────────────

    /**
     * Returns the session for {@code serverName}, opening it on first use.
     * Empty when no server of that name is configured.
     */
    public Optional<ToolServerSession> getSession(String serverName) {
        ToolServerConfig config = servers.get(serverName);
        if (config == null) {
            log.warn("Server not found: {}", serverName);
            return Optional.empty();
        }
        // computeIfAbsent serializes creation per server name
        return Optional.of(sessions.computeIfAbsent(serverName, name -> {
            log.debug("Created session for server: {}", name);
            return sessionFactory.apply(config);
        }));
    }

    /** Closes every open session. Safe to call repeatedly. */
    public void closeAll() {
        int closed = 0;
        for (String name : List.copyOf(sessions.keySet())) {
            ToolServerSession session = sessions.remove(name);
            if (session == null) {
                continue;
            }
            try {
                session.close();
                closed++;
            } catch (RuntimeException e) {
                log.warn("Failed to close session for server {}: {}", name, e.getMessage(), e);
            }
        }
        log.info("Closed all MCP server sessions ({} closed)", closed);
    }

    public int openSessionCount() {
        return sessions.size();
    }

    public Set<String> serverNames() {
        return servers.keySet();
    }

    // ── Config parsing ──────────────────────────────────────────────────────

    private static Map<String, ToolServerConfig> parse(ObjectNode section, String source) {
        Map<String, ToolServerConfig> parsed = new LinkedHashMap<>();
        section.fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            JsonNode body = entry.getValue();
            if (body == null || !body.isObject()) {
                throw new ConfigInvalidException(source + ": server '" + name + "' must be a mapping");
            }
            JsonNode url = body.get("url");
            if (url == null || url.asText().isBlank()) {
                throw new ConfigInvalidException(source + ": server '" + name + "' has no url");
            }
            parsed.put(name, new ToolServerConfig(
                    name,
                    url.asText(),
                    duration(body, "connect_timeout", source, name),
                    duration(body, "read_timeout", source, name),
                    headers(body, source, name),
                    tools(body, source, name)
            ));
        });
        return parsed;
    }

    private static Duration duration(JsonNode body, String field, String source, String server) {
        JsonNode value = body.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return value.isNumber()
                    ? Duration.ofSeconds(value.asLong())
                    : DurationStyle.detectAndParse(value.asText());
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException(
                    source + ": server '" + server + "' has an invalid " + field + ": " + value.asText(), e);
        }
    }

    private static Map<String, String> headers(JsonNode body, String source, String server) {
        JsonNode value = body.get("headers");
        if (value == null || value.isNull()) {
            return Map.of();
        }
        if (!value.isObject()) {
            throw new ConfigInvalidException(source + ": server '" + server + "' headers must be a mapping");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        value.fields().forEachRemaining(h -> headers.put(h.getKey(), h.getValue().asText()));
        return headers;
    }

    private static List<String> tools(JsonNode body, String source, String server) {
        JsonNode value = body.get("tools");
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new ConfigInvalidException(source + ": server '" + server + "' tools must be a list");
        }
        List<String> tools = new ArrayList<>();
        value.forEach(tool -> tools.add(tool.asText()));
        return tools;
    }
}

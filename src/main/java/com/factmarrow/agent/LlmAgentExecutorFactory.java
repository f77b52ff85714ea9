package com.factmarrow.agent;

import com.factmarrow.exception.ConfigInvalidException;
import com.factmarrow.exception.NotFoundException;
import com.factmarrow.model.AgentDefinition;
import com.factmarrow.model.AgentRole;
import com.factmarrow.service.ResilientLlmCaller;
import com.factmarrow.tool.ToolSessionProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Builds {@link LlmAgentExecutor}s: picks the chat client for the agent's model provider
 * and exposes the agent role's tools as tool callbacks backed by tool-server sessions.
 */
public class LlmAgentExecutorFactory implements AgentExecutorFactory {

    private static final Logger log = LoggerFactory.getLogger(LlmAgentExecutorFactory.class);

    private final Map<String, ChatClient> clientsByProvider;
    private final ToolSessionProvider toolSessionProvider;
    private final ResilientLlmCaller llmCaller;
    private final ObjectMapper objectMapper;
    private final Executor taskExecutor;
    private final Duration taskTimeout;

    public LlmAgentExecutorFactory(Map<String, ChatClient> clientsByProvider,
                                   ToolSessionProvider toolSessionProvider,
                                   ResilientLlmCaller llmCaller,
                                   ObjectMapper objectMapper,
                                   Executor taskExecutor,
                                   Duration taskTimeout) {
        this.clientsByProvider = Map.copyOf(clientsByProvider);
        this.toolSessionProvider = toolSessionProvider;
        this.llmCaller = llmCaller;
        this.objectMapper = objectMapper;
        this.taskExecutor = taskExecutor;
        this.taskTimeout = taskTimeout;
    }

    /**
     * @throws ConfigInvalidException if the agent's model id is malformed or names an unknown provider
     */
    @Override
    public AgentExecutor create(AgentDefinition definition) {
        ModelId modelId;
        try {
            modelId = ModelId.parse(definition.model());
        } catch (IllegalArgumentException e) {
            throw new ConfigInvalidException("Agent '" + definition.name() + "': " + e.getMessage(), e);
        }

        ChatClient chatClient = clientsByProvider.get(modelId.provider());
        if (chatClient == null) {
            throw new ConfigInvalidException("Agent '" + definition.name()
                    + "' uses unsupported model provider '" + modelId.provider() + "'");
        }

        List<ToolCallback> callbacks = toolCallbacks(definition.name());
        log.debug("Agent '{}': model {} via {}, {} tools", definition.name(),
                modelId.model(), modelId.provider(), callbacks.size());

        return new LlmAgentExecutor(definition, chatClient, modelId, callbacks,
                llmCaller, objectMapper, taskExecutor, taskTimeout);
    }

    List<ToolCallback> toolCallbacks(String agentName) {
        Optional<AgentRole> role = AgentRole.fromId(agentName);
        if (role.isEmpty()) {
            return List.of();
        }

        List<ToolCallback> callbacks = new ArrayList<>();
        for (String tool : toolSessionProvider.resolveTools(role.get())) {
            Optional<String> server = toolSessionProvider.serverFor(tool);
            if (server.isEmpty()) {
                log.debug("Agent '{}': tool '{}' is not hosted by any configured server, skipped", agentName, tool);
                continue;
            }
            String serverName = server.get();
            callbacks.add(FunctionToolCallback
                    .<Map<String, Object>, String>builder(tool, arguments -> invokeTool(serverName, tool, arguments))
                    .description("Invoke the '" + tool + "' tool on tool server '" + serverName + "'")
                    .inputType(Map.class)
                    .build());
        }
        return callbacks;
    }

    private String invokeTool(String serverName, String tool, Map<String, Object> arguments) {
        return toolSessionProvider.getSession(serverName)
                .orElseThrow(() -> new NotFoundException("Tool server", serverName))
                .callTool(tool, arguments);
    }
}

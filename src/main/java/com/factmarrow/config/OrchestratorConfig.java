package com.factmarrow.config;

import com.factmarrow.agent.AgentExecutorFactory;
import com.factmarrow.agent.AgentRegistry;
import com.factmarrow.agent.LlmAgentExecutorFactory;
import com.factmarrow.agent.ModelId;
import com.factmarrow.orchestrator.ActiveAnalysisTable;
import com.factmarrow.orchestrator.AnalysisProgressListener;
import com.factmarrow.orchestrator.WorkflowOrchestrator;
import com.factmarrow.service.ResilientLlmCaller;
import com.factmarrow.tool.ToolSessionProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Builds the orchestrator and its collaborators once at startup.
 * Configuration errors (missing or invalid YAML) abort application startup.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public AgentRegistry agentRegistry(FactMarrowProperties properties, ResourceLoader resourceLoader) {
        return new AgentRegistry(resourceLoader.getResource(properties.agents().config()));
    }

    @Bean
    public ToolSessionProvider toolSessionProvider(FactMarrowProperties properties, ResourceLoader resourceLoader) {
        return new ToolSessionProvider(resourceLoader.getResource(properties.mcp().config()));
    }

    @Bean
    public ResilientLlmCaller resilientLlmCaller(FactMarrowProperties properties) {
        return new ResilientLlmCaller(properties.llm().maxRetries(), properties.llm().retryBackoff());
    }

    @Bean
    public AgentExecutorFactory agentExecutorFactory(@Qualifier("anthropicChatClient") ChatClient anthropicChatClient,
                                                     @Qualifier("openAiChatClient") ChatClient openAiChatClient,
                                                     ToolSessionProvider toolSessionProvider,
                                                     ResilientLlmCaller resilientLlmCaller,
                                                     ObjectMapper objectMapper,
                                                     @Qualifier("agentExecutor") ExecutorService agentExecutor,
                                                     FactMarrowProperties properties) {
        return new LlmAgentExecutorFactory(
                Map.of(ModelId.ANTHROPIC, anthropicChatClient, ModelId.OPENAI, openAiChatClient),
                toolSessionProvider,
                resilientLlmCaller,
                objectMapper,
                agentExecutor,
                properties.workflow().taskTimeout());
    }

    @Bean
    public ActiveAnalysisTable activeAnalysisTable(FactMarrowProperties properties) {
        return new ActiveAnalysisTable(properties.workflow().retention(), properties.workflow().maxRetained());
    }

    @Bean
    public WorkflowOrchestrator workflowOrchestrator(AgentRegistry agentRegistry,
                                                     ToolSessionProvider toolSessionProvider,
                                                     AgentExecutorFactory agentExecutorFactory,
                                                     ActiveAnalysisTable activeAnalysisTable,
                                                     ObjectProvider<AnalysisProgressListener> listeners,
                                                     FactMarrowProperties properties) {
        return new WorkflowOrchestrator(
                agentRegistry,
                toolSessionProvider,
                agentExecutorFactory,
                activeAnalysisTable,
                listeners.orderedStream().toList(),
                properties.workflow().verificationConcurrency(),
                Clock.systemUTC());
    }
}

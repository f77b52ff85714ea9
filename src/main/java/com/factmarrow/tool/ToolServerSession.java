package com.factmarrow.tool;

import com.factmarrow.exception.FactMarrowException;
import com.factmarrow.model.ToolServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived HTTP session to one tool server. Tools are invoked with
 * {@code POST {url}/tools/{tool}} and a JSON object of arguments.
 */
public class ToolServerSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolServerSession.class);

    private final ToolServerConfig config;
    private final RestClient restClient;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public ToolServerSession(ToolServerConfig config) {
        this.config = config;

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(config.connectTimeout());
        factory.setReadTimeout(config.readTimeout());

        this.restClient = RestClient.builder()
                .baseUrl(config.url())
                .requestFactory(factory)
                .defaultHeaders(headers -> config.headers().forEach(headers::set))
                .build();
    }

    /**
     * Invokes a tool on this server and returns the raw response body.
     *
     * @throws IllegalStateException if the session was closed
     * @throws FactMarrowException   if the server is unreachable or answers with an error
     */
    public String callTool(String tool, Map<String, Object> arguments) {
        if (!open.get()) {
            throw new IllegalStateException("Session to tool server '" + config.name() + "' is closed");
        }
        log.debug("Calling tool '{}' on server '{}'", tool, config.name());
        try {
            return restClient.post()
                    .uri("/tools/{tool}", tool)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(arguments != null ? arguments : Map.of())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new FactMarrowException(
                    "Tool '" + tool + "' on server '" + config.name() + "' failed: " + e.getMessage(), e);
        }
    }

    public String serverName() {
        return config.name();
    }

    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.debug("Closed session for server: {}", config.name());
        }
    }
}

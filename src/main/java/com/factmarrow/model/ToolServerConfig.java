package com.factmarrow.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Connection parameters of one external tool server.
 *
 * @param name           server name
 * @param url            base URL of the server
 * @param connectTimeout connection timeout
 * @param readTimeout    read timeout
 * @param headers        headers sent with every request
 * @param tools          names of the tools hosted by the server
 */
public record ToolServerConfig(
        String name,
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers,
        List<String> tools
) {
    public ToolServerConfig {
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(60);
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}

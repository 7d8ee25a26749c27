package com.phodal.anthropicbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for the OpenAI-compatible upstream
 */
@Data
@ConfigurationProperties(prefix = "bridge.openai")
public class BridgeProperties {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    /**
     * Base URL of the chat completion service, without the /chat/completions suffix.
     */
    private String baseUrl = DEFAULT_BASE_URL;

    /**
     * Sent as a Bearer token on every request.
     */
    private String apiKey;

    /**
     * Response timeout. Applies to the time between reads for streams.
     */
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Largest non-streaming response body that will be buffered.
     */
    private DataSize maxInMemorySize = DataSize.ofMegabytes(16);

    /**
     * Extra headers added to every request.
     */
    private Map<String, String> defaultHeaders = new LinkedHashMap<>();

    public void setBaseUrl(String baseUrl) {
        String url = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.baseUrl = url;
    }
}

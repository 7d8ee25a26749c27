package com.phodal.anthropicbridge.config;

import com.phodal.anthropicbridge.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@link WebClient} that talks to the upstream service
 */
@Slf4j
public final class BridgeWebClients {

    private BridgeWebClients() {
    }

    public static WebClient create(BridgeProperties properties) {
        return configure(WebClient.builder(), properties).build();
    }

    public static WebClient.Builder configure(WebClient.Builder builder, BridgeProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new IllegalArgumentException("bridge.openai.api-key must be set");
        }

        Map<String, String> headers = new LinkedHashMap<>(properties.getDefaultHeaders());
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        log.debug("Creating upstream client for {} with headers {}",
                properties.getBaseUrl(), LogSanitizer.sanitizeHeaders(headers));

        HttpClient httpClient = HttpClient.create().responseTimeout(properties.getTimeout());
        int maxInMemorySize = (int) properties.getMaxInMemorySize().toBytes();

        return builder
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(h -> headers.forEach(h::set))
                .filter(ExchangeFilterFunction.ofRequestProcessor(BridgeWebClients::logRequest))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize));
    }

    static Mono<ClientRequest> logRequest(ClientRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("{} {} headers={}", request.method(), request.url(),
                    LogSanitizer.sanitizeHeaders(request.headers().toSingleValueMap()));
        }
        return Mono.just(request);
    }
}

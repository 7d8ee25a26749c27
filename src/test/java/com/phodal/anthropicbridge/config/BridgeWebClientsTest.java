package com.phodal.anthropicbridge.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeWebClientsTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(BridgeWebClients.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void everyRequestIsLoggedWithMaskedHeaders() {
        BridgeProperties properties = new BridgeProperties();
        properties.setApiKey("sk-secret");
        properties.setBaseUrl("http://localhost:8080/v1/");
        properties.getDefaultHeaders().put("OpenAI-Organization", "org-1");

        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        WebClient webClient = BridgeWebClients.configure(WebClient.builder().exchangeFunction(request -> {
            sent.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        }), properties).build();

        webClient.post().uri("/chat/completions").retrieve().toBodilessEntity().block();
        webClient.post().uri("/chat/completions").retrieve().toBodilessEntity().block();

        assertThat(sent.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-secret");
        assertThat(sent.get().headers().getFirst("OpenAI-Organization")).isEqualTo("org-1");

        List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertThat(messages)
                .filteredOn(message -> message.startsWith("POST http://localhost:8080/v1/chat/completions"))
                .hasSize(2)
                .allSatisfy(message -> assertThat(message)
                        .contains("Authorization=***")
                        .contains("OpenAI-Organization=org-1"));
        assertThat(messages).noneMatch(message -> message.contains("sk-secret"));
    }
}

package com.phodal.anthropicbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.anthropicbridge.client.BridgeClient;
import com.phodal.anthropicbridge.service.BridgeMetrics;
import com.phodal.anthropicbridge.service.OpenAIBridgeService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Registers the bridge beans once {@code bridge.openai.api-key} is configured
 */
@AutoConfiguration
@EnableConfigurationProperties(BridgeProperties.class)
@ConditionalOnProperty(prefix = "bridge.openai", name = "api-key")
public class BridgeAutoConfiguration {

    public static final String WEB_CLIENT_BEAN = "bridgeWebClient";

    @Bean
    @ConditionalOnMissingBean
    public BridgeMetrics bridgeMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new BridgeMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean(WEB_CLIENT_BEAN)
    @ConditionalOnMissingBean(name = WEB_CLIENT_BEAN)
    public WebClient bridgeWebClient(BridgeProperties properties) {
        return BridgeWebClients.create(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenAIBridgeService openAIBridgeService(@Qualifier(WEB_CLIENT_BEAN) WebClient webClient,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   BridgeMetrics metrics) {
        return new OpenAIBridgeService(webClient, objectMapper.getIfAvailable(ObjectMapper::new), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public BridgeClient bridgeClient(OpenAIBridgeService service) {
        return new BridgeClient(service);
    }
}

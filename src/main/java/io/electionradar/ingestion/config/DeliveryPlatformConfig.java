package io.electionradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.electionradar.ingestion.platform.BotApiPlatform;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DeliveryPlatformConfig {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryPlatformConfig.class);

    static final String TELEGRAM = "telegram";
    static final String BALE = "bale";

    @Bean
    @Order(1)
    public DeliveryPlatform telegramPlatform(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                                             IngestionConfig config) {
        return platform(TELEGRAM, config.platforms().telegram(), restClientBuilder, objectMapper, config);
    }

    @Bean
    @Order(2)
    public DeliveryPlatform balePlatform(RestClient.Builder restClientBuilder, ObjectMapper objectMapper,
                                         IngestionConfig config) {
        return platform(BALE, config.platforms().bale(), restClientBuilder, objectMapper, config);
    }

    private DeliveryPlatform platform(String name, PlatformConfig platformConfig, RestClient.Builder builder,
                                      ObjectMapper objectMapper, IngestionConfig config) {
        PlatformConfig effective = platformConfig != null ? platformConfig : new PlatformConfig(null, null, null);

        var requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) config.budget().platformTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        logger.info("Delivery platform {}: {}", name, effective.isConfigured() ? "configured" : "not configured");
        return new BotApiPlatform(name, effective, builder.clone().requestFactory(requestFactory), objectMapper);
    }
}

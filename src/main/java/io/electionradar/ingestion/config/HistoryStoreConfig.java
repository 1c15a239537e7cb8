package io.electionradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.electionradar.ingestion.history.AppwriteHistoryStore;
import io.electionradar.ingestion.history.HistoryStore;
import io.electionradar.ingestion.history.RedisHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HistoryStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(HistoryStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "ingestion.history", name = "type", havingValue = "redis")
    public HistoryStore redisHistoryStore(StringRedisTemplate redisTemplate,
                                          ObjectMapper objectMapper,
                                          IngestionConfig config) {
        logger.info("History store: Redis (record TTL {})", config.history().recordTtl());
        return new RedisHistoryStore(redisTemplate, objectMapper, config.history().recordTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "ingestion.history", name = "type", havingValue = "appwrite", matchIfMissing = true)
    public HistoryStore appwriteHistoryStore(RestClient.Builder restClientBuilder, IngestionConfig config) {
        HistoryConfig history = config.history();
        logger.info("History store: Appwrite at {} (collection {})", history.endpoint(), history.collectionId());

        var requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) config.budget().dbTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        return new AppwriteHistoryStore(restClientBuilder.requestFactory(requestFactory), history);
    }
}

package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.RunSummary;
import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.api.dto.kafka.ArticlePublishedEvent;
import io.electionradar.ingestion.api.dto.kafka.RunCompletedEvent;
import io.electionradar.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Optional run events for downstream consumers. Sending never blocks or fails a run.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    public boolean isEnabled() {
        return kafkaProperties.enabled();
    }

    public void publishArticlePublished(ScoredArticle article, List<String> platforms) {
        if (!isEnabled()) return;

        try {
            ArticlePublishedEvent event = ArticlePublishedEvent.create(
                    article.fingerprint(),
                    article.title(),
                    article.link(),
                    article.source(),
                    article.score(),
                    article.tier().name(),
                    article.entities(),
                    article.topics(),
                    platforms
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.articlePublished(), article.fingerprint(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent article published event: {} to partition: {}",
                            article.fingerprint(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send article published event: {}", article.fingerprint(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing article published event for: {}", article.link(), e);
        }
    }

    public void publishRunCompleted(RunSummary summary) {
        if (!isEnabled()) return;

        try {
            RunCompletedEvent event = RunCompletedEvent.create(
                    summary.status(),
                    summary.feedsOk(),
                    summary.feedsFailed(),
                    summary.entriesTotal(),
                    summary.posted(),
                    summary.postedByPlatform(),
                    summary.overflow(),
                    summary.errors(),
                    summary.elapsedMs()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.runCompleted(), event.runId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent run completed event: {} ({} posted)", event.runId(), summary.posted());
                } else {
                    logger.error("Failed to send run completed event: {}", event.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing run completed event", e);
        }
    }
}

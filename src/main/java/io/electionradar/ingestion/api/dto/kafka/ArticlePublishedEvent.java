package io.electionradar.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record ArticlePublishedEvent(
        @JsonProperty("contentHash") String contentHash,
        @JsonProperty("title") String title,
        @JsonProperty("link") String link,
        @JsonProperty("source") String source,
        @JsonProperty("score") int score,
        @JsonProperty("tier") String tier,
        @JsonProperty("candidates") List<String> candidates,
        @JsonProperty("topics") List<String> topics,
        @JsonProperty("platforms") List<String> platforms,
        @JsonProperty("publishedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant publishedAt
) {
    public static ArticlePublishedEvent create(String contentHash, String title, String link,
                                               String source, int score, String tier,
                                               List<String> candidates, List<String> topics,
                                               List<String> platforms) {
        return new ArticlePublishedEvent(
                contentHash, title, link, source, score, tier,
                candidates, topics, platforms, Instant.now()
        );
    }
}

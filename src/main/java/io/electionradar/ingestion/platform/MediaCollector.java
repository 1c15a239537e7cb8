package io.electionradar.ingestion.platform;

import io.electionradar.ingestion.api.dto.Article;

import java.time.Duration;
import java.util.List;

/**
 * Finds images to attach to a post. An empty list is a normal outcome: the post goes out as text.
 */
public interface MediaCollector {

    List<String> collect(Article article, Duration budget);
}

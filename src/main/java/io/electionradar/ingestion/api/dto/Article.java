package io.electionradar.ingestion.api.dto;

import com.rometools.rome.feed.synd.SyndEntry;

import java.time.Instant;

/**
 * One feed entry as fetched.
 *
 * @param publishedAt may be null when the feed carries neither a published nor an updated date
 * @param entry       the raw syndication entry; only the media collector reads it
 */
public record Article(
        String title,
        String link,
        String summary,
        Instant publishedAt,
        String source,
        String feedUrl,
        SyndEntry entry
) {}

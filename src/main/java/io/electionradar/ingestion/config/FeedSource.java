package io.electionradar.ingestion.config;

/**
 * One syndication feed. {@code trustBonus} is added to the relevance score of every
 * article from this source after tiering.
 */
public record FeedSource(
        String url,
        String name,
        int trustBonus,
        boolean enabled
) {
    public String getSimpleName() {
        return name != null && !name.isBlank() ? name : url;
    }
}

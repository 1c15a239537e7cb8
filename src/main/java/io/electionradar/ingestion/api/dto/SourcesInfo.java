package io.electionradar.ingestion.api.dto;

import java.time.Instant;
import java.util.List;

public record SourcesInfo(
        List<SourceView> sources,
        int totalSources,
        int enabledSources,
        Instant generatedAt
) {
    public record SourceView(String name, String url, int trustBonus, boolean enabled) {}
}

package io.electionradar.ingestion.config;

public record PlatformsConfig(
        PlatformConfig telegram,
        PlatformConfig bale
) {}

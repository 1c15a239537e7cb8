package io.electionradar.ingestion.config;

import io.electionradar.ingestion.dedup.ContentFingerprinter;
import io.electionradar.ingestion.dedup.DedupEngine;
import io.electionradar.ingestion.pipeline.RateLimiter;
import io.electionradar.ingestion.platform.CaptionFormatter;
import io.electionradar.ingestion.platform.MediaCollector;
import io.electionradar.ingestion.platform.RssMediaCollector;
import io.electionradar.ingestion.scoring.KeywordRuleSet;
import io.electionradar.ingestion.scoring.ScoringEngine;
import io.electionradar.ingestion.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public TextNormalizer textNormalizer(IngestionConfig config) {
        return new TextNormalizer(config.dedup().stopwords());
    }

    @Bean
    public KeywordRuleSet keywordRuleSet(IngestionConfig config, TextNormalizer textNormalizer) {
        KeywordRuleSet rules = KeywordRuleSet.compile(config.scoring(), textNormalizer);
        logger.info("Compiled keyword rules: {} core, {} contextual, {} rejection, {} entities, {} topics",
                rules.core().size(), rules.contextual().size(), rules.rejection().size(),
                rules.entities().size(), rules.topics().size());
        return rules;
    }

    @Bean
    public ScoringEngine scoringEngine(KeywordRuleSet keywordRuleSet, TextNormalizer textNormalizer,
                                       IngestionConfig config) {
        return new ScoringEngine(keywordRuleSet, textNormalizer, config.scoring());
    }

    @Bean
    public ContentFingerprinter contentFingerprinter(TextNormalizer textNormalizer) {
        return new ContentFingerprinter(textNormalizer);
    }

    @Bean
    public DedupEngine dedupEngine(TextNormalizer textNormalizer, IngestionConfig config) {
        return new DedupEngine(textNormalizer, config.dedup());
    }

    /**
     * Shared across runs so the 60-second window holds for back-to-back scheduled runs too.
     */
    @Bean
    public RateLimiter rateLimiter(Clock clock, IngestionConfig config) {
        return new RateLimiter(clock, config.publish().rateLimitPerMinute());
    }

    @Bean
    public CaptionFormatter captionFormatter(TextNormalizer textNormalizer, IngestionConfig config) {
        return new CaptionFormatter(textNormalizer, config.scoring(), config.publish());
    }

    @Bean
    public MediaCollector mediaCollector(IngestionConfig config) {
        return new RssMediaCollector(config.publish().maxImages(), config.http().userAgentsOrDefault().get(0));
    }
}

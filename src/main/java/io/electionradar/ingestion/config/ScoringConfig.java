package io.electionradar.ingestion.config;

import java.util.List;

/**
 * Raw keyword tables and weights. Compiled once into a
 * {@link io.electionradar.ingestion.scoring.KeywordRuleSet}.
 */
public record ScoringConfig(
        int highThreshold,
        int mediumThreshold,
        int entityTitleBonus,
        int entityDescriptionBonus,
        int entityBoost,
        int topicBoost,
        boolean trustBonusPromotesTier,
        List<WeightedKeyword> coreKeywords,
        List<WeightedKeyword> contextualKeywords,
        List<String> rejectionKeywords,
        List<String> knownEntities,
        List<TopicGroup> topics,
        List<HashtagRule> hashtags
) {}

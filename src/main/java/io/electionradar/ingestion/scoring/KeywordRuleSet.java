package io.electionradar.ingestion.scoring;

import io.electionradar.ingestion.config.ScoringConfig;
import io.electionradar.ingestion.config.TopicGroup;
import io.electionradar.ingestion.config.WeightedKeyword;
import io.electionradar.ingestion.text.TextNormalizer;

import java.util.List;
import java.util.Optional;

/**
 * Immutable, pre-compiled keyword tables. Built once at startup and shared by every run.
 */
public record KeywordRuleSet(
        List<WeightedPattern> core,
        List<WeightedPattern> contextual,
        List<KeywordPattern> rejection,
        List<KeywordPattern> entities,
        List<TopicRule> topics
) {

    public KeywordRuleSet {
        core = List.copyOf(core);
        contextual = List.copyOf(contextual);
        rejection = List.copyOf(rejection);
        entities = List.copyOf(entities);
        topics = List.copyOf(topics);
    }

    public static KeywordRuleSet compile(ScoringConfig config, TextNormalizer normalizer) {
        return new KeywordRuleSet(
                weighted(config.coreKeywords(), normalizer),
                weighted(config.contextualKeywords(), normalizer),
                simple(config.rejectionKeywords(), normalizer),
                simple(config.knownEntities(), normalizer),
                topics(config.topics(), normalizer)
        );
    }

    public int size() {
        return core.size() + contextual.size() + rejection.size() + entities.size() + topics.size();
    }

    private static List<WeightedPattern> weighted(List<WeightedKeyword> keywords, TextNormalizer normalizer) {
        if (keywords == null) return List.of();
        return keywords.stream()
                .flatMap(k -> KeywordPattern.compile(k.keyword(), normalizer)
                        .map(p -> new WeightedPattern(p, k.titleWeight(), k.descriptionWeight()))
                        .stream())
                .toList();
    }

    private static List<KeywordPattern> simple(List<String> keywords, TextNormalizer normalizer) {
        if (keywords == null) return List.of();
        return keywords.stream()
                .map(k -> KeywordPattern.compile(k, normalizer))
                .flatMap(Optional::stream)
                .toList();
    }

    private static List<TopicRule> topics(List<TopicGroup> groups, TextNormalizer normalizer) {
        if (groups == null) return List.of();
        return groups.stream()
                .map(g -> new TopicRule(g.name(), g.hashtag(), simple(g.keywords(), normalizer)))
                .filter(rule -> !rule.patterns().isEmpty())
                .toList();
    }
}

package io.electionradar.ingestion.scoring;

import io.electionradar.ingestion.config.ScoringConfig;
import io.electionradar.ingestion.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Relevance of an article to the election topic, computed from title and description.
 */
public class ScoringEngine {

    private final KeywordRuleSet rules;
    private final TextNormalizer normalizer;
    private final ScoringConfig config;

    public ScoringEngine(KeywordRuleSet rules, TextNormalizer normalizer, ScoringConfig config) {
        this.rules = rules;
        this.normalizer = normalizer;
        this.config = config;
    }

    public ScoreResult score(String title, String description) {
        String nt = normalizer.normalize(title);
        String nd = normalizer.normalize(description);
        String all = (nt + " " + nd).trim();

        for (KeywordPattern rejection : rules.rejection()) {
            if (rejection.matches(all)) {
                return ScoreResult.rejection();
            }
        }

        int score = accumulate(rules.core(), nt, nd) + accumulate(rules.contextual(), nt, nd);

        List<String> entities = new ArrayList<>();
        for (KeywordPattern entity : rules.entities()) {
            if (entity.matches(all)) {
                entities.add(entity.keyword());
                score += entity.matches(nt) ? config.entityTitleBonus() : config.entityDescriptionBonus();
            }
        }

        List<String> topics = new ArrayList<>();
        for (TopicRule topic : rules.topics()) {
            if (topic.matches(all) && !topics.contains(topic.topic())) {
                topics.add(topic.topic());
            }
        }

        if (!entities.isEmpty() && score >= config.mediumThreshold()) {
            score += config.entityBoost();
        }
        if (topics.size() >= 2 && score >= config.mediumThreshold()) {
            score += config.topicBoost();
        }

        return new ScoreResult(score, tierOf(score), List.copyOf(entities), List.copyOf(topics), false);
    }

    /**
     * Adds a per-source trust bonus after tiering. The tier only moves when
     * {@code trustBonusPromotesTier} is set; a rejection is never lifted.
     */
    public ScoreResult applyTrustBonus(ScoreResult result, int trustBonus) {
        if (trustBonus == 0 || result.rejected()) {
            return result;
        }
        int boosted = result.score() + trustBonus;
        Tier tier = config.trustBonusPromotesTier() ? tierOf(boosted) : result.tier();
        return new ScoreResult(boosted, tier, result.entities(), result.topics(), false);
    }

    public Tier tierOf(int score) {
        return Tier.of(score, config.highThreshold(), config.mediumThreshold());
    }

    // a description hit only counts when the title did not already match the same keyword
    private static int accumulate(List<WeightedPattern> patterns, String title, String description) {
        int score = 0;
        for (WeightedPattern wp : patterns) {
            if (wp.pattern().matches(title)) {
                score += wp.titleWeight();
            } else if (wp.pattern().matches(description)) {
                score += wp.descriptionWeight();
            }
        }
        return score;
    }
}

package io.electionradar.ingestion.scoring;

import io.electionradar.ingestion.support.TestFixtures;
import io.electionradar.ingestion.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringEngineTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    private ScoringEngine engine(boolean trustBonusPromotesTier) {
        var config = TestFixtures.scoringConfig(trustBonusPromotesTier);
        return new ScoringEngine(KeywordRuleSet.compile(config, normalizer), normalizer, config);
    }

    @Test
    void shouldRateTitleWithTwoCoreKeywordsAsHigh() {
        ScoreResult result = engine(false).score("انتخابات ریاست جمهوری آغاز شد", "");

        assertThat(result.rejected()).isFalse();
        assertThat(result.score()).isEqualTo(8);
        assertThat(result.tier()).isEqualTo(Tier.HIGH);
    }

    @Test
    void shouldMatchWholeTokensOnly() {
        ScoreResult result = engine(false).score("نتایج انتخاباتی", "");

        assertThat(result.score()).isZero();
        assertThat(result.tier()).isEqualTo(Tier.LOW);
    }

    @Test
    void shouldUseDescriptionWeightWhenKeywordIsOnlyInDescription() {
        ScoreResult result = engine(false).score("خبر مهم امروز", "گزارشی از انتخابات");

        assertThat(result.score()).isEqualTo(2);
        assertThat(result.tier()).isEqualTo(Tier.LOW);
    }

    @Test
    void shouldNotCountKeywordTwiceWhenInBothTitleAndDescription() {
        ScoreResult result = engine(false).score("انتخابات", "انتخابات");

        assertThat(result.score()).isEqualTo(4);
        assertThat(result.tier()).isEqualTo(Tier.MEDIUM);
    }

    @Test
    void shouldRejectArticleMatchingRejectionKeyword() {
        ScoreResult result = engine(false).score("فیلم سینمایی درباره انتخابات ریاست جمهوری", "");

        assertThat(result.rejected()).isTrue();
        assertThat(result.score()).isEqualTo(-1);
        assertThat(result.tier()).isEqualTo(Tier.LOW);
    }

    @Test
    void shouldAddEntityBonusAndBoostAndCollectTopics() {
        ScoreResult result = engine(false).score("رد صلاحیت پزشکیان توسط شورای نگهبان", "");

        // 5 + 4 keywords, 2 entity in title, 2 entity boost
        assertThat(result.score()).isEqualTo(13);
        assertThat(result.entities()).containsExactly("پزشکیان");
        assertThat(result.topics()).containsExactly("صلاحیت");
        assertThat(result.tier()).isEqualTo(Tier.HIGH);
    }

    @Test
    void shouldAddTopicBoostWhenTwoTopicsMatch() {
        ScoreResult result = engine(false).score("مناظره درباره رد صلاحیت", "");

        // 5 + 3 keywords, 1 topic boost
        assertThat(result.topics()).containsExactlyInAnyOrder("صلاحیت", "تبلیغات");
        assertThat(result.score()).isEqualTo(9);
    }

    @Test
    void shouldNotBoostBelowMediumThreshold() {
        ScoreResult result = engine(false).score("حزب جلیلی", "");

        // 1 keyword, 2 entity title bonus, then 3 >= medium so boost applies
        assertThat(result.score()).isEqualTo(5);

        ScoreResult weak = engine(false).score("دیدار جلیلی", "");
        assertThat(weak.score()).isEqualTo(2);
        assertThat(weak.tier()).isEqualTo(Tier.LOW);
    }

    @Test
    void shouldKeepTierWhenTrustBonusDoesNotPromote() {
        ScoringEngine engine = engine(false);
        ScoreResult base = engine.score("مناظره امشب", "");

        ScoreResult boosted = engine.applyTrustBonus(base, 3);

        assertThat(base.tier()).isEqualTo(Tier.MEDIUM);
        assertThat(boosted.score()).isEqualTo(6);
        assertThat(boosted.tier()).isEqualTo(Tier.MEDIUM);
    }

    @Test
    void shouldPromoteTierWhenTrustBonusPromotionEnabled() {
        ScoringEngine engine = engine(true);

        ScoreResult boosted = engine.applyTrustBonus(engine.score("مناظره امشب", ""), 3);

        assertThat(boosted.score()).isEqualTo(6);
        assertThat(boosted.tier()).isEqualTo(Tier.HIGH);
    }

    @Test
    void shouldNeverLiftRejectionWithTrustBonus() {
        ScoringEngine engine = engine(true);

        ScoreResult result = engine.applyTrustBonus(ScoreResult.rejection(), 10);

        assertThat(result.rejected()).isTrue();
        assertThat(result.tier()).isEqualTo(Tier.LOW);
    }
}

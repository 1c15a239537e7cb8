package io.electionradar.ingestion.dedup;

import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.history.StoredRecord;
import io.electionradar.ingestion.pipeline.RunLog;
import io.electionradar.ingestion.scoring.Tier;
import io.electionradar.ingestion.support.TestFixtures;
import io.electionradar.ingestion.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DedupEngineTest {

    private final TextNormalizer normalizer = new TextNormalizer();
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter(normalizer);

    private DedupEngine engine;
    private RunLog log;

    @BeforeEach
    void setUp() {
        engine = new DedupEngine(normalizer, TestFixtures.dedupConfig());
        log = RunLog.detached();
    }

    private ScoredArticle article(String title, String link) {
        ScoredArticle scored = TestFixtures.scored(title, link, 7, Tier.HIGH);
        return scored.withFingerprint(fingerprinter.fingerprint(title));
    }

    @Test
    void shouldRejectReorderedTitleAsExactDuplicate() {
        DedupIndex index = engine.buildIndex(List.of(), log);
        ScoredArticle first = article("مجلس شورای اسلامی رای داد", "https://a.ir/1");
        ScoredArticle second = article("رای داد مجلس شورای اسلامی", "https://b.ir/2");

        assertThat(engine.check(first, index)).isEqualTo(DuplicateKind.NONE);
        engine.admit(first, index);

        assertThat(engine.check(second, index)).isEqualTo(DuplicateKind.FINGERPRINT);
    }

    @Test
    void shouldRejectKnownLink() {
        DedupIndex index = engine.buildIndex(List.of(
                new StoredRecord("https://a.ir/1", "عنوان قدیمی کاملا متفاوت", "hash-1", "ISNA")), log);

        DuplicateKind kind = engine.check(article("خبر تازه درباره مناظره", "https://a.ir/1"), index);

        assertThat(kind).isEqualTo(DuplicateKind.LINK);
    }

    @Test
    void shouldFlagFuzzyDuplicateByOverlapEvenWhenSizesDiffer() {
        Set<String> shorter = normalizer.matchingTokens("نامزد اصلی مجلس شورای تهران");
        Set<String> longer = normalizer.matchingTokens("نامزد اصلی مجلس شورای اصفهان امروز دیروز فردا");

        // 4 shared of 5 and 8: overlap 0.8, jaccard 4/9
        assertThat(shorter).hasSize(5);
        assertThat(longer).hasSize(8);
        assertThat(engine.isSimilar(shorter, longer)).isTrue();
        assertThat(engine.isSimilar(longer, shorter)).isTrue();
    }

    @Test
    void shouldFlagFuzzyDuplicateAgainstHistory() {
        DedupIndex index = engine.buildIndex(List.of(
                new StoredRecord("https://a.ir/1", "نامزد اصلی مجلس شورای تهران", "hash-1", "ISNA")), log);

        DuplicateKind kind = engine.check(
                article("نامزد اصلی مجلس شورای اصفهان امروز دیروز فردا", "https://b.ir/9"), index);

        assertThat(kind).isEqualTo(DuplicateKind.FUZZY);
    }

    @Test
    void shouldNotFlagUnrelatedTitles() {
        Set<String> a = normalizer.matchingTokens("مناظره نامزدها امشب پخش میشود");
        Set<String> b = normalizer.matchingTokens("نتایج شمارش آرا اعلام شد");

        assertThat(engine.isSimilar(a, b)).isFalse();
    }

    @Test
    void shouldNeverFlagTitlesWithFewerThanTwoTokens() {
        Set<String> single = normalizer.matchingTokens("انتخابات");

        assertThat(engine.isSimilar(single, single)).isFalse();
        assertThat(engine.isFuzzyDuplicate("انتخابات", List.of(
                new DedupIndex.FuzzyRecord("انتخابات", single)))).isFalse();
    }

    @Test
    void shouldCatchDuplicateWithinSameBatchOnceAdmitted() {
        DedupIndex index = engine.buildIndex(List.of(), log);
        ScoredArticle first = article("نتایج انتخابات ریاست جمهوری اعلام شد", "https://a.ir/1");
        ScoredArticle copy = article("نتایج انتخابات ریاست جمهوری اعلام شد امروز", "https://c.ir/3");

        engine.admit(first, index);

        assertThat(engine.isDuplicate(copy, index)).isTrue();
        assertThat(index.linkCount()).isEqualTo(1);
    }

    @Test
    void shouldCountHashCollisionsInHistory() {
        DedupIndex index = engine.buildIndex(List.of(
                new StoredRecord("https://a.ir/1", "عنوان اول خبر", "same", "ISNA"),
                new StoredRecord("https://a.ir/2", "عنوان دوم خبر", "same", "ISNA")), log);

        assertThat(index.fingerprintCount()).isEqualTo(1);
        assertThat(log.metrics().snapshot().hashCollisions()).isEqualTo(1);
    }
}

package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.Article;
import io.electionradar.ingestion.api.dto.FetchOutcome;
import io.electionradar.ingestion.api.dto.RunSummary;
import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.api.exception.HistoryStoreException;
import io.electionradar.ingestion.config.FeedSource;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.config.PlatformConfig;
import io.electionradar.ingestion.config.PlatformsConfig;
import io.electionradar.ingestion.config.PublishConfig;
import io.electionradar.ingestion.dedup.ContentFingerprinter;
import io.electionradar.ingestion.dedup.DedupEngine;
import io.electionradar.ingestion.history.HistoryStore;
import io.electionradar.ingestion.history.StoredRecord;
import io.electionradar.ingestion.pipeline.ExecutionContext;
import io.electionradar.ingestion.pipeline.RateLimiter;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import io.electionradar.ingestion.scoring.KeywordRuleSet;
import io.electionradar.ingestion.scoring.ScoringEngine;
import io.electionradar.ingestion.support.MutableClock;
import io.electionradar.ingestion.support.TestFixtures;
import io.electionradar.ingestion.text.TextNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionPipelineServiceTest {

    private static final List<FeedSource> SOURCES = List.of(
            new FeedSource("https://isna.ir/rss", "ISNA", 0, true),
            new FeedSource("https://fars.ir/rss", "Fars", 0, true));

    private static final PublishService.Outcome POSTED =
            new PublishService.Outcome(PublishService.Status.POSTED, Map.of("telegram", true));

    @Mock
    private ParallelFeedFetcher feedFetcher;

    @Mock
    private HistoryStore historyStore;

    @Mock
    private PublishService publishService;

    @Mock
    private EventPublisherService eventPublisher;

    @Mock
    private DeliveryPlatform telegram;

    @Mock
    private ExecutionContext context;

    private final MutableClock clock = MutableClock.startingAt("2026-10-19T08:00:00Z");
    private final TextNormalizer normalizer = new TextNormalizer();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        lenient().when(telegram.name()).thenReturn("telegram");
        lenient().when(telegram.isEnabled()).thenReturn(true);
        lenient().when(publishService.platforms()).thenReturn(List.of(telegram));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private IngestionPipelineService service(IngestionConfig config) {
        var scoring = config.scoring();
        return new IngestionPipelineService(
                config,
                feedFetcher,
                historyStore,
                new ScoringEngine(KeywordRuleSet.compile(scoring, normalizer), normalizer, scoring),
                new ContentFingerprinter(normalizer),
                new DedupEngine(normalizer, config.dedup()),
                publishService,
                eventPublisher,
                new RateLimiter(clock, config.publish().rateLimitPerMinute()),
                executor,
                ms -> { },
                clock);
    }

    private Article article(String title, String link, Duration age) {
        return TestFixtures.article(title, link, clock.instant().minus(age));
    }

    private void feedsReturn(Article... articles) {
        when(feedFetcher.fetchAll(anyList(), any(), any(), any()))
                .thenReturn(new FetchOutcome(List.of(articles), 2, 0, 1, 0));
    }

    @Test
    void shouldScoreDedupAndPublishInPriorityOrder() {
        feedsReturn(
                article("مناظره نامزدها امشب", "https://isna.ir/news/5", Duration.ofMinutes(10)),
                article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)),
                article("آغاز شد انتخابات ریاست جمهوری", "https://fars.ir/news/7", Duration.ofHours(2)),
                article("هواشناسی فردا", "https://isna.ir/news/3", Duration.ofHours(1)),
                article("رد صلاحیت نامزدها", "https://fars.ir/news/4", Duration.ofHours(30)));
        when(historyStore.loadRecent(500)).thenReturn(List.of());
        when(publishService.publish(any(), any(), any())).thenReturn(POSTED);

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES)).run(Map.of("trigger", "test"), context);

        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.feedsOk()).isEqualTo(2);
        assertThat(summary.feedsRetried()).isEqualTo(1);
        assertThat(summary.entriesTotal()).isEqualTo(5);
        assertThat(summary.skippedTime()).isEqualTo(1);
        assertThat(summary.skippedLowRelevance()).isEqualTo(1);
        assertThat(summary.skippedDuplicate()).isEqualTo(1);
        assertThat(summary.queuedHigh()).isEqualTo(1);
        assertThat(summary.queuedMedium()).isEqualTo(1);
        assertThat(summary.queuedLow()).isEqualTo(1);
        assertThat(summary.posted()).isEqualTo(2);
        assertThat(summary.postedByPlatform()).containsEntry("telegram", 2);
        assertThat(summary.errors()).isZero();
        assertThat(summary.historyDegraded()).isFalse();

        ArgumentCaptor<ScoredArticle> published = ArgumentCaptor.forClass(ScoredArticle.class);
        verify(publishService, times(2)).publish(published.capture(), any(), any());
        assertThat(published.getAllValues()).extracting(ScoredArticle::title)
                .containsExactly("انتخابات ریاست جمهوری آغاز شد", "مناظره نامزدها امشب");
        assertThat(published.getAllValues()).allSatisfy(item -> assertThat(item.fingerprint()).hasSize(64));

        verify(eventPublisher, times(2)).publishArticlePublished(any(), eq(List.of("telegram")));
        verify(eventPublisher).publishRunCompleted(summary);
        verify(context, atLeastOnce()).log(contains("SUMMARY"));
    }

    @Test
    void shouldAbortWithMissingConfiguration() {
        IngestionConfig config = TestFixtures.ingestionConfig(SOURCES, TestFixtures.publishConfig(),
                new PlatformsConfig(new PlatformConfig("https://api.telegram.org/bot", "", ""), null));

        RunSummary summary = service(config).run(Map.of(), context);

        assertThat(summary.isSuccess()).isFalse();
        assertThat(summary.status()).isEqualTo(RunSummary.STATUS_ERROR);
        assertThat(summary.error()).isEqualTo(RunSummary.ERROR_MISSING_CONFIG);
        assertThat(summary.missingKeys())
                .containsExactly("ingestion.platforms.telegram.token", "ingestion.platforms.telegram.chat-id");
        verifyNoInteractions(feedFetcher, historyStore, publishService);
        verify(context).error(contains("Missing required configuration"));
    }

    @Test
    void shouldSkipKnownLinksFromHistory() {
        feedsReturn(article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)));
        when(historyStore.loadRecent(500)).thenReturn(List.of(
                new StoredRecord("https://isna.ir/news/1", "عنوان قبلی", "old-hash", "ISNA")));

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES)).run(Map.of(), null);

        assertThat(summary.skippedDuplicate()).isEqualTo(1);
        assertThat(summary.posted()).isZero();
        verify(publishService, never()).publish(any(), any(), any());
    }

    @Test
    void shouldContinueWithLocalDedupWhenHistoryLoadFails() {
        feedsReturn(article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)));
        when(historyStore.loadRecent(anyInt())).thenThrow(new HistoryStoreException("HTTP 503"));
        when(publishService.publish(any(), any(), any())).thenReturn(POSTED);

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES)).run(Map.of(), null);

        assertThat(summary.historyDegraded()).isTrue();
        assertThat(summary.posted()).isEqualTo(1);
    }

    @Test
    void shouldCountOverflowBeyondBatchSize() {
        PublishConfig oneAtATime = new PublishConfig(1, 8, Duration.ZERO, Duration.ofSeconds(4), 5, 1024, 500, 2,
                Duration.ofSeconds(2), Duration.ofSeconds(2), true, "@candidatoryiran", "");
        feedsReturn(
                article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)),
                article("مناظره نامزدها امشب", "https://isna.ir/news/5", Duration.ofHours(1)));
        when(historyStore.loadRecent(500)).thenReturn(List.of());
        when(publishService.publish(any(), any(), any())).thenReturn(POSTED);

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES, oneAtATime)).run(Map.of(), null);

        assertThat(summary.posted()).isEqualTo(1);
        assertThat(summary.overflow()).isEqualTo(1);
    }

    @Test
    void shouldClassifyPublishOutcomes() {
        feedsReturn(
                article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)),
                article("رد صلاحیت نامزدها اعلام شد", "https://isna.ir/news/2", Duration.ofHours(1)),
                article("مناظره نامزدها امشب", "https://isna.ir/news/5", Duration.ofHours(1)));
        when(historyStore.loadRecent(500)).thenReturn(List.of());
        when(publishService.publish(any(), any(), any()))
                .thenReturn(new PublishService.Outcome(PublishService.Status.CONFLICT, Map.of()))
                .thenReturn(new PublishService.Outcome(PublishService.Status.DELIVERY_FAILED, Map.of("telegram", false)))
                .thenReturn(new PublishService.Outcome(PublishService.Status.NO_BUDGET, Map.of()));

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES)).run(Map.of(), null);

        assertThat(summary.posted()).isZero();
        assertThat(summary.skippedDuplicate()).isEqualTo(1);
        assertThat(summary.errors()).isEqualTo(1);
        assertThat(summary.overflow()).isEqualTo(1);
        assertThat(summary.postedByPlatform()).containsEntry("telegram", 0);
    }

    @Test
    void shouldStopPublishingWhenRateWindowIsFull() {
        PublishConfig noCapacity = new PublishConfig(4, 0, Duration.ZERO, Duration.ofSeconds(4), 5, 1024, 500, 2,
                Duration.ofSeconds(2), Duration.ofSeconds(2), true, "", "");
        feedsReturn(article("انتخابات ریاست جمهوری آغاز شد", "https://isna.ir/news/1", Duration.ofHours(1)));
        when(historyStore.loadRecent(500)).thenReturn(List.of());

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES, noCapacity)).run(Map.of(), null);

        assertThat(summary.posted()).isZero();
        assertThat(summary.overflow()).isEqualTo(1);
        verify(publishService, never()).publish(any(), any(), any());
    }

    @Test
    void shouldNotLoadHistoryWhenNothingWasFetched() {
        when(feedFetcher.fetchAll(anyList(), any(), any(), any())).thenReturn(FetchOutcome.none());

        RunSummary summary = service(TestFixtures.ingestionConfig(SOURCES)).run(null, null);

        assertThat(summary.isSuccess()).isTrue();
        assertThat(summary.entriesTotal()).isZero();
        verifyNoInteractions(historyStore);
        assertThat(summary.metrics()).isNotNull();
    }
}

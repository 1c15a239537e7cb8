package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.Article;
import io.electionradar.ingestion.api.dto.FetchOutcome;
import io.electionradar.ingestion.api.dto.RunSummary;
import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.api.exception.MissingConfigurationException;
import io.electionradar.ingestion.config.BudgetConfig;
import io.electionradar.ingestion.config.FeedSource;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.dedup.ContentFingerprinter;
import io.electionradar.ingestion.dedup.DedupEngine;
import io.electionradar.ingestion.dedup.DedupIndex;
import io.electionradar.ingestion.dedup.DuplicateKind;
import io.electionradar.ingestion.history.HistoryStore;
import io.electionradar.ingestion.history.StoredRecord;
import io.electionradar.ingestion.pipeline.DeadlineBudget;
import io.electionradar.ingestion.pipeline.ExecutionContext;
import io.electionradar.ingestion.pipeline.RateLimiter;
import io.electionradar.ingestion.pipeline.RunLog;
import io.electionradar.ingestion.pipeline.RunStats;
import io.electionradar.ingestion.pipeline.TriageQueue;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import io.electionradar.ingestion.scoring.ScoreResult;
import io.electionradar.ingestion.scoring.ScoringEngine;
import io.electionradar.ingestion.scoring.Tier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One deadline-bounded run: fetch, load history, score and dedup, publish, summarize.
 * Every phase takes its budget from a single {@link DeadlineBudget}; only missing
 * configuration aborts a run, everything else degrades into counters.
 */
@Service
public class IngestionPipelineService {

    private final IngestionConfig config;
    private final ParallelFeedFetcher feedFetcher;
    private final HistoryStore historyStore;
    private final ScoringEngine scoringEngine;
    private final ContentFingerprinter fingerprinter;
    private final DedupEngine dedupEngine;
    private final PublishService publishService;
    private final EventPublisherService eventPublisher;
    private final RateLimiter rateLimiter;
    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final Clock clock;

    public IngestionPipelineService(IngestionConfig config,
                                    ParallelFeedFetcher feedFetcher,
                                    HistoryStore historyStore,
                                    ScoringEngine scoringEngine,
                                    ContentFingerprinter fingerprinter,
                                    DedupEngine dedupEngine,
                                    PublishService publishService,
                                    EventPublisherService eventPublisher,
                                    RateLimiter rateLimiter,
                                    @Qualifier("pipelineExecutor") ExecutorService executor,
                                    Sleeper sleeper,
                                    Clock clock) {
        this.config = config;
        this.feedFetcher = feedFetcher;
        this.historyStore = historyStore;
        this.scoringEngine = scoringEngine;
        this.fingerprinter = fingerprinter;
        this.dedupEngine = dedupEngine;
        this.publishService = publishService;
        this.eventPublisher = eventPublisher;
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @param event   optional trigger payload; only {@code trigger} is read, for logging
     * @param context optional log sinks of the caller
     */
    public RunSummary run(Map<String, Object> event, ExecutionContext context) {
        RunLog log = new RunLog(context);
        BudgetConfig budgets = config.budget();
        DeadlineBudget budget = DeadlineBudget.start(clock, budgets.globalDeadline());

        log.info("Election news run started at {} (trigger: {}, deadline {}s)", clock.instant(),
                event != null ? event.getOrDefault("trigger", "direct") : "direct",
                budgets.globalDeadline().toSeconds());

        try {
            config.validate();
        } catch (MissingConfigurationException e) {
            log.error("Missing required configuration: {}", e.getMissingKeys());
            return RunSummary.missingConfig(e.getMissingKeys(), budget.elapsed().toMillis());
        }

        RunStats stats = new RunStats();
        List<String> enabledPlatforms = new ArrayList<>();
        for (DeliveryPlatform platform : publishService.platforms()) {
            if (platform.isEnabled()) {
                enabledPlatforms.add(platform.name());
                stats.registerPlatform(platform.name());
            } else {
                log.info("{} not configured, skipping it", platform.name());
            }
        }
        log.info("Platforms: {}", String.join(", ", enabledPlatforms));

        List<Article> articles = fetchPhase(stats, budget, log);
        if (!articles.isEmpty()) {
            DedupIndex index = loadHistoryPhase(stats, budget, log);
            List<ScoredArticle> queue = triagePhase(articles, index, stats, budget, log);
            publishPhase(queue, stats, budget, log);
        }

        return finish(stats, budget, log);
    }

    private List<Article> fetchPhase(RunStats stats, DeadlineBudget budget, RunLog log) {
        BudgetConfig budgets = config.budget();
        List<FeedSource> sources = config.getEnabledSources();

        Duration fetchBudget = budget.phaseBudget(budgets.feedsTotalTimeout(), budgets.feedPhaseReserve());
        if (fetchBudget.compareTo(budgets.minFeedBudget()) < 0) {
            log.warn("Insufficient time for feeds ({})", budget.describeRemaining());
            return List.of();
        }

        log.info("Phase 1: fetching {} feeds (budget={}ms)", sources.size(), fetchBudget.toMillis());
        FetchOutcome outcome = feedFetcher.fetchAll(sources, fetchBudget, budget, log);
        stats.recordFetch(outcome.ok(), outcome.failed(), outcome.retried(), outcome.articles().size());

        List<Article> articles = new ArrayList<>(outcome.articles());
        // newest first, undated last; List.sort is stable
        articles.sort(Comparator.comparing(Article::publishedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        log.info("Phase 1 done: {} entries, {}/{} feeds ok [{}]",
                articles.size(), outcome.ok(), sources.size(), budget.describeRemaining());
        return articles;
    }

    private DedupIndex loadHistoryPhase(RunStats stats, DeadlineBudget budget, RunLog log) {
        BudgetConfig budgets = config.budget();
        Duration dbBudget = budget.phaseBudget(budgets.dbTimeout(), budgets.dbPhaseReserve());

        List<StoredRecord> history = List.of();
        if (dbBudget.compareTo(budgets.minDbBudget()) > 0) {
            log.info("Phase 2: history load (budget={}ms)", dbBudget.toMillis());
            Future<List<StoredRecord>> future = null;
            try {
                future = executor.submit(() -> historyStore.loadRecent(config.dedup().historyLimit()));
                history = future.get(dbBudget.toMillis(), TimeUnit.MILLISECONDS);
                log.info("Phase 2 done: {} records [{}]", history.size(), budget.describeRemaining());
            } catch (TimeoutException e) {
                future.cancel(true);
                stats.markHistoryDegraded();
                log.warn("History load timed out, local-only dedup");
            } catch (ExecutionException | RejectedExecutionException e) {
                stats.markHistoryDegraded();
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("History load failed: {}", cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stats.markHistoryDegraded();
            }
        } else {
            stats.markHistoryDegraded();
            log.warn("No budget for history load ({})", budget.describeRemaining());
        }

        return dedupEngine.buildIndex(history, log);
    }

    private List<ScoredArticle> triagePhase(List<Article> articles, DedupIndex index, RunStats stats,
                                            DeadlineBudget budget, RunLog log) {
        log.info("Phase 3: scoring and dedup");
        Instant threshold = clock.instant().minus(config.processing().hoursThreshold());
        Map<String, Integer> trustBonuses = new HashMap<>();
        for (FeedSource source : config.getEnabledSources()) {
            trustBonuses.put(source.getSimpleName(), source.trustBonus());
        }

        List<ScoredArticle> queue = new ArrayList<>();
        for (Article article : articles) {
            if (article.publishedAt() != null && article.publishedAt().isBefore(threshold)) {
                stats.recordSkippedTime();
                continue;
            }

            ScoreResult result = scoringEngine.applyTrustBonus(
                    scoringEngine.score(article.title(), article.summary()),
                    trustBonuses.getOrDefault(article.source(), 0));
            ScoredArticle scored = ScoredArticle.of(article, result)
                    .withFingerprint(fingerprinter.fingerprint(article.title()));

            if (result.tier() == Tier.LOW) {
                stats.recordLowRelevance();
                log.debug("[LOW] s={} [{}] {}", result.score(), article.source(), RunLog.preview(article.title()));
                continue;
            }

            DuplicateKind duplicate = dedupEngine.check(scored, index);
            if (duplicate.isDuplicate()) {
                stats.recordDuplicate();
                if (duplicate == DuplicateKind.FUZZY) {
                    log.metrics().recordFuzzyMatch();
                }
                log.debug("[DUP:{}] [{}] {}", duplicate, article.source(), RunLog.preview(article.title()));
                continue;
            }

            dedupEngine.admit(scored, index);
            stats.recordQueued(result.tier());
            queue.add(scored);
            log.item("QUEUED", scored);
        }

        log.info("Phase 3 done: queue={} (H={} M={}) [{}]",
                queue.size(), stats.queuedHigh(), stats.queuedMedium(), budget.describeRemaining());
        return queue;
    }

    private void publishPhase(List<ScoredArticle> queue, RunStats stats, DeadlineBudget budget, RunLog log) {
        TriageQueue triage = new TriageQueue(queue, config.publish().batchSize(), rateLimiter);
        log.info("Phase 4: publishing up to {} of {} queued", config.publish().batchSize(), triage.size());

        while (triage.hasNext()) {
            TriageQueue.Halt halt = triage.checkHalt(budget, config.budget().publishStopMargin());
            if (halt != TriageQueue.Halt.NONE) {
                int overflow = triage.drainOverflow();
                stats.recordOverflow(overflow);
                switch (halt) {
                    case DEADLINE -> log.info("Time low ({}), stopping with {} unpublished",
                            budget.describeRemaining(), overflow);
                    case BATCH_FULL -> log.info("Batch limit ({}) reached, {} left for next run",
                            config.publish().batchSize(), overflow);
                    case RATE_LIMITED -> log.warn("Rate limit reached, {} left for next run", overflow);
                    default -> { }
                }
                break;
            }

            ScoredArticle item = triage.poll();
            PublishService.Outcome outcome;
            try {
                outcome = publishService.publish(item, budget, log);
            } catch (RuntimeException e) {
                stats.recordError();
                log.error("Publishing [{}] {} failed: {}", item.source(), RunLog.preview(item.title()), e.getMessage());
                continue;
            }

            List<String> deliveredTo = new ArrayList<>();
            outcome.platformResults().forEach((platform, ok) -> {
                if (ok) {
                    stats.recordPlatformSuccess(platform);
                    deliveredTo.add(platform);
                }
            });

            switch (outcome.status()) {
                case POSTED -> {
                    stats.recordPosted();
                    triage.markPublished();
                    eventPublisher.publishArticlePublished(item, deliveredTo);
                    interPostDelay(triage, budget);
                }
                case CONFLICT -> stats.recordDuplicate();
                case NO_BUDGET -> {
                    stats.recordOverflow(1 + triage.drainOverflow());
                    return;
                }
                case PERSIST_FAILED, DELIVERY_FAILED -> stats.recordError();
            }
        }
    }

    private void interPostDelay(TriageQueue triage, DeadlineBudget budget) {
        Duration delay = config.publish().interPostDelay();
        if (delay.isZero() || !triage.hasNext() || triage.isBatchFull()
                || !budget.hasAtLeast(config.publish().interPostMinRemaining())) {
            return;
        }
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private RunSummary finish(RunStats stats, DeadlineBudget budget, RunLog log) {
        RunSummary summary = RunSummary.of(stats, log.metrics().snapshot(), budget.elapsed().toMillis());

        log.info("=========== SUMMARY ===========");
        log.info("Time: {}ms / {}s", summary.elapsedMs(), budget.ceiling().toSeconds());
        log.info("Feeds: {} ok | {} fail | {} retries",
                summary.feedsOk(), summary.feedsFailed(), summary.feedsRetried());
        log.info("Entries: {}", summary.entriesTotal());
        log.info("Skipped: time={} relevance={} dupe={}",
                summary.skippedTime(), summary.skippedLowRelevance(), summary.skippedDuplicate());
        log.info("Queue: H={} M={} L={}", summary.queuedHigh(), summary.queuedMedium(), summary.queuedLow());
        log.info("Posted: {} {}", summary.posted(), summary.postedByPlatform());
        log.info("Retries: {} | Fallbacks: {}",
                summary.metrics().postRetries(), summary.metrics().postFallbacks());
        log.info("Errors: {} | Overflow: {}", summary.errors(), summary.overflow());
        if (summary.historyDegraded()) {
            log.warn("History load degraded");
        }
        log.info("===============================");

        eventPublisher.publishRunCompleted(summary);
        return summary;
    }
}

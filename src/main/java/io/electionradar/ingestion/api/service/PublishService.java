package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.config.BudgetConfig;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.config.PublishConfig;
import io.electionradar.ingestion.history.HistoryStore;
import io.electionradar.ingestion.history.PublishRecord;
import io.electionradar.ingestion.pipeline.DeadlineBudget;
import io.electionradar.ingestion.pipeline.RunLog;
import io.electionradar.ingestion.platform.CaptionFormatter;
import io.electionradar.ingestion.platform.DeliveryPlatform;
import io.electionradar.ingestion.platform.MediaCollector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes one article: history record first, then every enabled platform concurrently.
 * The history write is the cross-run dedup gate, so nothing is delivered unless it succeeded.
 */
@Service
public class PublishService {

    public enum Status {
        POSTED,
        NO_BUDGET,
        PERSIST_FAILED,
        CONFLICT,
        DELIVERY_FAILED
    }

    /**
     * @param platformResults per enabled platform; disabled platforms are absent
     */
    public record Outcome(Status status, Map<String, Boolean> platformResults) {

        static Outcome of(Status status) {
            return new Outcome(status, Map.of());
        }

        public boolean posted() {
            return status == Status.POSTED;
        }
    }

    private final HistoryStore historyStore;
    private final MediaCollector mediaCollector;
    private final CaptionFormatter captionFormatter;
    private final List<DeliveryPlatform> platforms;
    private final PlatformDeliveryService deliveryService;
    private final ExecutorService executor;
    private final Clock clock;
    private final BudgetConfig budgetConfig;
    private final PublishConfig publishConfig;

    public PublishService(HistoryStore historyStore,
                          MediaCollector mediaCollector,
                          CaptionFormatter captionFormatter,
                          List<DeliveryPlatform> platforms,
                          PlatformDeliveryService deliveryService,
                          @Qualifier("pipelineExecutor") ExecutorService executor,
                          Clock clock,
                          IngestionConfig config) {
        this.historyStore = historyStore;
        this.mediaCollector = mediaCollector;
        this.captionFormatter = captionFormatter;
        this.platforms = List.copyOf(platforms);
        this.deliveryService = deliveryService;
        this.executor = executor;
        this.clock = clock;
        this.budgetConfig = config.budget();
        this.publishConfig = config.publish();
    }

    public List<DeliveryPlatform> platforms() {
        return platforms;
    }

    public Outcome publish(ScoredArticle item, DeadlineBudget budget, RunLog log) {
        Duration saveBudget = budget.phaseBudget(budgetConfig.dbTimeout(), budgetConfig.saveReserve());
        if (saveBudget.compareTo(budgetConfig.minSaveBudget()) < 0) {
            log.warn("No time for history save [{}] {}", item.source(), RunLog.preview(item.title()));
            return Outcome.of(Status.NO_BUDGET);
        }

        PublishRecord record = toRecord(item);
        Boolean saved = await(() -> historyStore.save(record), saveBudget, "history save", log);
        if (saved == null) {
            return Outcome.of(Status.PERSIST_FAILED);
        }
        if (!saved) {
            log.item("CONFLICT", item);
            return Outcome.of(Status.CONFLICT);
        }

        List<String> images = collectMedia(item, budget, log);
        String caption = captionFormatter.format(item);

        Map<String, Boolean> results = deliverAll(item, images, caption, budget, log);
        boolean anySuccess = results.isEmpty() || results.containsValue(Boolean.TRUE);

        if (anySuccess) {
            return new Outcome(Status.POSTED, results);
        }

        log.item("DELIVERY_FAILED", item);
        if (publishConfig.releaseOnDeliveryFailure()) {
            release(item, budget, log);
        }
        return new Outcome(Status.DELIVERY_FAILED, results);
    }

    private List<String> collectMedia(ScoredArticle item, DeadlineBudget budget, RunLog log) {
        Duration mediaBudget = budget.phaseBudget(budgetConfig.mediaTimeout(), budgetConfig.mediaReserve());
        if (mediaBudget.compareTo(budgetConfig.minMediaBudget()) <= 0) {
            return List.of();
        }
        List<String> images = await(() -> mediaCollector.collect(item.article(), mediaBudget),
                mediaBudget, "media collection", log);
        return images != null ? images : List.of();
    }

    private Map<String, Boolean> deliverAll(ScoredArticle item, List<String> images, String caption,
                                            DeadlineBudget budget, RunLog log) {
        Duration platformBudget = budget.phaseBudget(budgetConfig.platformTimeout(), budgetConfig.platformReserve());
        if (platformBudget.compareTo(budgetConfig.minPlatformBudget()) < 0) {
            platformBudget = budgetConfig.minPlatformBudget();
        }
        Instant deadline = clock.instant().plus(platformBudget);

        Map<String, Future<Boolean>> pending = new LinkedHashMap<>();
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (DeliveryPlatform platform : platforms) {
            if (!platform.isEnabled()) {
                continue;
            }
            try {
                pending.put(platform.name(), executor.submit(
                        () -> deliveryService.deliver(platform, images, caption, budget, log)));
            } catch (RejectedExecutionException e) {
                log.error("{}: delivery rejected by worker pool", platform.name());
                results.put(platform.name(), false);
            }
        }

        for (Map.Entry<String, Future<Boolean>> entry : pending.entrySet()) {
            String name = entry.getKey();
            Duration left = Duration.between(clock.instant(), deadline);
            boolean ok = awaitFuture(entry.getValue(), left.isNegative() ? Duration.ZERO : left, name, log);
            results.put(name, ok);
            log.item(ok ? "POSTED:" + name.toUpperCase() : "FAILED:" + name.toUpperCase(), item);
        }
        return results;
    }

    private void release(ScoredArticle item, DeadlineBudget budget, RunLog log) {
        Duration releaseBudget = budget.phaseBudget(budgetConfig.dbTimeout(), Duration.ZERO);
        if (releaseBudget.compareTo(budgetConfig.minSaveBudget()) < 0) {
            log.warn("No time to release history record {}", item.fingerprint());
            return;
        }
        Boolean released = await(() -> historyStore.release(item.fingerprint()), releaseBudget,
                "history release", log);
        if (Boolean.TRUE.equals(released)) {
            log.info("Released history record for undelivered [{}] {}", item.source(), RunLog.preview(item.title()));
        }
    }

    private PublishRecord toRecord(ScoredArticle item) {
        Instant now = clock.instant();
        Instant published = item.article().publishedAt() != null ? item.article().publishedAt() : now;
        return new PublishRecord(
                item.link(),
                item.title(),
                item.fingerprint(),
                item.source(),
                item.article().feedUrl(),
                published.toString(),
                now.toString()
        );
    }

    /**
     * Runs {@code task} on the worker pool and waits at most {@code timeout}.
     *
     * @return the result, or null on timeout, failure or rejection
     */
    private <T> T await(Callable<T> task, Duration timeout, String what, RunLog log) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            log.error("{} rejected by worker pool", what);
            return null;
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}ms", what, timeout.toMillis());
        } catch (ExecutionException e) {
            log.error("{} failed: {}", what, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
        }
        return null;
    }

    private boolean awaitFuture(Future<Boolean> future, Duration timeout, String platform, RunLog log) {
        try {
            return Boolean.TRUE.equals(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} post timed out", platform);
        } catch (ExecutionException e) {
            log.error("{} post error: {}", platform, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
        }
        return false;
    }
}

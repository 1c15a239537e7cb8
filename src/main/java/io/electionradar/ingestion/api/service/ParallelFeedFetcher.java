package io.electionradar.ingestion.api.service;

import io.electionradar.ingestion.api.dto.Article;
import io.electionradar.ingestion.api.dto.FeedResult;
import io.electionradar.ingestion.api.dto.FetchOutcome;
import io.electionradar.ingestion.config.FeedSource;
import io.electionradar.ingestion.pipeline.DeadlineBudget;
import io.electionradar.ingestion.pipeline.RunLog;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fetches every source at once on the pipeline pool. Sources are isolated from each other and
 * the whole phase is bounded: sources still running at the deadline are abandoned and the
 * finished ones are kept.
 */
@Service
public class ParallelFeedFetcher {

    private final FeedFetchService feedFetchService;
    private final ExecutorService executor;

    public ParallelFeedFetcher(FeedFetchService feedFetchService,
                               @Qualifier("pipelineExecutor") ExecutorService executor) {
        this.feedFetchService = feedFetchService;
        this.executor = executor;
    }

    public FetchOutcome fetchAll(List<FeedSource> sources, Duration phaseBudget, DeadlineBudget budget, RunLog log) {
        if (sources.isEmpty()) {
            return FetchOutcome.none();
        }

        List<Callable<FeedResult>> tasks = new ArrayList<>(sources.size());
        for (FeedSource source : sources) {
            tasks.add(() -> feedFetchService.fetch(source, budget, log));
        }

        List<Future<FeedResult>> futures;
        try {
            futures = executor.invokeAll(tasks, phaseBudget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Feed fetch interrupted");
            return new FetchOutcome(List.of(), 0, sources.size(), 0, sources.size());
        } catch (RejectedExecutionException e) {
            log.error("Feed fetch rejected by worker pool: {}", e.getMessage());
            return new FetchOutcome(List.of(), 0, sources.size(), 0, 0);
        }

        List<Article> articles = new ArrayList<>();
        int ok = 0;
        int failed = 0;
        int retried = 0;
        int abandoned = 0;

        for (int i = 0; i < futures.size(); i++) {
            String name = sources.get(i).getSimpleName();
            Future<FeedResult> future = futures.get(i);
            try {
                FeedResult result = future.get();
                retried += result.retries();
                if (result.isHealthy()) {
                    ok++;
                    articles.addAll(result.articles());
                } else {
                    failed++;
                }
            } catch (CancellationException e) {
                abandoned++;
                failed++;
                log.warn("{}: abandoned at fetch deadline", name);
            } catch (ExecutionException e) {
                failed++;
                log.error("{}: {}", name, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed++;
                break;
            }
        }

        if (abandoned > 0) {
            log.warn("Feed fetch timed out: {} of {} sources abandoned, using partial results",
                    abandoned, sources.size());
        }
        return new FetchOutcome(List.copyOf(articles), ok, failed, retried, abandoned);
    }
}

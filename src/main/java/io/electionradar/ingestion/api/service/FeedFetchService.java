package io.electionradar.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.electionradar.ingestion.api.dto.Article;
import io.electionradar.ingestion.api.dto.FeedResult;
import io.electionradar.ingestion.api.exception.ErrorCategory;
import io.electionradar.ingestion.api.exception.FeedFetchException;
import io.electionradar.ingestion.api.util.TextCleaner;
import io.electionradar.ingestion.config.FeedSource;
import io.electionradar.ingestion.config.HttpConfig;
import io.electionradar.ingestion.config.IngestionConfig;
import io.electionradar.ingestion.pipeline.DeadlineBudget;
import io.electionradar.ingestion.pipeline.RunLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;

@Service
public class FeedFetchService {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetchService.class);

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final IngestionConfig config;
    private final Sleeper sleeper;

    public FeedFetchService(IngestionConfig config, Sleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
    }

    /**
     * Fetches one source with retry. Never throws: every failure becomes a {@link FeedResult}.
     *
     * @param budget run budget; no further attempt starts once the fetch phase reserve is reached
     */
    public FeedResult fetch(FeedSource source, DeadlineBudget budget, RunLog log) {
        String name = source.getSimpleName();
        RetryTemplate retryTemplate = retryTemplate(budget);

        RetryCallback<FeedResult, FeedFetchException> attempt = context -> {
            List<Article> articles = timedAttempt(source, log);
            int retries = context.getRetryCount();
            log.info("[FEED] {}: {} entries{}", name, articles.size(),
                    retries > 0 ? " after " + retries + " retries" : "");
            return FeedResult.ok(name, articles, retries);
        };

        try {
            return retryTemplate.execute(attempt, context -> recover(source, context, log));
        } catch (FeedFetchException e) {
            // only reachable if the recovery callback itself rethrows
            log.error("{}: {}", name, e.getMessage());
            return FeedResult.failed(name, 0, e.getCategory());
        }
    }

    private FeedResult recover(FeedSource source, RetryContext context, RunLog log) {
        String name = source.getSimpleName();
        int retries = Math.max(0, context.getRetryCount() - 1);
        Throwable last = context.getLastThrowable();
        ErrorCategory category = last instanceof FeedFetchException e ? e.getCategory() : ErrorCategory.UNKNOWN;

        if (category.isDefinitiveEmpty()) {
            log.warn("{}: {} ({}), treating as empty", name, category, last.getMessage());
            return FeedResult.empty(name, retries, category);
        }

        log.error("{}: failed after {} attempts: {} ({})",
                name, context.getRetryCount(), last != null ? last.getMessage() : "unknown", category);
        return FeedResult.failed(name, retries, category);
    }

    private List<Article> timedAttempt(FeedSource source, RunLog log) throws FeedFetchException {
        long started = System.nanoTime();
        try {
            return fetchOnce(source);
        } finally {
            log.metrics().recordFeedLatency(source.getSimpleName(),
                    Duration.ofNanos(System.nanoTime() - started).toMillis());
        }
    }

    RetryTemplate retryTemplate(DeadlineBudget budget) {
        HttpConfig http = config.http();

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(http.retryDelay());
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(http.maxRetryDelay());
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new FeedRetryPolicy(Math.max(1, http.maxRetries()), budget,
                config.budget().feedPhaseReserve()));
        template.setBackOffPolicy(backOff);
        return template;
    }

    /**
     * Retries transient categories only, and only while the fetch phase still has time.
     */
    static class FeedRetryPolicy extends SimpleRetryPolicy {

        private final DeadlineBudget budget;
        private final Duration reserve;

        FeedRetryPolicy(int maxAttempts, DeadlineBudget budget, Duration reserve) {
            super(maxAttempts, Map.of(FeedFetchException.class, true));
            this.budget = budget;
            this.reserve = reserve;
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            if (last instanceof FeedFetchException e && !e.getCategory().isTransient()) {
                return false;
            }
            if (last != null && !budget.hasAtLeast(reserve)) {
                return false;
            }
            return super.canRetry(context);
        }
    }

    List<Article> fetchOnce(FeedSource source) throws FeedFetchException {
        String url = source.url();
        HttpURLConnection connection = null;

        try {
            if (url == null || url.isBlank()) {
                throw new FeedFetchException("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            connection = (HttpURLConnection) new URL(url).openConnection();
            configureConnection(connection);
            connection.connect();

            validateHttpResponse(connection, url);

            return parseFeed(connection, source);

        } catch (FeedFetchException e) {
            throw e;

        } catch (MalformedURLException e) {
            throw new FeedFetchException("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new FeedFetchException("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new FeedFetchException("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new FeedFetchException("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new FeedFetchException("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } catch (RuntimeException e) {
            logger.debug("Unexpected failure fetching {}", url, e);
            throw new FeedFetchException("Unexpected error: " + url, e, ErrorCategory.UNKNOWN);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(config.http().connectTimeout());
        connection.setReadTimeout(config.http().readTimeout());

        connection.setRequestProperty("User-Agent", nextUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "fa-IR,fa;q=0.9,en;q=0.8");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();

        if (responseCode >= 200 && responseCode < 300) {
            String contentType = connection.getContentType();
            if (contentType != null && !isValidFeedContentType(contentType)) {
                logger.warn("Unexpected content type for {}: {}", url, contentType);
            }
            return;
        }

        switch (responseCode) {
            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new FeedFetchException("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new FeedFetchException("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new FeedFetchException("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new FeedFetchException("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new FeedFetchException("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new FeedFetchException("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                throw new FeedFetchException(
                        String.format("HTTP %d (%s): %s", responseCode, connection.getResponseMessage(), url),
                        ErrorCategory.HTTP_ERROR
                );
        }
    }

    private List<Article> parseFeed(HttpURLConnection connection, FeedSource source)
            throws IOException, FeedFetchException {
        InputStream inputStream = connection.getInputStream();
        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        String xmlContent;
        try (InputStream in = inputStream) {
            xmlContent = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xmlContent));
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedFetchException("Malformed feed: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }

        if (feed == null || feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.debug("Feed {} has no entries", source.url());
            return List.of();
        }

        List<Article> articles = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            Article article = convertToArticle(entry, source);
            if (article != null) {
                articles.add(article);
            }
        }
        return articles;
    }

    private Article convertToArticle(SyndEntry entry, FeedSource source) {
        String title = TextCleaner.clean(entry.getTitle());
        String link = TextCleaner.clean(entry.getLink());
        if (title.isEmpty() || link.isEmpty()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        String summary = TextCleaner.truncate(
                TextCleaner.stripHtml(rawSummary(entry)), config.publish().maxDescChars());

        return new Article(title, link, summary, publishedAt(entry),
                source.getSimpleName(), source.url(), entry);
    }

    public static String rawSummary(SyndEntry entry) {
        SyndContent description = entry.getDescription();
        if (description != null && description.getValue() != null && !description.getValue().isBlank()) {
            return description.getValue();
        }
        if (entry.getContents() != null && !entry.getContents().isEmpty()) {
            String value = entry.getContents().get(0).getValue();
            return value != null ? value : "";
        }
        return "";
    }

    static Instant publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private String nextUserAgent() {
        List<String> userAgents = config.http().userAgentsOrDefault();
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }

    private boolean isValidFeedContentType(String contentType) {
        String lower = contentType.toLowerCase();
        return lower.contains("xml") || lower.contains("rss") || lower.contains("atom") || lower.contains("text");
    }
}

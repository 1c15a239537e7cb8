package io.electionradar.ingestion.pipeline;

import io.electionradar.ingestion.api.dto.ScoredArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.List;

/**
 * Per-run logging handle. Passed explicitly to every component taking part in a run; writes
 * to SLF4J and mirrors into the caller's {@link ExecutionContext} when there is one.
 */
public class RunLog {

    private static final Logger logger = LoggerFactory.getLogger("io.electionradar.ingestion.run");

    private static final int TITLE_PREVIEW = 55;

    private final ExecutionContext context;
    private final RunMetrics metrics = new RunMetrics();

    public RunLog(ExecutionContext context) {
        this.context = context;
    }

    public static RunLog detached() {
        return new RunLog(null);
    }

    public RunMetrics metrics() {
        return metrics;
    }

    public void info(String format, Object... args) {
        logger.info(format, args);
        mirror("[INFO] ", format, args, false);
    }

    public void warn(String format, Object... args) {
        logger.warn(format, args);
        mirror("[WARN] ", format, args, false);
    }

    public void error(String format, Object... args) {
        logger.error(format, args);
        mirror("[ERROR] ", format, args, true);
    }

    public void debug(String format, Object... args) {
        logger.debug(format, args);
    }

    /**
     * One line per article decision: {@code [ACTION] s=7 t=HIGH [Source] title c=.. tp=..}.
     */
    public void item(String action, ScoredArticle article) {
        StringBuilder line = new StringBuilder()
                .append('[').append(action).append("] ")
                .append("s=").append(article.score()).append(' ')
                .append("t=").append(article.tier()).append(' ')
                .append('[').append(article.source()).append("] ")
                .append(preview(article.title()));
        appendFirstTwo(line, " c=", article.entities());
        appendFirstTwo(line, " tp=", article.topics());
        info("{}", line);
    }

    public static String preview(String title) {
        if (title == null) return "";
        return title.length() > TITLE_PREVIEW ? title.substring(0, TITLE_PREVIEW) : title;
    }

    private static void appendFirstTwo(StringBuilder line, String label, List<String> values) {
        if (values == null || values.isEmpty()) return;
        line.append(label).append(String.join(",", values.subList(0, Math.min(2, values.size()))));
    }

    private void mirror(String level, String format, Object[] args, boolean isError) {
        if (context == null) return;
        String message = level + MessageFormatter.arrayFormat(format, args).getMessage();
        if (isError) {
            context.error(message);
        } else {
            context.log(message);
        }
    }
}

package io.electionradar.ingestion.platform;

import io.electionradar.ingestion.api.dto.ScoredArticle;
import io.electionradar.ingestion.config.HashtagRule;
import io.electionradar.ingestion.config.PublishConfig;
import io.electionradar.ingestion.config.ScoringConfig;
import io.electionradar.ingestion.config.TopicGroup;
import io.electionradar.ingestion.text.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.electionradar.ingestion.api.util.TextCleaner.escapeHtml;

/**
 * Renders the HTML caption shared by every platform.
 */
public class CaptionFormatter {

    public static final String DEFAULT_HASHTAG = "#انتخابات";

    static final int MAX_HASHTAGS = 6;
    private static final int MAX_KEYWORD_HASHTAGS = 5;
    private static final int MAX_CANDIDATE_HASHTAGS = 2;

    private final TextNormalizer normalizer;
    private final Map<String, String> topicHashtags = new LinkedHashMap<>();
    private final List<HashtagRule> hashtagRules;
    private final PublishConfig publish;

    public CaptionFormatter(TextNormalizer normalizer, ScoringConfig scoring, PublishConfig publish) {
        this.normalizer = normalizer;
        this.publish = publish;
        if (scoring.topics() != null) {
            for (TopicGroup topic : scoring.topics()) {
                if (topic.hashtag() != null && !topic.hashtag().isBlank()) {
                    topicHashtags.put(topic.name(), topic.hashtag());
                }
            }
        }
        this.hashtagRules = scoring.hashtags() != null ? List.copyOf(scoring.hashtags()) : List.of();
    }

    public String format(ScoredArticle item) {
        String title = escapeHtml(item.title().strip());
        String description = escapeHtml(nullToEmpty(item.article().summary()).strip());
        String hashtagLine = hashtagLine(hashtags(item), item.entities());
        String sourceLine = item.source() != null && !item.source().isBlank()
                ? "📰 " + escapeHtml(item.source()) + "\n"
                : "";

        String caption = render(title, hashtagLine, description, sourceLine);
        if (caption.length() > publish.captionMax()) {
            int overflow = caption.length() - publish.captionMax();
            String shortened = description.substring(0, Math.max(0, description.length() - overflow - 5)) + "…";
            caption = render(title, hashtagLine, shortened, sourceLine);
        }
        return caption;
    }

    /**
     * Topic hashtags first, then keyword hashtags found in the text; {@value #DEFAULT_HASHTAG} always leads.
     */
    public List<String> hashtags(ScoredArticle item) {
        String text = normalizer.normalize(item.title() + " " + nullToEmpty(item.article().summary()));
        Set<String> tags = new LinkedHashSet<>();

        for (String topic : item.topics()) {
            String hashtag = topicHashtags.get(topic);
            if (hashtag != null) {
                tags.add(hashtag);
            }
        }

        for (HashtagRule rule : hashtagRules) {
            if (tags.size() >= MAX_KEYWORD_HASHTAGS) break;
            String keyword = normalizer.normalize(rule.keyword());
            if (!keyword.isEmpty() && text.contains(keyword)) {
                tags.add(rule.hashtag());
            }
        }

        tags.remove(DEFAULT_HASHTAG);
        List<String> ordered = new ArrayList<>();
        ordered.add(DEFAULT_HASHTAG);
        ordered.addAll(tags);
        return ordered.size() > MAX_HASHTAGS ? List.copyOf(ordered.subList(0, MAX_HASHTAGS)) : ordered;
    }

    private static String hashtagLine(List<String> hashtags, List<String> entities) {
        StringBuilder line = new StringBuilder(hashtags.isEmpty() ? DEFAULT_HASHTAG : String.join(" ", hashtags));
        for (String entity : entities.subList(0, Math.min(MAX_CANDIDATE_HASHTAGS, entities.size()))) {
            String tag = "#" + escapeHtml(entity.replace(' ', '_'));
            if (line.indexOf(tag) < 0) {
                line.append(' ').append(tag);
            }
        }
        return line.toString();
    }

    private String render(String title, String hashtagLine, String description, String sourceLine) {
        StringBuilder caption = new StringBuilder()
                .append("💠 <b>").append(title).append("</b>\n\n")
                .append(hashtagLine).append("\n\n");
        if (publish.channelHandle() != null && !publish.channelHandle().isBlank()) {
            caption.append(publish.channelHandle()).append("\n\n");
        }
        caption.append(description).append("\n\n")
                .append(sourceLine);
        if (publish.channelSignature() != null) {
            caption.append(publish.channelSignature().strip());
        }
        return caption.toString().strip();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

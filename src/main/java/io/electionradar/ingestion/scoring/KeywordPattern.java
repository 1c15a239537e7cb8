package io.electionradar.ingestion.scoring;

import io.electionradar.ingestion.text.TextNormalizer;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A keyword compiled to a whole-token match over normalized text: "انتخابات" matches
 * "نتایج انتخابات" but not "انتخاباتی".
 *
 * @param keyword the keyword as configured, used as the display name of matches
 */
public record KeywordPattern(String keyword, Pattern pattern) {

    public static Optional<KeywordPattern> compile(String keyword, TextNormalizer normalizer) {
        String normalized = normalizer.normalize(keyword);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Pattern pattern = Pattern.compile("(?:^|\\s)" + Pattern.quote(normalized) + "(?:\\s|$)");
        return Optional.of(new KeywordPattern(keyword, pattern));
    }

    /**
     * @param normalizedText output of {@link TextNormalizer#normalize(String)}
     */
    public boolean matches(String normalizedText) {
        return !normalizedText.isEmpty() && pattern.matcher(normalizedText).find();
    }
}

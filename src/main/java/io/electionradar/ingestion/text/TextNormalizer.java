package io.electionradar.ingestion.text;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical form of Persian/Arabic/Latin news text. Everything that matches or compares
 * titles goes through here, so two spellings of the same word must end up identical.
 */
public class TextNormalizer {

    public static final Set<String> DEFAULT_STOPWORDS = Set.of(
            "و", "در", "به", "از", "که", "این", "را", "با", "های",
            "برای", "آن", "یک", "هم", "تا", "اما", "یا", "بود",
            "شد", "است", "می", "هر", "اگر", "بر", "ها", "نیز",
            "کرد", "خود", "هیچ", "پس", "باید", "نه", "ما", "شود",
            "the", "a", "an", "is", "are", "was", "of", "in",
            "to", "for", "and", "or", "but", "with", "on"
    );

    private static final Pattern DIACRITICS = Pattern.compile("[\\u064B-\\u065F\\u0670]");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200C\\u200D\\u200E\\u200F\\uFEFF]");
    private static final Pattern NON_WORD = Pattern.compile(
            "[^\\w\\s\\u0600-\\u06FF]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MIN_TOKEN_LENGTH = 2;

    private final Set<String> stopwords;

    public TextNormalizer() {
        this(DEFAULT_STOPWORDS);
    }

    public TextNormalizer(Set<String> stopwords) {
        this.stopwords = stopwords == null || stopwords.isEmpty()
                ? DEFAULT_STOPWORDS
                : stopwords.stream().map(this::normalize).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Letterform mapping, diacritic and zero-width removal, case folding, punctuation to
     * spaces, whitespace collapsed. Stopwords are kept so multi-word keywords still match.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String t = text
                .replace('ي', 'ی')
                .replace('ك', 'ک')
                .replace('ة', 'ه')
                .replace('ؤ', 'و')
                .replace('إ', 'ا')
                .replace('أ', 'ا')
                .replace('ئ', 'ی')
                .replace('ى', 'ی');

        t = DIACRITICS.matcher(t).replaceAll("");
        // removed outright, not spaced: "ثبت‌نام" and "ثبتنام" must collapse together
        t = ZERO_WIDTH.matcher(t).replaceAll("");
        t = t.toLowerCase(Locale.ROOT);
        t = NON_WORD.matcher(t).replaceAll(" ");
        return WHITESPACE.matcher(t).replaceAll(" ").trim();
    }

    /**
     * {@link #normalize(String)} plus stopword and short-token removal. Used for
     * fingerprints and fuzzy comparison, never for keyword search.
     */
    public String normalizeForMatching(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return "";
        }
        return Arrays.stream(normalized.split(" "))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                .filter(token -> !stopwords.contains(token))
                .collect(Collectors.joining(" "));
    }

    /**
     * Distinct tokens of {@link #normalizeForMatching(String)}, in first-seen order.
     */
    public Set<String> matchingTokens(String text) {
        String normalized = normalizeForMatching(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" "))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

package io.electionradar.ingestion.text;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void shouldMapArabicLetterformsToPersian() {
        assertThat(normalizer.normalize("علي كريمي")).isEqualTo("علی کریمی");
        assertThat(normalizer.normalize("مؤسسه")).isEqualTo("موسسه");
    }

    @Test
    void shouldRemoveZeroWidthCharactersWithoutSplittingWords() {
        assertThat(normalizer.normalize("ثبت‌نام")).isEqualTo("ثبتنام");
    }

    @Test
    void shouldStripDiacritics() {
        assertThat(normalizer.normalize("انتخاباتٌ")).isEqualTo("انتخابات");
    }

    @Test
    void shouldLowercaseAndTurnPunctuationIntoSpaces() {
        assertThat(normalizer.normalize("  Election,   RESULTS!  ")).isEqualTo("election results");
        assertThat(normalizer.normalize("«مناظره»! امشب")).isEqualTo("مناظره امشب");
    }

    @Test
    void shouldReturnEmptyStringForNullOrEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalizeForMatching("  ")).isEmpty();
    }

    @Test
    void shouldDropStopwordsAndSingleCharacterTokensForMatching() {
        assertThat(normalizer.normalizeForMatching("این انتخابات در تهران و x برگزار شد"))
                .isEqualTo("انتخابات تهران برگزار");
    }

    @Test
    void shouldReturnDistinctMatchingTokensInFirstSeenOrder() {
        assertThat(normalizer.matchingTokens("مجلس رای داد مجلس"))
                .containsExactly("مجلس", "رای", "داد");
    }

    @Test
    void shouldUseCustomStopwordsWhenConfigured() {
        TextNormalizer custom = new TextNormalizer(Set.of("خبر"));

        assertThat(custom.normalizeForMatching("خبر فوری در تهران")).isEqualTo("فوری در تهران");
    }
}

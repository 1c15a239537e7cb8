package io.electionradar.ingestion.api.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.regex.Pattern;

/**
 * Plain-text helpers for feed content before it is scored or rendered.
 */
public final class TextCleaner {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String ELLIPSIS = "…";

    private TextCleaner() {
    }

    public static String clean(String text) {
        return text == null ? "" : text.strip();
    }

    /**
     * Visible text of an HTML fragment with scripts, styles and frames removed.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        try {
            Document doc = Jsoup.parseBodyFragment(html);
            doc.select("script, style, iframe").remove();
            return WHITESPACE.matcher(doc.text()).replaceAll(" ").strip();
        } catch (RuntimeException e) {
            return WHITESPACE.matcher(TAG.matcher(html).replaceAll(" ")).replaceAll(" ").strip();
        }
    }

    /**
     * Cuts at {@code limit}, backing off to the last space when that loses less than a fifth.
     */
    public static String truncate(String text, int limit) {
        if (text == null) return "";
        if (text.length() <= limit) return text;

        String cut = text.substring(0, limit);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > limit * 0.8) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + ELLIPSIS;
    }

    public static String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}

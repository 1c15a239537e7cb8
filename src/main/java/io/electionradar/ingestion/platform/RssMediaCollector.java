package io.electionradar.ingestion.platform;

import com.rometools.modules.mediarss.MediaEntryModule;
import com.rometools.modules.mediarss.MediaModule;
import com.rometools.modules.mediarss.types.MediaContent;
import com.rometools.modules.mediarss.types.Metadata;
import com.rometools.modules.mediarss.types.Thumbnail;
import com.rometools.modules.mediarss.types.UrlReference;
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import io.electionradar.ingestion.api.dto.Article;
import io.electionradar.ingestion.api.service.FeedFetchService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Images from the feed entry itself (Media RSS, enclosures, {@code <img>} in the summary), falling
 * back to the article page's {@code og:image} when the entry has none.
 */
public class RssMediaCollector implements MediaCollector {

    private static final Logger logger = LoggerFactory.getLogger(RssMediaCollector.class);

    static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".webp");
    static final List<String> MEDIA_WORDS = List.of("image", "photo", "img", "media", "cdn", "upload");
    static final List<String> BLOCKLIST = List.of(
            "doubleclick", "googletagmanager", "analytics",
            "pixel", "beacon", "tracking", "stat.", "stats.");

    private static final List<String> IMG_ATTRIBUTES = List.of("src", "data-src", "data-lazy-src");
    private static final Duration PAGE_TIMEOUT = Duration.ofMillis(2500);

    private final int maxImages;
    private final String userAgent;
    private final boolean pageLookupEnabled;

    public RssMediaCollector(int maxImages, String userAgent) {
        this(maxImages, userAgent, true);
    }

    public RssMediaCollector(int maxImages, String userAgent, boolean pageLookupEnabled) {
        this.maxImages = maxImages;
        this.userAgent = userAgent;
        this.pageLookupEnabled = pageLookupEnabled;
    }

    @Override
    public List<String> collect(Article article, Duration budget) {
        Set<String> images = new LinkedHashSet<>();
        SyndEntry entry = article.entry();

        if (entry != null) {
            fromMediaModule(entry, images);
            fromEnclosures(entry, images);
            if (images.size() < maxImages) {
                fromHtml(FeedFetchService.rawSummary(entry), images);
            }
        }

        if (images.isEmpty() && pageLookupEnabled && budget.compareTo(Duration.ofMillis(500)) > 0) {
            String og = fetchPageImage(article.link(), budget);
            if (og != null) {
                images.add(og);
            }
        }

        List<String> result = new ArrayList<>(images);
        return result.size() > maxImages ? List.copyOf(result.subList(0, maxImages)) : List.copyOf(result);
    }

    private void fromMediaModule(SyndEntry entry, Set<String> images) {
        Module module = entry.getModule(MediaModule.URI);
        if (!(module instanceof MediaEntryModule media)) {
            return;
        }

        MediaContent[] contents = media.getMediaContents();
        if (contents != null) {
            for (MediaContent content : contents) {
                if (content.getReference() instanceof UrlReference ref && ref.getUrl() != null) {
                    String url = ref.getUrl().toString();
                    if ("image".equals(content.getMedium()) || hasImageExtension(url)) {
                        add(url, images);
                    }
                }
            }
        }

        Metadata metadata = media.getMetadata();
        if (metadata != null && metadata.getThumbnail() != null) {
            for (Thumbnail thumbnail : metadata.getThumbnail()) {
                if (thumbnail.getUrl() != null) {
                    add(thumbnail.getUrl().toString(), images);
                }
            }
        }
    }

    private void fromEnclosures(SyndEntry entry, Set<String> images) {
        if (entry.getEnclosures() == null) {
            return;
        }
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType();
            if (type != null && type.startsWith("image/") && enclosure.getUrl() != null) {
                add(enclosure.getUrl(), images);
            }
        }
    }

    private void fromHtml(String html, Set<String> images) {
        if (html == null || html.isBlank()) {
            return;
        }
        for (Element img : Jsoup.parseBodyFragment(html).select("img")) {
            for (String attribute : IMG_ATTRIBUTES) {
                String src = img.attr(attribute);
                if (src.startsWith("http")) {
                    add(src, images);
                    break;
                }
            }
            if (images.size() >= maxImages) {
                break;
            }
        }
    }

    private String fetchPageImage(String link, Duration budget) {
        if (link == null || !link.startsWith("http")) {
            return null;
        }
        int timeoutMs = (int) Math.min(PAGE_TIMEOUT.toMillis(), budget.toMillis());
        try {
            Document doc = Jsoup.connect(link)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .get();
            for (String selector : List.of("meta[property=og:image]", "meta[name=og:image]",
                    "meta[property=twitter:image]", "meta[name=twitter:image]")) {
                Element meta = doc.selectFirst(selector);
                if (meta != null && meta.attr("content").strip().startsWith("http")) {
                    return meta.attr("content").strip();
                }
            }
        } catch (IOException e) {
            logger.debug("No page image for {}: {}", link, e.getMessage());
        }
        return null;
    }

    static boolean isAcceptable(String url) {
        if (url == null || !url.startsWith("http")) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String blocked : BLOCKLIST) {
            if (lower.contains(blocked)) {
                return false;
            }
        }
        if (hasImageExtension(lower)) {
            return true;
        }
        for (String word : MEDIA_WORDS) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasImageExtension(String url) {
        String base = url.toLowerCase(Locale.ROOT);
        int query = base.indexOf('?');
        if (query >= 0) {
            base = base.substring(0, query);
        }
        for (String extension : IMAGE_EXTENSIONS) {
            if (base.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static void add(String url, Set<String> images) {
        String trimmed = url.strip();
        if (isAcceptable(trimmed)) {
            images.add(trimmed);
        }
    }
}

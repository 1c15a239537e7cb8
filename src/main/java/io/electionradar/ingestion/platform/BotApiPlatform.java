package io.electionradar.ingestion.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.electionradar.ingestion.api.exception.PlatformDeliveryException;
import io.electionradar.ingestion.api.exception.PlatformRateLimitedException;
import io.electionradar.ingestion.config.PlatformConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Telegram-compatible Bot HTTP API ({@code <base><token>/<method>}). Telegram and Bale both speak it.
 */
public class BotApiPlatform implements DeliveryPlatform {

    private static final Logger logger = LoggerFactory.getLogger(BotApiPlatform.class);

    private static final String PARSE_MODE = "HTML";
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

    private final String name;
    private final PlatformConfig config;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public BotApiPlatform(String name, PlatformConfig config, RestClient.Builder restClientBuilder,
                          ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(Objects.toString(config.baseUrl(), "") + Objects.toString(config.token(), ""))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return config.isConfigured();
    }

    @Override
    public void sendAlbum(List<String> imageUrls, String caption) {
        List<Map<String, Object>> media = new ArrayList<>();
        for (int i = 0; i < imageUrls.size(); i++) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", "photo");
            item.put("media", imageUrls.get(i));
            if (i == 0 && caption != null && !caption.isEmpty()) {
                item.put("caption", caption);
                item.put("parse_mode", PARSE_MODE);
            }
            media.add(item);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", config.chatId());
        body.put("media", media);
        body.put("disable_notification", true);
        call("sendMediaGroup", body);
    }

    @Override
    public void sendPhoto(String imageUrl, String caption) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", config.chatId());
        body.put("photo", imageUrl);
        body.put("caption", caption);
        body.put("parse_mode", PARSE_MODE);
        body.put("disable_notification", true);
        call("sendPhoto", body);
    }

    @Override
    public void sendText(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", config.chatId());
        body.put("text", text);
        body.put("parse_mode", PARSE_MODE);
        body.put("disable_web_page_preview", true);
        body.put("disable_notification", true);
        call("sendMessage", body);
    }

    private void call(String method, Map<String, Object> body) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/{method}", method)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new PlatformRateLimitedException(name, retryAfter(e));

        } catch (RestClientResponseException e) {
            throw new PlatformDeliveryException(name,
                    method + " HTTP " + e.getStatusCode().value() + ": " + abbreviate(e.getResponseBodyAsString()), e);

        } catch (RestClientException e) {
            throw new PlatformDeliveryException(name, method + " failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response != null ? response.path("description").asText("unknown") : "empty response";
            throw new PlatformDeliveryException(name, method + " rejected: " + description);
        }
        logger.debug("{} {} ok", name, method);
    }

    /**
     * {@code parameters.retry_after} of the error body, else the Retry-After header.
     */
    private Duration retryAfter(RestClientResponseException e) {
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            long seconds = error.path("parameters").path("retry_after").asLong(0);
            if (seconds > 0) {
                return Duration.ofSeconds(seconds);
            }
        } catch (IOException parseFailure) {
            logger.debug("{}: unreadable 429 body: {}", name, parseFailure.getMessage());
        }

        HttpHeaders headers = e.getResponseHeaders();
        String header = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (header != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(header.trim()));
            } catch (NumberFormatException ignored) {
                logger.debug("{}: non-numeric Retry-After '{}'", name, header);
            }
        }
        return DEFAULT_RETRY_AFTER;
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 150 ? text.substring(0, 150) : text;
    }
}

package io.electionradar.ingestion.history;

import com.fasterxml.jackson.databind.JsonNode;
import io.electionradar.ingestion.api.exception.HistoryStoreException;
import io.electionradar.ingestion.config.HistoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * History kept as documents in an Appwrite collection. The document id is derived from the
 * content hash, so a second create of the same story answers 409.
 */
public class AppwriteHistoryStore implements HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(AppwriteHistoryStore.class);

    private static final int DOCUMENT_ID_MAX = 36;

    private final RestClient restClient;
    private final String documentsPath;

    public AppwriteHistoryStore(RestClient.Builder builder, HistoryConfig config) {
        this.restClient = builder
                .baseUrl(config.endpoint())
                .defaultHeader("X-Appwrite-Project", config.project())
                .defaultHeader("X-Appwrite-Key", config.key())
                .build();
        this.documentsPath = "/databases/" + config.databaseId()
                + "/collections/" + config.collectionId() + "/documents";
    }

    @Override
    public List<StoredRecord> loadRecent(int limit) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(uri -> uri.path(documentsPath)
                            .queryParam("limit", limit)
                            .queryParam("orderType", "DESC")
                            .build())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new HistoryStoreException("Appwrite history load failed: " + e.getMessage(), e);
        }

        if (body == null || !body.path("documents").isArray()) {
            return List.of();
        }

        List<StoredRecord> records = new ArrayList<>();
        for (JsonNode doc : body.path("documents")) {
            records.add(new StoredRecord(
                    doc.path("link").asText(""),
                    doc.path("title").asText(""),
                    doc.path("content_hash").asText(""),
                    doc.path("site").asText("")
            ));
        }
        return records;
    }

    @Override
    public boolean save(PublishRecord record) {
        Map<String, Object> data = Map.of(
                "link", truncate(record.link(), 700),
                "title", truncate(record.title(), 300),
                "content_hash", truncate(record.contentHash(), 128),
                "site", truncate(record.site(), 100),
                "feed_url", truncate(record.feedUrl(), 500),
                "published_at", record.publishedAt(),
                "created_at", record.createdAt()
        );

        try {
            restClient.post()
                    .uri(documentsPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("documentId", documentId(record.contentHash()), "data", data))
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (HttpClientErrorException.Conflict e) {
            logger.info("History 409 for {}, already published", record.contentHash());
            return false;
        } catch (RestClientResponseException e) {
            throw new HistoryStoreException("History save: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new HistoryStoreException("History save failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean release(String contentHash) {
        try {
            restClient.delete()
                    .uri(documentsPath + "/{id}", documentId(contentHash))
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return false;
            }
            logger.warn("History release: HTTP {}", e.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            logger.warn("History release failed: {}", e.getMessage());
            return false;
        }
    }

    static String documentId(String contentHash) {
        return contentHash.length() > DOCUMENT_ID_MAX ? contentHash.substring(0, DOCUMENT_ID_MAX) : contentHash;
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() > max ? value.substring(0, max) : value;
    }
}

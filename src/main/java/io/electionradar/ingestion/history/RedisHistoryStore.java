package io.electionradar.ingestion.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.electionradar.ingestion.api.exception.HistoryStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * History kept in Redis: one {@code SET NX} key per content hash is the create-by-key gate,
 * and a capped list holds the recent records for dedup loading.
 */
public class RedisHistoryStore implements HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisHistoryStore.class);

    static final String RECORD_PREFIX = "history:record:";
    static final String RECENT_KEY = "history:recent";
    static final Duration DEFAULT_TTL = Duration.ofDays(7);
    static final int MAX_RECENT = 2000;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisHistoryStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl != null ? ttl : DEFAULT_TTL;
    }

    @Override
    public List<StoredRecord> loadRecent(int limit) {
        List<String> raw;
        try {
            raw = redisTemplate.opsForList().range(RECENT_KEY, 0, limit - 1L);
        } catch (RuntimeException e) {
            throw new HistoryStoreException("Redis history load failed: " + e.getMessage(), e);
        }
        if (raw == null) {
            return List.of();
        }

        List<StoredRecord> records = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                records.add(objectMapper.readValue(json, PublishRecord.class).toStoredRecord());
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable history entry: {}", e.getOriginalMessage());
            }
        }
        return records;
    }

    @Override
    public boolean save(PublishRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new HistoryStoreException("Cannot serialize history record " + record.contentHash(), e);
        }

        Boolean created;
        try {
            created = redisTemplate.opsForValue().setIfAbsent(generateKey(record.contentHash()), json, ttl);
        } catch (RuntimeException e) {
            throw new HistoryStoreException("Redis history save failed: " + e.getMessage(), e);
        }
        if (!Boolean.TRUE.equals(created)) {
            logger.info("History key exists for {}, already published", record.contentHash());
            return false;
        }

        // the key is claimed; a failed list write only hides the record from the next dedup load
        try {
            redisTemplate.opsForList().leftPush(RECENT_KEY, json);
            redisTemplate.opsForList().trim(RECENT_KEY, 0, MAX_RECENT - 1L);
        } catch (RuntimeException e) {
            logger.warn("History key saved for {} but recent list update failed: {}",
                    record.contentHash(), e.getMessage());
        }
        return true;
    }

    @Override
    public boolean release(String contentHash) {
        String key = generateKey(contentHash);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return false;
            }
            redisTemplate.opsForList().remove(RECENT_KEY, 1, json);
            return Objects.equals(Boolean.TRUE, redisTemplate.delete(key));
        } catch (RuntimeException e) {
            logger.warn("History release failed for {}: {}", contentHash, e.getMessage());
            return false;
        }
    }

    private String generateKey(String contentHash) {
        return RECORD_PREFIX + contentHash;
    }
}

package io.electionradar.ingestion.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.electionradar.ingestion.api.exception.HistoryStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisHistoryStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private ListOperations<String, String> listOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new RedisHistoryStore(redisTemplate, objectMapper, Duration.ofDays(7));
    }

    private static PublishRecord record() {
        return new PublishRecord("https://isna.ir/news/1", "انتخابات", "hash-1", "ISNA",
                "https://isna.ir/rss", "2026-10-19T08:00:00Z", "2026-10-19T08:01:00Z");
    }

    @Test
    void shouldSetKeyIfAbsentWithTtlAndPushToRecentList() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(valueOps.setIfAbsent(eq("history:record:hash-1"), contains("\"content_hash\":\"hash-1\""),
                eq(Duration.ofDays(7)))).thenReturn(true);

        assertThat(store.save(record())).isTrue();

        verify(listOps).leftPush(eq("history:recent"), contains("\"link\":\"https://isna.ir/news/1\""));
        verify(listOps).trim("history:recent", 0, RedisHistoryStore.MAX_RECENT - 1L);
    }

    @Test
    void shouldReportExistingKeyAsConflict() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), eq(Duration.ofDays(7)))).thenReturn(false);

        assertThat(store.save(record())).isFalse();

        verify(redisTemplate, never()).opsForList();
    }

    @Test
    void shouldThrowWhenConnectionFailsOnSave() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.save(record()))
                .isInstanceOf(HistoryStoreException.class)
                .hasMessageContaining("down");
    }

    @Test
    void shouldKeepClaimedKeyWhenRecentListUpdateFails() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), eq(Duration.ofDays(7)))).thenReturn(true);
        when(listOps.leftPush(anyString(), anyString())).thenThrow(new RedisConnectionFailureException("list down"));

        assertThat(store.save(record())).isTrue();

        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    void shouldLoadRecentRecordsSkippingUnreadableEntries() throws Exception {
        String json = objectMapper.writeValueAsString(record());
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(listOps.range("history:recent", 0, 499)).thenReturn(List.of(json, "not json"));

        List<StoredRecord> records = store.loadRecent(500);

        assertThat(records).containsExactly(new StoredRecord("https://isna.ir/news/1", "انتخابات", "hash-1", "ISNA"));
    }

    @Test
    void shouldWrapLoadFailure() {
        when(redisTemplate.opsForList()).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.loadRecent(500)).isInstanceOf(HistoryStoreException.class);
    }

    @Test
    void shouldReleaseKeyAndRecentEntry() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(valueOps.get("history:record:hash-1")).thenReturn("{\"content_hash\":\"hash-1\"}");
        when(redisTemplate.delete("history:record:hash-1")).thenReturn(true);

        assertThat(store.release("hash-1")).isTrue();

        verify(listOps).remove("history:recent", 1, "{\"content_hash\":\"hash-1\"}");
    }
}

package com.example.kitcheneta.service.load;

import com.example.kitcheneta.service.props.KitchenLoadProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisLoadCounterStoreTest {

    private static final String KEY = "location_load:1";
    private static final String LOCK_KEY = "location_load:1:lock";
    private static final String TTL = "3600";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;
    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;

    private final DefaultRedisScript<Long> readScript = new DefaultRedisScript<>("return 1", Long.class);
    private final DefaultRedisScript<Long> incrementScript = new DefaultRedisScript<>("return 1", Long.class);
    private final DefaultRedisScript<Long> decrementScript = new DefaultRedisScript<>("return 1", Long.class);

    private RedisLoadCounterStore store;

    @BeforeEach
    void setUp() {
        KitchenLoadProperties properties = new KitchenLoadProperties();
        store = new RedisLoadCounterStore(redisTemplate, redissonClient,
                readScript, incrementScript, decrementScript, properties);
    }

    @Test
    void read_PassesTtlSoHitsAreRefreshed() {
        given(redisTemplate.execute(readScript, List.of(KEY), TTL)).willReturn(5L);

        assertThat(store.read(KEY)).isEqualTo(5L);
    }

    @Test
    void read_Miss_ReturnsNull() {
        given(redisTemplate.execute(readScript, List.of(KEY), TTL)).willReturn(null);

        assertThat(store.read(KEY)).isNull();
    }

    @Test
    @DisplayName("Redis 异常统一转换为 CounterStoreUnavailableException")
    void read_ConnectionFailure_Translated() {
        given(redisTemplate.execute(readScript, List.of(KEY), TTL))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.read(KEY))
                .isInstanceOf(CounterStoreUnavailableException.class)
                .hasMessageContaining(KEY);
    }

    @Test
    void write_SetsValueWithTtl() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);

        store.write(KEY, 4);

        verify(valueOperations).set(KEY, "4", Duration.ofSeconds(3600));
    }

    @Test
    void increment_ReturnsScriptResult() {
        given(redisTemplate.execute(incrementScript, List.of(KEY), TTL)).willReturn(3L);

        assertThat(store.increment(KEY)).isEqualTo(3);
    }

    @Test
    void decrement_ScriptSignalsClamp() {
        given(redisTemplate.execute(decrementScript, List.of(KEY), TTL)).willReturn(-1L);

        assertThat(store.decrement(KEY)).isEqualTo(DecrementResult.clampedToZero());
    }

    @Test
    void decrement_ReturnsNewCount() {
        given(redisTemplate.execute(decrementScript, List.of(KEY), TTL)).willReturn(0L);

        assertThat(store.decrement(KEY)).isEqualTo(DecrementResult.of(0));
    }

    @Test
    @DisplayName("重建锁不等待，租约为配置的秒数")
    void tryLock_DoesNotWaitAndUsesLease() throws Exception {
        given(redissonClient.getLock(LOCK_KEY)).willReturn(lock);
        given(lock.tryLock(0, 10_000, TimeUnit.MILLISECONDS)).willReturn(false);

        assertThat(store.tryLock(LOCK_KEY)).isFalse();
    }

    @Test
    void tryLock_Interrupted_ReturnsFalseAndKeepsFlag() throws Exception {
        given(redissonClient.getLock(LOCK_KEY)).willReturn(lock);
        given(lock.tryLock(0, 10_000, TimeUnit.MILLISECONDS)).willThrow(new InterruptedException());

        try {
            assertThat(store.tryLock(LOCK_KEY)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void unlock_OnlyWhenHeldByCurrentThread() {
        given(redissonClient.getLock(LOCK_KEY)).willReturn(lock);
        given(lock.isHeldByCurrentThread()).willReturn(false);

        store.unlock(LOCK_KEY);

        verify(lock, never()).unlock();
    }

    @Test
    void unlock_FailureIsSwallowed() {
        given(redissonClient.getLock(LOCK_KEY)).willReturn(lock);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        willThrow(new IllegalStateException("connection reset")).given(lock).unlock();

        store.unlock(LOCK_KEY);

        verify(lock).unlock();
    }

    @Test
    void delete_ConnectionFailure_Translated() {
        given(redisTemplate.delete(KEY)).willThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.delete(KEY)).isInstanceOf(CounterStoreUnavailableException.class);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    @DisplayName("统计时跳过锁 key，只读取计数 key")
    void snapshot_SkipsLockKeys(@Mock RedisConnection connection, @Mock Cursor<byte[]> cursor) {
        given(redisTemplate.execute(any(RedisCallback.class)))
                .willAnswer(invocation -> ((RedisCallback) invocation.getArgument(0)).doInRedis(connection));
        given(connection.scan(any(ScanOptions.class))).willReturn(cursor);
        given(cursor.hasNext()).willReturn(true, true, false);
        given(cursor.next()).willReturn(KEY.getBytes(StandardCharsets.UTF_8),
                LOCK_KEY.getBytes(StandardCharsets.UTF_8));
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.multiGet(List.of(KEY))).willReturn(List.of("3"));

        assertThat(store.snapshot()).containsExactly(Map.entry(KEY, 3L));
    }
}

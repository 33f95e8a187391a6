package com.example.kitcheneta.service.load;

import com.example.kitcheneta.service.props.KitchenLoadProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class LocalLoadCounterStoreTest {

    private static final String KEY = "location_load:1";
    private static final String LOCK_KEY = "location_load:1:lock";

    private final AtomicLong nanos = new AtomicLong();
    private LocalLoadCounterStore store;

    @BeforeEach
    void setUp() {
        KitchenLoadProperties properties = new KitchenLoadProperties();
        properties.setCacheTtlSeconds(3600);
        properties.setLockLeaseSeconds(10);
        store = new LocalLoadCounterStore(properties, nanos::get);
    }

    @Test
    void increment_MissingKeyStartsFromZero() {
        assertThat(store.increment(KEY)).isEqualTo(1);
        assertThat(store.increment(KEY)).isEqualTo(2);
        assertThat(store.read(KEY)).isEqualTo(2L);
    }

    @Test
    @DisplayName("减到负数时截断为 0 并标记 clamped")
    void decrement_BelowZero_ClampsAndReports() {
        store.write(KEY, 1);

        assertThat(store.decrement(KEY)).isEqualTo(DecrementResult.of(0));
        assertThat(store.decrement(KEY)).isEqualTo(DecrementResult.clampedToZero());
        assertThat(store.read(KEY)).isZero();
    }

    @Test
    @DisplayName("超过 TTL 未访问的计数过期")
    void read_AfterTtlWithoutAccess_Expires() {
        store.write(KEY, 7);

        advance(Duration.ofSeconds(3601));

        assertThat(store.read(KEY)).isNull();
    }

    @Test
    void read_HitRefreshesTtl() {
        store.write(KEY, 7);

        advance(Duration.ofSeconds(3000));
        assertThat(store.read(KEY)).isEqualTo(7L);
        advance(Duration.ofSeconds(3000));

        assertThat(store.read(KEY)).isEqualTo(7L);
    }

    @Test
    void tryLock_IsExclusiveUntilUnlocked() {
        assertThat(store.tryLock(LOCK_KEY)).isTrue();
        assertThat(store.tryLock(LOCK_KEY)).isFalse();

        store.unlock(LOCK_KEY);

        assertThat(store.tryLock(LOCK_KEY)).isTrue();
    }

    @Test
    @DisplayName("持锁者不释放时，租约到期后锁自动失效")
    void tryLock_LeaseExpiryReleasesLock() {
        assertThat(store.tryLock(LOCK_KEY)).isTrue();

        advance(Duration.ofSeconds(11));

        assertThat(store.tryLock(LOCK_KEY)).isTrue();
    }

    @Test
    void unlock_NotHeld_IsNoop() {
        store.unlock(LOCK_KEY);

        assertThat(store.tryLock(LOCK_KEY)).isTrue();
    }

    @Test
    void delete_RemovesEntry() {
        store.write(KEY, 3);

        store.delete(KEY);

        assertThat(store.read(KEY)).isNull();
    }

    @Test
    void snapshot_ListsOnlyCounterKeys() {
        store.write("location_load:1", 3);
        store.write("location_load:2", 4);
        store.write("unrelated", 9);
        store.tryLock(LOCK_KEY);

        assertThat(store.snapshot())
                .containsOnlyKeys("location_load:1", "location_load:2")
                .containsEntry("location_load:2", 4L);
    }

    @Test
    @DisplayName("并发 increment 不丢失更新")
    void increment_Concurrent_NoLostUpdates() throws Exception {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.increment(KEY);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.read(KEY)).isEqualTo((long) threads * perThread);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}

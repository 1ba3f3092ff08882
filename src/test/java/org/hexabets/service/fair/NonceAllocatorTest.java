package org.hexabets.service.fair;

import org.hexabets.model.Commitment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NonceAllocatorTest {

    private final CommitmentManager commitments = new CommitmentManager(RandomStreamTest.SECRET);
    private final NonceAllocator nonces = new NonceAllocator(commitments);

    @Test
    void next_isSequentialFromZero() {
        assertThat(nonces.next()).isZero();
        assertThat(nonces.next()).isEqualTo(1);
        assertThat(nonces.next()).isEqualTo(2);
    }

    @Test
    void reserve_returnsContiguousBlocks() {
        Commitment c = commitments.current();
        assertThat(nonces.reserve(c, 4)).isZero();
        assertThat(nonces.reserve(c, 64)).isEqualTo(4);
        assertThat(nonces.next()).isEqualTo(68);
    }

    @Test
    void reserve_rejectsEmptyBlock() {
        assertThatThrownBy(() -> nonces.reserve(commitments.current(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void claim_movesCounterPastSuppliedBlock() {
        Commitment c = commitments.current();
        assertThat(nonces.claim(c, 100, 4)).isTrue();
        assertThat(nonces.next()).isEqualTo(104);
    }

    @Test
    void claim_refusesNumbersBelowCounter() {
        Commitment c = commitments.current();
        nonces.reserve(c, 4);

        assertThat(nonces.claim(c, 2, 1)).isFalse();
        assertThat(nonces.claim(c, 0, 4)).isFalse();
        assertThat(nonces.next()).isEqualTo(4);
    }

    @Test
    void claim_sameBlockTwice_onlyFirstWins() {
        Commitment c = commitments.current();

        assertThat(nonces.claim(c, 7, 1)).isTrue();
        assertThat(nonces.claim(c, 7, 1)).isFalse();
    }

    @Test
    void next_concurrentCallersNeverShareANumber() throws Exception {
        int threads = 8;
        int perThread = 1000;
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) seen.add(nonces.next());
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(seen).hasSize(threads * perThread);
        assertThat(nonces.next()).isEqualTo((long) threads * perThread);
    }
}

package xyz.vvrf.reactor.exec.plan;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchCounterTest {

    @Test
    void totalArrivingLastCompletes() {
        BatchCounter counter = new BatchCounter();
        assertThat(counter.increment()).isFalse();
        assertThat(counter.increment()).isFalse();
        assertThat(counter.setTotal(2)).isTrue();
        assertThat(counter.isCompleted()).isTrue();
        assertThat(counter.cancel()).isFalse();
    }

    @Test
    void lastBatchArrivingAfterTotalCompletes() {
        BatchCounter counter = new BatchCounter();
        assertThat(counter.setTotal(2)).isFalse();
        assertThat(counter.increment()).isFalse();
        assertThat(counter.increment()).isTrue();
    }

    @Test
    void emptyInputCompletesOnTotal() {
        BatchCounter counter = new BatchCounter();
        assertThat(counter.setTotal(0)).isTrue();
    }

    @Test
    void cancelClaimsCompletion() {
        BatchCounter counter = new BatchCounter();
        counter.increment();
        assertThat(counter.cancel()).isTrue();
        assertThat(counter.setTotal(1)).isFalse();
        assertThat(counter.cancel()).isFalse();
    }

    @RepeatedTest(20)
    void exactlyOneCallerWinsUnderContention() throws InterruptedException {
        int batches = 64;
        BatchCounter counter = new BatchCounter();
        AtomicInteger winners = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < batches; i++) {
                executor.execute(() -> {
                    awaitQuietly(go);
                    if (counter.increment()) {
                        winners.incrementAndGet();
                    }
                });
            }
            executor.execute(() -> {
                awaitQuietly(go);
                if (counter.setTotal(batches)) {
                    winners.incrementAndGet();
                }
            });
            go.countDown();
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(winners.get()).isEqualTo(1);
        assertThat(counter.count()).isEqualTo(batches);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}

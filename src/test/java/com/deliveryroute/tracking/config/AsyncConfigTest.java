package com.deliveryroute.tracking.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class AsyncConfigTest {

    @Test
    @DisplayName("Recalculation pool queues a burst instead of running work on the submitting thread")
    void recalculationExecutor_neverRunsOnCaller() throws Exception {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().recalculationExecutor();
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(300);
        List<String> threads = new CopyOnWriteArrayList<>();
        String caller = Thread.currentThread().getName();
        try {
            for (int i = 0; i < 300; i++) {
                executor.execute(() -> {
                    threads.add(Thread.currentThread().getName());
                    try {
                        gate.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    done.countDown();
                });
            }
            gate.countDown();

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(threads).hasSize(300)
                    .doesNotContain(caller)
                    .allMatch(name -> name.startsWith("schedule-recalc-"));
        } finally {
            executor.shutdown();
        }
    }
}

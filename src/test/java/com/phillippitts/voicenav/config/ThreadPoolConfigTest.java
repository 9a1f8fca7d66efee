package com.phillippitts.voicenav.config;

import com.phillippitts.voicenav.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateSingleThreadedExecutorByDefault() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).utteranceExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("utterance-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRunTasksInSubmissionOrder() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).utteranceExecutor();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(10);
        try {
            for (int i = 0; i < 10; i++) {
                int n = i;
                executor.execute(() -> {
                    order.add(n);
                    latch.countDown();
                });
            }
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(order).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorker() {
        ThreadContext.put("requestId", "req-42");
        AtomicReference<String> seen = new AtomicReference<>();

        Runnable decorated = ThreadPoolConfig.mdcPropagating()
                .decorate(() -> seen.set(ThreadContext.get("requestId")));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker-own");
        decorated.run();

        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(ThreadContext.get("requestId")).isEqualTo("worker-own");
    }
}

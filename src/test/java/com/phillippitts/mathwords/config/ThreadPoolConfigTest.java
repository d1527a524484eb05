package com.phillippitts.mathwords.config;

import com.phillippitts.mathwords.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.verbalizerExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);

        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(8);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("verbalizer-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldApplyConfiguredPoolSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getVerbalizer().setCorePoolSize(2);
        properties.getVerbalizer().setMaxPoolSize(3);
        properties.getVerbalizer().setThreadNamePrefix("batch-");

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).verbalizerExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("batch-");
        executor.shutdown();
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).verbalizerExecutor();

        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completedTasks.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        assertThat(executor.getActiveCount()).isLessThanOrEqualTo(executor.getMaxPoolSize());
        executor.shutdown();
    }

    @Test
    void shouldUseThreadNamePrefixForWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).verbalizerExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("verbalizer-pool-");
        executor.shutdown();
    }

    @Test
    void shouldPropagateRequestIdToWorkerThreads() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).verbalizerExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("requestId", "req-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        executor.shutdown();
    }

    @Test
    void decoratorShouldRestoreCallerContextWhenRunInline() {
        ThreadContext.put("requestId", "outer");
        Runnable decorated = ThreadPoolConfig.threadContextDecorator().decorate(() -> ThreadContext.put("extra", "x"));

        ThreadContext.clearAll();
        ThreadContext.put("requestId", "caller");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("caller");
        assertThat(ThreadContext.get("extra")).isNull();
    }

    @Test
    void shouldShutdownGracefully() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).verbalizerExecutor();

        executor.execute(() -> { });
        executor.shutdown();

        assertThat(executor.getThreadPoolExecutor().isShutdown()).isTrue();
    }
}
